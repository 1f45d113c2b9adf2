/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.perch;

import com.perch.exception.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RoutePathTests {
	@Test
	public void parsesLiteralAndTypedSegments() {
		RoutePath routePath = RoutePath.fromPattern("users/{userId:integer}/files/{file:rest-of-path}/");

		assertEquals("/users/{userId:integer}/files/{file:rest-of-path}", routePath.getPattern());
		assertEquals(List.of(
				PathSegment.withLiteral("users"),
				PathSegment.withParameter("userId", PathParameterType.INTEGER),
				PathSegment.withLiteral("files"),
				PathSegment.withParameter("file", PathParameterType.REST_OF_PATH)
		), routePath.getPathSegments());

		assertEquals(PathParameterType.INTEGER, routePath.getPathParameterType("userId").get());
		Assertions.assertTrue(routePath.getPathParameterType("missing").isEmpty());
	}

	@Test
	public void untypedPlaceholdersAreStrings() {
		RoutePath routePath = RoutePath.fromPattern("/tags/{tag}");
		assertEquals(PathParameterType.STRING, routePath.getPathParameterType("tag").get());
	}

	@Test
	public void angleBracketPlaceholdersAreRejectedWithSuggestion() {
		ConfigurationException exception = assertThrows(ConfigurationException.class,
				() -> RoutePath.fromPattern("/users/<int:id>/<name>"));

		Assertions.assertTrue(exception.getMessage().contains("/users/{id:integer}/{name}"), exception.getMessage());
	}

	@Test
	public void malformedPatternsAreRejected() {
		assertThrows(ConfigurationException.class, () -> RoutePath.fromPattern("/users/prefix{id}"));
		assertThrows(ConfigurationException.class, () -> RoutePath.fromPattern("/users/{id:uuid}"));
		assertThrows(ConfigurationException.class, () -> RoutePath.fromPattern("/users/{id}/{id}"));
		assertThrows(ConfigurationException.class, () -> RoutePath.fromPattern("/files/{rest:rest-of-path}/more"));
		assertThrows(ConfigurationException.class, () -> RoutePath.fromPattern("/users/{1id}"));
	}

	@Test
	public void pathParameterTypesConvertValues() {
		assertEquals(Long.valueOf(12), PathParameterType.INTEGER.convert("12").get());
		assertEquals(Long.valueOf(Long.MAX_VALUE), PathParameterType.INTEGER.convert("9223372036854775807").get());
		assertEquals(new BigInteger("9223372036854775808"), PathParameterType.INTEGER.convert("9223372036854775808").get());
		assertEquals(Double.valueOf(1.5), PathParameterType.FLOAT.convert("1.5").get());
		assertEquals("abc", PathParameterType.STRING.convert("abc").get());
	}
}
