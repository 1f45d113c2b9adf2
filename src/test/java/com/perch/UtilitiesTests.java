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

import com.perch.exception.BadRequestException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UtilitiesTests {
	@Test
	public void normalizedPath() {
		assertEquals("/", Utilities.normalizePath(""));
		assertEquals("/", Utilities.normalizePath("/"));
		assertEquals("/a/b", Utilities.normalizePath("a//b/"));
		assertEquals("/a/b", Utilities.normalizePath("/a/b"));
	}

	@Test
	public void pathFromRawUrl() {
		assertEquals("/users/jørn", Utilities.extractPathFromRawUrl("/users/j%C3%B8rn?tab=posts#top"));
		assertEquals("/a+b", Utilities.extractPathFromRawUrl("/a+b"), "Plus must stay literal in paths");
		assertThrows(BadRequestException.class, () -> Utilities.extractPathFromRawUrl("/bad%2"));
		assertThrows(BadRequestException.class, () -> Utilities.extractPathFromRawUrl("/nul%00"));
		assertEquals("/files/a ", Utilities.extractPathFromRawUrl(" /files/a%20 "), "Encoded whitespace is part of the path");
		assertEquals("/ x", Utilities.normalizePath("// x/"));
	}

	@Test
	public void queryParametersFromRawQuery() {
		Map<String, Set<String>> queryParameters = Utilities.extractQueryParametersFromRawQuery("a=1&b=2&b=3&b=2&c=&=ignored&d=C+Sharp&e=%E2%9C%93");

		assertEquals(List.of("a", "b", "c", "d", "e"), List.copyOf(queryParameters.keySet()));
		assertEquals(List.of("2", "3"), List.copyOf(queryParameters.get("b")));
		assertEquals(Set.of(""), queryParameters.get("c"));
		assertEquals(Set.of("C Sharp"), queryParameters.get("d"));
		assertEquals(Set.of("✓"), queryParameters.get("e"));
		Assertions.assertTrue(Utilities.extractQueryParametersFromRawQuery(null).isEmpty());
	}

	@Test
	public void rawQueryFromRawUrl() {
		assertEquals("a=1", Utilities.extractRawQueryFromRawUrl("/x?a=1#frag"));
		Assertions.assertNull(Utilities.extractRawQueryFromRawUrl("/x"));
		Assertions.assertNull(Utilities.extractRawQueryFromRawUrl("/x?"));
	}

	@Test
	public void headersAreCaseInsensitiveAndMergeable() {
		Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(Map.of("Content-Type", Set.of("text/plain")));

		assertEquals(Set.of("text/plain"), headers.get("content-type"));

		Map<String, Set<String>> merged = Utilities.mergeHeaders(headers, Map.of("CONTENT-TYPE", Set.of("text/html"), "X-Extra", Set.of("1")));

		assertEquals(Set.of("text/html"), merged.get("Content-Type"));
		assertEquals(2, merged.size());
	}

	@Test
	public void headerValidation() {
		assertThrows(IllegalArgumentException.class, () -> Utilities.validateHeaderNameAndValue("X-Bad", "line\r\nbreak"));
		assertThrows(IllegalArgumentException.class, () -> Utilities.validateHeaderNameAndValue("Bad Name", "value"));
		Assertions.assertDoesNotThrow(() -> Utilities.validateHeaderNameAndValue("X-Good", "value"));
	}

	@Test
	public void aggressiveTrimming() {
		assertEquals("abc", Utilities.trimAggressively("  abc "));
		Assertions.assertNull(Utilities.trimAggressivelyToNull(" \t "));
		assertEquals("", Utilities.trimAggressivelyToEmpty(null));
	}

	@Test
	public void printableStrings() {
		assertEquals("a\\nb", Utilities.printableString("a\nb"));
	}
}
