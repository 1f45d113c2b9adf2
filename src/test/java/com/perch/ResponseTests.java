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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResponseTests {
	@Test
	public void redirects() {
		Response response = Response.withRedirect(RedirectType.HTTP_307_TEMPORARY_REDIRECT, "/elsewhere");

		assertEquals(Integer.valueOf(307), response.getStatusCode().get());
		assertEquals(Set.of("/elsewhere"), response.getHeaders().get("location"));
	}

	@Test
	public void copierReplacesFields() {
		Response original = Response.withStatusCode(200)
				.headers(Map.of("X-One", Set.of("1")))
				.body("first")
				.build();

		Response copy = original.copy()
				.statusCode(202)
				.headers(headers -> headers.remove("X-One"))
				.body("second")
				.finish();

		assertEquals(Integer.valueOf(202), copy.getStatusCode().get());
		Assertions.assertTrue(copy.getHeaders().isEmpty());
		assertEquals("second", copy.getBody().get());
		assertEquals("first", original.getBody().get());
	}

	@Test
	public void illegalStatusCodesAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> Response.withStatusCode(99).build());
		assertThrows(IllegalArgumentException.class, () -> Response.withStatusCode(600).build());
	}

	@Test
	public void illegalHeadersAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> MarshaledResponse.withStatusCode(200)
				.headers(Map.of("X-Bad", Set.of("a\nb")))
				.build());
	}

	@Test
	public void marshaledResponsesAreCopiedOnChange() {
		MarshaledResponse original = MarshaledResponse.withStatusCode(200)
				.headers(Map.of("Content-Type", Set.of("text/plain")))
				.body(new byte[]{1})
				.build();

		MarshaledResponse changed = original.withStatus(201).withHeaders(Map.of("Content-Type", Set.of()));

		assertEquals(Integer.valueOf(200), original.getStatusCode());
		assertEquals(Integer.valueOf(201), changed.getStatusCode());
		Assertions.assertTrue(changed.getHeader("Content-Type").isEmpty());
		Assertions.assertArrayEquals(new byte[]{1}, changed.getBody().get());
	}
}
