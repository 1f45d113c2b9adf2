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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MiddlewareChainTests {
	@Test
	public void firstRegisteredMiddlewareIsOutermost() throws Exception {
		List<String> trace = new ArrayList<>();

		Middleware first = (request, next) -> {
			trace.add("first before");
			NegotiatedResponse negotiatedResponse = next.proceed(request);
			trace.add("first after");
			return negotiatedResponse;
		};

		Middleware second = (request, next) -> {
			trace.add("second before");
			NegotiatedResponse negotiatedResponse = next.proceed(request);
			trace.add("second after");
			return negotiatedResponse;
		};

		Next terminal = request -> {
			trace.add("handler");
			return MarshaledResponse.withStatusCode(200).build();
		};

		MiddlewareChain.withMiddleware(List.of(first, second))
				.compose(terminal)
				.proceed(Request.withPath(HttpMethod.GET, "/").build());

		assertEquals(List.of("first before", "second before", "handler", "second after", "first after"), trace);
	}

	@Test
	public void middlewareCanShortCircuit() throws Exception {
		List<String> trace = new ArrayList<>();

		Middleware gate = (request, next) -> MarshaledResponse.withStatusCode(401).build();
		Next terminal = request -> {
			trace.add("handler");
			return MarshaledResponse.withStatusCode(200).build();
		};

		NegotiatedResponse negotiatedResponse = MiddlewareChain.withMiddleware(List.of(gate))
				.compose(terminal)
				.proceed(Request.withPath(HttpMethod.GET, "/").build());

		assertEquals(Integer.valueOf(401), negotiatedResponse.getStatusCode());
		Assertions.assertTrue(trace.isEmpty());
	}

	@Test
	public void middlewareCanRewriteRequestAndResponse() throws Exception {
		Middleware rewriter = (request, next) -> next.proceed(request.copy().path("/rewritten").finish())
				.withHeader("X-Rewritten", "true");

		Next terminal = request -> MarshaledResponse.withStatusCode(200)
				.headers(Map.of("X-Path", Set.of(request.getPath())))
				.build();

		NegotiatedResponse negotiatedResponse = MiddlewareChain.withMiddleware(List.of(rewriter))
				.compose(terminal)
				.proceed(Request.withPath(HttpMethod.GET, "/original").build());

		assertEquals("/rewritten", negotiatedResponse.getHeader("X-Path").get());
		assertEquals("true", negotiatedResponse.getHeader("x-rewritten").get());
	}

	@Test
	public void emptyChainRunsTerminalDirectly() throws Exception {
		Next terminal = request -> MarshaledResponse.withStatusCode(202).build();

		NegotiatedResponse negotiatedResponse = MiddlewareChain.withMiddleware(null)
				.compose(terminal)
				.proceed(Request.withPath(HttpMethod.GET, "/").build());

		assertEquals(Integer.valueOf(202), negotiatedResponse.getStatusCode());
	}

	@Test
	public void nullFromMiddlewareIsRejected() {
		Middleware broken = (request, next) -> null;
		Next terminal = request -> MarshaledResponse.withStatusCode(200).build();

		assertThrows(IllegalStateException.class, () -> MiddlewareChain.withMiddleware(List.of(broken))
				.compose(terminal)
				.proceed(Request.withPath(HttpMethod.GET, "/").build()));
	}
}
