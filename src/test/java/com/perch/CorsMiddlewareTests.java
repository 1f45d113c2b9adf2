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
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CorsMiddlewareTests {
	@Test
	public void requestsWithoutOriginPassThrough() {
		Perch.runSimulator(configWith(CorsConfig.withAllowedOrigins(Set.of("*")).build()), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/things");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			Assertions.assertTrue(requestResult.getHeader("Access-Control-Allow-Origin").isEmpty());
		});
	}

	@Test
	public void wildcardOriginWithoutCredentials() {
		Perch.runSimulator(configWith(CorsConfig.withAllowedOrigins(Set.of("*")).build()), simulator -> {
			RequestResult requestResult = simulator.performRequest(request(HttpMethod.GET, "https://app.example.com", null));

			assertEquals("things", requestResult.getBodyAsString());
			assertEquals("*", requestResult.getHeader("Access-Control-Allow-Origin").get());
			Assertions.assertTrue(requestResult.getHeader("Vary").isEmpty());
		});
	}

	@Test
	public void credentialsEchoTheOrigin() {
		CorsConfig corsConfig = CorsConfig.withAllowedOrigins(Set.of("*"))
				.allowCredentials(true)
				.exposedHeaders(List.of("X-Request-Id", "X-Trace"))
				.build();

		Perch.runSimulator(configWith(corsConfig), simulator -> {
			RequestResult requestResult = simulator.performRequest(request(HttpMethod.GET, "https://app.example.com", null));

			assertEquals("https://app.example.com", requestResult.getHeader("Access-Control-Allow-Origin").get());
			assertEquals("Origin", requestResult.getHeader("Vary").get());
			assertEquals("true", requestResult.getHeader("Access-Control-Allow-Credentials").get());
			assertEquals("X-Request-Id, X-Trace", requestResult.getHeader("Access-Control-Expose-Headers").get());
		});
	}

	@Test
	public void disallowedOriginsGetNoCorsHeaders() {
		Perch.runSimulator(configWith(CorsConfig.withAllowedOrigins(Set.of("https://good.example.com")).build()), simulator -> {
			RequestResult requestResult = simulator.performRequest(request(HttpMethod.GET, "https://evil.example.com", null));

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			Assertions.assertTrue(requestResult.getHeader("Access-Control-Allow-Origin").isEmpty());
		});
	}

	@Test
	public void preflightIsAnsweredWithoutReachingTheRoute() {
		CorsConfig corsConfig = CorsConfig.withAllowedOrigins(Set.of("https://good.example.com"))
				.allowedMethods(List.of("GET", "POST"))
				.allowedHeaders(List.of("Content-Type"))
				.maxAge(Duration.ofMinutes(5))
				.build();

		Perch.runSimulator(configWith(corsConfig), simulator -> {
			RequestResult requestResult = simulator.performRequest(request(HttpMethod.OPTIONS, "https://good.example.com", "POST"));

			assertEquals(Integer.valueOf(204), requestResult.getStatusCode());
			assertEquals("https://good.example.com", requestResult.getHeader("Access-Control-Allow-Origin").get());
			assertEquals("GET, POST", requestResult.getHeader("Access-Control-Allow-Methods").get());
			assertEquals("Content-Type", requestResult.getHeader("Access-Control-Allow-Headers").get());
			assertEquals("300", requestResult.getHeader("Access-Control-Max-Age").get());
			assertEquals(0, requestResult.getBody().length);
		});
	}

	@Test
	public void defaultConfigAllowsNothing() {
		CorsConfig corsConfig = CorsConfig.withDefaults();

		Assertions.assertFalse(corsConfig.isAllowedOrigin("https://app.example.com"));
		assertEquals(List.of("GET", "HEAD", "OPTIONS"), corsConfig.getAllowedMethods());
		assertEquals(Duration.ofSeconds(600), corsConfig.getMaxAge());
	}

	@Test
	public void negativeMaxAgeIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> CorsConfig.withAllowedOrigins(Set.of("*"))
				.maxAge(Duration.ofSeconds(-1))
				.build());
	}

	private static PerchConfig configWith(CorsConfig corsConfig) {
		Router router = Router.create();
		router.register("/things", request -> "things", Set.of(HttpMethod.GET));

		return PerchConfig.withRouter(router)
				.middleware(List.of(CorsMiddleware.withConfig(corsConfig)))
				.build();
	}

	private static MockConnection request(HttpMethod httpMethod,
																				String origin,
																				String requestedMethod) {
		Map<String, Set<String>> headers = requestedMethod == null
				? Map.of("Origin", Set.of(origin))
				: Map.of("Origin", Set.of(origin), "Access-Control-Request-Method", Set.of(requestedMethod));

		return MockConnection.withRequest(httpMethod, "/things").headers(headers).build();
	}
}
