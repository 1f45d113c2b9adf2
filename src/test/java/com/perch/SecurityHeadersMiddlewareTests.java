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
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SecurityHeadersMiddlewareTests {
	@Test
	public void htmlResponsesGetDefaultHeaders() {
		Perch.runSimulator(configWith(SecurityHeadersMiddleware.withDefaults().build()), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/page");

			assertEquals("<p>hi</p>", requestResult.getBodyAsString());
			assertEquals("DENY", requestResult.getHeader("X-Frame-Options").get());
			assertEquals("nosniff", requestResult.getHeader("X-Content-Type-Options").get());
			assertEquals("strict-origin-when-cross-origin", requestResult.getHeader("Referrer-Policy").get());
			Assertions.assertTrue(requestResult.getHeader("Content-Security-Policy").get().startsWith("default-src 'self'"));
			Assertions.assertTrue(requestResult.getHeader("Strict-Transport-Security").isEmpty());
		});
	}

	@Test
	public void nonHtmlResponsesAreUntouched() {
		Perch.runSimulator(configWith(SecurityHeadersMiddleware.withDefaults().build()), simulator -> {
			RequestResult json = simulator.performRequest(HttpMethod.GET, "/data");

			assertEquals("application/json; charset=utf-8", json.getHeader("Content-Type").get());
			Assertions.assertTrue(json.getHeader("X-Frame-Options").isEmpty());

			RequestResult events = simulator.performRequest(HttpMethod.GET, "/events");

			assertEquals("data: tick\n\n", events.getBodyAsString());
			Assertions.assertTrue(events.getHeader("X-Frame-Options").isEmpty());
			Assertions.assertTrue(events.getHeader("Content-Security-Policy").isEmpty());
		});
	}

	@Test
	public void headersAreConfigurable() {
		SecurityHeadersMiddleware securityHeadersMiddleware = SecurityHeadersMiddleware.withDefaults()
				.frameOptions("SAMEORIGIN")
				.contentSecurityPolicy(null)
				.strictTransportSecurity("max-age=31536000; includeSubDomains")
				.build();

		Perch.runSimulator(configWith(securityHeadersMiddleware), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/page");

			assertEquals("SAMEORIGIN", requestResult.getHeader("X-Frame-Options").get());
			assertEquals("max-age=31536000; includeSubDomains", requestResult.getHeader("Strict-Transport-Security").get());
			Assertions.assertTrue(requestResult.getHeader("Content-Security-Policy").isEmpty());
		});
	}

	private static PerchConfig configWith(SecurityHeadersMiddleware securityHeadersMiddleware) {
		Router router = Router.create();
		router.register("/page", request -> "<p>hi</p>", Set.of(HttpMethod.GET));
		router.register("/data", request -> Map.of("ok", true), Set.of(HttpMethod.GET));
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("tick")).build(), Set.of(HttpMethod.GET));

		return PerchConfig.withRouter(router)
				.middleware(List.of(securityHeadersMiddleware))
				.build();
	}
}
