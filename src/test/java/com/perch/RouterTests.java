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
import com.perch.exception.MethodNotAllowedException;
import com.perch.exception.NotFoundException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RouterTests {
	@Test
	public void literalSegmentsTakePrecedenceOverPlaceholders() {
		RouteHandler literalHandler = request -> "me";
		RouteHandler placeholderHandler = request -> "by id";

		Router router = Router.create();
		router.register("/users/{userId}", placeholderHandler, Set.of(HttpMethod.GET));
		router.register("/users/me", literalHandler, Set.of(HttpMethod.GET));
		router.compile();

		RouteMatch literalMatch = router.match(HttpMethod.GET, "/users/me");
		assertEquals(literalHandler, literalMatch.getRoute().getRouteHandler());
		assertEquals(Map.of(), literalMatch.getPathParameters());

		RouteMatch placeholderMatch = router.match(HttpMethod.GET, "/users/123");
		assertEquals(placeholderHandler, placeholderMatch.getRoute().getRouteHandler());
		assertEquals(Map.of("userId", "123"), placeholderMatch.getPathParameters());
	}

	@Test
	public void typedPlaceholdersOnlyMatchConformingSegments() {
		Router router = Router.create();
		router.register("/orders/{orderId:integer}", request -> "order", Set.of(HttpMethod.GET));
		router.compile();

		assertEquals("42", router.match(HttpMethod.GET, "/orders/42").getPathParameter("orderId").get());
		assertThrows(NotFoundException.class, () -> router.match(HttpMethod.GET, "/orders/abc"));
		assertThrows(NotFoundException.class, () -> router.match(HttpMethod.GET, "/orders/4.2"));
		assertEquals("12345678901234567890", router.match(HttpMethod.GET, "/orders/12345678901234567890").getPathParameter("orderId").get());
	}

	@Test
	public void integerPlaceholdersAreTriedBeforeStringPlaceholders() {
		RouteHandler integerHandler = request -> "integer";
		RouteHandler stringHandler = request -> "string";

		Router router = Router.create();
		router.register("/items/{name}", stringHandler, Set.of(HttpMethod.GET));
		router.register("/items/{itemId:integer}", integerHandler, Set.of(HttpMethod.GET));
		router.compile();

		assertEquals(integerHandler, router.match(HttpMethod.GET, "/items/7").getRoute().getRouteHandler());
		assertEquals(stringHandler, router.match(HttpMethod.GET, "/items/seven").getRoute().getRouteHandler());
	}

	@Test
	public void restOfPathCapturesRemainingSegments() {
		Router router = Router.create();
		router.register("/static/{file:rest-of-path}", request -> "file", Set.of(HttpMethod.GET));
		router.compile();

		RouteMatch routeMatch = router.match(HttpMethod.GET, "/static/css/site/main.css");
		assertEquals("css/site/main.css", routeMatch.getPathParameter("file").get());
		assertThrows(NotFoundException.class, () -> router.match(HttpMethod.GET, "/static"));
	}

	@Test
	public void unmatchedMethodYieldsMethodNotAllowed() {
		Router router = Router.create();
		router.register("/widgets", request -> "widgets", Set.of(HttpMethod.GET));
		router.register("/widgets", request -> "created", Set.of(HttpMethod.POST));
		router.compile();

		MethodNotAllowedException exception = assertThrows(MethodNotAllowedException.class,
				() -> router.match(HttpMethod.DELETE, "/widgets"));

		assertEquals(Integer.valueOf(405), exception.getStatusCode());
		assertEquals(EnumSet.of(HttpMethod.GET, HttpMethod.POST), exception.getAllowedHttpMethods());
		assertEquals(Set.of("GET, POST"), exception.getHeaders().get("Allow"));
	}

	@Test
	public void trailingAndDuplicateSlashesAreIgnored() {
		Router router = Router.create();
		router.register("/a/b", request -> "ab", Set.of(HttpMethod.GET));
		router.compile();

		router.match(HttpMethod.GET, "/a/b/");
		router.match(HttpMethod.GET, "//a//b");
		assertThrows(NotFoundException.class, () -> router.match(HttpMethod.GET, "/a"));
	}

	@Test
	public void registrationAfterCompilationFails() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));
		router.compile();

		Assertions.assertTrue(router.isCompiled());
		assertThrows(IllegalStateException.class, () -> router.register("/late", request -> "late", Set.of(HttpMethod.GET)));
	}

	@Test
	public void matchingBeforeCompilationFails() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));

		assertThrows(IllegalStateException.class, () -> router.match(HttpMethod.GET, "/"));
	}

	@Test
	public void conflictingRoutesAreRejectedAtCompilation() {
		Router router = Router.create();
		router.register("/users/{id}", request -> "one", Set.of(HttpMethod.GET));
		router.register("/users/{id}/", request -> "two", Set.of(HttpMethod.GET));

		assertThrows(ConfigurationException.class, router::compile);
	}

	@Test
	public void routeNamesAreRetained() {
		Router router = Router.create();
		Route route = router.register("/health", request -> "ok", Set.of(HttpMethod.GET), "health-check");

		assertEquals("health-check", route.getName().get());
		assertEquals(1, router.getRoutes().size());
	}
}
