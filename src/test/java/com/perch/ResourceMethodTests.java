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

import com.perch.annotation.DELETE;
import com.perch.annotation.GET;
import com.perch.annotation.PATCH;
import com.perch.annotation.PathParameter;
import com.perch.annotation.POST;
import com.perch.annotation.PUT;
import com.perch.annotation.QueryParameter;
import com.perch.annotation.RequestBody;
import com.perch.annotation.RequestHeader;
import com.perch.exception.ConfigurationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static java.lang.String.format;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResourceMethodTests {
	@Test
	public void pathParametersAreConvertedToDeclaredTypes() {
		Router router = Router.create().registerResource(new ConversionResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("int=7 boolean=true price=9.99",
					simulator.performRequest(HttpMethod.GET, "/convert/7/TRUE/9.99").getBodyAsString());

			UUID uuid = UUID.randomUUID();
			assertEquals(uuid.toString(), simulator.performRequest(HttpMethod.PUT, "/uuids/" + uuid).getBodyAsString());
		});
	}

	@Test
	public void objectParametersReceiveTheRouteConversion() {
		Router router = Router.create().registerResource(new ConversionResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("java.lang.Long 12", simulator.performRequest(HttpMethod.PATCH, "/natural/12").getBodyAsString());
		});
	}

	@Test
	public void illegalValuesAreBadRequests() {
		Router router = Router.create().registerResource(new ConversionResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/convert/7/maybe/1.0");

			assertEquals(Integer.valueOf(400), requestResult.getStatusCode());
			assertEquals("Illegal value 'maybe' for path parameter 'flag'", requestResult.getBodyAsString());
		});
	}

	@Test
	public void unsupportedPathParameterTypesFailRegistration() {
		Router router = Router.create();

		ConfigurationException exception = assertThrows(ConfigurationException.class, () -> router.registerResource(new MisconfiguredResource()));

		Assertions.assertTrue(exception.getMessage().contains(Instant.class.getName()));
		Assertions.assertTrue(router.getRoutes().isEmpty());
	}

	@Test
	public void parametersNamingNoPlaceholderFailRegistration() {
		ConfigurationException exception = assertThrows(ConfigurationException.class,
				() -> Router.create().registerResource(new UnmatchedParameterResource()));

		Assertions.assertTrue(exception.getMessage().contains("'userId'"));
		assertThrows(ConfigurationException.class, () -> Router.create().registerResource(new UnknownPlaceholderResource()));
	}

	@Test
	public void queryParametersAndHeadersAreBound() {
		Router router = Router.create().registerResource(new BindingResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("q=perch page=2 locale=none",
					simulator.performRequest(HttpMethod.GET, "/search?q=perch&page=2").getBodyAsString());
			assertEquals("q=a b page=1 locale=fr",
					performRequest(simulator, HttpMethod.GET, "/search?q=a+b&page=1", Map.of("Accept-Language", Set.of("fr")), null).getBodyAsString());

			RequestResult missing = simulator.performRequest(HttpMethod.GET, "/search?page=1");
			assertEquals(Integer.valueOf(400), missing.getStatusCode());
			assertEquals("Query parameter 'q' is required", missing.getBodyAsString());

			RequestResult illegal = simulator.performRequest(HttpMethod.GET, "/search?q=x&page=two");
			assertEquals(Integer.valueOf(400), illegal.getStatusCode());
			assertEquals("Illegal value 'two' for query parameter 'page'", illegal.getBodyAsString());
		});
	}

	@Test
	public void requestBodiesAreBoundWithGson() {
		Router router = Router.create().registerResource(new BindingResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult json = performRequest(simulator, HttpMethod.POST, "/widgets",
					Map.of("Content-Type", Set.of("application/json")), "{\"name\":\"gizmo\",\"quantity\":3}");
			assertEquals("gizmo x3", json.getBodyAsString());

			RequestResult form = performRequest(simulator, HttpMethod.POST, "/widgets",
					Map.of("Content-Type", Set.of("application/x-www-form-urlencoded")), "name=sprocket&quantity=5");
			assertEquals("sprocket x5", form.getBodyAsString());

			RequestResult malformed = performRequest(simulator, HttpMethod.POST, "/widgets",
					Map.of("Content-Type", Set.of("application/json")), "{\"name\":");
			assertEquals(Integer.valueOf(400), malformed.getStatusCode());

			RequestResult missing = simulator.performRequest(HttpMethod.POST, "/widgets");
			assertEquals(Integer.valueOf(400), missing.getStatusCode());
			assertEquals("A request body is required", missing.getBodyAsString());

			assertEquals("note=none", simulator.performRequest(HttpMethod.PUT, "/notes").getBodyAsString());
			assertEquals("note=hello", performRequest(simulator, HttpMethod.PUT, "/notes", Map.of(),
					"hello").getBodyAsString());
		});
	}

	@Test
	public void recordsAreBoundFromQueryOrBody() {
		Router router = Router.create().registerResource(new BindingResource());

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("Filter[color=red, limit=10]",
					simulator.performRequest(HttpMethod.GET, "/filters?color=red&limit=10").getBodyAsString());
			assertEquals("Filter[color=null, limit=0]",
					simulator.performRequest(HttpMethod.GET, "/filters").getBodyAsString());
			assertEquals("Filter[color=blue, limit=3]", performRequest(simulator, HttpMethod.POST, "/filters",
					Map.of("Content-Type", Set.of("application/x-www-form-urlencoded")), "color=blue&limit=3").getBodyAsString());
			assertEquals(Integer.valueOf(400), simulator.performRequest(HttpMethod.GET, "/filters?limit=many").getStatusCode());
		});
	}

	@Test
	public void providedInstancesAreInjectedByType() {
		Router router = Router.create().registerResource(new GreetingResource());
		Greeter greeter = name -> "Hi, " + name;

		Perch.runSimulator(PerchConfig.withRouter(router).provide(Greeter.class, () -> greeter).build(), simulator -> {
			assertEquals("Hi, Ada", simulator.performRequest(HttpMethod.GET, "/greetings/Ada").getBodyAsString());
		});
	}

	@Test
	public void missingProvidersFailConfiguration() {
		Router router = Router.create().registerResource(new GreetingResource());

		ConfigurationException exception = assertThrows(ConfigurationException.class, () -> PerchConfig.withRouter(router).build());

		Assertions.assertTrue(exception.getMessage().contains(Greeter.class.getName()));
	}

	@Test
	public void handlerExceptionsAreUnwrapped() throws Exception {
		ConversionResource resource = new ConversionResource();
		ResourceMethod resourceMethod = ResourceMethod.withMethod(resource, ConversionResource.class.getMethod("fail"),
				ResourceMethodParameterProvider.defaultInstance());

		IllegalStateException exception = assertThrows(IllegalStateException.class,
				() -> resourceMethod.handle(Request.withPath(HttpMethod.GET, "/fail").build()));

		assertEquals("resource failure", exception.getMessage());
	}

	@Test
	public void methodsMustBelongToTheResource() throws Exception {
		assertThrows(IllegalArgumentException.class, () -> ResourceMethod.withMethod(new Object(),
				ConversionResource.class.getMethod("fail"), ResourceMethodParameterProvider.defaultInstance()));
	}

	@Test
	public void resourcesWithoutAnnotatedMethodsAreRejected() {
		assertThrows(ConfigurationException.class, () -> Router.create().registerResource(new Object()));
	}

	@Test
	public void routeNamesComeFromAnnotations() {
		Router router = Router.create().registerResource(new ConversionResource());

		Assertions.assertTrue(router.getRoutes().stream()
				.anyMatch(route -> route.getName().orElse("").equals("conversion")));
	}

	@ThreadSafe
	public static class ConversionResource {
		@GET(value = "/convert/{count:integer}/{flag}/{price:float}", name = "conversion")
		public String convert(@PathParameter("count") int count,
													@PathParameter("flag") Boolean flag,
													@PathParameter("price") BigDecimal price) {
			return format("int=%d boolean=%s price=%s", count, flag, price);
		}

		@PUT("/uuids/{id}")
		public String uuid(@PathParameter("id") UUID id) {
			return id.toString();
		}

		@PATCH("/natural/{value:integer}")
		public String natural(@PathParameter("value") Object value) {
			return format("%s %s", value.getClass().getName(), value);
		}

		@GET("/fail")
		public String fail() {
			throw new IllegalStateException("resource failure");
		}
	}

	@NonNull
	private static RequestResult performRequest(@NonNull Simulator simulator,
																							@NonNull HttpMethod httpMethod,
																							@NonNull String rawUrl,
																							@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers,
																							@Nullable String body) {
		MockConnection.Builder builder = MockConnection.withRequest(httpMethod, rawUrl).headers(headers);

		if (body != null)
			builder.body(body);

		return simulator.performRequest(builder.build());
	}

	@FunctionalInterface
	public interface Greeter {
		String greet(String name);
	}

	public record Widget(String name, int quantity) {}

	public record Filter(String color, int limit) {}

	@ThreadSafe
	public static class BindingResource {
		@GET("/search")
		public String search(@QueryParameter(name = "q") String query,
												 @QueryParameter Integer page,
												 @RequestHeader(name = "Accept-Language") Optional<String> locale) {
			return format("q=%s page=%d locale=%s", query, page, locale.orElse("none"));
		}

		@POST("/widgets")
		public String createWidget(@RequestBody Widget widget) {
			return format("%s x%d", widget.name(), widget.quantity());
		}

		@PUT("/notes")
		public String note(@RequestBody(optional = true) String note) {
			return format("note=%s", note == null ? "none" : note);
		}

		@GET("/filters")
		public String filter(Filter filter) {
			return filter.toString();
		}

		@POST("/filters")
		public String submitFilter(Filter filter) {
			return filter.toString();
		}
	}

	@ThreadSafe
	public static class GreetingResource {
		@GET("/greetings/{name}")
		public String greet(String name,
												Greeter greeter) {
			return greeter.greet(name);
		}
	}

	@ThreadSafe
	public static class UnmatchedParameterResource {
		@GET("/users/{id}")
		public String user(String userId) {
			return userId;
		}
	}

	@ThreadSafe
	public static class UnknownPlaceholderResource {
		@GET("/accounts/{id}")
		public String account(@PathParameter("accountId") Long accountId) {
			return String.valueOf(accountId);
		}
	}

	@ThreadSafe
	public static class MisconfiguredResource {
		@DELETE("/instants/{instant}")
		public String instant(@PathParameter("instant") Instant instant) {
			return instant.toString();
		}
	}
}
