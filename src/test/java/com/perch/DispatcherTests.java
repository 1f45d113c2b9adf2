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

import com.perch.annotation.GET;
import com.perch.annotation.PathParameter;
import com.perch.annotation.POST;
import com.perch.exception.HttpException;
import com.perch.exception.NotFoundException;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DispatcherTests {
	@Test
	public void requestHandlingBasics() {
		Router router = Router.create();
		router.register("/hello/{name}", request -> "Hello, " + request.getPathParameter("name").get(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/hello/J%C3%B8rn");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("Hello, Jørn", requestResult.getBodyAsString());
			assertEquals("text/html; charset=utf-8", requestResult.getHeader("Content-Type").get());
			assertEquals(String.valueOf("Hello, Jørn".getBytes(StandardCharsets.UTF_8).length), requestResult.getHeader("Content-Length").get());
		});
	}

	@Test
	public void encodedWhitespaceSurvivesIntoPathParameters() {
		Router router = Router.create();
		router.register("/files/{name}", request -> "[" + request.getPathParameter("name").get() + "]", Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("[a ]", simulator.performRequest(HttpMethod.GET, "/files/a%20").getBodyAsString());
			assertEquals("[ b]", simulator.performRequest(HttpMethod.GET, "/files/%20b").getBodyAsString());
		});
	}

	@Test
	public void unmatchedPathsAreNotFound() {
		Router router = Router.create();
		router.register("/exists", request -> "here", Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/missing");

			assertEquals(Integer.valueOf(404), requestResult.getStatusCode());
			assertEquals("text/plain; charset=utf-8", requestResult.getHeader("Content-Type").get());
			assertEquals("No route matches GET /missing", requestResult.getBodyAsString());
		});
	}

	@Test
	public void unmatchedMethodsAreNotAllowed() {
		Router router = Router.create();
		router.register("/widgets", request -> "widgets", Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.DELETE, "/widgets");

			assertEquals(Integer.valueOf(405), requestResult.getStatusCode());
			assertEquals("GET", requestResult.getHeader("Allow").get());
			assertEquals("Method Not Allowed", requestResult.getBodyAsString());
		});
	}

	@Test
	public void explicitStatusSignalsUseTheirDetail() {
		Router router = Router.create();
		router.register("/teapot", request -> {
			throw new HttpException(418, "Short and stout", Map.of("X-Reason", Set.of("teapot")));
		}, Set.of(HttpMethod.GET));
		router.register("/bare", request -> {
			throw new HttpException(409);
		}, Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult teapot = simulator.performRequest(HttpMethod.GET, "/teapot");
			assertEquals(Integer.valueOf(418), teapot.getStatusCode());
			assertEquals("Short and stout", teapot.getBodyAsString());
			assertEquals("teapot", teapot.getHeader("X-Reason").get());

			RequestResult bare = simulator.performRequest(HttpMethod.GET, "/bare");
			assertEquals(Integer.valueOf(409), bare.getStatusCode());
			assertEquals("Error 409", bare.getBodyAsString());
		});
	}

	@Test
	public void debugModePrefixesStatusOnErrorDetail() {
		Router router = Router.create();
		router.register("/gone", request -> {
			throw new HttpException(410, "Moved on");
		}, Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).debug(true).build(), simulator -> {
			assertEquals("410: Moved on", simulator.performRequest(HttpMethod.GET, "/gone").getBodyAsString());
		});
	}

	@Test
	public void unexpectedExceptionsHideDiagnosticsOutsideDebugMode() {
		Router router = Router.create();
		router.register("/boom", request -> {
			throw new IllegalStateException("secret detail");
		}, Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/boom");

			assertEquals(Integer.valueOf(500), requestResult.getStatusCode());
			assertEquals("Internal Server Error", requestResult.getBodyAsString());
		});

		LogEvent logEvent = lifecycleObserver.getLogEvents().get(0);
		assertEquals(LogEventType.REQUEST_PROCESSING_FAILED, logEvent.getLogEventType());
		assertEquals("500 GET /boom", logEvent.getMessage());
		Assertions.assertTrue(logEvent.getThrowable().get() instanceof IllegalStateException);
	}

	@Test
	public void unexpectedExceptionsExposeTraceInDebugMode() {
		Router router = Router.create();
		router.register("/boom", request -> {
			throw new IllegalStateException("secret detail");
		}, Set.of(HttpMethod.GET));

		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.debug(true)
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/boom");

			assertEquals(Integer.valueOf(500), requestResult.getStatusCode());
			Assertions.assertTrue(requestResult.getBodyAsString().contains("java.lang.IllegalStateException: secret detail"));
		});
	}

	@Test
	public void errorHandlersByStatusAndExceptionType() {
		Router router = Router.create();
		router.register("/missing-user", request -> {
			throw new NotFoundException("No such user");
		}, Set.of(HttpMethod.GET));
		router.register("/unsupported", request -> {
			throw new UnsupportedOperationException("nope");
		}, Set.of(HttpMethod.GET));

		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.errorHandler(404, (request, throwable) -> Map.of("error", ((HttpException) throwable).getDetail().orElse("missing")))
				.errorHandler(RuntimeException.class, (request, throwable) -> Response.withStatusCode(503).body("try later").build())
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			RequestResult notFound = simulator.performRequest(HttpMethod.GET, "/missing-user");
			assertEquals(Integer.valueOf(404), notFound.getStatusCode());
			assertEquals("{\"error\":\"No such user\"}", notFound.getBodyAsString());
			assertEquals("application/json; charset=utf-8", notFound.getHeader("Content-Type").get());

			RequestResult unsupported = simulator.performRequest(HttpMethod.GET, "/unsupported");
			assertEquals(Integer.valueOf(503), unsupported.getStatusCode());
			assertEquals("try later", unsupported.getBodyAsString());
		});
	}

	@Test
	public void internalErrorHandlerResultsDefaultTo500() {
		Router router = Router.create();
		router.register("/boom", request -> {
			throw new IllegalArgumentException("bad");
		}, Set.of(HttpMethod.GET));

		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.errorHandler(500, (request, throwable) -> "Something broke")
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/boom");

			assertEquals(Integer.valueOf(500), requestResult.getStatusCode());
			assertEquals("Something broke", requestResult.getBodyAsString());
		});
	}

	@Test
	public void failingErrorHandlerFallsBackToDefaultResponse() {
		Router router = Router.create();

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.errorHandler(404, (request, throwable) -> {
					throw new IllegalStateException("handler broke");
				})
				.lifecycleObserver(lifecycleObserver)
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/nothing");

			assertEquals(Integer.valueOf(404), requestResult.getStatusCode());
			assertEquals("No route matches GET /nothing", requestResult.getBodyAsString());
		});

		assertEquals(LogEventType.ERROR_HANDLER_FAILED, lifecycleObserver.getLogEvents().get(0).getLogEventType());
	}

	@Test
	public void bodylessStatusesOmitContentLength() {
		Router router = Router.create();
		router.register("/empty", request -> null, Set.of(HttpMethod.GET));
		router.register("/not-modified", request -> Response.withStatusCode(304).body("ignored").build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult empty = simulator.performRequest(HttpMethod.GET, "/empty");
			assertEquals(Integer.valueOf(204), empty.getStatusCode());
			Assertions.assertTrue(empty.getHeader("Content-Length").isEmpty());
			assertEquals(0, empty.getBody().length);

			RequestResult notModified = simulator.performRequest(HttpMethod.GET, "/not-modified");
			assertEquals(Integer.valueOf(304), notModified.getStatusCode());
			Assertions.assertTrue(notModified.getHeader("Content-Length").isEmpty());
			assertEquals(0, notModified.getBody().length);
		});
	}

	@Test
	public void headRequestsKeepContentLengthWithoutBody() {
		Router router = Router.create();
		router.register("/page", request -> "twelve bytes", Set.of(HttpMethod.GET, HttpMethod.HEAD));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.HEAD, "/page");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("12", requestResult.getHeader("Content-Length").get());
			assertEquals(0, requestResult.getBody().length);
		});
	}

	@Test
	public void streamingResponsesWriteEveryChunk() {
		Router router = Router.create();
		router.register("/stream", request -> StreamingResponse.withTextChunks(List.of("a", "b", "c").iterator()).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			MockConnection mockConnection = MockConnection.withRequest(HttpMethod.GET, "/stream").build();
			RequestResult requestResult = simulator.performRequest(mockConnection);

			assertEquals("abc", requestResult.getBodyAsString());
			Assertions.assertTrue(requestResult.getHeader("Content-Length").isEmpty());
			assertEquals(Integer.valueOf(1), mockConnection.getTerminatingBodyMessageCount());
		});
	}

	@Test
	public void streamingFailuresAppendRenderErrorMarker() {
		Iterator<String> failingChunks = new Iterator<>() {
			private int index;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public String next() {
				if (this.index++ == 0)
					return "<html>";

				throw new IllegalStateException("template exploded");
			}
		};

		Router router = Router.create();
		router.register("/page", request -> StreamingResponse.withTextChunks(failingChunks).build(), Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/page");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("<html><!-- perch: render error -->", requestResult.getBodyAsString());
		});

		assertEquals(LogEventType.STREAMING_RESPONSE_FAILED, lifecycleObserver.getLogEvents().get(0).getLogEventType());
	}

	@Test
	public void oversizedBodiesAreRejected() {
		Router router = Router.create();
		router.register("/upload", request -> request.getBodyAsString(), Set.of(HttpMethod.POST));

		Perch.runSimulator(PerchConfig.withRouter(router).maximumRequestSizeInBytes(4L).build(), simulator -> {
			RequestResult accepted = simulator.performRequest(MockConnection.withRequest(HttpMethod.POST, "/upload")
					.body("ab")
					.body("cd")
					.build());
			assertEquals("abcd", accepted.getBodyAsString());

			RequestResult rejected = simulator.performRequest(MockConnection.withRequest(HttpMethod.POST, "/upload")
					.body("abc")
					.body("de")
					.build());
			assertEquals(Integer.valueOf(413), rejected.getStatusCode());
		});
	}

	@Test
	public void undecodableRequestsAreRejected() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			RequestResult unknownMethod = simulator.performRequest(MockConnection.withRequest("BREW", "/").build());
			assertEquals(Integer.valueOf(501), unknownMethod.getStatusCode());
			assertEquals("Unsupported HTTP method BREW", unknownMethod.getBodyAsString());

			RequestResult badEncoding = simulator.performRequest(HttpMethod.GET, "/%zz");
			assertEquals(Integer.valueOf(400), badEncoding.getStatusCode());
		});
	}

	@Test
	public void unsupportedReturnTypesBecome500() {
		Router router = Router.create();
		router.register("/object", request -> new Object(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(new RecordingLifecycleObserver()).build(), simulator -> {
			assertEquals(Integer.valueOf(500), simulator.performRequest(HttpMethod.GET, "/object").getStatusCode());
		});
	}

	@Test
	public void lifecycleObserverSeesRequestStartAndFinish() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			simulator.performRequest(HttpMethod.GET, "/");
		});

		assertEquals(List.of("start GET /", "finish GET / 200"), lifecycleObserver.getEvents());
	}

	@Test
	public void failingLifecycleObserverDoesNotBreakRequests() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));

		LifecycleObserver lifecycleObserver = new LifecycleObserver() {
			@Override
			public void didStartRequestHandling(@NonNull Request request) {
				throw new IllegalStateException("observer broke");
			}

			@Override
			public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
				// Quiet
			}
		};

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/");
			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("root", requestResult.getBodyAsString());
		});
	}

	@Test
	public void resourceMethodsReceiveConvertedPathParameters() {
		Router router = Router.create().registerResource(new WidgetResource());

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(new RecordingLifecycleObserver()).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/widgets/42");
			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("{\"id\":43}", requestResult.getBodyAsString());

			RequestResult created = simulator.performRequest(MockConnection.withRequest(HttpMethod.POST, "/widgets")
					.body("gizmo")
					.build());
			assertEquals(Integer.valueOf(201), created.getStatusCode());
			assertEquals("created gizmo", created.getBodyAsString());
		});
	}

	@Test
	public void middlewareWrapsEveryRequest() {
		Router router = Router.create();
		router.register("/", request -> "root", Set.of(HttpMethod.GET));

		Middleware timing = (request, next) -> next.proceed(request).withHeader("X-Handled-By", "perch");
		Middleware rewriting = (request, next) -> next.proceed(request.copy().path("/").finish());

		Perch.runSimulator(PerchConfig.withRouter(router).middleware(List.of(timing, rewriting)).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/anything");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("perch", requestResult.getHeader("X-Handled-By").get());
		});
	}

	@Test
	public void middlewareSeesErrorsAsExceptions() {
		Router router = Router.create();

		Middleware recovering = (request, next) -> {
			try {
				return next.proceed(request);
			} catch (NotFoundException e) {
				return MarshaledResponse.withStatusCode(200).body("recovered".getBytes(StandardCharsets.UTF_8)).build();
			}
		};

		Perch.runSimulator(PerchConfig.withRouter(router).middleware(List.of(recovering)).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/nowhere");

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("recovered", requestResult.getBodyAsString());
		});
	}

	@Test
	public void requestContextIsAvailableToHandlers() {
		Router router = Router.create();
		router.register("/context", request -> RequestContext.get().getAttribute("user", String.class).orElse("anonymous"),
				Set.of(HttpMethod.GET));

		Middleware authenticating = (request, next) -> {
			RequestContext.get().setAttribute("user", request.getHeader("X-User").orElse(null));
			return next.proceed(request);
		};

		Perch.runSimulator(PerchConfig.withRouter(router).middleware(List.of(authenticating)).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(MockConnection.withRequest(HttpMethod.GET, "/context")
					.headers(Map.of("X-User", Set.of("ada")))
					.build());

			assertEquals("ada", requestResult.getBodyAsString());
			assertEquals("anonymous", simulator.performRequest(HttpMethod.GET, "/context").getBodyAsString());
		});

		Assertions.assertTrue(RequestContext.getCurrent().isEmpty());
	}

	@ThreadSafe
	public static class WidgetResource {
		@GET("/widgets/{id:integer}")
		public Map<String, Object> widget(@PathParameter("id") Long id) {
			return Map.of("id", id + 1);
		}

		@POST("/widgets")
		public Response createWidget(Request request) throws Exception {
			return Response.withStatusCode(201).body("created " + request.getBodyAsString()).build();
		}
	}
}
