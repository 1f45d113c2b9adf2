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

import com.google.gson.Gson;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
@Timeout(value = 10, unit = TimeUnit.SECONDS)
public class ServerSentEventEngineTests {
	@Test
	public void finiteStreamSendsEveryEventAndCloses() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("one", "two", "three")).build(),
				Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.lifecycleObserver(lifecycleObserver)
				.serverSentEventHeartbeatInterval(Duration.ofSeconds(30))
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			MockConnection mockConnection = MockConnection.withRequest(HttpMethod.GET, "/events").build();
			RequestResult requestResult = simulator.performRequest(mockConnection);

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("text/event-stream; charset=UTF-8", requestResult.getHeader("Content-Type").get());
			assertEquals("no-cache", requestResult.getHeader("Cache-Control").get());
			assertEquals("no", requestResult.getHeader("X-Accel-Buffering").get());
			Assertions.assertTrue(requestResult.getHeader("Content-Length").isEmpty());
			assertEquals("data: one\n\ndata: two\n\ndata: three\n\n", requestResult.getBodyAsString());
			assertEquals(Integer.valueOf(1), mockConnection.getResponseStartCount());
			assertEquals(Integer.valueOf(1), mockConnection.getTerminatingBodyMessageCount());
		});

		assertEquals(List.of("start GET /events", "established", "terminated EXHAUSTED", "finish GET /events 200"),
				lifecycleObserver.getEvents());
	}

	@Test
	public void heartbeatsAreSentWhileSourceIsIdle() {
		Iterator<String> slowEvents = new Iterator<>() {
			private boolean sent;

			@Override
			public boolean hasNext() {
				return !this.sent;
			}

			@Override
			public String next() {
				try {
					Thread.sleep(400);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException(e);
				}

				this.sent = true;
				return "late";
			}
		};

		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(slowEvents)
				.heartbeatInterval(Duration.ofMillis(50))
				.build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			String body = simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString();

			Assertions.assertTrue(body.startsWith(":\n\n"), body);
			Assertions.assertTrue(body.endsWith("data: late\n\n"), body);
		});
	}

	@Test
	public void noHeartbeatsWhenEventsArriveQuickly() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("a", "b")).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).serverSentEventHeartbeatInterval(Duration.ofSeconds(5)).build(), simulator -> {
			Assertions.assertFalse(simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString().contains(":\n\n"));
		});
	}

	@Test
	public void clientDisconnectStopsTheStream() throws Exception {
		BlockingQueue<Object> source = new LinkedBlockingQueue<>();
		source.add("first");

		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(new BlockingIterator(source)).build(),
				Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			MockConnection mockConnection = MockConnection.withRequest(HttpMethod.GET, "/events").build();
			CompletableFuture<RequestResult> requestResultFuture = simulator.performRequestAsync(mockConnection);

			try {
				Assertions.assertTrue(mockConnection.awaitBody(body -> body.contains("data: first\n\n"), Duration.ofSeconds(5)));

				mockConnection.disconnect();

				RequestResult requestResult = requestResultFuture.get(5, TimeUnit.SECONDS);
				assertEquals("data: first\n\n", requestResult.getBodyAsString());
			} catch (Exception e) {
				throw new IllegalStateException(e);
			}
		});

		Assertions.assertTrue(lifecycleObserver.getEvents().contains("terminated CLIENT_DISCONNECTED"), lifecycleObserver.getEvents().toString());
	}

	@Test
	public void closeEventIsSentWhenSourceIsExhausted() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("only")).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).serverSentEventCloseEvent("done").build(), simulator -> {
			assertEquals("data: only\n\nevent: done\ndata: complete\n\n",
					simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString());
		});
	}

	@Test
	public void retryFrameIsSentFirst() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("x")).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).serverSentEventRetry(Duration.ofSeconds(3)).build(), simulator -> {
			assertEquals("retry: 3000\n\ndata: x\n\n", simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString());
		});
	}

	@Test
	public void sourceFailureEmitsErrorEventAndCloses() {
		Iterator<String> failingEvents = new Iterator<>() {
			private int index;

			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public String next() {
				if (this.index++ == 0)
					return "one";

				throw new IllegalStateException("source exploded");
			}
		};

		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(failingEvents).build(), Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			MockConnection mockConnection = MockConnection.withRequest(HttpMethod.GET, "/events").build();
			RequestResult requestResult = simulator.performRequest(mockConnection);

			assertEquals(Integer.valueOf(200), requestResult.getStatusCode());
			assertEquals("data: one\n\nevent: error\ndata: Internal server error\n\n", requestResult.getBodyAsString());
			assertEquals(Integer.valueOf(1), mockConnection.getTerminatingBodyMessageCount());
		});

		assertEquals(LogEventType.SERVER_SENT_EVENT_STREAM_FAILED, lifecycleObserver.getLogEvents().get(0).getLogEventType());
		Assertions.assertTrue(lifecycleObserver.getEvents().contains("terminated FAILED"));
	}

	@Test
	public void unrenderableEventsAreSkipped() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of("one", new Object(), "two")).build(),
				Set.of(HttpMethod.GET));

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		Perch.runSimulator(PerchConfig.withRouter(router).lifecycleObserver(lifecycleObserver).build(), simulator -> {
			assertEquals("data: one\n\ndata: two\n\n", simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString());
		});

		assertEquals(LogEventType.SERVER_SENT_EVENT_RENDER_FAILED, lifecycleObserver.getLogEvents().get(0).getLogEventType());
	}

	@Test
	public void unrenderableEventsAreReportedInDebugMode() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of(new Object())).build(), Set.of(HttpMethod.GET));

		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.debug(true)
				.lifecycleObserver(new RecordingLifecycleObserver())
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			String body = simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString();
			Assertions.assertTrue(body.startsWith("event: error\ndata: Cannot send java.lang.Object as a Server-Sent Event"), body);
		});
	}

	@Test
	public void structuredValuesAreRendered() {
		TemplateRenderer templateRenderer = (name, context) -> "<li>" + context.get("item") + "</li>";

		List<Object> events = List.of(
				Map.of("count", 1),
				ServerSentEvent.withEvent("tick").id("7").data("line one\nline two").build(),
				ServerSentEventComment.withComment("keepalive"),
				Template.withName("item").context(Map.of("item", "x")).build(),
				Template.withName("item").context(Map.of("item", "y")).target("list").build()
		);

		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(events).eventType("update").build(), Set.of(HttpMethod.GET));

		PerchConfig perchConfig = PerchConfig.withRouter(router)
				.gson(new Gson())
				.templateRenderer(templateRenderer)
				.build();

		Perch.runSimulator(perchConfig, simulator -> {
			assertEquals("event: update\ndata: {\"count\":1}\n\n" +
							"event: tick\nid: 7\ndata: line one\ndata: line two\n\n" +
							": keepalive\n\n" +
							"event: fragment\ndata: <li>x</li>\n\n" +
							"event: list\ndata: <li>y</li>\n\n",
					simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString());
		});
	}

	@Test
	public void requestContextIsAvailableToEventSource() {
		Iterator<String> contextualEvents = new Iterator<>() {
			private boolean sent;

			@Override
			public boolean hasNext() {
				return !this.sent;
			}

			@Override
			public String next() {
				this.sent = true;
				return RequestContext.get().getRequest().getPath();
			}
		};

		Router router = Router.create();
		router.register("/events/{topic}", request -> ServerSentEventStream.withEvents(contextualEvents).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("data: /events/news\n\n", simulator.performRequest(HttpMethod.GET, "/events/news").getBodyAsString());
		});
	}

	@Test
	public void eventSourceRunsOnNamedDaemonThread() {
		Iterator<String> threadDescribingEvents = new Iterator<>() {
			private boolean sent;

			@Override
			public boolean hasNext() {
				return !this.sent;
			}

			@Override
			public String next() {
				this.sent = true;
				Thread thread = Thread.currentThread();
				return format("%s daemon=%s", thread.getName().replaceAll("-\\d+$", ""), thread.isDaemon());
			}
		};

		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(threadDescribingEvents).build(), Set.of(HttpMethod.GET));

		Perch.runSimulator(PerchConfig.withRouter(router).build(), simulator -> {
			assertEquals("data: perch-sse-puller daemon=true\n\n", simulator.performRequest(HttpMethod.GET, "/events").getBodyAsString());
		});
	}

	@Test
	public void protocolHeadersWinOverMiddlewareHeaders() {
		Router router = Router.create();
		router.register("/events", request -> ServerSentEventStream.withEvents(List.of()).build(), Set.of(HttpMethod.GET));

		Middleware headerAdding = (request, next) -> next.proceed(request)
				.withHeader("Content-Type", "text/plain")
				.withHeader("X-Stream", "yes");

		Perch.runSimulator(PerchConfig.withRouter(router).middleware(List.of(headerAdding)).build(), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/events");

			assertEquals("text/event-stream; charset=UTF-8", requestResult.getHeader("Content-Type").get());
			assertEquals("yes", requestResult.getHeader("X-Stream").get());
			assertEquals("", requestResult.getBodyAsString());
		});
	}

	// Yields values as they are added to a queue, forever
	@ThreadSafe
	private static class BlockingIterator implements Iterator<Object> {
		private final BlockingQueue<Object> source;

		BlockingIterator(BlockingQueue<Object> source) {
			this.source = source;
		}

		@Override
		public boolean hasNext() {
			return true;
		}

		@Override
		public Object next() {
			try {
				return this.source.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException(e);
			}
		}
	}
}
