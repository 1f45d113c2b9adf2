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

import com.perch.exception.NegotiationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Drives one Server-Sent Event stream from open to close.
 * <p>
 * Three threads cooperate per stream:
 * <ul>
 *   <li>a <em>puller</em> drains the application's event source into a single-slot queue, so a slow source never
 *   blocks the writer</li>
 *   <li>a <em>producer</em> waits on that queue for at most the heartbeat interval, writing each event as a frame or a
 *   heartbeat comment when the wait times out</li>
 *   <li>a <em>monitor</em> blocks on {@link Connection#receive()} until the client disconnects</li>
 * </ul>
 * Whichever of producer and monitor finishes first decides the close reason. The other is interrupted and joined
 * before closing proceeds, and no frame is written once closing has begun. The puller is interrupted but not joined,
 * since it never writes. The terminating body message is always sent exactly once.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ServerSentEventEngine {
	@NonNull
	private static final ThreadFactory PULLER_THREAD_FACTORY;
	@NonNull
	private static final ThreadFactory PRODUCER_THREAD_FACTORY;
	@NonNull
	private static final ThreadFactory MONITOR_THREAD_FACTORY;

	static {
		PULLER_THREAD_FACTORY = new NonvirtualThreadFactory("perch-sse-puller");
		PRODUCER_THREAD_FACTORY = new NonvirtualThreadFactory("perch-sse-producer");
		MONITOR_THREAD_FACTORY = new NonvirtualThreadFactory("perch-sse-monitor");
	}

	@NonNull
	private final PerchConfig perchConfig;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	ServerSentEventEngine(@NonNull PerchConfig perchConfig,
												@NonNull LifecycleObserver lifecycleObserver) {
		this.perchConfig = requireNonNull(perchConfig);
		this.lifecycleObserver = requireNonNull(lifecycleObserver);
	}

	/**
	 * Streams {@code serverSentEventResponse} over {@code responseChannel}, blocking until the stream is closed.
	 *
	 * @param requestContext          context installed on the engine's threads
	 * @param responseChannel         the not-yet-started response channel
	 * @param serverSentEventResponse the stream to send
	 * @return why the stream ended
	 */
	@NonNull
	ServerSentEventCloseReason stream(@NonNull RequestContext requestContext,
																		@NonNull ResponseChannel responseChannel,
																		@NonNull ServerSentEventResponse serverSentEventResponse) {
		requireNonNull(requestContext);
		requireNonNull(responseChannel);
		requireNonNull(serverSentEventResponse);

		Request request = requestContext.getRequest();
		ServerSentEventStream serverSentEventStream = serverSentEventResponse.getServerSentEventStream();
		Duration heartbeatInterval = serverSentEventStream.getHeartbeatInterval().orElse(getPerchConfig().getServerSentEventHeartbeatInterval());
		FrameWriter frameWriter = new FrameWriter(responseChannel);
		CompletableFuture<ServerSentEventCloseReason> winner = new CompletableFuture<>();
		ServerSentEventCloseReason closeReason = ServerSentEventCloseReason.CLIENT_DISCONNECTED;
		Thread puller = null;
		Thread producer = null;
		Thread monitor = null;
		boolean established = false;

		try {
			try {
				responseChannel.start(serverSentEventResponse.getStatusCode(), serverSentEventResponse.getHeaders());
			} catch (IOException e) {
				return closeReason;
			}

			established = true;
			getLifecycleObserver().didEstablishServerSentEventConnection(request);

			Duration retry = getPerchConfig().getServerSentEventRetry().orElse(null);

			if (retry != null && !frameWriter.write(ServerSentEventFormatter.format(ServerSentEvent.withDefaults().retry(retry).build())))
				return closeReason;

			BlockingQueue<Pulled> queue = new ArrayBlockingQueue<>(1);

			puller = startThread("puller", PULLER_THREAD_FACTORY, requestContext, () -> {
				pull(serverSentEventStream.getEvents(), queue);
				return null;
			}, winner);

			producer = startThread("producer", PRODUCER_THREAD_FACTORY, requestContext,
					() -> produce(request, serverSentEventStream, queue, heartbeatInterval, frameWriter), winner);

			monitor = startThread("monitor", MONITOR_THREAD_FACTORY, requestContext,
					() -> monitor(responseChannel.getConnection()), winner);

			closeReason = winner.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} catch (ExecutionException e) {
			// Tasks complete the winner normally; this would be a bug
			throw new IllegalStateException(e);
		} finally {
			frameWriter.close();

			if (puller != null)
				puller.interrupt();

			cancelAndJoin(producer);
			cancelAndJoin(monitor);

			String closeEvent = getPerchConfig().getServerSentEventCloseEvent().orElse(null);

			if (closeEvent != null && closeReason == ServerSentEventCloseReason.EXHAUSTED)
				frameWriter.writeAfterClose(ServerSentEventFormatter.format(ServerSentEvent.withEvent(closeEvent).data("complete").build()));

			if (responseChannel.isStarted()) {
				try {
					responseChannel.finish(Utilities.emptyByteArray());
				} catch (IOException ignored) {
					// Client is already gone; nothing left to tell it
				}
			}

			if (established)
				getLifecycleObserver().didTerminateServerSentEventConnection(request, closeReason);
		}

		return closeReason;
	}

	private void pull(@NonNull Iterator<?> events,
										@NonNull BlockingQueue<Pulled> queue) throws InterruptedException {
		requireNonNull(events);
		requireNonNull(queue);

		Pulled terminal;

		try {
			while (events.hasNext()) {
				Object event = events.next();

				if (event != null)
					queue.put(Pulled.withValue(event));
			}

			terminal = Pulled.exhausted();
		} catch (InterruptedException e) {
			throw e;
		} catch (Throwable t) {
			terminal = Pulled.withFailure(t);
		}

		queue.put(terminal);
	}

	@NonNull
	private ServerSentEventCloseReason produce(@NonNull Request request,
																						 @NonNull ServerSentEventStream serverSentEventStream,
																						 @NonNull BlockingQueue<Pulled> queue,
																						 @NonNull Duration heartbeatInterval,
																						 @NonNull FrameWriter frameWriter) throws InterruptedException {
		requireNonNull(request);
		requireNonNull(serverSentEventStream);
		requireNonNull(queue);
		requireNonNull(heartbeatInterval);
		requireNonNull(frameWriter);

		long heartbeatIntervalInMillis = Math.max(1L, heartbeatInterval.toMillis());

		while (true) {
			Pulled pulled = queue.poll(heartbeatIntervalInMillis, TimeUnit.MILLISECONDS);

			if (pulled == null) {
				if (!frameWriter.write(ServerSentEventFormatter.HEARTBEAT_FRAME))
					return ServerSentEventCloseReason.CLIENT_DISCONNECTED;

				continue;
			}

			if (pulled.isExhausted())
				return ServerSentEventCloseReason.EXHAUSTED;

			Throwable failure = pulled.getFailure();

			if (failure != null) {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_FAILED,
								format("Server-Sent Event source failed for %s %s", request.getHttpMethod().name(), request.getPath()))
						.throwable(failure)
						.request(request)
						.build());

				String data = getPerchConfig().getDebug() ? Utilities.stackTraceFor(failure) : "Internal server error";
				frameWriter.write(ServerSentEventFormatter.format(ServerSentEvent.withEvent("error").data(data).build()));
				return ServerSentEventCloseReason.FAILED;
			}

			String frame;

			try {
				frame = render(pulled.getValue(), serverSentEventStream);
			} catch (Exception e) {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_SENT_EVENT_RENDER_FAILED,
								format("Unable to render Server-Sent Event for %s %s, skipping it", request.getHttpMethod().name(), request.getPath()))
						.throwable(e)
						.request(request)
						.build());

				if (!getPerchConfig().getDebug())
					continue;

				String message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
				frame = ServerSentEventFormatter.format(ServerSentEvent.withEvent("error").data(message).build());
			}

			if (!frameWriter.write(frame))
				return ServerSentEventCloseReason.CLIENT_DISCONNECTED;
		}
	}

	@Nullable
	private ServerSentEventCloseReason monitor(@NonNull Connection connection) throws InterruptedException {
		requireNonNull(connection);

		try {
			while (true) {
				InboundMessage inboundMessage = connection.receive();

				if (inboundMessage.isDisconnect())
					return ServerSentEventCloseReason.CLIENT_DISCONNECTED;
			}
		} catch (IOException e) {
			return ServerSentEventCloseReason.CLIENT_DISCONNECTED;
		}
	}

	@NonNull
	private String render(@NonNull Object value,
												@NonNull ServerSentEventStream serverSentEventStream) throws Exception {
		requireNonNull(value);
		requireNonNull(serverSentEventStream);

		if (value instanceof ServerSentEvent serverSentEvent)
			return ServerSentEventFormatter.format(serverSentEvent);

		if (value instanceof ServerSentEventComment serverSentEventComment)
			return ServerSentEventFormatter.format(serverSentEventComment);

		String eventType = serverSentEventStream.getEventType().orElse(null);

		if (value instanceof String string)
			return ServerSentEventFormatter.format(ServerSentEvent.withEvent(eventType).data(string).build());

		if (value instanceof Map<?, ?> || value instanceof Collection<?>)
			return ServerSentEventFormatter.format(ServerSentEvent.withEvent(eventType).data(getPerchConfig().getGson().toJson(value)).build());

		if (value instanceof Template template) {
			TemplateRenderer templateRenderer = getPerchConfig().getTemplateRenderer().orElseThrow(() ->
					new IllegalStateException(format("Cannot render %s because no %s is configured", template,
							TemplateRenderer.class.getSimpleName())));

			String markup = templateRenderer.render(template.getName(), template.getContext());
			return ServerSentEventFormatter.format(ServerSentEvent.withEvent(template.getTarget().orElse("fragment")).data(markup).build());
		}

		throw new NegotiationException(format("Cannot send %s as a Server-Sent Event", value.getClass().getName()));
	}

	@NonNull
	private Thread startThread(@NonNull String role,
														 @NonNull ThreadFactory threadFactory,
														 @NonNull RequestContext requestContext,
														 @NonNull Task task,
														 @NonNull CompletableFuture<ServerSentEventCloseReason> winner) {
		requireNonNull(role);
		requireNonNull(threadFactory);
		requireNonNull(requestContext);
		requireNonNull(task);
		requireNonNull(winner);

		Thread thread = threadFactory.newThread(() -> {
			try {
				ServerSentEventCloseReason closeReason = RequestContext.perform(requestContext, ignored -> task.run());

				if (closeReason != null)
					winner.complete(closeReason);
			} catch (InterruptedException e) {
				// Cancelled
			} catch (Throwable t) {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_SENT_EVENT_STREAM_FAILED,
								format("Server-Sent Event %s failed", role))
						.throwable(t)
						.request(requestContext.getRequest())
						.build());

				winner.complete(ServerSentEventCloseReason.FAILED);
			}
		});

		thread.start();

		return thread;
	}

	private void cancelAndJoin(@Nullable Thread thread) {
		if (thread == null)
			return;

		thread.interrupt();

		boolean interrupted = false;

		while (true) {
			try {
				thread.join();
				break;
			} catch (InterruptedException e) {
				interrupted = true;
			}
		}

		if (interrupted)
			Thread.currentThread().interrupt();
	}

	@NonNull
	private PerchConfig getPerchConfig() {
		return this.perchConfig;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@FunctionalInterface
	private interface Task {
		@Nullable
		ServerSentEventCloseReason run() throws Exception;
	}

	/**
	 * One item handed from the puller to the producer.
	 */
	private static final class Pulled {
		@NonNull
		private static final Pulled EXHAUSTED;

		static {
			EXHAUSTED = new Pulled(null, null);
		}

		@Nullable
		private final Object value;
		@Nullable
		private final Throwable failure;

		@NonNull
		static Pulled withValue(@NonNull Object value) {
			return new Pulled(requireNonNull(value), null);
		}

		@NonNull
		static Pulled withFailure(@NonNull Throwable failure) {
			return new Pulled(null, requireNonNull(failure));
		}

		@NonNull
		static Pulled exhausted() {
			return EXHAUSTED;
		}

		private Pulled(@Nullable Object value,
									 @Nullable Throwable failure) {
			this.value = value;
			this.failure = failure;
		}

		@NonNull
		Boolean isExhausted() {
			return this == EXHAUSTED;
		}

		@NonNull
		Object getValue() {
			return requireNonNull(this.value);
		}

		@Nullable
		Throwable getFailure() {
			return this.failure;
		}
	}

	/**
	 * Serializes frame writes and refuses them once closing has begun.
	 */
	@ThreadSafe
	private static final class FrameWriter {
		@NonNull
		private final ResponseChannel responseChannel;
		@NonNull
		private final ReentrantLock lock;
		private boolean closing;
		private boolean disconnected;

		FrameWriter(@NonNull ResponseChannel responseChannel) {
			this.responseChannel = requireNonNull(responseChannel);
			this.lock = new ReentrantLock();
		}

		/**
		 * @return {@code false} if the frame was not written because the stream is closing or the client is gone
		 */
		@NonNull
		Boolean write(@NonNull String frame) {
			requireNonNull(frame);

			this.lock.lock();

			try {
				if (this.closing || this.disconnected)
					return false;

				return send(frame);
			} finally {
				this.lock.unlock();
			}
		}

		void writeAfterClose(@NonNull String frame) {
			requireNonNull(frame);

			this.lock.lock();

			try {
				if (!this.disconnected)
					send(frame);
			} finally {
				this.lock.unlock();
			}
		}

		void close() {
			this.lock.lock();

			try {
				this.closing = true;
			} finally {
				this.lock.unlock();
			}
		}

		@NonNull
		private Boolean send(@NonNull String frame) {
			try {
				this.responseChannel.write(frame.getBytes(StandardCharsets.UTF_8));
				return true;
			} catch (IOException e) {
				this.disconnected = true;
				return false;
			}
		}
	}
}
