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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link Connection} that records everything written to it.
 * <p>
 * Used by {@link Simulator}, and directly by tests that need to watch a response as it is produced, for example to
 * disconnect in the middle of a Server-Sent Event stream. Protocol violations, such as a second response start or a
 * body message after the terminating one, fail immediately with {@link IllegalStateException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MockConnection implements Connection {
	@NonNull
	private final ConnectionMetadata connectionMetadata;
	@NonNull
	private final BlockingQueue<InboundMessage> inboundMessages;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Condition outboundChanged;
	@NonNull
	private final ByteArrayOutputStream body;
	@NonNull
	private final List<byte @NonNull []> bodyMessages;
	@Nullable
	private Integer statusCode;
	@Nullable
	private Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	private int responseStartCount;
	private int terminatingBodyMessageCount;
	private boolean disconnected;

	@NonNull
	public static Builder withRequest(@NonNull String httpMethodName,
																		@NonNull String rawUrl) {
		requireNonNull(httpMethodName);
		requireNonNull(rawUrl);

		return new Builder(httpMethodName, rawUrl);
	}

	@NonNull
	public static Builder withRequest(@NonNull HttpMethod httpMethod,
																		@NonNull String rawUrl) {
		requireNonNull(httpMethod);
		requireNonNull(rawUrl);

		return new Builder(httpMethod.name(), rawUrl);
	}

	private MockConnection(@NonNull Builder builder) {
		requireNonNull(builder);

		this.connectionMetadata = ConnectionMetadata.with(builder.httpMethodName, builder.rawUrl)
				.headers(builder.headers)
				.httpVersion("HTTP/1.1")
				.build();
		this.inboundMessages = new LinkedBlockingQueue<>();
		this.lock = new ReentrantLock();
		this.outboundChanged = this.lock.newCondition();
		this.body = new ByteArrayOutputStream();
		this.bodyMessages = new ArrayList<>();

		List<byte[]> bodyChunks = builder.bodyChunks;

		if (bodyChunks.isEmpty()) {
			this.inboundMessages.add(InboundMessage.withBody(Utilities.emptyByteArray(), false));
		} else {
			for (int i = 0; i < bodyChunks.size(); ++i)
				this.inboundMessages.add(InboundMessage.withBody(bodyChunks.get(i), i < bodyChunks.size() - 1));
		}
	}

	/**
	 * Simulates the client going away. Subsequent {@link #receive()} calls report a disconnect and subsequent writes
	 * fail with {@link IOException}.
	 */
	public void disconnect() {
		getLock().lock();

		try {
			this.disconnected = true;
			this.inboundMessages.add(InboundMessage.disconnect());
			this.outboundChanged.signalAll();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public ConnectionMetadata getMetadata() {
		return this.connectionMetadata;
	}

	@NonNull
	@Override
	public InboundMessage receive() throws InterruptedException {
		InboundMessage inboundMessage = this.inboundMessages.take();

		// Disconnect is sticky
		if (inboundMessage.isDisconnect())
			this.inboundMessages.add(inboundMessage);

		return inboundMessage;
	}

	@Override
	public void sendResponseStart(@NonNull Integer statusCode,
																@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) throws IOException {
		requireNonNull(statusCode);
		requireNonNull(headers);

		getLock().lock();

		try {
			++this.responseStartCount;

			if (this.responseStartCount > 1)
				throw new IllegalStateException("Response start was sent more than once");

			if (this.disconnected)
				throw new IOException("Client disconnected");

			this.statusCode = statusCode;
			this.headers = Utilities.immutableCaseInsensitiveHeaders(headers);
			this.outboundChanged.signalAll();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void sendResponseBody(@NonNull byte[] body,
															 @NonNull Boolean moreBody) throws IOException {
		requireNonNull(body);
		requireNonNull(moreBody);

		getLock().lock();

		try {
			if (this.responseStartCount == 0)
				throw new IllegalStateException("Response body was sent before response start");

			if (this.terminatingBodyMessageCount > 0)
				throw new IllegalStateException("Response body was sent after the terminating body message");

			if (!moreBody)
				++this.terminatingBodyMessageCount;

			if (this.disconnected)
				throw new IOException("Client disconnected");

			this.body.write(body, 0, body.length);
			this.bodyMessages.add(body.clone());
			this.outboundChanged.signalAll();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Waits until the body written so far satisfies {@code predicate}.
	 *
	 * @param predicate tested against the body decoded as UTF-8
	 * @param timeout   how long to wait at most
	 * @return {@code true} if the predicate was satisfied in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	@NonNull
	public Boolean awaitBody(@NonNull Predicate<String> predicate,
													 @NonNull Duration timeout) throws InterruptedException {
		requireNonNull(predicate);
		requireNonNull(timeout);

		long remainingNanos = timeout.toNanos();

		getLock().lock();

		try {
			while (!predicate.test(this.body.toString(StandardCharsets.UTF_8))) {
				if (remainingNanos <= 0)
					return false;

				remainingNanos = this.outboundChanged.awaitNanos(remainingNanos);
			}

			return true;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Waits until the terminating body message has been sent.
	 *
	 * @param timeout how long to wait at most
	 * @return {@code true} if the response completed in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	@NonNull
	public Boolean awaitCompletion(@NonNull Duration timeout) throws InterruptedException {
		requireNonNull(timeout);

		long deadline = System.nanoTime() + timeout.toNanos();

		getLock().lock();

		try {
			while (this.terminatingBodyMessageCount == 0) {
				long remainingNanos = deadline - System.nanoTime();

				if (remainingNanos <= 0)
					return false;

				this.outboundChanged.await(remainingNanos, TimeUnit.NANOSECONDS);
			}

			return true;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<Integer> getStatusCode() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.statusCode);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		getLock().lock();

		try {
			return this.headers == null ? Map.of() : this.headers;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public byte[] getBody() {
		getLock().lock();

		try {
			return this.body.toByteArray();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public String getBodyAsString() {
		return new String(getBody(), StandardCharsets.UTF_8);
	}

	/**
	 * Every body message sent so far, in order, including empty ones.
	 *
	 * @return the body messages
	 */
	@NonNull
	public List<byte @NonNull []> getBodyMessages() {
		getLock().lock();

		try {
			return List.copyOf(this.bodyMessages);
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Integer getResponseStartCount() {
		getLock().lock();

		try {
			return this.responseStartCount;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Integer getTerminatingBodyMessageCount() {
		getLock().lock();

		try {
			return this.terminatingBodyMessageCount;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{metadata=%s}", getClass().getSimpleName(), getMetadata());
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link MockConnection}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String httpMethodName;
		@NonNull
		private final String rawUrl;
		@Nullable
		private Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers;
		@NonNull
		private final List<byte @NonNull []> bodyChunks;

		private Builder(@NonNull String httpMethodName,
										@NonNull String rawUrl) {
			this.httpMethodName = requireNonNull(httpMethodName);
			this.rawUrl = requireNonNull(rawUrl);
			this.bodyChunks = new ArrayList<>();
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		/**
		 * Appends a request body chunk; call repeatedly to simulate a body arriving in pieces.
		 */
		@NonNull
		public Builder body(@NonNull byte[] bodyChunk) {
			requireNonNull(bodyChunk);
			this.bodyChunks.add(bodyChunk.clone());
			return this;
		}

		@NonNull
		public Builder body(@NonNull String bodyChunk) {
			requireNonNull(bodyChunk);
			return body(bodyChunk.getBytes(StandardCharsets.UTF_8));
		}

		@NonNull
		public MockConnection build() {
			return new MockConnection(this);
		}
	}
}
