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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Performs requests against a {@link Dispatcher} entirely in memory.
 * <p>
 * Acquired via {@link Perch#runSimulator(PerchConfig, java.util.function.Consumer)}. For example:
 * <pre>{@code  Perch.runSimulator(config, simulator -> {
 *   RequestResult result = simulator.performRequest(HttpMethod.GET, "/widgets/123");
 *   assertEquals(200, result.getStatusCode());
 * });}</pre>
 * <p>
 * Long-lived responses such as Server-Sent Event streams can be driven with {@link #performRequestAsync(MockConnection)}
 * while the test inspects the {@link MockConnection} as it fills.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Simulator {
	@NonNull
	private static final AtomicInteger THREAD_COUNTER;

	static {
		THREAD_COUNTER = new AtomicInteger();
	}

	@NonNull
	private final Dispatcher dispatcher;

	@NonNull
	static Simulator withDispatcher(@NonNull Dispatcher dispatcher) {
		requireNonNull(dispatcher);
		return new Simulator(dispatcher);
	}

	private Simulator(@NonNull Dispatcher dispatcher) {
		this.dispatcher = requireNonNull(dispatcher);
	}

	@NonNull
	public RequestResult performRequest(@NonNull HttpMethod httpMethod,
																			@NonNull String rawUrl) {
		requireNonNull(httpMethod);
		requireNonNull(rawUrl);

		return performRequest(MockConnection.withRequest(httpMethod, rawUrl).build());
	}

	/**
	 * Dispatches {@code mockConnection} on the calling thread and returns once the response is complete.
	 *
	 * @param mockConnection the simulated connection
	 * @return the recorded response
	 */
	@NonNull
	public RequestResult performRequest(@NonNull MockConnection mockConnection) {
		requireNonNull(mockConnection);

		getDispatcher().dispatch(mockConnection);
		return RequestResult.fromMockConnection(mockConnection);
	}

	/**
	 * Dispatches {@code mockConnection} on a new thread.
	 *
	 * @param mockConnection the simulated connection
	 * @return completes with the recorded response once the terminating body message has been sent
	 */
	@NonNull
	public CompletableFuture<RequestResult> performRequestAsync(@NonNull MockConnection mockConnection) {
		requireNonNull(mockConnection);

		CompletableFuture<RequestResult> requestResultFuture = new CompletableFuture<>();

		Thread thread = new Thread(() -> {
			try {
				requestResultFuture.complete(performRequest(mockConnection));
			} catch (Throwable t) {
				requestResultFuture.completeExceptionally(t);
			}
		}, format("perch-simulator-%d", THREAD_COUNTER.incrementAndGet()));

		thread.setDaemon(true);
		thread.start();

		return requestResultFuture;
	}

	@NonNull
	private Dispatcher getDispatcher() {
		return this.dispatcher;
	}
}
