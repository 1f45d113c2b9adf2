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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Perch's main class: wires a {@link PerchConfig} to a {@link Dispatcher} and a {@link Server}.
 * <p>
 * For example:
 * <pre>{@code  Router router = Router.create()
 *   .registerResource(new WidgetResource());
 *
 * try (Perch perch = Perch.withConfig(PerchConfig.withRouter(router).port(8080).build())) {
 *   perch.start();
 *   perch.awaitShutdown();
 * }}</pre>
 * <p>
 * For tests, {@link #runSimulator(PerchConfig, Consumer)} runs the same request handling without any networking.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Perch implements AutoCloseable {
	@NonNull
	private final PerchConfig perchConfig;
	@NonNull
	private final Dispatcher dispatcher;
	@NonNull
	private final Server server;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;

	@NonNull
	public static Perch withConfig(@NonNull PerchConfig perchConfig) {
		requireNonNull(perchConfig);
		return new Perch(perchConfig);
	}

	private Perch(@NonNull PerchConfig perchConfig) {
		requireNonNull(perchConfig);

		this.perchConfig = perchConfig;
		this.dispatcher = Dispatcher.withConfig(perchConfig);
		this.server = perchConfig.getServer().orElseGet(() ->
				DefaultServer.withPort(perchConfig.getPort()).host(perchConfig.getHost()).build());
		this.lifecycleObserver = new SafeLifecycleObserver(perchConfig.getLifecycleObserver());
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		this.server.initialize(this.dispatcher);
	}

	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			this.awaitShutdownLatchReference.set(new CountDownLatch(1));
			getServer().start();
			getLifecycleObserver().didStartServer(getServer());
		} finally {
			getLock().unlock();
		}
	}

	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			try {
				getServer().stop();
				getLifecycleObserver().didStopServer(getServer());
			} finally {
				this.awaitShutdownLatchReference.get().countDown();
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Blocks until {@link #stop()} is called from another thread.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		this.awaitShutdownLatchReference.get().await();
	}

	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getServer().isStarted();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void close() {
		stop();
	}

	/**
	 * Runs request handling for {@code perchConfig} against an in-memory {@link Simulator}, useful for integration
	 * testing. No server is started.
	 *
	 * @param perchConfig       configuration that drives request handling
	 * @param simulatorConsumer code to execute within the context of the simulator
	 */
	public static void runSimulator(@NonNull PerchConfig perchConfig,
																	@NonNull Consumer<Simulator> simulatorConsumer) {
		requireNonNull(perchConfig);
		requireNonNull(simulatorConsumer);

		simulatorConsumer.accept(Simulator.withDispatcher(Dispatcher.withConfig(perchConfig)));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{perchConfig=%s, server=%s}", getClass().getSimpleName(), getPerchConfig(), getServer());
	}

	@NonNull
	public PerchConfig getPerchConfig() {
		return this.perchConfig;
	}

	@NonNull
	public Dispatcher getDispatcher() {
		return this.dispatcher;
	}

	@NonNull
	public Server getServer() {
		return this.server;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
