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

import com.sun.net.httpserver.HttpServer;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Perch's default {@link Server}, built on the JDK's {@code com.sun.net.httpserver.HttpServer}.
 * <p>
 * Each exchange is dispatched on a worker thread from a cached pool, since Server-Sent Event streams hold their
 * thread for as long as the client stays connected. Buffered responses are sent with a fixed length; streaming and
 * Server-Sent Event responses use chunked transfer encoding.
 * <p>
 * Instances can be acquired via the {@link #withPort(Integer)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DefaultServer implements Server {
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;

	static {
		DEFAULT_HOST = "127.0.0.1";
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
	}

	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile Dispatcher dispatcher;
	@Nullable
	private HttpServer httpServer;
	@Nullable
	private ExecutorService executorService;

	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	private DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.port < 0 || builder.port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", builder.port));

		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.port = builder.port;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.lock = new ReentrantLock();
	}

	@Override
	public void initialize(@NonNull Dispatcher dispatcher) {
		requireNonNull(dispatcher);
		this.dispatcher = dispatcher;
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			Dispatcher dispatcher = this.dispatcher;

			if (dispatcher == null)
				throw new IllegalStateException(format("%s must be initialized before it is started", getClass().getSimpleName()));

			ExecutorService executorService = Executors.newCachedThreadPool(new NonvirtualThreadFactory("perch-worker"));

			HttpServer httpServer;

			try {
				httpServer = HttpServer.create(new InetSocketAddress(getHost(), getPort()), 0);
			} catch (IOException e) {
				executorService.shutdownNow();
				throw new UncheckedIOException(format("Unable to bind to %s:%d", getHost(), getPort()), e);
			}

			httpServer.createContext("/", httpExchange -> {
				try {
					dispatcher.dispatch(new HttpExchangeConnection(httpExchange));
				} finally {
					httpExchange.close();
				}
			});

			httpServer.setExecutor(executorService);
			httpServer.start();

			this.httpServer = httpServer;
			this.executorService = executorService;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			this.httpServer.stop((int) Math.max(0, getShutdownTimeout().toSeconds()));
			this.executorService.shutdownNow();

			try {
				this.executorService.awaitTermination(getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			} finally {
				this.httpServer = null;
				this.executorService = null;
			}
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			return this.httpServer != null;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The address actually bound, which differs from the configured port when port {@code 0} was requested.
	 *
	 * @return the bound address
	 * @throws IllegalStateException if the server is not started
	 */
	@NonNull
	public InetSocketAddress getBoundAddress() {
		getLock().lock();

		try {
			if (this.httpServer == null)
				throw new IllegalStateException("Server is not started");

			return this.httpServer.getAddress();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{host=%s, port=%d}", getClass().getSimpleName(), getHost(), getPort());
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link DefaultServer} via {@link DefaultServer#withPort(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Integer port;
		@Nullable
		private String host;
		@Nullable
		private Duration shutdownTimeout;

		private Builder(@NonNull Integer port) {
			this.port = requireNonNull(port);
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public DefaultServer build() {
			return new DefaultServer(this);
		}
	}
}
