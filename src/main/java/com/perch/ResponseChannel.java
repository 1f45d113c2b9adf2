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
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Enforces the outbound protocol of a {@link Connection}: one response start, then body messages, then exactly one
 * terminating body message.
 * <p>
 * State flips before the underlying send, so a failed send is never retried.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ResponseChannel {
	@NonNull
	private final Connection connection;
	@NonNull
	private final ReentrantLock lock;
	private boolean started;
	private boolean finished;

	ResponseChannel(@NonNull Connection connection) {
		this.connection = requireNonNull(connection);
		this.lock = new ReentrantLock();
	}

	void start(@NonNull Integer statusCode,
						 @NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) throws IOException {
		requireNonNull(statusCode);
		requireNonNull(headers);

		getLock().lock();

		try {
			if (this.started)
				throw new IllegalStateException("Response has already been started");

			this.started = true;
			getConnection().sendResponseStart(statusCode, headers);
		} finally {
			getLock().unlock();
		}
	}

	void write(@NonNull byte[] body) throws IOException {
		requireNonNull(body);

		getLock().lock();

		try {
			if (!this.started)
				throw new IllegalStateException("Response has not been started");
			if (this.finished)
				throw new IllegalStateException("Response has already been finished");

			getConnection().sendResponseBody(body, true);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Sends the terminating body message unless it has already been sent.
	 *
	 * @param body the final bytes, often empty
	 * @return {@code true} if this call sent the terminating message
	 * @throws IOException if sending fails
	 */
	@NonNull
	Boolean finish(@NonNull byte[] body) throws IOException {
		requireNonNull(body);

		getLock().lock();

		try {
			if (!this.started)
				throw new IllegalStateException("Response has not been started");
			if (this.finished)
				return false;

			this.finished = true;
			getConnection().sendResponseBody(body, false);
			return true;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Boolean isStarted() {
		getLock().lock();

		try {
			return this.started;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Boolean isFinished() {
		getLock().lock();

		try {
			return this.finished;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	Connection getConnection() {
		return this.connection;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
