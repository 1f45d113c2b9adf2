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

/**
 * A transport that accepts HTTP connections and hands each one to a {@link Dispatcher}.
 * <p>
 * It's the responsibility of the server to implement HTTP mechanics: read bytes from the request, write bytes to the
 * response, and adapt each exchange to a {@link Connection}.
 * <p>
 * <strong>Most Perch applications will use {@link DefaultServer} and therefore do not need to implement this interface
 * directly.</strong>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Called once by {@link Perch} before {@link #start()}.
	 *
	 * @param dispatcher handles each accepted connection
	 */
	void initialize(@NonNull Dispatcher dispatcher);

	void start();

	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * Stops the server; equivalent to {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}
}
