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

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * The transport boundary: one inbound HTTP exchange as seen by the {@link Dispatcher}.
 * <p>
 * The outbound side is a strict protocol. Exactly one {@link #sendResponseStart(Integer, Map)} comes first,
 * followed by one or more {@link #sendResponseBody(byte[], Boolean)} calls, the last of which passes
 * {@code moreBody} of {@code false}. The dispatcher guarantees this sequence on every code path; transports may
 * assume it.
 * <p>
 * {@link #receive()} may be called from a different thread than the send methods, and may be called while a send
 * is in progress. The send methods are never called concurrently with each other.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Connection {
	@NonNull
	ConnectionMetadata getMetadata();

	/**
	 * Blocks until the next inbound message is available.
	 *
	 * @return the next body chunk, or {@link InboundMessage#disconnect()} once the client is gone
	 * @throws IOException          if reading fails
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	@NonNull
	InboundMessage receive() throws IOException, InterruptedException;

	void sendResponseStart(@NonNull Integer statusCode,
												 @NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) throws IOException;

	void sendResponseBody(@NonNull byte[] body,
												@NonNull Boolean moreBody) throws IOException;
}
