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
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The negotiated form of a {@link ServerSentEventStream}.
 * <p>
 * The status is always {@code 200}. The protocol headers ({@code Content-Type}, {@code Cache-Control},
 * {@code Connection} and {@code X-Accel-Buffering}) are always present and cannot be overridden; other headers, for
 * example from CORS middleware, are carried alongside them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventResponse implements NegotiatedResponse {
	@NonNull
	private static final Map<@NonNull String, @NonNull Set<@NonNull String>> PROTOCOL_HEADERS;

	static {
		PROTOCOL_HEADERS = Utilities.immutableCaseInsensitiveHeaders(Map.of(
				"Content-Type", Set.of("text/event-stream; charset=UTF-8"),
				"Cache-Control", Set.of("no-cache"),
				"Connection", Set.of("keep-alive"),
				"X-Accel-Buffering", Set.of("no")
		));
	}

	@NonNull
	private final ServerSentEventStream serverSentEventStream;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

	@NonNull
	public static ServerSentEventResponse withServerSentEventStream(@NonNull ServerSentEventStream serverSentEventStream) {
		requireNonNull(serverSentEventStream);
		return new ServerSentEventResponse(serverSentEventStream, Map.of());
	}

	private ServerSentEventResponse(@NonNull ServerSentEventStream serverSentEventStream,
																	@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> additionalHeaders) {
		requireNonNull(serverSentEventStream);
		requireNonNull(additionalHeaders);

		Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(additionalHeaders);
		headers.putAll(PROTOCOL_HEADERS);

		this.serverSentEventStream = serverSentEventStream;
		this.headers = Utilities.immutableCaseInsensitiveHeaders(headers);
	}

	@Override
	@NonNull
	public Integer getStatusCode() {
		return 200;
	}

	@Override
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public ServerSentEventStream getServerSentEventStream() {
		return this.serverSentEventStream;
	}

	@Override
	@NonNull
	public ServerSentEventResponse withStatus(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return this;
	}

	@Override
	@NonNull
	public ServerSentEventResponse withHeaders(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		requireNonNull(headers);
		return new ServerSentEventResponse(getServerSentEventStream(), Utilities.mergeHeaders(getHeaders(), headers));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{headers=%s, serverSentEventStream=%s}", getClass().getSimpleName(), getHeaders(),
				getServerSentEventStream());
	}
}
