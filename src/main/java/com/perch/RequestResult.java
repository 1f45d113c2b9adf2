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
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What a client would have received for a simulated request: status, headers and the complete body.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestResult {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@NonNull
	private final byte[] body;

	@NonNull
	static RequestResult fromMockConnection(@NonNull MockConnection mockConnection) {
		requireNonNull(mockConnection);

		Integer statusCode = mockConnection.getStatusCode().orElseThrow(() ->
				new IllegalStateException(format("No response was started for %s", mockConnection)));

		return new RequestResult(statusCode, mockConnection.getHeaders(), mockConnection.getBody());
	}

	private RequestResult(@NonNull Integer statusCode,
												@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers,
												@NonNull byte[] body) {
		this.statusCode = requireNonNull(statusCode);
		this.headers = Utilities.immutableCaseInsensitiveHeaders(requireNonNull(headers));
		this.body = requireNonNull(body);
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		Set<String> values = getHeaders().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.iterator().next());
	}

	@NonNull
	public byte[] getBody() {
		return this.body.clone();
	}

	@NonNull
	public String getBodyAsString() {
		return new String(this.body, StandardCharsets.UTF_8);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%d bytes}", getClass().getSimpleName(), getStatusCode(),
				getHeaders(), this.body.length);
	}
}
