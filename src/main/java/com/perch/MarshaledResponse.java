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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A buffered response: status, headers and the complete body as bytes.
 * <p>
 * Handlers that already know exactly which bytes to send can return one directly and content negotiation passes it
 * through untouched. When written, a {@code Content-Length} header is added unless the status is bodyless.
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(Integer)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MarshaledResponse implements NegotiatedResponse {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@Nullable
	private final byte[] body;

	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	private MarshaledResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, Set<String>> headers = Utilities.immutableCaseInsensitiveHeaders(builder.headers);

		for (Map.Entry<String, Set<String>> entry : headers.entrySet())
			for (String value : entry.getValue())
				Utilities.validateHeaderNameAndValue(entry.getKey(), value);

		this.statusCode = builder.statusCode;
		this.headers = headers;
		this.body = builder.body;
	}

	@Override
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Override
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * The body decoded as UTF-8, mostly useful in tests.
	 *
	 * @return the body text, or {@link Optional#empty()} if there is no body
	 */
	@NonNull
	public Optional<String> getBodyAsString() {
		return getBody().map(body -> new String(body, StandardCharsets.UTF_8));
	}

	@Override
	@NonNull
	public MarshaledResponse withStatus(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		return new Builder(statusCode)
				.headers(getHeaders())
				.body(this.body)
				.build();
	}

	@Override
	@NonNull
	public MarshaledResponse withHeaders(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		requireNonNull(headers);

		return new Builder(getStatusCode())
				.headers(Utilities.mergeHeaders(getHeaders(), headers))
				.body(this.body)
				.build();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), format("%d bytes", getBody().orElse(Utilities.emptyByteArray()).length));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MarshaledResponse marshaledResponse))
			return false;

		return Objects.equals(getStatusCode(), marshaledResponse.getStatusCode())
				&& Objects.equals(getHeaders(), marshaledResponse.getHeaders())
				&& Arrays.equals(this.body, marshaledResponse.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders(), Arrays.hashCode(this.body));
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse} via {@link MarshaledResponse#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer statusCode;
		@Nullable
		private Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
		@Nullable
		private byte[] body;

		private Builder(@NonNull Integer statusCode) {
			this.statusCode = requireNonNull(statusCode);
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			this.statusCode = requireNonNull(statusCode);
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}
}
