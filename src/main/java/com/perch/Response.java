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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A handler result that pairs a body with an explicit status code and extra headers.
 * <p>
 * The body is negotiated like any other handler result; this response's status (if specified) and headers are then
 * applied on top. For example:
 * <pre>{@code  return Response.withStatusCode(201)
 *   .headers(Map.of("Location", Set.of("/widgets/123")))
 *   .body(Map.of("id", 123))
 *   .build();}</pre>
 * <p>
 * Redirects are responses too: {@link #withRedirect(RedirectType, String)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Response {
	@Nullable
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@Nullable
	private final Object body;

	/**
	 * Acquires a builder for a response with the given status code.
	 *
	 * @param statusCode the status code, or {@code null} to keep whatever status the body negotiates to
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@Nullable Integer statusCode) {
		return new Builder(statusCode);
	}

	@NonNull
	public static Builder withBody(@Nullable Object body) {
		return new Builder(null).body(body);
	}

	/**
	 * Acquires a redirect response: the redirect status, a {@code Location} header and no body.
	 *
	 * @param redirectType the kind of redirect
	 * @param location     the redirect target
	 * @return the response
	 */
	@NonNull
	public static Response withRedirect(@NonNull RedirectType redirectType,
																			@NonNull String location) {
		requireNonNull(redirectType);
		requireNonNull(location);

		return new Builder(redirectType.getStatusCode().getStatusCode())
				.headers(Map.of("Location", Set.of(location)))
				.body("")
				.build();
	}

	private Response(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.statusCode != null && (builder.statusCode < 100 || builder.statusCode > 599))
			throw new IllegalArgumentException(format("Illegal status code %d", builder.statusCode));

		this.statusCode = builder.statusCode;
		this.headers = Utilities.immutableCaseInsensitiveHeaders(builder.headers);
		this.body = builder.body;
	}

	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	@NonNull
	public Optional<Integer> getStatusCode() {
		return Optional.ofNullable(this.statusCode);
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<Object> getBody() {
		return Optional.ofNullable(this.body);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode().map(String::valueOf).orElse("[not specified]"), getHeaders(),
				getBody().map(body -> body.getClass().getSimpleName()).orElse("[none]"));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Response response))
			return false;

		return Objects.equals(getStatusCode(), response.getStatusCode())
				&& Objects.equals(getHeaders(), response.getHeaders())
				&& Objects.equals(getBody(), response.getBody());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders(), getBody());
	}

	/**
	 * Builder used to construct instances of {@link Response}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Integer statusCode;
		@Nullable
		private Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers;
		@Nullable
		private Object body;

		private Builder(@Nullable Integer statusCode) {
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder statusCode(@Nullable Integer statusCode) {
			this.statusCode = statusCode;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable Object body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Response build() {
			return new Response(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Response} via {@link Response#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Response response) {
			requireNonNull(response);

			this.builder = new Builder(response.statusCode)
					.headers(Utilities.caseInsensitiveHeaders(response.getHeaders()))
					.body(response.body);
		}

		@NonNull
		public Copier statusCode(@Nullable Integer statusCode) {
			this.builder.statusCode(statusCode);
			return this;
		}

		@NonNull
		public Copier headers(@NonNull Consumer<Map<@NonNull String, @NonNull Set<@NonNull String>>> headersConsumer) {
			requireNonNull(headersConsumer);

			Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(this.builder.headers);
			headersConsumer.accept(headers);
			this.builder.headers(headers);
			return this;
		}

		@NonNull
		public Copier body(@Nullable Object body) {
			this.builder.body(body);
			return this;
		}

		@NonNull
		public Response finish() {
			return this.builder.build();
		}
	}
}
