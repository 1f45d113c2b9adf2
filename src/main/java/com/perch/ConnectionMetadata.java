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
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * What a transport knows about a connection before any body is read: the request line, the headers and the endpoints.
 * <p>
 * Values are raw: the URL is undecoded and the method name is not validated. The {@link Dispatcher} turns this into a {@link Request}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ConnectionMetadata {
	@NonNull
	private final String httpMethodName;
	@NonNull
	private final String rawUrl;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@Nullable
	private final InetSocketAddress clientAddress;
	@Nullable
	private final InetSocketAddress serverAddress;
	@Nullable
	private final String httpVersion;

	/**
	 * Acquires a builder seeded with the request line.
	 *
	 * @param httpMethodName the method exactly as received, e.g. {@code "GET"}
	 * @param rawUrl         the undecoded request target, e.g. {@code "/users/42?tab=posts"}
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String httpMethodName,
														 @NonNull String rawUrl) {
		requireNonNull(httpMethodName);
		requireNonNull(rawUrl);

		return new Builder(httpMethodName, rawUrl);
	}

	private ConnectionMetadata(@NonNull Builder builder) {
		requireNonNull(builder);

		this.httpMethodName = builder.httpMethodName;
		this.rawUrl = builder.rawUrl;
		this.headers = Utilities.immutableCaseInsensitiveHeaders(builder.headers);
		this.clientAddress = builder.clientAddress;
		this.serverAddress = builder.serverAddress;
		this.httpVersion = builder.httpVersion;
	}

	@NonNull
	public String getHttpMethodName() {
		return this.httpMethodName;
	}

	@NonNull
	public String getRawUrl() {
		return this.rawUrl;
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<InetSocketAddress> getClientAddress() {
		return Optional.ofNullable(this.clientAddress);
	}

	@NonNull
	public Optional<InetSocketAddress> getServerAddress() {
		return Optional.ofNullable(this.serverAddress);
	}

	@NonNull
	public Optional<String> getHttpVersion() {
		return Optional.ofNullable(this.httpVersion);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethodName=%s, rawUrl=%s, clientAddress=%s}", getClass().getSimpleName(),
				getHttpMethodName(), getRawUrl(), getClientAddress().orElse(null));
	}

	/**
	 * Builder used to construct instances of {@link ConnectionMetadata} via {@link ConnectionMetadata#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String httpMethodName;
		@NonNull
		private final String rawUrl;
		@Nullable
		private Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers;
		@Nullable
		private InetSocketAddress clientAddress;
		@Nullable
		private InetSocketAddress serverAddress;
		@Nullable
		private String httpVersion;

		private Builder(@NonNull String httpMethodName,
										@NonNull String rawUrl) {
			this.httpMethodName = requireNonNull(httpMethodName);
			this.rawUrl = requireNonNull(rawUrl);
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder clientAddress(@Nullable InetSocketAddress clientAddress) {
			this.clientAddress = clientAddress;
			return this;
		}

		@NonNull
		public Builder serverAddress(@Nullable InetSocketAddress serverAddress) {
			this.serverAddress = serverAddress;
			return this;
		}

		@NonNull
		public Builder httpVersion(@Nullable String httpVersion) {
			this.httpVersion = httpVersion;
			return this;
		}

		@NonNull
		public ConnectionMetadata build() {
			return new ConnectionMetadata(this);
		}
	}
}
