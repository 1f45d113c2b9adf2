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
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static com.perch.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable snapshot of one HTTP request.
 * <p>
 * Header names are case-insensitive. Headers and query parameters are multi-valued. Path parameters are present once
 * the request has been matched to a {@link Route}: the {@link Dispatcher} derives a copy carrying the route and its
 * raw path parameter values via {@link #copy()}.
 * <p>
 * The body is not read up front; see {@link #getRequestBody()}.
 * <p>
 * Instances can be acquired via {@link #withRawUrl(HttpMethod, String)} (undecoded request target, as received from a
 * transport) or {@link #withPath(HttpMethod, String)} (already-decoded path, convenient for tests).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final HttpMethod httpMethod;
	@NonNull
	private final String path;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> queryParameters;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@NonNull
	private final Map<@NonNull String, @NonNull String> pathParameters;
	@Nullable
	private final Route route;
	@Nullable
	private final InetSocketAddress clientAddress;
	@Nullable
	private final InetSocketAddress serverAddress;
	@Nullable
	private final String httpVersion;
	@NonNull
	private final RequestBody requestBody;

	/**
	 * Acquires a builder from an undecoded request target, e.g. {@code /users/j%C3%B8rn?tab=posts}.
	 * <p>
	 * The path is percent-decoded and normalized, and query parameters are parsed, when the request is built.
	 *
	 * @param httpMethod the request method
	 * @param rawUrl     the undecoded request target
	 * @return the builder
	 */
	@NonNull
	public static Builder withRawUrl(@NonNull HttpMethod httpMethod,
																	 @NonNull String rawUrl) {
		requireNonNull(httpMethod);
		requireNonNull(rawUrl);

		return new Builder(httpMethod).rawUrl(rawUrl);
	}

	/**
	 * Acquires a builder from an already-decoded path, e.g. {@code /users/jørn}.
	 * <p>
	 * Query parameters, if any, are supplied separately via {@link Builder#queryParameters(Map)}.
	 *
	 * @param httpMethod the request method
	 * @param path       the decoded path
	 * @return the builder
	 */
	@NonNull
	public static Builder withPath(@NonNull HttpMethod httpMethod,
																 @NonNull String path) {
		requireNonNull(httpMethod);
		requireNonNull(path);

		return new Builder(httpMethod).path(path);
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 * <p>
	 * The copy shares this request's {@link RequestBody}.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	private Request(@NonNull Builder builder) {
		requireNonNull(builder);

		String path;
		Map<String, Set<String>> queryParameters;

		if (builder.rawUrl != null) {
			path = Utilities.extractPathFromRawUrl(builder.rawUrl);
			queryParameters = Utilities.extractQueryParametersFromRawQuery(Utilities.extractRawQueryFromRawUrl(builder.rawUrl));
		} else {
			path = Utilities.normalizePath(builder.path == null ? "" : builder.path);
			queryParameters = builder.queryParameters == null ? Map.of() : builder.queryParameters;
		}

		Map<String, Set<String>> immutableQueryParameters = new LinkedHashMap<>();

		for (Map.Entry<String, Set<String>> entry : queryParameters.entrySet())
			immutableQueryParameters.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));

		this.httpMethod = builder.httpMethod;
		this.path = path;
		this.queryParameters = Collections.unmodifiableMap(immutableQueryParameters);
		this.headers = Utilities.immutableCaseInsensitiveHeaders(builder.headers);
		this.pathParameters = builder.pathParameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParameters));
		this.route = builder.route;
		this.clientAddress = builder.clientAddress;
		this.serverAddress = builder.serverAddress;
		this.httpVersion = builder.httpVersion;
		this.requestBody = builder.requestBody == null ? RequestBody.empty() : builder.requestBody;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethod=%s, path=%s, queryParameters=%s, pathParameters=%s, headers=%s}", getClass().getSimpleName(),
				getHttpMethod(), getPath(), getQueryParameters(), getPathParameters(), getHeaders());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Request request))
			return false;

		return Objects.equals(getHttpMethod(), request.getHttpMethod())
				&& Objects.equals(getPath(), request.getPath())
				&& Objects.equals(getQueryParameters(), request.getQueryParameters())
				&& Objects.equals(getHeaders(), request.getHeaders())
				&& Objects.equals(getPathParameters(), request.getPathParameters())
				&& Objects.equals(getRoute(), request.getRoute())
				&& Objects.equals(getRequestBody(), request.getRequestBody());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHttpMethod(), getPath(), getQueryParameters(), getHeaders(), getPathParameters(), getRoute(), getRequestBody());
	}

	@NonNull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	/**
	 * The decoded, normalized path, e.g. {@code /users/42}. Never has a trailing slash unless it is {@code /}.
	 *
	 * @return the path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getQueryParameters() {
		return this.queryParameters;
	}

	/**
	 * The first value of the named query parameter.
	 *
	 * @param name the query parameter name
	 * @return the value, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<String> getQueryParameter(@NonNull String name) {
		requireNonNull(name);
		return firstValue(getQueryParameters().get(name));
	}

	/**
	 * Headers keyed case-insensitively.
	 *
	 * @return the headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);
		return firstValue(getHeaders().get(name));
	}

	/**
	 * Raw (unconverted) path parameter values, populated once the request is matched to a route.
	 *
	 * @return the path parameters, empty before matching
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getPathParameters() {
		return this.pathParameters;
	}

	@NonNull
	public Optional<String> getPathParameter(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getPathParameters().get(name));
	}

	@NonNull
	public Optional<Route> getRoute() {
		return Optional.ofNullable(this.route);
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

	/**
	 * Lazy access to the body. Reading may block on the transport.
	 *
	 * @return the body
	 */
	@NonNull
	public RequestBody getRequestBody() {
		return this.requestBody;
	}

	/**
	 * Reads the whole body. Convenience for {@code getRequestBody().readAll()}.
	 *
	 * @return the body bytes
	 * @throws IOException          if the transport fails
	 * @throws InterruptedException if interrupted while waiting for the transport
	 */
	@NonNull
	public byte[] getBody() throws IOException, InterruptedException {
		return getRequestBody().readAll();
	}

	/**
	 * Reads the whole body as text, decoded with the {@code Content-Type} charset or UTF-8 if none is declared.
	 *
	 * @return the body text
	 * @throws IOException          if the transport fails
	 * @throws InterruptedException if interrupted while waiting for the transport
	 */
	@NonNull
	public String getBodyAsString() throws IOException, InterruptedException {
		return new String(getBody(), getCharset().orElse(StandardCharsets.UTF_8));
	}

	/**
	 * The media type of the {@code Content-Type} header, without parameters, e.g. {@code application/json}.
	 *
	 * @return the content type, or {@link Optional#empty()} if not specified
	 */
	@NonNull
	public Optional<String> getContentType() {
		return getHeader("Content-Type")
				.map(contentType -> trimAggressivelyToNull(contentType.split(";", 2)[0]))
				.map(contentType -> contentType.toLowerCase(Locale.ENGLISH));
	}

	@NonNull
	public Optional<Charset> getCharset() {
		String contentType = getHeader("Content-Type").orElse(null);

		if (contentType == null)
			return Optional.empty();

		for (String parameter : contentType.split(";")) {
			String[] nameAndValue = parameter.split("=", 2);

			if (nameAndValue.length == 2 && "charset".equalsIgnoreCase(nameAndValue[0].trim())) {
				String charsetName = nameAndValue[1].trim().replace("\"", "");

				try {
					return Optional.of(Charset.forName(charsetName));
				} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
					return Optional.empty();
				}
			}
		}

		return Optional.empty();
	}

	@NonNull
	private static Optional<String> firstValue(@Nullable Set<@NonNull String> values) {
		if (values == null || values.isEmpty())
			return Optional.empty();

		return Optional.of(values.iterator().next());
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#withRawUrl(HttpMethod, String)} or {@link Request#withPath(HttpMethod, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private HttpMethod httpMethod;
		@Nullable
		private String rawUrl;
		@Nullable
		private String path;
		@Nullable
		private Map<@NonNull String, @NonNull Set<@NonNull String>> queryParameters;
		@Nullable
		private Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers;
		@Nullable
		private Map<@NonNull String, @NonNull String> pathParameters;
		@Nullable
		private Route route;
		@Nullable
		private InetSocketAddress clientAddress;
		@Nullable
		private InetSocketAddress serverAddress;
		@Nullable
		private String httpVersion;
		@Nullable
		private RequestBody requestBody;

		private Builder(@NonNull HttpMethod httpMethod) {
			this.httpMethod = requireNonNull(httpMethod);
		}

		@NonNull
		public Builder httpMethod(@NonNull HttpMethod httpMethod) {
			this.httpMethod = requireNonNull(httpMethod);
			return this;
		}

		@NonNull
		private Builder rawUrl(@NonNull String rawUrl) {
			this.rawUrl = requireNonNull(rawUrl);
			this.path = null;
			return this;
		}

		@NonNull
		public Builder path(@NonNull String path) {
			this.path = requireNonNull(path);
			this.rawUrl = null;
			return this;
		}

		@NonNull
		public Builder queryParameters(@Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> queryParameters) {
			this.queryParameters = queryParameters;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder pathParameters(@Nullable Map<@NonNull String, @NonNull String> pathParameters) {
			this.pathParameters = pathParameters;
			return this;
		}

		@NonNull
		public Builder route(@Nullable Route route) {
			this.route = route;
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
		public Builder requestBody(@Nullable RequestBody requestBody) {
			this.requestBody = requestBody;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.requestBody = body == null ? null : RequestBody.withBytes(body);
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Request} via {@link Request#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Request request) {
			requireNonNull(request);

			this.builder = new Builder(request.getHttpMethod())
					.path(request.getPath())
					.queryParameters(new LinkedHashMap<>(request.getQueryParameters()))
					.headers(Utilities.caseInsensitiveHeaders(request.getHeaders()))
					.pathParameters(new LinkedHashMap<>(request.getPathParameters()))
					.route(request.getRoute().orElse(null))
					.clientAddress(request.getClientAddress().orElse(null))
					.serverAddress(request.getServerAddress().orElse(null))
					.httpVersion(request.getHttpVersion().orElse(null))
					.requestBody(request.getRequestBody());
		}

		@NonNull
		public Copier httpMethod(@NonNull HttpMethod httpMethod) {
			this.builder.httpMethod(httpMethod);
			return this;
		}

		@NonNull
		public Copier path(@NonNull String path) {
			this.builder.path(path);
			return this;
		}

		@NonNull
		public Copier queryParameters(@Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> queryParameters) {
			this.builder.queryParameters(queryParameters);
			return this;
		}

		// Convenience method for mutation
		@NonNull
		public Copier headers(@NonNull Consumer<Map<@NonNull String, @NonNull Set<@NonNull String>>> headersConsumer) {
			requireNonNull(headersConsumer);

			Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(this.builder.headers);
			headersConsumer.accept(headers);
			this.builder.headers(headers);
			return this;
		}

		@NonNull
		public Copier pathParameters(@Nullable Map<@NonNull String, @NonNull String> pathParameters) {
			this.builder.pathParameters(pathParameters);
			return this;
		}

		@NonNull
		public Copier route(@Nullable Route route) {
			this.builder.route(route);
			return this;
		}

		@NonNull
		public Request finish() {
			return this.builder.build();
		}
	}
}
