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
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Cross-origin policy for {@link CorsMiddleware}.
 * <p>
 * Defaults allow nothing: no origins, methods {@code GET, HEAD, OPTIONS}, no extra request headers, no exposed
 * headers, no credentials and a 10 minute preflight cache. An origin of {@code *} allows any origin.
 * <p>
 * For example:
 * <pre>{@code  CorsConfig corsConfig = CorsConfig.withAllowedOrigins(Set.of("https://www.example.com"))
 *   .allowedMethods(List.of("GET", "POST", "PUT"))
 *   .allowedHeaders(List.of("Content-Type", "Authorization"))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CorsConfig {
	@NonNull
	private static final List<@NonNull String> DEFAULT_ALLOWED_METHODS;
	@NonNull
	private static final Duration DEFAULT_MAX_AGE;

	static {
		DEFAULT_ALLOWED_METHODS = List.of("GET", "HEAD", "OPTIONS");
		DEFAULT_MAX_AGE = Duration.ofSeconds(600);
	}

	@NonNull
	private final Set<@NonNull String> allowedOrigins;
	@NonNull
	private final List<@NonNull String> allowedMethods;
	@NonNull
	private final List<@NonNull String> allowedHeaders;
	@NonNull
	private final List<@NonNull String> exposedHeaders;
	@NonNull
	private final Boolean allowCredentials;
	@NonNull
	private final Duration maxAge;

	@NonNull
	public static Builder withAllowedOrigins(@NonNull Set<@NonNull String> allowedOrigins) {
		requireNonNull(allowedOrigins);
		return new Builder(allowedOrigins);
	}

	/**
	 * A configuration that allows no origins at all.
	 *
	 * @return the configuration
	 */
	@NonNull
	public static CorsConfig withDefaults() {
		return new Builder(Set.of()).build();
	}

	private CorsConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.maxAge != null && builder.maxAge.isNegative())
			throw new IllegalArgumentException(format("Max age must not be negative, but was %s", builder.maxAge));

		this.allowedOrigins = Set.copyOf(builder.allowedOrigins);
		this.allowedMethods = builder.allowedMethods != null ? List.copyOf(builder.allowedMethods) : DEFAULT_ALLOWED_METHODS;
		this.allowedHeaders = builder.allowedHeaders != null ? List.copyOf(builder.allowedHeaders) : List.of();
		this.exposedHeaders = builder.exposedHeaders != null ? List.copyOf(builder.exposedHeaders) : List.of();
		this.allowCredentials = builder.allowCredentials != null ? builder.allowCredentials : false;
		this.maxAge = builder.maxAge != null ? builder.maxAge : DEFAULT_MAX_AGE;
	}

	@NonNull
	public Boolean isAllowedOrigin(@NonNull String origin) {
		requireNonNull(origin);
		return getAllowedOrigins().contains("*") || getAllowedOrigins().contains(origin);
	}

	@NonNull
	public Set<@NonNull String> getAllowedOrigins() {
		return this.allowedOrigins;
	}

	@NonNull
	public List<@NonNull String> getAllowedMethods() {
		return this.allowedMethods;
	}

	@NonNull
	public List<@NonNull String> getAllowedHeaders() {
		return this.allowedHeaders;
	}

	@NonNull
	public List<@NonNull String> getExposedHeaders() {
		return this.exposedHeaders;
	}

	@NonNull
	public Boolean getAllowCredentials() {
		return this.allowCredentials;
	}

	@NonNull
	public Duration getMaxAge() {
		return this.maxAge;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{allowedOrigins=%s, allowedMethods=%s, allowCredentials=%s}", getClass().getSimpleName(),
				getAllowedOrigins(), getAllowedMethods(), getAllowCredentials());
	}

	/**
	 * Builder used to construct instances of {@link CorsConfig} via {@link CorsConfig#withAllowedOrigins(Set)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Set<@NonNull String> allowedOrigins;
		@Nullable
		private List<@NonNull String> allowedMethods;
		@Nullable
		private List<@NonNull String> allowedHeaders;
		@Nullable
		private List<@NonNull String> exposedHeaders;
		@Nullable
		private Boolean allowCredentials;
		@Nullable
		private Duration maxAge;

		private Builder(@NonNull Set<@NonNull String> allowedOrigins) {
			this.allowedOrigins = requireNonNull(allowedOrigins);
		}

		@NonNull
		public Builder allowedMethods(@Nullable List<@NonNull String> allowedMethods) {
			this.allowedMethods = allowedMethods;
			return this;
		}

		@NonNull
		public Builder allowedHeaders(@Nullable List<@NonNull String> allowedHeaders) {
			this.allowedHeaders = allowedHeaders;
			return this;
		}

		@NonNull
		public Builder exposedHeaders(@Nullable List<@NonNull String> exposedHeaders) {
			this.exposedHeaders = exposedHeaders;
			return this;
		}

		@NonNull
		public Builder allowCredentials(@Nullable Boolean allowCredentials) {
			this.allowCredentials = allowCredentials;
			return this;
		}

		@NonNull
		public Builder maxAge(@Nullable Duration maxAge) {
			this.maxAge = maxAge;
			return this;
		}

		@NonNull
		public CorsConfig build() {
			return new CorsConfig(this);
		}
	}
}
