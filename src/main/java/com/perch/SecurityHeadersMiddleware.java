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
import java.util.Locale;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Middleware} which adds browser security headers to HTML responses.
 * <p>
 * Only responses whose {@code Content-Type} is {@code text/html} are touched; JSON, binary and Server-Sent Event
 * responses pass through unchanged. By default it sends:
 * <ul>
 *   <li>{@code X-Frame-Options: DENY}</li>
 *   <li>{@code X-Content-Type-Options: nosniff}</li>
 *   <li>{@code Referrer-Policy: strict-origin-when-cross-origin}</li>
 *   <li>a restrictive {@code Content-Security-Policy}</li>
 * </ul>
 * {@code Strict-Transport-Security} is only sent when configured.
 * <p>
 * Instances can be acquired via the {@link #withDefaults()} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SecurityHeadersMiddleware implements Middleware {
	@NonNull
	private static final String DEFAULT_CONTENT_SECURITY_POLICY;

	static {
		DEFAULT_CONTENT_SECURITY_POLICY = "default-src 'self'; base-uri 'self'; frame-ancestors 'none'; object-src 'none'";
	}

	@NonNull
	private final String frameOptions;
	@NonNull
	private final String contentTypeOptions;
	@NonNull
	private final String referrerPolicy;
	@Nullable
	private final String contentSecurityPolicy;
	@Nullable
	private final String strictTransportSecurity;

	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	private SecurityHeadersMiddleware(@NonNull Builder builder) {
		requireNonNull(builder);

		this.frameOptions = requireNonNull(Utilities.trimAggressivelyToNull(builder.frameOptions), "X-Frame-Options must not be blank");
		this.contentTypeOptions = requireNonNull(Utilities.trimAggressivelyToNull(builder.contentTypeOptions), "X-Content-Type-Options must not be blank");
		this.referrerPolicy = requireNonNull(Utilities.trimAggressivelyToNull(builder.referrerPolicy), "Referrer-Policy must not be blank");
		this.contentSecurityPolicy = Utilities.trimAggressivelyToNull(builder.contentSecurityPolicy);
		this.strictTransportSecurity = Utilities.trimAggressivelyToNull(builder.strictTransportSecurity);
	}

	@NonNull
	@Override
	public NegotiatedResponse handle(@NonNull Request request,
																	 @NonNull Next next) throws Exception {
		requireNonNull(request);
		requireNonNull(next);

		NegotiatedResponse response = next.proceed(request);

		if (response instanceof ServerSentEventResponse || !isHtml(response))
			return response;

		response = response.withHeader("X-Frame-Options", getFrameOptions())
				.withHeader("X-Content-Type-Options", getContentTypeOptions())
				.withHeader("Referrer-Policy", getReferrerPolicy());

		if (this.contentSecurityPolicy != null)
			response = response.withHeader("Content-Security-Policy", this.contentSecurityPolicy);

		if (this.strictTransportSecurity != null)
			response = response.withHeader("Strict-Transport-Security", this.strictTransportSecurity);

		return response;
	}

	@NonNull
	private Boolean isHtml(@NonNull NegotiatedResponse response) {
		requireNonNull(response);

		return response.getHeader("Content-Type")
				.map(contentType -> contentType.toLowerCase(Locale.ENGLISH).startsWith("text/html"))
				.orElse(false);
	}

	@NonNull
	public String getFrameOptions() {
		return this.frameOptions;
	}

	@NonNull
	public String getContentTypeOptions() {
		return this.contentTypeOptions;
	}

	@NonNull
	public String getReferrerPolicy() {
		return this.referrerPolicy;
	}

	@NonNull
	public Optional<String> getContentSecurityPolicy() {
		return Optional.ofNullable(this.contentSecurityPolicy);
	}

	@NonNull
	public Optional<String> getStrictTransportSecurity() {
		return Optional.ofNullable(this.strictTransportSecurity);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{frameOptions=%s, contentTypeOptions=%s, referrerPolicy=%s, contentSecurityPolicy=%s, strictTransportSecurity=%s}",
				getClass().getSimpleName(), getFrameOptions(), getContentTypeOptions(), getReferrerPolicy(),
				getContentSecurityPolicy().orElse(null), getStrictTransportSecurity().orElse(null));
	}

	/**
	 * Builder used to construct instances of {@link SecurityHeadersMiddleware} via {@link SecurityHeadersMiddleware#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String frameOptions;
		@Nullable
		private String contentTypeOptions;
		@Nullable
		private String referrerPolicy;
		@Nullable
		private String contentSecurityPolicy;
		@Nullable
		private String strictTransportSecurity;

		private Builder() {
			this.frameOptions = "DENY";
			this.contentTypeOptions = "nosniff";
			this.referrerPolicy = "strict-origin-when-cross-origin";
			this.contentSecurityPolicy = DEFAULT_CONTENT_SECURITY_POLICY;
		}

		@NonNull
		public Builder frameOptions(@NonNull String frameOptions) {
			this.frameOptions = requireNonNull(frameOptions);
			return this;
		}

		@NonNull
		public Builder contentTypeOptions(@NonNull String contentTypeOptions) {
			this.contentTypeOptions = requireNonNull(contentTypeOptions);
			return this;
		}

		@NonNull
		public Builder referrerPolicy(@NonNull String referrerPolicy) {
			this.referrerPolicy = requireNonNull(referrerPolicy);
			return this;
		}

		/**
		 * The {@code Content-Security-Policy} value; {@code null} omits the header.
		 */
		@NonNull
		public Builder contentSecurityPolicy(@Nullable String contentSecurityPolicy) {
			this.contentSecurityPolicy = contentSecurityPolicy;
			return this;
		}

		@NonNull
		public Builder strictTransportSecurity(@Nullable String strictTransportSecurity) {
			this.strictTransportSecurity = strictTransportSecurity;
			return this;
		}

		@NonNull
		public SecurityHeadersMiddleware build() {
			return new SecurityHeadersMiddleware(this);
		}
	}
}
