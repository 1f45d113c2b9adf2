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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Middleware} implementing <a href="https://fetch.spec.whatwg.org/#http-cors-protocol">CORS</a>.
 * <p>
 * Requests without an {@code Origin} header, or from an origin the {@link CorsConfig} does not allow, pass through
 * untouched. Preflight {@code OPTIONS} requests from allowed origins are answered directly with {@code 204} and never
 * reach routing; other requests from allowed origins gain {@code Access-Control-*} headers on the way out.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CorsMiddleware implements Middleware {
	@NonNull
	private final CorsConfig corsConfig;

	@NonNull
	public static CorsMiddleware withConfig(@NonNull CorsConfig corsConfig) {
		requireNonNull(corsConfig);
		return new CorsMiddleware(corsConfig);
	}

	private CorsMiddleware(@NonNull CorsConfig corsConfig) {
		this.corsConfig = requireNonNull(corsConfig);
	}

	@NonNull
	@Override
	public NegotiatedResponse handle(@NonNull Request request,
																	 @NonNull Next next) throws Exception {
		requireNonNull(request);
		requireNonNull(next);

		String origin = request.getHeader("Origin").orElse(null);

		if (origin == null || !getCorsConfig().isAllowedOrigin(origin))
			return next.proceed(request);

		if (request.getHttpMethod() == HttpMethod.OPTIONS)
			return preflightResponse(origin, request.getHeader("Access-Control-Request-Method").isPresent());

		return withCorsHeaders(next.proceed(request), origin);
	}

	@NonNull
	private NegotiatedResponse preflightResponse(@NonNull String origin,
																							 @NonNull Boolean methodRequested) {
		requireNonNull(origin);
		requireNonNull(methodRequested);

		CorsConfig corsConfig = getCorsConfig();
		NegotiatedResponse response = withCorsHeaders(MarshaledResponse.withStatusCode(204).build(), origin);

		if (methodRequested)
			response = response.withHeader("Access-Control-Allow-Methods", String.join(", ", corsConfig.getAllowedMethods()));

		if (!corsConfig.getAllowedHeaders().isEmpty())
			response = response.withHeader("Access-Control-Allow-Headers", String.join(", ", corsConfig.getAllowedHeaders()));

		return response.withHeader("Access-Control-Max-Age", String.valueOf(corsConfig.getMaxAge().toSeconds()));
	}

	@NonNull
	private NegotiatedResponse withCorsHeaders(@NonNull NegotiatedResponse response,
																						 @NonNull String origin) {
		requireNonNull(response);
		requireNonNull(origin);

		CorsConfig corsConfig = getCorsConfig();

		// A wildcard cannot be combined with credentials, so echo the origin instead
		if (corsConfig.getAllowedOrigins().contains("*") && !corsConfig.getAllowCredentials()) {
			response = response.withHeader("Access-Control-Allow-Origin", "*");
		} else {
			response = response.withHeader("Access-Control-Allow-Origin", origin);
			response = response.withHeader("Vary", "Origin");
		}

		if (corsConfig.getAllowCredentials())
			response = response.withHeader("Access-Control-Allow-Credentials", "true");

		if (!corsConfig.getExposedHeaders().isEmpty())
			response = response.withHeader("Access-Control-Expose-Headers", String.join(", ", corsConfig.getExposedHeaders()));

		return response;
	}

	@NonNull
	public CorsConfig getCorsConfig() {
		return this.corsConfig;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{corsConfig=%s}", getClass().getSimpleName(), getCorsConfig());
	}
}
