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

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typesafe representation of <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods">HTTP request methods</a> that routes may declare.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum HttpMethod {
	GET,
	POST,
	PUT,
	PATCH,
	DELETE,
	OPTIONS,
	HEAD;

	@NonNull
	private static final Map<@NonNull String, @NonNull HttpMethod> HTTP_METHODS_BY_NAME;

	static {
		HTTP_METHODS_BY_NAME = Arrays.stream(HttpMethod.values())
				.collect(Collectors.toUnmodifiableMap(HttpMethod::name, Function.identity()));
	}

	/**
	 * Resolves a method from its wire name, ignoring case and surrounding whitespace.
	 *
	 * @param name the method name as it appeared on the request line, e.g. {@code "GET"}
	 * @return the method, or {@link Optional#empty()} if the name is not a method this framework routes
	 */
	@NonNull
	public static Optional<HttpMethod> fromName(@Nullable String name) {
		String normalizedName = Utilities.trimAggressivelyToNull(name);

		if (normalizedName == null)
			return Optional.empty();

		return Optional.ofNullable(HTTP_METHODS_BY_NAME.get(normalizedName.toUpperCase(Locale.ENGLISH)));
	}
}
