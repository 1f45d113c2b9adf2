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

package com.perch.exception;

import com.perch.HttpMethod;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A route matches the request path, but not the request method.
 * <p>
 * Carries the methods the matching routes do accept, which become the response's {@code Allow} header,
 * e.g. {@code Allow: GET, POST}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class MethodNotAllowedException extends HttpException {
	@NonNull
	private final SortedSet<@NonNull HttpMethod> allowedHttpMethods;

	public MethodNotAllowedException(@NonNull Set<@NonNull HttpMethod> allowedHttpMethods) {
		super(405, "Method Not Allowed", Map.of("Allow", Set.of(allowHeaderValue(requireNonNull(allowedHttpMethods)))));
		this.allowedHttpMethods = Collections.unmodifiableSortedSet(new TreeSet<>(allowedHttpMethods.isEmpty()
				? EnumSet.noneOf(HttpMethod.class) : EnumSet.copyOf(allowedHttpMethods)));
	}

	@NonNull
	private static String allowHeaderValue(@NonNull Set<@NonNull HttpMethod> allowedHttpMethods) {
		requireNonNull(allowedHttpMethods);

		return allowedHttpMethods.stream()
				.map(HttpMethod::name)
				.sorted()
				.collect(Collectors.joining(", "));
	}

	/**
	 * The methods accepted at the matched path, in alphabetical order.
	 *
	 * @return the allowed methods
	 */
	@NonNull
	public SortedSet<@NonNull HttpMethod> getAllowedHttpMethods() {
		return this.allowedHttpMethods;
	}
}
