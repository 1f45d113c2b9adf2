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

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A response in wire-ready form, the output of content negotiation.
 * <p>
 * There are exactly three kinds:
 * <ul>
 *   <li>{@link MarshaledResponse}: status, headers and a complete body</li>
 *   <li>{@link StreamingResponse}: status, headers and a lazy sequence of body chunks</li>
 *   <li>{@link ServerSentEventResponse}: status {@code 200}, protocol headers and a lazy sequence of events</li>
 * </ul>
 * Instances are immutable; the {@code with...} methods return modified copies. Middleware uses them to rewrite
 * responses on the way out.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface NegotiatedResponse {
	@NonNull
	Integer getStatusCode();

	/**
	 * Response headers, keyed case-insensitively.
	 *
	 * @return the headers
	 */
	@NonNull
	Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders();

	/**
	 * A copy of this response with a different status code.
	 * <p>
	 * A {@link ServerSentEventResponse} always answers {@code 200} and returns itself unchanged.
	 *
	 * @param statusCode the new status code
	 * @return the copy
	 */
	@NonNull
	NegotiatedResponse withStatus(@NonNull Integer statusCode);

	/**
	 * A copy of this response with {@code headers} added; a header already present is replaced.
	 *
	 * @param headers the headers to add
	 * @return the copy
	 */
	@NonNull
	NegotiatedResponse withHeaders(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers);

	@NonNull
	default NegotiatedResponse withHeader(@NonNull String name,
																				@Nullable String value) {
		requireNonNull(name);

		Set<String> values = new LinkedHashSet<>();

		if (value != null)
			values.add(value);

		return withHeaders(Map.of(name, values));
	}

	@NonNull
	default Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		Set<String> values = getHeaders().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.iterator().next());
	}
}
