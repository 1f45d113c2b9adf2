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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Signals "respond with this status code and detail" from anywhere in request handling.
 * <p>
 * Application code throws these to produce non-{@code 2xx} responses without building a response by hand.
 * They are caught at the dispatch boundary, offered to any registered error handler for the exception type or
 * status code, and otherwise turned into a minimal response carrying {@link #getDetail()} and {@link #getHeaders()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HttpException extends RuntimeException {
	@NonNull
	private final Integer statusCode;
	@Nullable
	private final String detail;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

	public HttpException(@NonNull Integer statusCode) {
		this(statusCode, null, null, null);
	}

	public HttpException(@NonNull Integer statusCode,
											 @Nullable String detail) {
		this(statusCode, detail, null, null);
	}

	public HttpException(@NonNull Integer statusCode,
											 @Nullable String detail,
											 @Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		this(statusCode, detail, headers, null);
	}

	public HttpException(@NonNull Integer statusCode,
											 @Nullable String detail,
											 @Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> headers,
											 @Nullable Throwable cause) {
		super(detail == null ? format("HTTP %d", requireNonNull(statusCode)) : format("HTTP %d: %s", requireNonNull(statusCode), detail), cause);

		if (statusCode < 100 || statusCode > 599)
			throw new IllegalArgumentException(format("Illegal status code %d", statusCode));

		this.statusCode = statusCode;
		this.detail = detail;

		Map<String, Set<String>> copiedHeaders = new LinkedHashMap<>();

		if (headers != null)
			for (Map.Entry<String, Set<String>> entry : headers.entrySet())
				copiedHeaders.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));

		this.headers = Collections.unmodifiableMap(copiedHeaders);
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * Human-readable detail for the response body, if one was supplied.
	 *
	 * @return the detail, or {@link Optional#empty()} if the status alone describes the failure
	 */
	@NonNull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	/**
	 * Headers that must accompany the error response regardless of how its body is produced, e.g. {@code Allow}.
	 *
	 * @return the headers, never {@code null}
	 */
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}
}
