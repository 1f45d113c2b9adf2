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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The HTTP status codes this framework produces on its own, with their reason phrases.
 * <p>
 * Handlers may use any status code; this enumeration exists so default error bodies and
 * transports can describe a status without a lookup table of their own.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_204(204, "No Content"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	HTTP_400(400, "Bad Request"),
	HTTP_401(401, "Unauthorized"),
	HTTP_403(403, "Forbidden"),
	HTTP_404(404, "Not Found"),
	HTTP_405(405, "Method Not Allowed"),
	HTTP_409(409, "Conflict"),
	HTTP_413(413, "Content Too Large"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_422(422, "Unprocessable Content"),
	HTTP_429(429, "Too Many Requests"),
	HTTP_500(500, "Internal Server Error"),
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	HTTP_503(503, "Service Unavailable");

	@NonNull
	private static final Map<@NonNull Integer, @NonNull StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * Provides a human-readable description of any status code, known or not.
	 *
	 * @param statusCode the status code to describe
	 * @return the reason phrase, or {@code "HTTP <statusCode>"} for status codes not enumerated here
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse(format("HTTP %d", statusCode));
	}

	/**
	 * Statuses which must not carry a response body: {@code 1xx}, {@code 204} and {@code 304}.
	 *
	 * @param statusCode the status code to check
	 * @return {@code true} if a body must not be written for this status
	 */
	@NonNull
	public static Boolean isBodyless(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return (statusCode >= 100 && statusCode < 200) || statusCode == 204 || statusCode == 304;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
