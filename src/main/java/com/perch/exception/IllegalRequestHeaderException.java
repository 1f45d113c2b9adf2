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

import static java.util.Objects.requireNonNull;

/**
 * A request header value cannot be converted to the Java type a handler parameter declares.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class IllegalRequestHeaderException extends BadRequestException {
	@NonNull
	private final String requestHeaderName;
	@NonNull
	private final String requestHeaderValue;

	public IllegalRequestHeaderException(@Nullable String detail,
																			 @Nullable Throwable cause,
																			 @NonNull String requestHeaderName,
																			 @NonNull String requestHeaderValue) {
		super(detail, cause);
		this.requestHeaderName = requireNonNull(requestHeaderName);
		this.requestHeaderValue = requireNonNull(requestHeaderValue);
	}

	@NonNull
	public String getRequestHeaderName() {
		return this.requestHeaderName;
	}

	@NonNull
	public String getRequestHeaderValue() {
		return this.requestHeaderValue;
	}
}
