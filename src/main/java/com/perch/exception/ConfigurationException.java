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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Application setup is invalid: a malformed route pattern, a route registered after compilation,
 * a handler parameter that cannot be resolved, and the like.
 * <p>
 * These are programming errors. They surface at startup and are never converted into HTTP responses.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ConfigurationException extends RuntimeException {
	public ConfigurationException(@Nullable String message) {
		super(message);
	}

	public ConfigurationException(@Nullable String message,
																@Nullable Throwable cause) {
		super(message, cause);
	}
}
