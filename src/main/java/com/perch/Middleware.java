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

/**
 * Wraps request handling.
 * <p>
 * A middleware may rewrite the request before calling {@code next}, return its own response without calling
 * {@code next} at all, or rewrite the response {@code next} returns. For example:
 * <pre>{@code  Middleware timing = (request, next) -> {
 *   long start = System.nanoTime();
 *   NegotiatedResponse response = next.proceed(request);
 *   return response.withHeader("X-Elapsed-Nanos", String.valueOf(System.nanoTime() - start));
 * };}</pre>
 * <p>
 * Middleware runs in registration order on the way in and in reverse order on the way out.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Middleware {
	@NonNull
	NegotiatedResponse handle(@NonNull Request request,
														@NonNull Next next) throws Exception;
}
