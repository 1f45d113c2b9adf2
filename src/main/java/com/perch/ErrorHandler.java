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

/**
 * Produces the response for a failed request.
 * <p>
 * Register handlers by status code or by exception type via {@link PerchConfig.Builder}. The return value is negotiated
 * like any route handler result; if it negotiates to {@code 200}, the error's own status is used instead. For example:
 * <pre>{@code  PerchConfig.withRouter(router)
 *   .errorHandler(404, (request, throwable) -> Template.of("not-found.html"))
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ErrorHandler {
	@Nullable
	Object handle(@NonNull Request request,
								@NonNull Throwable throwable) throws Exception;
}
