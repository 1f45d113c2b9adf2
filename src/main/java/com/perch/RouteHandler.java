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
 * Application code invoked when a {@link Route} matches.
 * <p>
 * The returned value is handed to the {@link ContentNegotiator}, so it may be anything negotiation understands:
 * a {@link String}, {@code byte[]}, {@link java.util.Map}, {@link java.util.List}, {@link Response}, {@link Template},
 * {@link ServerSentEventStream} or an already-formed {@link NegotiatedResponse}. Returning {@code null} produces
 * {@code 204 No Content}.
 * <p>
 * Annotated methods registered via {@link Router#registerResource(Object)} are adapted to this interface by
 * {@link ResourceMethod}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface RouteHandler {
	@Nullable
	Object handle(@NonNull Request request) throws Exception;
}
