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
 * The rest of the request pipeline, as seen from a {@link Middleware}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Next {
	/**
	 * Passes {@code request} down the pipeline and returns the response produced below this point.
	 *
	 * @param request the request to pass on, possibly a rewritten copy of the one received
	 * @return the response
	 * @throws Exception if anything below fails
	 */
	@NonNull
	NegotiatedResponse proceed(@NonNull Request request) throws Exception;
}
