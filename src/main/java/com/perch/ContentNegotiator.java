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
 * Maps whatever a route handler returned to a wire-ready {@link NegotiatedResponse}.
 * <p>
 * Perch uses {@link DefaultContentNegotiator} unless you supply your own via
 * {@link PerchConfig.Builder#contentNegotiator(ContentNegotiator)}. A custom negotiator typically handles a few extra
 * types and delegates everything else to the default.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ContentNegotiator {
	/**
	 * Negotiates {@code value} into a response.
	 *
	 * @param request the request being handled
	 * @param value   the handler's return value, may be {@code null}
	 * @return the negotiated response
	 * @throws Exception if negotiation fails, for example {@link com.perch.exception.NegotiationException} for an
	 *                   unsupported type or a template rendering failure
	 */
	@NonNull
	NegotiatedResponse negotiate(@NonNull Request request,
															 @Nullable Object value) throws Exception;
}
