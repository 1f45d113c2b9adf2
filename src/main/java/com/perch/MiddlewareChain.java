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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Composes an ordered list of {@link Middleware} around a terminal {@link Next}.
 * <p>
 * For middleware {@code [M1, M2]} the inbound order is {@code M1, M2, terminal} and the outbound order is
 * {@code terminal, M2, M1}. Chains are immutable; compose once at startup and reuse the result for every request.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MiddlewareChain {
	@NonNull
	private final List<@NonNull Middleware> middleware;

	@NonNull
	public static MiddlewareChain withMiddleware(@Nullable List<@NonNull Middleware> middleware) {
		return new MiddlewareChain(middleware == null ? List.of() : middleware);
	}

	private MiddlewareChain(@NonNull List<@NonNull Middleware> middleware) {
		requireNonNull(middleware);

		for (Middleware current : middleware)
			requireNonNull(current, "Middleware list must not contain null elements");

		this.middleware = List.copyOf(middleware);
	}

	/**
	 * Wraps {@code terminal} so that calling the result runs every middleware, then {@code terminal}.
	 *
	 * @param terminal the innermost step
	 * @return the composed pipeline
	 */
	@NonNull
	public Next compose(@NonNull Next terminal) {
		requireNonNull(terminal);

		Next next = terminal;

		// Wrap from the inside out so the first middleware ends up outermost
		for (int i = getMiddleware().size() - 1; i >= 0; --i) {
			Middleware current = getMiddleware().get(i);
			Next inner = next;
			next = request -> {
				NegotiatedResponse negotiatedResponse = current.handle(request, inner);

				if (negotiatedResponse == null)
					throw new IllegalStateException(format("%s returned null instead of a %s", current,
							NegotiatedResponse.class.getSimpleName()));

				return negotiatedResponse;
			};
		}

		return next;
	}

	@NonNull
	public List<@NonNull Middleware> getMiddleware() {
		return this.middleware;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{middleware=%s}", getClass().getSimpleName(), getMiddleware());
	}
}
