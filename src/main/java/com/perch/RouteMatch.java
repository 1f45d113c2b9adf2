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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The result of a successful {@link Router#match(HttpMethod, String)}: the matched route plus the raw
 * (not yet type-converted) values of its path parameters.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RouteMatch {
	@NonNull
	private final Route route;
	@NonNull
	private final Map<@NonNull String, @NonNull String> pathParameters;

	public RouteMatch(@NonNull Route route,
										@NonNull Map<@NonNull String, @NonNull String> pathParameters) {
		requireNonNull(route);
		requireNonNull(pathParameters);

		this.route = route;
		this.pathParameters = Collections.unmodifiableMap(new LinkedHashMap<>(pathParameters));
	}

	@NonNull
	public Route getRoute() {
		return this.route;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getPathParameters() {
		return this.pathParameters;
	}

	@NonNull
	public Optional<String> getPathParameter(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.pathParameters.get(name));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{route=%s, pathParameters=%s}", getClass().getSimpleName(), getRoute(), getPathParameters());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RouteMatch routeMatch))
			return false;

		return Objects.equals(getRoute(), routeMatch.getRoute())
				&& Objects.equals(getPathParameters(), routeMatch.getPathParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRoute(), getPathParameters());
	}
}
