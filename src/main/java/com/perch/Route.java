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
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Associates a {@link RoutePath} and a set of HTTP methods with a {@link RouteHandler}.
 * <p>
 * Instances are created by {@link Router#register(String, RouteHandler, Set)} and are never modified afterward.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Route {
	@NonNull
	private final RoutePath routePath;
	@NonNull
	private final RouteHandler routeHandler;
	@NonNull
	private final Set<@NonNull HttpMethod> httpMethods;
	@Nullable
	private final String name;

	Route(@NonNull RoutePath routePath,
				@NonNull RouteHandler routeHandler,
				@NonNull Set<@NonNull HttpMethod> httpMethods,
				@Nullable String name) {
		requireNonNull(routePath);
		requireNonNull(routeHandler);
		requireNonNull(httpMethods);

		if (httpMethods.isEmpty())
			throw new IllegalArgumentException(format("At least one HTTP method is required for route %s", routePath.getPattern()));

		this.routePath = routePath;
		this.routeHandler = routeHandler;
		this.httpMethods = Collections.unmodifiableSet(EnumSet.copyOf(httpMethods));
		this.name = name;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethods=%s, pattern=%s, name=%s}", getClass().getSimpleName(),
				getHttpMethods(), getRoutePath().getPattern(), getName().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Route route))
			return false;

		return Objects.equals(getRoutePath(), route.getRoutePath())
				&& Objects.equals(getRouteHandler(), route.getRouteHandler())
				&& Objects.equals(getHttpMethods(), route.getHttpMethods())
				&& Objects.equals(getName(), route.getName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRoutePath(), getRouteHandler(), getHttpMethods(), getName());
	}

	@NonNull
	public RoutePath getRoutePath() {
		return this.routePath;
	}

	@NonNull
	public RouteHandler getRouteHandler() {
		return this.routeHandler;
	}

	@NonNull
	public Set<@NonNull HttpMethod> getHttpMethods() {
		return this.httpMethods;
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}
}
