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

import com.perch.exception.ConfigurationException;
import org.jspecify.annotations.NonNull;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Vends the arguments used to invoke a {@link ResourceMethod}.
 * <p>
 * Perch uses {@link DefaultResourceMethodParameterProvider} unless a different one is passed to
 * {@link Router#registerResource(Object, ResourceMethodParameterProvider)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ResourceMethodParameterProvider {
	/**
	 * For the given {@code request} and {@code resourceMethod}, vends the list of arguments to use when invoking the
	 * underlying Java method located at {@link ResourceMethod#getMethod()}.
	 * <p>
	 * The size of the returned list must exactly match the number of parameters the Java method declares.
	 *
	 * @param request        the matched request, with path parameters populated
	 * @param resourceMethod the resource method being invoked
	 * @return the arguments, or the empty list if the method takes none
	 */
	@NonNull
	List<Object> parameterValuesForResourceMethod(@NonNull Request request,
																								@NonNull ResourceMethod resourceMethod) throws IOException, InterruptedException;

	/**
	 * Checks, when {@code resourceMethod} is registered for {@code routePath}, that every parameter can be resolved.
	 *
	 * @param resourceMethod the resource method being registered
	 * @param routePath      the route it is registered for
	 * @throws ConfigurationException if a parameter can never be resolved
	 */
	default void validateResourceMethod(@NonNull ResourceMethod resourceMethod,
																			@NonNull RoutePath routePath) {
		// No checks by default
	}

	/**
	 * The types {@code resourceMethod} expects to be injected from {@link PerchConfig.Builder#provide(Class, java.util.function.Supplier)}.
	 *
	 * @param resourceMethod the resource method
	 * @param routePath      the route it is registered for
	 * @return the provided types it needs, empty if none
	 */
	@NonNull
	default Set<@NonNull Class<?>> providedTypesForResourceMethod(@NonNull ResourceMethod resourceMethod,
																															 @NonNull RoutePath routePath) {
		return Set.of();
	}

	@NonNull
	static ResourceMethodParameterProvider defaultInstance() {
		return DefaultResourceMethodParameterProvider.defaultInstance();
	}
}
