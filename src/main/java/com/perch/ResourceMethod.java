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
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link RouteHandler} backed by an annotated Java method on a resource object.
 * <p>
 * Acquired by {@link Router#registerResource(Object)}; applications rarely construct these directly.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ResourceMethod implements RouteHandler {
	@NonNull
	private final Object resource;
	@NonNull
	private final Method method;
	@NonNull
	private final ResourceMethodParameterProvider resourceMethodParameterProvider;

	@NonNull
	public static ResourceMethod withMethod(@NonNull Object resource,
																					@NonNull Method method,
																					@NonNull ResourceMethodParameterProvider resourceMethodParameterProvider) {
		requireNonNull(resource);
		requireNonNull(method);
		requireNonNull(resourceMethodParameterProvider);

		return new ResourceMethod(resource, method, resourceMethodParameterProvider);
	}

	private ResourceMethod(@NonNull Object resource,
												 @NonNull Method method,
												 @NonNull ResourceMethodParameterProvider resourceMethodParameterProvider) {
		requireNonNull(resource);
		requireNonNull(method);
		requireNonNull(resourceMethodParameterProvider);

		if (!method.getDeclaringClass().isInstance(resource))
			throw new IllegalArgumentException(format("%s is not declared by %s", method, resource.getClass().getName()));

		this.resource = resource;
		this.method = method;
		this.resourceMethodParameterProvider = resourceMethodParameterProvider;
	}

	@Override
	@Nullable
	public Object handle(@NonNull Request request) throws Exception {
		requireNonNull(request);

		List<Object> parameterValues = getResourceMethodParameterProvider().parameterValuesForResourceMethod(request, this);

		if (parameterValues.size() != getMethod().getParameterCount())
			throw new IllegalStateException(format("%s vended %d arguments for %s, which takes %d",
					getResourceMethodParameterProvider().getClass().getSimpleName(), parameterValues.size(), getMethod(),
					getMethod().getParameterCount()));

		try {
			return getMethod().invoke(getResource(), parameterValues.toArray());
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();

			if (cause instanceof Exception exception)
				throw exception;
			if (cause instanceof Error error)
				throw error;

			throw e;
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s}", getClass().getSimpleName(), getMethod());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResourceMethod resourceMethod))
			return false;

		return getResource() == resourceMethod.getResource()
				&& Objects.equals(getMethod(), resourceMethod.getMethod());
	}

	@Override
	public int hashCode() {
		return Objects.hash(System.identityHashCode(getResource()), getMethod());
	}

	@NonNull
	public Object getResource() {
		return this.resource;
	}

	@NonNull
	public Method getMethod() {
		return this.method;
	}

	@NonNull
	public ResourceMethodParameterProvider getResourceMethodParameterProvider() {
		return this.resourceMethodParameterProvider;
	}
}
