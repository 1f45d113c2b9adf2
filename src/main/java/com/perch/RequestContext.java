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

import com.google.gson.Gson;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Request-scoped state: the request being handled plus an attribute store that middleware can write and handlers can read.
 * <p>
 * The {@link Dispatcher} installs a fresh instance for the current thread around each request via
 * {@link #perform(RequestContext, Operation)}, which always clears it afterward, on the exception path too, so state never
 * leaks to the next request served by the same worker thread.
 * <p>
 * For example, an authentication middleware might do:
 * <pre>{@code  RequestContext.get().setAttribute("account", account);}</pre>
 * and a handler, or a resource method declaring a {@code RequestContext} parameter, might read it back with
 * {@code getAttribute("account", Account.class)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestContext {
	@NonNull
	private static final ThreadLocal<RequestContext> REQUEST_CONTEXT_HOLDER = new ThreadLocal<>();

	@NonNull
	private final Request request;
	@NonNull
	private final Gson gson;
	@NonNull
	private final Map<@NonNull Class<?>, @NonNull Supplier<?>> providersByType;
	@NonNull
	private final Map<@NonNull String, @NonNull Object> attributes;

	public RequestContext(@NonNull Request request) {
		this(request, new Gson(), Map.of());
	}

	/**
	 * Creates a context whose handlers bind JSON with {@code gson} and can be injected with instances from
	 * {@code providersByType}.
	 *
	 * @param request         the request being handled
	 * @param gson            the configured JSON serializer
	 * @param providersByType instance suppliers keyed by the type they provide
	 */
	public RequestContext(@NonNull Request request,
												@NonNull Gson gson,
												@NonNull Map<@NonNull Class<?>, @NonNull Supplier<?>> providersByType) {
		requireNonNull(request);
		requireNonNull(gson);
		requireNonNull(providersByType);

		this.request = request;
		this.gson = gson;
		this.providersByType = Map.copyOf(providersByType);
		this.attributes = new ConcurrentHashMap<>();
	}

	/**
	 * Runs {@code operation} with {@code requestContext} installed for the current thread, restoring whatever was
	 * installed before once the operation completes.
	 *
	 * @param requestContext the context to install
	 * @param operation      the operation to run
	 * @param <T>            the operation's result type
	 * @return the operation's result
	 * @throws Exception if the operation throws
	 */
	@Nullable
	public static <T> T perform(@NonNull RequestContext requestContext,
															@NonNull Operation<T> operation) throws Exception {
		requireNonNull(requestContext);
		requireNonNull(operation);

		RequestContext previousRequestContext = REQUEST_CONTEXT_HOLDER.get();
		REQUEST_CONTEXT_HOLDER.set(requestContext);

		try {
			return operation.perform(requestContext);
		} finally {
			if (previousRequestContext == null)
				REQUEST_CONTEXT_HOLDER.remove();
			else
				REQUEST_CONTEXT_HOLDER.set(previousRequestContext);
		}
	}

	@NonNull
	public static Optional<RequestContext> getCurrent() {
		return Optional.ofNullable(REQUEST_CONTEXT_HOLDER.get());
	}

	/**
	 * The context for the current thread.
	 *
	 * @return the context
	 * @throws IllegalStateException if no request is being handled on this thread
	 */
	@NonNull
	public static RequestContext get() {
		RequestContext requestContext = REQUEST_CONTEXT_HOLDER.get();

		if (requestContext == null)
			throw new IllegalStateException(format("No %s is available for this thread. It is only available while a request is being handled.",
					RequestContext.class.getSimpleName()));

		return requestContext;
	}

	/**
	 * The request as originally decoded by the dispatcher, before any middleware rewrites.
	 *
	 * @return the request
	 */
	@NonNull
	public Request getRequest() {
		return this.request;
	}

	@NonNull
	public Gson getGson() {
		return this.gson;
	}

	/**
	 * Vends an instance of {@code type} from the supplier registered for exactly that type.
	 *
	 * @param type the type to provide
	 * @param <T>  the provided type
	 * @return a provided instance, or {@link Optional#empty()} if no supplier is registered for {@code type}
	 */
	@NonNull
	public <T> Optional<T> getProvidedInstance(@NonNull Class<T> type) {
		requireNonNull(type);

		Supplier<?> supplier = this.providersByType.get(type);

		if (supplier == null)
			return Optional.empty();

		Object instance = supplier.get();

		if (instance == null)
			throw new IllegalStateException(format("The provider for %s supplied null", type.getName()));

		return Optional.of(type.cast(instance));
	}

	public void setAttribute(@NonNull String name,
													 @Nullable Object value) {
		requireNonNull(name);

		if (value == null)
			this.attributes.remove(name);
		else
			this.attributes.put(name, value);
	}

	@NonNull
	public Optional<Object> getAttribute(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.attributes.get(name));
	}

	@NonNull
	public <T> Optional<T> getAttribute(@NonNull String name,
																			@NonNull Class<T> type) {
		requireNonNull(name);
		requireNonNull(type);

		Object value = this.attributes.get(name);

		if (value == null)
			return Optional.empty();

		if (!type.isInstance(value))
			throw new IllegalStateException(format("Attribute '%s' is of type %s, not %s", name, value.getClass().getName(), type.getName()));

		return Optional.of(type.cast(value));
	}

	@NonNull
	public Map<@NonNull String, @NonNull Object> getAttributes() {
		return Collections.unmodifiableMap(this.attributes);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{request=%s, attributes=%s}", getClass().getSimpleName(), getRequest(), this.attributes.keySet());
	}

	/**
	 * Work performed with a {@link RequestContext} installed.
	 *
	 * @param <T> the result type
	 */
	@FunctionalInterface
	public interface Operation<T> {
		@Nullable
		T perform(@NonNull RequestContext requestContext) throws Exception;
	}
}
