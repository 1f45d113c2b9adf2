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
import com.perch.exception.ConfigurationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a Perch instance is configured.
 * <p>
 * Only the {@link Router} is required; everything else has a sensible default:
 * <ul>
 *   <li>no middleware and no error handlers</li>
 *   <li>{@link DefaultContentNegotiator} backed by a plain {@link Gson}</li>
 *   <li>{@link LifecycleObserver#defaultInstance()}, which logs to {@code java.util.logging}</li>
 *   <li>a 15 second Server-Sent Event heartbeat interval</li>
 *   <li>a 16MB request body limit</li>
 *   <li>a {@link DefaultServer} on {@code 127.0.0.1:8000}</li>
 * </ul>
 * The router is compiled when the configuration is built, so route conflicts fail at startup. So do resource methods
 * whose parameters need an instance no {@link Builder#provide(Class, Supplier)} call supplies.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class PerchConfig {
	@NonNull
	private static final Duration DEFAULT_SERVER_SENT_EVENT_HEARTBEAT_INTERVAL;
	@NonNull
	private static final Long DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Integer DEFAULT_PORT;

	static {
		DEFAULT_SERVER_SENT_EVENT_HEARTBEAT_INTERVAL = Duration.ofSeconds(15);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 16L * 1024 * 1024;
		DEFAULT_HOST = "127.0.0.1";
		DEFAULT_PORT = 8000;
	}

	@NonNull
	private final Router router;
	@NonNull
	private final List<@NonNull Middleware> middleware;
	@NonNull
	private final Map<@NonNull Integer, @NonNull ErrorHandler> errorHandlersByStatusCode;
	@NonNull
	private final Map<@NonNull Class<? extends Throwable>, @NonNull ErrorHandler> errorHandlersByExceptionType;
	@NonNull
	private final Map<@NonNull Class<?>, @NonNull Supplier<?>> providersByType;
	@NonNull
	private final Gson gson;
	@Nullable
	private final TemplateRenderer templateRenderer;
	@NonNull
	private final ContentNegotiator contentNegotiator;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Boolean debug;
	@NonNull
	private final Duration serverSentEventHeartbeatInterval;
	@Nullable
	private final Duration serverSentEventRetry;
	@Nullable
	private final String serverSentEventCloseEvent;
	@NonNull
	private final Long maximumRequestSizeInBytes;
	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@Nullable
	private final Server server;

	@NonNull
	public static Builder withRouter(@NonNull Router router) {
		requireNonNull(router);
		return new Builder(router);
	}

	private PerchConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.serverSentEventHeartbeatInterval != null
				&& (builder.serverSentEventHeartbeatInterval.isNegative() || builder.serverSentEventHeartbeatInterval.isZero()))
			throw new IllegalArgumentException(format("Server-Sent Event heartbeat interval must be positive, but was %s",
					builder.serverSentEventHeartbeatInterval));

		if (builder.serverSentEventRetry != null && builder.serverSentEventRetry.isNegative())
			throw new IllegalArgumentException("Server-Sent Event retry must not be negative");

		if (builder.maximumRequestSizeInBytes != null && builder.maximumRequestSizeInBytes < 0)
			throw new IllegalArgumentException("Maximum request size must not be negative");

		if (builder.port != null && (builder.port < 0 || builder.port > 65535))
			throw new IllegalArgumentException(format("Illegal port %d", builder.port));

		String serverSentEventCloseEvent = Utilities.trimAggressivelyToNull(builder.serverSentEventCloseEvent);

		if (serverSentEventCloseEvent != null && (serverSentEventCloseEvent.indexOf('\n') >= 0 || serverSentEventCloseEvent.indexOf('\r') >= 0))
			throw new IllegalArgumentException("Server-Sent Event close event must not contain line breaks");

		this.router = builder.router.compile();
		this.middleware = builder.middleware == null ? List.of() : List.copyOf(builder.middleware);
		this.errorHandlersByStatusCode = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errorHandlersByStatusCode));
		this.errorHandlersByExceptionType = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errorHandlersByExceptionType));
		this.providersByType = Collections.unmodifiableMap(new LinkedHashMap<>(builder.providersByType));
		this.gson = builder.gson != null ? builder.gson : new Gson();
		this.templateRenderer = builder.templateRenderer;
		this.contentNegotiator = builder.contentNegotiator != null ? builder.contentNegotiator : DefaultContentNegotiator.with(getGson(), this.templateRenderer);
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.debug = builder.debug != null ? builder.debug : false;
		this.serverSentEventHeartbeatInterval = builder.serverSentEventHeartbeatInterval != null ? builder.serverSentEventHeartbeatInterval : DEFAULT_SERVER_SENT_EVENT_HEARTBEAT_INTERVAL;
		this.serverSentEventRetry = builder.serverSentEventRetry;
		this.serverSentEventCloseEvent = serverSentEventCloseEvent;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.port = builder.port != null ? builder.port : DEFAULT_PORT;
		this.server = builder.server;

		validateProvidedTypes();
	}

	private void validateProvidedTypes() {
		for (Route route : getRouter().getRoutes()) {
			if (!(route.getRouteHandler() instanceof ResourceMethod))
				continue;

			ResourceMethod resourceMethod = (ResourceMethod) route.getRouteHandler();
			Set<Class<?>> providedTypes = resourceMethod.getResourceMethodParameterProvider()
					.providedTypesForResourceMethod(resourceMethod, route.getRoutePath());

			for (Class<?> providedType : providedTypes)
				if (!getProvidersByType().containsKey(providedType))
					throw new ConfigurationException(format("%s needs an instance of %s, but no provider is registered for it. " +
							"Register one with %s.%s#provide", resourceMethod.getMethod(), providedType.getName(),
							PerchConfig.class.getSimpleName(), Builder.class.getSimpleName()));
		}
	}

	@NonNull
	public Router getRouter() {
		return this.router;
	}

	@NonNull
	public List<@NonNull Middleware> getMiddleware() {
		return this.middleware;
	}

	@NonNull
	public Map<@NonNull Integer, @NonNull ErrorHandler> getErrorHandlersByStatusCode() {
		return this.errorHandlersByStatusCode;
	}

	@NonNull
	public Map<@NonNull Class<? extends Throwable>, @NonNull ErrorHandler> getErrorHandlersByExceptionType() {
		return this.errorHandlersByExceptionType;
	}

	@NonNull
	public Map<@NonNull Class<?>, @NonNull Supplier<?>> getProvidersByType() {
		return this.providersByType;
	}

	@NonNull
	public Gson getGson() {
		return this.gson;
	}

	@NonNull
	public Optional<TemplateRenderer> getTemplateRenderer() {
		return Optional.ofNullable(this.templateRenderer);
	}

	@NonNull
	public ContentNegotiator getContentNegotiator() {
		return this.contentNegotiator;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * Whether diagnostics such as stack traces are exposed in responses. Never enable in production.
	 *
	 * @return {@code true} if debug mode is on
	 */
	@NonNull
	public Boolean getDebug() {
		return this.debug;
	}

	@NonNull
	public Duration getServerSentEventHeartbeatInterval() {
		return this.serverSentEventHeartbeatInterval;
	}

	/**
	 * Reconnect delay hint written as a {@code retry:} frame when a Server-Sent Event stream opens.
	 *
	 * @return the retry hint, if configured
	 */
	@NonNull
	public Optional<Duration> getServerSentEventRetry() {
		return Optional.ofNullable(this.serverSentEventRetry);
	}

	/**
	 * Event type written with data {@code complete} when a Server-Sent Event source is exhausted.
	 *
	 * @return the close event type, if configured
	 */
	@NonNull
	public Optional<String> getServerSentEventCloseEvent() {
		return Optional.ofNullable(this.serverSentEventCloseEvent);
	}

	@NonNull
	public Long getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	/**
	 * The transport to run on; if not specified, {@link Perch} creates a {@link DefaultServer} for {@link #getHost()}
	 * and {@link #getPort()}.
	 *
	 * @return the server, if one was specified
	 */
	@NonNull
	public Optional<Server> getServer() {
		return Optional.ofNullable(this.server);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{router=%s, middleware=%s, debug=%s, host=%s, port=%s}", getClass().getSimpleName(),
				getRouter(), getMiddleware(), getDebug(), getHost(), getPort());
	}

	/**
	 * Builder used to construct instances of {@link PerchConfig} via {@link PerchConfig#withRouter(Router)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Router router;
		@Nullable
		private List<@NonNull Middleware> middleware;
		@NonNull
		private final Map<@NonNull Integer, @NonNull ErrorHandler> errorHandlersByStatusCode;
		@NonNull
		private final Map<@NonNull Class<? extends Throwable>, @NonNull ErrorHandler> errorHandlersByExceptionType;
		@NonNull
		private final Map<@NonNull Class<?>, @NonNull Supplier<?>> providersByType;
		@Nullable
		private Gson gson;
		@Nullable
		private TemplateRenderer templateRenderer;
		@Nullable
		private ContentNegotiator contentNegotiator;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private Boolean debug;
		@Nullable
		private Duration serverSentEventHeartbeatInterval;
		@Nullable
		private Duration serverSentEventRetry;
		@Nullable
		private String serverSentEventCloseEvent;
		@Nullable
		private Long maximumRequestSizeInBytes;
		@Nullable
		private String host;
		@Nullable
		private Integer port;
		@Nullable
		private Server server;

		private Builder(@NonNull Router router) {
			this.router = requireNonNull(router);
			this.errorHandlersByStatusCode = new LinkedHashMap<>();
			this.errorHandlersByExceptionType = new LinkedHashMap<>();
			this.providersByType = new LinkedHashMap<>();
		}

		/**
		 * Middleware in the order it should run for inbound requests.
		 */
		@NonNull
		public Builder middleware(@Nullable List<@NonNull Middleware> middleware) {
			this.middleware = middleware == null ? null : new ArrayList<>(middleware);
			return this;
		}

		@NonNull
		public Builder errorHandler(@NonNull Integer statusCode,
																@NonNull ErrorHandler errorHandler) {
			requireNonNull(statusCode);
			requireNonNull(errorHandler);

			this.errorHandlersByStatusCode.put(statusCode, errorHandler);
			return this;
		}

		@NonNull
		public Builder errorHandler(@NonNull Class<? extends Throwable> exceptionType,
																@NonNull ErrorHandler errorHandler) {
			requireNonNull(exceptionType);
			requireNonNull(errorHandler);

			this.errorHandlersByExceptionType.put(exceptionType, errorHandler);
			return this;
		}

		/**
		 * Registers a supplier for resource method parameters of exactly {@code type}, e.g. a repository or client.
		 * <p>
		 * The supplier is called once per parameter per request; return a shared instance to provide a singleton.
		 */
		@NonNull
		public <T> Builder provide(@NonNull Class<T> type,
															 @NonNull Supplier<? extends T> supplier) {
			requireNonNull(type);
			requireNonNull(supplier);

			this.providersByType.put(type, supplier);
			return this;
		}

		@NonNull
		public Builder gson(@Nullable Gson gson) {
			this.gson = gson;
			return this;
		}

		@NonNull
		public Builder templateRenderer(@Nullable TemplateRenderer templateRenderer) {
			this.templateRenderer = templateRenderer;
			return this;
		}

		@NonNull
		public Builder contentNegotiator(@Nullable ContentNegotiator contentNegotiator) {
			this.contentNegotiator = contentNegotiator;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder debug(@Nullable Boolean debug) {
			this.debug = debug;
			return this;
		}

		@NonNull
		public Builder serverSentEventHeartbeatInterval(@Nullable Duration serverSentEventHeartbeatInterval) {
			this.serverSentEventHeartbeatInterval = serverSentEventHeartbeatInterval;
			return this;
		}

		@NonNull
		public Builder serverSentEventRetry(@Nullable Duration serverSentEventRetry) {
			this.serverSentEventRetry = serverSentEventRetry;
			return this;
		}

		@NonNull
		public Builder serverSentEventCloseEvent(@Nullable String serverSentEventCloseEvent) {
			this.serverSentEventCloseEvent = serverSentEventCloseEvent;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Long maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		@NonNull
		public Builder server(@Nullable Server server) {
			this.server = server;
			return this;
		}

		@NonNull
		public PerchConfig build() {
			return new PerchConfig(this);
		}
	}
}
