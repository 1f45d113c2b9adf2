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

import com.perch.exception.HttpException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns request failures into responses.
 * <p>
 * {@link HttpException}s are offered to the error handler registered for the exception's type (or nearest supertype),
 * then to the one registered for its status code. Unexpected exceptions are logged and offered to the {@code 500}
 * handler, then to the type handler. Without a handler, or if the handler itself fails, a minimal plain-text response
 * is produced.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ErrorPipeline {
	@NonNull
	private static final String DEFAULT_CONTENT_TYPE;

	static {
		DEFAULT_CONTENT_TYPE = "text/plain; charset=utf-8";
	}

	@NonNull
	private final PerchConfig perchConfig;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	ErrorPipeline(@NonNull PerchConfig perchConfig,
								@NonNull LifecycleObserver lifecycleObserver) {
		this.perchConfig = requireNonNull(perchConfig);
		this.lifecycleObserver = requireNonNull(lifecycleObserver);
	}

	@NonNull
	NegotiatedResponse handleHttpException(@NonNull Request request,
																				 @NonNull HttpException httpException) {
		requireNonNull(request);
		requireNonNull(httpException);

		Integer statusCode = httpException.getStatusCode();
		ErrorHandler errorHandler = errorHandlerForExceptionType(httpException.getClass(), HttpException.class);

		if (errorHandler == null)
			errorHandler = getPerchConfig().getErrorHandlersByStatusCode().get(statusCode);

		if (errorHandler != null) {
			NegotiatedResponse negotiatedResponse = invokeErrorHandler(errorHandler, request, httpException);

			if (negotiatedResponse != null) {
				// Handlers rarely pick a status; a plain 200 means "use the error's"
				if (negotiatedResponse.getStatusCode() == 200)
					negotiatedResponse = negotiatedResponse.withStatus(statusCode);

				return withMissingHeaders(negotiatedResponse, httpException.getHeaders());
			}
		}

		String detail = httpException.getDetail().orElse(null);
		String body = detail == null ? format("Error %d", statusCode) : detail;

		if (getPerchConfig().getDebug() && detail != null)
			body = format("%d: %s", statusCode, detail);

		return defaultResponse(statusCode, body, httpException.getHeaders());
	}

	@NonNull
	NegotiatedResponse handleUnexpectedException(@NonNull Request request,
																							 @NonNull Throwable throwable) {
		requireNonNull(request);
		requireNonNull(throwable);

		log(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, format("500 %s %s", request.getHttpMethod().name(), request.getPath()))
				.throwable(throwable)
				.request(request)
				.build());

		ErrorHandler errorHandler = getPerchConfig().getErrorHandlersByStatusCode().get(500);

		if (errorHandler == null)
			errorHandler = errorHandlerForExceptionType(throwable.getClass(), Throwable.class);

		if (errorHandler != null) {
			NegotiatedResponse negotiatedResponse = invokeErrorHandler(errorHandler, request, throwable);

			if (negotiatedResponse != null)
				return negotiatedResponse.getStatusCode() == 200 ? negotiatedResponse.withStatus(500) : negotiatedResponse;
		}

		String body = getPerchConfig().getDebug() ? Utilities.stackTraceFor(throwable) : "Internal Server Error";
		return defaultResponse(500, body, Map.of());
	}

	// Walks from the exception's own type up to and including upperBound
	@Nullable
	private ErrorHandler errorHandlerForExceptionType(@NonNull Class<?> exceptionType,
																										@NonNull Class<? extends Throwable> upperBound) {
		requireNonNull(exceptionType);
		requireNonNull(upperBound);

		Map<Class<? extends Throwable>, ErrorHandler> errorHandlersByExceptionType = getPerchConfig().getErrorHandlersByExceptionType();

		for (Class<?> currentType = exceptionType; currentType != null && upperBound.isAssignableFrom(currentType); currentType = currentType.getSuperclass()) {
			ErrorHandler errorHandler = errorHandlersByExceptionType.get(currentType);

			if (errorHandler != null)
				return errorHandler;
		}

		return null;
	}

	@Nullable
	private NegotiatedResponse invokeErrorHandler(@NonNull ErrorHandler errorHandler,
																								@NonNull Request request,
																								@NonNull Throwable throwable) {
		requireNonNull(errorHandler);
		requireNonNull(request);
		requireNonNull(throwable);

		try {
			Object result = errorHandler.handle(request, throwable);
			return getPerchConfig().getContentNegotiator().negotiate(request, result);
		} catch (Exception e) {
			log(LogEvent.with(LogEventType.ERROR_HANDLER_FAILED, format("Error handler failed while handling %s for %s %s",
							throwable.getClass().getSimpleName(), request.getHttpMethod().name(), request.getPath()))
					.throwable(e)
					.request(request)
					.build());

			return null;
		}
	}

	@NonNull
	private NegotiatedResponse withMissingHeaders(@NonNull NegotiatedResponse negotiatedResponse,
																								@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		requireNonNull(negotiatedResponse);
		requireNonNull(headers);

		Map<String, Set<String>> missingHeaders = new LinkedHashMap<>();

		for (Map.Entry<String, Set<String>> entry : headers.entrySet())
			if (!negotiatedResponse.getHeaders().containsKey(entry.getKey()))
				missingHeaders.put(entry.getKey(), entry.getValue());

		return missingHeaders.isEmpty() ? negotiatedResponse : negotiatedResponse.withHeaders(missingHeaders);
	}

	@NonNull
	private MarshaledResponse defaultResponse(@NonNull Integer statusCode,
																						@NonNull String body,
																						@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		requireNonNull(statusCode);
		requireNonNull(body);
		requireNonNull(headers);

		Map<String, Set<String>> responseHeaders = Utilities.caseInsensitiveHeaders(headers);
		responseHeaders.put("Content-Type", Set.of(DEFAULT_CONTENT_TYPE));

		return MarshaledResponse.withStatusCode(statusCode)
				.headers(responseHeaders)
				.body(body.getBytes(StandardCharsets.UTF_8))
				.build();
	}

	private void log(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		getLifecycleObserver().didReceiveLogEvent(logEvent);
	}

	@NonNull
	private PerchConfig getPerchConfig() {
		return this.perchConfig;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
