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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import com.perch.annotation.PathParameter;
import com.perch.annotation.QueryParameter;
import com.perch.annotation.RequestBody;
import com.perch.annotation.RequestHeader;
import com.perch.exception.ConfigurationException;
import com.perch.exception.IllegalPathParameterException;
import com.perch.exception.IllegalQueryParameterException;
import com.perch.exception.IllegalRequestBodyException;
import com.perch.exception.IllegalRequestHeaderException;
import com.perch.exception.MissingQueryParameterException;
import com.perch.exception.MissingRequestBodyException;
import com.perch.exception.MissingRequestHeaderException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Perch's standard {@link ResourceMethodParameterProvider}.
 * <p>
 * Arguments are resolved per parameter, in this order:
 * <ol>
 *   <li>{@link Request} and {@link RequestContext} parameters are injected by type</li>
 *   <li>{@link QueryParameter}, {@link RequestHeader} and {@link RequestBody} parameters are bound from the request</li>
 *   <li>{@link PathParameter} parameters, and parameters named like a route placeholder, are path parameters</li>
 *   <li>parameters of a type registered with {@link PerchConfig.Builder#provide(Class, java.util.function.Supplier)}
 *   receive a provided instance</li>
 *   <li>record parameters are bound from the query string for {@code GET} and {@code HEAD} requests and from the form or
 *   JSON body otherwise</li>
 * </ol>
 * Path parameter values are converted to the declared Java type. When conversion fails and the parameter accepts a
 * {@link String}, the raw value is passed instead; otherwise the request fails with {@code 400 Bad Request}.
 * <p>
 * Parameters that can never resolve, like a scalar named after no placeholder or a path parameter of an unsupported
 * type, fail registration with {@link ConfigurationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DefaultResourceMethodParameterProvider implements ResourceMethodParameterProvider {
	@NonNull
	private static final DefaultResourceMethodParameterProvider DEFAULT_INSTANCE;
	@NonNull
	private static final Map<@NonNull Class<?>, @NonNull Function<@NonNull String, @NonNull Object>> CONVERTERS_BY_TYPE;
	@NonNull
	private static final String FORM_CONTENT_TYPE;

	static {
		DEFAULT_INSTANCE = new DefaultResourceMethodParameterProvider();
		FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

		CONVERTERS_BY_TYPE = Map.ofEntries(
				Map.entry(Integer.class, Integer::valueOf),
				Map.entry(int.class, Integer::valueOf),
				Map.entry(Long.class, Long::valueOf),
				Map.entry(long.class, Long::valueOf),
				Map.entry(Double.class, Double::valueOf),
				Map.entry(double.class, Double::valueOf),
				Map.entry(Float.class, Float::valueOf),
				Map.entry(float.class, Float::valueOf),
				Map.entry(BigDecimal.class, BigDecimal::new),
				Map.entry(BigInteger.class, BigInteger::new),
				Map.entry(Boolean.class, DefaultResourceMethodParameterProvider::parseBoolean),
				Map.entry(boolean.class, DefaultResourceMethodParameterProvider::parseBoolean),
				Map.entry(UUID.class, UUID::fromString)
		);
	}

	// Where a parameter's argument comes from
	private enum ParameterSource {
		REQUEST,
		REQUEST_CONTEXT,
		QUERY_PARAMETER,
		REQUEST_HEADER,
		REQUEST_BODY,
		PATH_PARAMETER,
		PROVIDED_INSTANCE,
		BOUND_RECORD
	}

	@NonNull
	public static DefaultResourceMethodParameterProvider defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultResourceMethodParameterProvider() {
		// Stateless
	}

	@Override
	public void validateResourceMethod(@NonNull ResourceMethod resourceMethod,
																		 @NonNull RoutePath routePath) {
		requireNonNull(resourceMethod);
		requireNonNull(routePath);

		for (Parameter parameter : resourceMethod.getMethod().getParameters())
			parameterSourceFor(resourceMethod.getMethod(), parameter, routePath.getPathParameterTypesByName());
	}

	@Override
	@NonNull
	public Set<@NonNull Class<?>> providedTypesForResourceMethod(@NonNull ResourceMethod resourceMethod,
																															 @NonNull RoutePath routePath) {
		requireNonNull(resourceMethod);
		requireNonNull(routePath);

		Set<Class<?>> providedTypes = new LinkedHashSet<>();

		for (Parameter parameter : resourceMethod.getMethod().getParameters())
			if (parameterSourceFor(resourceMethod.getMethod(), parameter, routePath.getPathParameterTypesByName()) == ParameterSource.PROVIDED_INSTANCE)
				providedTypes.add(parameter.getType());

		return providedTypes;
	}

	@Override
	@NonNull
	public List<Object> parameterValuesForResourceMethod(@NonNull Request request,
																											 @NonNull ResourceMethod resourceMethod) throws IOException, InterruptedException {
		requireNonNull(request);
		requireNonNull(resourceMethod);

		RequestContext requestContext = RequestContext.getCurrent().orElseGet(() -> new RequestContext(request));
		Map<String, PathParameterType> pathParameterTypesByName = pathParameterTypesByName(request);
		Parameter[] parameters = resourceMethod.getMethod().getParameters();
		List<Object> parametersToPass = new ArrayList<>(parameters.length);

		for (Parameter parameter : parameters) {
			ParameterSource parameterSource = parameterSourceFor(resourceMethod.getMethod(), parameter, pathParameterTypesByName);
			parametersToPass.add(extractParameterValue(request, requestContext, parameter, parameterSource, pathParameterTypesByName));
		}

		return parametersToPass;
	}

	@NonNull
	private Map<@NonNull String, @NonNull PathParameterType> pathParameterTypesByName(@NonNull Request request) {
		requireNonNull(request);

		Route route = request.getRoute().orElse(null);

		if (route != null)
			return route.getRoutePath().getPathParameterTypesByName();

		// Invoked outside of routing, e.g. directly from a test
		Map<String, PathParameterType> pathParameterTypesByName = new LinkedHashMap<>();

		for (String pathParameterName : request.getPathParameters().keySet())
			pathParameterTypesByName.put(pathParameterName, PathParameterType.STRING);

		return pathParameterTypesByName;
	}

	@NonNull
	private ParameterSource parameterSourceFor(@NonNull Method method,
																						 @NonNull Parameter parameter,
																						 @NonNull Map<@NonNull String, @NonNull PathParameterType> pathParameterTypesByName) {
		requireNonNull(method);
		requireNonNull(parameter);
		requireNonNull(pathParameterTypesByName);

		Class<?> parameterType = parameter.getType();

		if (parameterType.equals(Request.class))
			return ParameterSource.REQUEST;

		if (parameterType.equals(RequestContext.class))
			return ParameterSource.REQUEST_CONTEXT;

		QueryParameter queryParameter = parameter.getAnnotation(QueryParameter.class);

		if (queryParameter != null) {
			requireConvertible(method, parameter, optionalElementType(method, parameter), "query parameter");
			bindingName(method, parameter, queryParameter.name(), QueryParameter.class);
			return ParameterSource.QUERY_PARAMETER;
		}

		RequestHeader requestHeader = parameter.getAnnotation(RequestHeader.class);

		if (requestHeader != null) {
			requireConvertible(method, parameter, optionalElementType(method, parameter), "request header");
			bindingName(method, parameter, requestHeader.name(), RequestHeader.class);
			return ParameterSource.REQUEST_HEADER;
		}

		if (parameter.getAnnotation(RequestBody.class) != null)
			return ParameterSource.REQUEST_BODY;

		PathParameter pathParameter = parameter.getAnnotation(PathParameter.class);
		String pathParameterName = pathParameter == null ? null : Utilities.trimAggressivelyToNull(pathParameter.value());

		if (pathParameterName == null && pathParameter != null)
			pathParameterName = bindingName(method, parameter, "", PathParameter.class);

		if (pathParameterName == null && parameter.isNamePresent() && pathParameterTypesByName.containsKey(parameter.getName()))
			pathParameterName = parameter.getName();

		if (pathParameterName != null) {
			if (!pathParameterTypesByName.containsKey(pathParameterName))
				throw new ConfigurationException(format("Parameter '%s' of %s names no placeholder of its route. Placeholders are %s",
						pathParameterName, method, pathParameterTypesByName.keySet()));

			requireConvertible(method, parameter, parameterType, "path parameter");
			return ParameterSource.PATH_PARAMETER;
		}

		if (isConvertible(parameterType)) {
			if (!parameter.isNamePresent())
				throw new ConfigurationException(format("Cannot determine the name of parameter %s of %s. Annotate it with @%s or compile with -parameters",
						parameter, method, PathParameter.class.getSimpleName()));

			throw new ConfigurationException(format("Parameter '%s' of %s is neither an injectable type nor a placeholder of its route. Placeholders are %s",
					parameter.getName(), method, pathParameterTypesByName.keySet()));
		}

		return parameterType.isRecord() ? ParameterSource.BOUND_RECORD : ParameterSource.PROVIDED_INSTANCE;
	}

	@Nullable
	private Object extractParameterValue(@NonNull Request request,
																			 @NonNull RequestContext requestContext,
																			 @NonNull Parameter parameter,
																			 @NonNull ParameterSource parameterSource,
																			 @NonNull Map<@NonNull String, @NonNull PathParameterType> pathParameterTypesByName) throws IOException, InterruptedException {
		requireNonNull(request);
		requireNonNull(requestContext);
		requireNonNull(parameter);
		requireNonNull(parameterSource);
		requireNonNull(pathParameterTypesByName);

		switch (parameterSource) {
			case REQUEST:
				return request;
			case REQUEST_CONTEXT:
				return requestContext;
			case QUERY_PARAMETER:
				return extractQueryParameterValue(request, parameter);
			case REQUEST_HEADER:
				return extractRequestHeaderValue(request, parameter);
			case REQUEST_BODY:
				return extractRequestBodyValue(request, requestContext, parameter);
			case PATH_PARAMETER:
				return extractPathParameterValue(request, parameter, pathParameterTypesByName);
			case PROVIDED_INSTANCE:
				return requestContext.getProvidedInstance(parameter.getType())
						.orElseThrow(() -> new IllegalStateException(format("No provider is registered for %s", parameter.getType().getName())));
			case BOUND_RECORD:
				return requestContext.getProvidedInstance(parameter.getType())
						.<Object>map(instance -> instance)
						.orElseGet(() -> extractRecordValue(request, requestContext, parameter));
			default:
				throw new IllegalStateException(format("Unhandled %s %s", ParameterSource.class.getSimpleName(), parameterSource.name()));
		}
	}

	@Nullable
	private Object extractQueryParameterValue(@NonNull Request request,
																						@NonNull Parameter parameter) {
		requireNonNull(request);
		requireNonNull(parameter);

		QueryParameter queryParameter = parameter.getAnnotation(QueryParameter.class);
		String name = bindingName(null, parameter, queryParameter.name(), QueryParameter.class);
		String rawValue = request.getQueryParameter(name).orElse(null);
		boolean wrappedInOptional = parameter.getType().equals(Optional.class);

		if (rawValue == null) {
			if (wrappedInOptional)
				return Optional.empty();

			if (queryParameter.optional())
				return null;

			throw new MissingQueryParameterException(format("Query parameter '%s' is required", name), name);
		}

		Object value;

		try {
			value = convert(rawValue, optionalElementType(null, parameter));
		} catch (IllegalArgumentException e) {
			throw new IllegalQueryParameterException(format("Illegal value '%s' for query parameter '%s'", rawValue, name), e, name, rawValue);
		}

		return wrappedInOptional ? Optional.of(value) : value;
	}

	@Nullable
	private Object extractRequestHeaderValue(@NonNull Request request,
																					 @NonNull Parameter parameter) {
		requireNonNull(request);
		requireNonNull(parameter);

		RequestHeader requestHeader = parameter.getAnnotation(RequestHeader.class);
		String name = bindingName(null, parameter, requestHeader.name(), RequestHeader.class);
		String rawValue = request.getHeader(name).orElse(null);
		boolean wrappedInOptional = parameter.getType().equals(Optional.class);

		if (rawValue == null) {
			if (wrappedInOptional)
				return Optional.empty();

			if (requestHeader.optional())
				return null;

			throw new MissingRequestHeaderException(format("Request header '%s' is required", name), name);
		}

		Object value;

		try {
			value = convert(rawValue, optionalElementType(null, parameter));
		} catch (IllegalArgumentException e) {
			throw new IllegalRequestHeaderException(format("Illegal value '%s' for request header '%s'", rawValue, name), e, name, rawValue);
		}

		return wrappedInOptional ? Optional.of(value) : value;
	}

	@Nullable
	private Object extractRequestBodyValue(@NonNull Request request,
																				 @NonNull RequestContext requestContext,
																				 @NonNull Parameter parameter) throws IOException, InterruptedException {
		requireNonNull(request);
		requireNonNull(requestContext);
		requireNonNull(parameter);

		boolean wrappedInOptional = parameter.getType().equals(Optional.class);
		boolean optional = wrappedInOptional || parameter.getAnnotation(RequestBody.class).optional();
		Type bodyType = wrappedInOptional ? ((ParameterizedType) parameter.getParameterizedType()).getActualTypeArguments()[0] : parameter.getParameterizedType();
		byte[] body = request.getBody();
		Object value = null;

		if (body.length > 0) {
			if (bodyType.equals(byte[].class)) {
				value = body;
			} else if (bodyType.equals(String.class)) {
				value = new String(body, request.getCharset().orElse(StandardCharsets.UTF_8));
			} else {
				JsonElement jsonElement = request.getContentType().filter(FORM_CONTENT_TYPE::equals).isPresent()
						? jsonObjectFor(Utilities.extractQueryParametersFromRawQuery(request.getBodyAsString()))
						: parseJson(request.getBodyAsString(), bodyType);

				value = fromJson(requestContext, jsonElement, bodyType);
			}
		}

		if (value == null && !optional)
			throw new MissingRequestBodyException("A request body is required");

		return wrappedInOptional ? Optional.ofNullable(value) : value;
	}

	@NonNull
	private Object extractRecordValue(@NonNull Request request,
																		@NonNull RequestContext requestContext,
																		@NonNull Parameter parameter) {
		requireNonNull(request);
		requireNonNull(requestContext);
		requireNonNull(parameter);

		Type recordType = parameter.getParameterizedType();
		JsonElement jsonElement;

		if (request.getHttpMethod() == HttpMethod.GET || request.getHttpMethod() == HttpMethod.HEAD) {
			jsonElement = jsonObjectFor(request.getQueryParameters());
		} else {
			String body;

			try {
				body = request.getBodyAsString();
			} catch (IOException e) {
				throw new IllegalRequestBodyException("Unable to read request body", e);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while reading request body", e);
			}

			if (body.isEmpty())
				jsonElement = new JsonObject();
			else if (request.getContentType().filter(FORM_CONTENT_TYPE::equals).isPresent())
				jsonElement = jsonObjectFor(Utilities.extractQueryParametersFromRawQuery(body));
			else
				jsonElement = parseJson(body, recordType);
		}

		Object value = fromJson(requestContext, jsonElement, recordType);

		if (value == null)
			throw new MissingRequestBodyException(format("Unable to bind the request to %s", recordType.getTypeName()));

		return value;
	}

	@Nullable
	private Object extractPathParameterValue(@NonNull Request request,
																					 @NonNull Parameter parameter,
																					 @NonNull Map<@NonNull String, @NonNull PathParameterType> pathParameterTypesByName) {
		requireNonNull(request);
		requireNonNull(parameter);
		requireNonNull(pathParameterTypesByName);

		PathParameter pathParameter = parameter.getAnnotation(PathParameter.class);
		String pathParameterName = pathParameter == null ? null : Utilities.trimAggressivelyToNull(pathParameter.value());

		if (pathParameterName == null)
			pathParameterName = parameter.getName();

		String rawValue = request.getPathParameter(pathParameterName).orElse(null);

		if (rawValue == null)
			throw new IllegalStateException(format("No value was matched for path parameter '%s'", pathParameterName));

		Class<?> parameterType = parameter.getType();

		if (parameterType.equals(String.class) || parameterType.equals(CharSequence.class))
			return rawValue;

		if (parameterType.equals(Object.class)) {
			// The route's own conversion decides the natural value, e.g. Long for integer placeholders
			PathParameterType pathParameterType = pathParameterTypesByName.getOrDefault(pathParameterName, PathParameterType.STRING);
			return pathParameterType.convert(rawValue).orElse(rawValue);
		}

		try {
			return convert(rawValue, parameterType);
		} catch (IllegalArgumentException e) {
			throw new IllegalPathParameterException(format("Illegal value '%s' for path parameter '%s'", rawValue, pathParameterName),
					e, pathParameterName, rawValue);
		}
	}

	@NonNull
	private JsonElement parseJson(@NonNull String json,
																@NonNull Type type) {
		requireNonNull(json);
		requireNonNull(type);

		try {
			return JsonParser.parseString(json);
		} catch (JsonParseException e) {
			throw new IllegalRequestBodyException(format("Request body is not valid JSON for %s", type.getTypeName()), e);
		}
	}

	@Nullable
	private Object fromJson(@NonNull RequestContext requestContext,
													@NonNull JsonElement jsonElement,
													@NonNull Type type) {
		requireNonNull(requestContext);
		requireNonNull(jsonElement);
		requireNonNull(type);

		try {
			return requestContext.getGson().fromJson(jsonElement, TypeToken.get(type));
		} catch (JsonParseException | IllegalArgumentException e) {
			throw new IllegalRequestBodyException(format("Unable to read request data as %s", type.getTypeName()), e);
		}
	}

	// Single values become strings and repeated ones arrays; Gson converts strings to numbers and booleans itself
	@NonNull
	private JsonObject jsonObjectFor(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> parameters) {
		requireNonNull(parameters);

		JsonObject jsonObject = new JsonObject();

		for (Map.Entry<String, Set<String>> entry : parameters.entrySet()) {
			if (entry.getValue().size() == 1) {
				jsonObject.addProperty(entry.getKey(), entry.getValue().iterator().next());
			} else {
				JsonArray jsonArray = new JsonArray();
				entry.getValue().forEach(jsonArray::add);
				jsonObject.add(entry.getKey(), jsonArray);
			}
		}

		return jsonObject;
	}

	@NonNull
	private Object convert(@NonNull String rawValue,
												 @NonNull Class<?> type) {
		requireNonNull(rawValue);
		requireNonNull(type);

		if (type.equals(String.class) || type.equals(CharSequence.class) || type.equals(Object.class))
			return rawValue;

		Function<String, Object> converter = CONVERTERS_BY_TYPE.get(type);

		if (converter == null)
			throw new IllegalStateException(format("No converter for %s", type.getName()));

		return converter.apply(rawValue);
	}

	@NonNull
	private Boolean isConvertible(@NonNull Class<?> type) {
		requireNonNull(type);

		return type.equals(String.class) || type.equals(CharSequence.class) || type.equals(Object.class)
				|| CONVERTERS_BY_TYPE.containsKey(type);
	}

	private void requireConvertible(@NonNull Method method,
																	@NonNull Parameter parameter,
																	@NonNull Class<?> type,
																	@NonNull String description) {
		requireNonNull(method);
		requireNonNull(parameter);
		requireNonNull(type);
		requireNonNull(description);

		if (!isConvertible(type))
			throw new ConfigurationException(format("Unsupported type %s for %s parameter %s of %s", type.getName(), description, parameter, method));
	}

	// The T of an Optional<T> parameter, otherwise the parameter's own type
	@NonNull
	private Class<?> optionalElementType(@Nullable Method method,
																			 @NonNull Parameter parameter) {
		requireNonNull(parameter);

		if (!parameter.getType().equals(Optional.class))
			return parameter.getType();

		Type parameterizedType = parameter.getParameterizedType();

		if (parameterizedType instanceof ParameterizedType) {
			Type elementType = ((ParameterizedType) parameterizedType).getActualTypeArguments()[0];

			if (elementType instanceof Class<?>)
				return (Class<?>) elementType;
		}

		throw new ConfigurationException(format("Parameter %s of %s must declare a concrete %s type argument", parameter,
				method == null ? "[unknown]" : method, Optional.class.getSimpleName()));
	}

	@NonNull
	private String bindingName(@Nullable Method method,
														 @NonNull Parameter parameter,
														 @NonNull String annotatedName,
														 @NonNull Class<?> annotationType) {
		requireNonNull(parameter);
		requireNonNull(annotatedName);
		requireNonNull(annotationType);

		String name = Utilities.trimAggressivelyToNull(annotatedName);

		if (name != null)
			return name;

		if (!parameter.isNamePresent())
			throw new ConfigurationException(format("Cannot determine the name of parameter %s of %s. Name it in @%s or compile with -parameters",
					parameter, method == null ? "[unknown]" : method, annotationType.getSimpleName()));

		return parameter.getName();
	}

	@NonNull
	private static Boolean parseBoolean(@NonNull String value) {
		requireNonNull(value);

		if ("true".equalsIgnoreCase(value))
			return true;
		if ("false".equalsIgnoreCase(value))
			return false;

		throw new IllegalArgumentException(format("'%s' is not a boolean", value));
	}
}
