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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.perch.Utilities.normalizePath;
import static com.perch.Utilities.trimAggressivelyToEmpty;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A route pattern such as {@code /users/{userId:integer}/files/{file:rest-of-path}}, parsed into {@link PathSegment}s.
 * <p>
 * Placeholders use single-mustache syntax, {@code {name}} or {@code {name:type}}, where {@code type} is one of
 * {@code string}, {@code integer}, {@code float} or {@code rest-of-path}. The following patterns are rejected with a
 * {@link ConfigurationException} at construction time:
 * <ul>
 *   <li>angle-bracket placeholders, e.g. {@code /users/<id>}</li>
 *   <li>placeholders that do not span their entire segment, e.g. {@code /users/prefix{id}}</li>
 *   <li>unknown types, e.g. {@code {id:uuid}}</li>
 *   <li>the same placeholder name used twice</li>
 *   <li>a {@code rest-of-path} placeholder anywhere but the final segment</li>
 * </ul>
 * Patterns are normalized the same way request paths are: duplicate and trailing slashes are removed,
 * and a leading slash is added if missing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RoutePath {
	@NonNull
	private static final Pattern PLACEHOLDER_PATTERN;
	@NonNull
	private static final Pattern PARAMETER_NAME_PATTERN;
	@NonNull
	private static final Pattern ANGLE_BRACKET_PLACEHOLDER_PATTERN;

	static {
		PLACEHOLDER_PATTERN = Pattern.compile("^\\{([^{}:]*)(?::([^{}]*))?\\}$");
		PARAMETER_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
		ANGLE_BRACKET_PLACEHOLDER_PATTERN = Pattern.compile("<(?:([^<>:]+):)?([^<>]+)>");
	}

	@NonNull
	private final String pattern;
	@NonNull
	private final List<@NonNull PathSegment> pathSegments;
	@NonNull
	private final Map<@NonNull String, @NonNull PathParameterType> pathParameterTypesByName;

	/**
	 * Parses a route pattern.
	 *
	 * @param pattern the pattern, e.g. {@code /users/{id:integer}}
	 * @return the parsed pattern
	 * @throws ConfigurationException if the pattern is malformed
	 */
	@NonNull
	public static RoutePath fromPattern(@NonNull String pattern) {
		requireNonNull(pattern);
		return new RoutePath(pattern);
	}

	private RoutePath(@NonNull String pattern) {
		requireNonNull(pattern);

		if (ANGLE_BRACKET_PLACEHOLDER_PATTERN.matcher(pattern).find())
			throw new ConfigurationException(format("Route pattern '%s' uses unsupported '<name>' placeholder syntax. " +
					"Use '{name}' or '{name:type}' instead, for example '%s'", pattern, suggestedPattern(pattern)));

		this.pattern = normalizePath(trimAggressivelyToEmpty(pattern));

		List<PathSegment> pathSegments = new ArrayList<>();
		Map<String, PathParameterType> pathParameterTypesByName = new LinkedHashMap<>();

		for (String token : this.pattern.split("/")) {
			if (token.length() == 0)
				continue;

			PathSegment pathSegment = parsePathSegment(token);

			if (pathSegment.isParameter()) {
				String parameterName = pathSegment.getParameterName().get();

				if (pathParameterTypesByName.containsKey(parameterName))
					throw new ConfigurationException(format("Duplicate placeholder name '%s' in route pattern '%s'", parameterName, pattern));

				pathParameterTypesByName.put(parameterName, pathSegment.getParameterType().get());
			}

			pathSegments.add(pathSegment);
		}

		for (int i = 0; i < pathSegments.size() - 1; ++i)
			if (pathSegments.get(i).getParameterType().orElse(null) == PathParameterType.REST_OF_PATH)
				throw new ConfigurationException(format("Placeholder '%s' in route pattern '%s' is of type '%s' and must be the final segment",
						pathSegments.get(i).getParameterName().get(), pattern, PathParameterType.REST_OF_PATH.getTag()));

		this.pathSegments = Collections.unmodifiableList(pathSegments);
		this.pathParameterTypesByName = Collections.unmodifiableMap(pathParameterTypesByName);
	}

	@NonNull
	private PathSegment parsePathSegment(@NonNull String token) {
		requireNonNull(token);

		Matcher matcher = PLACEHOLDER_PATTERN.matcher(token);

		if (!matcher.matches()) {
			if (token.indexOf('{') >= 0 || token.indexOf('}') >= 0)
				throw new ConfigurationException(format("Malformed segment '%s' in route pattern '%s'. " +
						"A placeholder must span its entire segment, for example '/users/{id}'", token, this.pattern));

			return PathSegment.withLiteral(token);
		}

		String parameterName = matcher.group(1).trim();
		String tag = matcher.group(2) == null ? null : matcher.group(2).trim();

		if (!PARAMETER_NAME_PATTERN.matcher(parameterName).matches())
			throw new ConfigurationException(format("Illegal placeholder name '%s' in route pattern '%s'", parameterName, this.pattern));

		PathParameterType pathParameterType = tag == null ? PathParameterType.STRING : PathParameterType.fromTag(tag).orElse(null);

		if (pathParameterType == null)
			throw new ConfigurationException(format("Unknown placeholder type '%s' in route pattern '%s'. Supported types are " +
					"'string', 'integer', 'float' and 'rest-of-path'", tag, this.pattern));

		return PathSegment.withParameter(parameterName, pathParameterType);
	}

	@NonNull
	private static String suggestedPattern(@NonNull String pattern) {
		requireNonNull(pattern);

		Matcher matcher = ANGLE_BRACKET_PLACEHOLDER_PATTERN.matcher(pattern);
		StringBuilder suggestion = new StringBuilder();

		while (matcher.find()) {
			String tag = matcher.group(1) == null ? null : suggestedTag(matcher.group(1).trim());
			String name = matcher.group(2).trim();
			matcher.appendReplacement(suggestion, Matcher.quoteReplacement(tag == null ? format("{%s}", name) : format("{%s:%s}", name, tag)));
		}

		matcher.appendTail(suggestion);
		return suggestion.toString();
	}

	@Nullable
	private static String suggestedTag(@NonNull String converterName) {
		requireNonNull(converterName);

		switch (converterName) {
			case "int":
				return PathParameterType.INTEGER.getTag();
			case "float":
				return PathParameterType.FLOAT.getTag();
			case "path":
				return PathParameterType.REST_OF_PATH.getTag();
			default:
				return null;
		}
	}

	/**
	 * The normalized pattern, e.g. {@code /users/{id:integer}}.
	 *
	 * @return the pattern
	 */
	@NonNull
	public String getPattern() {
		return this.pattern;
	}

	@NonNull
	public List<@NonNull PathSegment> getPathSegments() {
		return this.pathSegments;
	}

	@NonNull
	public Optional<PathParameterType> getPathParameterType(@NonNull String pathParameterName) {
		requireNonNull(pathParameterName);
		return Optional.ofNullable(this.pathParameterTypesByName.get(pathParameterName));
	}

	@NonNull
	public Map<@NonNull String, @NonNull PathParameterType> getPathParameterTypesByName() {
		return this.pathParameterTypesByName;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{pattern=%s}", getClass().getSimpleName(), getPattern());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RoutePath routePath))
			return false;

		return Objects.equals(getPathSegments(), routePath.getPathSegments());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPathSegments());
	}
}
