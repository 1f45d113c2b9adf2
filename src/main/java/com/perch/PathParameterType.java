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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Types a route pattern placeholder may declare via {@code {name:type}} syntax.
 * <p>
 * A placeholder with no declared type is {@link #STRING}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum PathParameterType {
	/**
	 * One path segment of any content, e.g. {@code {slug}} or {@code {slug:string}}.
	 */
	STRING("string", "[^/]+"),
	/**
	 * One path segment of digits only, e.g. {@code {id:integer}}. Converts to {@link Long}, or to {@link BigInteger}
	 * for values too large for a {@code long}.
	 */
	INTEGER("integer", "\\d+"),
	/**
	 * One path segment of digits with an optional decimal part, e.g. {@code {price:float}}. Converts to {@link Double}.
	 */
	FLOAT("float", "\\d+(?:\\.\\d+)?"),
	/**
	 * Everything that remains of the path, slashes included, e.g. {@code {file:rest-of-path}}.
	 * Only legal as the final segment of a pattern.
	 */
	REST_OF_PATH("rest-of-path", ".+");

	@NonNull
	private static final Map<@NonNull String, @NonNull PathParameterType> PATH_PARAMETER_TYPES_BY_TAG;

	static {
		PATH_PARAMETER_TYPES_BY_TAG = Arrays.stream(PathParameterType.values())
				.collect(Collectors.toUnmodifiableMap(PathParameterType::getTag, Function.identity()));
	}

	@NonNull
	private final String tag;
	@NonNull
	private final Pattern pattern;

	PathParameterType(@NonNull String tag,
										@NonNull String regex) {
		requireNonNull(tag);
		requireNonNull(regex);

		this.tag = tag;
		this.pattern = Pattern.compile(regex);
	}

	@NonNull
	public static Optional<PathParameterType> fromTag(@Nullable String tag) {
		if (tag == null)
			return Optional.empty();

		return Optional.ofNullable(PATH_PARAMETER_TYPES_BY_TAG.get(tag));
	}

	/**
	 * Converts a raw path value to this type's natural Java representation.
	 *
	 * @param rawValue the raw value extracted from the request path
	 * @return the converted value, or {@link Optional#empty()} if the raw value is not of this type
	 */
	@NonNull
	public Optional<Object> convert(@NonNull String rawValue) {
		requireNonNull(rawValue);

		if (!getPattern().matcher(rawValue).matches())
			return Optional.empty();

		switch (this) {
			case INTEGER:
				return Optional.of(convertInteger(rawValue));
			case FLOAT:
				return Optional.of(Double.valueOf(rawValue));
			default:
				return Optional.of(rawValue);
		}
	}

	@NonNull
	private static Object convertInteger(@NonNull String rawValue) {
		requireNonNull(rawValue);

		BigInteger value = new BigInteger(rawValue);
		return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
	}

	@NonNull
	public Boolean matches(@NonNull String rawValue) {
		requireNonNull(rawValue);
		return convert(rawValue).isPresent();
	}

	/**
	 * The tag used in route patterns, e.g. {@code "integer"}.
	 *
	 * @return the tag
	 */
	@NonNull
	public String getTag() {
		return this.tag;
	}

	@NonNull
	public Pattern getPattern() {
		return this.pattern;
	}
}
