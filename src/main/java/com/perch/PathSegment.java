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

import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One {@code /}-delimited token of a compiled route pattern: either literal text or a typed placeholder.
 * <p>
 * For example, {@code /users/{id:integer}} compiles to a literal segment {@code users} followed by a
 * placeholder segment named {@code id} of type {@link PathParameterType#INTEGER}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class PathSegment {
	@Nullable
	private final String literal;
	@Nullable
	private final String parameterName;
	@Nullable
	private final PathParameterType parameterType;

	@NonNull
	public static PathSegment withLiteral(@NonNull String literal) {
		requireNonNull(literal);
		return new PathSegment(literal, null, null);
	}

	@NonNull
	public static PathSegment withParameter(@NonNull String parameterName,
																					@NonNull PathParameterType parameterType) {
		requireNonNull(parameterName);
		requireNonNull(parameterType);

		return new PathSegment(null, parameterName, parameterType);
	}

	private PathSegment(@Nullable String literal,
											@Nullable String parameterName,
											@Nullable PathParameterType parameterType) {
		this.literal = literal;
		this.parameterName = parameterName;
		this.parameterType = parameterType;
	}

	@NonNull
	public Boolean isLiteral() {
		return this.literal != null;
	}

	@NonNull
	public Boolean isParameter() {
		return this.parameterName != null;
	}

	@NonNull
	public Optional<String> getLiteral() {
		return Optional.ofNullable(this.literal);
	}

	@NonNull
	public Optional<String> getParameterName() {
		return Optional.ofNullable(this.parameterName);
	}

	@NonNull
	public Optional<PathParameterType> getParameterType() {
		return Optional.ofNullable(this.parameterType);
	}

	@Override
	@NonNull
	public String toString() {
		if (isLiteral())
			return format("%s{literal=%s}", getClass().getSimpleName(), this.literal);

		return format("%s{parameterName=%s, parameterType=%s}", getClass().getSimpleName(), this.parameterName, this.parameterType.getTag());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PathSegment pathSegment))
			return false;

		return Objects.equals(this.literal, pathSegment.literal)
				&& Objects.equals(this.parameterName, pathSegment.parameterName)
				&& Objects.equals(this.parameterType, pathSegment.parameterType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.literal, this.parameterName, this.parameterType);
	}
}
