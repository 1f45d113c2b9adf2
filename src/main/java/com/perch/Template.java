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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A handler result that names a template and the variables to render it with.
 * <p>
 * Negotiates to {@code text/html; charset=utf-8}. Progressive templates are streamed chunk by chunk. Inside a
 * {@link ServerSentEventStream}, a template renders to one event whose type is {@link #getTarget()}, or
 * {@code fragment} when no target is set.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Template {
	@NonNull
	private final String name;
	@NonNull
	private final Map<@NonNull String, Object> context;
	@NonNull
	private final Boolean progressive;
	@Nullable
	private final String target;

	@NonNull
	public static Template of(@NonNull String name) {
		return withName(name).build();
	}

	@NonNull
	public static Builder withName(@NonNull String name) {
		requireNonNull(name);
		return new Builder(name);
	}

	private Template(@NonNull Builder builder) {
		requireNonNull(builder);

		String name = Utilities.trimAggressivelyToNull(builder.name);

		if (name == null)
			throw new IllegalArgumentException("Template name must not be blank");

		this.name = name;
		this.context = builder.context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
		this.progressive = builder.progressive == null ? false : builder.progressive;
		this.target = Utilities.trimAggressivelyToNull(builder.target);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Map<@NonNull String, Object> getContext() {
		return this.context;
	}

	@NonNull
	public Boolean isProgressive() {
		return this.progressive;
	}

	@NonNull
	public Optional<String> getTarget() {
		return Optional.ofNullable(this.target);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, progressive=%s, target=%s}", getClass().getSimpleName(), getName(), isProgressive(),
				getTarget().orElse("[not specified]"));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Template template))
			return false;

		return Objects.equals(getName(), template.getName())
				&& Objects.equals(getContext(), template.getContext())
				&& Objects.equals(isProgressive(), template.isProgressive())
				&& Objects.equals(getTarget(), template.getTarget());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getContext(), isProgressive(), getTarget());
	}

	/**
	 * Builder used to construct instances of {@link Template} via {@link Template#withName(String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String name;
		@Nullable
		private Map<@NonNull String, Object> context;
		@Nullable
		private Boolean progressive;
		@Nullable
		private String target;

		private Builder(@NonNull String name) {
			this.name = requireNonNull(name);
		}

		@NonNull
		public Builder context(@Nullable Map<@NonNull String, Object> context) {
			this.context = context;
			return this;
		}

		@NonNull
		public Builder progressive(@Nullable Boolean progressive) {
			this.progressive = progressive;
			return this;
		}

		@NonNull
		public Builder target(@Nullable String target) {
			this.target = target;
			return this;
		}

		@NonNull
		public Template build() {
			return new Template(this);
		}
	}
}
