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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html">Server-Sent Event</a>: a data payload
 * with an optional event type, id and client reconnect-delay hint.
 * <p>
 * For example:
 * <pre>{@code  ServerSentEvent event = ServerSentEvent.withEvent("price")
 *   .data("{\"symbol\": \"ACME\", \"price\": 12.5}")
 *   .id("42")
 *   .retry(Duration.ofSeconds(5))
 *   .build();}</pre>
 * <p>
 * Multi-line data is legal and is written as one {@code data:} line per payload line. Event types and ids may not contain
 * line breaks, and ids may not contain NUL.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEvent {
	@Nullable
	private final String id;
	@Nullable
	private final String event;
	@Nullable
	private final String data;
	@Nullable
	private final Duration retry;

	@NonNull
	public static Builder withEvent(@Nullable String event) {
		return new Builder().event(event);
	}

	@NonNull
	public static Builder withData(@Nullable String data) {
		return new Builder().data(data);
	}

	/**
	 * An "empty" builder, useful for special cases like {@code retry}-only events.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	private ServerSentEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.id = builder.id;
		this.event = builder.event;
		this.data = builder.data;
		this.retry = builder.retry;

		if (this.retry != null && this.retry.isNegative())
			throw new IllegalArgumentException(format("%s 'retry' values must be non-negative. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), this.retry));

		if (this.event != null && containsLineBreaks(this.event))
			throw new IllegalArgumentException(format("%s 'event' values must not contain CR or LF characters. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), Utilities.printableString(this.event)));

		if (this.id != null && (containsLineBreaks(this.id) || this.id.indexOf('\u0000') >= 0))
			throw new IllegalArgumentException(format("%s 'id' values must not contain NUL, CR or LF characters. You supplied '%s'",
					ServerSentEvent.class.getSimpleName(), Utilities.printableString(this.id)));
	}

	@NonNull
	private static Boolean containsLineBreaks(@NonNull String string) {
		requireNonNull(string);
		return string.indexOf('\n') >= 0 || string.indexOf('\r') >= 0;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(4);

		if (this.event != null)
			components.add(format("event=%s", this.event));
		if (this.id != null)
			components.add(format("id=%s", this.id));
		if (this.retry != null)
			components.add(format("retry=%s", this.retry));
		if (this.data != null)
			components.add(format("data=%s", this.data.trim()));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEvent serverSentEvent))
			return false;

		return Objects.equals(this.id, serverSentEvent.id)
				&& Objects.equals(this.event, serverSentEvent.event)
				&& Objects.equals(this.data, serverSentEvent.data)
				&& Objects.equals(this.retry, serverSentEvent.retry);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.id, this.event, this.data, this.retry);
	}

	@NonNull
	public Optional<String> getId() {
		return Optional.ofNullable(this.id);
	}

	@NonNull
	public Optional<String> getEvent() {
		return Optional.ofNullable(this.event);
	}

	@NonNull
	public Optional<String> getData() {
		return Optional.ofNullable(this.data);
	}

	@NonNull
	public Optional<Duration> getRetry() {
		return Optional.ofNullable(this.retry);
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEvent}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String id;
		@Nullable
		private String event;
		@Nullable
		private String data;
		@Nullable
		private Duration retry;

		private Builder() {
			// Nothing to do
		}

		@NonNull
		public Builder id(@Nullable String id) {
			this.id = id;
			return this;
		}

		@NonNull
		public Builder event(@Nullable String event) {
			this.event = event;
			return this;
		}

		@NonNull
		public Builder data(@Nullable String data) {
			this.data = data;
			return this;
		}

		@NonNull
		public Builder retry(@Nullable Duration retry) {
			this.retry = retry;
			return this;
		}

		@NonNull
		public ServerSentEvent build() {
			return new ServerSentEvent(this);
		}
	}
}
