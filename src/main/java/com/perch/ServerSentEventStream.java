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
import java.util.Iterator;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A handler result that opens a Server-Sent Event stream.
 * <p>
 * Wraps a lazy source of items; the connection stays open until the source is exhausted, it fails, or the client
 * disconnects. Each item is rendered to one frame:
 * <ul>
 *   <li>{@link ServerSentEvent} is written as-is</li>
 *   <li>{@link ServerSentEventComment} is written as a comment frame</li>
 *   <li>{@link String} becomes the event data</li>
 *   <li>{@link java.util.Map} or {@link java.util.Collection} is serialized to JSON data</li>
 *   <li>{@link Template} is rendered to data, with its target as the event type</li>
 * </ul>
 * {@code null} items are skipped. The source is pulled from a dedicated thread, so a blocking source does not delay
 * heartbeats or disconnect detection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventStream {
	@NonNull
	private final Iterator<?> events;
	@Nullable
	private final Duration heartbeatInterval;
	@Nullable
	private final String eventType;

	@NonNull
	public static Builder withEvents(@NonNull Iterator<?> events) {
		requireNonNull(events);
		return new Builder(events);
	}

	@NonNull
	public static Builder withEvents(@NonNull Iterable<?> events) {
		requireNonNull(events);
		return new Builder(events.iterator());
	}

	private ServerSentEventStream(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.heartbeatInterval != null && (builder.heartbeatInterval.isNegative() || builder.heartbeatInterval.isZero()))
			throw new IllegalArgumentException(format("Heartbeat interval must be positive, but was %s", builder.heartbeatInterval));

		String eventType = Utilities.trimAggressivelyToNull(builder.eventType);

		if (eventType != null && (eventType.indexOf('\n') >= 0 || eventType.indexOf('\r') >= 0))
			throw new IllegalArgumentException("Event type must not contain line breaks");

		this.events = builder.events;
		this.heartbeatInterval = builder.heartbeatInterval;
		this.eventType = eventType;
	}

	@NonNull
	public Iterator<?> getEvents() {
		return this.events;
	}

	/**
	 * How long the stream may be idle before a heartbeat comment is written.
	 *
	 * @return the interval, or {@link Optional#empty()} to use the configured default
	 */
	@NonNull
	public Optional<Duration> getHeartbeatInterval() {
		return Optional.ofNullable(this.heartbeatInterval);
	}

	/**
	 * Default event type for items that do not carry their own.
	 *
	 * @return the event type, if any
	 */
	@NonNull
	public Optional<String> getEventType() {
		return Optional.ofNullable(this.eventType);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{heartbeatInterval=%s, eventType=%s}", getClass().getSimpleName(),
				getHeartbeatInterval().map(Duration::toString).orElse("[default]"), getEventType().orElse("[not specified]"));
	}

	/**
	 * Builder used to construct instances of {@link ServerSentEventStream}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Iterator<?> events;
		@Nullable
		private Duration heartbeatInterval;
		@Nullable
		private String eventType;

		private Builder(@NonNull Iterator<?> events) {
			this.events = requireNonNull(events);
		}

		@NonNull
		public Builder heartbeatInterval(@Nullable Duration heartbeatInterval) {
			this.heartbeatInterval = heartbeatInterval;
			return this;
		}

		@NonNull
		public Builder eventType(@Nullable String eventType) {
			this.eventType = eventType;
			return this;
		}

		@NonNull
		public ServerSentEventStream build() {
			return new ServerSentEventStream(this);
		}
	}
}
