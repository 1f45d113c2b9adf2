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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A Server-Sent Event comment: one or more lines beginning with {@code :}, ignored by clients.
 * <p>
 * Handlers may yield comments from a {@link ServerSentEventStream} alongside events. The engine itself uses an
 * empty comment as its idle heartbeat.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerSentEventComment {
	@NonNull
	private static final ServerSentEventComment HEARTBEAT;

	static {
		HEARTBEAT = new ServerSentEventComment("");
	}

	@NonNull
	private final String comment;

	@NonNull
	public static ServerSentEventComment withComment(@NonNull String comment) {
		requireNonNull(comment);
		return comment.isEmpty() ? HEARTBEAT : new ServerSentEventComment(comment);
	}

	/**
	 * The payload-free comment written when a stream is idle.
	 *
	 * @return the heartbeat comment
	 */
	@NonNull
	public static ServerSentEventComment heartbeat() {
		return HEARTBEAT;
	}

	private ServerSentEventComment(@NonNull String comment) {
		this.comment = requireNonNull(comment);
	}

	@NonNull
	public String getComment() {
		return this.comment;
	}

	@NonNull
	public Boolean isHeartbeat() {
		return this.comment.isEmpty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{comment=%s}", getClass().getSimpleName(), getComment());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerSentEventComment serverSentEventComment))
			return false;

		return Objects.equals(getComment(), serverSentEventComment.getComment());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getComment());
	}
}
