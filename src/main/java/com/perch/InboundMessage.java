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
import java.util.Arrays;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A message read from a {@link Connection}'s inbound side: either a chunk of request body or notice that the client went away.
 * <p>
 * A transport yields zero or more {@link Type#BODY} messages, the last of which has {@link #getMoreBody()} of {@code false},
 * and then, once the client disconnects, {@link Type#DISCONNECT}. After a disconnect, every further receive yields
 * {@link Type#DISCONNECT} again.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public final class InboundMessage {
	@NonNull
	private static final InboundMessage DISCONNECT;

	static {
		DISCONNECT = new InboundMessage(Type.DISCONNECT, Utilities.emptyByteArray(), false);
	}

	@NonNull
	private final Type type;
	@NonNull
	private final byte[] body;
	@NonNull
	private final Boolean moreBody;

	@NonNull
	public static InboundMessage withBody(@Nullable byte[] body,
																				@NonNull Boolean moreBody) {
		requireNonNull(moreBody);
		return new InboundMessage(Type.BODY, body == null ? Utilities.emptyByteArray() : body, moreBody);
	}

	@NonNull
	public static InboundMessage disconnect() {
		return DISCONNECT;
	}

	private InboundMessage(@NonNull Type type,
												 @NonNull byte[] body,
												 @NonNull Boolean moreBody) {
		this.type = requireNonNull(type);
		this.body = requireNonNull(body);
		this.moreBody = requireNonNull(moreBody);
	}

	@NonNull
	public Type getType() {
		return this.type;
	}

	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	@NonNull
	public Boolean getMoreBody() {
		return this.moreBody;
	}

	@NonNull
	public Boolean isDisconnect() {
		return getType() == Type.DISCONNECT;
	}

	@Override
	@NonNull
	public String toString() {
		if (isDisconnect())
			return format("%s{type=%s}", getClass().getSimpleName(), getType().name());

		return format("%s{type=%s, body=%d bytes, moreBody=%s}", getClass().getSimpleName(), getType().name(), getBody().length, getMoreBody());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof InboundMessage inboundMessage))
			return false;

		return Objects.equals(getType(), inboundMessage.getType())
				&& Arrays.equals(getBody(), inboundMessage.getBody())
				&& Objects.equals(getMoreBody(), inboundMessage.getMoreBody());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), Arrays.hashCode(getBody()), getMoreBody());
	}

	public enum Type {
		BODY,
		DISCONNECT
	}
}
