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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Encodes events and comments in the {@code text/event-stream} wire format.
 * <p>
 * An event block is an optional {@code event:} line, an optional {@code id:} line, an optional {@code retry:} line in
 * milliseconds and one {@code data:} line per payload line, terminated by a blank line. CR, LF and CRLF all split
 * payload lines. An event with no fields at all encodes as a heartbeat.
 * <p>
 * A comment is one {@code :}-prefixed line per comment line, terminated by a blank line. The heartbeat is the
 * payload-free comment {@code ":\n\n"}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class ServerSentEventFormatter {
	@NonNull
	static final String HEARTBEAT_FRAME;

	static {
		HEARTBEAT_FRAME = ":\n\n";
	}

	private ServerSentEventFormatter() {
		// Non-instantiable
	}

	@NonNull
	static String format(@NonNull ServerSentEvent serverSentEvent) {
		requireNonNull(serverSentEvent);

		StringBuilder frame = new StringBuilder(128);
		boolean hasField = false;

		String event = serverSentEvent.getEvent().orElse(null);

		if (event != null) {
			frame.append("event: ").append(event).append('\n');
			hasField = true;
		}

		String id = serverSentEvent.getId().orElse(null);

		if (id != null) {
			frame.append("id: ").append(id).append('\n');
			hasField = true;
		}

		Duration retry = serverSentEvent.getRetry().orElse(null);

		if (retry != null) {
			frame.append("retry: ").append(retry.toMillis()).append('\n');
			hasField = true;
		}

		String data = serverSentEvent.getData().orElse(null);

		if (data != null) {
			hasField = true;
			appendLines(frame, "data: ", "data: ", data);
		}

		if (!hasField)
			return HEARTBEAT_FRAME;

		return frame.append('\n').toString();
	}

	@NonNull
	static String format(@NonNull ServerSentEventComment serverSentEventComment) {
		requireNonNull(serverSentEventComment);

		if (serverSentEventComment.isHeartbeat())
			return HEARTBEAT_FRAME;

		StringBuilder frame = new StringBuilder(64);
		appendLines(frame, ": ", ":", serverSentEventComment.getComment());
		return frame.append('\n').toString();
	}

	// Emits one prefixed line per CR, LF or CRLF-delimited line of text, keeping a trailing empty line like split("\\R", -1)
	private static void appendLines(@NonNull StringBuilder frame,
																	@NonNull String prefix,
																	@NonNull String emptyLinePrefix,
																	@NonNull String text) {
		int length = text.length();
		int start = 0;

		for (int i = 0; i < length; i++) {
			char c = text.charAt(i);

			if (c == '\n' || c == '\r') {
				appendLine(frame, prefix, emptyLinePrefix, text, start, i);

				if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n')
					i++;

				start = i + 1;
			}
		}

		appendLine(frame, prefix, emptyLinePrefix, text, start, length);
	}

	private static void appendLine(@NonNull StringBuilder frame,
																 @NonNull String prefix,
																 @NonNull String emptyLinePrefix,
																 @NonNull String text,
																 int start,
																 int end) {
		if (end > start)
			frame.append(prefix).append(text, start, end);
		else
			frame.append(emptyLinePrefix);

		frame.append('\n');
	}
}
