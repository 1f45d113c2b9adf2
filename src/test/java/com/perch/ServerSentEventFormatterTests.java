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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerSentEventFormatterTests {
	@Test
	public void fieldsAreWrittenInOrder() {
		ServerSentEvent serverSentEvent = ServerSentEvent.withEvent("update")
				.id("42")
				.retry(Duration.ofSeconds(2))
				.data("hello")
				.build();

		assertEquals("event: update\nid: 42\nretry: 2000\ndata: hello\n\n", ServerSentEventFormatter.format(serverSentEvent));
	}

	@Test
	public void everyLineBreakStyleSplitsData() {
		ServerSentEvent serverSentEvent = ServerSentEvent.withData("a\nb\r\nc\rd").build();
		assertEquals("data: a\ndata: b\ndata: c\ndata: d\n\n", ServerSentEventFormatter.format(serverSentEvent));
	}

	@Test
	public void emptyLinesInDataArePreserved() {
		assertEquals("data: a\ndata: \ndata: \n\n", ServerSentEventFormatter.format(ServerSentEvent.withData("a\n\n").build()));
		assertEquals("data: \n\n", ServerSentEventFormatter.format(ServerSentEvent.withData("").build()));
	}

	@Test
	public void eventWithoutFieldsIsHeartbeat() {
		assertEquals(":\n\n", ServerSentEventFormatter.format(ServerSentEvent.withDefaults().build()));
		assertEquals(":\n\n", ServerSentEventFormatter.format(ServerSentEventComment.heartbeat()));
	}

	@Test
	public void commentsArePrefixedPerLine() {
		assertEquals(": first\n: second\n:\n\n", ServerSentEventFormatter.format(ServerSentEventComment.withComment("first\nsecond\n")));
	}

	@Test
	public void lineBreaksInSingleLineFieldsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> ServerSentEvent.withEvent("bad\nevent").build());
		assertThrows(IllegalArgumentException.class, () -> ServerSentEvent.withData("ok").id("bad\rid").build());
	}
}
