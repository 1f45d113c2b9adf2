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

/**
 * Kinds of {@link LogEvent} that Perch emits via {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * A route handler or middleware threw an unexpected exception; the client receives {@code 500}.
	 */
	REQUEST_PROCESSING_FAILED,
	/**
	 * A registered error handler itself failed while handling another error.
	 */
	ERROR_HANDLER_FAILED,
	/**
	 * Writing a response to the transport failed, typically because the client went away.
	 */
	RESPONSE_WRITING_FAILED,
	/**
	 * A streaming response body failed after its status and headers had already been sent.
	 */
	STREAMING_RESPONSE_FAILED,
	/**
	 * A Server-Sent Event source failed unexpectedly; the stream is closed after an error frame.
	 */
	SERVER_SENT_EVENT_STREAM_FAILED,
	/**
	 * A single Server-Sent Event item could not be rendered and was skipped.
	 */
	SERVER_SENT_EVENT_RENDER_FAILED,
	/**
	 * A {@link LifecycleObserver} callback threw.
	 */
	LIFECYCLE_OBSERVER_FAILED,
	/**
	 * The transport could not decode or accept a connection.
	 */
	SERVER_INTERNAL_ERROR
}
