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
 * Why a Server-Sent Event stream ended.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ServerSentEventCloseReason {
	/**
	 * The event source ran out of events.
	 */
	EXHAUSTED,
	/**
	 * The client disconnected, or a write to it failed.
	 */
	CLIENT_DISCONNECTED,
	/**
	 * The event source threw; an error frame was written if the connection was still writable.
	 */
	FAILED
}
