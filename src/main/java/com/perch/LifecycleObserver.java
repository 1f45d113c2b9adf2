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

import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only hook methods for observing server and request lifecycle events.
 * <p>
 * Perch catches exceptions thrown by these methods and surfaces them separately via {@link #didReceiveLogEvent(LogEvent)}.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method. It writes
 * log events to {@code java.util.logging}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called after a {@link Server} starts accepting connections.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after a {@link Server} stops.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called as soon as a request has been decoded, before routing.
	 */
	default void didStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called after the response for {@code request} has been fully written, or writing has failed.
	 *
	 * @param request            the request
	 * @param negotiatedResponse the response that was written, or {@code null} if only the failsafe response could be sent
	 * @param duration           how long handling took, including writing
	 * @param throwables         exceptions encountered along the way, in order; empty on success
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@Nullable NegotiatedResponse negotiatedResponse,
																				@NonNull Duration duration,
																				@NonNull List<@NonNull Throwable> throwables) {
		// No-op by default
	}

	/**
	 * Called after the headers of a Server-Sent Event stream have been sent.
	 */
	default void didEstablishServerSentEventConnection(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called after a Server-Sent Event stream has sent its terminating message.
	 */
	default void didTerminateServerSentEventConnection(@NonNull Request request,
																										 @NonNull ServerSentEventCloseReason closeReason) {
		// No-op by default
	}

	/**
	 * Called when Perch emits a log event.
	 * <p>
	 * Events with a throwable are logged at {@link Level#SEVERE}, others at {@link Level#WARNING}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger logger = Logger.getLogger(LifecycleObserver.class.getName());
		Throwable throwable = logEvent.getThrowable().orElse(null);
		String message = String.format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());

		if (throwable == null)
			logger.log(Level.WARNING, message);
		else
			logger.log(Level.SEVERE, message, throwable);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
