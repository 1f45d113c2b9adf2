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
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Wraps an application's {@link LifecycleObserver} so that exceptions it throws never escape into request handling.
 * <p>
 * Callback failures are reported as {@link LogEventType#LIFECYCLE_OBSERVER_FAILED}; if logging itself fails, the
 * event goes to {@link LifecycleObserver#defaultInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class SafeLifecycleObserver implements LifecycleObserver {
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	SafeLifecycleObserver(@NonNull LifecycleObserver lifecycleObserver) {
		this.lifecycleObserver = requireNonNull(lifecycleObserver);
	}

	@Override
	public void didStartServer(@NonNull Server server) {
		requireNonNull(server);

		try {
			getLifecycleObserver().didStartServer(server);
		} catch (RuntimeException e) {
			reportFailure("didStartServer", e, null);
		}
	}

	@Override
	public void didStopServer(@NonNull Server server) {
		requireNonNull(server);

		try {
			getLifecycleObserver().didStopServer(server);
		} catch (RuntimeException e) {
			reportFailure("didStopServer", e, null);
		}
	}

	@Override
	public void didStartRequestHandling(@NonNull Request request) {
		requireNonNull(request);

		try {
			getLifecycleObserver().didStartRequestHandling(request);
		} catch (RuntimeException e) {
			reportFailure("didStartRequestHandling", e, request);
		}
	}

	@Override
	public void didFinishRequestHandling(@NonNull Request request,
																			 @Nullable NegotiatedResponse negotiatedResponse,
																			 @NonNull Duration duration,
																			 @NonNull List<@NonNull Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(duration);
		requireNonNull(throwables);

		try {
			getLifecycleObserver().didFinishRequestHandling(request, negotiatedResponse, duration, throwables);
		} catch (RuntimeException e) {
			reportFailure("didFinishRequestHandling", e, request);
		}
	}

	@Override
	public void didEstablishServerSentEventConnection(@NonNull Request request) {
		requireNonNull(request);

		try {
			getLifecycleObserver().didEstablishServerSentEventConnection(request);
		} catch (RuntimeException e) {
			reportFailure("didEstablishServerSentEventConnection", e, request);
		}
	}

	@Override
	public void didTerminateServerSentEventConnection(@NonNull Request request,
																										@NonNull ServerSentEventCloseReason closeReason) {
		requireNonNull(request);
		requireNonNull(closeReason);

		try {
			getLifecycleObserver().didTerminateServerSentEventConnection(request, closeReason);
		} catch (RuntimeException e) {
			reportFailure("didTerminateServerSentEventConnection", e, request);
		}
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (RuntimeException e) {
			LifecycleObserver.defaultInstance().didReceiveLogEvent(logEvent);
			LifecycleObserver.defaultInstance().didReceiveLogEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
					format("%s::didReceiveLogEvent failed", LifecycleObserver.class.getSimpleName())).throwable(e).build());
		}
	}

	private void reportFailure(@NonNull String callbackName,
														 @NonNull RuntimeException exception,
														 @Nullable Request request) {
		requireNonNull(callbackName);
		requireNonNull(exception);

		didReceiveLogEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
						format("An exception occurred while invoking %s::%s", LifecycleObserver.class.getSimpleName(), callbackName))
				.throwable(exception)
				.request(request)
				.build());
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
