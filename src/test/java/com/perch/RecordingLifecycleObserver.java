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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records lifecycle callbacks and log events so tests can assert on them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
class RecordingLifecycleObserver implements LifecycleObserver {
	@NonNull
	private final List<@NonNull LogEvent> logEvents = Collections.synchronizedList(new ArrayList<>());
	@NonNull
	private final List<@NonNull String> events = Collections.synchronizedList(new ArrayList<>());

	@Override
	public void didStartRequestHandling(@NonNull Request request) {
		this.events.add(String.format("start %s %s", request.getHttpMethod().name(), request.getPath()));
	}

	@Override
	public void didFinishRequestHandling(@NonNull Request request,
																			 @Nullable NegotiatedResponse negotiatedResponse,
																			 @NonNull Duration duration,
																			 @NonNull List<@NonNull Throwable> throwables) {
		this.events.add(String.format("finish %s %s %s", request.getHttpMethod().name(), request.getPath(),
				negotiatedResponse == null ? "none" : negotiatedResponse.getStatusCode()));
	}

	@Override
	public void didEstablishServerSentEventConnection(@NonNull Request request) {
		this.events.add("established");
	}

	@Override
	public void didTerminateServerSentEventConnection(@NonNull Request request,
																										@NonNull ServerSentEventCloseReason serverSentEventCloseReason) {
		this.events.add(String.format("terminated %s", serverSentEventCloseReason.name()));
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		this.logEvents.add(logEvent);
	}

	@NonNull
	public List<@NonNull LogEvent> getLogEvents() {
		synchronized (this.logEvents) {
			return List.copyOf(this.logEvents);
		}
	}

	@NonNull
	public List<@NonNull String> getEvents() {
		synchronized (this.events) {
			return List.copyOf(this.events);
		}
	}
}
