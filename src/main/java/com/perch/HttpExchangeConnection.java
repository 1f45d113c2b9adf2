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

import com.sun.net.httpserver.HttpExchange;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import static java.util.Objects.requireNonNull;

/**
 * Adapts one {@link HttpExchange} to the {@link Connection} protocol.
 * <p>
 * The JDK server does not report client disconnects directly. Once the request body is exhausted, {@link #receive()}
 * blocks until a write fails or the response completes, then reports {@link InboundMessage#disconnect()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class HttpExchangeConnection implements Connection {
	private static final int READ_BUFFER_SIZE = 8_192;

	@NonNull
	private final HttpExchange httpExchange;
	@NonNull
	private final ConnectionMetadata connectionMetadata;
	@NonNull
	private final CountDownLatch closedLatch;
	private volatile boolean requestBodyExhausted;

	HttpExchangeConnection(@NonNull HttpExchange httpExchange) {
		requireNonNull(httpExchange);

		URI requestUri = httpExchange.getRequestURI();
		String rawUrl = requestUri.getRawPath() == null ? "/" : requestUri.getRawPath();

		if (requestUri.getRawQuery() != null)
			rawUrl = rawUrl + "?" + requestUri.getRawQuery();

		this.httpExchange = httpExchange;
		this.connectionMetadata = ConnectionMetadata.with(httpExchange.getRequestMethod(), rawUrl)
				.headers(httpExchange.getRequestHeaders())
				.clientAddress(httpExchange.getRemoteAddress())
				.serverAddress(httpExchange.getLocalAddress())
				.httpVersion(httpExchange.getProtocol())
				.build();
		this.closedLatch = new CountDownLatch(1);
	}

	@NonNull
	@Override
	public ConnectionMetadata getMetadata() {
		return this.connectionMetadata;
	}

	@NonNull
	@Override
	public InboundMessage receive() throws IOException, InterruptedException {
		if (!this.requestBodyExhausted) {
			InputStream inputStream = this.httpExchange.getRequestBody();
			byte[] buffer = new byte[READ_BUFFER_SIZE];
			int bytesRead = inputStream.read(buffer);

			if (bytesRead < 0) {
				this.requestBodyExhausted = true;
				return InboundMessage.withBody(Utilities.emptyByteArray(), false);
			}

			return InboundMessage.withBody(Arrays.copyOf(buffer, bytesRead), true);
		}

		this.closedLatch.await();
		return InboundMessage.disconnect();
	}

	@Override
	public void sendResponseStart(@NonNull Integer statusCode,
																@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) throws IOException {
		requireNonNull(statusCode);
		requireNonNull(headers);

		long responseLength = 0;
		String contentLength = null;

		for (Map.Entry<String, Set<String>> entry : headers.entrySet()) {
			// The JDK server computes Content-Length itself from the length passed to sendResponseHeaders
			if ("Content-Length".equalsIgnoreCase(entry.getKey())) {
				contentLength = entry.getValue().isEmpty() ? null : entry.getValue().iterator().next();
				responseLength = contentLength == null ? 0 : Long.parseLong(contentLength);
				responseLength = responseLength == 0 ? -1 : responseLength;
				continue;
			}

			for (String value : entry.getValue())
				this.httpExchange.getResponseHeaders().add(entry.getKey(), value);
		}

		if (StatusCode.isBodyless(statusCode)) {
			responseLength = -1;
		} else if ("HEAD".equalsIgnoreCase(this.httpExchange.getRequestMethod())) {
			// For HEAD the JDK server ignores the length argument and sends only headers set by hand
			if (contentLength != null)
				this.httpExchange.getResponseHeaders().set("Content-Length", contentLength);

			responseLength = -1;
		}

		try {
			this.httpExchange.sendResponseHeaders(statusCode, responseLength);
		} catch (IOException e) {
			this.closedLatch.countDown();
			throw e;
		}
	}

	@Override
	public void sendResponseBody(@NonNull byte[] body,
															 @NonNull Boolean moreBody) throws IOException {
		requireNonNull(body);
		requireNonNull(moreBody);

		try {
			OutputStream outputStream = this.httpExchange.getResponseBody();

			if (body.length > 0) {
				outputStream.write(body);
				outputStream.flush();
			}

			if (!moreBody) {
				outputStream.close();
				this.closedLatch.countDown();
			}
		} catch (IOException e) {
			this.closedLatch.countDown();
			throw e;
		}
	}
}
