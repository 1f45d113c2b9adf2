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

import com.perch.exception.HttpException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Handles one {@link Connection} from decoding through the last byte written.
 * <p>
 * For each connection the dispatcher:
 * <ol>
 *   <li>decodes the transport metadata into an immutable {@link Request}</li>
 *   <li>installs a {@link RequestContext} for the duration of handling</li>
 *   <li>runs the middleware chain around the terminal step, which matches a route, invokes its handler and
 *   negotiates the result</li>
 *   <li>turns {@link HttpException}s and unexpected exceptions into responses</li>
 *   <li>writes the response in buffered, streaming or Server-Sent Event form</li>
 * </ol>
 * Response start and the terminating body message are each sent exactly once, whatever fails along the way. If
 * nothing has been started when handling ends, a failsafe {@code 500} is sent.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Dispatcher {
	@NonNull
	private static final byte[] RENDER_ERROR_MARKER;
	@NonNull
	private static final byte[] FAILSAFE_BODY;

	static {
		RENDER_ERROR_MARKER = "<!-- perch: render error -->".getBytes(StandardCharsets.UTF_8);
		FAILSAFE_BODY = "HTTP 500: Internal Server Error".getBytes(StandardCharsets.UTF_8);
	}

	@NonNull
	private final PerchConfig perchConfig;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ErrorPipeline errorPipeline;
	@NonNull
	private final ServerSentEventEngine serverSentEventEngine;
	@NonNull
	private final Next pipeline;

	@NonNull
	public static Dispatcher withConfig(@NonNull PerchConfig perchConfig) {
		requireNonNull(perchConfig);
		return new Dispatcher(perchConfig);
	}

	private Dispatcher(@NonNull PerchConfig perchConfig) {
		requireNonNull(perchConfig);

		this.perchConfig = perchConfig;
		this.lifecycleObserver = new SafeLifecycleObserver(perchConfig.getLifecycleObserver());
		this.errorPipeline = new ErrorPipeline(perchConfig, this.lifecycleObserver);
		this.serverSentEventEngine = new ServerSentEventEngine(perchConfig, this.lifecycleObserver);
		this.pipeline = MiddlewareChain.withMiddleware(perchConfig.getMiddleware()).compose(this::handleMatchedRoute);
	}

	/**
	 * Handles {@code connection} to completion on the calling thread.
	 * <p>
	 * Returns once the terminating body message has been sent; for Server-Sent Event streams that is when the stream
	 * closes.
	 *
	 * @param connection the connection to handle
	 */
	public void dispatch(@NonNull Connection connection) {
		requireNonNull(connection);

		long startTime = System.nanoTime();
		ResponseChannel responseChannel = new ResponseChannel(connection);
		List<Throwable> throwables = new ArrayList<>(2);
		Request request = null;
		NegotiatedResponse negotiatedResponse = null;

		try {
			try {
				request = decodeRequest(connection);
			} catch (HttpException e) {
				throwables.add(e);
				writeUndecodableRequestResponse(responseChannel, e);
				return;
			}

			getLifecycleObserver().didStartRequestHandling(request);

			RequestContext requestContext = new RequestContext(request, getPerchConfig().getGson(), getPerchConfig().getProvidersByType());
			negotiatedResponse = RequestContext.perform(requestContext, currentRequestContext ->
					handleRequest(currentRequestContext, responseChannel, throwables));
		} catch (IOException e) {
			throwables.add(e);

			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.RESPONSE_WRITING_FAILED,
							request == null ? "Unable to write response" : format("Unable to write response for %s %s", request.getHttpMethod().name(), request.getPath()))
					.throwable(e)
					.request(request)
					.build());
		} catch (Throwable t) {
			throwables.add(t);

			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED,
							request == null ? "Unable to handle connection" : format("500 %s %s", request.getHttpMethod().name(), request.getPath()))
					.throwable(t)
					.request(request)
					.build());
		} finally {
			try {
				completeResponse(responseChannel, request);
			} finally {
				if (request != null)
					getLifecycleObserver().didFinishRequestHandling(request, negotiatedResponse,
							Duration.ofNanos(System.nanoTime() - startTime), List.copyOf(throwables));
			}
		}
	}

	@NonNull
	private NegotiatedResponse handleRequest(@NonNull RequestContext requestContext,
																					 @NonNull ResponseChannel responseChannel,
																					 @NonNull List<@NonNull Throwable> throwables) throws IOException {
		requireNonNull(requestContext);
		requireNonNull(responseChannel);
		requireNonNull(throwables);

		Request request = requestContext.getRequest();
		NegotiatedResponse negotiatedResponse;

		try {
			negotiatedResponse = getPipeline().proceed(request);
		} catch (HttpException e) {
			throwables.add(e);
			negotiatedResponse = getErrorPipeline().handleHttpException(request, e);
		} catch (Exception e) {
			throwables.add(e);
			negotiatedResponse = getErrorPipeline().handleUnexpectedException(request, e);
		}

		writeResponse(requestContext, responseChannel, negotiatedResponse, throwables);
		return negotiatedResponse;
	}

	@NonNull
	private NegotiatedResponse handleMatchedRoute(@NonNull Request request) throws Exception {
		requireNonNull(request);

		RouteMatch routeMatch = getPerchConfig().getRouter().match(request.getHttpMethod(), request.getPath());

		Request matchedRequest = request.copy()
				.route(routeMatch.getRoute())
				.pathParameters(routeMatch.getPathParameters())
				.finish();

		Object result = routeMatch.getRoute().getRouteHandler().handle(matchedRequest);
		NegotiatedResponse negotiatedResponse = getPerchConfig().getContentNegotiator().negotiate(matchedRequest, result);

		if (negotiatedResponse == null)
			throw new IllegalStateException(format("%s returned null for %s", ContentNegotiator.class.getSimpleName(), matchedRequest));

		return negotiatedResponse;
	}

	@NonNull
	private Request decodeRequest(@NonNull Connection connection) {
		requireNonNull(connection);

		ConnectionMetadata connectionMetadata = connection.getMetadata();
		HttpMethod httpMethod = HttpMethod.fromName(connectionMetadata.getHttpMethodName()).orElseThrow(() ->
				new HttpException(501, format("Unsupported HTTP method %s", Utilities.printableString(connectionMetadata.getHttpMethodName()))));

		return Request.withRawUrl(httpMethod, connectionMetadata.getRawUrl())
				.headers(connectionMetadata.getHeaders())
				.clientAddress(connectionMetadata.getClientAddress().orElse(null))
				.serverAddress(connectionMetadata.getServerAddress().orElse(null))
				.httpVersion(connectionMetadata.getHttpVersion().orElse(null))
				.requestBody(RequestBody.fromConnection(connection, getPerchConfig().getMaximumRequestSizeInBytes()))
				.build();
	}

	private void writeResponse(@NonNull RequestContext requestContext,
														 @NonNull ResponseChannel responseChannel,
														 @NonNull NegotiatedResponse negotiatedResponse,
														 @NonNull List<@NonNull Throwable> throwables) throws IOException {
		requireNonNull(requestContext);
		requireNonNull(responseChannel);
		requireNonNull(negotiatedResponse);
		requireNonNull(throwables);

		if (negotiatedResponse instanceof MarshaledResponse marshaledResponse)
			writeMarshaledResponse(requestContext.getRequest(), responseChannel, marshaledResponse);
		else if (negotiatedResponse instanceof StreamingResponse streamingResponse)
			writeStreamingResponse(requestContext.getRequest(), responseChannel, streamingResponse, throwables);
		else if (negotiatedResponse instanceof ServerSentEventResponse serverSentEventResponse)
			getServerSentEventEngine().stream(requestContext, responseChannel, serverSentEventResponse);
		else
			throw new IllegalStateException(format("Unsupported %s implementation %s", NegotiatedResponse.class.getSimpleName(),
					negotiatedResponse.getClass().getName()));
	}

	private void writeMarshaledResponse(@NonNull Request request,
																			@NonNull ResponseChannel responseChannel,
																			@NonNull MarshaledResponse marshaledResponse) throws IOException {
		requireNonNull(request);
		requireNonNull(responseChannel);
		requireNonNull(marshaledResponse);

		Integer statusCode = marshaledResponse.getStatusCode();
		Boolean bodyless = StatusCode.isBodyless(statusCode);
		byte[] body = bodyless ? Utilities.emptyByteArray() : marshaledResponse.getBody().orElse(Utilities.emptyByteArray());
		Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(marshaledResponse.getHeaders());

		if (bodyless)
			headers.remove("Content-Length");
		else
			headers.put("Content-Length", Set.of(String.valueOf(body.length)));

		// HEAD advertises the length it would have sent
		if (request.getHttpMethod() == HttpMethod.HEAD)
			body = Utilities.emptyByteArray();

		responseChannel.start(statusCode, headers);
		responseChannel.finish(body);
	}

	private void writeStreamingResponse(@NonNull Request request,
																			@NonNull ResponseChannel responseChannel,
																			@NonNull StreamingResponse streamingResponse,
																			@NonNull List<@NonNull Throwable> throwables) throws IOException {
		requireNonNull(request);
		requireNonNull(responseChannel);
		requireNonNull(streamingResponse);
		requireNonNull(throwables);

		Integer statusCode = streamingResponse.getStatusCode();
		Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(streamingResponse.getHeaders());
		headers.remove("Content-Length");

		responseChannel.start(statusCode, headers);

		if (!StatusCode.isBodyless(statusCode) && request.getHttpMethod() != HttpMethod.HEAD) {
			try {
				Iterator<byte[]> chunks = streamingResponse.getChunks();

				while (chunks.hasNext()) {
					byte[] chunk = chunks.next();

					if (chunk != null && chunk.length > 0)
						responseChannel.write(chunk);
				}
			} catch (IOException e) {
				throw e;
			} catch (Exception e) {
				throwables.add(e);

				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.STREAMING_RESPONSE_FAILED,
								format("Streaming response failed for %s %s", request.getHttpMethod().name(), request.getPath()))
						.throwable(e)
						.request(request)
						.build());

				// Status and headers are already on the wire; all that's left is to flag the failure in-band
				responseChannel.write(RENDER_ERROR_MARKER);
			}
		}

		responseChannel.finish(Utilities.emptyByteArray());
	}

	private void writeUndecodableRequestResponse(@NonNull ResponseChannel responseChannel,
																							 @NonNull HttpException httpException) throws IOException {
		requireNonNull(responseChannel);
		requireNonNull(httpException);

		byte[] body = httpException.getDetail().orElse(StatusCode.reasonPhraseFor(httpException.getStatusCode())).getBytes(StandardCharsets.UTF_8);
		Map<String, Set<String>> headers = Utilities.caseInsensitiveHeaders(httpException.getHeaders());
		headers.put("Content-Type", Set.of("text/plain; charset=utf-8"));
		headers.put("Content-Length", Set.of(String.valueOf(body.length)));

		responseChannel.start(httpException.getStatusCode(), headers);
		responseChannel.finish(body);
	}

	private void completeResponse(@NonNull ResponseChannel responseChannel,
																@Nullable Request request) {
		requireNonNull(responseChannel);

		try {
			if (!responseChannel.isStarted()) {
				responseChannel.start(500, Map.of(
						"Content-Type", Set.of("text/plain; charset=utf-8"),
						"Content-Length", Set.of(String.valueOf(FAILSAFE_BODY.length))
				));
				responseChannel.finish(FAILSAFE_BODY);
			} else if (!responseChannel.isFinished()) {
				responseChannel.finish(Utilities.emptyByteArray());
			}
		} catch (IOException e) {
			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.RESPONSE_WRITING_FAILED,
							request == null ? "Unable to complete response" : format("Unable to complete response for %s %s",
									request.getHttpMethod().name(), request.getPath()))
					.throwable(e)
					.request(request)
					.build());
		}
	}

	@NonNull
	public PerchConfig getPerchConfig() {
		return this.perchConfig;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private ErrorPipeline getErrorPipeline() {
		return this.errorPipeline;
	}

	@NonNull
	private ServerSentEventEngine getServerSentEventEngine() {
		return this.serverSentEventEngine;
	}

	@NonNull
	private Next getPipeline() {
		return this.pipeline;
	}
}
