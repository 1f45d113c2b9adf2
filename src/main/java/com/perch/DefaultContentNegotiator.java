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

import com.google.gson.Gson;
import com.perch.exception.NegotiationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Perch's standard {@link ContentNegotiator}.
 * <p>
 * Rules are applied in this order, first match wins:
 * <ol>
 *   <li>a {@link NegotiatedResponse} passes through unchanged</li>
 *   <li>{@code null} becomes {@code 204 No Content}</li>
 *   <li>a {@link Response} negotiates its body, then applies its status and headers</li>
 *   <li>{@link String} becomes {@code text/html; charset=utf-8}</li>
 *   <li>{@code byte[]} becomes {@code application/octet-stream}</li>
 *   <li>{@link Map} or {@link Collection} becomes {@code application/json; charset=utf-8} via Gson</li>
 *   <li>{@link Template} is rendered by the configured {@link TemplateRenderer}, streamed if progressive</li>
 *   <li>{@link ServerSentEventStream} becomes a {@link ServerSentEventResponse}</li>
 * </ol>
 * Anything else fails with {@link NegotiationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DefaultContentNegotiator implements ContentNegotiator {
	@NonNull
	private static final String HTML_CONTENT_TYPE;
	@NonNull
	private static final String JSON_CONTENT_TYPE;
	@NonNull
	private static final String BINARY_CONTENT_TYPE;
	@NonNull
	private static final DefaultContentNegotiator DEFAULT_INSTANCE;

	static {
		HTML_CONTENT_TYPE = "text/html; charset=utf-8";
		JSON_CONTENT_TYPE = "application/json; charset=utf-8";
		BINARY_CONTENT_TYPE = "application/octet-stream";
		DEFAULT_INSTANCE = new DefaultContentNegotiator(new Gson(), null);
	}

	@NonNull
	private final Gson gson;
	@Nullable
	private final TemplateRenderer templateRenderer;

	/**
	 * A negotiator with a default {@link Gson} and no template renderer.
	 *
	 * @return the shared default instance
	 */
	@NonNull
	public static DefaultContentNegotiator defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static DefaultContentNegotiator with(@NonNull Gson gson,
																							@Nullable TemplateRenderer templateRenderer) {
		requireNonNull(gson);
		return new DefaultContentNegotiator(gson, templateRenderer);
	}

	private DefaultContentNegotiator(@NonNull Gson gson,
																	 @Nullable TemplateRenderer templateRenderer) {
		requireNonNull(gson);

		this.gson = gson;
		this.templateRenderer = templateRenderer;
	}

	@Override
	@NonNull
	public NegotiatedResponse negotiate(@NonNull Request request,
																			@Nullable Object value) throws Exception {
		requireNonNull(request);

		if (value instanceof NegotiatedResponse negotiatedResponse)
			return negotiatedResponse;

		if (value == null)
			return MarshaledResponse.withStatusCode(204).build();

		if (value instanceof Response response) {
			NegotiatedResponse negotiatedResponse = negotiate(request, response.getBody().orElse(null));

			// A Response with an empty body keeps its own status rather than collapsing to 204
			if (response.getBody().isEmpty() && negotiatedResponse.getStatusCode() == 204)
				negotiatedResponse = MarshaledResponse.withStatusCode(200).body(Utilities.emptyByteArray()).build();

			if (response.getStatusCode().isPresent())
				negotiatedResponse = negotiatedResponse.withStatus(response.getStatusCode().get());

			if (response.getHeaders().size() > 0)
				negotiatedResponse = negotiatedResponse.withHeaders(response.getHeaders());

			return negotiatedResponse;
		}

		if (value instanceof String string)
			return buffered(string.getBytes(StandardCharsets.UTF_8), HTML_CONTENT_TYPE);

		if (value instanceof byte[] bytes)
			return buffered(bytes, BINARY_CONTENT_TYPE);

		if (value instanceof Map<?, ?> || value instanceof Collection<?>)
			return buffered(getGson().toJson(value).getBytes(StandardCharsets.UTF_8), JSON_CONTENT_TYPE);

		if (value instanceof Template template) {
			TemplateRenderer templateRenderer = getTemplateRenderer().orElseThrow(() ->
					new IllegalStateException(format("Cannot render %s because no %s is configured", template,
							TemplateRenderer.class.getSimpleName())));

			if (template.isProgressive())
				return StreamingResponse.withTextChunks(templateRenderer.renderProgressively(template.getName(), template.getContext()))
						.headers(Map.of("Content-Type", Set.of(HTML_CONTENT_TYPE)))
						.build();

			String markup = templateRenderer.render(template.getName(), template.getContext());
			return buffered(markup.getBytes(StandardCharsets.UTF_8), HTML_CONTENT_TYPE);
		}

		if (value instanceof ServerSentEventStream serverSentEventStream)
			return ServerSentEventResponse.withServerSentEventStream(serverSentEventStream);

		throw new NegotiationException(value.getClass());
	}

	@NonNull
	private MarshaledResponse buffered(@NonNull byte[] body,
																		 @NonNull String contentType) {
		requireNonNull(body);
		requireNonNull(contentType);

		return MarshaledResponse.withStatusCode(200)
				.headers(Map.of("Content-Type", Set.of(contentType)))
				.body(body)
				.build();
	}

	@NonNull
	public Gson getGson() {
		return this.gson;
	}

	@NonNull
	public Optional<TemplateRenderer> getTemplateRenderer() {
		return Optional.ofNullable(this.templateRenderer);
	}
}
