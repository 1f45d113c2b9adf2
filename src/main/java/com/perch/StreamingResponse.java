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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A response whose body is produced lazily, one chunk at a time, while it is being written.
 * <p>
 * Streaming responses never carry {@code Content-Length}. The chunk iterator is consumed exactly once, by the
 * dispatcher, after the status and headers have been sent; if it fails partway through, the failure can no longer change
 * the status, so the dispatcher writes a render-error marker chunk and completes the response.
 * <p>
 * Progressive {@link Template}s negotiate to this type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StreamingResponse implements NegotiatedResponse {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;
	@NonNull
	private final Iterator<byte @NonNull []> chunks;

	@NonNull
	public static Builder withChunks(@NonNull Iterator<byte @NonNull []> chunks) {
		requireNonNull(chunks);
		return new Builder(chunks);
	}

	/**
	 * Acquires a builder for text chunks, each encoded as UTF-8 as it is written.
	 *
	 * @param textChunks the text chunks
	 * @return the builder
	 */
	@NonNull
	public static Builder withTextChunks(@NonNull Iterator<@NonNull String> textChunks) {
		requireNonNull(textChunks);

		return new Builder(new Iterator<>() {
			@Override
			public boolean hasNext() {
				return textChunks.hasNext();
			}

			@Override
			public byte[] next() {
				String textChunk = textChunks.next();
				return textChunk == null ? Utilities.emptyByteArray() : textChunk.getBytes(StandardCharsets.UTF_8);
			}
		});
	}

	private StreamingResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.headers = Utilities.immutableCaseInsensitiveHeaders(builder.headers);
		this.chunks = builder.chunks;
	}

	@Override
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Override
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Iterator<byte @NonNull []> getChunks() {
		return this.chunks;
	}

	@Override
	@NonNull
	public StreamingResponse withStatus(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		return new Builder(getChunks())
				.statusCode(statusCode)
				.headers(getHeaders())
				.build();
	}

	@Override
	@NonNull
	public StreamingResponse withHeaders(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
		requireNonNull(headers);

		return new Builder(getChunks())
				.statusCode(getStatusCode())
				.headers(Utilities.mergeHeaders(getHeaders(), headers))
				.build();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s}", getClass().getSimpleName(), getStatusCode(), getHeaders());
	}

	/**
	 * Builder used to construct instances of {@link StreamingResponse}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Iterator<byte @NonNull []> chunks;
		@NonNull
		private Integer statusCode;
		@Nullable
		private Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

		private Builder(@NonNull Iterator<byte @NonNull []> chunks) {
			this.chunks = requireNonNull(chunks);
			this.statusCode = 200;
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			this.statusCode = requireNonNull(statusCode);
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull Set<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public StreamingResponse build() {
			return new StreamingResponse(this);
		}
	}
}
