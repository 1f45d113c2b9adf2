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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Lazy, pull-based access to a request body.
 * <p>
 * Nothing is read from the transport until a caller asks. {@link #readChunk()} streams the body one chunk at a time;
 * once the body is exhausted it keeps returning {@link Optional#empty()}. {@link #readAll()} drains whatever has not been
 * streamed yet and caches the result, so repeated calls return the same bytes.
 * <p>
 * A {@link Request} and the copies derived from it share one instance, and so share its cursor.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestBody {
	@NonNull
	private static final RequestBody EMPTY;

	static {
		EMPTY = withBytes(Utilities.emptyByteArray());
	}

	@Nullable
	private final Connection connection;
	@Nullable
	private final Long maximumSizeInBytes;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private byte[] pendingBytes;
	@Nullable
	private byte[] cachedBody;
	private long bytesRead;
	private boolean exhausted;

	@NonNull
	public static RequestBody empty() {
		return EMPTY;
	}

	/**
	 * A body whose content is already in memory, e.g. for tests or transports that buffer.
	 *
	 * @param bytes the body
	 * @return the request body
	 */
	@NonNull
	public static RequestBody withBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return new RequestBody(null, bytes, null);
	}

	/**
	 * A body pulled from the inbound side of a connection on demand.
	 *
	 * @param connection         the connection to read from
	 * @param maximumSizeInBytes reading more than this many bytes fails with {@code 413}; {@code null} for no limit
	 * @return the request body
	 */
	@NonNull
	public static RequestBody fromConnection(@NonNull Connection connection,
																					 @Nullable Long maximumSizeInBytes) {
		requireNonNull(connection);
		return new RequestBody(connection, null, maximumSizeInBytes);
	}

	private RequestBody(@Nullable Connection connection,
											@Nullable byte[] pendingBytes,
											@Nullable Long maximumSizeInBytes) {
		this.connection = connection;
		this.pendingBytes = pendingBytes;
		this.maximumSizeInBytes = maximumSizeInBytes;
		this.lock = new ReentrantLock();
		this.exhausted = connection == null && (pendingBytes == null || pendingBytes.length == 0);
	}

	/**
	 * Reads the next chunk of the body.
	 *
	 * @return the next non-empty chunk, or {@link Optional#empty()} once the body is exhausted
	 * @throws HttpException        with status {@code 413} if the body exceeds the configured maximum size
	 * @throws IOException          if the transport fails
	 * @throws InterruptedException if interrupted while waiting for the transport
	 */
	@NonNull
	public Optional<byte[]> readChunk() throws IOException, InterruptedException {
		getLock().lock();

		try {
			while (!this.exhausted) {
				if (this.connection == null) {
					byte[] chunk = this.pendingBytes;
					this.pendingBytes = null;
					this.exhausted = true;
					return Optional.of(chunk);
				}

				InboundMessage inboundMessage = this.connection.receive();

				if (inboundMessage.isDisconnect()) {
					this.exhausted = true;
					break;
				}

				byte[] chunk = inboundMessage.getBody();
				this.bytesRead += chunk.length;

				if (!inboundMessage.getMoreBody())
					this.exhausted = true;

				if (this.maximumSizeInBytes != null && this.bytesRead > this.maximumSizeInBytes) {
					this.exhausted = true;
					throw new HttpException(413, format("Request body exceeds the maximum of %d bytes", this.maximumSizeInBytes));
				}

				if (chunk.length > 0)
					return Optional.of(chunk);
			}

			return Optional.empty();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Reads the remainder of the body into memory.
	 *
	 * @return the body bytes not already consumed via {@link #readChunk()}; the same array on repeated calls
	 * @throws HttpException        with status {@code 413} if the body exceeds the configured maximum size
	 * @throws IOException          if the transport fails
	 * @throws InterruptedException if interrupted while waiting for the transport
	 */
	@NonNull
	public byte[] readAll() throws IOException, InterruptedException {
		getLock().lock();

		try {
			if (this.cachedBody != null)
				return this.cachedBody;

			ByteArrayOutputStream body = new ByteArrayOutputStream();
			Optional<byte[]> chunk;

			while ((chunk = readChunk()).isPresent())
				body.writeBytes(chunk.get());

			this.cachedBody = body.toByteArray();
			return this.cachedBody;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isExhausted() {
		getLock().lock();

		try {
			return this.exhausted;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}
}
