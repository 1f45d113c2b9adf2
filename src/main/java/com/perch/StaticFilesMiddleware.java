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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link Middleware} which serves files from a directory for request paths under a URL prefix.
 * <p>
 * Only {@code GET} and {@code HEAD} requests under the prefix are considered. Paths that name no regular file fall
 * through to the next handler, and paths that resolve outside the directory, symlinks included, are answered with
 * {@code 403 Forbidden}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StaticFilesMiddleware implements Middleware {
	@NonNull
	private static final Map<@NonNull String, @NonNull String> CONTENT_TYPES_BY_EXTENSION;

	static {
		// Common web types the JDK's file name map lacks or gets wrong
		CONTENT_TYPES_BY_EXTENSION = Map.of(
				"css", "text/css; charset=utf-8",
				"js", "text/javascript; charset=utf-8",
				"mjs", "text/javascript; charset=utf-8",
				"json", "application/json; charset=utf-8",
				"svg", "image/svg+xml",
				"webp", "image/webp",
				"woff", "font/woff",
				"woff2", "font/woff2",
				"html", "text/html; charset=utf-8",
				"txt", "text/plain; charset=utf-8"
		);
	}

	@NonNull
	private final Path directory;
	@NonNull
	private final String prefix;

	/**
	 * Serves files below {@code directory} for request paths below {@code prefix}, e.g. {@code /static}.
	 *
	 * @param directory the directory to serve
	 * @param prefix    the URL prefix
	 * @return the middleware
	 * @throws IllegalArgumentException if {@code directory} is not a directory
	 */
	@NonNull
	public static StaticFilesMiddleware withDirectory(@NonNull Path directory,
																										@NonNull String prefix) {
		requireNonNull(directory);
		requireNonNull(prefix);

		return new StaticFilesMiddleware(directory, prefix);
	}

	private StaticFilesMiddleware(@NonNull Path directory,
																@NonNull String prefix) {
		requireNonNull(directory);
		requireNonNull(prefix);

		if (!Files.isDirectory(directory))
			throw new IllegalArgumentException(format("%s is not a directory", directory));

		try {
			this.directory = directory.toRealPath();
		} catch (IOException e) {
			throw new IllegalArgumentException(format("Unable to resolve %s", directory), e);
		}

		this.prefix = Utilities.normalizePath(Utilities.trimAggressivelyToEmpty(prefix));
	}

	@NonNull
	@Override
	public NegotiatedResponse handle(@NonNull Request request,
																	 @NonNull Next next) throws Exception {
		requireNonNull(request);
		requireNonNull(next);

		if (request.getHttpMethod() != HttpMethod.GET && request.getHttpMethod() != HttpMethod.HEAD)
			return next.proceed(request);

		String path = request.getPath();
		String relativePath;

		if ("/".equals(getPrefix()))
			relativePath = path.substring(1);
		else if (path.startsWith(getPrefix() + "/"))
			relativePath = path.substring(getPrefix().length() + 1);
		else
			return next.proceed(request);

		if (relativePath.isEmpty())
			return next.proceed(request);

		Path file = getDirectory().resolve(relativePath).normalize();

		if (!file.startsWith(getDirectory()))
			return forbidden();

		if (!Files.isRegularFile(file))
			return next.proceed(request);

		if (!file.toRealPath().startsWith(getDirectory()))
			return forbidden();

		return MarshaledResponse.withStatusCode(200)
				.headers(Map.of(
						"Content-Type", Set.of(contentTypeFor(file)),
						"Cache-Control", Set.of("public, max-age=3600")))
				.body(Files.readAllBytes(file))
				.build();
	}

	@NonNull
	private NegotiatedResponse forbidden() {
		return MarshaledResponse.withStatusCode(403)
				.headers(Map.of("Content-Type", Set.of("text/plain; charset=utf-8")))
				.body("Forbidden".getBytes(StandardCharsets.UTF_8))
				.build();
	}

	@NonNull
	private String contentTypeFor(@NonNull Path file) {
		requireNonNull(file);

		String fileName = file.getFileName().toString();
		int extensionIndex = fileName.lastIndexOf('.');
		String extension = extensionIndex < 0 ? "" : fileName.substring(extensionIndex + 1).toLowerCase(Locale.ENGLISH);
		String contentType = CONTENT_TYPES_BY_EXTENSION.get(extension);

		if (contentType == null)
			contentType = URLConnection.guessContentTypeFromName(fileName);

		return contentType == null ? "application/octet-stream" : contentType;
	}

	@NonNull
	public Path getDirectory() {
		return this.directory;
	}

	@NonNull
	public String getPrefix() {
		return this.prefix;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{directory=%s, prefix=%s}", getClass().getSimpleName(), getDirectory(), getPrefix());
	}
}
