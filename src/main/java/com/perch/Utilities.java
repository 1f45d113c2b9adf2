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

import com.perch.exception.BadRequestException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Utility methods shared across request parsing, routing and response writing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern DUPLICATE_SLASHES_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		// \p{Z} covers every kind of Unicode whitespace and invisible separator, which plain trim() misses
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z})+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z})+$");
		DUPLICATE_SLASHES_PATTERN = Pattern.compile("/{2,}");
	}

	private Utilities() {
		// Non-instantiable
	}

	@NonNull
	public static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Normalizes a path: collapses duplicate slashes, guarantees a leading slash and removes any trailing slash.
	 * <p>
	 * For example, {@code "users//42/"} becomes {@code "/users/42"}, and the empty string becomes {@code "/"}.
	 * Whitespace is data here and is kept; callers trim raw input before decoding it.
	 *
	 * @param path the path to normalize
	 * @return the normalized path
	 */
	@NonNull
	public static String normalizePath(@NonNull String path) {
		requireNonNull(path);

		path = DUPLICATE_SLASHES_PATTERN.matcher(path).replaceAll("/");

		if (!path.startsWith("/"))
			path = format("/%s", path);

		while (path.length() > 1 && path.endsWith("/"))
			path = path.substring(0, path.length() - 1);

		return path;
	}

	/**
	 * Extracts the normalized, percent-decoded path from a raw request target like {@code /users/j%C3%B8rn/?tab=1}.
	 *
	 * @param rawUrl the raw (undecoded) request target
	 * @return the decoded path, e.g. {@code /users/jørn}
	 * @throws BadRequestException if the path contains malformed percent-encoding or a NUL character
	 */
	@NonNull
	public static String extractPathFromRawUrl(@NonNull String rawUrl) {
		requireNonNull(rawUrl);

		String rawPath = trimAggressivelyToEmpty(rawUrl);
		int queryIndex = rawPath.indexOf('?');

		if (queryIndex >= 0)
			rawPath = rawPath.substring(0, queryIndex);

		int fragmentIndex = rawPath.indexOf('#');

		if (fragmentIndex >= 0)
			rawPath = rawPath.substring(0, fragmentIndex);

		String path = percentDecode(rawPath, false);

		if (path.indexOf('\u0000') >= 0)
			throw new BadRequestException(format("Illegal NUL character in path '%s'", printableString(path)));

		return normalizePath(path);
	}

	/**
	 * Extracts the raw query from a raw request target, e.g. {@code "a=1&b=2"} from {@code "/x?a=1&b=2"}.
	 *
	 * @param rawUrl the raw (undecoded) request target
	 * @return the raw query, or {@code null} if there is none
	 */
	@Nullable
	public static String extractRawQueryFromRawUrl(@NonNull String rawUrl) {
		requireNonNull(rawUrl);

		int queryIndex = rawUrl.indexOf('?');

		if (queryIndex < 0)
			return null;

		String rawQuery = rawUrl.substring(queryIndex + 1);
		int fragmentIndex = rawQuery.indexOf('#');

		if (fragmentIndex >= 0)
			rawQuery = rawQuery.substring(0, fragmentIndex);

		return trimAggressivelyToNull(rawQuery);
	}

	/**
	 * Parses a raw query string such as {@code "a=1&b=2&b=3&c=%20"} into a multimap of decoded names to values.
	 * <p>
	 * {@code +} decodes to a space. Pairs without a name are ignored; pairs without a value get the empty string.
	 * Names keep first-seen order, values keep insertion order and are de-duplicated.
	 *
	 * @param rawQuery the raw query string, without the leading {@code ?}
	 * @return the query parameters, empty if there are none
	 * @throws BadRequestException if the query contains malformed percent-encoding
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> extractQueryParametersFromRawQuery(@Nullable String rawQuery) {
		rawQuery = trimAggressivelyToNull(rawQuery);

		if (rawQuery == null)
			return Map.of();

		Map<String, Set<String>> queryParameters = new LinkedHashMap<>();

		for (String pair : rawQuery.split("&")) {
			if (pair.isEmpty())
				continue;

			String[] nameAndValue = pair.split("=", 2);
			String rawName = trimAggressivelyToNull(nameAndValue[0]);

			if (rawName == null)
				continue;

			String rawValue = nameAndValue.length > 1 ? nameAndValue[1] : "";
			String name = percentDecode(rawName, true);
			String value = percentDecode(rawValue, true);

			queryParameters.computeIfAbsent(name, ignored -> new LinkedHashSet<>()).add(value);
		}

		return queryParameters;
	}

	// One pass: consecutive %xx triplets are decoded as a UTF-8 byte run
	@NonNull
	private static String percentDecode(@NonNull String string,
																			@NonNull Boolean plusAsSpace) {
		requireNonNull(string);
		requireNonNull(plusAsSpace);

		if (string.indexOf('%') < 0)
			return plusAsSpace ? string.replace('+', ' ') : string;

		StringBuilder decoded = new StringBuilder(string.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < string.length(); ) {
			char c = string.charAt(i);

			if (c == '%') {
				bytes.reset();
				int j = i;

				while (j < string.length() && string.charAt(j) == '%') {
					if (j + 2 >= string.length())
						throw new BadRequestException("Invalid percent-encoding in URL");

					int high = hex(string.charAt(j + 1));
					int low = hex(string.charAt(j + 2));

					if (high < 0 || low < 0)
						throw new BadRequestException("Invalid percent-encoding in URL");

					bytes.write((high << 4) | low);
					j += 3;
				}

				decoded.append(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
				i = j;
				continue;
			}

			decoded.append(plusAsSpace && c == '+' ? ' ' : c);
			++i;
		}

		return decoded.toString();
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}

	/**
	 * Copies headers into a map whose keys compare case-insensitively, preserving each value set's order.
	 *
	 * @param headers the headers to copy, may be {@code null}
	 * @return a mutable, case-insensitive copy
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> caseInsensitiveHeaders(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
		Map<String, Set<String>> caseInsensitiveHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (headers == null)
			return caseInsensitiveHeaders;

		for (Map.Entry<String, ? extends Iterable<String>> entry : headers.entrySet()) {
			Set<String> values = caseInsensitiveHeaders.computeIfAbsent(entry.getKey(), ignored -> new LinkedHashSet<>());

			for (String value : entry.getValue())
				values.add(value);
		}

		return caseInsensitiveHeaders;
	}

	/**
	 * Immutable, case-insensitive copy of the given headers.
	 *
	 * @param headers the headers to copy, may be {@code null}
	 * @return the copy
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> immutableCaseInsensitiveHeaders(@Nullable Map<@NonNull String, ? extends @NonNull Iterable<@NonNull String>> headers) {
		Map<String, Set<String>> caseInsensitiveHeaders = caseInsensitiveHeaders(headers);
		caseInsensitiveHeaders.replaceAll((name, values) -> Collections.unmodifiableSet(values));
		return Collections.unmodifiableMap(caseInsensitiveHeaders);
	}

	/**
	 * Case-insensitive copy of {@code headers} with {@code additionalHeaders} applied on top.
	 * <p>
	 * An additional header replaces any existing values for its name; one with no values removes the header.
	 *
	 * @param headers           the base headers
	 * @param additionalHeaders the headers to apply
	 * @return the merged headers, mutable
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Set<@NonNull String>> mergeHeaders(@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> headers,
																																								@NonNull Map<@NonNull String, @NonNull Set<@NonNull String>> additionalHeaders) {
		requireNonNull(headers);
		requireNonNull(additionalHeaders);

		Map<String, Set<String>> mergedHeaders = caseInsensitiveHeaders(headers);

		for (Map.Entry<String, Set<String>> entry : additionalHeaders.entrySet()) {
			if (entry.getValue().isEmpty())
				mergedHeaders.remove(entry.getKey());
			else
				mergedHeaders.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
		}

		return mergedHeaders;
	}

	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		// trim() also removes ASCII control characters such as CR and LF, which \p{Z} does not cover
		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("").trim();
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	/**
	 * Rejects header names that are not RFC 9110 tokens and values containing CR, LF, NUL or other control characters.
	 *
	 * @param name  the header name
	 * @param value the header value, may be {@code null}
	 * @throws IllegalArgumentException if the name or value is illegal
	 */
	public static void validateHeaderNameAndValue(@Nullable String name,
																								@Nullable String value) {
		name = trimAggressivelyToNull(name);

		if (name == null)
			throw new IllegalArgumentException("Header name is blank");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);

			if (c > 0x7F || !(c == '!' || c == '#' || c == '$' || c == '%' || c == '&' || c == '\'' || c == '*' || c == '+' ||
					c == '-' || c == '.' || c == '^' || c == '_' || c == '`' || c == '|' || c == '~' || Character.isLetterOrDigit(c)))
				throw new IllegalArgumentException(format("Illegal header name '%s'. Offending character: '%s'", name, printableChar(c)));
		}

		if (value == null)
			return;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c > 0xFF || (c < 0x20 && c != '\t') || c == 0x7F)
				throw new IllegalArgumentException(format("Illegal value '%s' for header '%s'. Offending character: '%s'",
						printableString(value), name, printableChar(c)));
		}
	}

	@NonNull
	public static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder printable = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			printable.append(printableChar(input.charAt(i)));

		return printable.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == 0) return "\\0";

		if (c < 0x20 || c == 0x7F || Character.isISOControl(c) || Character.getType(c) == Character.FORMAT)
			return format("\\u%04X", (int) c);

		return String.valueOf(c);
	}

	/**
	 * Renders a throwable's stack trace, including causes, as a string.
	 *
	 * @param throwable the throwable to render
	 * @return the stack trace
	 */
	@NonNull
	public static String stackTraceFor(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		StringWriter stringWriter = new StringWriter();

		try (PrintWriter printWriter = new PrintWriter(stringWriter)) {
			throwable.printStackTrace(printWriter);
		}

		return stringWriter.toString();
	}
}
