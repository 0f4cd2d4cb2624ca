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

package com.sluice;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * A non-instantiable collection of utility methods.
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

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		// \p{Z}: any kind of whitespace or invisible separator, at the head or tail of a string
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Extracts the media type (without parameters) from a {@code Content-Type} header value.
	 * <p>
	 * For example, {@code "application/json; charset=UTF-8"} → {@code "application/json"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		int indexOfSemicolon = contentTypeHeaderValue.indexOf(';');

		if (indexOfSemicolon == -1)
			return Optional.of(contentTypeHeaderValue);

		return Optional.ofNullable(trimAggressivelyToNull(contentTypeHeaderValue.substring(0, indexOfSemicolon)));
	}

	/**
	 * Normalizes a {@code Content-Type} header value for codec lookup: parameters are stripped, whitespace trimmed
	 * and the result lowercased.
	 * <p>
	 * For example, {@code " Application/JSON ; charset=UTF-8"} → {@code "application/json"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the normalized media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> normalizeContentType(@Nullable String contentTypeHeaderValue) {
		return extractContentTypeFromHeaderValue(contentTypeHeaderValue)
				.map(contentType -> contentType.toLowerCase(Locale.ROOT));
	}

	/**
	 * Extracts the {@code charset=...} parameter from a {@code Content-Type} header value.
	 * <p>
	 * Parameters may appear in any order; the charset name may be quoted.  Unknown or illegal charset names yield {@link Optional#empty()}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the resolved charset if present and valid; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull Charset> extractCharsetFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		String[] components = contentTypeHeaderValue.split(";");

		// First component is the media type itself
		for (int i = 1; i < components.length; ++i) {
			String parameter = trimAggressivelyToEmpty(components[i]);
			int indexOfEquals = parameter.indexOf('=');

			if (indexOfEquals == -1)
				continue;

			String name = trimAggressivelyToEmpty(parameter.substring(0, indexOfEquals));

			if (!"charset".equalsIgnoreCase(name))
				continue;

			String charsetName = stripOptionalQuotes(trimAggressivelyToEmpty(parameter.substring(indexOfEquals + 1)));

			if (charsetName.length() == 0)
				return Optional.empty();

			try {
				return Optional.of(Charset.forName(charsetName));
			} catch (IllegalCharsetNameException | UnsupportedCharsetException ignored) {
				return Optional.empty();
			}
		}

		return Optional.empty();
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	/**
	 * Aggressively trims whitespace from the given string and returns {@code null} if the result is empty.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed, non-empty string; or {@code null} if input was {@code null} or trimmed to empty
	 */
	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Aggressively trims whitespace from the given string and returns {@code ""} if the input is {@code null}.
	 *
	 * @param string the input string; may be {@code null}
	 * @return a trimmed string (never {@code null})
	 */
	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	static void validateHeaderNameAndValue(@Nullable String name,
																				 @Nullable String value) {
		name = trimAggressivelyToNull(name);

		if (name == null)
			throw new IllegalArgumentException("Header name is blank");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			// RFC 9110 tchar
			if (c > 0x7F || !(c == '!' || c == '#' || c == '$' || c == '%' || c == '&' || c == '\'' || c == '*' || c == '+' ||
					c == '-' || c == '.' || c == '^' || c == '_' || c == '`' || c == '|' || c == '~' ||
					Character.isLetterOrDigit(c))) {
				throw new IllegalArgumentException(format("Illegal header name '%s'. Offending character: '%s'", name, printableChar(c)));
			}
		}

		if (value == null)
			return;

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\r' || c == '\n' || c > 0xFF || (c < 0x20 && c != '\t'))
				throw new IllegalArgumentException(format("Illegal header value '%s' for header name '%s'. Offending character: '%s'", value, name, printableChar(c)));
		}
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r')
			return "\\r";
		if (c == '\n')
			return "\\n";
		if (c == '\t')
			return "\\t";
		if (c < 0x20 || c == 0x7F)
			return format("0x%02X", (int) c);

		return String.valueOf(c);
	}

	@NonNull
	private static String stripOptionalQuotes(@NonNull String string) {
		if (string.length() >= 2) {
			char first = string.charAt(0);
			char last = string.charAt(string.length() - 1);

			if ((first == '"' && last == '"') || (first == '\'' && last == '\''))
				return string.substring(1, string.length() - 1);
		}

		return string;
	}
}
