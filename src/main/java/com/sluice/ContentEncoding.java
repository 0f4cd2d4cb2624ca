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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.sluice.Utilities.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * {@code Content-Encoding}s that Sluice is able to decompress.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ContentEncoding {
	/**
	 * RFC 1952 gzip.  Also matches the legacy {@code x-gzip} token.
	 */
	GZIP(Set.of("gzip", "x-gzip")),
	/**
	 * RFC 1950 zlib-wrapped deflate.  Raw RFC 1951 deflate streams (as sent by some clients) are also accepted.
	 */
	DEFLATE(Set.of("deflate"));

	@NonNull
	private final Set<@NonNull String> tokens;

	ContentEncoding(@NonNull Set<@NonNull String> tokens) {
		requireNonNull(tokens);
		this.tokens = tokens;
	}

	/**
	 * Maps a {@code Content-Encoding} header value to a supported encoding.
	 * <p>
	 * Matching is case-insensitive.  Absent values, {@code identity} and unrecognized encodings all yield {@link Optional#empty()},
	 * which means "treat the body as already decompressed".
	 *
	 * @param contentEncodingHeaderValue the raw header value, may be {@code null}
	 * @return the supported encoding, or {@link Optional#empty()} if none applies
	 */
	@NonNull
	public static Optional<ContentEncoding> fromHeaderValue(@Nullable String contentEncodingHeaderValue) {
		String token = trimAggressivelyToNull(contentEncodingHeaderValue);

		if (token == null)
			return Optional.empty();

		token = token.toLowerCase(Locale.ROOT);

		for (ContentEncoding contentEncoding : values())
			if (contentEncoding.getTokens().contains(token))
				return Optional.of(contentEncoding);

		return Optional.empty();
	}

	@NonNull
	public Set<@NonNull String> getTokens() {
		return this.tokens;
	}
}
