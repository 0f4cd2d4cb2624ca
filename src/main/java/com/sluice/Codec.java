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

import com.sluice.exception.DecodeException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;

/**
 * Contract for turning a decompressed request body into zero or more event field mappings.
 * <p>
 * Codecs are looked up by identifier via {@link CodecRegistry}.  Sluice ships with these:
 * <ul>
 *   <li>{@code plain} ({@link #plain()}) - one event whose {@code message} field is the entire body</li>
 *   <li>{@code line} ({@link #line()}) - one event per newline-delimited segment, including a final segment without a trailing newline</li>
 *   <li>{@code json} ({@link #json()}) - a JSON object becomes one event with the object's top-level fields; a JSON array of objects becomes one event per element</li>
 *   <li>{@code json_lines} ({@link #jsonLines()}) - one JSON object per line, one event per line</li>
 * </ul>
 * <p>
 * Implementations must be threadsafe and must not retain the body after returning.
 * Decoding is all-or-nothing: on failure, implementations throw {@link DecodeException} and no events are produced.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Codec {
	/**
	 * Decodes a request body into event field mappings, in the order they occur in the body.
	 *
	 * @param body    the decompressed request body
	 * @param charset the charset declared by the request's {@code Content-Type}, or UTF-8 if none was declared
	 * @return the decoded field mappings, possibly empty
	 * @throws DecodeException if the body cannot be decoded by this codec
	 */
	@NonNull
	List<@NonNull Map<@NonNull String, @Nullable Object>> decode(byte @NonNull [] body,
																															 @NonNull Charset charset);

	/**
	 * Acquires the codec which produces exactly one event whose {@code message} field is the entire body.
	 *
	 * @return the {@code plain} codec
	 */
	@NonNull
	static Codec plain() {
		return PlainCodec.defaultInstance();
	}

	/**
	 * Acquires the codec which produces one event per newline-delimited line of the body.
	 *
	 * @return the {@code line} codec
	 */
	@NonNull
	static Codec line() {
		return LineCodec.defaultInstance();
	}

	/**
	 * Acquires the codec which parses the body as a JSON object (or array of objects).
	 *
	 * @return the {@code json} codec
	 */
	@NonNull
	static Codec json() {
		return JsonCodec.defaultInstance();
	}

	/**
	 * Acquires the codec which parses each line of the body as a JSON object.
	 *
	 * @return the {@code json_lines} codec
	 */
	@NonNull
	static Codec jsonLines() {
		return JsonLinesCodec.defaultInstance();
	}
}
