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

import com.fasterxml.jackson.databind.JsonNode;
import com.sluice.exception.DecodeException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class JsonLinesCodec implements Codec {
	@NonNull
	private static final JsonLinesCodec DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new JsonLinesCodec();
	}

	@NonNull
	public static JsonLinesCodec defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private JsonLinesCodec() {
		// Only the default instance
	}

	@Override
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> decode(byte @NonNull [] body,
																																			@NonNull Charset charset) {
		requireNonNull(body);
		requireNonNull(charset);

		List<String> lines = LineCodec.splitLines(new String(body, charset));
		List<Map<String, Object>> fieldMappings = new ArrayList<>(lines.size());
		int lineNumber = 0;

		for (String line : lines) {
			++lineNumber;

			if (line.isBlank())
				continue;

			JsonNode jsonNode;

			try {
				jsonNode = JsonCodec.readTree(line);
			} catch (DecodeException e) {
				throw new DecodeException(format("Line %d: %s", lineNumber, e.getMessage()), e);
			}

			if (!jsonNode.isObject())
				throw new DecodeException(format("Line %d: expected a JSON object, but found %s", lineNumber, JsonCodec.describe(jsonNode)));

			fieldMappings.add(JsonCodec.toFields(jsonNode));
		}

		return fieldMappings;
	}

	@Override
	@NonNull
	public String toString() {
		return "json_lines";
	}
}
