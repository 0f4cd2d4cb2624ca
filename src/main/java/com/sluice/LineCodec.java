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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class LineCodec implements Codec {
	@NonNull
	private static final LineCodec DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new LineCodec();
	}

	@NonNull
	public static LineCodec defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private LineCodec() {
		// Only the default instance
	}

	@Override
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> decode(byte @NonNull [] body,
																																			@NonNull Charset charset) {
		requireNonNull(body);
		requireNonNull(charset);

		List<Map<String, Object>> fieldMappings = new ArrayList<>();

		for (String line : splitLines(new String(body, charset)))
			fieldMappings.add(Map.of(Event.MESSAGE_FIELD, line));

		return fieldMappings;
	}

	/**
	 * Splits on {@code \n}, dropping a trailing {@code \r} from each line.
	 * The final segment is included even without a trailing delimiter; an empty final segment is not.
	 */
	@NonNull
	static List<@NonNull String> splitLines(@NonNull String text) {
		requireNonNull(text);

		List<String> lines = new ArrayList<>();
		int start = 0;

		while (start < text.length()) {
			int end = text.indexOf('\n', start);

			if (end == -1)
				end = text.length();

			String line = text.substring(start, end);

			if (line.endsWith("\r"))
				line = line.substring(0, line.length() - 1);

			lines.add(line);
			start = end + 1;
		}

		return lines;
	}

	@Override
	@NonNull
	public String toString() {
		return "line";
	}
}
