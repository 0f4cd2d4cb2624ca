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
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class PlainCodec implements Codec {
	@NonNull
	private static final PlainCodec DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new PlainCodec();
	}

	@NonNull
	public static PlainCodec defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private PlainCodec() {
		// Only the default instance
	}

	@Override
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> decode(byte @NonNull [] body,
																																			@NonNull Charset charset) {
		requireNonNull(body);
		requireNonNull(charset);

		return List.of(Map.of(Event.MESSAGE_FIELD, new String(body, charset)));
	}

	@Override
	@NonNull
	public String toString() {
		return "plain";
	}
}
