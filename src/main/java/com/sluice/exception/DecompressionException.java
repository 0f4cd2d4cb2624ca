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

package com.sluice.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Exception thrown when a request body cannot be decompressed according to its {@code Content-Encoding}.
 * <p>
 * For example, a body declared as {@code gzip} that is not a valid gzip stream, or whose decompressed size exceeds the configured maximum.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class DecompressionException extends BadRequestException {
	public DecompressionException(@Nullable String message) {
		super(message);
	}

	public DecompressionException(@Nullable String message,
																@Nullable Throwable cause) {
		super(message, cause);
	}
}
