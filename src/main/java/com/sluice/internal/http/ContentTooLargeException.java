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

package com.sluice.internal.http;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a request body is larger than the configured maximum.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class ContentTooLargeException extends Exception {
	@NonNull
	private final Integer maximumSizeInBytes;

	public ContentTooLargeException(@NonNull Integer maximumSizeInBytes) {
		super(format("Request body exceeds the maximum of %d bytes", requireNonNull(maximumSizeInBytes)));
		this.maximumSizeInBytes = maximumSizeInBytes;
	}

	@NonNull
	public Integer getMaximumSizeInBytes() {
		return this.maximumSizeInBytes;
	}
}
