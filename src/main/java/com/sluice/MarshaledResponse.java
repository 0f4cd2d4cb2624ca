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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finalized HTTP response, suitable for sending to clients over the wire.
 * <p>
 * Header names are case-insensitive; a later {@link Builder#header(String, String)} call replaces an earlier value for the same name.
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(Integer)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class MarshaledResponse {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@Nullable
	private final byte[] body;

	/**
	 * Acquires a builder for {@link MarshaledResponse} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Builder copy() {
		return new Builder(getStatusCode())
				.headers(getHeaders())
				.body(this.body);
	}

	private MarshaledResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (Map.Entry<String, String> entry : builder.headers.entrySet()) {
			Utilities.validateHeaderNameAndValue(entry.getKey(), entry.getValue());
			headers.put(entry.getKey(), entry.getValue());
		}

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(headers);
		this.body = builder.body;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), format("%d bytes", getBody().isPresent() ? getBody().get().length : 0));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof MarshaledResponse marshaledResponse))
			return false;

		return Objects.equals(getStatusCode(), marshaledResponse.getStatusCode())
				&& Objects.equals(getHeaders(), marshaledResponse.getHeaders())
				&& Arrays.equals(this.body, marshaledResponse.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatusCode(), getHeaders(), Arrays.hashCode(this.body));
	}

	/**
	 * The HTTP status code for this response.
	 *
	 * @return the status code
	 */
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * The HTTP headers to write for this response, excluding the framing headers ({@code Content-Length}, {@code Connection})
	 * which are written by the server.
	 *
	 * @return the response headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getHeaders() {
		return this.headers;
	}

	/**
	 * The HTTP response body to write, if available.
	 *
	 * @return the response body, or {@link Optional#empty()} if none
	 */
	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * The response body decoded as UTF-8, mostly useful for tests and logging.
	 *
	 * @return the body text, or {@link Optional#empty()} if there is no body
	 */
	@NonNull
	public Optional<String> getBodyAsString() {
		return getBody().map(body -> new String(body, StandardCharsets.UTF_8));
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer statusCode;
		@NonNull
		private final Map<@NonNull String, @NonNull String> headers;
		@Nullable
		private byte[] body;

		private Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);

			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
		}

		@NonNull
		public Builder statusCode(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
			return this;
		}

		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.put(name, value);
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull String> headers) {
			if (headers != null)
				this.headers.putAll(headers);

			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder body(@Nullable String body) {
			this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
			return this;
		}

		@NonNull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}
}
