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
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static com.sluice.Utilities.emptyByteArray;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request as read off the wire by a request worker.
 * <p>
 * Header names are case-insensitive.  A request is consumed entirely within one worker and discarded once its response has been written.
 * <p>
 * Instances can be acquired via the {@link #withMethodAndUri(String, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String method;
	@NonNull
	private final String uri;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> headers;
	@NonNull
	private final byte[] body;
	@Nullable
	private final InetSocketAddress remoteAddress;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the HTTP method, e.g. {@code POST}
	 * @param uri    the request target, e.g. {@code /events?source=web}
	 * @return the builder
	 */
	@NonNull
	public static Builder withMethodAndUri(@NonNull String method,
																				 @NonNull String uri) {
		requireNonNull(method);
		requireNonNull(uri);

		return new Builder(method, uri);
	}

	private Request(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (Map.Entry<String, List<String>> entry : builder.headers.entrySet())
			headers.computeIfAbsent(entry.getKey(), name -> new ArrayList<>()).addAll(entry.getValue());

		headers.replaceAll((name, values) -> Collections.unmodifiableList(values));

		this.method = builder.method;
		this.uri = builder.uri;
		this.headers = Collections.unmodifiableMap(headers);
		this.body = builder.body == null ? emptyByteArray() : builder.body;
		this.remoteAddress = builder.remoteAddress;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, uri=%s, remoteAddress=%s, body=%d bytes}", getClass().getSimpleName(),
				getMethod(), getUri(), getRemoteAddress().orElse(null), getBody().length);
	}

	/**
	 * The first value of the named header, if present.
	 *
	 * @param name the header name (case-insensitive)
	 * @return the first header value, or {@link Optional#empty()} if the header was not sent
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getHeaders().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	@NonNull
	public Optional<String> getContentType() {
		return getHeader("Content-Type");
	}

	@NonNull
	public Optional<String> getContentEncoding() {
		return getHeader("Content-Encoding");
	}

	@NonNull
	public Optional<String> getAuthorization() {
		return getHeader("Authorization");
	}

	/**
	 * The client's IP address as text, e.g. {@code 127.0.0.1}.
	 *
	 * @return the remote host address, or {@link Optional#empty()} if it is unknown
	 */
	@NonNull
	public Optional<String> getRemoteHost() {
		return getRemoteAddress().map(remoteAddress -> remoteAddress.getAddress() == null
				? remoteAddress.getHostString()
				: remoteAddress.getAddress().getHostAddress());
	}

	@NonNull
	public String getMethod() {
		return this.method;
	}

	@NonNull
	public String getUri() {
		return this.uri;
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getHeaders() {
		return this.headers;
	}

	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	/**
	 * Builder used to construct instances of {@link Request}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String uri;
		@NonNull
		private final Map<@NonNull String, @NonNull List<@NonNull String>> headers;
		@Nullable
		private byte[] body;
		@Nullable
		private InetSocketAddress remoteAddress;

		private Builder(@NonNull String method,
										@NonNull String uri) {
			requireNonNull(method);
			requireNonNull(uri);

			this.method = method;
			this.uri = uri;
			this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		}

		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @NonNull List<@NonNull String>> headers) {
			this.headers.clear();

			if (headers != null)
				for (Map.Entry<String, List<String>> entry : headers.entrySet())
					for (String value : entry.getValue())
						header(entry.getKey(), value);

			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}
}
