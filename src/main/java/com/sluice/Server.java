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
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A plaintext or TLS HTTP/1.1 listener that admits at most {@code concurrency} connections at once and answers the
 * rest with HTTP 429.
 * <p>
 * Sluice ships with {@link DefaultServer}, acquired via {@link #withPort(Integer)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts accepting connections.
	 * <p>
	 * If the server is already started, this is a no-op.
	 *
	 * @throws com.sluice.exception.ConfigurationException if the TLS keystore cannot be loaded
	 * @throws java.io.UncheckedIOException                if the listening socket cannot be bound
	 */
	void start();

	/**
	 * Closes the listening socket, waits up to the shutdown timeout for in-flight requests, then interrupts whatever remains.
	 * <p>
	 * If the server is already stopped, this is a no-op.
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The port the listening socket is bound to, which differs from the configured port when that was {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if the server is not started
	 */
	@NonNull
	Optional<Integer> getLocalPort();

	/**
	 * Wires the server to its request handler and observer.  Called once by {@link Sluice} before {@link #start()}.
	 *
	 * @param requestHandler    handles each admitted, fully-read request on a worker thread
	 * @param lifecycleObserver receives lifecycle callbacks and log events
	 */
	void initialize(@NonNull RequestHandler requestHandler,
									@NonNull LifecycleObserver lifecycleObserver);

	@Override
	default void close() {
		stop();
	}

	/**
	 * Turns a request into the response to write.  Runs on a worker thread, which holds an admission slot until the
	 * response has been written.
	 */
	@FunctionalInterface
	interface RequestHandler {
		@NonNull
		MarshaledResponse handleRequest(@NonNull Request request);
	}

	/**
	 * Acquires a builder for {@link Server} instances.
	 *
	 * @param port the port to listen on, or {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct instances of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Integer concurrency;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Duration rejectionDrainTimeout;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Path keystore;
		@Nullable
		String keystorePassword;
		@NonNull
		final Map<@NonNull String, @NonNull String> responseHeaders;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);

			this.port = port;
			this.responseHeaders = new LinkedHashMap<>();
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * Sets the number of worker threads, which is also the number of connections admitted at once.
		 */
		@NonNull
		public Builder concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		/**
		 * Sets the socket read timeout applied while reading a request.
		 */
		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * Sets how long the accept thread keeps reading (and discarding) a rejected client's input after writing 429.
		 */
		@NonNull
		public Builder rejectionDrainTimeout(@Nullable Duration rejectionDrainTimeout) {
			this.rejectionDrainTimeout = rejectionDrainTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		/**
		 * Enables TLS using a PKCS12 or JKS keystore.  The keystore is loaded when the server starts.
		 */
		@NonNull
		public Builder keystore(@Nullable Path keystore,
														@Nullable String keystorePassword) {
			this.keystore = keystore;
			this.keystorePassword = keystorePassword;
			return this;
		}

		/**
		 * Sets headers written on every response the server itself produces (429, 400 for unparseable requests, and so forth).
		 */
		@NonNull
		public Builder responseHeaders(@Nullable Map<@NonNull String, @NonNull String> responseHeaders) {
			this.responseHeaders.clear();

			if (responseHeaders != null)
				this.responseHeaders.putAll(responseHeaders);

			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
