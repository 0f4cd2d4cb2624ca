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
import org.slf4j.event.Level;

import static java.util.Objects.requireNonNull;

/**
 * Kinds of {@link LogEvent}s Sluice emits, each with the SLF4J level the default {@link LifecycleObserver} logs it at.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * An unexpected error occurred while accepting, reading or answering a connection.
	 */
	SERVER_INTERNAL_ERROR(Level.ERROR),
	/**
	 * The listening socket failed to accept a connection.  The accept loop keeps running.
	 */
	SERVER_ACCEPT_FAILED(Level.WARN),
	/**
	 * A connection was answered with 429 because no worker slot was free.
	 */
	SERVER_CONNECTION_REJECTED(Level.DEBUG),
	/**
	 * The bytes received could not be parsed as an HTTP/1.1 request.
	 */
	SERVER_UNPARSEABLE_REQUEST(Level.DEBUG),
	/**
	 * Reading a request failed at the transport level, e.g. a failed TLS handshake or a reset connection.
	 */
	SERVER_REQUEST_READ_FAILED(Level.DEBUG),
	/**
	 * The client did not send a complete request before the request timeout elapsed.
	 */
	SERVER_REQUEST_READ_TIMEOUT(Level.DEBUG),
	/**
	 * The request body exceeded the maximum content length.
	 */
	SERVER_CONTENT_TOO_LARGE(Level.DEBUG),
	/**
	 * The server could not write a response, typically because the client went away.
	 */
	SERVER_RESPONSE_WRITE_FAILED(Level.DEBUG),
	/**
	 * A request failed the credential check.
	 */
	AUTHENTICATION_FAILED(Level.DEBUG),
	/**
	 * A request body could not be decompressed.
	 */
	DECOMPRESSION_FAILED(Level.DEBUG),
	/**
	 * A request body could not be decoded by its codec.
	 */
	DECODE_FAILED(Level.DEBUG),
	/**
	 * A worker was interrupted while waiting for downstream queue capacity, typically during shutdown.
	 */
	ENQUEUE_INTERRUPTED(Level.WARN),
	/**
	 * A {@link LifecycleObserver} callback threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED(Level.ERROR);

	@NonNull
	private final Level level;

	LogEventType(@NonNull Level level) {
		requireNonNull(level);
		this.level = level;
	}

	@NonNull
	public Level getLevel() {
		return this.level;
	}
}
