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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Read-only hooks for observing Sluice's lifecycle and per-request processing.
 * <p>
 * All methods have no-op defaults except {@link #didReceiveLogEvent(LogEvent)}, which logs through SLF4J.
 * Exceptions thrown from these methods are caught and never affect request handling.
 * <p>
 * Observers are invoked on accept-loop and worker threads and so must be threadsafe and fast; in particular, a slow
 * observer holds a worker slot for longer.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called before Sluice starts.
	 */
	default void willStartSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after Sluice has started and its server is accepting connections.
	 */
	default void didStartSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called if Sluice could not start, for example because of a keystore problem or a port conflict.
	 */
	default void didFailToStartSluice(@NonNull Sluice sluice,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before Sluice stops.
	 */
	default void willStopSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after Sluice has stopped and in-flight requests have drained (or been abandoned).
	 */
	default void didStopSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after the server has bound its listening socket.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server has closed its listening socket and drained its workers.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called on the accept thread when a connection is answered without entering the request pipeline.
	 *
	 * @param remoteAddress             the client's address, if known
	 * @param connectionRejectionReason why the connection was rejected
	 */
	default void didRejectConnection(@Nullable InetSocketAddress remoteAddress,
																	 @NonNull ConnectionRejectionReason connectionRejectionReason) {
		// No-op by default
	}

	/**
	 * Called on a worker thread after a request has been read and before it is processed.
	 */
	default void didStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called on a worker thread after an event has been accepted by the downstream {@link EventQueue}.
	 */
	default void didEnqueueEvent(@NonNull Request request,
															 @NonNull Event event) {
		// No-op by default
	}

	/**
	 * Called on a worker thread after a request has been processed, before its response is written.
	 *
	 * @param request            the request
	 * @param marshaledResponse  the response that will be written
	 * @param processingDuration how long processing took, including time spent blocked on the downstream queue
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@NonNull MarshaledResponse marshaledResponse,
																				@NonNull Duration processingDuration) {
		// No-op by default
	}

	/**
	 * Called when Sluice emits a log event.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger logger = LoggerFactory.getLogger(LifecycleObserver.class);
		Throwable throwable = logEvent.getThrowable().orElse(null);

		logger.atLevel(logEvent.getLogEventType().getLevel())
				.setCause(throwable)
				.log("[{}] {}", logEvent.getLogEventType().name(), logEvent.getMessage());
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
