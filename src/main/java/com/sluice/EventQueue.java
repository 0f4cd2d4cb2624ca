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

import java.util.concurrent.BlockingQueue;

import static java.util.Objects.requireNonNull;

/**
 * The downstream collaborator that receives decoded {@link Event}s.
 * <p>
 * Implementations must block while they are full and must never silently drop an event.
 * A request worker that is blocked in {@link #enqueue(Event)} keeps its worker slot occupied, which is how downstream
 * saturation becomes visible to new clients as HTTP 429.
 * <p>
 * Any {@link BlockingQueue} can be adapted via {@link #fromBlockingQueue(BlockingQueue)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface EventQueue {
	/**
	 * Hands an event to the downstream consumer, blocking until there is capacity for it.
	 *
	 * @param event the event to enqueue
	 * @throws InterruptedException if the calling worker is interrupted while waiting, e.g. during a forced shutdown
	 */
	void enqueue(@NonNull Event event) throws InterruptedException;

	/**
	 * Adapts a {@link BlockingQueue} by delegating to its blocking {@link BlockingQueue#put(Object)} operation.
	 *
	 * @param blockingQueue the queue to adapt
	 * @return an {@code EventQueue} backed by {@code blockingQueue}
	 */
	@NonNull
	static EventQueue fromBlockingQueue(@NonNull BlockingQueue<Event> blockingQueue) {
		requireNonNull(blockingQueue);
		return new BlockingQueueEventQueue(blockingQueue);
	}
}
