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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.BlockingQueue;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class BlockingQueueEventQueue implements EventQueue {
	@NonNull
	private final BlockingQueue<Event> blockingQueue;

	BlockingQueueEventQueue(@NonNull BlockingQueue<Event> blockingQueue) {
		requireNonNull(blockingQueue);
		this.blockingQueue = blockingQueue;
	}

	@Override
	public void enqueue(@NonNull Event event) throws InterruptedException {
		requireNonNull(event);
		getBlockingQueue().put(event);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{remainingCapacity=%d}", getClass().getSimpleName(), getBlockingQueue().remainingCapacity());
	}

	@NonNull
	BlockingQueue<Event> getBlockingQueue() {
		return this.blockingQueue;
	}
}
