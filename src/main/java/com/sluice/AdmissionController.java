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
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fixed-size pool of worker slots that decides, per accepted connection, whether it is admitted or must be rejected.
 * <p>
 * Admission never waits: {@link #tryAdmit()} either claims a free slot immediately or reports that none is free.
 * A slot stays claimed until its {@link Admission} is closed, which the server does only after the response for that connection
 * has been written.  Because a worker blocked on a full {@link EventQueue} still holds its slot, a saturated downstream
 * consumer shows up here as "no free slots" without ever inspecting the queue.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class AdmissionController {
	@NonNull
	private final Integer slots;
	@NonNull
	private final Semaphore semaphore;

	/**
	 * Acquires an admission controller with the given number of worker slots.
	 *
	 * @param slots the number of connections that may be processed concurrently, must be &gt; 0
	 * @return the admission controller
	 */
	@NonNull
	public static AdmissionController withSlots(@NonNull Integer slots) {
		requireNonNull(slots);
		return new AdmissionController(slots);
	}

	private AdmissionController(@NonNull Integer slots) {
		requireNonNull(slots);

		if (slots <= 0)
			throw new IllegalArgumentException("Number of worker slots must be > 0");

		this.slots = slots;
		this.semaphore = new Semaphore(slots);
	}

	/**
	 * Claims a free worker slot, if one is available right now.
	 *
	 * @return the admission, which must be closed to release the slot; {@link Optional#empty()} if every slot is occupied
	 */
	@NonNull
	public Optional<Admission> tryAdmit() {
		if (!getSemaphore().tryAcquire())
			return Optional.empty();

		return Optional.of(new Admission(getSemaphore()));
	}

	@NonNull
	public Integer getSlots() {
		return this.slots;
	}

	@NonNull
	public Integer getAvailableSlots() {
		return getSemaphore().availablePermits();
	}

	@NonNull
	public Integer getOccupiedSlots() {
		return getSlots() - getAvailableSlots();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{slots=%d, availableSlots=%d}", getClass().getSimpleName(), getSlots(), getAvailableSlots());
	}

	@NonNull
	private Semaphore getSemaphore() {
		return this.semaphore;
	}

	/**
	 * A claimed worker slot.  Closing releases the slot; closing more than once has no further effect.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	public static final class Admission implements AutoCloseable {
		@NonNull
		private final Semaphore semaphore;
		@NonNull
		private final AtomicBoolean released;

		private Admission(@NonNull Semaphore semaphore) {
			requireNonNull(semaphore);

			this.semaphore = semaphore;
			this.released = new AtomicBoolean(false);
		}

		@Override
		public void close() {
			if (this.released.compareAndSet(false, true))
				this.semaphore.release();
		}

		@NonNull
		public Boolean isReleased() {
			return this.released.get();
		}
	}
}
