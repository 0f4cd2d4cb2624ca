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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Sluice's main class - accepts HTTP {@code POST}s, decodes their bodies into {@link Event}s and hands them to a
 * bounded downstream {@link EventQueue}, answering with HTTP 429 when every worker is busy.
 * <p>
 * Sample usage:
 * <pre>{@code  BlockingQueue<Event> queue = new ArrayBlockingQueue<>(10_000);
 *
 * SluiceConfig config = SluiceConfig.withPort(8080)
 *   .threads(4)
 *   .additionalCodecs(Map.of("application/x-ndjson", "json_lines"))
 *   .build();
 *
 * try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
 *   sluice.start();
 *   sluice.awaitShutdown();
 * }}</pre>
 * <p>
 * Configuration is validated when the {@link SluiceConfig} is built; problems that can only be detected at start
 * (an unreadable keystore, a port conflict) surface from {@link #start()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Sluice implements AutoCloseable {
	@NonNull
	private final SluiceConfig sluiceConfig;
	@NonNull
	private final EventQueue eventQueue;
	@NonNull
	private final Server server;
	@NonNull
	private final RequestProcessor requestProcessor;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;

	/**
	 * Acquires a Sluice instance that feeds {@code eventQueue}.
	 *
	 * @param sluiceConfig configuration that drives the Sluice system
	 * @param eventQueue   the downstream queue that receives decoded events
	 * @return the Sluice instance, not yet started
	 */
	@NonNull
	public static Sluice withConfig(@NonNull SluiceConfig sluiceConfig,
																	@NonNull EventQueue eventQueue) {
		requireNonNull(sluiceConfig);
		requireNonNull(eventQueue);

		return new Sluice(sluiceConfig, eventQueue);
	}

	private Sluice(@NonNull SluiceConfig sluiceConfig,
								 @NonNull EventQueue eventQueue) {
		requireNonNull(sluiceConfig);
		requireNonNull(eventQueue);

		Server.Builder serverBuilder = Server.withPort(sluiceConfig.getPort())
				.host(sluiceConfig.getHost())
				.concurrency(sluiceConfig.getThreads())
				.requestTimeout(sluiceConfig.getRequestTimeout())
				.shutdownTimeout(sluiceConfig.getShutdownTimeout())
				.maximumRequestSizeInBytes(sluiceConfig.getMaximumContentLength())
				.responseHeaders(sluiceConfig.getResponseHeaders());

		if (sluiceConfig.getSsl())
			serverBuilder.keystore(sluiceConfig.getKeystore().orElse(null), sluiceConfig.getKeystorePassword().orElse(null));

		this.sluiceConfig = sluiceConfig;
		this.eventQueue = eventQueue;
		this.server = serverBuilder.build();
		this.requestProcessor = RequestProcessor.fromConfig(sluiceConfig, eventQueue);
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		this.server.initialize(getRequestProcessor()::process, sluiceConfig.getLifecycleObserver());
	}

	/**
	 * Starts the managed server.
	 * <p>
	 * If the server is already started, this is a no-op.
	 *
	 * @throws com.sluice.exception.ConfigurationException if the TLS keystore cannot be loaded
	 * @throws java.io.UncheckedIOException                if the listening socket cannot be bound
	 */
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			LifecycleObserver lifecycleObserver = getSluiceConfig().getLifecycleObserver();
			lifecycleObserver.willStartSluice(this);

			try {
				getServer().start();
			} catch (RuntimeException e) {
				lifecycleObserver.didFailToStartSluice(this, e);
				throw e;
			}

			lifecycleObserver.didStartServer(getServer());
			lifecycleObserver.didStartSluice(this);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops the managed server, waiting up to the configured shutdown timeout for in-flight requests.
	 * <p>
	 * If the server is already stopped, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (isStarted()) {
				LifecycleObserver lifecycleObserver = getSluiceConfig().getLifecycleObserver();

				lifecycleObserver.willStopSluice(this);
				getServer().stop();
				lifecycleObserver.didStopServer(getServer());
				lifecycleObserver.didStopSluice(this);
			}
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until {@link #stop()} is called or the JVM begins shutting down
	 * ({@code SIGTERM}, CTRL-C, {@code System.exit(...)} and so forth), in which case {@link #stop()} is invoked.
	 *
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(this::stop, "sluice-shutdown-hook");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException ignored) {
				// JVM is already shutting down
			}
		}
	}

	/**
	 * Synonym for {@link #stop()}.
	 */
	@Override
	public void close() {
		stop();
	}

	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getServer().isStarted();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * The port the server is listening on, useful when configured with port {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if not started
	 */
	@NonNull
	public Optional<Integer> getLocalPort() {
		return getServer().getLocalPort();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sluiceConfig=%s, eventQueue=%s}", getClass().getSimpleName(), getSluiceConfig(), getEventQueue());
	}

	@NonNull
	public SluiceConfig getSluiceConfig() {
		return this.sluiceConfig;
	}

	@NonNull
	public EventQueue getEventQueue() {
		return this.eventQueue;
	}

	@NonNull
	Server getServer() {
		return this.server;
	}

	@NonNull
	RequestProcessor getRequestProcessor() {
		return this.requestProcessor;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}
}
