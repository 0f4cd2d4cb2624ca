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

import com.sluice.exception.ConfigurationException;
import com.sluice.internal.http.ContentTooLargeException;
import com.sluice.internal.http.MalformedRequestException;
import com.sluice.internal.http.RequestReader;
import com.sluice.internal.http.ResponseWriter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Blocking-socket {@link Server}: one accept thread plus a fixed pool of worker threads.
 * <p>
 * The accept thread asks the {@link AdmissionController} for a slot for each accepted connection.  Admitted
 * connections are handed to a worker, which reads the request, runs the {@link RequestHandler} and writes the
 * response before giving its slot back.  Connections that find no free slot are answered with 429 directly on the
 * accept thread and never reach a worker.  Closing a rejected connection (half-close, brief drain of client input, close)
 * happens on a small separate pool so the accept thread is free to take the next connection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_REJECTION_DRAIN_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Integer MAXIMUM_DRAINED_BYTES;
	@NonNull
	private static final Integer MAXIMUM_REJECTION_CLOSER_THREADS;
	@NonNull
	private static final Integer MAXIMUM_PENDING_REJECTION_CLOSES;
	@NonNull
	private static final Duration ACCEPT_THREAD_JOIN_TIMEOUT;
	@NonNull
	private static final Duration FORCED_SHUTDOWN_GRACE_PERIOD;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_REJECTION_DRAIN_TIMEOUT = Duration.ofMillis(250);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 100 * 1_024 * 1_024;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 1_024;
		MAXIMUM_DRAINED_BYTES = 1_024 * 1_024;
		MAXIMUM_REJECTION_CLOSER_THREADS = 4;
		MAXIMUM_PENDING_REJECTION_CLOSES = 1_024;
		ACCEPT_THREAD_JOIN_TIMEOUT = Duration.ofSeconds(5);
		FORCED_SHUTDOWN_GRACE_PERIOD = Duration.ofMillis(500);
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final Integer concurrency;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Duration rejectionDrainTimeout;
	@NonNull
	private final Integer socketPendingConnectionLimit;
	@Nullable
	private final Path keystore;
	@Nullable
	private final String keystorePassword;
	@NonNull
	private final Map<@NonNull String, @NonNull String> responseHeaders;
	@NonNull
	private final RequestReader requestReader;
	@NonNull
	private final AdmissionController admissionController;
	@NonNull
	private final Set<@NonNull Socket> activeSockets;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile RequestHandler requestHandler;
	@Nullable
	private volatile LifecycleObserver lifecycleObserver;
	@Nullable
	private volatile ServerSocket serverSocket;
	@Nullable
	private volatile Thread acceptThread;
	@Nullable
	private volatile ExecutorService workerExecutorService;
	@Nullable
	private volatile ExecutorService rejectionExecutorService;
	private volatile boolean stopping;

	DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.port = builder.port;
		this.host = builder.host == null ? DEFAULT_HOST : builder.host;
		this.concurrency = builder.concurrency == null ? Runtime.getRuntime().availableProcessors() : builder.concurrency;
		this.requestTimeout = builder.requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : builder.requestTimeout;
		this.shutdownTimeout = builder.shutdownTimeout == null ? DEFAULT_SHUTDOWN_TIMEOUT : builder.shutdownTimeout;
		this.rejectionDrainTimeout = builder.rejectionDrainTimeout == null ? DEFAULT_REJECTION_DRAIN_TIMEOUT : builder.rejectionDrainTimeout;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit == null ? DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT : builder.socketPendingConnectionLimit;
		this.keystore = builder.keystore;
		this.keystorePassword = builder.keystorePassword;
		this.responseHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.responseHeaders));
		this.requestReader = RequestReader.withMaximumBodySizeInBytes(builder.maximumRequestSizeInBytes == null
				? DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES : builder.maximumRequestSizeInBytes);

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port %d is out of range", this.port));

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException("Request timeout must be positive");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must not be negative");

		if (this.rejectionDrainTimeout.isNegative() || this.rejectionDrainTimeout.isZero())
			throw new IllegalArgumentException("Rejection drain timeout must be positive");

		// Validates concurrency > 0
		this.admissionController = AdmissionController.withSlots(this.concurrency);
		this.activeSockets = ConcurrentHashMap.newKeySet();
		this.lock = new ReentrantLock();
	}

	@Override
	public void initialize(@NonNull RequestHandler requestHandler,
												 @NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(requestHandler);
		requireNonNull(lifecycleObserver);

		this.requestHandler = requestHandler;
		this.lifecycleObserver = lifecycleObserver;
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			if (this.requestHandler == null)
				throw new IllegalStateException(format("%s must be initialized before it is started", Server.class.getSimpleName()));

			// Keystore problems surface here, before anything is bound
			SSLContext sslContext = this.keystore == null ? null : createSslContext(this.keystore);
			ServerSocket serverSocket = null;

			try {
				serverSocket = sslContext == null ? new ServerSocket() : sslContext.getServerSocketFactory().createServerSocket();
				serverSocket.setReuseAddress(true);
				serverSocket.bind(new InetSocketAddress(getHost(), getPort()), getSocketPendingConnectionLimit());
			} catch (IOException e) {
				closeQuietly(serverSocket);
				throw new UncheckedIOException(format("Unable to bind to %s:%d", getHost(), getPort()), e);
			}

			ExecutorService workerExecutorService = Executors.newFixedThreadPool(getConcurrency(), new NonvirtualThreadFactory("sluice-worker"));
			ExecutorService rejectionExecutorService = createRejectionExecutorService();
			ServerSocket acceptingServerSocket = serverSocket;
			Thread acceptThread = new Thread(() -> acceptConnections(acceptingServerSocket, workerExecutorService, rejectionExecutorService), "sluice-acceptor");

			this.stopping = false;
			this.serverSocket = serverSocket;
			this.workerExecutorService = workerExecutorService;
			this.rejectionExecutorService = rejectionExecutorService;
			this.acceptThread = acceptThread;

			acceptThread.start();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			this.stopping = true;

			try {
				requireNonNull(this.serverSocket).close();
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to close listening socket")
						.throwable(e)
						.build());
			}

			ExecutorService workerExecutorService = requireNonNull(this.workerExecutorService);
			ExecutorService rejectionExecutorService = requireNonNull(this.rejectionExecutorService);
			boolean interrupted = false;

			try {
				// The accept thread might be finishing a rejection write
				requireNonNull(this.acceptThread).join(ACCEPT_THREAD_JOIN_TIMEOUT.toMillis());

				workerExecutorService.shutdown();

				long remainingMillis = Math.max(0L, getShutdownTimeout().toMillis());
				boolean terminated = remainingMillis == 0L ? workerExecutorService.isTerminated()
						: workerExecutorService.awaitTermination(remainingMillis, TimeUnit.MILLISECONDS);

				if (!terminated)
					forceShutdown(workerExecutorService);

				// Pending rejection closes are each bounded by the drain timeout
				rejectionExecutorService.shutdown();

				if (!rejectionExecutorService.awaitTermination(getRejectionDrainTimeout().plus(FORCED_SHUTDOWN_GRACE_PERIOD).toMillis(), TimeUnit.MILLISECONDS))
					rejectionExecutorService.shutdownNow();
			} catch (InterruptedException e) {
				interrupted = true;
				workerExecutorService.shutdownNow();
				rejectionExecutorService.shutdownNow();
				closeActiveSockets();
			} finally {
				if (interrupted)
					Thread.currentThread().interrupt();
			}
		} finally {
			this.serverSocket = null;
			this.workerExecutorService = null;
			this.rejectionExecutorService = null;
			this.acceptThread = null;

			getLock().unlock();
		}
	}

	/**
	 * Interrupts workers (unblocking queue waits, which answer 503), then closes sockets that are still open so that
	 * workers blocked on reads give up too.
	 */
	private void forceShutdown(@NonNull ExecutorService workerExecutorService) throws InterruptedException {
		requireNonNull(workerExecutorService);

		workerExecutorService.shutdownNow();

		if (workerExecutorService.awaitTermination(FORCED_SHUTDOWN_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS))
			return;

		closeActiveSockets();

		if (!workerExecutorService.awaitTermination(FORCED_SHUTDOWN_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS))
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Worker threads did not terminate during shutdown").build());
	}

	private void closeActiveSockets() {
		for (Socket socket : getActiveSockets())
			closeQuietly(socket);
	}

	@Override
	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return this.serverSocket != null;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public Optional<Integer> getLocalPort() {
		ServerSocket serverSocket = this.serverSocket;
		return serverSocket == null ? Optional.empty() : Optional.of(serverSocket.getLocalPort());
	}

	private void acceptConnections(@NonNull ServerSocket serverSocket,
																 @NonNull ExecutorService workerExecutorService,
																 @NonNull ExecutorService rejectionExecutorService) {
		requireNonNull(serverSocket);
		requireNonNull(workerExecutorService);
		requireNonNull(rejectionExecutorService);

		while (!this.stopping) {
			Socket socket;

			try {
				socket = serverSocket.accept();
			} catch (IOException e) {
				if (this.stopping || serverSocket.isClosed())
					break;

				safelyLog(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "Unable to accept connection")
						.throwable(e)
						.build());
				continue;
			}

			try {
				dispatchConnection(socket, workerExecutorService, rejectionExecutorService);
			} catch (Throwable t) {
				closeQuietly(socket);
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to dispatch accepted connection")
						.throwable(t)
						.build());
			}
		}
	}

	private void dispatchConnection(@NonNull Socket socket,
																	@NonNull ExecutorService workerExecutorService,
																	@NonNull ExecutorService rejectionExecutorService) {
		requireNonNull(socket);
		requireNonNull(workerExecutorService);
		requireNonNull(rejectionExecutorService);

		InetSocketAddress remoteAddress = remoteAddressFor(socket);
		AdmissionController.Admission admission = getAdmissionController().tryAdmit().orElse(null);

		if (admission == null) {
			rejectConnection(socket, remoteAddress, ConnectionRejectionReason.NO_WORKER_SLOT_AVAILABLE, rejectionExecutorService);
			return;
		}

		getActiveSockets().add(socket);

		try {
			workerExecutorService.execute(() -> handleConnection(socket, remoteAddress, admission));
		} catch (RejectedExecutionException e) {
			getActiveSockets().remove(socket);
			admission.close();
			rejectConnection(socket, remoteAddress, ConnectionRejectionReason.SERVER_STOPPING, rejectionExecutorService);
		}
	}

	/**
	 * Answers a connection without reading its request.  Plaintext responses are written on the accept thread; TLS
	 * responses, which need a handshake first, are written on {@code rejectionExecutorService}.
	 * <p>
	 * Closing is handed to {@code rejectionExecutorService}: our side of the connection is half-closed and the client's
	 * input is drained briefly so that closing does not reset the connection before the client has read the response.
	 * If that pool is saturated the connection is closed right away instead.
	 */
	private void rejectConnection(@NonNull Socket socket,
																@Nullable InetSocketAddress remoteAddress,
																@NonNull ConnectionRejectionReason connectionRejectionReason,
																@NonNull ExecutorService rejectionExecutorService) {
		requireNonNull(socket);
		requireNonNull(connectionRejectionReason);
		requireNonNull(rejectionExecutorService);

		safelyInvokeLifecycleObserver("didRejectConnection",
				lifecycleObserver -> lifecycleObserver.didRejectConnection(remoteAddress, connectionRejectionReason));

		safelyLog(LogEvent.with(LogEventType.SERVER_CONNECTION_REJECTED, format("Rejected connection from %s (%s)",
				remoteAddress == null ? "unknown address" : remoteAddress, connectionRejectionReason.name())).build());

		Integer statusCode = connectionRejectionReason == ConnectionRejectionReason.NO_WORKER_SLOT_AVAILABLE ? 429 : 503;

		// Writing to a TLS socket means a handshake first, which must not hold up the accept thread
		if (socket instanceof SSLSocket) {
			try {
				rejectionExecutorService.execute(() -> {
					if (writeRejectionResponse(socket, statusCode))
						closeRejectedConnection(socket);
				});
			} catch (RejectedExecutionException e) {
				closeQuietly(socket);
			}

			return;
		}

		if (!writeRejectionResponse(socket, statusCode))
			return;

		try {
			rejectionExecutorService.execute(() -> closeRejectedConnection(socket));
		} catch (RejectedExecutionException e) {
			closeQuietly(socket);
		}
	}

	/**
	 * @return {@code true} if the response was written, {@code false} if writing failed and the socket was closed
	 */
	private boolean writeRejectionResponse(@NonNull Socket socket,
																				 @NonNull Integer statusCode) {
		requireNonNull(socket);
		requireNonNull(statusCode);

		try {
			socket.setSoTimeout((int) Math.max(1L, getRejectionDrainTimeout().toMillis()));
			ResponseWriter.writeResponse(socket.getOutputStream(), serverResponse(statusCode));
			return true;
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_RESPONSE_WRITE_FAILED, format("Unable to write %d response to rejected connection", statusCode))
					.throwable(e)
					.build());

			closeQuietly(socket);
			return false;
		}
	}

	private void closeRejectedConnection(@NonNull Socket socket) {
		requireNonNull(socket);

		try (Socket rejectedSocket = socket) {
			// TLS sockets do not support half-close
			if (!(rejectedSocket instanceof SSLSocket))
				rejectedSocket.shutdownOutput();

			drainInput(rejectedSocket);
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_RESPONSE_WRITE_FAILED, "Unable to cleanly close rejected connection")
					.throwable(e)
					.build());
		}
	}

	@NonNull
	private ExecutorService createRejectionExecutorService() {
		ThreadPoolExecutor rejectionExecutorService = new ThreadPoolExecutor(MAXIMUM_REJECTION_CLOSER_THREADS, MAXIMUM_REJECTION_CLOSER_THREADS,
				30L, TimeUnit.SECONDS, new ArrayBlockingQueue<>(MAXIMUM_PENDING_REJECTION_CLOSES), new NonvirtualThreadFactory("sluice-rejector"));

		rejectionExecutorService.allowCoreThreadTimeOut(true);
		return rejectionExecutorService;
	}

	private void drainInput(@NonNull Socket socket) throws IOException {
		requireNonNull(socket);

		InputStream inputStream = socket.getInputStream();
		long deadlineNanos = System.nanoTime() + getRejectionDrainTimeout().toNanos();
		byte[] buffer = new byte[8_192];
		long drainedBytes = 0;

		try {
			while (drainedBytes < MAXIMUM_DRAINED_BYTES && System.nanoTime() < deadlineNanos) {
				int bytesRead = inputStream.read(buffer);

				if (bytesRead == -1)
					break;

				drainedBytes += bytesRead;
			}
		} catch (SocketTimeoutException e) {
			// Client is idle; stop draining and close
		}
	}

	private void handleConnection(@NonNull Socket socket,
																@Nullable InetSocketAddress remoteAddress,
																AdmissionController.@NonNull Admission admission) {
		requireNonNull(socket);
		requireNonNull(admission);

		// Closing the socket happens before the slot is released
		try (AdmissionController.Admission heldAdmission = admission; Socket connectedSocket = socket) {
			connectedSocket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1L, getRequestTimeout().toMillis())));
			connectedSocket.setTcpNoDelay(true);

			InputStream inputStream = new BufferedInputStream(connectedSocket.getInputStream());
			OutputStream outputStream = new BufferedOutputStream(connectedSocket.getOutputStream());
			Request request = null;
			MarshaledResponse marshaledResponse;

			try {
				request = getRequestReader().readRequest(inputStream, outputStream, remoteAddress).orElse(null);

				// Client connected and went away without sending anything
				if (request == null)
					return;

				marshaledResponse = handleRequest(request);
			} catch (SocketTimeoutException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_READ_TIMEOUT, format("Timed out after %s waiting for request from %s",
						getRequestTimeout(), remoteAddress)).build());
				marshaledResponse = serverResponse(408);
			} catch (MalformedRequestException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, format("Unable to parse request from %s: %s",
						remoteAddress, e.getMessage())).throwable(e).build());
				marshaledResponse = serverResponse(400);
			} catch (ContentTooLargeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_CONTENT_TOO_LARGE, format("Request from %s exceeds %d bytes",
						remoteAddress, e.getMaximumSizeInBytes())).build());
				marshaledResponse = serverResponse(413);
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_READ_FAILED, format("Unable to read request from %s", remoteAddress))
						.throwable(e)
						.build());
				return;
			}

			try {
				ResponseWriter.writeResponse(outputStream, marshaledResponse);
			} catch (IOException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_RESPONSE_WRITE_FAILED, format("Unable to write %d response to %s",
								marshaledResponse.getStatusCode(), remoteAddress))
						.throwable(e)
						.request(request)
						.build());
			}
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, format("Unexpected failure while handling connection from %s", remoteAddress))
					.throwable(t)
					.build());
		} finally {
			getActiveSockets().remove(socket);
		}
	}

	@NonNull
	private MarshaledResponse handleRequest(@NonNull Request request) {
		requireNonNull(request);

		safelyInvokeLifecycleObserver("didStartRequestHandling", lifecycleObserver -> lifecycleObserver.didStartRequestHandling(request));

		long startedAtNanos = System.nanoTime();
		MarshaledResponse marshaledResponse;

		try {
			marshaledResponse = requireNonNull(requireNonNull(this.requestHandler).handleRequest(request));
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, format("Unexpected failure while handling %s %s", request.getMethod(), request.getUri()))
					.throwable(t)
					.request(request)
					.build());

			marshaledResponse = serverResponse(500);
		}

		Duration processingDuration = Duration.ofNanos(System.nanoTime() - startedAtNanos);
		MarshaledResponse finishedMarshaledResponse = marshaledResponse;

		safelyInvokeLifecycleObserver("didFinishRequestHandling",
				lifecycleObserver -> lifecycleObserver.didFinishRequestHandling(request, finishedMarshaledResponse, processingDuration));

		return marshaledResponse;
	}

	@NonNull
	private MarshaledResponse serverResponse(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return MarshaledResponse.withStatusCode(statusCode).headers(getResponseHeaders()).build();
	}

	@NonNull
	private SSLContext createSslContext(@NonNull Path keystore) {
		requireNonNull(keystore);

		if (!Files.isRegularFile(keystore))
			throw new ConfigurationException(format("Keystore %s does not exist", keystore.toAbsolutePath()));

		char[] password = this.keystorePassword == null ? new char[0] : this.keystorePassword.toCharArray();

		try {
			// Detects PKCS12 vs. JKS
			KeyStore keyStore = KeyStore.getInstance(keystore.toFile(), password);

			if (Collections.list(keyStore.aliases()).stream().noneMatch(alias -> isKeyEntry(keyStore, alias)))
				throw new ConfigurationException(format("Keystore %s does not contain a private key", keystore.toAbsolutePath()));

			KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
			keyManagerFactory.init(keyStore, password);

			SSLContext sslContext = SSLContext.getInstance("TLS");
			sslContext.init(keyManagerFactory.getKeyManagers(), null, null);

			return sslContext;
		} catch (IOException | GeneralSecurityException e) {
			throw new ConfigurationException(format("Unable to load keystore %s: %s", keystore.toAbsolutePath(), e.getMessage()), e);
		}
	}

	private static boolean isKeyEntry(@NonNull KeyStore keyStore,
																		@NonNull String alias) {
		requireNonNull(keyStore);
		requireNonNull(alias);

		try {
			return keyStore.isKeyEntry(alias);
		} catch (GeneralSecurityException e) {
			throw new ConfigurationException(format("Unable to inspect keystore entry '%s'", alias), e);
		}
	}

	@Nullable
	private static InetSocketAddress remoteAddressFor(@NonNull Socket socket) {
		requireNonNull(socket);

		SocketAddress remoteSocketAddress = socket.getRemoteSocketAddress();
		return remoteSocketAddress instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress : null;
	}

	private void closeQuietly(@Nullable AutoCloseable closeable) {
		if (closeable == null)
			return;

		try {
			closeable.close();
		} catch (Exception e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, format("Unable to close %s", closeable.getClass().getSimpleName()))
					.throwable(e)
					.build());
		}
	}

	private void safelyInvokeLifecycleObserver(@NonNull String methodName,
																						 @NonNull Consumer<LifecycleObserver> invocation) {
		requireNonNull(methodName);
		requireNonNull(invocation);

		LifecycleObserver lifecycleObserver = this.lifecycleObserver;

		if (lifecycleObserver == null)
			return;

		try {
			invocation.accept(lifecycleObserver);
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, format("An exception occurred while invoking %s::%s",
							LifecycleObserver.class.getSimpleName(), methodName))
					.throwable(throwable)
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			LifecycleObserver lifecycleObserver = this.lifecycleObserver;

			if (lifecycleObserver != null)
				lifecycleObserver.didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The observer errored out, but we can't let that affect us
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private Integer getPort() {
		return this.port;
	}

	@NonNull
	private String getHost() {
		return this.host;
	}

	@NonNull
	Integer getConcurrency() {
		return this.concurrency;
	}

	@NonNull
	private Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	private Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	private Duration getRejectionDrainTimeout() {
		return this.rejectionDrainTimeout;
	}

	@NonNull
	private Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@NonNull
	private Map<@NonNull String, @NonNull String> getResponseHeaders() {
		return this.responseHeaders;
	}

	@NonNull
	private RequestReader getRequestReader() {
		return this.requestReader;
	}

	@NonNull
	AdmissionController getAdmissionController() {
		return this.admissionController;
	}

	@NonNull
	private Set<@NonNull Socket> getActiveSockets() {
		return this.activeSockets;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@ThreadSafe
	private static final class NonvirtualThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		private NonvirtualThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			requireNonNull(runnable);
			return new Thread(runnable, format("%s-%d", this.namePrefix, this.idGenerator.incrementAndGet()));
		}
	}
}
