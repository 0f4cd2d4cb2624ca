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

import com.sluice.exception.DecodeException;
import com.sluice.exception.DecompressionException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs the per-request pipeline on a worker thread: method check, authentication, decompression, decoding and
 * enqueueing, producing the response to write.
 * <p>
 * Enqueueing blocks while the downstream {@link EventQueue} is full, which keeps the calling worker (and its admission
 * slot) busy; this is how downstream saturation becomes visible to new clients as HTTP 429.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestProcessor {
	@NonNull
	private static final String SUCCESS_BODY;
	@NonNull
	private static final String DECOMPRESSION_FAILURE_BODY;
	@NonNull
	private static final String DECODE_FAILURE_BODY_PREFIX;
	@NonNull
	private static final String WWW_AUTHENTICATE_HEADER_VALUE;
	@NonNull
	private static final String TEXT_PLAIN_CONTENT_TYPE;

	static {
		SUCCESS_BODY = "ok";
		DECOMPRESSION_FAILURE_BODY = "Failed to decompress body";
		DECODE_FAILURE_BODY_PREFIX = "Failed to decode body: ";
		WWW_AUTHENTICATE_HEADER_VALUE = "Basic realm=\"sluice\"";
		TEXT_PLAIN_CONTENT_TYPE = "text/plain; charset=UTF-8";
	}

	@NonNull
	private final EventQueue eventQueue;
	@NonNull
	private final CodecRegistry codecRegistry;
	@NonNull
	private final ContentDecompressor contentDecompressor;
	@NonNull
	private final Authenticator authenticator;
	@NonNull
	private final Integer responseCode;
	@NonNull
	private final Map<@NonNull String, @NonNull String> responseHeaders;
	@Nullable
	private final String requestHeadersTargetField;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	/**
	 * Acquires a builder for {@link RequestProcessor} instances.
	 *
	 * @param eventQueue the downstream queue that receives decoded events
	 * @return the builder
	 */
	@NonNull
	public static Builder withEventQueue(@NonNull EventQueue eventQueue) {
		requireNonNull(eventQueue);
		return new Builder(eventQueue);
	}

	/**
	 * Acquires a processor wired from {@code sluiceConfig}.
	 *
	 * @param sluiceConfig the configuration
	 * @param eventQueue   the downstream queue that receives decoded events
	 * @return the processor
	 */
	@NonNull
	public static RequestProcessor fromConfig(@NonNull SluiceConfig sluiceConfig,
																						@NonNull EventQueue eventQueue) {
		requireNonNull(sluiceConfig);
		requireNonNull(eventQueue);

		return withEventQueue(eventQueue)
				.codecRegistry(sluiceConfig.getCodecRegistry())
				.contentDecompressor(ContentDecompressor.withMaximumDecompressedSizeInBytes(sluiceConfig.getMaximumContentLength()))
				.authenticator(sluiceConfig.getAuthenticator())
				.responseCode(sluiceConfig.getResponseCode())
				.responseHeaders(sluiceConfig.getResponseHeaders())
				.requestHeadersTargetField(sluiceConfig.getRequestHeadersTargetField().orElse(null))
				.lifecycleObserver(sluiceConfig.getLifecycleObserver())
				.build();
	}

	private RequestProcessor(@NonNull Builder builder) {
		requireNonNull(builder);

		this.eventQueue = builder.eventQueue;
		this.codecRegistry = builder.codecRegistry == null ? CodecRegistry.defaultInstance() : builder.codecRegistry;
		this.contentDecompressor = builder.contentDecompressor == null ? ContentDecompressor.defaultInstance() : builder.contentDecompressor;
		this.authenticator = builder.authenticator == null ? Authenticator.permitAll() : builder.authenticator;
		this.responseCode = builder.responseCode == null ? SluiceConfig.DEFAULT_RESPONSE_CODE : builder.responseCode;
		this.responseHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.responseHeaders));
		this.requestHeadersTargetField = builder.requestHeadersTargetField;
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;
	}

	/**
	 * Processes a fully-read request.
	 * <p>
	 * This method never throws for per-request failures; each outcome maps to a response:
	 * <ul>
	 *   <li>405 for methods other than {@code POST}</li>
	 *   <li>401 if authentication fails</li>
	 *   <li>400 if the body cannot be decompressed or decoded (nothing is enqueued)</li>
	 *   <li>503 if the thread is interrupted while waiting on the queue</li>
	 *   <li>500 for anything unexpected</li>
	 *   <li>the configured success code once every decoded event has been enqueued</li>
	 * </ul>
	 *
	 * @param request the request to process
	 * @return the response to write
	 */
	@NonNull
	public MarshaledResponse process(@NonNull Request request) {
		requireNonNull(request);

		try {
			return processUnsafely(request);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();

			safelyLog(LogEvent.with(LogEventType.ENQUEUE_INTERRUPTED, "Interrupted while waiting for space in the event queue")
					.throwable(e)
					.request(request)
					.build());

			return responseWithStatusCode(503).build();
		} catch (Exception e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, format("Unexpected failure while processing %s %s", request.getMethod(), request.getUri()))
					.throwable(e)
					.request(request)
					.build());

			return responseWithStatusCode(500).build();
		}
	}

	@NonNull
	private MarshaledResponse processUnsafely(@NonNull Request request) throws InterruptedException {
		requireNonNull(request);

		if (!"POST".equals(request.getMethod()))
			return responseWithStatusCode(405)
					.header("Allow", "POST")
					.build();

		if (!getAuthenticator().isAuthenticated(request)) {
			safelyLog(LogEvent.with(LogEventType.AUTHENTICATION_FAILED, format("Rejected unauthenticated request from %s",
							request.getRemoteHost().orElse("unknown host")))
					.request(request)
					.build());

			return responseWithStatusCode(401)
					.header("WWW-Authenticate", WWW_AUTHENTICATE_HEADER_VALUE)
					.build();
		}

		byte[] body;

		try {
			body = getContentDecompressor().decompress(request.getContentEncoding().orElse(null), request.getBody());
		} catch (DecompressionException e) {
			safelyLog(LogEvent.with(LogEventType.DECOMPRESSION_FAILED, e.getMessage() == null ? DECOMPRESSION_FAILURE_BODY : e.getMessage())
					.throwable(e)
					.request(request)
					.build());

			return textResponseWithStatusCode(400, DECOMPRESSION_FAILURE_BODY);
		}

		String contentType = request.getContentType().orElse(null);
		Codec codec = getCodecRegistry().resolve(contentType);
		Charset charset = Utilities.extractCharsetFromHeaderValue(contentType).orElse(StandardCharsets.UTF_8);
		List<Map<String, Object>> decodedFields;

		try {
			decodedFields = codec.decode(body, charset);
		} catch (DecodeException e) {
			String reason = e.getMessage() == null ? "unknown error" : e.getMessage();

			safelyLog(LogEvent.with(LogEventType.DECODE_FAILED, format("Codec '%s' could not decode body: %s", codec, reason))
					.throwable(e)
					.request(request)
					.build());

			return textResponseWithStatusCode(400, DECODE_FAILURE_BODY_PREFIX + reason);
		}

		String host = request.getRemoteHost().orElse(null);
		Map<String, Object> requestHeaderFields = getRequestHeadersTargetField().isPresent() ? requestHeaderFieldsFor(request) : null;

		for (Map<String, Object> fields : decodedFields) {
			Event event = Event.withFields(fields);

			if (requestHeaderFields != null)
				event = event.withField(this.requestHeadersTargetField, requestHeaderFields);

			if (host != null)
				event = event.withField(Event.HOST_FIELD, host);

			// Blocks while the queue is full
			getEventQueue().enqueue(event);

			Event enqueuedEvent = event;
			safelyInvokeLifecycleObserver("didEnqueueEvent", request, () -> getLifecycleObserver().didEnqueueEvent(request, enqueuedEvent));
		}

		if (getResponseCode() == 204)
			return responseWithStatusCode(204).build();

		return textResponseWithStatusCode(getResponseCode(), SUCCESS_BODY);
	}

	@NonNull
	private Map<@NonNull String, @NonNull Object> requestHeaderFieldsFor(@NonNull Request request) {
		requireNonNull(request);

		Map<String, Object> requestHeaderFields = new TreeMap<>();

		for (Map.Entry<String, List<String>> header : request.getHeaders().entrySet())
			requestHeaderFields.put(header.getKey().toLowerCase(Locale.ROOT), String.join(", ", header.getValue()));

		requestHeaderFields.put("request_method", request.getMethod());
		requestHeaderFields.put("request_path", request.getUri());

		return requestHeaderFields;
	}

	private MarshaledResponse.@NonNull Builder responseWithStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return MarshaledResponse.withStatusCode(statusCode).headers(getResponseHeaders());
	}

	@NonNull
	private MarshaledResponse textResponseWithStatusCode(@NonNull Integer statusCode,
																											 @NonNull String body) {
		requireNonNull(statusCode);
		requireNonNull(body);

		MarshaledResponse.Builder builder = responseWithStatusCode(statusCode).body(body);

		if (getResponseHeaders().keySet().stream().noneMatch(name -> name.equalsIgnoreCase("Content-Type")))
			builder.header("Content-Type", TEXT_PLAIN_CONTENT_TYPE);

		return builder.build();
	}

	private void safelyInvokeLifecycleObserver(@NonNull String methodName,
																						 @NonNull Request request,
																						 @NonNull Runnable runnable) {
		requireNonNull(methodName);
		requireNonNull(request);
		requireNonNull(runnable);

		try {
			runnable.run();
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, format("An exception occurred while invoking %s::%s",
							LifecycleObserver.class.getSimpleName(), methodName))
					.throwable(throwable)
					.request(request)
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The observer errored out, but we can't let that affect request handling
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	public EventQueue getEventQueue() {
		return this.eventQueue;
	}

	@NonNull
	public CodecRegistry getCodecRegistry() {
		return this.codecRegistry;
	}

	@NonNull
	public ContentDecompressor getContentDecompressor() {
		return this.contentDecompressor;
	}

	@NonNull
	public Authenticator getAuthenticator() {
		return this.authenticator;
	}

	@NonNull
	public Integer getResponseCode() {
		return this.responseCode;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getResponseHeaders() {
		return this.responseHeaders;
	}

	@NonNull
	public Optional<String> getRequestHeadersTargetField() {
		return Optional.ofNullable(this.requestHeadersTargetField);
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * Builder used to construct instances of {@link RequestProcessor}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final EventQueue eventQueue;
		@Nullable
		private CodecRegistry codecRegistry;
		@Nullable
		private ContentDecompressor contentDecompressor;
		@Nullable
		private Authenticator authenticator;
		@Nullable
		private Integer responseCode;
		@NonNull
		private final Map<@NonNull String, @NonNull String> responseHeaders;
		@Nullable
		private String requestHeadersTargetField;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		private Builder(@NonNull EventQueue eventQueue) {
			requireNonNull(eventQueue);

			this.eventQueue = eventQueue;
			this.responseHeaders = new LinkedHashMap<>();
		}

		@NonNull
		public Builder codecRegistry(@Nullable CodecRegistry codecRegistry) {
			this.codecRegistry = codecRegistry;
			return this;
		}

		@NonNull
		public Builder contentDecompressor(@Nullable ContentDecompressor contentDecompressor) {
			this.contentDecompressor = contentDecompressor;
			return this;
		}

		@NonNull
		public Builder authenticator(@Nullable Authenticator authenticator) {
			this.authenticator = authenticator;
			return this;
		}

		@NonNull
		public Builder responseCode(@Nullable Integer responseCode) {
			this.responseCode = responseCode;
			return this;
		}

		@NonNull
		public Builder responseHeaders(@Nullable Map<@NonNull String, @NonNull String> responseHeaders) {
			this.responseHeaders.clear();

			if (responseHeaders != null)
				this.responseHeaders.putAll(responseHeaders);

			return this;
		}

		@NonNull
		public Builder requestHeadersTargetField(@Nullable String requestHeadersTargetField) {
			this.requestHeadersTargetField = requestHeadersTargetField;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public RequestProcessor build() {
			return new RequestProcessor(this);
		}
	}
}
