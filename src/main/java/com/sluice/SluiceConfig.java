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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.sluice.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a {@link Sluice} instance is configured.
 * <p>
 * Instances are immutable and fully validated on construction: an illegal combination of settings (for example,
 * TLS enabled without keystore material) fails with {@link ConfigurationException} before any socket is bound.
 * <p>
 * Build programmatically via {@link #withPort(Integer)} or load from a {@code .properties} file via
 * {@link #withPropertiesFile(Path)}, whose keys are:
 * <ul>
 *   <li>{@code host}, {@code port}, {@code threads}</li>
 *   <li>{@code ssl}, {@code keystore}, {@code keystore_password}</li>
 *   <li>{@code user}, {@code password}</li>
 *   <li>{@code codec}, {@code additional_codecs.<content type>=<codec>}</li>
 *   <li>{@code response_headers.<name>=<value>}, {@code response_code}</li>
 *   <li>{@code max_content_length}, {@code request_timeout} and {@code shutdown_timeout} (seconds)</li>
 *   <li>{@code request_headers_target_field}</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SluiceConfig {
	@NonNull
	public static final String DEFAULT_HOST;
	@NonNull
	public static final Integer DEFAULT_PORT;
	@NonNull
	public static final Integer DEFAULT_RESPONSE_CODE;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_CONTENT_LENGTH;
	@NonNull
	public static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final Set<@NonNull Integer> PERMITTED_RESPONSE_CODES;
	@NonNull
	private static final Set<@NonNull String> SUPPORTED_PROPERTY_KEYS;
	@NonNull
	private static final Set<@NonNull String> SUPPORTED_PROPERTY_PREFIXES;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_PORT = 8080;
		DEFAULT_RESPONSE_CODE = 200;
		DEFAULT_MAXIMUM_CONTENT_LENGTH = 100 * 1_024 * 1_024;
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
		PERMITTED_RESPONSE_CODES = Set.of(200, 201, 202, 204);
		SUPPORTED_PROPERTY_KEYS = Set.of("host", "port", "threads", "ssl", "keystore", "keystore_password", "user", "password",
				"codec", "response_code", "max_content_length", "request_timeout", "shutdown_timeout", "request_headers_target_field");
		SUPPORTED_PROPERTY_PREFIXES = Set.of("additional_codecs", "response_headers");
	}

	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@NonNull
	private final Integer threads;
	@NonNull
	private final Boolean ssl;
	@Nullable
	private final Path keystore;
	@Nullable
	private final String keystorePassword;
	@Nullable
	private final String user;
	@Nullable
	private final String password;
	@NonNull
	private final Map<@NonNull String, @NonNull String> responseHeaders;
	@NonNull
	private final Integer responseCode;
	@NonNull
	private final Integer maximumContentLength;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@Nullable
	private final String requestHeadersTargetField;
	@NonNull
	private final CodecRegistry codecRegistry;
	@NonNull
	private final Authenticator authenticator;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	/**
	 * Acquires a builder for {@link SluiceConfig} instances.
	 *
	 * @param port the port to listen on, or {@code 0} to pick an ephemeral port at start
	 * @return the builder
	 */
	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Acquires a builder pre-populated from a {@code .properties} file.
	 * <p>
	 * Unknown keys and unparseable values fail fast with {@link ConfigurationException}.
	 *
	 * @param propertiesFile path to the properties file
	 * @return the builder
	 */
	@NonNull
	public static Builder withPropertiesFile(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		return withPropertiesFileReader(PropertiesFileReader.fromPath(propertiesFile));
	}

	/**
	 * Acquires a builder pre-populated from in-memory properties using the same keys as {@link #withPropertiesFile(Path)}.
	 *
	 * @param properties the configuration properties
	 * @return the builder
	 */
	@NonNull
	public static Builder withProperties(@NonNull Map<@NonNull String, @NonNull String> properties) {
		requireNonNull(properties);
		return withPropertiesFileReader(PropertiesFileReader.fromMap(properties));
	}

	@NonNull
	private static Builder withPropertiesFileReader(@NonNull PropertiesFileReader propertiesFileReader) {
		requireNonNull(propertiesFileReader);

		for (String key : propertiesFileReader.getProperties().keySet()) {
			int dotIndex = key.indexOf('.');
			boolean supported = dotIndex == -1 ? SUPPORTED_PROPERTY_KEYS.contains(key)
					: SUPPORTED_PROPERTY_PREFIXES.contains(key.substring(0, dotIndex));

			if (!supported)
				throw new ConfigurationException(format("Unknown configuration key '%s'", key));
		}

		Builder builder = withPort(propertiesFileReader.optionalValueFor("port", Integer::valueOf).orElse(DEFAULT_PORT));

		propertiesFileReader.optionalStringFor("host").ifPresent(builder::host);
		propertiesFileReader.optionalValueFor("threads", Integer::valueOf).ifPresent(builder::threads);
		propertiesFileReader.optionalValueFor("ssl", SluiceConfig::parseBoolean).ifPresent(builder::ssl);
		propertiesFileReader.optionalValueFor("keystore", Paths::get).ifPresent(builder::keystore);
		propertiesFileReader.optionalStringFor("keystore_password").ifPresent(builder::keystorePassword);
		propertiesFileReader.optionalStringFor("user").ifPresent(builder::user);
		propertiesFileReader.optionalStringFor("password").ifPresent(builder::password);
		propertiesFileReader.optionalStringFor("codec").ifPresent(builder::codec);
		propertiesFileReader.optionalValueFor("response_code", Integer::valueOf).ifPresent(builder::responseCode);
		propertiesFileReader.optionalValueFor("max_content_length", Integer::valueOf).ifPresent(builder::maximumContentLength);
		propertiesFileReader.optionalValueFor("request_timeout", SluiceConfig::parseSeconds).ifPresent(builder::requestTimeout);
		propertiesFileReader.optionalValueFor("shutdown_timeout", SluiceConfig::parseSeconds).ifPresent(builder::shutdownTimeout);
		propertiesFileReader.optionalStringFor("request_headers_target_field").ifPresent(builder::requestHeadersTargetField);

		builder.additionalCodecs(propertiesFileReader.valuesWithPrefix("additional_codecs"));
		builder.responseHeaders(propertiesFileReader.valuesWithPrefix("response_headers"));

		return builder;
	}

	@NonNull
	private static Boolean parseBoolean(@NonNull String value) {
		requireNonNull(value);

		String normalizedValue = value.toLowerCase(Locale.ROOT);

		if (normalizedValue.equals("true"))
			return true;
		if (normalizedValue.equals("false"))
			return false;

		throw new IllegalArgumentException(format("'%s' is not a boolean", value));
	}

	@NonNull
	private static Duration parseSeconds(@NonNull String value) {
		requireNonNull(value);
		return Duration.ofSeconds(Long.parseLong(value));
	}

	private SluiceConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		String host = trimAggressivelyToNull(builder.host);
		Integer threads = builder.threads == null ? Runtime.getRuntime().availableProcessors() : builder.threads;

		if (host == null)
			throw new ConfigurationException("Host must not be blank");

		if (builder.port < 0 || builder.port > 65_535)
			throw new ConfigurationException(format("Port %d is out of range", builder.port));

		if (threads < 1)
			throw new ConfigurationException(format("Threads must be at least 1 (was %d)", threads));

		if (builder.ssl) {
			if (builder.keystore == null)
				throw new ConfigurationException("SSL is enabled but no keystore was configured");

			if (builder.keystorePassword == null)
				throw new ConfigurationException("SSL is enabled but no keystore password was configured");

			if (!Files.isRegularFile(builder.keystore))
				throw new ConfigurationException(format("SSL is enabled but keystore %s does not exist", builder.keystore.toAbsolutePath()));
		}

		if ((builder.user == null) != (builder.password == null))
			throw new ConfigurationException("User and password must be configured together");

		if (builder.user != null && builder.authenticator != null)
			throw new ConfigurationException(format("Configure either user/password or a custom %s, not both", Authenticator.class.getSimpleName()));

		if (!PERMITTED_RESPONSE_CODES.contains(builder.responseCode))
			throw new ConfigurationException(format("Response code %d is not permitted. Permitted values are %s",
					builder.responseCode, new TreeSet<>(PERMITTED_RESPONSE_CODES)));

		if (builder.maximumContentLength < 1)
			throw new ConfigurationException(format("Maximum content length must be at least 1 byte (was %d)", builder.maximumContentLength));

		if (builder.requestTimeout.isNegative() || builder.requestTimeout.isZero())
			throw new ConfigurationException("Request timeout must be positive");

		if (builder.shutdownTimeout.isNegative())
			throw new ConfigurationException("Shutdown timeout must not be negative");

		Map<String, String> responseHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (Map.Entry<String, String> responseHeader : builder.responseHeaders.entrySet()) {
			try {
				Utilities.validateHeaderNameAndValue(responseHeader.getKey(), responseHeader.getValue());
			} catch (IllegalArgumentException e) {
				throw new ConfigurationException(format("Illegal response header: %s", e.getMessage()), e);
			}

			responseHeaders.put(responseHeader.getKey().trim(), responseHeader.getValue());
		}

		CodecRegistry.Builder codecRegistryBuilder = CodecRegistry.withDefaultCodecId(builder.codec)
				.contentTypeOverrides(builder.additionalCodecs);

		for (Map.Entry<String, Codec> customCodec : builder.customCodecs.entrySet())
			codecRegistryBuilder.codec(customCodec.getKey(), customCodec.getValue());

		this.host = host;
		this.port = builder.port;
		this.threads = threads;
		this.ssl = builder.ssl;
		this.keystore = builder.keystore;
		this.keystorePassword = builder.keystorePassword;
		this.user = builder.user;
		this.password = builder.password;
		this.responseHeaders = Collections.unmodifiableMap(responseHeaders);
		this.responseCode = builder.responseCode;
		this.maximumContentLength = builder.maximumContentLength;
		this.requestTimeout = builder.requestTimeout;
		this.shutdownTimeout = builder.shutdownTimeout;
		this.requestHeadersTargetField = trimAggressivelyToNull(builder.requestHeadersTargetField);
		this.codecRegistry = codecRegistryBuilder.build();
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;

		if (builder.authenticator != null)
			this.authenticator = builder.authenticator;
		else if (builder.user != null)
			this.authenticator = Authenticator.withBasicCredentials(builder.user, builder.password);
		else
			this.authenticator = Authenticator.permitAll();
	}

	/**
	 * Acquires a builder seeded with this instance's values.
	 *
	 * @return a builder that produces a copy of this configuration unless modified
	 */
	@NonNull
	public Builder copy() {
		Builder builder = withPort(getPort())
				.host(getHost())
				.threads(getThreads())
				.ssl(getSsl())
				.keystore(this.keystore)
				.keystorePassword(this.keystorePassword)
				.codec(getCodecRegistry().getDefaultCodecId())
				.responseHeaders(getResponseHeaders())
				.responseCode(getResponseCode())
				.maximumContentLength(getMaximumContentLength())
				.requestTimeout(getRequestTimeout())
				.shutdownTimeout(getShutdownTimeout())
				.requestHeadersTargetField(this.requestHeadersTargetField)
				.lifecycleObserver(getLifecycleObserver());

		// Built-in content type mappings are re-applied by the registry itself
		builder.additionalCodecs(getCodecRegistry().getCodecIdsByContentType());
		getCodecRegistry().getCodecsById().forEach(builder::customCodec);

		if (this.user != null)
			builder.user(this.user).password(this.password);
		else
			builder.authenticator(getAuthenticator());

		return builder;
	}

	@Override
	@NonNull
	public String toString() {
		// Credentials are intentionally absent
		return format("%s{host=%s, port=%d, threads=%d, ssl=%s, codecRegistry=%s, responseCode=%d, maximumContentLength=%d}",
				getClass().getSimpleName(), getHost(), getPort(), getThreads(), getSsl(), getCodecRegistry(),
				getResponseCode(), getMaximumContentLength());
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	/**
	 * The number of worker threads, which is also the number of requests that may be in flight at once.
	 *
	 * @return the worker thread count
	 */
	@NonNull
	public Integer getThreads() {
		return this.threads;
	}

	@NonNull
	public Boolean getSsl() {
		return this.ssl;
	}

	@NonNull
	public Optional<Path> getKeystore() {
		return Optional.ofNullable(this.keystore);
	}

	@NonNull
	public Optional<String> getKeystorePassword() {
		return Optional.ofNullable(this.keystorePassword);
	}

	@NonNull
	public Optional<String> getUser() {
		return Optional.ofNullable(this.user);
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getResponseHeaders() {
		return this.responseHeaders;
	}

	/**
	 * The status code written for successfully enqueued requests.
	 *
	 * @return one of 200, 201, 202 or 204
	 */
	@NonNull
	public Integer getResponseCode() {
		return this.responseCode;
	}

	@NonNull
	public Integer getMaximumContentLength() {
		return this.maximumContentLength;
	}

	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	public Optional<String> getRequestHeadersTargetField() {
		return Optional.ofNullable(this.requestHeadersTargetField);
	}

	@NonNull
	public CodecRegistry getCodecRegistry() {
		return this.codecRegistry;
	}

	@NonNull
	public Authenticator getAuthenticator() {
		return this.authenticator;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * Builder used to construct instances of {@link SluiceConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer port;
		@NonNull
		private String host;
		@Nullable
		private Integer threads;
		@NonNull
		private Boolean ssl;
		@Nullable
		private Path keystore;
		@Nullable
		private String keystorePassword;
		@Nullable
		private String user;
		@Nullable
		private String password;
		@NonNull
		private String codec;
		@NonNull
		private final Map<@NonNull String, @NonNull String> additionalCodecs;
		@NonNull
		private final Map<@NonNull String, @NonNull Codec> customCodecs;
		@NonNull
		private final Map<@NonNull String, @NonNull String> responseHeaders;
		@NonNull
		private Integer responseCode;
		@NonNull
		private Integer maximumContentLength;
		@NonNull
		private Duration requestTimeout;
		@NonNull
		private Duration shutdownTimeout;
		@Nullable
		private String requestHeadersTargetField;
		@Nullable
		private Authenticator authenticator;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);

			this.port = port;
			this.host = DEFAULT_HOST;
			this.ssl = false;
			this.codec = CodecRegistry.DEFAULT_CODEC_ID;
			this.additionalCodecs = new LinkedHashMap<>();
			this.customCodecs = new LinkedHashMap<>();
			this.responseHeaders = new LinkedHashMap<>();
			this.responseCode = DEFAULT_RESPONSE_CODE;
			this.maximumContentLength = DEFAULT_MAXIMUM_CONTENT_LENGTH;
			this.requestTimeout = DEFAULT_REQUEST_TIMEOUT;
			this.shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@NonNull String host) {
			requireNonNull(host);
			this.host = host;
			return this;
		}

		/**
		 * Sets the worker thread count; defaults to the number of available processors.
		 */
		@NonNull
		public Builder threads(@Nullable Integer threads) {
			this.threads = threads;
			return this;
		}

		@NonNull
		public Builder ssl(@NonNull Boolean ssl) {
			requireNonNull(ssl);
			this.ssl = ssl;
			return this;
		}

		@NonNull
		public Builder keystore(@Nullable Path keystore) {
			this.keystore = keystore;
			return this;
		}

		@NonNull
		public Builder keystorePassword(@Nullable String keystorePassword) {
			this.keystorePassword = keystorePassword;
			return this;
		}

		@NonNull
		public Builder user(@Nullable String user) {
			this.user = user;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		/**
		 * Sets the identifier of the codec used for content types with no mapping.
		 */
		@NonNull
		public Builder codec(@NonNull String codec) {
			requireNonNull(codec);
			this.codec = codec;
			return this;
		}

		@NonNull
		public Builder additionalCodecs(@Nullable Map<@NonNull String, @NonNull String> additionalCodecs) {
			this.additionalCodecs.clear();

			if (additionalCodecs != null)
				this.additionalCodecs.putAll(additionalCodecs);

			return this;
		}

		/**
		 * Registers a codec under an identifier so that {@link #codec(String)} and {@link #additionalCodecs(Map)} can refer to it.
		 */
		@NonNull
		public Builder customCodec(@NonNull String codecId,
															 @NonNull Codec codec) {
			requireNonNull(codecId);
			requireNonNull(codec);

			this.customCodecs.put(codecId, codec);
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
		public Builder responseCode(@NonNull Integer responseCode) {
			requireNonNull(responseCode);
			this.responseCode = responseCode;
			return this;
		}

		@NonNull
		public Builder maximumContentLength(@NonNull Integer maximumContentLength) {
			requireNonNull(maximumContentLength);
			this.maximumContentLength = maximumContentLength;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@NonNull Duration requestTimeout) {
			requireNonNull(requestTimeout);
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@NonNull Duration shutdownTimeout) {
			requireNonNull(shutdownTimeout);
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder requestHeadersTargetField(@Nullable String requestHeadersTargetField) {
			this.requestHeadersTargetField = requestHeadersTargetField;
			return this;
		}

		/**
		 * Supplies a custom credential check in place of {@link #user(String)}/{@link #password(String)}.
		 */
		@NonNull
		public Builder authenticator(@Nullable Authenticator authenticator) {
			this.authenticator = authenticator;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public SluiceConfig build() {
			return new SluiceConfig(this);
		}
	}
}
