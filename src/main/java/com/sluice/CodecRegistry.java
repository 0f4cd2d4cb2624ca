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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.sluice.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps request {@code Content-Type}s to {@link Codec}s.
 * <p>
 * Content types are normalized before lookup (parameters such as {@code charset} are stripped, the result is lowercased).
 * Resolution order is:
 * <ol>
 *   <li>the configured override mapping - an override fully replaces the built-in mapping for that content type</li>
 *   <li>the built-in mapping, which maps {@code application/json} to the {@code json} codec</li>
 *   <li>the default codec, used for anything unmapped and for requests without a {@code Content-Type}</li>
 * </ol>
 * <p>
 * Codecs are registered by identifier.  The built-in identifiers are {@code plain}, {@code line}, {@code json} and
 * {@code json_lines}; additional codecs may be registered via {@link Builder#codec(String, Codec)}.
 * <p>
 * Instances can be acquired via the {@link #withDefaultCodecId(String)} builder factory method or {@link #defaultInstance()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CodecRegistry {
	@NonNull
	public static final String DEFAULT_CODEC_ID;
	@NonNull
	private static final Map<@NonNull String, @NonNull Codec> BUILT_IN_CODECS_BY_ID;
	@NonNull
	private static final Map<@NonNull String, @NonNull String> BUILT_IN_CODEC_IDS_BY_CONTENT_TYPE;
	@NonNull
	private static final CodecRegistry DEFAULT_INSTANCE;

	static {
		DEFAULT_CODEC_ID = "plain";

		Map<String, Codec> builtInCodecsById = new LinkedHashMap<>();
		builtInCodecsById.put("plain", Codec.plain());
		builtInCodecsById.put("line", Codec.line());
		builtInCodecsById.put("json", Codec.json());
		builtInCodecsById.put("json_lines", Codec.jsonLines());

		BUILT_IN_CODECS_BY_ID = Collections.unmodifiableMap(builtInCodecsById);
		BUILT_IN_CODEC_IDS_BY_CONTENT_TYPE = Map.of("application/json", "json");
		DEFAULT_INSTANCE = withDefaultCodecId(DEFAULT_CODEC_ID).build();
	}

	@NonNull
	private final String defaultCodecId;
	@NonNull
	private final Map<@NonNull String, @NonNull Codec> codecsById;
	@NonNull
	private final Map<@NonNull String, @NonNull String> codecIdsByContentType;

	/**
	 * Acquires a builder for {@link CodecRegistry} instances.
	 *
	 * @param defaultCodecId identifier of the codec used when no content-type mapping applies
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaultCodecId(@NonNull String defaultCodecId) {
		requireNonNull(defaultCodecId);
		return new Builder(defaultCodecId);
	}

	/**
	 * Acquires a registry with built-in codecs and mappings and {@code plain} as the default codec.
	 *
	 * @return the default registry
	 */
	@NonNull
	public static CodecRegistry defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private CodecRegistry(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, Codec> codecsById = new LinkedHashMap<>(BUILT_IN_CODECS_BY_ID);

		for (Map.Entry<String, Codec> entry : builder.codecsById.entrySet())
			codecsById.put(normalizeCodecId(entry.getKey()), requireNonNull(entry.getValue()));

		String defaultCodecId = normalizeCodecId(builder.defaultCodecId);

		if (!codecsById.containsKey(defaultCodecId))
			throw new ConfigurationException(format("Unknown default codec '%s'. Known codecs are %s", builder.defaultCodecId, codecsById.keySet()));

		Map<String, String> codecIdsByContentType = new LinkedHashMap<>(BUILT_IN_CODEC_IDS_BY_CONTENT_TYPE);

		for (Map.Entry<String, String> entry : builder.contentTypeOverrides.entrySet()) {
			String contentType = Utilities.normalizeContentType(entry.getKey()).orElse(null);

			if (contentType == null)
				throw new ConfigurationException(format("Illegal content type '%s' in codec overrides", entry.getKey()));

			String codecId = normalizeCodecId(entry.getValue());

			if (!codecsById.containsKey(codecId))
				throw new ConfigurationException(format("Unknown codec '%s' configured for content type '%s'. Known codecs are %s",
						entry.getValue(), entry.getKey(), codecsById.keySet()));

			codecIdsByContentType.put(contentType, codecId);
		}

		this.defaultCodecId = defaultCodecId;
		this.codecsById = Collections.unmodifiableMap(codecsById);
		this.codecIdsByContentType = Collections.unmodifiableMap(codecIdsByContentType);
	}

	/**
	 * Determines which codec identifier applies to the given {@code Content-Type} header value.
	 *
	 * @param contentType the raw {@code Content-Type} header value, or {@code null} if the request did not specify one
	 * @return the codec identifier
	 */
	@NonNull
	public String resolveCodecId(@Nullable String contentType) {
		String normalizedContentType = Utilities.normalizeContentType(contentType).orElse(null);

		if (normalizedContentType == null)
			return getDefaultCodecId();

		return getCodecIdsByContentType().getOrDefault(normalizedContentType, getDefaultCodecId());
	}

	/**
	 * Determines which codec decodes bodies of the given {@code Content-Type} header value.
	 *
	 * @param contentType the raw {@code Content-Type} header value, or {@code null} if the request did not specify one
	 * @return the codec
	 */
	@NonNull
	public Codec resolve(@Nullable String contentType) {
		return getCodecsById().get(resolveCodecId(contentType));
	}

	/**
	 * The codec registered under the given identifier, if any.
	 *
	 * @param codecId the codec identifier, e.g. {@code json}
	 * @return the codec, or {@link Optional#empty()} if none is registered
	 */
	@NonNull
	public Optional<Codec> getCodec(@NonNull String codecId) {
		requireNonNull(codecId);
		return Optional.ofNullable(getCodecsById().get(normalizeCodecId(codecId)));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{defaultCodecId=%s, codecIdsByContentType=%s}", getClass().getSimpleName(),
				getDefaultCodecId(), getCodecIdsByContentType());
	}

	@NonNull
	public String getDefaultCodecId() {
		return this.defaultCodecId;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getCodecIdsByContentType() {
		return this.codecIdsByContentType;
	}

	@NonNull
	Map<@NonNull String, @NonNull Codec> getCodecsById() {
		return this.codecsById;
	}

	@NonNull
	private static String normalizeCodecId(@Nullable String codecId) {
		codecId = trimAggressivelyToNull(codecId);

		if (codecId == null)
			throw new ConfigurationException("Codec identifiers cannot be blank");

		return codecId.toLowerCase(Locale.ROOT);
	}

	/**
	 * Builder used to construct instances of {@link CodecRegistry}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private String defaultCodecId;
		@NonNull
		private final Map<@NonNull String, @NonNull Codec> codecsById;
		@NonNull
		private final Map<@NonNull String, @NonNull String> contentTypeOverrides;

		private Builder(@NonNull String defaultCodecId) {
			requireNonNull(defaultCodecId);

			this.defaultCodecId = defaultCodecId;
			this.codecsById = new LinkedHashMap<>();
			this.contentTypeOverrides = new LinkedHashMap<>();
		}

		@NonNull
		public Builder defaultCodecId(@NonNull String defaultCodecId) {
			requireNonNull(defaultCodecId);
			this.defaultCodecId = defaultCodecId;
			return this;
		}

		/**
		 * Registers a codec under an identifier, replacing any built-in codec with the same identifier.
		 */
		@NonNull
		public Builder codec(@NonNull String codecId,
												 @NonNull Codec codec) {
			requireNonNull(codecId);
			requireNonNull(codec);

			this.codecsById.put(codecId, codec);
			return this;
		}

		/**
		 * Maps content types to codec identifiers, taking precedence over the built-in mapping.
		 */
		@NonNull
		public Builder contentTypeOverrides(@Nullable Map<@NonNull String, @NonNull String> contentTypeOverrides) {
			this.contentTypeOverrides.clear();

			if (contentTypeOverrides != null)
				this.contentTypeOverrides.putAll(contentTypeOverrides);

			return this;
		}

		@NonNull
		public CodecRegistry build() {
			return new CodecRegistry(this);
		}
	}
}
