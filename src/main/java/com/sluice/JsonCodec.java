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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sluice.exception.DecodeException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class JsonCodec implements Codec {
	@NonNull
	private static final JsonCodec DEFAULT_INSTANCE;
	@NonNull
	static final ObjectMapper OBJECT_MAPPER;
	@NonNull
	private static final TypeReference<Map<String, Object>> FIELDS_TYPE_REFERENCE;

	static {
		// A body holding anything after its first JSON value is malformed, not truncated to that value
		OBJECT_MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		FIELDS_TYPE_REFERENCE = new TypeReference<>() {};
		DEFAULT_INSTANCE = new JsonCodec();
	}

	@NonNull
	public static JsonCodec defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private JsonCodec() {
		// Only the default instance
	}

	@Override
	@NonNull
	public List<@NonNull Map<@NonNull String, @Nullable Object>> decode(byte @NonNull [] body,
																																			@NonNull Charset charset) {
		requireNonNull(body);
		requireNonNull(charset);

		String json = new String(body, charset);

		if (json.isBlank())
			return List.of();

		JsonNode jsonNode = readTree(json);

		if (jsonNode.isObject())
			return List.of(toFields(jsonNode));

		if (jsonNode.isArray()) {
			List<Map<String, Object>> fieldMappings = new ArrayList<>(jsonNode.size());

			for (JsonNode element : jsonNode) {
				if (!element.isObject())
					throw new DecodeException(format("JSON array elements must be objects, but found %s", describe(element)));

				fieldMappings.add(toFields(element));
			}

			return fieldMappings;
		}

		throw new DecodeException(format("Expected a JSON object or array of objects, but found %s", describe(jsonNode)));
	}

	@NonNull
	static JsonNode readTree(@NonNull String json) {
		requireNonNull(json);

		try {
			JsonNode jsonNode = OBJECT_MAPPER.readTree(json);

			if (jsonNode == null || jsonNode.isMissingNode())
				throw new DecodeException("No JSON content found");

			return jsonNode;
		} catch (JsonProcessingException e) {
			throw new DecodeException(format("Malformed JSON: %s", e.getOriginalMessage()), e);
		}
	}

	@NonNull
	static Map<@NonNull String, @Nullable Object> toFields(@NonNull JsonNode objectNode) {
		requireNonNull(objectNode);
		return OBJECT_MAPPER.convertValue(objectNode, FIELDS_TYPE_REFERENCE);
	}

	@NonNull
	static String describe(@NonNull JsonNode jsonNode) {
		requireNonNull(jsonNode);
		return jsonNode.getNodeType().name().toLowerCase(Locale.ROOT);
	}

	@Override
	@NonNull
	public String toString() {
		return "json";
	}
}
