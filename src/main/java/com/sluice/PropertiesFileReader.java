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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;

import static com.sluice.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads configuration values from a properties file (or an in-memory map of the same shape) and converts them to
 * Java types, failing with {@link ConfigurationException} on unparseable values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class PropertiesFileReader {
	@NonNull
	private final Map<@NonNull String, @NonNull String> properties;

	@NonNull
	public static PropertiesFileReader fromPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		return new PropertiesFileReader(loadPropertiesForPath(propertiesFile));
	}

	@NonNull
	public static PropertiesFileReader fromMap(@NonNull Map<@NonNull String, @NonNull String> properties) {
		requireNonNull(properties);
		return new PropertiesFileReader(properties);
	}

	private PropertiesFileReader(@NonNull Map<@NonNull String, @NonNull String> properties) {
		requireNonNull(properties);
		this.properties = Collections.unmodifiableMap(new TreeMap<>(properties));
	}

	@NonNull
	public Optional<String> optionalStringFor(@NonNull String key) {
		requireNonNull(key);
		return Optional.ofNullable(trimAggressivelyToNull(getProperties().get(key)));
	}

	@NonNull
	public <T> Optional<T> optionalValueFor(@NonNull String key,
																					@NonNull Function<String, T> valueConverter) {
		requireNonNull(key);
		requireNonNull(valueConverter);

		String value = optionalStringFor(key).orElse(null);

		if (value == null)
			return Optional.empty();

		try {
			return Optional.ofNullable(valueConverter.apply(value));
		} catch (RuntimeException e) {
			throw new ConfigurationException(format("Illegal value '%s' for configuration key '%s'", value, key), e);
		}
	}

	/**
	 * All entries whose key begins with {@code prefix + "."}, keyed by the remainder of the key.
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> valuesWithPrefix(@NonNull String prefix) {
		requireNonNull(prefix);

		String qualifiedPrefix = prefix + ".";
		Map<String, String> values = new LinkedHashMap<>();

		for (Map.Entry<String, String> entry : getProperties().entrySet()) {
			if (!entry.getKey().startsWith(qualifiedPrefix))
				continue;

			String name = entry.getKey().substring(qualifiedPrefix.length());

			if (name.isEmpty())
				throw new ConfigurationException(format("Configuration key '%s' is missing a name after the prefix", entry.getKey()));

			values.put(name, entry.getValue().trim());
		}

		return values;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getProperties() {
		return this.properties;
	}

	@NonNull
	private static Map<@NonNull String, @NonNull String> loadPropertiesForPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new ConfigurationException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new ConfigurationException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			properties.load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
		} catch (IOException | IllegalArgumentException e) {
			throw new ConfigurationException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesMap = new LinkedHashMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}
}
