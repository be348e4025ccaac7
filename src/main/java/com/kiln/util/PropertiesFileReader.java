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

package com.kiln.util;

import com.kiln.converter.ValueConversionException;
import com.kiln.converter.ValueConverter;
import com.kiln.converter.ValueConverters;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file from disk and converts its values to Java types with {@link ValueConverters}.
 */
@ThreadSafe
public class PropertiesFileReader {
	@NonNull
	private final Map<String, String> properties;

	public PropertiesFileReader(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		this.properties = Collections.unmodifiableMap(new HashMap<>(loadPropertiesForPath(propertiesFile)));
	}

	public PropertiesFileReader(@NonNull Properties properties) {
		requireNonNull(properties);

		Map<String, String> propertiesAsMap = new HashMap<>();

		for (String name : properties.stringPropertyNames())
			propertiesAsMap.put(name, properties.getProperty(name));

		this.properties = Collections.unmodifiableMap(propertiesAsMap);
	}

	/**
	 * The value for {@code key}, converted to {@code type}.
	 *
	 * @throws IllegalStateException    if there is no value for {@code key}
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	@NonNull
	public <T> T valueFor(@NonNull String key,
												@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		return optionalValueFor(key, type).orElseThrow(() ->
				new IllegalStateException(format("No properties file value was found for key '%s'", key)));
	}

	@NonNull
	public <T> Optional<T> optionalValueFor(@NonNull String key,
																					@NonNull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		String value = getProperties().get(key);

		if (value == null || value.isBlank())
			return Optional.empty();

		ValueConverter<T> valueConverter = ValueConverters.forType(type).orElseThrow(() ->
				new IllegalArgumentException(format("Not sure how to convert properties file value '%s' for key '%s' to requested type %s",
						value, key, type.getName())));

		try {
			return valueConverter.convert(value.trim());
		} catch (ValueConversionException e) {
			throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' is not a valid %s", value, key, type.getSimpleName()), e);
		}
	}

	@NonNull
	protected Map<String, String> loadPropertiesForPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			properties.load(inputStream);
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesAsMap = new HashMap<>();

		for (String name : properties.stringPropertyNames())
			propertiesAsMap.put(name, properties.getProperty(name));

		return propertiesAsMap;
	}

	@NonNull
	public Map<String, String> getProperties() {
		return this.properties;
	}
}
