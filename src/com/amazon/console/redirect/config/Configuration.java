/*
 * Copyright 2014-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Amazon Software License (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/asl/
 *
 * or in the "license" file accompanying this file.
 * This file is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */
package com.amazon.console.redirect.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonParser.Feature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Function;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * A configuration is a <code>Map&lt;String, Object&gt;</code>, usually read
 * from a JSON file, with typed accessors on top:
 * <code><pre>
 *   Configuration config = Configuration.get(Paths.get("redirect.json"));
 *   long maxSize = config.readLong("maxSizeBytes", 1024L);
 * </pre></code>
 * Values are converted to the requested type on read; numeric strings such
 * as {@code "1024"} are accepted for numbers.
 */
public class Configuration {

    private static final Function<Object, Path> PATH_CONVERTER = new Function<Object, Path>() {
        @Override
        @Nullable
        public Path apply(@Nullable Object input) {
            return Paths.get(input.toString());
        }
    };

    private static final Map<Class<?>, Function<Object, ?>> CONVERTERS = ImmutableMap.<Class<?>, Function<Object, ?>> builder()
            .put(String.class, new Function<Object, String>() {
                @Override
                @Nullable
                public String apply(@Nullable Object input) {
                    return input.toString();
                }
            })
            .put(Integer.class, fromString(Ints.stringConverter()))
            .put(Long.class, fromString(Longs.stringConverter()))
            .put(Path.class, PATH_CONVERTER)
            .build();

    private static <T> Function<Object, T> fromString(final com.google.common.base.Converter<String, T> delegate) {
        return new Function<Object, T>() {
            @Override
            @Nullable
            public T apply(@Nullable Object input) {
                return delegate.convert(input.toString().trim());
            }
        };
    }

    /** The config map backing this instance. */
    private final Map<String, Object> configMap;

    /**
     * Build a configuration from a JSON file.
     */
    public static Configuration get(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            return get(is);
        }
    }

    /**
     * Build a configuration from an input stream containing a JSON object.
     * Comments are allowed in the input.
     */
    public static Configuration get(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(Feature.ALLOW_COMMENTS, true);
        Map<String, Object> map = mapper.readValue(is, new TypeReference<HashMap<String, Object>>() {
        });
        if (map == null)
            throw new ConfigurationException("Configuration is empty.");
        return new Configuration(map);
    }

    public Configuration(Configuration config) {
        this(config.getConfigMap());
    }

    public Configuration(Map<String, Object> map) {
        Preconditions.checkNotNull(map);
        this.configMap = map;
    }

    /**
     * @return an unmodifiable view of the map backing this instance.
     */
    public Map<String, Object> getConfigMap() {
        return Collections.unmodifiableMap(this.configMap);
    }

    public boolean containsKey(String key) {
        return this.configMap.containsKey(key);
    }

    /**
     * Reads a required value, converting it to {@code clazz}.
     *
     * @throws ConfigurationException if the key is missing or the value
     *         cannot be converted.
     */
    public <T> T readScalar(String key, Class<T> clazz) {
        Preconditions.checkNotNull(key);
        if (!configMap.containsKey(key))
            throw new ConfigurationException("Required configuration value missing: " + key);
        return convert(key, configMap.get(key), clazz);
    }

    /**
     * Reads an optional value, converting it to {@code clazz}.
     *
     * @return the value at the given key, or {@code fallback} if the key is
     *         absent. A key that is present with a {@code null} value yields
     *         {@code null}.
     */
    public <T> T readScalar(String key, Class<T> clazz, T fallback) {
        Preconditions.checkNotNull(key);
        if (!configMap.containsKey(key))
            return fallback;
        return convert(key, configMap.get(key), clazz);
    }

    @SuppressWarnings("unchecked")
    private <T> T convert(String key, Object value, Class<T> clazz) {
        if (value == null || clazz.isInstance(value))
            return (T) value;
        Function<Object, ?> converter = CONVERTERS.get(clazz);
        if (converter == null)
            throw new ConfigurationException("Don't know how to read value of type: " + clazz);
        try {
            return (T) converter.apply(value);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException(String.format("Failed to convert value (%s) to desired type (%s): %s",
                    value, clazz.getSimpleName(), key), e);
        }
    }

    /**
     * Reads an enum constant by name. Matching ignores case, and
     * {@code "timestamped-rotating"} matches {@code TIMESTAMPED_ROTATING}.
     *
     * @return the constant, or {@code fallback} if the key is absent or null.
     * @throws ConfigurationException if the value names no constant.
     */
    public <E extends Enum<E>> E readEnum(Class<E> enumType, String key, E fallback) {
        String stringVal = readString(key, null);
        if (stringVal == null)
            return fallback;
        String name = stringVal.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(enumType, name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format(
                    "Value(%s) is not legally accepted by key: %s. Legal values are %s",
                    stringVal, key, Joiner.on(",").join(enumType.getEnumConstants())), e);
        }
    }

    public String readString(String key) {
        return readScalar(key, String.class);
    }

    public String readString(String key, String fallback) {
        return readScalar(key, String.class, fallback);
    }

    public Integer readInteger(String key) {
        return readScalar(key, Integer.class);
    }

    public Integer readInteger(String key, Integer fallback) {
        return readScalar(key, Integer.class, fallback);
    }

    public Long readLong(String key) {
        return readScalar(key, Long.class);
    }

    public Long readLong(String key, Long fallback) {
        return readScalar(key, Long.class, fallback);
    }

    public Path readPath(String key) {
        return readScalar(key, Path.class);
    }

    public Path readPath(String key, Path fallback) {
        return readScalar(key, Path.class, fallback);
    }

    @Override
    public String toString() {
        return this.configMap.toString();
    }

    /**
     * @throws ConfigurationException if the value doesn't fall within the range.
     */
    public static <T extends Comparable<T>> void validateRange(T value, Range<T> range, String label) {
        if (value == null || !range.contains(value)) {
            throw new ConfigurationException(String.format("'%s' value %s is outside of valid range (%s)",
                    label, value, range));
        }
    }
}
