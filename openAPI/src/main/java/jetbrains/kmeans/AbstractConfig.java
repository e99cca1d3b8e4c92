/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.kmeans;

import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.NonNls;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for {@linkplain KMeansConfig}. Holds typed settings whose types are defined by their
 * default values: {@code Boolean}, {@code Integer} or {@code Double}.
 */
public abstract class AbstractConfig {

    @NonNls
    private static final String UNSUPPORTED_TYPE_ERROR_MSG = "Unsupported value type";

    @NotNull
    private final Map<String, Object> settings;
    private boolean isMutable = true;

    protected AbstractConfig(@NotNull final Pair<String, Object>[] props, @NotNull final ConfigurationStrategy strategy) {
        settings = new LinkedHashMap<>();
        for (final Pair<String, Object> prop : props) {
            final String propName = prop.getLeft();
            final Object defaultValue = prop.getRight();
            final Object value;
            final Class<?> clazz = defaultValue.getClass();
            if (clazz == Boolean.class) {
                value = getBoolean(strategy, propName, (Boolean) defaultValue);
            } else if (clazz == Integer.class) {
                value = getInteger(strategy, propName, (Integer) defaultValue);
            } else if (clazz == Double.class) {
                value = getDouble(strategy, propName, (Double) defaultValue);
            } else {
                throw new ClusteringException(UNSUPPORTED_TYPE_ERROR_MSG);
            }
            settings.put(propName, value);
        }
    }

    public Object getSetting(@NotNull final String key) {
        return settings.get(key);
    }

    public AbstractConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        if (!isMutable) {
            throw new ClusteringException("Config is immutable");
        }
        settings.put(key, value);
        return this;
    }

    public Map<String, Object> getSettings() {
        return Collections.unmodifiableMap(settings);
    }

    public boolean isMutable() {
        return isMutable;
    }

    public AbstractConfig setMutable(boolean isMutable) {
        this.isMutable = isMutable;
        return this;
    }

    public void setSettings(@NotNull final Map<String, String> settings) throws InvalidSettingException {
        final StringBuilder errorMessage = new StringBuilder();
        for (final Map.Entry<String, String> entry : settings.entrySet()) {
            final String key = entry.getKey();
            final Object oldValue = getSetting(key);
            if (oldValue == null) {
                appendLineFeed(errorMessage);
                errorMessage.append("Unknown setting key: ");
                errorMessage.append(key);
                continue;
            }
            final String value = entry.getValue();
            if (value == null) {
                appendLineFeed(errorMessage);
                errorMessage.append("Missing value of ");
                errorMessage.append(key);
                continue;
            }
            final Object newValue;
            final Class<?> clazz = oldValue.getClass();
            try {
                if (clazz == Boolean.class) {
                    newValue = Boolean.valueOf(value);
                } else if (clazz == Integer.class) {
                    newValue = Integer.decode(value);
                } else if (clazz == Double.class) {
                    newValue = Double.valueOf(value);
                } else {
                    appendLineFeed(errorMessage);
                    errorMessage.append(UNSUPPORTED_TYPE_ERROR_MSG);
                    errorMessage.append(": ");
                    errorMessage.append(clazz);
                    continue;
                }
                setSetting(key, newValue);
            } catch (NumberFormatException e) {
                appendLineFeed(errorMessage);
                errorMessage.append("Invalid value of ");
                errorMessage.append(key);
                errorMessage.append(": ");
                errorMessage.append(value);
            }
        }
        if (errorMessage.length() > 0) {
            throw new InvalidSettingException(errorMessage.toString());
        }
    }

    private static boolean getBoolean(@NotNull final ConfigurationStrategy strategy,
                                      @NotNull final String propName,
                                      final boolean defaultValue) {
        final String value = strategy.getProperty(propName);
        return value == null ? defaultValue : "true".equalsIgnoreCase(value);
    }

    private static Integer getInteger(@NotNull final ConfigurationStrategy strategy,
                                      @NotNull final String propName,
                                      final Integer defaultValue) {
        final String v = strategy.getProperty(propName);
        if (v != null) {
            try {
                return Integer.decode(v);
            } catch (NumberFormatException ignored) {
            }
        }
        return defaultValue;
    }

    private static Double getDouble(@NotNull final ConfigurationStrategy strategy,
                                    @NotNull final String propName,
                                    final Double defaultValue) {
        final String v = strategy.getProperty(propName);
        if (v != null) {
            try {
                return Double.valueOf(v);
            } catch (NumberFormatException ignored) {
            }
        }
        return defaultValue;
    }

    private static void appendLineFeed(@NotNull final StringBuilder builder) {
        if (builder.length() > 0) {
            builder.append('\n');
        }
    }
}
