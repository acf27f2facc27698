/*
 * Markup-Rewrite - Document Tree Rewrite Engine
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.rewrite.config;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Immutable configuration of a document, tree or tree root. Values live in nested maps and are
 * addressed by dotted keys ({@code laika.autonumbering.scope}). A config without a value for a
 * key asks its fallback, which is how documents inherit from their trees.
 */
public final class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/markup-rewrite-defaults.yaml";

    public static final Config EMPTY = new Config(Map.of(), null);

    private final Map<String, Object> values;
    private final Config fallback;

    private Config(Map<String, Object> values, Config fallback) {
        this.values = values;
        this.fallback = fallback;
    }

    public static Config fromMap(Map<String, Object> values) {
        return new Config(deepCopy(values), null);
    }

    public static Config fromYaml(String yaml) {
        Object loaded = newYaml().load(yaml);
        return fromLoaded(loaded, "inline YAML");
    }

    /**
     * Load configuration from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static Config fromResource(String resourcePath) {
        try (InputStream inputStream = Config.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new ConfigException("Resource not found: " + resourcePath);
            }
            Config config = fromLoaded(newYaml().load(inputStream), resourcePath);
            logger.debug(
                    "Loaded configuration with {} top-level keys from resource {}",
                    config.values.size(),
                    resourcePath);
            return config;
        } catch (ConfigException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load configuration from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new ConfigException(
                    "Failed to load configuration from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load the defaults from the standard location */
    public static Config loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static Config fromLoaded(Object loaded, String origin) {
        if (loaded == null) return EMPTY;
        if (!(loaded instanceof Map)) {
            throw new ConfigException("Configuration in " + origin + " is not a mapping");
        }
        return new Config(deepCopy((Map<?, ?>) loaded), null);
    }

    /** Returns a config that asks {@code next} for all keys it does not define itself. */
    public Config withFallback(Config next) {
        if (next == null || next == EMPTY || next == this) return this;
        Config newFallback = fallback == null ? next : fallback.withFallback(next);
        return new Config(values, newFallback);
    }

    /** Returns a copy of this config with the value at {@code key} replaced. */
    public Config withValue(String key, Object value) {
        Map<String, Object> copy = deepCopy(values);
        String[] parts = key.split("\\.");
        Map<String, Object> current = copy;
        for (int i = 0; i < parts.length - 1; i++) {
            Object next = current.get(parts[i]);
            if (!(next instanceof Map)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts[i], next);
            }
            current = asMap(next);
        }
        current.put(parts[parts.length - 1], value);
        return new Config(copy, fallback);
    }

    public boolean hasKey(String key) {
        return get(key).isPresent();
    }

    public Optional<Object> get(String key) {
        Object own = lookup(values, key.split("\\."), 0);
        if (own != null) return Optional.of(own);
        return fallback != null ? fallback.get(key) : Optional.empty();
    }

    public Optional<String> getString(String key) {
        return get(key).map(String::valueOf);
    }

    public Optional<Integer> getInt(String key) {
        return get(key).map(v -> {
            if (v instanceof Number n) return n.intValue();
            try {
                return Integer.parseInt(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(invalidType(key, "an integer", v), e);
            }
        });
    }

    public Optional<Boolean> getBoolean(String key) {
        return get(key).map(v -> {
            if (v instanceof Boolean b) return b;
            String s = v.toString().trim();
            if (s.equalsIgnoreCase("true")) return true;
            if (s.equalsIgnoreCase("false")) return false;
            throw new ConfigException(invalidType(key, "a boolean", v));
        });
    }

    public Optional<List<String>> getStringList(String key) {
        return get(key).map(v -> {
            if (v instanceof List<?> list) {
                List<String> out = new ArrayList<>(list.size());
                list.forEach(item -> out.add(String.valueOf(item)));
                return List.copyOf(out);
            }
            return List.of(v.toString());
        });
    }

    public Optional<List<Object>> getList(String key) {
        return get(key).map(v -> {
            if (v instanceof List<?> list) return List.copyOf(list);
            throw new ConfigException(invalidType(key, "a list", v));
        });
    }

    /** Returns the map at {@code key}, merged with the maps of all fallbacks (nearest wins). */
    public Map<String, Object> getMap(String key) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (fallback != null) merged.putAll(fallback.getMap(key));
        Object own = lookup(values, key.split("\\."), 0);
        if (own != null) {
            if (!(own instanceof Map)) {
                throw new ConfigException(invalidType(key, "a mapping", own));
            }
            merged.putAll(asMap(own));
        }
        return merged;
    }

    private static String invalidType(String key, String expected, Object found) {
        return "Invalid value for key '" + key + "': expected " + expected + ", found " + found;
    }

    /** Walks nested maps; keys may also be stored flat with dots in them. */
    private static Object lookup(Map<String, Object> map, String[] parts, int from) {
        for (int to = parts.length; to > from; to--) {
            String candidate = String.join(".", Arrays.copyOfRange(parts, from, to));
            if (!map.containsKey(candidate)) continue;
            Object value = map.get(candidate);
            if (to == parts.length) return value;
            if (value instanceof Map) {
                Object nested = lookup(asMap(value), parts, to);
                if (nested != null) return nested;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : source.entrySet()) {
            Object value = e.getValue();
            copy.put(
                    String.valueOf(e.getKey()),
                    value instanceof Map<?, ?> nested ? deepCopy(nested) : value);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "Config" + values + (fallback != null ? " -> " + fallback : "");
    }
}
