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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The versions of the documentation, read from {@link ConfigKeys#VERSIONS}. */
public record Versions(
        Version currentVersion, List<Version> olderVersions, List<Version> newerVersions) {

    public Versions {
        olderVersions = List.copyOf(olderVersions);
        newerVersions = List.copyOf(newerVersions);
    }

    public record Version(String displayValue, String pathSegment) {}

    public List<Version> allVersions() {
        List<Version> all = new ArrayList<>(newerVersions);
        all.add(currentVersion);
        all.addAll(olderVersions);
        return all;
    }

    public static Optional<Versions> fromConfig(Config config) {
        Map<String, Object> map = config.getMap(ConfigKeys.VERSIONS);
        if (map.isEmpty()) return Optional.empty();
        Object current = map.get("currentVersion");
        if (!(current instanceof Map)) {
            throw new ConfigException(
                    "Invalid value for key '" + ConfigKeys.VERSIONS + "': currentVersion missing");
        }
        return Optional.of(
                new Versions(
                        versionOf(current),
                        versionsOf(map.get("olderVersions")),
                        versionsOf(map.get("newerVersions"))));
    }

    private static List<Version> versionsOf(Object value) {
        if (!(value instanceof List<?> list)) return List.of();
        List<Version> out = new ArrayList<>();
        list.forEach(v -> out.add(versionOf(v)));
        return out;
    }

    private static Version versionOf(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigException("Invalid version entry: " + value);
        }
        Object segment = map.get("pathSegment");
        Object display = map.get("displayValue");
        if (segment == null) throw new ConfigException("Version without pathSegment: " + value);
        String path = segment.toString();
        return new Version(display != null ? display.toString() : path, path);
    }
}
