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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigTest {

    @Test
    void readsNestedYamlByDottedKey() {
        Config config =
                Config.fromYaml(
                        "laika:\n"
                                + "  autonumbering:\n"
                                + "    scope: sections\n"
                                + "    depth: 2\n"
                                + "  targetFormats: [html, epub]\n");

        assertEquals("sections", config.getString(ConfigKeys.AUTONUMBERING_SCOPE).orElseThrow());
        assertEquals(2, config.getInt(ConfigKeys.AUTONUMBERING_DEPTH).orElseThrow());
        assertEquals(
                List.of("html", "epub"),
                config.getStringList(ConfigKeys.TARGET_FORMATS).orElseThrow());
    }

    @Test
    void readsFlatDottedKeys() {
        Config config = Config.fromMap(Map.of("laika.siteBaseURL", "https://example.com/"));
        assertEquals(
                "https://example.com/", config.getString(ConfigKeys.SITE_BASE_URL).orElseThrow());
    }

    @Test
    void fallsBackForMissingKeys() {
        Config parent = Config.fromMap(Map.of("laika", Map.of("versioned", true)));
        Config child =
                Config.fromMap(Map.of("laika", Map.of("firstHeaderAsTitle", false)))
                        .withFallback(parent);

        assertTrue(child.getBoolean(ConfigKeys.VERSIONED).orElseThrow());
        assertFalse(child.getBoolean(ConfigKeys.FIRST_HEADER_AS_TITLE).orElseThrow());
        assertTrue(child.get("laika.unknown").isEmpty());
    }

    @Test
    void mergesMapsAcrossFallbacks() {
        Config parent =
                Config.fromMap(
                        Map.of("laika", Map.of("links", Map.of("targets", Map.of("a", "/a.md")))));
        Config child =
                Config.fromMap(
                                Map.of(
                                        "laika",
                                        Map.of(
                                                "links",
                                                Map.of(
                                                        "targets",
                                                        Map.of("b", "https://b.com")))))
                        .withFallback(parent);

        assertEquals(
                Map.of("a", "/a.md", "b", "https://b.com"), child.getMap(ConfigKeys.LINK_TARGETS));
    }

    @Test
    void withValueLeavesOriginalUntouched() {
        Config original = Config.fromMap(Map.of("laika", Map.of("versioned", false)));
        Config updated = original.withValue(ConfigKeys.VERSIONED, true);

        assertFalse(original.getBoolean(ConfigKeys.VERSIONED).orElseThrow());
        assertTrue(updated.getBoolean(ConfigKeys.VERSIONED).orElseThrow());
    }

    @Test
    void rejectsValuesOfWrongType() {
        Config config =
                Config.fromMap(
                        Map.of("laika", Map.of("autonumbering", Map.of("depth", "x"))));
        assertThrows(ConfigException.class, () -> config.getInt(ConfigKeys.AUTONUMBERING_DEPTH));
    }

    @Test
    void rejectsYamlThatIsNotAMapping() {
        assertThrows(ConfigException.class, () -> Config.fromYaml("- just\n- a list\n"));
    }

    @Test
    void loadsBundledDefaults() {
        Config defaults = Config.loadDefault();
        assertEquals("global", defaults.getString(ConfigKeys.LINK_VALIDATION).orElseThrow());
        assertEquals(
                List.of("document", "tree", "ancestors"),
                defaults.getStringList(ConfigKeys.LINK_LOOKUP_ORDER).orElseThrow());
    }

    @Test
    void missingResourceFailsWithConfigException() {
        assertThrows(ConfigException.class, () -> Config.fromResource("/no-such-config.yaml"));
    }

    @Test
    void readsVersions() {
        Config config =
                Config.fromYaml(
                        "laika:\n"
                                + "  versions:\n"
                                + "    currentVersion:\n"
                                + "      {displayValue: '0.42.x', pathSegment: '0.42'}\n"
                                + "    olderVersions:\n"
                                + "      - {displayValue: '0.41.x', pathSegment: '0.41'}\n");

        Versions versions = Versions.fromConfig(config).orElseThrow();
        assertEquals("0.42", versions.currentVersion().pathSegment());
        assertEquals(2, versions.allVersions().size());
    }
}
