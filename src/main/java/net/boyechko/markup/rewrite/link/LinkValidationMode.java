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
package net.boyechko.markup.rewrite.link;

import java.util.Locale;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;

/** How thoroughly internal links get validated, read from {@link ConfigKeys#LINK_VALIDATION}. */
public enum LinkValidationMode {
    /** No validation at all. */
    OFF,
    /** Only links to targets within the same document. */
    LOCAL,
    /** All internal links, except those into excluded paths. */
    GLOBAL;

    public static LinkValidationMode fromConfig(Config config) {
        String value = config.getString(ConfigKeys.LINK_VALIDATION).orElse("global");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(
                    "Invalid value for " + ConfigKeys.LINK_VALIDATION + ": " + value, e);
        }
    }
}
