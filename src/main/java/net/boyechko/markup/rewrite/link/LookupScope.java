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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;

/** The scopes searched, in configured order, when resolving a reference by id. */
public enum LookupScope {
    /** The document containing the reference. */
    DOCUMENT,
    /** All documents of the tree containing the document. */
    TREE,
    /** All documents of each ancestor tree, nearest first. */
    ANCESTORS;

    public static final List<LookupScope> DEFAULT_ORDER = List.of(DOCUMENT, TREE, ANCESTORS);

    /** Reads {@link ConfigKeys#LINK_LOOKUP_ORDER}, falling back to {@link #DEFAULT_ORDER}. */
    public static List<LookupScope> fromConfig(Config config) {
        List<String> names = config.getStringList(ConfigKeys.LINK_LOOKUP_ORDER).orElse(null);
        if (names == null) return DEFAULT_ORDER;
        List<LookupScope> order = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                order.add(valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(
                        "Invalid value for " + ConfigKeys.LINK_LOOKUP_ORDER + ": " + name, e);
            }
        }
        return List.copyOf(order);
    }
}
