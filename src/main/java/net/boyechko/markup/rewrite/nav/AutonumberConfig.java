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
package net.boyechko.markup.rewrite.nav;

import java.util.Locale;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;

/**
 * Which titles and headers get numbers.
 *
 * @param documents whether document titles carry the position of the document in the tree
 * @param sections whether section headers are numbered
 * @param maxDepth sections whose number has more components than this stay unnumbered
 */
public record AutonumberConfig(boolean documents, boolean sections, int maxDepth) {

    public static final AutonumberConfig DISABLED =
            new AutonumberConfig(false, false, Integer.MAX_VALUE);

    /**
     * Reads {@link ConfigKeys#AUTONUMBERING_SCOPE} (all, documents, sections or none) and {@link
     * ConfigKeys#AUTONUMBERING_DEPTH}.
     *
     * @throws ConfigException for an unknown scope
     */
    public static AutonumberConfig fromConfig(Config config) {
        String scope = config.getString(ConfigKeys.AUTONUMBERING_SCOPE).orElse("none");
        int depth = config.getInt(ConfigKeys.AUTONUMBERING_DEPTH).orElse(Integer.MAX_VALUE);
        switch (scope.trim().toLowerCase(Locale.ROOT)) {
            case "all":
                return new AutonumberConfig(true, true, depth);
            case "documents":
                return new AutonumberConfig(true, false, depth);
            case "sections":
                return new AutonumberConfig(false, true, depth);
            case "none":
                return new AutonumberConfig(false, false, depth);
            default:
                throw new ConfigException("Invalid value for autonumbering.scope: " + scope);
        }
    }
}
