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
package net.boyechko.markup.rewrite.ast;

/** The destination of a link or image. */
public sealed interface Target permits ExternalTarget, InternalTarget, ResolvedInternalTarget {

    /**
     * Interprets a URL from markup or configuration: absolute URLs become external targets,
     * everything else a path inside the document tree.
     */
    static Target parse(String url) {
        if (url.startsWith("http:")
                || url.startsWith("https:")
                || url.startsWith("mailto:")
                || url.startsWith("//")) {
            return new ExternalTarget(url);
        }
        return new InternalTarget(PathBase.parse(url));
    }
}
