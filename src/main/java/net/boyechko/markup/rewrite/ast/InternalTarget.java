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

/** A path inside the document tree as written in markup, not yet resolved. */
public record InternalTarget(PathBase path) implements Target {

    /** Resolves this target for a link placed in the document at {@code refPath}. */
    public ResolvedInternalTarget relativeTo(Path refPath) {
        Path absolute;
        if (path instanceof RelativePath rel) {
            absolute =
                    rel.isCurrentDocument()
                            ? refPath.withFragment(rel.fragment().orElse(null))
                            : refPath.parent().resolve(rel);
        } else {
            absolute = (Path) path;
        }
        return ResolvedInternalTarget.of(absolute, refPath, TargetFormats.ALL);
    }
}
