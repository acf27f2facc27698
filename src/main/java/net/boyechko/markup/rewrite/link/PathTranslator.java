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

import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RelativePath;
import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;
import net.boyechko.markup.rewrite.ast.Target;

/** Translates the paths of the input tree to the paths of the rendered output. */
public interface PathTranslator {

    Path translate(Path input);

    RelativePath translate(RelativePath input);

    default Target translate(Target target) {
        if (target instanceof ResolvedInternalTarget resolved) {
            return new ResolvedInternalTarget(
                    translate(resolved.absolutePath()),
                    translate(resolved.relativePath()),
                    resolved.internalFormats());
        }
        return target;
    }
}
