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

import java.util.Objects;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.Block;

/** Produces the final form of a target block; empty removes the target from the document. */
@FunctionalInterface
public interface TargetReplacer {

    Optional<Block> replace(Block target);

    TargetReplacer REMOVE_TARGET = target -> Optional.empty();

    TargetReplacer REMOVE_ID = target -> Optional.of(target.withoutId());

    static TargetReplacer addId(String id) {
        return target ->
                Optional.of(Objects.equals(target.options().id(), id) ? target : target.withId(id));
    }
}
