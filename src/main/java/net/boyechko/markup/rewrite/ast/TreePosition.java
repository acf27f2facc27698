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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** The position of a document or tree as a list of one-based indices, used for numbering. */
public record TreePosition(List<Integer> toList) {

    public static final TreePosition ROOT = new TreePosition(List.of());

    public TreePosition {
        toList = List.copyOf(toList);
    }

    public TreePosition forChild(int childNum) {
        List<Integer> child = new ArrayList<>(toList);
        child.add(childNum);
        return new TreePosition(child);
    }

    public int depth() {
        return toList.size();
    }

    @Override
    public String toString() {
        return toList.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
