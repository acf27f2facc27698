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

import java.util.List;
import java.util.stream.Collectors;

/** The number of a section or document, prepended to its header. */
public record SectionNumber(List<Integer> position, Options options) implements TextContainer {

    public SectionNumber {
        position = List.copyOf(position);
    }

    public SectionNumber(List<Integer> position) {
        this(position, Options.styles("section-number"));
    }

    @Override
    public String text() {
        return position.stream().map(String::valueOf).collect(Collectors.joining(".")) + " ";
    }

    @Override
    public SectionNumber withOptions(Options newOptions) {
        return new SectionNumber(position, newOptions);
    }
}
