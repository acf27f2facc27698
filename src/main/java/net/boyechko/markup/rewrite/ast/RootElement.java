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

/** The root of a single document's content. */
public record RootElement(List<Block> content, Options options) implements BlockContainer {

    public RootElement {
        content = List.copyOf(content);
    }

    public RootElement(List<Block> content) {
        this(content, Options.NONE);
    }

    public static RootElement of(Block... blocks) {
        return new RootElement(List.of(blocks));
    }

    @Override
    public RootElement withContent(List<Block> newContent) {
        return new RootElement(newContent, options);
    }

    @Override
    public RootElement withOptions(Options newOptions) {
        return new RootElement(content, newOptions);
    }
}
