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

public record QuotedBlock(List<Block> content, Options options) implements BlockContainer {

    public QuotedBlock {
        content = List.copyOf(content);
    }

    public QuotedBlock(List<Block> content) {
        this(content, Options.NONE);
    }

    @Override
    public QuotedBlock withContent(List<Block> newContent) {
        return new QuotedBlock(newContent, options);
    }

    @Override
    public QuotedBlock withOptions(Options newOptions) {
        return new QuotedBlock(content, newOptions);
    }
}
