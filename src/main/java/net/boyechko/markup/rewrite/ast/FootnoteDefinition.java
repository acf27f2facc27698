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

/** An unresolved footnote as produced by a parser. */
public record FootnoteDefinition(FootnoteLabel label, List<Block> content, Options options)
        implements BlockContainer {

    public FootnoteDefinition {
        content = List.copyOf(content);
    }

    public FootnoteDefinition(FootnoteLabel label, List<Block> content) {
        this(label, content, Options.NONE);
    }

    @Override
    public FootnoteDefinition withContent(List<Block> newContent) {
        return new FootnoteDefinition(label, newContent, options);
    }

    @Override
    public FootnoteDefinition withOptions(Options newOptions) {
        return new FootnoteDefinition(label, content, newOptions);
    }
}
