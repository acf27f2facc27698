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

/** A block that contains other blocks. */
public interface BlockContainer extends Block {

    List<Block> content();

    BlockContainer withContent(List<Block> content);

    @Override
    default List<? extends Element> children() {
        return content();
    }

    @Override
    default Block rewriteChildren(ElementRewriter rewriter) {
        List<Block> rewritten = rewriter.rewriteBlocks(content());
        return rewritten == content() ? this : withContent(rewritten);
    }
}
