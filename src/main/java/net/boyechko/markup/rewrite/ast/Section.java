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

/** A header together with all blocks up to the next header of the same or a higher level. */
public record Section(Header header, List<Block> content, Options options)
        implements BlockContainer {

    public Section {
        content = List.copyOf(content);
    }

    public Section(Header header, List<Block> content) {
        this(header, content, Options.NONE);
    }

    @Override
    public List<? extends Element> children() {
        List<Element> all = new ArrayList<>(content.size() + 1);
        all.add(header);
        all.addAll(content);
        return all;
    }

    @Override
    public Section withContent(List<Block> newContent) {
        return new Section(header, newContent, options);
    }

    @Override
    public Section withOptions(Options newOptions) {
        return new Section(header, content, newOptions);
    }

    /**
     * Rewrites the header like any other block. A header replaced by something other than a header
     * keeps its previous form, since a section cannot exist without one.
     */
    @Override
    public Block rewriteChildren(ElementRewriter rewriter) {
        List<Block> headerList = List.of(header);
        List<Block> rewrittenHeader = rewriter.rewriteBlocks(headerList);
        Header newHeader = header;
        if (rewrittenHeader != headerList
                && rewrittenHeader.size() == 1
                && rewrittenHeader.get(0) instanceof Header h) {
            newHeader = h;
        }
        List<Block> newContent = rewriter.rewriteBlocks(content);
        if (newHeader == header && newContent == content) return this;
        return new Section(newHeader, newContent, options);
    }
}
