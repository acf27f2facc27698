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

/** A header as produced by a parser, before sections get built. */
public record Header(int level, List<Span> content, Options options)
        implements Block, SpanContainer {

    public Header {
        content = List.copyOf(content);
    }

    public Header(int level, List<Span> content) {
        this(level, content, Options.NONE);
    }

    public static Header of(int level, String text) {
        return new Header(level, List.of(new Text(text)));
    }

    public Header withContent(List<Span> newContent) {
        return new Header(level, newContent, options);
    }

    @Override
    public Header withOptions(Options newOptions) {
        return new Header(level, content, newOptions);
    }

    @Override
    public Block rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content ? this : new Header(level, rewritten, options);
    }
}
