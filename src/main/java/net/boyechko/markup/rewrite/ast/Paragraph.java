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

public record Paragraph(List<Span> content, Options options) implements Block, SpanContainer {

    public Paragraph {
        content = List.copyOf(content);
    }

    public Paragraph(List<Span> content) {
        this(content, Options.NONE);
    }

    public static Paragraph of(Span... spans) {
        return new Paragraph(List.of(spans));
    }

    public static Paragraph of(String text) {
        return new Paragraph(List.of(new Text(text)));
    }

    @Override
    public Paragraph withOptions(Options newOptions) {
        return new Paragraph(content, newOptions);
    }

    @Override
    public Block rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content ? this : new Paragraph(rewritten, options);
    }
}
