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

public record SpanSequence(List<Span> content, Options options) implements Span, SpanContainer {

    public SpanSequence {
        content = List.copyOf(content);
    }

    public SpanSequence(List<Span> content) {
        this(content, Options.NONE);
    }

    public static SpanSequence of(Span... spans) {
        return new SpanSequence(List.of(spans));
    }

    @Override
    public SpanSequence withOptions(Options newOptions) {
        return new SpanSequence(content, newOptions);
    }

    @Override
    public Span rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content ? this : new SpanSequence(rewritten, options);
    }
}
