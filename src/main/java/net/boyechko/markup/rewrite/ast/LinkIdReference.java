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

/**
 * A reference to a link definition or any other target by id. An empty {@code ref} marks an
 * anonymous reference, matched by position.
 */
public record LinkIdReference(List<Span> content, String ref, String source, Options options)
        implements Reference, SpanContainer {

    public LinkIdReference {
        content = List.copyOf(content);
    }

    public LinkIdReference(List<Span> content, String ref, String source) {
        this(content, ref, source, Options.NONE);
    }

    public static LinkIdReference of(String text, String ref, String source) {
        return new LinkIdReference(List.of(new Text(text)), ref, source);
    }

    @Override
    public LinkIdReference withOptions(Options newOptions) {
        return new LinkIdReference(content, ref, source, newOptions);
    }

    @Override
    public Span rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content ? this : new LinkIdReference(rewritten, ref, source, options);
    }
}
