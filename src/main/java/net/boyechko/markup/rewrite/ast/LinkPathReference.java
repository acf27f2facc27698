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

public record LinkPathReference(
        List<Span> content, PathBase path, String source, String title, Options options)
        implements PathReference, SpanContainer {

    public LinkPathReference {
        content = List.copyOf(content);
    }

    public LinkPathReference(List<Span> content, PathBase path, String source) {
        this(content, path, source, null, Options.NONE);
    }

    public static LinkPathReference of(String text, String path, String source) {
        return new LinkPathReference(List.of(new Text(text)), PathBase.parse(path), source);
    }

    @Override
    public SpanLink resolve(Target target) {
        return new SpanLink(content, target, title, options);
    }

    @Override
    public LinkPathReference withOptions(Options newOptions) {
        return new LinkPathReference(content, path, source, title, newOptions);
    }

    @Override
    public Span rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content
                ? this
                : new LinkPathReference(rewritten, path, source, title, options);
    }
}
