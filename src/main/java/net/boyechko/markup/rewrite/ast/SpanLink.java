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

public record SpanLink(List<Span> content, Target target, String title, Options options)
        implements GlobalLink, SpanContainer {

    public SpanLink {
        content = List.copyOf(content);
    }

    public SpanLink(List<Span> content, Target target) {
        this(content, target, null, Options.NONE);
    }

    @Override
    public SpanLink withTarget(Target newTarget) {
        return new SpanLink(content, newTarget, title, options);
    }

    @Override
    public boolean supportsExternalTargets() {
        return true;
    }

    @Override
    public SpanLink withOptions(Options newOptions) {
        return new SpanLink(content, target, title, newOptions);
    }

    @Override
    public Span rewriteChildren(ElementRewriter rewriter) {
        List<Span> rewritten = rewriter.rewriteSpans(content);
        return rewritten == content ? this : new SpanLink(rewritten, target, title, options);
    }
}
