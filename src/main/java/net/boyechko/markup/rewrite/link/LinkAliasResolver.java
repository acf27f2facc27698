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
package net.boyechko.markup.rewrite.link;

import java.util.Optional;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.TargetFormats;

/**
 * An alias making the target selected by {@code targetSelector} reachable through {@code
 * sourceSelector}. The alias itself is removed from the document.
 */
public final class LinkAliasResolver extends TargetResolver {

    private final TargetIdSelector sourceSelector;
    private final TargetIdSelector targetSelector;
    private final ReferenceResolver referenceResolver;

    private LinkAliasResolver(
            TargetIdSelector sourceSelector,
            TargetIdSelector targetSelector,
            ReferenceResolver referenceResolver,
            TargetFormats formats) {
        super(sourceSelector, formats, 0);
        this.sourceSelector = sourceSelector;
        this.targetSelector = targetSelector;
        this.referenceResolver = referenceResolver;
    }

    /** An alias whose target has not been looked up yet. */
    public static LinkAliasResolver unresolved(
            TargetIdSelector sourceSelector,
            TargetIdSelector targetSelector,
            TargetFormats formats) {
        String message = "unresolved link alias: " + targetSelector.id();
        return new LinkAliasResolver(
                sourceSelector,
                targetSelector,
                source -> invalidReference(source, message),
                formats);
    }

    public TargetIdSelector sourceSelector() {
        return sourceSelector;
    }

    public TargetIdSelector targetSelector() {
        return targetSelector;
    }

    public LinkAliasResolver resolveWith(ReferenceResolver resolver) {
        return new LinkAliasResolver(sourceSelector, targetSelector, resolver, targetFormats());
    }

    public LinkAliasResolver circularReference() {
        String message = "circular link reference: " + targetSelector.id();
        return resolveWith(source -> invalidReference(source, message));
    }

    @Override
    public Optional<Span> resolveReference(LinkSource source) {
        return referenceResolver.resolve(source);
    }

    @Override
    public Optional<Element> replaceTarget(Element rewrittenOriginal) {
        return Optional.empty();
    }
}
