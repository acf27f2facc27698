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

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.TargetFormats;

/**
 * Targets matched by position. References and targets each consume the sequence in document
 * order, independently of each other; once a sequence is exhausted, further calls return empty.
 */
public class TargetSequenceResolver extends TargetResolver {

    private final List<TargetResolver> targets;
    private final Iterator<TargetResolver> referenceIterator;
    private final Iterator<TargetResolver> targetIterator;

    public TargetSequenceResolver(List<TargetResolver> targets, PositionalSelector selector) {
        super(selector, TargetFormats.ALL, 0);
        this.targets = List.copyOf(targets);
        this.referenceIterator = this.targets.iterator();
        this.targetIterator = this.targets.iterator();
    }

    public int size() {
        return targets.size();
    }

    @Override
    public Optional<Span> resolveReference(LinkSource source) {
        if (!referenceIterator.hasNext()) return Optional.empty();
        return referenceIterator.next().resolveReference(source);
    }

    @Override
    public Optional<Element> replaceTarget(Element rewrittenOriginal) {
        if (!targetIterator.hasNext()) return Optional.empty();
        return targetIterator.next().replaceTarget(rewrittenOriginal);
    }
}
