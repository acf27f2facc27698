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
import net.boyechko.markup.rewrite.ast.ExternalTarget;
import net.boyechko.markup.rewrite.ast.InternalTarget;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.PathReference;
import net.boyechko.markup.rewrite.ast.RelativePath;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.SpanLink;
import net.boyechko.markup.rewrite.ast.Target;

/** Turns a reference into the span that replaces it, if the reference is of a supported kind. */
@FunctionalInterface
public interface ReferenceResolver {

    Optional<Span> resolve(LinkSource source);

    /** Resolves path and link id references to an internal link pointing at {@code target}. */
    static ReferenceResolver internalLink(Path target) {
        return source -> {
            Span span = source.span();
            if (span instanceof PathReference ref) {
                return Optional.of(
                        ref.resolve(new InternalTarget(target).relativeTo(source.path())));
            }
            if (span instanceof LinkIdReference ref) {
                return Optional.of(
                        new SpanLink(
                                ref.content(),
                                new InternalTarget(target).relativeTo(source.path()),
                                null,
                                ref.options()));
            }
            return Optional.empty();
        };
    }

    /**
     * Resolves a relative path for a link in the document at {@code refPath}. Paths that point
     * above the root of the tree become external targets and are not validated.
     */
    static Target resolveTarget(RelativePath target, Path refPath) {
        if (target.parentLevels() >= refPath.depth()) {
            return new ExternalTarget(target.toString());
        }
        return new InternalTarget(target).relativeTo(refPath);
    }

    static Target resolveTarget(Target target, Path refPath) {
        if (target instanceof InternalTarget internal) {
            if (internal.path() instanceof RelativePath rel) return resolveTarget(rel, refPath);
            return internal.relativeTo(refPath);
        }
        return target;
    }
}
