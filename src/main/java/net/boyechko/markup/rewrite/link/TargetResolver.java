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

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.Reference;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.TargetFormats;

/**
 * A link target with its final id, able to resolve the references matching its selector and to
 * produce the final form of the target element itself.
 */
public abstract class TargetResolver {

    private final Selector selector;
    private final TargetFormats targetFormats;
    private final int precedence;

    protected TargetResolver(Selector selector, TargetFormats targetFormats, int precedence) {
        this.selector = selector;
        this.targetFormats = targetFormats;
        this.precedence = precedence;
    }

    public Selector selector() {
        return selector;
    }

    /** The output formats of the document this target lives in. */
    public TargetFormats targetFormats() {
        return targetFormats;
    }

    /** Among targets with the same selector, higher values win. Headers use 10 minus level. */
    public int precedence() {
        return precedence;
    }

    /** Creates the link element for a reference to this target; empty if unsupported. */
    public abstract Optional<Span> resolveReference(LinkSource source);

    /**
     * Creates the final target element from the original one, which may already have rewritten
     * children. Empty removes the target.
     */
    public abstract Optional<Element> replaceTarget(Element rewrittenOriginal);

    public static TargetResolver create(
            Selector selector,
            ReferenceResolver referenceResolver,
            TargetReplacer targetReplacer,
            TargetFormats formats,
            int precedence) {
        return new TargetResolver(selector, formats, precedence) {
            @Override
            public Optional<Span> resolveReference(LinkSource source) {
                return referenceResolver.resolve(source);
            }

            @Override
            public Optional<Element> replaceTarget(Element rewrittenOriginal) {
                if (rewrittenOriginal instanceof Block block) {
                    return targetReplacer.replace(block).map(Element.class::cast);
                }
                return Optional.empty();
            }
        };
    }

    public static TargetResolver create(
            Selector selector,
            ReferenceResolver referenceResolver,
            TargetReplacer targetReplacer,
            TargetFormats formats) {
        return create(selector, referenceResolver, targetReplacer, formats, 0);
    }

    /** A target expressed as an id on a span, like an inline anchor. */
    public static TargetResolver forSpanTarget(
            TargetIdSelector selector, ReferenceResolver referenceResolver, TargetFormats formats) {
        return new TargetResolver(selector, formats, 0) {
            @Override
            public Optional<Span> resolveReference(LinkSource source) {
                return referenceResolver.resolve(source);
            }

            @Override
            public Optional<Element> replaceTarget(Element rewrittenOriginal) {
                if (rewrittenOriginal instanceof Span span) {
                    if (Objects.equals(span.options().id(), selector.id())) {
                        return Optional.of(span);
                    }
                    return Optional.of(span.withId(selector.id()));
                }
                return Optional.empty();
            }
        };
    }

    /**
     * A target that turns all references into invalid spans and itself into an invalid element
     * with the same message.
     */
    public static TargetResolver forInvalidTarget(UniqueSelector selector, String message) {
        return new TargetResolver(selector, TargetFormats.ALL, 0) {
            @Override
            public Optional<Span> resolveReference(LinkSource source) {
                return invalidReference(source, message);
            }

            @Override
            public Optional<Element> replaceTarget(Element rewrittenOriginal) {
                if (rewrittenOriginal instanceof Block block) {
                    return Optional.of(new InvalidBlock(message, block.withoutId()));
                }
                if (rewrittenOriginal instanceof Span span) {
                    return Optional.of(new InvalidSpan(message, span.withoutId()));
                }
                return Optional.empty();
            }
        };
    }

    /**
     * Combines several targets sharing a unique selector within one document.
     *
     * <p>Headers with the same id are all kept, numbered with {@code -1}, {@code -2} and so on in
     * document order; a reference goes to the one with the highest precedence if there is exactly
     * one such header. Duplicate link definitions are dropped. All other duplicates turn into
     * invalid elements, and so do references to them.
     *
     * @param documentPath the path of the document containing the targets
     * @param allHeaders whether every target is a header
     * @param linkDefinitions whether the targets are link definitions
     */
    public static TargetResolver forDuplicateSelector(
            UniqueSelector selector,
            Path documentPath,
            List<TargetResolver> targets,
            boolean allHeaders,
            boolean linkDefinitions) {
        DuplicateMode mode =
                linkDefinitions
                        ? DuplicateMode.DROP
                        : allHeaders ? DuplicateMode.RENUMBER : DuplicateMode.INVALID;
        return new DuplicateResolver(selector, documentPath, targets, mode);
    }

    /**
     * Combines targets for a unique selector collected from several documents. The single target
     * with the highest precedence wins; a tie makes references ambiguous. Targets are never
     * replaced through this resolver, only through the one of their own document.
     */
    public static TargetResolver forTreeSelector(
            UniqueSelector selector, Path scope, List<TargetResolver> targets) {
        List<TargetResolver> top = highestPrecedence(targets);
        if (top.size() == 1) return top.get(0);
        String ambiguous =
                "Ambiguous reference: more than one "
                        + selector.description()
                        + " in path "
                        + scope;
        return new TargetResolver(selector, TargetFormats.ALL, top.get(0).precedence()) {
            @Override
            public Optional<Span> resolveReference(LinkSource source) {
                return invalidReference(source, ambiguous);
            }

            @Override
            public Optional<Element> replaceTarget(Element rewrittenOriginal) {
                return Optional.empty();
            }
        };
    }

    /** Makes {@code delegate} reachable through another selector. */
    public static TargetResolver forDelegate(Selector selector, TargetResolver delegate) {
        return new TargetResolver(selector, delegate.targetFormats(), delegate.precedence()) {
            @Override
            public Optional<Span> resolveReference(LinkSource source) {
                return delegate.resolveReference(source);
            }

            @Override
            public Optional<Element> replaceTarget(Element rewrittenOriginal) {
                return delegate.replaceTarget(rewrittenOriginal);
            }
        };
    }

    static Optional<Span> invalidReference(LinkSource source, String message) {
        if (source.span() instanceof Reference ref) {
            return Optional.of(InvalidSpan.of(message, ref.source()));
        }
        return Optional.empty();
    }

    static List<TargetResolver> highestPrecedence(List<TargetResolver> targets) {
        int max = targets.stream().mapToInt(TargetResolver::precedence).max().orElse(0);
        return targets.stream().filter(t -> t.precedence() == max).toList();
    }

    private enum DuplicateMode {
        RENUMBER,
        DROP,
        INVALID
    }

    private static final class DuplicateResolver extends TargetResolver {
        private final Path documentPath;
        private final List<TargetResolver> targets;
        private final DuplicateMode mode;
        private final Iterator<TargetResolver> replaceIterator;
        private int replaced;

        DuplicateResolver(
                UniqueSelector selector,
                Path documentPath,
                List<TargetResolver> targets,
                DuplicateMode mode) {
            super(
                    selector,
                    targets.get(0).targetFormats(),
                    targets.stream()
                            .max(Comparator.comparingInt(TargetResolver::precedence))
                            .map(TargetResolver::precedence)
                            .orElse(0));
            this.documentPath = documentPath;
            this.targets = List.copyOf(targets);
            this.mode = mode;
            this.replaceIterator = this.targets.iterator();
        }

        private String description() {
            return ((UniqueSelector) selector()).description();
        }

        @Override
        public Optional<Span> resolveReference(LinkSource source) {
            if (mode == DuplicateMode.RENUMBER) {
                List<TargetResolver> top = highestPrecedence(targets);
                if (top.size() == 1) {
                    String id =
                            ((TargetIdSelector) selector()).id()
                                    + "-"
                                    + (targets.indexOf(top.get(0)) + 1);
                    return ReferenceResolver.internalLink(documentPath.withFragment(id))
                            .resolve(source);
                }
            }
            return invalidReference(
                    source,
                    "Ambiguous reference: more than one "
                            + description()
                            + " in path "
                            + documentPath);
        }

        @Override
        public Optional<Element> replaceTarget(Element rewrittenOriginal) {
            if (!replaceIterator.hasNext()) return Optional.empty();
            TargetResolver next = replaceIterator.next();
            int index = replaced++;
            switch (mode) {
                case DROP:
                    return Optional.empty();
                case RENUMBER:
                    return next.replaceTarget(rewrittenOriginal)
                            .map(target -> renumber(target, index));
                default:
                    String message =
                            "More than one " + description() + " in path " + documentPath;
                    return forInvalidTarget((UniqueSelector) selector(), message)
                            .replaceTarget(rewrittenOriginal);
            }
        }

        private static Element renumber(Element target, int index) {
            String id = target.options().id();
            if (id == null) return target;
            String renumbered = id + "-" + (index + 1);
            if (target instanceof Block block) return block.withId(renumbered);
            if (target instanceof Span span) return span.withId(renumbered);
            return target;
        }
    }
}
