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

import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.Citation;
import net.boyechko.markup.rewrite.ast.CitationReference;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.FootnoteDefinition;
import net.boyechko.markup.rewrite.ast.FootnoteLabel;
import net.boyechko.markup.rewrite.ast.FootnoteReference;
import net.boyechko.markup.rewrite.ast.GlobalLink;
import net.boyechko.markup.rewrite.ast.Header;
import net.boyechko.markup.rewrite.ast.Hidden;
import net.boyechko.markup.rewrite.ast.ImageIdReference;
import net.boyechko.markup.rewrite.ast.InternalTarget;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.PathReference;
import net.boyechko.markup.rewrite.ast.Reference;
import net.boyechko.markup.rewrite.ast.RelativePath;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves references to footnotes, citations, link definitions, headers and documents, and gives
 * all link targets their final ids.
 *
 * <p>All targets of the tree are collected in {@link #prepare} before any reference is resolved,
 * since references may appear before their targets. Problems end up in the tree as invalid
 * elements: unresolved, ambiguous, circular and surplus references, as well as links to documents
 * that do not support the required output formats.
 */
public class LinkResolver implements RewriteRulesBuilder {
    private static final Logger logger = LoggerFactory.getLogger(LinkResolver.class);

    private volatile TreeTargets targets;

    @Override
    public String name() {
        return "link-resolver";
    }

    @Override
    public String description() {
        return "Resolves references and assigns the final ids of link targets";
    }

    @Override
    public Set<RewritePhase.Kind> phases() {
        return Set.of(RewritePhase.Kind.RESOLVE);
    }

    @Override
    public void prepare(RootCursor root, RewritePhase phase) {
        targets = new TreeTargets(root);
    }

    @Override
    public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
        if (targets == null) {
            throw new IllegalStateException("Link targets have not been collected for " + phase);
        }
        return new DocumentRules(cursor, targets).rules();
    }

    private static final class DocumentRules {
        private final DocumentCursor cursor;
        private final TreeTargets targets;
        private final LinkValidator validator;
        private final List<LookupScope> lookupOrder;

        DocumentRules(DocumentCursor cursor, TreeTargets targets) {
            this.cursor = cursor;
            this.targets = targets;
            this.validator =
                    new LinkValidator(
                            cursor,
                            path ->
                                    targets.select(Path.ROOT, new PathSelector(path))
                                            .map(TargetResolver::targetFormats),
                            validationMode(cursor));
            this.lookupOrder = lookupOrder(cursor);
        }

        private static LinkValidationMode validationMode(DocumentCursor cursor) {
            try {
                return LinkValidationMode.fromConfig(cursor.config());
            } catch (ConfigException e) {
                logger.warn("{} in {}, validating all links", e.getMessage(), cursor.path());
                return LinkValidationMode.GLOBAL;
            }
        }

        private static List<LookupScope> lookupOrder(DocumentCursor cursor) {
            try {
                return LookupScope.fromConfig(cursor.config());
            } catch (ConfigException e) {
                logger.warn("{} in {}, using the default order", e.getMessage(), cursor.path());
                return LookupScope.DEFAULT_ORDER;
            }
        }

        RewriteRules rules() {
            RewriteRule<Block> blockRule = this::rewriteBlock;
            RewriteRule<Span> spanRule = this::rewriteSpan;
            return RewriteRules.of(List.of(blockRule), List.of(spanRule));
        }

        private RewriteAction<Block> rewriteBlock(Block block) {
            if (block instanceof FootnoteDefinition footnote) {
                return replaceBlock(footnote, footnoteSelector(footnote.label()));
            }
            if (block instanceof Citation citation) {
                return replaceBlock(citation, new TargetIdSelector(Slugs.slug(citation.label())));
            }
            if (block instanceof Header header) {
                return replaceBlock(header, new TargetIdSelector(DocumentTargets.headerId(header)));
            }
            if (block instanceof Hidden) {
                return RewriteAction.remove();
            }
            if (block.hasId()) {
                String id = Slugs.slugId(block.options().id());
                return replaceBlock(block, new TargetIdSelector(id));
            }
            return RewriteAction.retain();
        }

        private RewriteAction<Span> rewriteSpan(Span span) {
            if (span instanceof CitationReference ref) {
                return resolveLocal(
                        ref,
                        new TargetIdSelector(Slugs.slug(ref.label())),
                        "unresolved citation reference: " + ref.label());
            }
            if (span instanceof FootnoteReference ref) {
                FootnoteLabel label = ref.label();
                if (label instanceof FootnoteLabel.Autonumber) {
                    return resolveLocal(
                            ref,
                            PositionalSelector.AUTONUMBER,
                            PositionalSelector.AUTONUMBER.surplusMessage());
                }
                if (label instanceof FootnoteLabel.Autosymbol) {
                    return resolveLocal(
                            ref,
                            PositionalSelector.AUTOSYMBOL,
                            PositionalSelector.AUTOSYMBOL.surplusMessage());
                }
                return resolveLocal(
                        ref,
                        footnoteSelector(label),
                        "unresolved footnote reference: " + label.display());
            }
            if (span instanceof PathReference ref) {
                return resolvePath(ref);
            }
            if (span instanceof LinkIdReference ref) {
                if (ref.ref().isEmpty()) {
                    return resolveLocal(
                            ref,
                            PositionalSelector.ANONYMOUS,
                            PositionalSelector.ANONYMOUS.surplusMessage());
                }
                TargetIdSelector slugged = new TargetIdSelector(Slugs.slug(ref.ref()));
                Optional<TargetResolver> target =
                        selectRecursive(new LinkDefinitionSelector(ref.ref()))
                                .or(() -> selectRecursive(slugged));
                return resolveWith(ref, target, "unresolved link id reference: " + ref.ref());
            }
            if (span instanceof ImageIdReference ref) {
                return resolveWith(
                        ref,
                        selectRecursive(new LinkDefinitionSelector(ref.id())),
                        "unresolved image reference: " + ref.id());
            }
            if (span.hasId()) {
                return replaceSpan(span, new TargetIdSelector(Slugs.slugId(span.options().id())));
            }
            return RewriteAction.retain();
        }

        private static Selector footnoteSelector(FootnoteLabel label) {
            if (label instanceof FootnoteLabel.NumericLabel numeric) {
                return new TargetIdSelector(Integer.toString(numeric.number()));
            }
            if (label instanceof FootnoteLabel.AutonumberLabel named) {
                return new TargetIdSelector(Slugs.slug(named.label()));
            }
            if (label instanceof FootnoteLabel.Autonumber) return PositionalSelector.AUTONUMBER;
            return PositionalSelector.AUTOSYMBOL;
        }

        private Optional<Element> replace(Element element, Selector selector) {
            return targets.select(cursor.path(), selector)
                    .flatMap(target -> target.replaceTarget(element));
        }

        private static String describeUnknownTarget(Element target) {
            String id = target.hasId() ? "id " + target.options().id() : "<no id>";
            return "link target of type "
                    + target.getClass().getSimpleName()
                    + " with "
                    + id
                    + " can only be inserted in the build phase";
        }

        private RewriteAction<Block> replaceBlock(Block block, Selector selector) {
            Optional<Element> replaced = replace(block, selector);
            if (replaced.isPresent() && replaced.get() instanceof Block result) {
                return RewriteAction.replace(result);
            }
            return RewriteAction.replace(
                    new InvalidBlock(describeUnknownTarget(block), block.withoutId()));
        }

        private RewriteAction<Span> replaceSpan(Span span, Selector selector) {
            Optional<Element> replaced = replace(span, selector);
            if (replaced.isPresent() && replaced.get() instanceof Span result) {
                return RewriteAction.replace(result);
            }
            return RewriteAction.replace(
                    new InvalidSpan(describeUnknownTarget(span), span.withoutId()));
        }

        private Optional<TargetResolver> selectRecursive(UniqueSelector selector) {
            return targets.selectRecursive(cursor, selector, lookupOrder);
        }

        private RewriteAction<Span> resolveLocal(
                Reference ref, Selector selector, String message) {
            return resolveWith(ref, targets.select(cursor.path(), selector), message);
        }

        private RewriteAction<Span> resolvePath(PathReference ref) {
            String message = "unresolved internal reference: " + ref.path();
            if (ref.path() instanceof RelativePath rel
                    && rel.parentLevels() >= cursor.path().depth()) {
                return resolveWith(ref, Optional.empty(), message);
            }
            Path absolute = new InternalTarget(ref.path()).relativeTo(cursor.path()).absolutePath();
            return resolveWith(ref, targets.select(Path.ROOT, new PathSelector(absolute)), message);
        }

        private RewriteAction<Span> resolveWith(
                Reference ref, Optional<TargetResolver> target, String message) {
            Optional<Span> resolved =
                    target.flatMap(t -> t.resolveReference(new LinkSource(ref, cursor.path())));
            Span result;
            if (resolved.isPresent()) {
                Span span = resolved.get();
                result =
                        span instanceof GlobalLink link
                                ? validator.validateAndRecover(link, ref.source())
                                : span;
            } else if (ref instanceof PathReference pathRef) {
                Target unresolved =
                        ReferenceResolver.resolveTarget(
                                new InternalTarget(pathRef.path()), cursor.path());
                result = validator.validateAndRecover(pathRef.resolve(unresolved), ref.source());
            } else {
                result = InvalidSpan.of(message, ref.source());
            }
            return RewriteAction.replace(result);
        }
    }
}
