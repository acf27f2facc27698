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
package net.boyechko.markup.rewrite.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.Document;
import net.boyechko.markup.rewrite.ast.ElementRewriter;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RootElement;
import net.boyechko.markup.rewrite.ast.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Block and span rules applied together in a single bottom-up pass: the children of an element
 * are rewritten before the element itself is offered to the rules. Lists and elements that no
 * rule touched are returned as the same instances, so callers can detect "no change" by identity.
 */
public final class RewriteRules implements ElementRewriter {
    private static final Logger logger = LoggerFactory.getLogger(RewriteRules.class);

    public static final RewriteRules EMPTY = new RewriteRules(List.of(), List.of());

    private final List<RewriteRule<Block>> blockRules;
    private final List<RewriteRule<Span>> spanRules;
    private final RewriteRule<Block> blockRule;
    private final RewriteRule<Span> spanRule;

    private RewriteRules(List<RewriteRule<Block>> blockRules, List<RewriteRule<Span>> spanRules) {
        this.blockRules = List.copyOf(blockRules);
        this.spanRules = List.copyOf(spanRules);
        this.blockRule = RewriteRule.chain(this.blockRules);
        this.spanRule = RewriteRule.chain(this.spanRules);
    }

    public static RewriteRules of(
            List<RewriteRule<Block>> blockRules, List<RewriteRule<Span>> spanRules) {
        return new RewriteRules(blockRules, spanRules);
    }

    public static RewriteRules forBlocks(RewriteRule<Block> rule) {
        return new RewriteRules(List.of(rule), List.of());
    }

    public static RewriteRules forSpans(RewriteRule<Span> rule) {
        return new RewriteRules(List.of(), List.of(rule));
    }

    /** Rules of {@code other} run after the rules of this instance, on their output. */
    public RewriteRules andThen(RewriteRules other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<RewriteRule<Block>> blocks = new ArrayList<>(blockRules);
        blocks.addAll(other.blockRules);
        List<RewriteRule<Span>> spans = new ArrayList<>(spanRules);
        spans.addAll(other.spanRules);
        return new RewriteRules(blocks, spans);
    }

    public boolean isEmpty() {
        return blockRules.isEmpty() && spanRules.isEmpty();
    }

    /**
     * Wraps every rule so that an exception thrown while rewriting one element replaces only that
     * element with an invalid node, leaving the rest of the document untouched.
     */
    public RewriteRules guarded(String ruleName, Path documentPath) {
        List<RewriteRule<Block>> blocks = new ArrayList<>(blockRules.size());
        for (RewriteRule<Block> rule : blockRules) {
            blocks.add(
                    block -> {
                        try {
                            return rule.apply(block);
                        } catch (RuntimeException e) {
                            logger.error(
                                    "Error in rule {} at {}: {}",
                                    ruleName,
                                    documentPath,
                                    e.getMessage());
                            return RewriteAction.replace(
                                    new InvalidBlock(failure(ruleName, e), block.withoutId()));
                        }
                    });
        }
        List<RewriteRule<Span>> spans = new ArrayList<>(spanRules.size());
        for (RewriteRule<Span> rule : spanRules) {
            spans.add(
                    span -> {
                        try {
                            return rule.apply(span);
                        } catch (RuntimeException e) {
                            logger.error(
                                    "Error in rule {} at {}: {}",
                                    ruleName,
                                    documentPath,
                                    e.getMessage());
                            return RewriteAction.replace(
                                    new InvalidSpan(failure(ruleName, e), span.withoutId()));
                        }
                    });
        }
        return new RewriteRules(blocks, spans);
    }

    private static String failure(String ruleName, RuntimeException e) {
        return "rule " + ruleName + " failed: " + e.getMessage();
    }

    @Override
    public List<Block> rewriteBlocks(List<Block> blocks) {
        return rewriteAll(blocks, this::rewriteBlock);
    }

    @Override
    public List<Span> rewriteSpans(List<Span> spans) {
        return rewriteAll(spans, this::rewriteSpan);
    }

    /** Rewrites a single block; empty if a rule removed it. */
    public Optional<Block> rewriteBlock(Block block) {
        Block withChildren = block.rewriteChildren(this);
        return resolve(withChildren, blockRule.apply(withChildren));
    }

    /** Rewrites a single span; empty if a rule removed it. */
    public Optional<Span> rewriteSpan(Span span) {
        Span withChildren = span.rewriteChildren(this);
        return resolve(withChildren, spanRule.apply(withChildren));
    }

    /**
     * Rewrites a document root. A root that a rule removes becomes empty; a root replaced by some
     * other block becomes a root containing that block.
     */
    public RootElement rewriteRoot(RootElement root) {
        Optional<Block> result = rewriteBlock(root);
        if (result.isEmpty()) return new RootElement(List.of(), root.options());
        Block block = result.get();
        if (block instanceof RootElement rewritten) return rewritten;
        return new RootElement(List.of(block), root.options());
    }

    public Document rewriteDocument(Document document) {
        return document.withContent(rewriteRoot(document.content()));
    }

    private static <T> Optional<T> resolve(T current, RewriteAction<T> action) {
        if (action instanceof RewriteAction.Remove) return Optional.empty();
        if (action instanceof RewriteAction.Replace<T> replace) {
            return Optional.of(replace.element());
        }
        return Optional.of(current);
    }

    private static <T> List<T> rewriteAll(
            List<T> elements, java.util.function.Function<T, Optional<T>> rewrite) {
        List<T> result = null;
        for (int i = 0; i < elements.size(); i++) {
            T original = elements.get(i);
            Optional<T> rewritten = rewrite.apply(original);
            boolean unchanged = rewritten.isPresent() && rewritten.get() == original;
            if (!unchanged && result == null) {
                result = new ArrayList<>(elements.subList(0, i));
            }
            if (result != null) {
                rewritten.ifPresent(result::add);
            }
        }
        return result == null ? elements : List.copyOf(result);
    }
}
