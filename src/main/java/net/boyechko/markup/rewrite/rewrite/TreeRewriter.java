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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.markup.rewrite.ast.Document;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the rules of one phase to every document of a tree. The rules of all builders are
 * combined into a single bottom-up pass per document, in registration order.
 */
public class TreeRewriter {
    private static final Logger logger = LoggerFactory.getLogger(TreeRewriter.class);

    private final RuleRegistry registry;
    private final Config defaults;
    private final boolean parallel;

    public TreeRewriter(RuleRegistry registry) {
        this(registry, Config.EMPTY, false);
    }

    public TreeRewriter(RuleRegistry registry, Config defaults, boolean parallel) {
        this.registry = registry;
        this.defaults = defaults;
        this.parallel = parallel;
    }

    /**
     * Rewrites all documents for the given phase. Returns the same root instance when no rule
     * changed anything.
     */
    public DocumentTreeRoot rewrite(DocumentTreeRoot root, RewritePhase phase) {
        List<RewriteRulesBuilder> registered = registry.buildersFor(phase.kind());
        if (registered.isEmpty()) {
            logger.debug("No rule builders for phase {}", phase);
            return root;
        }

        RootCursor cursor = new RootCursor(root, defaults, phase.format());
        List<RewriteRulesBuilder> builders = prepared(registered, cursor, phase);

        List<DocumentCursor> documents = cursor.allDocuments();
        Stream<DocumentCursor> stream =
                parallel ? documents.parallelStream() : documents.stream();
        Map<Path, Document> rewritten =
                stream.map(doc -> rewriteDocument(doc, builders, phase))
                        .collect(
                                Collectors.toMap(
                                        Document::path,
                                        d -> d,
                                        (a, b) -> a,
                                        LinkedHashMap::new));

        DocumentTreeRoot result = root.withDocuments(rewritten);
        logger.debug(
                "Phase {} applied {} builders to {} documents{}",
                phase,
                builders.size(),
                documents.size(),
                result == root ? " without changes" : "");
        return result;
    }

    /** Builders whose preparation succeeded; a failing builder takes no part in the phase. */
    private static List<RewriteRulesBuilder> prepared(
            List<RewriteRulesBuilder> builders, RootCursor cursor, RewritePhase phase) {
        List<RewriteRulesBuilder> ready = new ArrayList<>(builders.size());
        for (RewriteRulesBuilder builder : builders) {
            try {
                builder.prepare(cursor, phase);
                ready.add(builder);
            } catch (RuntimeException e) {
                logger.error(
                        "Error preparing {} for phase {}: {}",
                        builder.name(),
                        phase,
                        e.getMessage());
            }
        }
        return ready;
    }

    private Document rewriteDocument(
            DocumentCursor cursor, List<RewriteRulesBuilder> builders, RewritePhase phase) {
        RewriteRules rules = RewriteRules.EMPTY;
        for (RewriteRulesBuilder builder : builders) {
            try {
                RewriteRules built = builder.build(cursor, phase);
                rules = rules.andThen(built.guarded(builder.name(), cursor.path()));
            } catch (RuntimeException e) {
                logger.error(
                        "Error building rules of {} for {}: {}",
                        builder.name(),
                        cursor.path(),
                        e.getMessage());
            }
        }
        if (rules.isEmpty()) return cursor.target();
        return rules.rewriteDocument(cursor.target());
    }
}
