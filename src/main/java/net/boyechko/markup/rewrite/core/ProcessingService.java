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
package net.boyechko.markup.rewrite.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.issues.Issue;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.issues.IssueType;
import net.boyechko.markup.rewrite.nav.ChoiceCombination;
import net.boyechko.markup.rewrite.nav.Selections;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;
import net.boyechko.markup.rewrite.rewrite.RuleRegistry;
import net.boyechko.markup.rewrite.rewrite.TreeRewriter;
import net.boyechko.markup.rewrite.validation.ElementVisitor;
import net.boyechko.markup.rewrite.validation.ElementWalker;
import net.boyechko.markup.rewrite.validation.TreeOutputVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the rewriting of a document tree: the build, resolve and (when an output format
 * is set) render phases, followed by a validation walk over the result.
 */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final RuleRegistry registry;
    private final TreeRewriter rewriter;
    private final ProcessingListener listener;
    private final List<Supplier<ElementVisitor>> visitorSuppliers;
    private final String outputFormat;

    public static class ProcessingServiceBuilder {
        private ProcessingListener listener;
        private Config defaults;
        private boolean parallel;
        private String outputFormat;
        private boolean printTree;
        private final List<Supplier<RewriteRulesBuilder>> extraBuilders = new ArrayList<>();
        private final Set<String> skipBuilders = new HashSet<>();
        private final Set<String> includeOnlyBuilders = new HashSet<>();

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        /** Configuration that every tree falls back to; the bundled defaults if not set. */
        public ProcessingServiceBuilder withDefaults(Config defaults) {
            this.defaults = defaults;
            return this;
        }

        public ProcessingServiceBuilder withParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /** Enables the render phase for the given format. */
        public ProcessingServiceBuilder withOutputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public ProcessingServiceBuilder withPrintTree(boolean printTree) {
            this.printTree = printTree;
            return this;
        }

        /** Registers an additional rule builder, running after the built-in ones. */
        public ProcessingServiceBuilder addBuilder(Supplier<RewriteRulesBuilder> builder) {
            extraBuilders.add(builder);
            return this;
        }

        public ProcessingServiceBuilder skipBuilders(Set<String> builderNames) {
            skipBuilders.addAll(builderNames);
            return this;
        }

        public ProcessingServiceBuilder includeOnlyBuilders(Set<String> builderNames) {
            includeOnlyBuilders.addAll(builderNames);
            return this;
        }

        public ProcessingService build() {
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before"
                                + " building ProcessingService");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.listener = builder.listener;
        this.outputFormat = builder.outputFormat;

        List<Supplier<RewriteRulesBuilder>> suppliers = ProcessingDefaults.builderSuppliers();
        suppliers.addAll(builder.extraBuilders);
        this.registry =
                new RuleRegistry(suppliers)
                        .filter(builder.skipBuilders, builder.includeOnlyBuilders);

        Config defaults = builder.defaults != null ? builder.defaults : Config.loadDefault();
        this.rewriter = new TreeRewriter(registry, defaults, builder.parallel);

        this.visitorSuppliers = new ArrayList<>(ProcessingDefaults.visitorSuppliers());
        if (builder.printTree) {
            visitorSuppliers.add(() -> new TreeOutputVisitor(listener::onVerboseOutput));
        }
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public List<RewritePhase> phases() {
        List<RewritePhase> phases = new ArrayList<>();
        phases.add(RewritePhase.BUILD);
        phases.add(RewritePhase.RESOLVE);
        if (outputFormat != null) {
            phases.add(RewritePhase.render(outputFormat));
        }
        return phases;
    }

    /** Runs all phases over the tree and validates the result. */
    public ProcessingResult process(DocumentTreeRoot root) {
        List<RewritePhase> phases = phases();
        DocumentTreeRoot current = root;
        for (RewritePhase phase : phases) {
            listener.onPhaseStart(phase.toString());
            DocumentTreeRoot rewritten = rewriter.rewrite(current, phase);
            listener.onSuccess(
                    rewritten == current
                            ? "No changes in phase " + phase
                            : "Rewrote " + current.allDocuments().size() + " documents");
            current = rewritten;
        }

        listener.onPhaseStart("Validation");
        IssueList issues = validate(current);
        if (issues.isEmpty()) {
            listener.onSuccess("No issues found");
        } else {
            reportIssuesGrouped(issues);
        }
        listener.onSummary(issues);
        return new ProcessingResult(current, phases, issues);
    }

    /**
     * Processes one variant of the tree per combination of separated selections. A tree without
     * such selections yields a single result.
     */
    public List<ProcessingResult> processCombinations(DocumentTreeRoot root) {
        List<ChoiceCombination> combinations;
        try {
            combinations = Selections.createChoiceCombinations(root.config());
        } catch (ConfigException e) {
            logger.error("Invalid selections in {}: {}", root.tree().path(), e.getMessage());
            listener.onError("Invalid selections: " + e.getMessage());
            IssueList issues =
                    new IssueList(new Issue(IssueType.CONFIGURATION_ERROR, e.getMessage()));
            listener.onSummary(issues);
            return List.of(new ProcessingResult(root, List.of(), issues));
        }

        List<ProcessingResult> results = new ArrayList<>();
        for (ChoiceCombination combination : combinations) {
            if (!combination.classifiers().isEmpty()) {
                listener.onInfo("Processing variant " + combination.classifier());
            }
            results.add(
                    process(combination.applyTo(root)).withClassifier(combination.classifier()));
        }
        return results;
    }

    private IssueList validate(DocumentTreeRoot root) {
        ElementWalker walker = new ElementWalker();
        for (Supplier<ElementVisitor> supplier : visitorSuppliers) {
            walker.addVisitor(supplier.get());
        }
        return walker.walk(root);
    }

    private void reportIssuesGrouped(IssueList issues) {
        for (Map.Entry<IssueType, List<Issue>> entry : issues.groupedByType().entrySet()) {
            List<Issue> groupIssues = entry.getValue();
            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }
}
