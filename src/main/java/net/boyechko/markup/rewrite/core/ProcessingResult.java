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

import java.util.List;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;

/**
 * Summary of the processing of a document tree.
 *
 * @param root the rewritten tree
 * @param phases the phases that were applied, in order
 * @param issues problems found in the rewritten tree
 * @param classifier the selected choices this tree variant was produced for; empty when the tree
 *     has no separated selections
 */
public record ProcessingResult(
        DocumentTreeRoot root, List<RewritePhase> phases, IssueList issues, String classifier) {

    public ProcessingResult {
        phases = List.copyOf(phases);
    }

    public ProcessingResult(DocumentTreeRoot root, List<RewritePhase> phases, IssueList issues) {
        this(root, phases, issues, "");
    }

    public ProcessingResult withClassifier(String newClassifier) {
        return new ProcessingResult(root, phases, issues, newClassifier);
    }

    public int totalIssues() {
        return issues.size();
    }

    public boolean hasErrors() {
        return issues.hasErrors();
    }

    public boolean wasRendered() {
        return phases.stream().anyMatch(p -> p.kind() == RewritePhase.Kind.RENDER);
    }
}
