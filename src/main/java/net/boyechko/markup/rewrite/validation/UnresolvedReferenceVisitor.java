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
package net.boyechko.markup.rewrite.validation;

import net.boyechko.markup.rewrite.ast.Invalid;
import net.boyechko.markup.rewrite.ast.Reference;
import net.boyechko.markup.rewrite.issues.Issue;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.issues.IssueType;

/**
 * Reports references that are still present in the tree. Only trees that skipped the render
 * phase can contain them.
 */
public class UnresolvedReferenceVisitor implements ElementVisitor {

    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Unresolved Reference Visitor";
    }

    @Override
    public String description() {
        return "All references should be resolved";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        if (ctx.element() instanceof Invalid) {
            return false;
        }
        if (ctx.element() instanceof Reference ref) {
            issues.add(
                    new Issue(
                            IssueType.UNRESOLVED_REFERENCE,
                            ctx.location(),
                            "unresolved reference: " + ref.source()));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
