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

import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.issues.IssueList;

/** Visitor interface for read-only traversal of the elements of a document tree. */
public interface ElementVisitor {

    String name();

    String description();

    /** Returns {@code false} to skip the children of the current element. */
    default boolean enterElement(VisitorContext ctx) {
        return true;
    }

    default void leaveElement(VisitorContext ctx) {}

    default void beforeTraversal(DocumentTreeRoot root) {}

    default void afterTraversal() {}

    IssueList getIssues();
}
