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

import java.util.Set;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.RootCursor;

/** Creates the rewrite rules of one concern for each document of a tree. */
public interface RewriteRulesBuilder {

    String name();

    String description();

    /** The phases this builder contributes rules to. Must not be empty. */
    Set<RewritePhase.Kind> phases();

    /** Builders whose rules must be applied before the rules of this one. */
    default Set<Class<? extends RewriteRulesBuilder>> prerequisites() {
        return Set.of();
    }

    /**
     * Called once per phase before any rules get built, with a view of the complete tree. Builders
     * that need tree-wide state collect it here.
     */
    default void prepare(RootCursor root, RewritePhase phase) {}

    /** Builds the rules for one document. Called concurrently for different documents. */
    RewriteRules build(DocumentCursor cursor, RewritePhase phase);
}
