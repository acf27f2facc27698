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
package net.boyechko.markup.rewrite.nav;

import java.util.Set;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.Reference;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;

/** Turns every reference still present before rendering into an invalid span. */
public class UnresolvedNodeDetector implements RewriteRulesBuilder {

    @Override
    public String name() {
        return "unresolved-node-detector";
    }

    @Override
    public String description() {
        return "Marks references left unresolved before rendering as invalid";
    }

    @Override
    public Set<RewritePhase.Kind> phases() {
        return Set.of(RewritePhase.Kind.RENDER);
    }

    @Override
    public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
        return RewriteRules.forSpans(
                RewriteRule.forType(
                        Reference.class,
                        ref ->
                                RewriteAction.<Span>replace(
                                        InvalidSpan.of(
                                                "unresolved reference: " + ref.source(),
                                                ref.source()))));
    }
}
