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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.BlockSequence;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.Selection;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;

/**
 * Replaces each selection that has a selected choice with the content of that choice. Selections
 * without a selected choice are left for the renderer, which shows all of them.
 */
public class FormatFilter implements RewriteRulesBuilder {

    @Override
    public String name() {
        return "format-filter";
    }

    @Override
    public String description() {
        return "Keeps only the selected choice of each selection";
    }

    @Override
    public Set<RewritePhase.Kind> phases() {
        return Set.of(RewritePhase.Kind.RENDER);
    }

    @Override
    public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
        Config rootConfig = cursor.root().config();
        Config config = rootConfig.hasKey(ConfigKeys.SELECTIONS) ? rootConfig : cursor.config();

        Map<String, String> selected = new LinkedHashMap<>();
        for (SelectionConfig selection : Selections.fromConfig(config).selections()) {
            selection.selectedChoice().ifPresent(c -> selected.put(selection.name(), c.name()));
        }
        if (selected.isEmpty()) return RewriteRules.EMPTY;

        return RewriteRules.forBlocks(
                RewriteRule.forType(
                        Selection.class,
                        selection -> {
                            String choiceName = selected.get(selection.name());
                            if (choiceName == null) return RewriteAction.retain();
                            return selection.choices().stream()
                                    .filter(c -> c.name().equals(choiceName))
                                    .findFirst()
                                    .map(c -> new BlockSequence(c.content()))
                                    .map(RewriteAction::<Block>replace)
                                    .orElse(RewriteAction.retain());
                        }));
    }
}
