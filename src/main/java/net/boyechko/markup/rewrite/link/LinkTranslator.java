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

import java.util.Set;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.GlobalLink;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;

/** Translates the targets of all resolved links to the paths of the output format. */
public class LinkTranslator implements RewriteRulesBuilder {

    private volatile TargetLookup lookup;

    @Override
    public String name() {
        return "link-translator";
    }

    @Override
    public String description() {
        return "Translates internal link targets to output paths";
    }

    @Override
    public Set<RewritePhase.Kind> phases() {
        return Set.of(RewritePhase.Kind.RENDER);
    }

    @Override
    public void prepare(RootCursor root, RewritePhase phase) {
        lookup = new TargetLookup(root);
    }

    @Override
    public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
        PathTranslator translator =
                new ConfigurablePathTranslator(
                        LinkValidator.versionsOf(cursor),
                        cursor.config().getString(ConfigKeys.SITE_BASE_URL),
                        phase.format(),
                        cursor.path(),
                        lookup::translatorSpec);
        return RewriteRules.forSpans(
                RewriteRule.forType(
                        GlobalLink.class,
                        link -> {
                            Target translated = translator.translate(link.target());
                            if (translated.equals(link.target())) return RewriteAction.retain();
                            return RewriteAction.replace(link.withTarget(translated));
                        }));
    }
}
