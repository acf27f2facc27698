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

import static net.boyechko.markup.rewrite.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.BlockSequence;
import net.boyechko.markup.rewrite.ast.Choice;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.Paragraph;
import net.boyechko.markup.rewrite.ast.Selection;
import net.boyechko.markup.rewrite.ast.Text;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import org.junit.jupiter.api.Test;

class FormatFilterTest {

    private static final Selection LANG =
            new Selection(
                    "lang",
                    List.of(
                            new Choice("java", "Java", List.of(Paragraph.of("java code"))),
                            new Choice("scala", "Scala", List.of(Paragraph.of("scala code")))));

    private static Config selectedLanguage(String selected) {
        return Config.fromYaml(
                "laika:\n"
                        + "  selections:\n"
                        + "    - name: lang\n"
                        + "      choices:\n"
                        + "        - {name: java, selected: "
                        + "java".equals(selected)
                        + "}\n"
                        + "        - {name: scala, selected: "
                        + "scala".equals(selected)
                        + "}\n");
    }

    @Test
    void selectedChoiceReplacesSelection() {
        DocumentTreeRoot result =
                rewrite(
                        root(selectedLanguage("scala"), doc("/doc.md", LANG)),
                        RewritePhase.render("epub"),
                        FormatFilter::new);

        List<Block> blocks = content(result);
        assertEquals(new BlockSequence(List.of(Paragraph.of("scala code"))), blocks.get(0));
    }

    @Test
    void selectionWithoutSelectedChoiceIsKept() {
        DocumentTreeRoot tree = root(selectedLanguage("none"), doc("/doc.md", LANG));
        assertSame(tree, rewrite(tree, RewritePhase.render("html"), FormatFilter::new));
    }

    @Test
    void unknownSelectionIsKept() {
        Selection other =
                new Selection(
                        "other", List.of(new Choice("a", "A", List.of(Paragraph.of("a")))));
        DocumentTreeRoot tree = root(selectedLanguage("java"), doc("/doc.md", other));
        assertSame(tree, rewrite(tree, RewritePhase.render("html"), FormatFilter::new));
    }

    @Test
    void combinationConfigDrivesFilter() {
        DocumentTreeRoot tree = root(doc("/doc.md", LANG));
        Config config = selectedLanguage("java");
        ChoiceCombination combination = Selections.createChoiceCombinations(config).get(0);

        DocumentTreeRoot result =
                rewrite(combination.applyTo(tree), RewritePhase.render("fo"), FormatFilter::new);

        assertEquals(
                new BlockSequence(List.of(Paragraph.of("java code"))), content(result).get(0));
    }

    @Test
    void unresolvedReferencesAreMarkedForRendering() {
        DocumentTreeRoot tree =
                root(doc("/doc.md", Paragraph.of(LinkIdReference.of("x", "id", "[x][id]"))));

        DocumentTreeRoot result =
                rewrite(tree, RewritePhase.render("html"), UnresolvedNodeDetector::new);

        Paragraph paragraph = (Paragraph) content(result).get(0);
        InvalidSpan invalid = (InvalidSpan) paragraph.content().get(0);
        assertEquals("unresolved reference: [x][id]", invalid.message());
        assertEquals(new Text("[x][id]"), invalid.fallback());
    }
}
