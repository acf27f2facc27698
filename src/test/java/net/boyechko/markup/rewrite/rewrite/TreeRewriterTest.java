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

import static net.boyechko.markup.rewrite.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.Paragraph;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.Text;
import net.boyechko.markup.rewrite.config.Config;
import org.junit.jupiter.api.Test;

class TreeRewriterTest {

    @Test
    void unchangedTreeIsReturnedAsIs() {
        DocumentTreeRoot root = root(doc("/a.md", Paragraph.of("a")), doc("/b.md"));

        DocumentTreeRoot result = rewrite(root, RewritePhase.BUILD, DocumentNameBuilder::new);

        assertSame(root, result);
    }

    @Test
    void phaseWithoutBuildersLeavesTreeUntouched() {
        DocumentTreeRoot root = root(doc("/a.md", Paragraph.of("a")));
        assertSame(root, rewrite(root, RewritePhase.RESOLVE, DocumentNameBuilder::new));
    }

    @Test
    void rulesSeeTheirOwnDocument() {
        DocumentTreeRoot root =
                root(
                        doc("/a.md", Paragraph.of("name")),
                        tree("/sub", doc("/sub/b.md", Paragraph.of("name"))));

        DocumentTreeRoot result = rewrite(root, RewritePhase.BUILD, DocumentNameBuilder::new);

        assertEquals(List.of(Paragraph.of("/a.md")), content(result, "/a.md"));
        assertEquals(List.of(Paragraph.of("/sub/b.md")), content(result, "/sub/b.md"));
    }

    @Test
    void parallelRewriteGivesSameResult() {
        DocumentTreeRoot root =
                root(
                        doc("/a.md", Paragraph.of("name")),
                        doc("/b.md", Paragraph.of("name")),
                        doc("/c.md", Paragraph.of("name")));
        RuleRegistry registry = new RuleRegistry(List.of(DocumentNameBuilder::new));

        DocumentTreeRoot sequential =
                new TreeRewriter(registry, Config.EMPTY, false).rewrite(root, RewritePhase.BUILD);
        DocumentTreeRoot parallel =
                new TreeRewriter(registry, Config.EMPTY, true).rewrite(root, RewritePhase.BUILD);

        assertEquals(sequential, parallel);
    }

    @Test
    void failingBuilderIsSkippedForThatDocument() {
        DocumentTreeRoot root =
                root(doc("/a.md", Paragraph.of("name")), doc("/broken.md", Paragraph.of("name")));

        DocumentTreeRoot result =
                rewrite(root, RewritePhase.BUILD, DocumentNameBuilder::new, FailingBuilder::new);

        assertEquals(List.of(Paragraph.of("/a.md")), content(result, "/a.md"));
        assertEquals(List.of(Paragraph.of("/broken.md")), content(result, "/broken.md"));
    }

    @Test
    void builderFailingToPrepareTakesNoPartInThePhase() {
        DocumentTreeRoot root =
                root(doc("/a.md", Paragraph.of("name")), doc("/b.md", Paragraph.of("name")));

        DocumentTreeRoot result =
                rewrite(
                        root,
                        RewritePhase.BUILD,
                        FailingPrepareBuilder::new,
                        DocumentNameBuilder::new);

        assertEquals(List.of(Paragraph.of("/a.md")), content(result, "/a.md"));
        assertEquals(List.of(Paragraph.of("/b.md")), content(result, "/b.md"));
    }

    @Test
    void prepareSeesWholeTreeBeforeBuild() {
        DocumentTreeRoot root =
                root(doc("/a.md", Paragraph.of("count")), doc("/b.md", Paragraph.of("count")));

        DocumentTreeRoot result = rewrite(root, RewritePhase.BUILD, DocumentCountBuilder::new);

        assertEquals(List.of(Paragraph.of("2")), content(result, "/a.md"));
    }

    /** Replaces the text "name" with the path of the document. */
    static class DocumentNameBuilder implements RewriteRulesBuilder {
        @Override
        public String name() {
            return "document-name";
        }

        @Override
        public String description() {
            return "";
        }

        @Override
        public Set<RewritePhase.Kind> phases() {
            return Set.of(RewritePhase.Kind.BUILD);
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            return RewriteRules.forSpans(replaceText("name", cursor.path().toString()));
        }
    }

    static class FailingBuilder extends DocumentNameBuilder {
        @Override
        public String name() {
            return "failing";
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            if (cursor.path().name().equals("broken.md")) {
                throw new IllegalStateException("cannot build");
            }
            return RewriteRules.EMPTY;
        }
    }

    static class FailingPrepareBuilder extends DocumentNameBuilder {
        @Override
        public String name() {
            return "failing-prepare";
        }

        @Override
        public void prepare(RootCursor root, RewritePhase phase) {
            throw new IllegalStateException("cannot prepare");
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            return RewriteRules.forSpans(replaceText("name", "prepared"));
        }
    }

    static class DocumentCountBuilder extends DocumentNameBuilder {
        private int documents = -1;

        @Override
        public void prepare(RootCursor root, RewritePhase phase) {
            documents = root.allDocuments().size();
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            return RewriteRules.forSpans(replaceText("count", Integer.toString(documents)));
        }
    }

    private static RewriteRule<Span> replaceText(String from, String to) {
        return RewriteRule.forType(
                Text.class,
                text ->
                        text.text().equals(from)
                                ? RewriteAction.replace(new Text(to))
                                : RewriteAction.retain());
    }
}
