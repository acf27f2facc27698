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

import static net.boyechko.markup.rewrite.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.Header;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.LinkPathReference;
import net.boyechko.markup.rewrite.ast.Options;
import net.boyechko.markup.rewrite.ast.Paragraph;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;
import net.boyechko.markup.rewrite.ast.Section;
import net.boyechko.markup.rewrite.ast.SpanLink;
import net.boyechko.markup.rewrite.ast.Text;
import net.boyechko.markup.rewrite.ast.Title;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.issues.Issue;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.issues.IssueType;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;
import org.junit.jupiter.api.Test;

class ProcessingServiceTest {

    /** Collects every event for later inspection. */
    static class RecordingListener implements ProcessingListener {
        final List<String> phases = new ArrayList<>();
        final List<String> successes = new ArrayList<>();
        final List<Issue> warnings = new ArrayList<>();
        final List<String> groups = new ArrayList<>();
        final List<String> infos = new ArrayList<>();
        final List<String> verbose = new ArrayList<>();
        IssueList summary;

        @Override
        public void onPhaseStart(String phaseName) {
            phases.add(phaseName);
        }

        @Override
        public void onSuccess(String message) {
            successes.add(message);
        }

        @Override
        public void onWarning(Issue issue) {
            warnings.add(issue);
        }

        @Override
        public void onIssueGroup(String groupLabel, List<Issue> issues) {
            groups.add(groupLabel);
            ProcessingListener.super.onIssueGroup(groupLabel, issues);
        }

        @Override
        public void onInfo(String message) {
            infos.add(message);
        }

        @Override
        public void onVerboseOutput(String message) {
            verbose.add(message);
        }

        @Override
        public void onSummary(IssueList allIssues) {
            summary = allIssues;
        }
    }

    /** Replaces paragraphs reading "draft" in the build phase. */
    static class DraftReplacer implements RewriteRulesBuilder {
        @Override
        public String name() {
            return "draft-replacer";
        }

        @Override
        public String description() {
            return "Replaces draft paragraphs";
        }

        @Override
        public Set<RewritePhase.Kind> phases() {
            return Set.of(RewritePhase.Kind.BUILD);
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            return RewriteRules.forBlocks(
                    RewriteRule.forType(
                            Paragraph.class,
                            p ->
                                    "draft".equals(p.extractText())
                                            ? RewriteAction.<Block>replace(Paragraph.of("final"))
                                            : RewriteAction.<Block>retain()));
        }
    }

    private static ProcessingService.ProcessingServiceBuilder builder(ProcessingListener listener) {
        return new ProcessingService.ProcessingServiceBuilder()
                .withListener(listener)
                .withDefaults(Config.EMPTY);
    }

    @Test
    void listenerIsRequired() {
        var ex =
                assertThrows(
                        IllegalStateException.class,
                        () -> new ProcessingService.ProcessingServiceBuilder().build());
        assertTrue(ex.getMessage().contains("ProcessingListener"));
    }

    @Test
    void cleanTreeHasNoIssues() {
        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                builder(listener)
                        .build()
                        .process(
                                root(
                                        doc(
                                                "/doc.md",
                                                Header.of(1, "Title"),
                                                Header.of(2, "Part"),
                                                Paragraph.of(
                                                        LinkIdReference.of(
                                                                "p", "part", "[p][part]")))));

        assertEquals(List.of("BUILD", "RESOLVE", "Validation"), listener.phases);
        assertTrue(listener.successes.contains("No issues found"));
        assertEquals(0, result.totalIssues());
        assertFalse(result.wasRendered());
        assertSame(result.issues(), listener.summary);

        List<Block> blocks = content(result.root());
        assertInstanceOf(Title.class, blocks.get(0));
        assertInstanceOf(Section.class, blocks.get(1));
    }

    @Test
    void unresolvedReferencesAreReported() {
        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                builder(listener)
                        .build()
                        .process(
                                root(
                                        doc(
                                                "/doc.md",
                                                Paragraph.of(
                                                        LinkIdReference.of(
                                                                "x", "nowhere", "[x][nowhere]")))));

        assertTrue(result.hasErrors());
        assertEquals(1, result.issues().ofType(IssueType.UNRESOLVED_REFERENCE).size());
        assertEquals(1, listener.warnings.size());
        assertTrue(listener.groups.isEmpty());
    }

    @Test
    void manyIssuesOfOneTypeAreGrouped() {
        RecordingListener listener = new RecordingListener();
        builder(listener)
                .build()
                .process(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                LinkIdReference.of("a", "a", "[a]"),
                                                LinkIdReference.of("b", "b", "[b]"),
                                                LinkIdReference.of("c", "c", "[c]")))));

        assertEquals(List.of(IssueType.UNRESOLVED_REFERENCE.groupLabel()), listener.groups);
        assertEquals(3, listener.warnings.size());
        assertEquals(3, listener.summary.size());
    }

    @Test
    void renderPhaseTranslatesLinks() {
        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                builder(listener)
                        .withOutputFormat("html")
                        .build()
                        .process(
                                root(
                                        doc(
                                                "/a.md",
                                                Paragraph.of(
                                                        LinkPathReference.of(
                                                                "b",
                                                                "b.md#details",
                                                                "[b](b.md#details)"))),
                                        doc("/b.md", Header.of(1, "B"), Header.of(2, "Details"))));

        assertTrue(result.wasRendered());
        assertEquals(List.of("BUILD", "RESOLVE", "RENDER(html)", "Validation"), listener.phases);
        Paragraph paragraph = (Paragraph) content(result.root(), "/a.md").get(0);
        ResolvedInternalTarget target =
                (ResolvedInternalTarget) ((SpanLink) paragraph.content().get(0)).target();
        assertEquals("b.html#details", target.relativePath().toString());
        assertEquals(0, result.totalIssues());
    }

    @Test
    void additionalBuilderRunsInBuildPhase() {
        ProcessingService service =
                builder(ProcessingListener.silent()).addBuilder(DraftReplacer::new).build();
        ProcessingResult result = service.process(root(doc("/doc.md", Paragraph.of("draft"))));

        assertEquals(Paragraph.of("final"), content(result.root()).get(0));
        assertEquals(6, service.getRegistry().getBuilderSuppliers().size());
    }

    @Test
    void skippedBuilderDoesNotRun() {
        ProcessingService service =
                builder(ProcessingListener.silent())
                        .skipBuilders(Set.of("section-builder"))
                        .build();
        ProcessingResult result =
                service.process(root(doc("/doc.md", Header.of(1, "A"), Header.of(2, "B"))));

        List<Block> blocks = content(result.root());
        assertEquals(2, blocks.size());
        assertInstanceOf(Header.class, blocks.get(0));
    }

    @Test
    void skippingPrerequisiteIsRejected() {
        var ex =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                builder(ProcessingListener.silent())
                                        .skipBuilders(Set.of("link-resolver"))
                                        .build());
        assertTrue(ex.getMessage().contains("LinkResolver"));
    }

    @Test
    void printTreeSendsListingToListener() {
        RecordingListener listener = new RecordingListener();
        builder(listener)
                .withPrintTree(true)
                .build()
                .process(root(doc("/doc.md", Paragraph.of("text"))));

        assertTrue(listener.verbose.contains("Document /doc.md"));
    }

    @Test
    void separatedSelectionsProduceOneResultPerChoice() {
        Config config =
                Config.fromYaml(
                        "laika:\n"
                                + "  selections:\n"
                                + "    - name: build\n"
                                + "      separateEbooks: true\n"
                                + "      choices: [{name: sbt}, {name: maven}]\n");
        RecordingListener listener = new RecordingListener();

        List<ProcessingResult> results =
                builder(listener)
                        .withOutputFormat("epub")
                        .build()
                        .processCombinations(root(config, doc("/doc.md", Paragraph.of("text"))));

        assertEquals(2, results.size());
        assertEquals("sbt", results.get(0).classifier());
        assertEquals("maven", results.get(1).classifier());
        assertEquals(List.of("Processing variant sbt", "Processing variant maven"), listener.infos);
    }

    @Test
    void invalidSelectionsGiveConfigurationError() {
        Config config = Config.fromYaml("laika:\n  selections:\n    - name: broken\n");
        DocumentTreeRoot tree = root(config, doc("/doc.md", Paragraph.of("text")));

        List<ProcessingResult> results =
                builder(ProcessingListener.silent()).build().processCombinations(tree);

        assertEquals(1, results.size());
        assertSame(tree, results.get(0).root());
        assertEquals(IssueType.CONFIGURATION_ERROR, results.get(0).issues().get(0).type());
    }

    @Test
    void bundledDefaultsAreLoaded() {
        ProcessingService service =
                new ProcessingService.ProcessingServiceBuilder()
                        .withListener(ProcessingListener.silent())
                        .build();
        ProcessingResult result =
                service.process(root(doc("/doc.md", Header.of(1, "Title"), Paragraph.of("x"))));

        assertInstanceOf(Title.class, content(result.root()).get(0));
    }

    @Test
    void malformedLinkTargetsOfOneDocumentDoNotStopTheOthers() {
        Config broken = Config.fromMap(Map.of("laika.links.targets", "oops"));
        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                builder(listener)
                        .build()
                        .process(
                                root(
                                        doc(
                                                "/a.md",
                                                Paragraph.of(
                                                        LinkIdReference.of(
                                                                "go", "anchor", "[go][anchor]")),
                                                new Paragraph(
                                                        List.of(new Text("here")),
                                                        Options.id("anchor"))),
                                        doc("/b.md", broken, Paragraph.of("plain"))));

        Paragraph first = (Paragraph) content(result.root(), "/a.md").get(0);
        SpanLink resolved = assertInstanceOf(SpanLink.class, first.content().get(0));
        assertEquals(
                Path.parse("/a.md#anchor"),
                ((ResolvedInternalTarget) resolved.target()).absolutePath());
        assertEquals(0, result.totalIssues());
    }

    @Test
    void malformedVersionsStillResolveReferences() {
        Config broken =
                Config.fromMap(Map.of("laika.versions", Map.of("olderVersions", List.of())));
        RecordingListener listener = new RecordingListener();
        ProcessingResult result =
                builder(listener)
                        .build()
                        .process(
                                root(
                                        broken,
                                        doc(
                                                "/a.md",
                                                Paragraph.of(
                                                        LinkIdReference.of(
                                                                "m", "missing", "[m][missing]")))));

        Paragraph paragraph = (Paragraph) content(result.root(), "/a.md").get(0);
        InvalidSpan invalid = assertInstanceOf(InvalidSpan.class, paragraph.content().get(0));
        assertEquals("unresolved link id reference: missing", invalid.message());
        assertEquals(1, listener.warnings.size());
    }
}
