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

import static net.boyechko.markup.rewrite.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.Citation;
import net.boyechko.markup.rewrite.ast.CitationLink;
import net.boyechko.markup.rewrite.ast.CitationReference;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.ExternalTarget;
import net.boyechko.markup.rewrite.ast.Footnote;
import net.boyechko.markup.rewrite.ast.FootnoteDefinition;
import net.boyechko.markup.rewrite.ast.FootnoteLabel;
import net.boyechko.markup.rewrite.ast.FootnoteLink;
import net.boyechko.markup.rewrite.ast.FootnoteReference;
import net.boyechko.markup.rewrite.ast.Header;
import net.boyechko.markup.rewrite.ast.ImageIdReference;
import net.boyechko.markup.rewrite.ast.ImagePathReference;
import net.boyechko.markup.rewrite.ast.InternalLinkTarget;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.LinkAlias;
import net.boyechko.markup.rewrite.ast.LinkDefinition;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.LinkPathReference;
import net.boyechko.markup.rewrite.ast.Options;
import net.boyechko.markup.rewrite.ast.Paragraph;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RelativePath;
import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.SpanLink;
import net.boyechko.markup.rewrite.ast.TargetFormats;
import net.boyechko.markup.rewrite.ast.Text;
import net.boyechko.markup.rewrite.config.Config;
import org.junit.jupiter.api.Test;

class LinkResolverTest {

    private static List<Span> spans(Block block) {
        return ((Paragraph) block).content();
    }

    private static String invalidMessage(Span span) {
        assertInstanceOf(InvalidSpan.class, span);
        return ((InvalidSpan) span).message();
    }

    private static SpanLink link(Span span) {
        assertInstanceOf(SpanLink.class, span, "Expected a link but got " + span);
        return (SpanLink) span;
    }

    @Test
    void anonymousReferencesResolveInOrder() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                LinkIdReference.of("a", "", "[a]__"),
                                                LinkIdReference.of("b", "", "[b]__"),
                                                LinkIdReference.of("c", "", "[c]__")),
                                        new LinkDefinition("", new ExternalTarget("http://one")),
                                        new LinkDefinition(
                                                "", new ExternalTarget("http://two")))));

        List<Block> blocks = content(result);
        assertEquals(1, blocks.size(), "Link definitions should be removed");
        List<Span> spans = spans(blocks.get(0));
        assertEquals(new ExternalTarget("http://one"), link(spans.get(0)).target());
        assertEquals(new ExternalTarget("http://two"), link(spans.get(1)).target());
        assertEquals("too many anonymous references", invalidMessage(spans.get(2)));
    }

    @Test
    void namedLinkDefinitionResolvesReference() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                LinkIdReference.of("docs", "docs", "[docs]")),
                                        new LinkDefinition(
                                                "docs", new ExternalTarget("https://docs.org")))));

        SpanLink resolved = link(spans(content(result).get(0)).get(0));
        assertEquals(new ExternalTarget("https://docs.org"), resolved.target());
        assertEquals(List.of(new Text("docs")), resolved.content());
    }

    @Test
    void duplicateIdsInvalidateTargetsAndReferences() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        new Paragraph(List.of(new Text("one")), Options.id("name")),
                                        new Paragraph(List.of(new Text("two")), Options.id("name")),
                                        Paragraph.of(
                                                LinkIdReference.of("x", "name", "[x][name]")))));

        List<Block> blocks = content(result);
        for (Block target : blocks.subList(0, 2)) {
            assertInstanceOf(InvalidBlock.class, target);
            assertEquals(
                    "More than one link target with id 'name' in path /doc.md",
                    ((InvalidBlock) target).message());
            assertFalse(((InvalidBlock) target).fallback().hasId());
        }
        assertEquals(
                "Ambiguous reference: more than one link target with id 'name' in path /doc.md",
                invalidMessage(spans(blocks.get(2)).get(0)));
    }

    @Test
    void duplicateHeadersAreRenumberedAndTopLevelWins() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Header.of(2, "Intro"),
                                        Header.of(1, "Intro"),
                                        Paragraph.of(
                                                LinkIdReference.of("x", "intro", "[x][intro]")))));

        List<Block> blocks = content(result);
        assertEquals("intro-1", blocks.get(0).options().id());
        assertEquals("intro-2", blocks.get(1).options().id());

        SpanLink resolved = link(spans(blocks.get(2)).get(0));
        ResolvedInternalTarget target = (ResolvedInternalTarget) resolved.target();
        assertEquals(Path.parse("/doc.md#intro-2"), target.absolutePath());
        assertTrue(target.relativePath().isCurrentDocument());
    }

    @Test
    void duplicateLinkDefinitionsAreDroppedAndReferencesAmbiguous() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(LinkIdReference.of("d", "dup", "[d][dup]")),
                                        new LinkDefinition("dup", new ExternalTarget("http://a")),
                                        new LinkDefinition(
                                                "dup", new ExternalTarget("http://b")))));

        List<Block> blocks = content(result);
        assertEquals(1, blocks.size());
        assertEquals(
                "Ambiguous reference: more than one link definition with id 'dup' in path /doc.md",
                invalidMessage(spans(blocks.get(0)).get(0)));
    }

    @Test
    void aliasResolvesToHeader() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Header.of(1, "Getting Started"),
                                        new LinkAlias("start", "getting started"),
                                        Paragraph.of(
                                                LinkIdReference.of(
                                                        "go", "start", "[go][start]")))));

        List<Block> blocks = content(result);
        assertEquals(2, blocks.size(), "The alias should be removed");
        ResolvedInternalTarget target =
                (ResolvedInternalTarget) link(spans(blocks.get(1)).get(0)).target();
        assertEquals(Path.parse("/doc.md#getting-started"), target.absolutePath());
    }

    @Test
    void aliasCycleIsReported() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        new LinkAlias("name", "ref"),
                                        new LinkAlias("ref", "name"),
                                        Paragraph.of(
                                                LinkIdReference.of("x", "name", "[x][name]")))));

        String message = invalidMessage(spans(content(result).get(0)).get(0));
        assertTrue(message.startsWith("circular link reference: "), message);
    }

    @Test
    void autonumberedFootnotesGetLabelsInOrder() {
        FootnoteReference ref = new FootnoteReference(FootnoteLabel.AUTONUMBER, "[#]_");
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(ref, ref, ref),
                                        new FootnoteDefinition(
                                                FootnoteLabel.AUTONUMBER,
                                                List.of(Paragraph.of("first"))),
                                        new FootnoteDefinition(
                                                FootnoteLabel.AUTONUMBER,
                                                List.of(Paragraph.of("second"))))));

        List<Block> blocks = content(result);
        List<Span> spans = spans(blocks.get(0));
        assertEquals(new FootnoteLink("__fn-1", "1"), spans.get(0));
        assertEquals(new FootnoteLink("__fn-2", "2"), spans.get(1));
        assertEquals("too many autonumber references", invalidMessage(spans.get(2)));

        Footnote first = (Footnote) blocks.get(1);
        assertEquals("1", first.label());
        assertEquals("__fn-1", first.options().id());
        assertEquals("2", ((Footnote) blocks.get(2)).label());
    }

    @Test
    void autosymbolFootnotesUseSymbolSequence() {
        FootnoteReference ref = new FootnoteReference(FootnoteLabel.AUTOSYMBOL, "[*]_");
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(ref, ref),
                                        new FootnoteDefinition(
                                                FootnoteLabel.AUTOSYMBOL,
                                                List.of(Paragraph.of("a"))),
                                        new FootnoteDefinition(
                                                FootnoteLabel.AUTOSYMBOL,
                                                List.of(Paragraph.of("b"))))));

        List<Span> spans = spans(content(result).get(0));
        assertEquals(new FootnoteLink("__fns-1", "*"), spans.get(0));
        assertEquals(new FootnoteLink("__fns-2", "\u2020"), spans.get(1));
    }

    @Test
    void numericFootnoteKeepsItsLabel() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                new FootnoteReference(
                                                        new FootnoteLabel.NumericLabel(7),
                                                        "[7]_")),
                                        new FootnoteDefinition(
                                                new FootnoteLabel.NumericLabel(7),
                                                List.of(Paragraph.of("seven"))))));

        List<Block> blocks = content(result);
        assertEquals(new FootnoteLink("__fnl-7", "7"), spans(blocks.get(0)).get(0));
        assertEquals("__fnl-7", blocks.get(1).options().id());
    }

    @Test
    void citationsResolveToSluggedIds() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(new CitationReference("Smith2020", "[S]_")),
                                        new Citation(
                                                "Smith2020", List.of(Paragraph.of("Smith."))))));

        List<Block> blocks = content(result);
        CitationLink citationLink = (CitationLink) spans(blocks.get(0)).get(0);
        assertEquals("Smith2020", citationLink.label());
        Citation citation = (Citation) blocks.get(1);
        assertEquals("__cit-" + citationLink.ref(), citation.options().id());
    }

    @Test
    void danglingAliasIsReported() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        new LinkAlias("start", "nowhere"),
                                        Paragraph.of(
                                                LinkIdReference.of(
                                                        "go", "start", "[go][start]")))));

        assertEquals(
                "unresolved link alias: nowhere",
                invalidMessage(spans(content(result).get(0)).get(0)));
    }

    @Test
    void referenceResolvesToInternalLinkTarget() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                InternalLinkTarget.of("anchor"),
                                                new Text("anchored text")),
                                        Paragraph.of(
                                                LinkIdReference.of(
                                                        "go", "anchor", "[go][anchor]")))));

        List<Block> blocks = content(result);
        Span anchor = spans(blocks.get(0)).get(0);
        assertInstanceOf(InternalLinkTarget.class, anchor);
        assertEquals("anchor", anchor.options().id());
        ResolvedInternalTarget target =
                (ResolvedInternalTarget) link(spans(blocks.get(1)).get(0)).target();
        assertEquals(Path.parse("/doc.md#anchor"), target.absolutePath());
    }

    @Test
    void sameTreeTargetTakesPrecedenceOverAncestorTree() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                tree(
                                        "/sub",
                                        doc(
                                                "/sub/a.md",
                                                Paragraph.of(
                                                        LinkIdReference.of(
                                                                "i", "intro", "[i][intro]"))),
                                        doc("/sub/b.md", Header.of(1, "Intro"))),
                                doc("/c.md", Header.of(1, "Intro"))));

        ResolvedInternalTarget target =
                (ResolvedInternalTarget)
                        link(spans(content(result, "/sub/a.md").get(0)).get(0)).target();
        assertEquals(Path.parse("/sub/b.md#intro"), target.absolutePath());
    }

    @Test
    void configuredLinkTargetsAreAvailable() {
        Config config =
                Config.fromMap(
                        Map.of(
                                "laika",
                                Map.of(
                                        "links",
                                        Map.of("targets", Map.of("ext", "https://ext.com")))));
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                config,
                                doc(
                                        "/doc.md",
                                        Paragraph.of(LinkIdReference.of("e", "ext", "[e][ext]")))));

        assertEquals(
                new ExternalTarget("https://ext.com"),
                link(spans(content(result).get(0)).get(0)).target());
    }

    @Test
    void pathReferenceToHeaderInOtherDocument() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/a.md",
                                        Paragraph.of(
                                                LinkPathReference.of(
                                                        "b", "b.md#section", "[b](b.md#section)"))),
                                doc("/b.md", Header.of(1, "Section"))));

        SpanLink resolved = link(spans(content(result, "/a.md").get(0)).get(0));
        ResolvedInternalTarget target = (ResolvedInternalTarget) resolved.target();
        assertEquals(Path.parse("/b.md#section"), target.absolutePath());
        assertEquals("b.md#section", target.relativePath().toString());
    }

    @Test
    void pathAboveTheRootBecomesExternalLink() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/a.md",
                                        Paragraph.of(
                                                LinkPathReference.of(
                                                        "out",
                                                        "../outside.md",
                                                        "[out](../outside.md)")))));

        assertEquals(
                new ExternalTarget("../outside.md"),
                link(spans(content(result).get(0)).get(0)).target());
    }

    @Test
    void unresolvedReferencesBecomeInvalidSpans() {
        DocumentTreeRoot result =
                resolveLinks(
                        root(
                                doc(
                                        "/doc.md",
                                        Paragraph.of(
                                                LinkIdReference.of("m", "missing", "[m][missing]"),
                                                new ImageIdReference("img", "logo", "![img][logo]"),
                                                LinkPathReference.of(
                                                        "p", "missing.md", "[p](missing.md)")))));

        List<Span> spans = spans(content(result).get(0));
        assertEquals("unresolved link id reference: missing", invalidMessage(spans.get(0)));
        assertEquals("unresolved image reference: logo", invalidMessage(spans.get(1)));
        assertEquals("unresolved internal reference: missing.md", invalidMessage(spans.get(2)));
        assertEquals(new Text("[m][missing]"), ((InvalidSpan) spans.get(0)).fallback());
    }

    @Test
    void referenceToDocumentWithRestrictedFormatsIsInvalid() {
        DocumentTreeRoot result = resolveLinks(restrictedFormatsTree(Config.EMPTY));

        assertEquals(
                "document for all output formats cannot reference document 'b.md' with"
                        + " restricted output formats unless html is one of the formats and"
                        + " siteBaseUrl is defined",
                invalidMessage(spans(content(result, "/a.md").get(0)).get(0)));
    }

    @Test
    void referenceToDocumentWithRestrictedFormatsRecoversWithSiteBaseUrl() {
        Config config = Config.fromMap(Map.of("laika.siteBaseURL", "https://site.com/"));
        DocumentTreeRoot result = resolveLinks(restrictedFormatsTree(config));

        SpanLink resolved = link(spans(content(result, "/a.md").get(0)).get(0));
        ResolvedInternalTarget target = (ResolvedInternalTarget) resolved.target();
        assertEquals(TargetFormats.selected("html"), target.internalFormats());
    }

    @Test
    void imageOfDocumentWithRestrictedFormatsDoesNotRecover() {
        Config config = Config.fromMap(Map.of("laika.siteBaseURL", "https://site.com/"));
        ImagePathReference image =
                new ImagePathReference(RelativePath.parse("b.md"), "pic", "![pic](b.md)");
        DocumentTreeRoot result = resolveLinks(restrictedFormatsTree(config, image));

        assertEquals(
                "document for all output formats cannot reference document 'b.md' with"
                        + " restricted output formats",
                invalidMessage(spans(content(result, "/a.md").get(0)).get(0)));
    }

    private static DocumentTreeRoot restrictedFormatsTree(Config rootConfig) {
        return restrictedFormatsTree(
                rootConfig, LinkPathReference.of("b", "b.md", "[b](b.md)"));
    }

    private static DocumentTreeRoot restrictedFormatsTree(Config rootConfig, Span reference) {
        Config htmlOnly = Config.fromMap(Map.of("laika.targetFormats", List.of("html")));
        return root(
                rootConfig,
                doc("/a.md", Paragraph.of(reference)),
                doc("/b.md", htmlOnly, Paragraph.of("html only")));
    }

    @Test
    void resolvingTwiceChangesNothing() {
        FootnoteReference ref = new FootnoteReference(FootnoteLabel.AUTONUMBER, "[#]_");
        DocumentTreeRoot once =
                resolve(
                        root(
                                doc(
                                        "/doc.md",
                                        Header.of(1, "Title"),
                                        Header.of(2, "Part"),
                                        Paragraph.of(
                                                ref, LinkIdReference.of("p", "part", "[p][part]")),
                                        new FootnoteDefinition(
                                                FootnoteLabel.AUTONUMBER,
                                                List.of(Paragraph.of("note"))),
                                        new Citation("c1", List.of(Paragraph.of("cited"))))));

        assertSame(once, resolve(once));
    }
}
