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

import static net.boyechko.markup.rewrite.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.Emphasized;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.InvalidSpan;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.Paragraph;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.Text;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.issues.IssueLocation;
import net.boyechko.markup.rewrite.issues.IssueType;
import org.junit.jupiter.api.Test;

/** Tests for ElementWalker and the visitors run after processing. */
class ElementWalkerTest {

    private static DocumentTreeRoot twoDocuments() {
        return root(
                doc("/a.md", Paragraph.of("first"), Paragraph.of("second")),
                doc("/b.md", Paragraph.of(new Emphasized(List.of(new Text("nested"))))));
    }

    /** Records what it sees; stops descending below elements of {@code skipBelow}. */
    private static class RecordingVisitor implements ElementVisitor {
        final List<String> entered = new ArrayList<>();
        final List<String> left = new ArrayList<>();
        final List<String> paths = new ArrayList<>();
        private final Class<?> skipBelow;

        RecordingVisitor(Class<?> skipBelow) {
            this.skipBelow = skipBelow;
        }

        @Override
        public String name() {
            return "Recording Visitor";
        }

        @Override
        public String description() {
            return "Records visited elements";
        }

        @Override
        public boolean enterElement(VisitorContext ctx) {
            entered.add(ctx.elementName());
            paths.add(ctx.documentPath() + ctx.path());
            return skipBelow == null || !skipBelow.isInstance(ctx.element());
        }

        @Override
        public void leaveElement(VisitorContext ctx) {
            left.add(ctx.elementName());
        }

        @Override
        public IssueList getIssues() {
            return new IssueList();
        }
    }

    @Test
    void walkerVisitsEveryElementOfEveryDocument() {
        RecordingVisitor visitor = new RecordingVisitor(null);
        new ElementWalker().addVisitor(visitor).walk(twoDocuments());

        assertEquals(
                List.of(
                        "RootElement", "Paragraph", "Text", "Paragraph", "Text",
                        "RootElement", "Paragraph", "Emphasized", "Text"),
                visitor.entered);
        assertEquals(visitor.entered.size(), visitor.left.size());
        assertEquals("RootElement", visitor.left.get(visitor.left.size() - 1));
    }

    @Test
    void pathsCarryOneBasedSiblingIndex() {
        RecordingVisitor visitor = new RecordingVisitor(null);
        new ElementWalker().addVisitor(visitor).walk(twoDocuments());

        assertTrue(visitor.paths.contains("/a.md/RootElement"));
        assertTrue(visitor.paths.contains("/a.md/RootElement/Paragraph[2]/Text[1]"));
        assertTrue(visitor.paths.contains("/b.md/RootElement/Paragraph[1]/Emphasized[1]/Text[1]"));
    }

    @Test
    void returningFalseSkipsChildren() {
        RecordingVisitor visitor = new RecordingVisitor(Paragraph.class);
        new ElementWalker().addVisitor(visitor).walk(twoDocuments());

        assertFalse(visitor.entered.contains("Text"));
        assertFalse(visitor.entered.contains("Emphasized"));
    }

    @Test
    void failingVisitorDoesNotStopOthers() {
        ElementVisitor failing =
                new ElementVisitor() {
                    @Override
                    public String name() {
                        return "Failing Visitor";
                    }

                    @Override
                    public String description() {
                        return "Always fails";
                    }

                    @Override
                    public boolean enterElement(VisitorContext ctx) {
                        throw new IllegalStateException("boom");
                    }

                    @Override
                    public IssueList getIssues() {
                        return new IssueList();
                    }
                };
        RecordingVisitor recording = new RecordingVisitor(null);

        new ElementWalker().addVisitor(failing).addVisitor(recording).walk(twoDocuments());

        assertEquals(9, recording.entered.size());
    }

    @Test
    void invalidElementsAreReportedWithTypeAndLocation() {
        DocumentTreeRoot tree =
                root(
                        doc(
                                "/doc.md",
                                InvalidBlock.of("More than one link target with id 'x' in path"),
                                Paragraph.of(
                                        InvalidSpan.of("unresolved link id reference: y", "[y]"),
                                        InvalidSpan.of("too many anonymous references", "[z]__"))));

        IssueList issues = new ElementWalker().addVisitor(new InvalidElementVisitor()).walk(tree);

        assertEquals(3, issues.size());
        assertEquals(IssueType.DUPLICATE_TARGET, issues.get(0).type());
        assertEquals(IssueType.UNRESOLVED_REFERENCE, issues.get(1).type());
        assertEquals(IssueType.SURPLUS_REFERENCE, issues.get(2).type());
        assertEquals(
                IssueLocation.at(Path.parse("/doc.md"), "/RootElement/Paragraph[2]/InvalidSpan[1]"),
                issues.get(1).where());
        assertTrue(issues.hasErrors());
    }

    @Test
    void leftoverReferencesAreReported() {
        DocumentTreeRoot tree =
                root(
                        doc(
                                "/doc.md",
                                Paragraph.of(
                                        LinkIdReference.of("x", "id", "[x][id]"),
                                        new InvalidSpan(
                                                "already reported",
                                                LinkIdReference.of("y", "id", "[y][id]")))));

        IssueList issues =
                new ElementWalker().addVisitor(new UnresolvedReferenceVisitor()).walk(tree);

        assertEquals(1, issues.size());
        assertEquals(IssueType.UNRESOLVED_REFERENCE, issues.get(0).type());
        assertEquals("unresolved reference: [x][id]", issues.get(0).message());
    }

    @Test
    void treeOutputListsElementsPerDocument() {
        List<String> lines = new ArrayList<>();
        new ElementWalker().addVisitor(new TreeOutputVisitor(lines::add)).walk(twoDocuments());

        assertTrue(lines.get(0).startsWith("Index"));
        assertTrue(lines.contains("Document /a.md"));
        assertTrue(lines.contains("Document /b.md"));
        assertTrue(lines.stream().anyMatch(l -> l.contains("- Text") && l.contains("nested")));
    }
}
