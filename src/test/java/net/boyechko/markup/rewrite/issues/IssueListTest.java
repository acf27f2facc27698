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
package net.boyechko.markup.rewrite.issues;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import net.boyechko.markup.rewrite.ast.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IssueListTest {

    private static final Path DOC_A = Path.parse("/a.md");
    private static final Path DOC_B = Path.parse("/b.md");

    private static IssueList sample() {
        IssueList issues = new IssueList();
        issues.add(
                new Issue(
                        IssueType.UNRESOLVED_REFERENCE,
                        IssueLocation.inDocument(DOC_A),
                        "unresolved link id reference: x"));
        issues.add(
                new Issue(
                        IssueType.DUPLICATE_TARGET,
                        IssueLocation.inDocument(DOC_B),
                        "More than one link target with id 'y' in path /b.md"));
        issues.add(
                new Issue(
                        IssueType.UNRESOLVED_REFERENCE,
                        IssueLocation.at(DOC_B, "/RootElement/Paragraph[1]"),
                        "unresolved image reference: logo"));
        return issues;
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '"',
            value = {
                "unresolved internal reference: missing.md | UNRESOLVED_REFERENCE",
                "Ambiguous reference: more than one link target | AMBIGUOUS_REFERENCE",
                "More than one link definition with id 'a' | DUPLICATE_TARGET",
                "circular link reference: a | CIRCULAR_REFERENCE",
                "too many autosymbol references | SURPLUS_REFERENCE",
                "document for all output formats cannot reference document 'b.md' | "
                        + "FORMAT_INCOMPATIBLE",
                "link target of type Paragraph with <no id> can only be inserted | "
                        + "MISPLACED_TARGET",
                "Invalid value for autonumbering.scope: x | CONFIGURATION_ERROR",
                "rule section-builder failed: boom | RULE_FAILURE",
                "something else entirely | INVALID_ELEMENT"
            })
    void classifiesMessages(String message, IssueType expected) {
        assertEquals(expected, IssueType.classify(message));
    }

    @Test
    void shortConstructorUsesDefaultSeverity() {
        assertEquals(
                IssueSev.WARNING, new Issue(IssueType.DUPLICATE_TARGET, "duplicate").severity());
        assertEquals(IssueSev.ERROR, new Issue(IssueType.RULE_FAILURE, "failed").severity());
    }

    @Test
    void filtersByTypeDocumentAndSeverity() {
        IssueList issues = sample();

        assertEquals(2, issues.ofType(IssueType.UNRESOLVED_REFERENCE).size());
        assertEquals(2, issues.inDocument(DOC_B).size());
        assertEquals(2, issues.atLeast(IssueSev.ERROR).size());
        assertEquals(3, issues.atLeast(IssueSev.WARNING).size());
        assertTrue(issues.hasErrors());
        assertFalse(issues.ofType(IssueType.DUPLICATE_TARGET).hasErrors());
    }

    @Test
    void groupsKeepOrderOfFirstOccurrence() {
        Map<IssueType, List<Issue>> groups = sample().groupedByType();

        assertEquals(
                List.of(IssueType.UNRESOLVED_REFERENCE, IssueType.DUPLICATE_TARGET),
                List.copyOf(groups.keySet()));
        assertEquals(2, groups.get(IssueType.UNRESOLVED_REFERENCE).size());
    }

    @Test
    void locationToString() {
        assertEquals("", IssueLocation.none().toString());
        assertEquals("/a.md", IssueLocation.inDocument(DOC_A).toString());
        assertEquals(
                "/a.md (/RootElement/Title[1])",
                IssueLocation.at(DOC_A, "/RootElement/Title[1]").toString());
    }

    @Test
    void issueToStringIncludesLocation() {
        Issue issue =
                new Issue(
                        IssueType.CIRCULAR_REFERENCE,
                        IssueLocation.inDocument(DOC_A),
                        "circular link reference: a");
        assertEquals("CIRCULAR_REFERENCE: circular link reference: a at /a.md", issue.toString());
    }

    @Test
    void nullCollectionGivesEmptyList() {
        assertTrue(new IssueList((List<Issue>) null).isEmpty());
        assertTrue(new IssueList((Issue) null).isEmpty());
    }
}
