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

/** The kinds of problems left in a document tree after rewriting. */
public enum IssueType {
    // Reference issues
    UNRESOLVED_REFERENCE("unresolved references", IssueSev.ERROR),
    AMBIGUOUS_REFERENCE("ambiguous references", IssueSev.ERROR),
    CIRCULAR_REFERENCE("circular link references", IssueSev.ERROR),
    SURPLUS_REFERENCE("references without a matching target", IssueSev.ERROR),
    FORMAT_INCOMPATIBLE("links to documents not rendered in all formats", IssueSev.ERROR),

    // Target issues
    DUPLICATE_TARGET("duplicate link targets", IssueSev.WARNING),
    MISPLACED_TARGET("link targets inserted after the build phase", IssueSev.ERROR),

    // Processing issues
    CONFIGURATION_ERROR("invalid configuration values", IssueSev.ERROR),
    RULE_FAILURE("rewrite rules that failed", IssueSev.ERROR),
    INVALID_ELEMENT("other invalid elements", IssueSev.ERROR);

    private final String groupLabel;
    private final IssueSev defaultSeverity;

    IssueType(String groupLabel, IssueSev defaultSeverity) {
        this.groupLabel = groupLabel;
        this.defaultSeverity = defaultSeverity;
    }

    public String groupLabel() {
        return groupLabel;
    }

    public IssueSev defaultSeverity() {
        return defaultSeverity;
    }

    /** Derives the issue type from the message of an invalid element. */
    public static IssueType classify(String message) {
        if (message == null) return INVALID_ELEMENT;
        if (message.startsWith("unresolved")) return UNRESOLVED_REFERENCE;
        if (message.startsWith("Ambiguous reference")) return AMBIGUOUS_REFERENCE;
        if (message.startsWith("More than one")) return DUPLICATE_TARGET;
        if (message.startsWith("circular")) return CIRCULAR_REFERENCE;
        if (message.startsWith("too many")) return SURPLUS_REFERENCE;
        if (message.contains("cannot reference document")) return FORMAT_INCOMPATIBLE;
        if (message.startsWith("link target of type")) return MISPLACED_TARGET;
        if (message.startsWith("Invalid value for")) return CONFIGURATION_ERROR;
        if (message.startsWith("rule ")) return RULE_FAILURE;
        return INVALID_ELEMENT;
    }
}
