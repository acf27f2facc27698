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

/** A problem found in a rewritten document tree. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLocation where;
    private final String message;

    public Issue(IssueType type, String message) {
        this(type, type.defaultSeverity(), IssueLocation.none(), message);
    }

    public Issue(IssueType type, IssueLocation where, String message) {
        this(type, type.defaultSeverity(), where, message);
    }

    public Issue(IssueType type, IssueSev sev, IssueLocation where, String message) {
        this.type = type;
        this.severity = sev;
        this.where = where;
        this.message = message;
    }

    public IssueType type() {
        return type;
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLocation where() {
        return where;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        String location = where.toString();
        return type + ": " + message + (location.isEmpty() ? "" : " at " + location);
    }
}
