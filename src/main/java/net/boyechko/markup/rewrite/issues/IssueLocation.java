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

import net.boyechko.markup.rewrite.ast.Path;

/**
 * Where an issue was found.
 *
 * @param documentPath the document, or {@code null} for issues of the whole tree
 * @param elementPath position of the element inside the document, e.g. {@code
 *     /Section[2]/Paragraph[1]}; {@code null} if not applicable
 */
public record IssueLocation(Path documentPath, String elementPath) {

    private static final IssueLocation NONE = new IssueLocation(null, null);

    public static IssueLocation none() {
        return NONE;
    }

    public static IssueLocation inDocument(Path documentPath) {
        return new IssueLocation(documentPath, null);
    }

    public static IssueLocation at(Path documentPath, String elementPath) {
        return new IssueLocation(documentPath, elementPath);
    }

    @Override
    public String toString() {
        String output = "";
        if (documentPath != null) {
            output += documentPath;
        }
        if (elementPath != null) {
            output += " (" + elementPath + ")";
        }
        return output.trim();
    }
}
