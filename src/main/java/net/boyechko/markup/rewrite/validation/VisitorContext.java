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

import java.util.List;
import net.boyechko.markup.rewrite.ast.Document;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.issues.IssueLocation;

/**
 * Immutable context passed to visitors during traversal.
 *
 * @param path element path inside the document, e.g. {@code /RootElement/Section[2]}
 * @param parent the enclosing element, {@code null} for the root element of a document
 * @param depth depth in the document (0 = root element)
 * @param globalIndex index in traversal order over the whole tree (1-based)
 */
public record VisitorContext(
        Element element,
        String path,
        Element parent,
        int depth,
        int globalIndex,
        Document document) {

    public String elementName() {
        return element.getClass().getSimpleName();
    }

    public List<? extends Element> children() {
        return element.children();
    }

    public Path documentPath() {
        return document.path();
    }

    public IssueLocation location() {
        return IssueLocation.at(document.path(), path);
    }

    public boolean is(Class<? extends Element> type) {
        return type.isInstance(element);
    }
}
