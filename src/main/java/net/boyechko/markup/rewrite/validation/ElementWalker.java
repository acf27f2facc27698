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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.markup.rewrite.ast.Document;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.issues.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks all documents of a tree once, invoking multiple visitors at each element. */
public class ElementWalker {
    private static final Logger logger = LoggerFactory.getLogger(ElementWalker.class);

    private final List<ElementVisitor> visitors = new ArrayList<>();

    private Document document;
    private int globalIndex;

    public ElementWalker addVisitor(ElementVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(DocumentTreeRoot root) {
        this.globalIndex = 0;

        for (ElementVisitor visitor : visitors) {
            visitor.beforeTraversal(root);
        }

        for (Document doc : root.allDocuments()) {
            this.document = doc;
            walkElement(doc.content(), null, "", 0);
        }

        IssueList allIssues = new IssueList();
        for (ElementVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    private void walkElement(Element element, Element parent, String parentPath, int depth) {
        globalIndex++;
        String name = element.getClass().getSimpleName();
        String path =
                parent == null ? "/" + name : parentPath + "/" + name + indexIn(parent, element);
        VisitorContext ctx =
                new VisitorContext(element, path, parent, depth, globalIndex, document);

        boolean continueToChildren = true;
        for (ElementVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} at {}{}: {}",
                        visitor.name(),
                        document.path(),
                        path,
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            for (Element child : element.children()) {
                walkElement(child, element, path, depth + 1);
            }
        }

        for (ElementVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} leaving {}{}: {}",
                        visitor.name(),
                        document.path(),
                        path,
                        e.getMessage());
            }
        }
    }

    private static String indexIn(Element parent, Element child) {
        List<? extends Element> siblings = parent.children();
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i) == child) return "[" + (i + 1) + "]";
        }
        return "";
    }
}
