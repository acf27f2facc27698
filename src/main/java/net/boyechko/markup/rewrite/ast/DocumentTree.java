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
package net.boyechko.markup.rewrite.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.markup.rewrite.config.Config;

/** A directory of documents and sub-trees, in the order they are navigated and numbered. */
public record DocumentTree(Path path, List<TreeContent> content, Config config)
        implements TreeContent {

    public DocumentTree {
        content = List.copyOf(content);
    }

    public DocumentTree(Path path, List<TreeContent> content) {
        this(path, content, Config.EMPTY);
    }

    public List<Document> documents() {
        return content.stream()
                .filter(Document.class::isInstance)
                .map(Document.class::cast)
                .toList();
    }

    public List<DocumentTree> subtrees() {
        return content.stream()
                .filter(DocumentTree.class::isInstance)
                .map(DocumentTree.class::cast)
                .toList();
    }

    /** All documents of this tree and its sub-trees, depth first in content order. */
    public List<Document> allDocuments() {
        List<Document> all = new ArrayList<>();
        for (TreeContent c : content) {
            if (c instanceof Document doc) all.add(doc);
            else if (c instanceof DocumentTree tree) all.addAll(tree.allDocuments());
        }
        return all;
    }

    public Optional<Document> selectDocument(Path docPath) {
        return allDocuments().stream().filter(d -> d.path().equals(docPath)).findFirst();
    }

    public Optional<DocumentTree> selectSubtree(Path treePath) {
        if (treePath.equals(path)) return Optional.of(this);
        for (DocumentTree sub : subtrees()) {
            if (treePath.isSubPath(sub.path())) return sub.selectSubtree(treePath);
        }
        return Optional.empty();
    }

    /**
     * Replaces documents by path. Returns this instance when none of the replacements differs
     * from the document it replaces.
     */
    public DocumentTree withDocuments(Map<Path, Document> replacements) {
        boolean changed = false;
        List<TreeContent> newContent = new ArrayList<>(content.size());
        for (TreeContent c : content) {
            TreeContent updated = c;
            if (c instanceof Document doc) {
                updated = replacements.getOrDefault(doc.path(), doc);
            } else if (c instanceof DocumentTree tree) {
                updated = tree.withDocuments(replacements);
            }
            changed |= updated != c;
            newContent.add(updated);
        }
        return changed ? new DocumentTree(path, newContent, config) : this;
    }
}
