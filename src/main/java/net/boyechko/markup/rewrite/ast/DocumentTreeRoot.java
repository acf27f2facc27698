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

import java.util.List;
import java.util.Map;
import net.boyechko.markup.rewrite.config.Config;

/** The complete input of a transformation: the document tree plus static files. */
public record DocumentTreeRoot(DocumentTree tree, List<StaticDocument> staticDocuments) {

    public DocumentTreeRoot {
        staticDocuments = List.copyOf(staticDocuments);
    }

    public DocumentTreeRoot(DocumentTree tree) {
        this(tree, List.of());
    }

    public Config config() {
        return tree.config();
    }

    public List<Document> allDocuments() {
        return tree.allDocuments();
    }

    public DocumentTreeRoot withTree(DocumentTree newTree) {
        return newTree == tree ? this : new DocumentTreeRoot(newTree, staticDocuments);
    }

    public DocumentTreeRoot withConfig(Config config) {
        return new DocumentTreeRoot(
                new DocumentTree(tree.path(), tree.content(), config), staticDocuments);
    }

    public DocumentTreeRoot withDocuments(Map<Path, Document> replacements) {
        return withTree(tree.withDocuments(replacements));
    }
}
