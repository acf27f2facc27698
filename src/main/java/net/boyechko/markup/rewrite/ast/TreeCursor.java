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
import java.util.Optional;
import net.boyechko.markup.rewrite.config.Config;

/** Read-only view of a {@link DocumentTree} with access to its parent and the root. */
public final class TreeCursor {

    private final DocumentTree target;
    private final TreeCursor parent;
    private final RootCursor root;
    private final Config config;
    private final TreePosition position;
    private final List<DocumentCursor> documents = new ArrayList<>();
    private final List<TreeCursor> subtrees = new ArrayList<>();

    TreeCursor(
            DocumentTree target,
            TreeCursor parent,
            RootCursor root,
            Config inherited,
            TreePosition position) {
        this.target = target;
        this.parent = parent;
        this.root = root;
        this.config = parent == null ? inherited : target.config().withFallback(inherited);
        this.position = position;

        int childNum = 0;
        for (TreeContent child : target.content()) {
            childNum++;
            if (child instanceof Document doc) {
                documents.add(new DocumentCursor(doc, this, position.forChild(childNum)));
            } else if (child instanceof DocumentTree tree) {
                subtrees.add(new TreeCursor(tree, this, root, config, position.forChild(childNum)));
            }
        }
    }

    public DocumentTree target() {
        return target;
    }

    public Path path() {
        return target.path();
    }

    public Optional<TreeCursor> parent() {
        return Optional.ofNullable(parent);
    }

    public RootCursor root() {
        return root;
    }

    public Config config() {
        return config;
    }

    public TreePosition position() {
        return position;
    }

    public List<DocumentCursor> documents() {
        return List.copyOf(documents);
    }

    public List<TreeCursor> subtrees() {
        return List.copyOf(subtrees);
    }

    /** Documents of this tree and all sub-trees, in the order they appear in the tree. */
    public List<DocumentCursor> allDocuments() {
        List<DocumentCursor> all = new ArrayList<>();
        int docIndex = 0;
        int treeIndex = 0;
        for (TreeContent child : target.content()) {
            if (child instanceof Document) {
                all.add(documents.get(docIndex++));
            } else if (child instanceof DocumentTree) {
                all.addAll(subtrees.get(treeIndex++).allDocuments());
            }
        }
        return all;
    }
}
