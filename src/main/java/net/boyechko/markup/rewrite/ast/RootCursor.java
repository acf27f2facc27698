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
import java.util.Optional;
import net.boyechko.markup.rewrite.config.Config;

/**
 * Read-only view of a tree root during a rewrite. Cursors for trees and documents are created
 * eagerly and keep links to their parents.
 */
public final class RootCursor {

    private final DocumentTreeRoot target;
    private final Config config;
    private final String outputFormat;
    private final TreeCursor tree;

    public RootCursor(DocumentTreeRoot target) {
        this(target, Config.EMPTY, null);
    }

    /**
     * @param defaults configuration that all trees and documents fall back to
     * @param outputFormat the format being rendered, or {@code null} before the render phase
     */
    public RootCursor(DocumentTreeRoot target, Config defaults, String outputFormat) {
        this.target = target;
        this.config = target.config().withFallback(defaults);
        this.outputFormat = outputFormat;
        this.tree = new TreeCursor(target.tree(), null, this, config, TreePosition.ROOT);
    }

    public DocumentTreeRoot target() {
        return target;
    }

    public Config config() {
        return config;
    }

    public Optional<String> outputFormat() {
        return Optional.ofNullable(outputFormat);
    }

    public TreeCursor tree() {
        return tree;
    }

    public List<DocumentCursor> allDocuments() {
        return tree.allDocuments();
    }

    public Optional<DocumentCursor> selectDocument(Path path) {
        return allDocuments().stream().filter(d -> d.path().equals(path)).findFirst();
    }

    /** The effective configuration of the tree at {@code path}, or of its closest ancestor. */
    public Config selectTreeConfig(Path path) {
        TreeCursor current = tree;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (TreeCursor sub : current.subtrees()) {
                if (path.isSubPath(sub.path())) {
                    current = sub;
                    descended = true;
                    break;
                }
            }
        }
        return current.config();
    }
}
