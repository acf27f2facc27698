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

import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigKeys;

/**
 * Read-only view of a single document inside a tree root. Rewrite rules receive one of these
 * when they are built, so they can look beyond the document they apply to.
 */
public final class DocumentCursor {

    private final Document target;
    private final TreeCursor parent;
    private final Config config;
    private final TreePosition position;

    DocumentCursor(Document target, TreeCursor parent, TreePosition position) {
        this.target = target;
        this.parent = parent;
        this.config = target.config().withFallback(parent.config());
        this.position = position;
    }

    public Document target() {
        return target;
    }

    public Path path() {
        return target.path();
    }

    public TreeCursor parent() {
        return parent;
    }

    public RootCursor root() {
        return parent.root();
    }

    /** The document's own configuration backed by that of all its ancestors. */
    public Config config() {
        return config;
    }

    public TreePosition position() {
        return position;
    }

    /** The formats this document is rendered to; {@link TargetFormats#ALL} when unconfigured. */
    public TargetFormats targetFormats() {
        return TargetFormats.fromList(config.getStringList(ConfigKeys.TARGET_FORMATS).orElse(null));
    }
}
