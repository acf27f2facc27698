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

/** A single markup document with its content and its own configuration. */
public record Document(Path path, RootElement content, Config config) implements TreeContent {

    public Document(Path path, RootElement content) {
        this(path, content, Config.EMPTY);
    }

    public Document withContent(RootElement newContent) {
        return newContent == content ? this : new Document(path, newContent, config);
    }

    public Document withConfig(Config newConfig) {
        return new Document(path, content, newConfig);
    }
}
