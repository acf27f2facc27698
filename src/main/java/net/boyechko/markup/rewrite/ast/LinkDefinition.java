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

/** Defines the target of link id references. An empty id marks an anonymous definition. */
public record LinkDefinition(String id, Target target, String title, Options options)
        implements Hidden {

    public LinkDefinition(String id, Target target) {
        this(id, target, null, Options.NONE);
    }

    public boolean isAnonymous() {
        return id.isEmpty();
    }

    @Override
    public LinkDefinition withOptions(Options newOptions) {
        return new LinkDefinition(id, target, title, newOptions);
    }
}
