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

/** A block-level element such as a paragraph, header or section. */
public interface Block extends Element {

    Block withOptions(Options options);

    default Block withId(String id) {
        return withOptions(options().withId(id));
    }

    default Block withoutId() {
        return hasId() ? withOptions(options().withoutId()) : this;
    }

    default Block withStyle(String style) {
        return withOptions(options().withStyle(style));
    }

    /**
     * Applies the rewriter to the children of this block. Returns this instance when none of the
     * children changed.
     */
    default Block rewriteChildren(ElementRewriter rewriter) {
        return this;
    }
}
