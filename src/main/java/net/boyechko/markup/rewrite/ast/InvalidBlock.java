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

public record InvalidBlock(String message, Block fallback, Options options)
        implements Block, Invalid {

    public InvalidBlock(String message, Block fallback) {
        this(message, fallback, Options.NONE);
    }

    /** Creates an invalid block without any source content to fall back to. */
    public static InvalidBlock of(String message) {
        return new InvalidBlock(message, new Paragraph(List.of()));
    }

    @Override
    public List<? extends Element> children() {
        return List.of(fallback);
    }

    @Override
    public InvalidBlock withOptions(Options newOptions) {
        return new InvalidBlock(message, fallback, newOptions);
    }
}
