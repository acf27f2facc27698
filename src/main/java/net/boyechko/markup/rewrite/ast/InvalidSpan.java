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

public record InvalidSpan(String message, Span fallback, Options options)
        implements Span, Invalid {

    public InvalidSpan(String message, Span fallback) {
        this(message, fallback, Options.NONE);
    }

    /** Creates an invalid span that falls back to rendering the original markup source. */
    public static InvalidSpan of(String message, String source) {
        return new InvalidSpan(message, new Text(source));
    }

    @Override
    public List<? extends Element> children() {
        return List.of(fallback);
    }

    @Override
    public InvalidSpan withOptions(Options newOptions) {
        return new InvalidSpan(message, fallback, newOptions);
    }
}
