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
package net.boyechko.markup.rewrite.rewrite;

import java.util.Optional;

/**
 * The phases a tree is rewritten in. All documents finish one phase before the next one starts.
 *
 * <ul>
 *   <li>{@code BUILD}: rules on the raw tree as it came from the parser
 *   <li>{@code RESOLVE}: references and sections, with the whole tree visible
 *   <li>{@code RENDER}: preparation for one specific output format
 * </ul>
 */
public record RewritePhase(Kind kind, String format) {

    public enum Kind {
        BUILD,
        RESOLVE,
        RENDER
    }

    public static final RewritePhase BUILD = new RewritePhase(Kind.BUILD, null);
    public static final RewritePhase RESOLVE = new RewritePhase(Kind.RESOLVE, null);

    public RewritePhase {
        if (kind == Kind.RENDER && (format == null || format.isBlank())) {
            throw new IllegalArgumentException("The render phase requires an output format");
        }
        if (kind != Kind.RENDER && format != null) {
            throw new IllegalArgumentException("Only the render phase has an output format");
        }
    }

    public static RewritePhase render(String format) {
        return new RewritePhase(Kind.RENDER, format);
    }

    public Optional<String> outputFormat() {
        return Optional.ofNullable(format);
    }

    @Override
    public String toString() {
        return format == null ? kind.name() : kind.name() + "(" + format + ")";
    }
}
