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

import java.util.LinkedHashSet;
import java.util.Set;

/** Identity and styling of an element: an optional id and a set of style names. */
public record Options(String id, Set<String> styles) {

    public static final Options NONE = new Options(null, Set.of());

    public Options {
        styles = styles == null ? Set.of() : Set.copyOf(styles);
    }

    public static Options id(String id) {
        return new Options(id, Set.of());
    }

    public static Options styles(String... styles) {
        return new Options(null, Set.of(styles));
    }

    public boolean hasId() {
        return id != null;
    }

    public boolean hasStyle(String style) {
        return styles.contains(style);
    }

    public Options withId(String newId) {
        return new Options(newId, styles);
    }

    public Options withoutId() {
        return id == null ? this : new Options(null, styles);
    }

    public Options withStyle(String style) {
        if (styles.contains(style)) return this;
        Set<String> merged = new LinkedHashSet<>(styles);
        merged.add(style);
        return new Options(id, merged);
    }

    /** Combines both options; the id of {@code other} wins if present. */
    public Options merge(Options other) {
        Set<String> merged = new LinkedHashSet<>(styles);
        merged.addAll(other.styles);
        return new Options(other.id != null ? other.id : id, merged);
    }
}
