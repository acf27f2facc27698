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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** The output formats a document or target is rendered to. */
public sealed interface TargetFormats
        permits TargetFormats.All, TargetFormats.None, TargetFormats.Selected {

    All ALL = new All();
    None NONE = new None();

    boolean contains(String format);

    static TargetFormats selected(String... formats) {
        return new Selected(new LinkedHashSet<>(List.of(formats)));
    }

    /** Interprets a configured list of formats; {@code null} means all formats. */
    static TargetFormats fromList(List<String> formats) {
        if (formats == null) return ALL;
        if (formats.isEmpty()) return NONE;
        return new Selected(new LinkedHashSet<>(formats));
    }

    record All() implements TargetFormats {
        @Override
        public boolean contains(String format) {
            return true;
        }
    }

    record None() implements TargetFormats {
        @Override
        public boolean contains(String format) {
            return false;
        }
    }

    record Selected(Set<String> formats) implements TargetFormats {
        public Selected {
            formats = Collections.unmodifiableSet(new LinkedHashSet<>(formats));
        }

        @Override
        public boolean contains(String format) {
            return formats.contains(format);
        }
    }
}
