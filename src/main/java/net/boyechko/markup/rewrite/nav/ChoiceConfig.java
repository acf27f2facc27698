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
package net.boyechko.markup.rewrite.nav;

import java.util.LinkedHashMap;
import java.util.Map;

/** One choice of a selection, for example the Java variant of a code sample. */
public record ChoiceConfig(String name, String label, boolean selected) {

    public ChoiceConfig(String name, String label) {
        this(name, label, false);
    }

    public ChoiceConfig select() {
        return selected ? this : new ChoiceConfig(name, label, true);
    }

    public ChoiceConfig deselect() {
        return selected ? new ChoiceConfig(name, label, false) : this;
    }

    Map<String, Object> toConfigValue() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", name);
        value.put("label", label);
        value.put("selected", selected);
        return value;
    }
}
