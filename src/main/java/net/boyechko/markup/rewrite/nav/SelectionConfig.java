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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The choices available for one kind of selection.
 *
 * @param separateEbooks whether e-books get produced separately for each choice instead of
 *     showing all of them
 */
public record SelectionConfig(String name, List<ChoiceConfig> choices, boolean separateEbooks) {

    public SelectionConfig {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("Selection " + name + " has no choices");
        }
        choices = List.copyOf(choices);
    }

    public SelectionConfig(String name, ChoiceConfig... choices) {
        this(name, List.of(choices), false);
    }

    public SelectionConfig withSeparateEbooks() {
        return new SelectionConfig(name, choices, true);
    }

    /** Selects {@code choice} and deselects all others. */
    public SelectionConfig select(ChoiceConfig choice) {
        List<ChoiceConfig> updated = new ArrayList<>(choices.size());
        for (ChoiceConfig c : choices) {
            updated.add(c.name().equals(choice.name()) ? c.select() : c.deselect());
        }
        return new SelectionConfig(name, updated, separateEbooks);
    }

    public Optional<ChoiceConfig> selectedChoice() {
        return choices.stream().filter(ChoiceConfig::selected).findFirst();
    }

    Map<String, Object> toConfigValue() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", name);
        value.put("separateEbooks", separateEbooks);
        value.put("choices", choices.stream().map(ChoiceConfig::toConfigValue).toList());
        return value;
    }
}
