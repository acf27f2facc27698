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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All selections of a tree, read from {@link ConfigKeys#SELECTIONS}. Selections offer alternative
 * versions of the same content; for e-books each combination of separated choices becomes its own
 * variant.
 */
public record Selections(List<SelectionConfig> selections) {
    private static final Logger logger = LoggerFactory.getLogger(Selections.class);

    public static final Selections EMPTY = new Selections(List.of());

    public Selections {
        selections = List.copyOf(selections);
    }

    public Optional<SelectionConfig> getSelection(String name) {
        return selections.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /** The names of the selected choices of all selections that have one. */
    public List<String> getClassifiers() {
        List<String> classifiers = new ArrayList<>();
        for (SelectionConfig selection : selections) {
            selection.selectedChoice().ifPresent(c -> classifiers.add(c.name()));
        }
        return classifiers;
    }

    public List<Map<String, Object>> toConfigValue() {
        return selections.stream().map(SelectionConfig::toConfigValue).toList();
    }

    public static Selections fromConfig(Config config) {
        Optional<List<Object>> entries = config.getList(ConfigKeys.SELECTIONS);
        if (entries.isEmpty()) return EMPTY;
        List<SelectionConfig> selections = new ArrayList<>();
        for (Object entry : entries.get()) {
            selections.add(selectionOf(entry));
        }
        return new Selections(selections);
    }

    private static SelectionConfig selectionOf(Object entry) {
        if (!(entry instanceof Map<?, ?> map)) {
            throw new ConfigException("Invalid selection: " + entry);
        }
        Object name = map.get("name");
        if (name == null) throw new ConfigException("Selection without name: " + entry);
        if (!(map.get("choices") instanceof List<?> choiceList) || choiceList.isEmpty()) {
            throw new ConfigException("Selection " + name + " has no choices");
        }
        List<ChoiceConfig> choices = new ArrayList<>();
        for (Object choice : choiceList) {
            choices.add(choiceOf(choice));
        }
        boolean separate = Boolean.parseBoolean(String.valueOf(map.get("separateEbooks")));
        return new SelectionConfig(name.toString(), choices, separate);
    }

    private static ChoiceConfig choiceOf(Object entry) {
        if (!(entry instanceof Map<?, ?> map) || map.get("name") == null) {
            throw new ConfigException("Invalid choice: " + entry);
        }
        String name = map.get("name").toString();
        Object label = map.get("label");
        boolean selected = Boolean.parseBoolean(String.valueOf(map.get("selected")));
        return new ChoiceConfig(name, label != null ? label.toString() : name, selected);
    }

    /**
     * Creates one configuration per combination of choices of all selections with separate
     * e-books, in declaration order with the first selection varying slowest. Without such
     * selections the result is the unchanged configuration.
     */
    public static List<ChoiceCombination> createChoiceCombinations(Config config) {
        Selections value = fromConfig(config);
        List<SelectionConfig> separated = new ArrayList<>();
        List<SelectionConfig> nonSeparated = new ArrayList<>();
        for (SelectionConfig selection : value.selections()) {
            (selection.separateEbooks() ? separated : nonSeparated).add(selection);
        }
        if (separated.isEmpty()) {
            return List.of(new ChoiceCombination(config, value.getClassifiers()));
        }

        List<List<SelectionConfig>> combinations = List.of(List.of());
        for (SelectionConfig group : separated) {
            List<List<SelectionConfig>> next = new ArrayList<>();
            for (List<SelectionConfig> prefix : combinations) {
                for (ChoiceConfig choice : group.choices()) {
                    List<SelectionConfig> combined = new ArrayList<>(prefix);
                    combined.add(group.select(choice));
                    next.add(combined);
                }
            }
            combinations = next;
        }

        List<ChoiceCombination> result = new ArrayList<>(combinations.size());
        for (List<SelectionConfig> combination : combinations) {
            List<SelectionConfig> all = new ArrayList<>(combination);
            all.addAll(nonSeparated);
            Selections selections = new Selections(all);
            result.add(
                    new ChoiceCombination(
                            config.withValue(ConfigKeys.SELECTIONS, selections.toConfigValue()),
                            selections.getClassifiers()));
        }
        logger.debug("Created {} choice combinations", result.size());
        return result;
    }
}
