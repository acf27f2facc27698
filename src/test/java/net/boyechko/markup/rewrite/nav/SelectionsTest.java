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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import org.junit.jupiter.api.Test;

class SelectionsTest {

    private static final String CONFIG_AND_LANGUAGE =
            "laika:\n"
                    + "  selections:\n"
                    + "    - name: config\n"
                    + "      separateEbooks: true\n"
                    + "      choices:\n"
                    + "        - {name: sbt, label: sbt}\n"
                    + "        - {name: library, label: Library API}\n"
                    + "    - name: lang\n"
                    + "      choices:\n"
                    + "        - {name: java, label: Java, selected: true}\n"
                    + "        - {name: scala, label: Scala}\n";

    @Test
    void readsSelectionsFromConfig() {
        Selections selections = Selections.fromConfig(Config.fromYaml(CONFIG_AND_LANGUAGE));

        assertEquals(2, selections.selections().size());
        SelectionConfig config = selections.getSelection("config").orElseThrow();
        assertTrue(config.separateEbooks());
        assertEquals("Library API", config.choices().get(1).label());
        assertTrue(config.selectedChoice().isEmpty());
        SelectionConfig lang = selections.getSelection("lang").orElseThrow();
        assertEquals("java", lang.selectedChoice().orElseThrow().name());
        assertEquals(List.of("java"), selections.getClassifiers());
    }

    @Test
    void missingSelectionsAreEmpty() {
        assertSame(Selections.EMPTY, Selections.fromConfig(Config.EMPTY));
    }

    @Test
    void selectionWithoutChoicesIsRejected() {
        Config config = Config.fromYaml("laika:\n  selections:\n    - name: broken\n");
        var ex = assertThrows(ConfigException.class, () -> Selections.fromConfig(config));
        assertEquals("Selection broken has no choices", ex.getMessage());
    }

    @Test
    void selectDeselectsOtherChoices() {
        SelectionConfig selection =
                new SelectionConfig(
                        "lang",
                        new ChoiceConfig("java", "Java", true),
                        new ChoiceConfig("scala", "Scala"));

        SelectionConfig switched = selection.select(new ChoiceConfig("scala", "Scala"));

        assertEquals("scala", switched.selectedChoice().orElseThrow().name());
        assertFalse(switched.choices().get(0).selected());
    }

    @Test
    void emptyChoicesAreRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SelectionConfig("empty", List.of(), false));
    }

    @Test
    void withoutSeparatedSelectionsConfigIsKept() {
        Config config =
                Config.fromYaml(
                        "laika:\n"
                                + "  selections:\n"
                                + "    - name: lang\n"
                                + "      choices:\n"
                                + "        - {name: java, label: Java, selected: true}\n");

        List<ChoiceCombination> combinations = Selections.createChoiceCombinations(config);

        assertEquals(1, combinations.size());
        assertSame(config, combinations.get(0).config());
        assertEquals(List.of("java"), combinations.get(0).classifiers());
    }

    @Test
    void createsOneCombinationPerSeparatedChoice() {
        List<ChoiceCombination> combinations =
                Selections.createChoiceCombinations(Config.fromYaml(CONFIG_AND_LANGUAGE));

        assertEquals(2, combinations.size());
        assertEquals("sbt-java", combinations.get(0).classifier());
        assertEquals("library-java", combinations.get(1).classifier());

        Selections second = Selections.fromConfig(combinations.get(1).config());
        SelectionConfig config = second.getSelection("config").orElseThrow();
        assertEquals("library", config.selectedChoice().orElseThrow().name());
        assertFalse(config.choices().get(0).selected());
        assertEquals(
                "java",
                second.getSelection("lang").orElseThrow().selectedChoice().orElseThrow().name());
    }

    @Test
    void firstSeparatedSelectionVariesSlowest() {
        Config config =
                Config.fromYaml(
                        "laika:\n"
                                + "  selections:\n"
                                + "    - name: build\n"
                                + "      separateEbooks: true\n"
                                + "      choices: [{name: sbt}, {name: maven}]\n"
                                + "    - name: lang\n"
                                + "      separateEbooks: true\n"
                                + "      choices: [{name: java}, {name: scala}]\n");

        List<String> classifiers =
                Selections.createChoiceCombinations(config).stream()
                        .map(ChoiceCombination::classifier)
                        .toList();

        assertEquals(List.of("sbt-java", "sbt-scala", "maven-java", "maven-scala"), classifiers);
    }

    @Test
    void choiceLabelDefaultsToName() {
        Config config =
                Config.fromYaml(
                        "laika:\n  selections:\n    - name: lang\n      choices: [{name: java}]\n");
        ChoiceConfig choice =
                Selections.fromConfig(config).getSelection("lang").orElseThrow().choices().get(0);
        assertEquals("java", choice.label());
    }
}
