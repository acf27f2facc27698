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

import java.util.List;
import net.boyechko.markup.rewrite.ast.DocumentTreeRoot;
import net.boyechko.markup.rewrite.config.Config;

/**
 * One variant of the documentation: the configuration with a single choice selected in each
 * separated selection, plus the names of the selected choices to tell the variants apart.
 */
public record ChoiceCombination(Config config, List<String> classifiers) {

    public ChoiceCombination {
        classifiers = List.copyOf(classifiers);
    }

    /** The classifiers joined with dashes, as appended to artifact names. */
    public String classifier() {
        return String.join("-", classifiers);
    }

    public DocumentTreeRoot applyTo(DocumentTreeRoot root) {
        return root.withConfig(config);
    }
}
