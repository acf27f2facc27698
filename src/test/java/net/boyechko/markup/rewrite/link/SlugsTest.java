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
package net.boyechko.markup.rewrite.link;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SlugsTest {

    @ParameterizedTest
    @CsvSource({
        "Getting Started, getting-started",
        "'  Leading and trailing  ', leading-and-trailing",
        "Section 1.2: Details!, section-1-2-details",
        "already-slugged, already-slugged",
        "Smith2020, smith2020"
    })
    void slugsText(String text, String expected) {
        assertEquals(expected, Slugs.slug(text));
    }

    @ParameterizedTest
    @CsvSource({"__fn-1, __fn-1", "__cit-smith, __cit-smith", "My Id, my-id"})
    void slugIdKeepsGeneratedIds(String id, String expected) {
        assertEquals(expected, Slugs.slugId(id));
    }
}
