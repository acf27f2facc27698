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
import java.util.stream.Collectors;

/** An element that contains spans. Implemented by both blocks (paragraphs) and spans (links). */
public interface SpanContainer extends Element {

    List<Span> content();

    @Override
    default List<? extends Element> children() {
        return content();
    }

    /** Concatenates the text of all nested {@link TextContainer}s. */
    default String extractText() {
        return content().stream().map(SpanContainer::textOf).collect(Collectors.joining());
    }

    static String textOf(Span span) {
        if (span instanceof SectionNumber) return "";
        if (span instanceof TextContainer text) return text.text();
        if (span instanceof SpanContainer container) return container.extractText();
        return "";
    }
}
