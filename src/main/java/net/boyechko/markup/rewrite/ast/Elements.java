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

import java.util.ArrayList;
import java.util.List;

/** Static helpers for reading element trees. */
public final class Elements {
    private Elements() {}

    /** All elements below and including {@code root}, parents before their children. */
    public static List<Element> allElements(Element root) {
        List<Element> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    public static <T> List<T> collect(Element root, Class<T> type) {
        return allElements(root).stream().filter(type::isInstance).map(type::cast).toList();
    }

    private static void collect(Element element, List<Element> out) {
        out.add(element);
        for (Element child : element.children()) {
            collect(child, out);
        }
    }
}
