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

/** Selectors matched by position: the n-th reference resolves to the n-th target. */
public enum PositionalSelector implements Selector {
    ANONYMOUS("anonymous"),
    AUTONUMBER("autonumber"),
    AUTOSYMBOL("autosymbol");

    private final String label;

    PositionalSelector(String label) {
        this.label = label;
    }

    /** Message for a reference that has no target left to consume. */
    public String surplusMessage() {
        return "too many " + label + " references";
    }
}
