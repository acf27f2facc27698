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

/** Derives identifiers from text. */
public final class Slugs {
    private Slugs() {}

    /** Ids generated by the resolver itself; they are already final and never slugged again. */
    public static final String GENERATED_PREFIX = "__";

    /**
     * Replaces every run of characters other than ASCII letters, digits and dashes with a single
     * dash, trims dashes at both ends and lowercases the result.
     */
    public static String slug(String text) {
        return text.replaceAll("[^a-zA-Z0-9-]+", "-")
                .replaceFirst("^-", "")
                .replaceFirst("-$", "")
                .toLowerCase();
    }

    /** Slugs an id that was set on an element, leaving generated ids untouched. */
    public static String slugId(String id) {
        return id.startsWith(GENERATED_PREFIX) ? id : slug(id);
    }
}
