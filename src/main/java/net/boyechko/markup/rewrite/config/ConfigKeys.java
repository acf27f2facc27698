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
package net.boyechko.markup.rewrite.config;

/** Keys of the configuration values the rewrite rules read. */
public final class ConfigKeys {
    private ConfigKeys() {}

    public static final String AUTONUMBERING_SCOPE = "laika.autonumbering.scope";
    public static final String AUTONUMBERING_DEPTH = "laika.autonumbering.depth";
    public static final String FIRST_HEADER_AS_TITLE = "laika.firstHeaderAsTitle";
    public static final String SITE_BASE_URL = "laika.siteBaseURL";

    public static final String LINK_TARGETS = "laika.links.targets";
    public static final String LINK_VALIDATION = "laika.links.validation";
    public static final String LINK_VALIDATION_EXCLUDED = "laika.links.excludeFromValidation";
    public static final String LINK_LOOKUP_ORDER = "laika.links.lookupOrder";

    public static final String VERSIONS = "laika.versions";
    public static final String VERSIONED = "laika.versioned";
    public static final String TARGET_FORMATS = "laika.targetFormats";
    public static final String SELECTIONS = "laika.selections";
}
