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

public record ImagePathReference(
        PathBase path, String alt, String source, String title, Options options)
        implements PathReference {

    public ImagePathReference(PathBase path, String alt, String source) {
        this(path, alt, source, null, Options.NONE);
    }

    @Override
    public Image resolve(Target target) {
        return new Image(alt, target, title, options);
    }

    @Override
    public ImagePathReference withOptions(Options newOptions) {
        return new ImagePathReference(path, alt, source, title, newOptions);
    }
}
