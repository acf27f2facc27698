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

/**
 * An internal target with its absolute path, the path relative to the referencing document and
 * the output formats the target document is rendered to.
 */
public record ResolvedInternalTarget(
        Path absolutePath, RelativePath relativePath, TargetFormats internalFormats)
        implements Target {

    public static ResolvedInternalTarget of(
            Path absolutePath, Path refPath, TargetFormats internalFormats) {
        return new ResolvedInternalTarget(
                absolutePath, relativePathOf(absolutePath, refPath), internalFormats);
    }

    static RelativePath relativePathOf(Path absolutePath, Path refPath) {
        if (absolutePath.withoutFragment().equals(refPath)) {
            return RelativePath.currentDocument(absolutePath.fragment().orElse(null));
        }
        return absolutePath.relativeTo(refPath.parent());
    }

    /** Recomputes the relative path for a link placed in the document at {@code refPath}. */
    public ResolvedInternalTarget relativeTo(Path refPath) {
        return new ResolvedInternalTarget(
                absolutePath, relativePathOf(absolutePath, refPath), internalFormats);
    }

    public ResolvedInternalTarget withInternalFormats(TargetFormats formats) {
        return new ResolvedInternalTarget(absolutePath, relativePath, formats);
    }
}
