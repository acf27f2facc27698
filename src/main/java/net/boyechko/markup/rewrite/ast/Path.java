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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An absolute path inside the virtual tree of documents. The last segment may carry a fragment
 * ({@code /tree/doc.md#intro}).
 */
public final class Path implements PathBase {

    public static final Path ROOT = new Path(List.of(), null);

    private final List<String> segments;
    private final String fragment;

    private Path(List<String> segments, String fragment) {
        this.segments = List.copyOf(segments);
        this.fragment = segments.isEmpty() ? null : fragment;
    }

    public static Path of(String... segments) {
        return of(Arrays.asList(segments));
    }

    public static Path of(List<String> segments) {
        return segments.isEmpty() ? ROOT : new Path(segments, null);
    }

    /** Parses a path; the leading slash is optional. */
    public static Path parse(String str) {
        String trimmed = stripSlashes(str);
        if (trimmed.isEmpty()) return ROOT;
        List<String> parts = new ArrayList<>(Arrays.asList(trimmed.split("/")));
        String last = parts.remove(parts.size() - 1);
        String fragment = null;
        int hash = last.indexOf('#');
        if (hash >= 0) {
            fragment = last.substring(hash + 1);
            last = last.substring(0, hash);
        }
        parts.add(last);
        return new Path(parts, fragment);
    }

    static String stripSlashes(String str) {
        String s = str.startsWith("/") ? str.substring(1) : str;
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public Path parent() {
        if (segments.size() <= 1) return ROOT;
        return new Path(segments.subList(0, segments.size() - 1), null);
    }

    @Override
    public String name() {
        return segments.isEmpty() ? "/" : segments.get(segments.size() - 1);
    }

    public String basename() {
        return segments.isEmpty() ? "/" : PathBase.basenameOf(name());
    }

    @Override
    public Optional<String> suffix() {
        return segments.isEmpty() ? Optional.empty() : PathBase.suffixOf(name());
    }

    @Override
    public Optional<String> fragment() {
        return Optional.ofNullable(fragment);
    }

    public Path child(String name) {
        List<String> newSegments = new ArrayList<>(segments);
        newSegments.add(name);
        return new Path(newSegments, null);
    }

    /** Resolves a path relative to this path, interpreting this path as a directory. */
    public Path resolve(RelativePath path) {
        int keep = Math.max(0, segments.size() - path.parentLevels());
        List<String> newSegments = new ArrayList<>(segments.subList(0, keep));
        newSegments.addAll(path.segments());
        if (newSegments.isEmpty()) return ROOT;
        return new Path(newSegments, path.fragment().orElse(null));
    }

    /** Expresses this path relative to {@code base}, interpreting {@code base} as a directory. */
    public RelativePath relativeTo(Path base) {
        List<String> other = base.segments;
        int common = 0;
        while (common < other.size()
                && common < segments.size()
                && other.get(common).equals(segments.get(common))) {
            common++;
        }
        return RelativePath.of(
                other.size() - common, segments.subList(common, segments.size()), fragment);
    }

    /** Whether this path equals {@code other} or lies below it. Fragments are ignored. */
    public boolean isSubPath(Path other) {
        if (other.segments.size() > segments.size()) return false;
        return segments.subList(0, other.segments.size()).equals(other.segments);
    }

    public Path withSuffix(String newSuffix) {
        if (segments.isEmpty() || suffix().filter(newSuffix::equals).isPresent()) return this;
        return withName(basename() + "." + newSuffix);
    }

    public Path withoutSuffix() {
        if (suffix().isEmpty()) return this;
        return withName(basename());
    }

    public Path withFragment(String newFragment) {
        if (segments.isEmpty()) return this;
        return new Path(segments, newFragment);
    }

    public Path withoutFragment() {
        return fragment == null ? this : new Path(segments, null);
    }

    private Path withName(String newName) {
        List<String> newSegments = new ArrayList<>(segments);
        newSegments.set(newSegments.size() - 1, newName);
        return new Path(newSegments, fragment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Path other)) return false;
        return segments.equals(other.segments) && Objects.equals(fragment, other.fragment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments, fragment);
    }

    @Override
    public String toString() {
        return "/" + String.join("/", segments) + (fragment != null ? "#" + fragment : "");
    }
}
