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
 * A path relative to a document's directory: a number of parent levels followed by segments, as
 * in {@code ../tree-2/doc-5.md#intro}. A path without levels and segments but with a fragment
 * points into the current document.
 */
public final class RelativePath implements PathBase {

    public static final RelativePath CURRENT = new RelativePath(0, List.of(), null);

    private final int parentLevels;
    private final List<String> segments;
    private final String fragment;

    private RelativePath(int parentLevels, List<String> segments, String fragment) {
        this.parentLevels = parentLevels;
        this.segments = List.copyOf(segments);
        this.fragment = fragment;
    }

    public static RelativePath of(int parentLevels, List<String> segments, String fragment) {
        return new RelativePath(parentLevels, segments, fragment);
    }

    public static RelativePath of(String... segments) {
        return new RelativePath(0, Arrays.asList(segments), null);
    }

    public static RelativePath parent(int levels) {
        return new RelativePath(levels, List.of(), null);
    }

    public static RelativePath currentDocument(String fragment) {
        return new RelativePath(0, List.of(), fragment);
    }

    /** Parses a relative path; leading {@code ../} sequences become parent levels. */
    public static RelativePath parse(String str) {
        String rest = Path.stripSlashes(str);
        if (rest.isEmpty() || rest.equals(".")) return CURRENT;
        if (rest.startsWith("#")) return currentDocument(rest.substring(1));
        int levels = 0;
        while (rest.startsWith("..")) {
            levels++;
            rest = rest.substring(2);
            if (rest.startsWith("/")) rest = rest.substring(1);
        }
        if (rest.isEmpty()) return parent(levels);
        List<String> parts = new ArrayList<>(Arrays.asList(rest.split("/")));
        String last = parts.remove(parts.size() - 1);
        String fragment = null;
        int hash = last.indexOf('#');
        if (hash >= 0) {
            fragment = last.substring(hash + 1);
            last = last.substring(0, hash);
        }
        parts.add(last);
        return new RelativePath(levels, parts, fragment);
    }

    public int parentLevels() {
        return parentLevels;
    }

    public List<String> segments() {
        return segments;
    }

    /** Whether this path points into the current document (only a fragment, or nothing). */
    public boolean isCurrentDocument() {
        return parentLevels == 0 && segments.isEmpty();
    }

    @Override
    public String name() {
        if (!segments.isEmpty()) return segments.get(segments.size() - 1);
        return parentLevels == 0 ? "." : "../".repeat(parentLevels);
    }

    public String basename() {
        return segments.isEmpty() ? name() : PathBase.basenameOf(name());
    }

    @Override
    public Optional<String> suffix() {
        return segments.isEmpty() ? Optional.empty() : PathBase.suffixOf(name());
    }

    @Override
    public Optional<String> fragment() {
        return Optional.ofNullable(fragment);
    }

    /** Appends {@code other}, consuming this path's segments for each of its parent levels. */
    public RelativePath resolve(RelativePath other) {
        int dropped = Math.min(segments.size(), other.parentLevels);
        int newLevels = parentLevels + Math.max(0, other.parentLevels - segments.size());
        List<String> newSegments = new ArrayList<>(segments.subList(0, segments.size() - dropped));
        newSegments.addAll(other.segments);
        String newFragment = other.fragment;
        if (other.isCurrentDocument() && other.fragment == null) newFragment = fragment;
        return new RelativePath(newLevels, newSegments, newFragment);
    }

    public RelativePath withSuffix(String newSuffix) {
        if (segments.isEmpty() || suffix().filter(newSuffix::equals).isPresent()) return this;
        return withName(basename() + "." + newSuffix);
    }

    public RelativePath withoutSuffix() {
        if (suffix().isEmpty()) return this;
        return withName(basename());
    }

    public RelativePath withFragment(String newFragment) {
        return new RelativePath(parentLevels, segments, newFragment);
    }

    public RelativePath withoutFragment() {
        return fragment == null ? this : new RelativePath(parentLevels, segments, null);
    }

    private RelativePath withName(String newName) {
        List<String> newSegments = new ArrayList<>(segments);
        newSegments.set(newSegments.size() - 1, newName);
        return new RelativePath(parentLevels, newSegments, fragment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelativePath other)) return false;
        return parentLevels == other.parentLevels
                && segments.equals(other.segments)
                && Objects.equals(fragment, other.fragment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentLevels, segments, fragment);
    }

    @Override
    public String toString() {
        String frag = fragment != null ? "#" + fragment : "";
        if (segments.isEmpty()) {
            if (parentLevels == 0) return fragment != null ? frag : ".";
            return "../".repeat(parentLevels) + frag;
        }
        return "../".repeat(parentLevels) + String.join("/", segments) + frag;
    }
}
