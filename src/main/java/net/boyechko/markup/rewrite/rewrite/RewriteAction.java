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
package net.boyechko.markup.rewrite.rewrite;

/** The outcome of applying a rule to one element. */
public sealed interface RewriteAction<T>
        permits RewriteAction.Retain, RewriteAction.Replace, RewriteAction.Remove {

    record Retain<T>() implements RewriteAction<T> {
        private static final Retain<Object> INSTANCE = new Retain<>();
    }

    record Replace<T>(T element) implements RewriteAction<T> {}

    record Remove<T>() implements RewriteAction<T> {
        private static final Remove<Object> INSTANCE = new Remove<>();
    }

    @SuppressWarnings("unchecked")
    static <T> RewriteAction<T> retain() {
        return (RewriteAction<T>) Retain.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    static <T> RewriteAction<T> remove() {
        return (RewriteAction<T>) Remove.INSTANCE;
    }

    static <T> RewriteAction<T> replace(T element) {
        return new Replace<>(element);
    }
}
