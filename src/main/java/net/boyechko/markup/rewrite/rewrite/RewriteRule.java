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

import java.util.List;
import java.util.function.Function;

/**
 * A local transformation of one element. Rules return {@link RewriteAction#retain()} for every
 * element they are not interested in.
 */
@FunctionalInterface
public interface RewriteRule<T> {

    RewriteAction<T> apply(T element);

    /** Adapts a function on one element type into a rule that retains all other elements. */
    static <T, E extends T> RewriteRule<T> forType(
            Class<E> type, Function<? super E, RewriteAction<T>> rule) {
        return element ->
                type.isInstance(element) ? rule.apply(type.cast(element)) : RewriteAction.retain();
    }

    /**
     * Applies the rules in order. A replacement is passed on to the following rules, a removal ends
     * the chain.
     */
    static <T> RewriteRule<T> chain(List<RewriteRule<T>> rules) {
        if (rules.isEmpty()) return element -> RewriteAction.retain();
        if (rules.size() == 1) return rules.get(0);
        List<RewriteRule<T>> copy = List.copyOf(rules);
        return element -> {
            RewriteAction<T> result = RewriteAction.retain();
            T current = element;
            for (RewriteRule<T> rule : copy) {
                RewriteAction<T> action = rule.apply(current);
                if (action instanceof RewriteAction.Remove) {
                    return action;
                }
                if (action instanceof RewriteAction.Replace<T> replace) {
                    current = replace.element();
                    result = action;
                }
            }
            return result;
        };
    }
}
