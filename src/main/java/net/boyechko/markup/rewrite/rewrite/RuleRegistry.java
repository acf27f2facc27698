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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered set of rule builders applied to a tree. Builders are registered as suppliers so that
 * every transformation works on fresh instances.
 */
public class RuleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RuleRegistry.class);

    private final List<Supplier<RewriteRulesBuilder>> builderSuppliers;

    public RuleRegistry(List<Supplier<RewriteRulesBuilder>> builderSuppliers) {
        this.builderSuppliers = List.copyOf(builderSuppliers);
        validateBuilders();
    }

    private void validateBuilders() {
        Set<Class<? extends RewriteRulesBuilder>> seen = new HashSet<>();
        for (Supplier<RewriteRulesBuilder> supplier : builderSuppliers) {
            RewriteRulesBuilder builder = supplier.get();
            if (builder == null) {
                throw new IllegalStateException("Rule builder supplier returned null");
            }
            if (builder.phases().isEmpty()) {
                throw new IllegalArgumentException(
                        builder.getClass().getSimpleName() + " does not declare any phase");
            }
            for (Class<? extends RewriteRulesBuilder> prereq : builder.prerequisites()) {
                if (!seen.contains(prereq)) {
                    throw new IllegalArgumentException(
                            builder.getClass().getSimpleName()
                                    + " requires "
                                    + prereq.getSimpleName()
                                    + " to run first, but it has not been registered"
                                    + " or appears later in the builder list");
                }
            }
            seen.add(builder.getClass());
        }
    }

    public List<Supplier<RewriteRulesBuilder>> getBuilderSuppliers() {
        return builderSuppliers;
    }

    /** Fresh builder instances in registration order. */
    public List<RewriteRulesBuilder> instantiate() {
        List<RewriteRulesBuilder> builders = new ArrayList<>(builderSuppliers.size());
        for (Supplier<RewriteRulesBuilder> supplier : builderSuppliers) {
            builders.add(supplier.get());
        }
        return builders;
    }

    /** Fresh builders that contribute to the given phase, in registration order. */
    public List<RewriteRulesBuilder> buildersFor(RewritePhase.Kind phase) {
        return instantiate().stream().filter(b -> b.phases().contains(phase)).toList();
    }

    /**
     * Returns a registry without the builders named in {@code skip}. When {@code includeOnly} is
     * not empty, only builders named there are kept. Unknown names are logged and ignored.
     */
    public RuleRegistry filter(Set<String> skip, Set<String> includeOnly) {
        Set<String> known = new HashSet<>();
        List<Supplier<RewriteRulesBuilder>> kept = new ArrayList<>();
        for (Supplier<RewriteRulesBuilder> supplier : builderSuppliers) {
            String name = supplier.get().name();
            known.add(name);
            boolean included = includeOnly.isEmpty() || includeOnly.contains(name);
            if (included && !skip.contains(name)) {
                kept.add(supplier);
            }
        }
        Set<String> requested = new HashSet<>(skip);
        requested.addAll(includeOnly);
        requested.removeAll(known);
        for (String unknown : requested) {
            logger.warn("Unknown rule builder: {}", unknown);
        }
        return new RuleRegistry(kept);
    }
}
