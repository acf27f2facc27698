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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import org.junit.jupiter.api.Test;

class RuleRegistryTest {

    @Test
    void rejectsBuilderBeforeItsPrerequisite() {
        List<Supplier<RewriteRulesBuilder>> suppliers =
                List.of(DependentBuilder::new, PrereqBuilder::new);
        var ex = assertThrows(IllegalArgumentException.class, () -> new RuleRegistry(suppliers));
        assertTrue(
                ex.getMessage().contains("PrereqBuilder"),
                "Error should name the missing prerequisite");
    }

    @Test
    void acceptsBuilderAfterItsPrerequisite() {
        assertDoesNotThrow(
                () -> new RuleRegistry(List.of(PrereqBuilder::new, DependentBuilder::new)));
    }

    @Test
    void rejectsBuilderWithoutPhase() {
        var ex =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> new RuleRegistry(List.of(NoPhaseBuilder::new)));
        assertTrue(ex.getMessage().contains("does not declare any phase"));
    }

    @Test
    void selectsBuildersByPhaseInRegistrationOrder() {
        RuleRegistry registry =
                new RuleRegistry(List.of(PrereqBuilder::new, DependentBuilder::new));

        List<RewriteRulesBuilder> resolve = registry.buildersFor(RewritePhase.Kind.RESOLVE);
        assertEquals(2, resolve.size());
        assertInstanceOf(PrereqBuilder.class, resolve.get(0));
        assertTrue(registry.buildersFor(RewritePhase.Kind.RENDER).isEmpty());
    }

    @Test
    void filteringOutPrerequisiteIsRejected() {
        RuleRegistry registry =
                new RuleRegistry(List.of(PrereqBuilder::new, DependentBuilder::new));
        assertThrows(
                IllegalArgumentException.class, () -> registry.filter(Set.of("prereq"), Set.of()));
    }

    @Test
    void includeOnlyKeepsNamedBuilders() {
        RuleRegistry registry =
                new RuleRegistry(List.of(PrereqBuilder::new, DependentBuilder::new))
                        .filter(Set.of(), Set.of("prereq", "unknown"));
        assertEquals(1, registry.getBuilderSuppliers().size());
    }

    @Test
    void renderPhaseRequiresFormat() {
        assertThrows(IllegalArgumentException.class, () -> RewritePhase.render(" "));
        assertEquals("RENDER(html)", RewritePhase.render("html").toString());
    }

    // --- Stub builders for testing ---

    static class PrereqBuilder implements RewriteRulesBuilder {
        @Override
        public String name() {
            return "prereq";
        }

        @Override
        public String description() {
            return "";
        }

        @Override
        public Set<RewritePhase.Kind> phases() {
            return Set.of(RewritePhase.Kind.RESOLVE);
        }

        @Override
        public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
            return RewriteRules.EMPTY;
        }
    }

    static class DependentBuilder extends PrereqBuilder {
        @Override
        public String name() {
            return "dependent";
        }

        @Override
        public Set<Class<? extends RewriteRulesBuilder>> prerequisites() {
            return Set.of(PrereqBuilder.class);
        }
    }

    static class NoPhaseBuilder extends PrereqBuilder {
        @Override
        public Set<RewritePhase.Kind> phases() {
            return Set.of();
        }
    }
}
