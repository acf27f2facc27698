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
package net.boyechko.markup.rewrite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.markup.rewrite.link.LinkResolver;
import net.boyechko.markup.rewrite.link.LinkTranslator;
import net.boyechko.markup.rewrite.nav.FormatFilter;
import net.boyechko.markup.rewrite.nav.SectionBuilder;
import net.boyechko.markup.rewrite.nav.UnresolvedNodeDetector;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;
import net.boyechko.markup.rewrite.validation.ElementVisitor;
import net.boyechko.markup.rewrite.validation.InvalidElementVisitor;
import net.boyechko.markup.rewrite.validation.UnresolvedReferenceVisitor;

public final class ProcessingDefaults {
    private ProcessingDefaults() {}

    /** The built-in rule builders, in the order they have to run within a phase. */
    public static List<Supplier<RewriteRulesBuilder>> builderSuppliers() {
        List<Supplier<RewriteRulesBuilder>> suppliers = new ArrayList<>();
        suppliers.add(LinkResolver::new);
        suppliers.add(SectionBuilder::new);
        suppliers.add(FormatFilter::new);
        suppliers.add(LinkTranslator::new);
        suppliers.add(UnresolvedNodeDetector::new);
        return suppliers;
    }

    public static List<Supplier<ElementVisitor>> visitorSuppliers() {
        List<Supplier<ElementVisitor>> suppliers = new ArrayList<>();
        suppliers.add(InvalidElementVisitor::new);
        suppliers.add(UnresolvedReferenceVisitor::new);
        return suppliers;
    }
}
