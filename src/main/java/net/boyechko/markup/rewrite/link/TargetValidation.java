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
package net.boyechko.markup.rewrite.link;

import net.boyechko.markup.rewrite.ast.ResolvedInternalTarget;

/** The outcome of validating an internal link target. */
public sealed interface TargetValidation
        permits TargetValidation.ValidTarget,
                TargetValidation.InvalidTarget,
                TargetValidation.RecoveredTarget {

    ValidTarget VALID = new ValidTarget();

    record ValidTarget() implements TargetValidation {}

    record InvalidTarget(String message) implements TargetValidation {}

    /**
     * The target does not support all formats of the linking document, but links can switch to
     * the external form of {@code recoveredTarget} for the unsupported ones.
     */
    record RecoveredTarget(String message, ResolvedInternalTarget recoveredTarget)
            implements TargetValidation {}
}
