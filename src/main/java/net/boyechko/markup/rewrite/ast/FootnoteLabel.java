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

/** The label of a footnote definition or reference. */
public sealed interface FootnoteLabel
        permits FootnoteLabel.Autonumber,
                FootnoteLabel.Autosymbol,
                FootnoteLabel.NumericLabel,
                FootnoteLabel.AutonumberLabel {

    Autonumber AUTONUMBER = new Autonumber();
    Autosymbol AUTOSYMBOL = new Autosymbol();

    /** Label text as it appears in the source, used in messages. */
    String display();

    record Autonumber() implements FootnoteLabel {
        @Override
        public String display() {
            return "#";
        }
    }

    record Autosymbol() implements FootnoteLabel {
        @Override
        public String display() {
            return "*";
        }
    }

    record NumericLabel(int number) implements FootnoteLabel {
        @Override
        public String display() {
            return Integer.toString(number);
        }
    }

    record AutonumberLabel(String label) implements FootnoteLabel {
        @Override
        public String display() {
            return label;
        }
    }
}
