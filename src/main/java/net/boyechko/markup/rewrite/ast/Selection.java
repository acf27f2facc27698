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
import java.util.List;

/** Alternative versions of the same content, for example code samples in different languages. */
public record Selection(String name, List<Choice> choices, Options options) implements Block {

    public Selection {
        choices = List.copyOf(choices);
    }

    public Selection(String name, List<Choice> choices) {
        this(name, choices, Options.NONE);
    }

    @Override
    public List<? extends Element> children() {
        List<Element> all = new ArrayList<>();
        choices.forEach(c -> all.addAll(c.content()));
        return all;
    }

    @Override
    public Selection withOptions(Options newOptions) {
        return new Selection(name, choices, newOptions);
    }

    @Override
    public Block rewriteChildren(ElementRewriter rewriter) {
        boolean changed = false;
        List<Choice> rewritten = new ArrayList<>(choices.size());
        for (Choice choice : choices) {
            List<Block> content = rewriter.rewriteBlocks(choice.content());
            if (content != choice.content()) {
                changed = true;
                rewritten.add(choice.withContent(content));
            } else {
                rewritten.add(choice);
            }
        }
        return changed ? new Selection(name, rewritten, options) : this;
    }
}
