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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.ast.StaticDocument;
import net.boyechko.markup.rewrite.config.ConfigKeys;

/** Finds the documents and static files of a tree root by path. */
public class TargetLookup {

    private final Map<Path, TranslatorSpec> specs = new HashMap<>();

    public TargetLookup(RootCursor root) {
        for (DocumentCursor doc : root.allDocuments()) {
            boolean versioned = doc.config().getBoolean(ConfigKeys.VERSIONED).orElse(false);
            specs.put(doc.path(), new TranslatorSpec(false, versioned));
        }
        for (StaticDocument doc : root.target().staticDocuments()) {
            boolean versioned =
                    root.selectTreeConfig(doc.path().parent())
                            .getBoolean(ConfigKeys.VERSIONED)
                            .orElse(false);
            specs.putIfAbsent(doc.path(), new TranslatorSpec(true, versioned));
        }
    }

    /** The translator spec of the document or static file at {@code path}, ignoring fragments. */
    public Optional<TranslatorSpec> translatorSpec(Path path) {
        return Optional.ofNullable(specs.get(path.withoutFragment()));
    }
}
