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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.RootCursor;
import net.boyechko.markup.rewrite.ast.StaticDocument;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.ast.TargetFormats;
import net.boyechko.markup.rewrite.ast.TreeCursor;
import net.boyechko.markup.rewrite.config.Config;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All link targets of a tree root, indexed by scope and selector.
 *
 * <ul>
 *   <li>A document scope holds every target of that document.
 *   <li>A tree scope holds the id and link definition targets of all documents in the tree and its
 *       sub-trees, plus the link targets configured for the tree.
 *   <li>The root scope also holds every path target, including static documents.
 * </ul>
 */
public class TreeTargets {
    private static final Logger logger = LoggerFactory.getLogger(TreeTargets.class);

    private final Map<Path, Map<Selector, TargetResolver>> scopes = new HashMap<>();

    public TreeTargets(RootCursor root) {
        Map<Path, DocumentTargets> documents = new LinkedHashMap<>();
        for (DocumentCursor doc : root.allDocuments()) {
            DocumentTargets targets = new DocumentTargets(doc.target(), doc.targetFormats());
            documents.put(doc.path(), targets);
            scopes.put(doc.path(), documentScope(targets, doc));
        }

        addTreeScopes(root.tree(), documents);

        Map<Selector, TargetResolver> rootScope =
                scopes.computeIfAbsent(Path.ROOT, p -> new LinkedHashMap<>());
        for (DocumentTargets targets : documents.values()) {
            for (TargetResolver target : targets.targets()) {
                if (target.selector() instanceof PathSelector) {
                    rootScope.putIfAbsent(target.selector(), target);
                }
            }
        }
        for (StaticDocument doc : root.target().staticDocuments()) {
            rootScope.putIfAbsent(
                    new PathSelector(doc.path()),
                    TargetResolver.create(
                            new PathSelector(doc.path()),
                            ReferenceResolver.internalLink(doc.path()),
                            TargetReplacer.REMOVE_TARGET,
                            doc.formats()));
        }
        logger.debug(
                "Collected link targets of {} documents and {} static documents",
                documents.size(),
                root.target().staticDocuments().size());
    }

    public Optional<TargetResolver> select(Path scope, Selector selector) {
        Map<Selector, TargetResolver> targets = scopes.get(scope);
        return targets == null ? Optional.empty() : Optional.ofNullable(targets.get(selector));
    }

    /** Looks up a unique selector in the scopes of {@code order}, returning the first match. */
    public Optional<TargetResolver> selectRecursive(
            DocumentCursor cursor, UniqueSelector selector, List<LookupScope> order) {
        for (LookupScope scope : order) {
            Optional<TargetResolver> found = selectIn(cursor, selector, scope);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private Optional<TargetResolver> selectIn(
            DocumentCursor cursor, UniqueSelector selector, LookupScope scope) {
        switch (scope) {
            case DOCUMENT:
                return select(cursor.path(), selector);
            case TREE:
                return select(cursor.parent().path(), selector);
            default:
                Optional<TreeCursor> ancestor = cursor.parent().parent();
                while (ancestor.isPresent()) {
                    Optional<TargetResolver> found = select(ancestor.get().path(), selector);
                    if (found.isPresent()) return found;
                    ancestor = ancestor.get().parent();
                }
                return Optional.empty();
        }
    }

    private Map<Selector, TargetResolver> documentScope(
            DocumentTargets targets, DocumentCursor doc) {
        Map<Selector, TargetResolver> scope = new LinkedHashMap<>();
        for (TargetResolver target : targets.targets()) {
            scope.putIfAbsent(target.selector(), target);
        }
        addConfiguredTargets(scope, doc.target().config(), doc.path());
        return scope;
    }

    private List<TargetResolver> addTreeScopes(
            TreeCursor tree, Map<Path, DocumentTargets> documents) {
        List<TargetResolver> collected = new ArrayList<>();
        for (DocumentCursor doc : tree.documents()) {
            for (TargetResolver target : documents.get(doc.path()).targets()) {
                Selector selector = target.selector();
                if (selector instanceof TargetIdSelector
                        || selector instanceof LinkDefinitionSelector) {
                    collected.add(target);
                }
            }
        }
        for (TreeCursor sub : tree.subtrees()) {
            collected.addAll(addTreeScopes(sub, documents));
        }

        Map<Selector, List<TargetResolver>> bySelector = new LinkedHashMap<>();
        for (TargetResolver target : collected) {
            bySelector.computeIfAbsent(target.selector(), s -> new ArrayList<>()).add(target);
        }
        Map<Selector, TargetResolver> scope =
                scopes.computeIfAbsent(tree.path(), p -> new LinkedHashMap<>());
        for (Map.Entry<Selector, List<TargetResolver>> entry : bySelector.entrySet()) {
            List<TargetResolver> group = entry.getValue();
            scope.put(
                    entry.getKey(),
                    group.size() == 1
                            ? group.get(0)
                            : TargetResolver.forTreeSelector(
                                    (UniqueSelector) entry.getKey(), tree.path(), group));
        }
        addConfiguredTargets(scope, tree.config(), tree.path());
        return collected;
    }

    /** Adds the targets of {@link ConfigKeys#LINK_TARGETS} not already defined in markup. */
    private static void addConfiguredTargets(
            Map<Selector, TargetResolver> scope, Config config, Path location) {
        Map<String, Object> configured;
        try {
            configured = config.getMap(ConfigKeys.LINK_TARGETS);
        } catch (ConfigException e) {
            logger.warn("{} in {}, ignoring configured link targets", e.getMessage(), location);
            return;
        }
        for (Map.Entry<String, Object> entry : configured.entrySet()) {
            LinkDefinitionSelector selector = new LinkDefinitionSelector(entry.getKey());
            if (scope.containsKey(selector)) continue;
            Target target = Target.parse(String.valueOf(entry.getValue()));
            scope.put(
                    selector,
                    DocumentTargets.linkDefinitionResolver(
                            selector, target, null, TargetFormats.ALL));
        }
    }
}
