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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.Citation;
import net.boyechko.markup.rewrite.ast.CitationLink;
import net.boyechko.markup.rewrite.ast.CitationReference;
import net.boyechko.markup.rewrite.ast.Document;
import net.boyechko.markup.rewrite.ast.Element;
import net.boyechko.markup.rewrite.ast.Elements;
import net.boyechko.markup.rewrite.ast.Footnote;
import net.boyechko.markup.rewrite.ast.FootnoteDefinition;
import net.boyechko.markup.rewrite.ast.FootnoteLabel;
import net.boyechko.markup.rewrite.ast.FootnoteLink;
import net.boyechko.markup.rewrite.ast.FootnoteReference;
import net.boyechko.markup.rewrite.ast.Header;
import net.boyechko.markup.rewrite.ast.Image;
import net.boyechko.markup.rewrite.ast.ImageIdReference;
import net.boyechko.markup.rewrite.ast.LinkAlias;
import net.boyechko.markup.rewrite.ast.LinkDefinition;
import net.boyechko.markup.rewrite.ast.LinkIdReference;
import net.boyechko.markup.rewrite.ast.Path;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.SpanLink;
import net.boyechko.markup.rewrite.ast.Target;
import net.boyechko.markup.rewrite.ast.TargetFormats;

/**
 * Collects all elements of one document that references can point to: footnotes, citations, link
 * definitions, headers, aliases and any other element with an id. Each target gets its final id
 * here, before any reference is resolved.
 */
public class DocumentTargets {

    private static final List<String> SYMBOLS =
            List.of(
                    "*", "\u2020", "\u2021", "\u00a7", "\u00b6", "#", "\u2660", "\u2665",
                    "\u2666", "\u2663");

    private final Path path;
    private final TargetFormats formats;
    private final List<TargetResolver> targets;

    public DocumentTargets(Document document, TargetFormats formats) {
        this.path = document.path();
        this.formats = formats;
        this.targets = List.copyOf(buildTargets(collectDirectTargets(document)));
    }

    public Path path() {
        return path;
    }

    public TargetFormats formats() {
        return formats;
    }

    /** All targets of the document, with duplicates and aliases already resolved. */
    public List<TargetResolver> targets() {
        return targets;
    }

    /** The n-th symbol (zero-based): the ten symbols once, then doubled, tripled and so on. */
    static String symbol(int index) {
        return SYMBOLS.get(index % SYMBOLS.size()).repeat(index / SYMBOLS.size() + 1);
    }

    private record Collected(TargetResolver resolver, Element source) {}

    private List<Collected> collectDirectTargets(Document document) {
        List<Collected> collected = new ArrayList<>();
        int numbers = 0;
        int symbols = 0;

        for (Element element : Elements.allElements(document.content())) {
            TargetResolver resolver = null;

            if (element instanceof Citation citation) {
                resolver = citationTarget(citation);
            } else if (element instanceof FootnoteDefinition footnote) {
                FootnoteLabel label = footnote.label();
                if (label instanceof FootnoteLabel.Autosymbol) {
                    resolver =
                            footnoteTarget(
                                    "__fns-" + (symbols + 1),
                                    symbol(symbols),
                                    PositionalSelector.AUTOSYMBOL);
                    symbols++;
                } else if (label instanceof FootnoteLabel.Autonumber) {
                    numbers++;
                    resolver =
                            footnoteTarget(
                                    "__fn-" + numbers,
                                    Integer.toString(numbers),
                                    PositionalSelector.AUTONUMBER);
                } else if (label instanceof FootnoteLabel.AutonumberLabel named) {
                    numbers++;
                    String id = Slugs.slug(named.label());
                    resolver =
                            footnoteTarget(
                                    id, Integer.toString(numbers), new TargetIdSelector(id));
                } else if (label instanceof FootnoteLabel.NumericLabel numeric) {
                    String num = Integer.toString(numeric.number());
                    resolver = footnoteTarget("__fnl-" + num, num, new TargetIdSelector(num));
                }
            } else if (element instanceof LinkDefinition definition) {
                Selector selector =
                        definition.isAnonymous()
                                ? PositionalSelector.ANONYMOUS
                                : new LinkDefinitionSelector(definition.id());
                resolver =
                        linkDefinitionResolver(
                                selector, definition.target(), definition.title(), formats);
            } else if (element instanceof Header header) {
                TargetIdSelector selector = new TargetIdSelector(headerId(header));
                resolver =
                        TargetResolver.create(
                                selector,
                                ReferenceResolver.internalLink(path.withFragment(selector.id())),
                                TargetReplacer.addId(selector.id()),
                                formats,
                                10 - header.level());
            } else if (element instanceof LinkAlias alias) {
                resolver =
                        LinkAliasResolver.unresolved(
                                new TargetIdSelector(Slugs.slug(alias.id())),
                                new TargetIdSelector(Slugs.slug(alias.target())),
                                formats);
            } else if (element instanceof Block block && block.hasId()) {
                TargetIdSelector selector =
                        new TargetIdSelector(Slugs.slugId(block.options().id()));
                resolver =
                        TargetResolver.create(
                                selector,
                                ReferenceResolver.internalLink(path.withFragment(selector.id())),
                                TargetReplacer.addId(selector.id()),
                                formats);
            } else if (element instanceof Span span && span.hasId()) {
                TargetIdSelector selector =
                        new TargetIdSelector(Slugs.slugId(span.options().id()));
                resolver =
                        TargetResolver.forSpanTarget(
                                selector,
                                ReferenceResolver.internalLink(path.withFragment(selector.id())),
                                formats);
            }

            if (resolver != null) collected.add(new Collected(resolver, element));
        }
        return collected;
    }

    /** The id of a header: its own id if it already has one, a slug of its text otherwise. */
    public static String headerId(Header header) {
        return header.hasId()
                ? Slugs.slugId(header.options().id())
                : Slugs.slug(header.extractText());
    }

    private TargetResolver citationTarget(Citation citation) {
        TargetIdSelector selector = new TargetIdSelector(Slugs.slug(citation.label()));
        String docId = Slugs.GENERATED_PREFIX + "cit-" + selector.id();
        ReferenceResolver resolver =
                source -> {
                    if (source.span() instanceof CitationReference ref) {
                        return Optional.of(
                                new CitationLink(selector.id(), ref.label(), ref.options()));
                    }
                    return Optional.empty();
                };
        TargetReplacer replacer =
                block -> {
                    if (!(block instanceof Citation c)) return Optional.empty();
                    if (Objects.equals(c.options().id(), docId)) return Optional.of(c);
                    return Optional.of(c.withId(docId));
                };
        return TargetResolver.create(selector, resolver, replacer, formats);
    }

    private TargetResolver footnoteTarget(String docId, String displayLabel, Selector selector) {
        ReferenceResolver resolver =
                source -> {
                    if (source.span() instanceof FootnoteReference ref) {
                        return Optional.of(new FootnoteLink(docId, displayLabel, ref.options()));
                    }
                    return Optional.empty();
                };
        TargetReplacer replacer =
                block -> {
                    if (!(block instanceof FootnoteDefinition f)) return Optional.empty();
                    return Optional.of(
                            new Footnote(displayLabel, f.content(), f.options().withId(docId)));
                };
        return TargetResolver.create(selector, resolver, replacer, formats);
    }

    /** Resolves link id and image id references to the target of a link definition. */
    static TargetResolver linkDefinitionResolver(
            Selector selector, Target target, String title, TargetFormats formats) {
        ReferenceResolver resolver =
                source -> {
                    Span span = source.span();
                    if (span instanceof LinkIdReference ref) {
                        return Optional.of(
                                new SpanLink(
                                        ref.content(),
                                        ReferenceResolver.resolveTarget(target, source.path()),
                                        title,
                                        ref.options()));
                    }
                    if (span instanceof ImageIdReference ref) {
                        return Optional.of(
                                new Image(
                                        ref.text(),
                                        ReferenceResolver.resolveTarget(target, source.path()),
                                        title,
                                        ref.options()));
                    }
                    return Optional.empty();
                };
        return TargetResolver.create(selector, resolver, TargetReplacer.REMOVE_TARGET, formats);
    }

    private List<TargetResolver> buildTargets(List<Collected> direct) {
        Map<Selector, List<Collected>> bySelector = new LinkedHashMap<>();
        for (Collected c : direct) {
            bySelector.computeIfAbsent(c.resolver().selector(), s -> new ArrayList<>()).add(c);
        }

        Map<Selector, TargetResolver> grouped = new LinkedHashMap<>();
        List<String> renumberedIds = new ArrayList<>();
        for (Map.Entry<Selector, List<Collected>> entry : bySelector.entrySet()) {
            Selector selector = entry.getKey();
            List<Collected> group = entry.getValue();
            List<TargetResolver> resolvers = group.stream().map(Collected::resolver).toList();
            if (selector instanceof PositionalSelector positional) {
                grouped.put(selector, new TargetSequenceResolver(resolvers, positional));
            } else if (resolvers.size() == 1) {
                grouped.put(selector, resolvers.get(0));
            } else {
                boolean allHeaders = group.stream().allMatch(c -> c.source() instanceof Header);
                if (allHeaders && selector instanceof TargetIdSelector id) {
                    for (int i = 1; i <= group.size(); i++) {
                        renumberedIds.add(id.id() + "-" + i);
                    }
                }
                grouped.put(
                        selector,
                        TargetResolver.forDuplicateSelector(
                                (UniqueSelector) selector,
                                path,
                                resolvers,
                                allHeaders,
                                selector instanceof LinkDefinitionSelector));
            }
        }

        List<TargetResolver> resolved = new ArrayList<>();
        for (TargetResolver target : grouped.values()) {
            if (target instanceof LinkAliasResolver alias) {
                resolved.add(resolveAlias(alias, grouped));
            } else {
                resolved.add(target);
            }
        }

        List<TargetResolver> all = new ArrayList<>(resolved);
        for (TargetResolver target : resolved) {
            if (target.selector() instanceof TargetIdSelector id) {
                all.add(
                        TargetResolver.forDelegate(
                                new PathSelector(path.withFragment(id.id())), target));
            }
        }
        for (String id : renumberedIds) {
            Path target = path.withFragment(id);
            all.add(
                    TargetResolver.create(
                            new PathSelector(target),
                            ReferenceResolver.internalLink(target),
                            TargetReplacer.REMOVE_TARGET,
                            formats));
        }
        all.add(
                TargetResolver.create(
                        new PathSelector(path),
                        ReferenceResolver.internalLink(path),
                        TargetReplacer.REMOVE_TARGET,
                        formats));
        return all;
    }

    /** Follows a chain of aliases to the first target that is not an alias. */
    static LinkAliasResolver resolveAlias(
            LinkAliasResolver alias, Map<Selector, TargetResolver> targets) {
        Set<TargetIdSelector> visited = new HashSet<>();
        visited.add(alias.sourceSelector());
        TargetIdSelector current = alias.targetSelector();
        while (true) {
            if (visited.contains(current)) return alias.circularReference();
            TargetResolver next = targets.get(current);
            if (next == null) return alias;
            if (next instanceof LinkAliasResolver chained) {
                visited.add(current);
                current = chained.targetSelector();
            } else {
                return alias.resolveWith(next::resolveReference);
            }
        }
    }
}
