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
package net.boyechko.markup.rewrite.nav;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import net.boyechko.markup.rewrite.ast.Block;
import net.boyechko.markup.rewrite.ast.DocumentCursor;
import net.boyechko.markup.rewrite.ast.Header;
import net.boyechko.markup.rewrite.ast.InvalidBlock;
import net.boyechko.markup.rewrite.ast.RootElement;
import net.boyechko.markup.rewrite.ast.Section;
import net.boyechko.markup.rewrite.ast.SectionNumber;
import net.boyechko.markup.rewrite.ast.Span;
import net.boyechko.markup.rewrite.ast.Title;
import net.boyechko.markup.rewrite.config.ConfigException;
import net.boyechko.markup.rewrite.config.ConfigKeys;
import net.boyechko.markup.rewrite.link.LinkResolver;
import net.boyechko.markup.rewrite.rewrite.RewriteAction;
import net.boyechko.markup.rewrite.rewrite.RewritePhase;
import net.boyechko.markup.rewrite.rewrite.RewriteRule;
import net.boyechko.markup.rewrite.rewrite.RewriteRules;
import net.boyechko.markup.rewrite.rewrite.RewriteRulesBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Nests the flat sequence of headers of a document into sections, turns the first header into
 * the document title and adds section numbers where configured.
 *
 * <p>Runs after {@link LinkResolver}, so headers already carry their final ids.
 */
public class SectionBuilder implements RewriteRulesBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SectionBuilder.class);

    static final String TITLE_STYLE = "title";
    static final String SECTION_STYLE = "section";

    @Override
    public String name() {
        return "section-builder";
    }

    @Override
    public String description() {
        return "Builds sections and the document title from headers";
    }

    @Override
    public Set<RewritePhase.Kind> phases() {
        return Set.of(RewritePhase.Kind.RESOLVE);
    }

    @Override
    public Set<Class<? extends RewriteRulesBuilder>> prerequisites() {
        return Set.of(LinkResolver.class);
    }

    @Override
    public RewriteRules build(DocumentCursor cursor, RewritePhase phase) {
        AutonumberConfig autonumbering;
        InvalidBlock configError = null;
        try {
            autonumbering = AutonumberConfig.fromConfig(cursor.config());
        } catch (ConfigException e) {
            logger.warn("{} in {}", e.getMessage(), cursor.path());
            autonumbering = AutonumberConfig.DISABLED;
            configError = InvalidBlock.of(e.getMessage());
        }
        boolean firstHeaderAsTitle =
                cursor.config().getBoolean(ConfigKeys.FIRST_HEADER_AS_TITLE).orElse(true);
        Sectioning sectioning =
                new Sectioning(
                        autonumbering,
                        firstHeaderAsTitle,
                        cursor.position().toList(),
                        configError);
        return RewriteRules.forBlocks(RewriteRule.forType(RootElement.class, sectioning::apply));
    }

    private static final class Sectioning {
        private final AutonumberConfig autonumbering;
        private final boolean firstHeaderAsTitle;
        private final List<Integer> documentPosition;
        private final InvalidBlock configError;

        Sectioning(
                AutonumberConfig autonumbering,
                boolean firstHeaderAsTitle,
                List<Integer> documentPosition,
                InvalidBlock configError) {
            this.autonumbering = autonumbering;
            this.firstHeaderAsTitle = firstHeaderAsTitle;
            this.documentPosition = documentPosition;
            this.configError = configError;
        }

        RewriteAction<Block> apply(RootElement root) {
            List<Block> content = root.content();
            boolean hasHeaders = content.stream().anyMatch(Header.class::isInstance);
            boolean addError = configError != null && !startsWithError(content);
            if (!hasHeaders && !addError) return RewriteAction.retain();

            List<Block> result = new ArrayList<>();
            if (addError) result.add(configError);
            result.addAll(hasHeaders ? buildSections(content) : content);
            return RewriteAction.replace(root.withContent(result));
        }

        private boolean startsWithError(List<Block> content) {
            return !content.isEmpty() && configError.equals(content.get(0));
        }

        private List<Block> buildSections(List<Block> blocks) {
            Deque<SectionBuffer> stack = new ArrayDeque<>();
            SectionBuffer rootBuffer = new SectionBuffer(null);
            stack.push(rootBuffer);
            boolean titlePending = firstHeaderAsTitle;

            for (Block block : blocks) {
                if (block instanceof Header header) {
                    if (titlePending) {
                        titlePending = false;
                        rootBuffer.content.add(title(header));
                        continue;
                    }
                    closeSections(stack, header.level());
                    stack.push(new SectionBuffer(header));
                } else {
                    stack.peek().content.add(block);
                }
            }
            closeSections(stack, 1);

            List<Integer> prefix = autonumbering.documents() ? documentPosition : List.of();
            return numberSections(rootBuffer.content, prefix);
        }

        private static void closeSections(Deque<SectionBuffer> stack, int level) {
            while (stack.size() > 1 && stack.peek().header.level() >= level) {
                SectionBuffer closed = stack.pop();
                stack.peek().content.add(closed.build());
            }
        }

        private Title title(Header header) {
            List<Span> content = header.content();
            if (autonumbering.documents() && !documentPosition.isEmpty()) {
                content = prepend(new SectionNumber(documentPosition), content);
            }
            return new Title(content, header.options().withStyle(TITLE_STYLE));
        }

        private List<Block> numberSections(List<Block> blocks, List<Integer> parentNumber) {
            List<Block> result = new ArrayList<>(blocks.size());
            int index = 0;
            for (Block block : blocks) {
                if (block instanceof Section section) {
                    index++;
                    List<Integer> number = new ArrayList<>(parentNumber);
                    number.add(index);
                    Header header = section.header();
                    if (autonumbering.sections() && number.size() <= autonumbering.maxDepth()) {
                        header =
                                header.withContent(
                                        prepend(new SectionNumber(number), header.content()));
                    }
                    result.add(
                            new Section(
                                    header,
                                    numberSections(section.content(), number),
                                    section.options()));
                } else {
                    result.add(block);
                }
            }
            return result;
        }

        private static List<Span> prepend(Span first, List<Span> rest) {
            List<Span> spans = new ArrayList<>(rest.size() + 1);
            spans.add(first);
            spans.addAll(rest);
            return spans;
        }
    }

    private static final class SectionBuffer {
        private final Header header;
        private final List<Block> content = new ArrayList<>();

        SectionBuffer(Header header) {
            this.header = header;
        }

        Section build() {
            Header styled = header.withOptions(header.options().withStyle(SECTION_STYLE));
            return new Section(styled, content);
        }
    }
}
