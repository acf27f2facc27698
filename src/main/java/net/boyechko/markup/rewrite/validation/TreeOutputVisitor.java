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
package net.boyechko.markup.rewrite.validation;

import java.util.function.Consumer;
import net.boyechko.markup.rewrite.ast.TextContainer;
import net.boyechko.markup.rewrite.issues.IssueList;

/** Outputs a tabular listing of the element tree of each document during traversal. */
public class TreeOutputVisitor implements ElementVisitor {

    private static final String INDENT = "  ";
    private static final int INDEX_WIDTH = 5;
    private static final int ELEMENT_NAME_WIDTH = 40;
    private static final int ID_WIDTH = 20;
    private static final int CONTENT_SUMMARY_WIDTH = 30;

    private static final String ROW_FORMAT =
            String.format("%%-%ds %%-%ds %%-%ds %%s", INDEX_WIDTH, ELEMENT_NAME_WIDTH, ID_WIDTH);

    private final Consumer<String> output;
    private boolean headerPrinted = false;

    public TreeOutputVisitor(Consumer<String> output) {
        this.output = output;
    }

    @Override
    public String name() {
        return "Element Tree Output";
    }

    @Override
    public String description() {
        return "Outputs a tabular listing of the element tree during traversal";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        if (!headerPrinted) {
            printHeader();
        }
        if (ctx.parent() == null) {
            output.accept("Document " + ctx.documentPath());
        }
        printElement(ctx);
        return true;
    }

    @Override
    public IssueList getIssues() {
        return new IssueList();
    }

    private void printHeader() {
        headerPrinted = true;
        output.accept(String.format(ROW_FORMAT, "Index", "Element", "Id", "Content"));
        output.accept(
                String.format(
                        ROW_FORMAT,
                        "-".repeat(INDEX_WIDTH),
                        "-".repeat(ELEMENT_NAME_WIDTH),
                        "-".repeat(ID_WIDTH),
                        "-".repeat(CONTENT_SUMMARY_WIDTH)));
    }

    private void printElement(VisitorContext ctx) {
        String paddedIndex = String.format("%" + INDEX_WIDTH + "d", ctx.globalIndex());
        String elementName = INDENT.repeat(ctx.depth()) + "- " + ctx.elementName();
        String id = ctx.element().hasId() ? ctx.element().options().id() : "";
        String content = "";
        if (ctx.element() instanceof TextContainer text) {
            content = summarize(text.text());
        }
        output.accept(String.format(ROW_FORMAT, paddedIndex, elementName, id, content));
    }

    private static String summarize(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= CONTENT_SUMMARY_WIDTH
                ? flat
                : flat.substring(0, CONTENT_SUMMARY_WIDTH - 3) + "...";
    }
}
