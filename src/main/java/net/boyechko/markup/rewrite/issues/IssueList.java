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
package net.boyechko.markup.rewrite.issues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.markup.rewrite.ast.Path;

public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public IssueList(Issue issue) {
        super();
        if (issue != null) {
            add(issue);
        }
    }

    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList inDocument(Path documentPath) {
        return stream()
                .filter(issue -> documentPath.equals(issue.where().documentPath()))
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList atLeast(IssueSev severity) {
        return stream()
                .filter(issue -> issue.severity().isAtLeast(severity))
                .collect(Collectors.toCollection(IssueList::new));
    }

    public boolean hasErrors() {
        return stream().anyMatch(issue -> issue.severity() == IssueSev.ERROR);
    }

    /** Issues grouped by type, in the order the types were first encountered. */
    public Map<IssueType, List<Issue>> groupedByType() {
        return stream()
                .collect(
                        Collectors.groupingBy(
                                Issue::type, LinkedHashMap::new, Collectors.toList()));
    }
}
