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

import java.util.List;
import net.boyechko.markup.rewrite.issues.Issue;
import net.boyechko.markup.rewrite.issues.IssueList;

/** Interface for reporting progress and results of the processing. */
public interface ProcessingListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(Issue issue);

    void onSummary(IssueList allIssues);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onIssueGroup(String groupLabel, List<Issue> issues) {
        for (Issue issue : issues) {
            onWarning(issue);
        }
    }

    /** A listener that ignores all events. */
    static ProcessingListener silent() {
        return new ProcessingListener() {
            @Override
            public void onPhaseStart(String phaseName) {}

            @Override
            public void onSuccess(String message) {}

            @Override
            public void onWarning(Issue issue) {}

            @Override
            public void onSummary(IssueList allIssues) {}
        };
    }
}
