/*
 * Icon-Studio - Icon Validation and Repair
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
package net.boyechko.iconstudio.issue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.stream.Collectors;

/** List of issues found in an icon. */
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

    /** Returns a subset of this list with only ERROR-severity issues. */
    public IssueList errors() {
        return stream().filter(Issue::isError).collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns a subset of this list with only WARNING-severity issues. */
    public IssueList warnings() {
        return stream()
                .filter(issue -> issue.severity() == IssueSev.WARNING)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public IssueList ofKind(ErrorKind kind) {
        return stream()
                .filter(issue -> issue.kind() == kind)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public boolean hasErrors() {
        return stream().anyMatch(Issue::isError);
    }

    public boolean containsType(IssueType type) {
        return stream().anyMatch(issue -> issue.type() == type);
    }
}
