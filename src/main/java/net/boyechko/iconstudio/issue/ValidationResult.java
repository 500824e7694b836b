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

import java.util.Collection;

/**
 * Outcome of one validator run. Errors are the ERROR-severity issues, warnings the rest; the
 * result is valid iff there are no errors, whatever the warnings.
 */
public final class ValidationResult {
    private final IssueList issues;

    private ValidationResult(IssueList issues) {
        this.issues = issues;
    }

    public static ValidationResult valid() {
        return new ValidationResult(new IssueList());
    }

    public static ValidationResult of(Collection<Issue> issues) {
        return new ValidationResult(new IssueList(issues));
    }

    public static ValidationResult of(Issue issue) {
        return new ValidationResult(new IssueList(issue));
    }

    public boolean isValid() {
        return !issues.hasErrors();
    }

    public IssueList issues() {
        return new IssueList(issues);
    }

    public IssueList errors() {
        return issues.errors();
    }

    public IssueList warnings() {
        return issues.warnings();
    }

    /** Combines this result with another; the merged result keeps issue order. */
    public ValidationResult merge(ValidationResult other) {
        IssueList merged = new IssueList(issues);
        merged.addAll(other.issues);
        return new ValidationResult(merged);
    }

    @Override
    public String toString() {
        return "ValidationResult[valid="
                + isValid()
                + ", errors="
                + errors().size()
                + ", warnings="
                + warnings().size()
                + "]";
    }
}
