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
package net.boyechko.iconstudio.repair;

import net.boyechko.iconstudio.issue.IssueList;

/** The icon failed validation, so the repair pipeline refused to run. */
public class ValidationGateException extends RepairException {
    private final IssueList errors;

    public ValidationGateException(String stepName, IssueList errors) {
        super(stepName, summarize(errors));
        this.errors = new IssueList(errors);
    }

    public IssueList errors() {
        return new IssueList(errors);
    }

    private static String summarize(IssueList errors) {
        String first = errors.isEmpty() ? "" : ": " + errors.get(0).message().replace("<br>", " ");
        return "Validation failed with " + errors.size() + " error(s)" + first;
    }
}
