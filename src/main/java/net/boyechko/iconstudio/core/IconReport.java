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
package net.boyechko.iconstudio.core;

import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.validation.IconCategory;
import net.boyechko.iconstudio.validation.MasterValidation;
import net.boyechko.iconstudio.validation.ReadinessReport;

/**
 * Combined validation verdict for one icon frame.
 *
 * @param category category the icon was checked against; null if undetectable
 * @param readiness structural readiness; null when no category could be determined
 * @param name name check result; null when no name was checked
 * @param nameSuggestion corrected name; null if the name is valid or unchecked
 */
public record IconReport(
        String frameId,
        String frameName,
        IconCategory category,
        MasterValidation master,
        ReadinessReport readiness,
        ValidationResult name,
        String nameSuggestion) {

    /**
     * Geometry errors need manual correction and block the repair pipeline; structural errors are
     * what the pipeline fixes, so they do not.
     */
    public boolean canRepair() {
        return category != null && master.isValid();
    }

    /** True if every check passed and nothing needs repairing. */
    public boolean isValid() {
        return master.isValid()
                && (readiness == null || readiness.isReady())
                && (name == null || name.isValid());
    }

    public IssueList allIssues() {
        IssueList all = new IssueList();
        all.addAll(master.result().issues());
        if (readiness != null) {
            all.addAll(readiness.result().issues());
        }
        if (name != null) {
            all.addAll(name.issues());
        }
        return all;
    }
}
