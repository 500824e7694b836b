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
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.validation.MasterValidation;

/** Refuses to continue when the icon has size, stroke or safety-zone errors. */
public class ValidationGate implements RepairStep {
    private static final int P_GATE = 10;

    @Override
    public int priority() {
        return P_GATE;
    }

    @Override
    public String name() {
        return "Validate icon";
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        MasterValidation master;
        try {
            master = ctx.master();
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Could not read icon: " + e.getMessage(), e);
        }
        IssueList errors = master.result().errors();
        if (!errors.isEmpty()) {
            throw new ValidationGateException(name(), errors);
        }
    }
}
