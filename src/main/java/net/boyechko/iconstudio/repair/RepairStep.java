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

import net.boyechko.iconstudio.core.IconReport;

/** One stage of the repair pipeline, run by the workflow orchestrator. */
public interface RepairStep {
    /** Lower values run first. */
    int priority();

    /** Name shown in progress reports. */
    String name();

    /** Whether the step has work to do, judged from the analysis done before the run. */
    default boolean isNeeded(IconReport report, RepairContext ctx) {
        return true;
    }

    void apply(RepairContext ctx) throws RepairException;
}
