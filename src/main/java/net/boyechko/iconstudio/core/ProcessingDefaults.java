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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.boyechko.iconstudio.repair.ApplyColorVariables;
import net.boyechko.iconstudio.repair.EditDescription;
import net.boyechko.iconstudio.repair.FlattenContent;
import net.boyechko.iconstudio.repair.OutlineStrokes;
import net.boyechko.iconstudio.repair.RepairStep;
import net.boyechko.iconstudio.repair.ScaleVariants;
import net.boyechko.iconstudio.repair.UnionByColor;
import net.boyechko.iconstudio.repair.ValidationGate;

public final class ProcessingDefaults {
    private ProcessingDefaults() {}

    /** The repair pipeline in run order. */
    public static List<RepairStep> repairSteps() {
        List<RepairStep> steps =
                new ArrayList<>(
                        List.of(
                                new ValidationGate(),
                                new OutlineStrokes(),
                                new UnionByColor(),
                                new FlattenContent(),
                                new ApplyColorVariables(),
                                new ScaleVariants(),
                                new EditDescription()));
        steps.sort(Comparator.comparingInt(RepairStep::priority));
        return steps;
    }
}
