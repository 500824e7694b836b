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
package net.boyechko.iconstudio.validation;

import java.util.List;
import java.util.Optional;
import net.boyechko.iconstudio.geometry.VectorPositionInfo;
import net.boyechko.iconstudio.issue.ValidationResult;

/**
 * Result of the size, stroke and safety-zone checks.
 *
 * @param category detected or requested category; null if the frame size matched none
 * @param positions measured position of every primitive with geometry
 */
public record MasterValidation(
        IconCategory category, ValidationResult result, List<VectorPositionInfo> positions) {

    public MasterValidation {
        positions = List.copyOf(positions);
    }

    public Optional<IconCategory> detectedCategory() {
        return Optional.ofNullable(category);
    }

    public boolean isValid() {
        return result.isValid();
    }
}
