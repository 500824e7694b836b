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

import java.util.Objects;
import net.boyechko.iconstudio.repair.DescriptionData;
import net.boyechko.iconstudio.validation.IconCategory;

/**
 * What to repair and how.
 *
 * @param frameId master icon frame to prepare
 * @param category category to validate against; null to detect it from the frame size
 * @param variantSetId frame holding the size variants to complete by scaling; null to skip
 * @param description description to write; null to leave the description unchanged
 */
public record RepairRequest(
        String frameId, IconCategory category, String variantSetId, DescriptionData description) {

    public RepairRequest {
        Objects.requireNonNull(frameId, "frameId");
    }

    public static RepairRequest forFrame(String frameId) {
        return new RepairRequest(frameId, null, null, null);
    }

    public RepairRequest withCategory(IconCategory category) {
        return new RepairRequest(frameId, category, variantSetId, description);
    }

    public RepairRequest withVariantSet(String variantSetId) {
        return new RepairRequest(frameId, category, variantSetId, description);
    }

    public RepairRequest withDescription(DescriptionData description) {
        return new RepairRequest(frameId, category, variantSetId, description);
    }

    /** Node the description is written to: the variant set if there is one, else the frame. */
    public String descriptionTargetId() {
        return variantSetId != null ? variantSetId : frameId;
    }
}
