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
package net.boyechko.iconstudio.geometry;

import java.util.List;

/**
 * Position of one primitive inside its container, computed fresh on each validation pass.
 *
 * @param x absolute x inside the container
 * @param y absolute y inside the container
 * @param relativeX x relative to the direct parent
 * @param relativeY y relative to the direct parent
 * @param strokeWeight stroke weight, 0 if the primitive has no stroke
 * @param parentFrameName name of the enclosing intermediate frame, null unless {@code inFrame}
 * @param layerPath names of the ancestors between container and primitive
 */
public record VectorPositionInfo(
        String nodeId,
        String name,
        double x,
        double y,
        double relativeX,
        double relativeY,
        double width,
        double height,
        EdgeDistances distances,
        double strokeWeight,
        boolean inFrame,
        String parentFrameName,
        List<String> layerPath) {

    public VectorPositionInfo {
        layerPath = List.copyOf(layerPath);
    }

    public boolean hasStroke() {
        return strokeWeight > 0;
    }
}
