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
package net.boyechko.iconstudio.scene;

import java.util.List;

/** Stroke paints plus the stroke weight in pixels. */
public record Stroke(List<Paint> paints, double weight) {

    public static final Stroke NONE = new Stroke(List.of(), 0);

    public Stroke {
        paints = List.copyOf(paints);
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Stroke weight must be >= 0: " + weight);
        }
    }

    public static Stroke of(double weight, Paint... paints) {
        return new Stroke(List.of(paints), weight);
    }

    /** A stroke counts only if it has positive weight and at least one visible paint. */
    public boolean isVisible() {
        return weight > 0 && paints.stream().anyMatch(Paint::visible);
    }
}
