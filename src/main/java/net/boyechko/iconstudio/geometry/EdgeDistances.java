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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Distances from a primitive to the four container edges, rounded to two decimals. */
public record EdgeDistances(double left, double top, double right, double bottom) {

    public enum Edge {
        LEFT,
        TOP,
        RIGHT,
        BOTTOM;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static EdgeDistances rounded(double left, double top, double right, double bottom) {
        return new EdgeDistances(round2(left), round2(top), round2(right), round2(bottom));
    }

    public double get(Edge edge) {
        return switch (edge) {
            case LEFT -> left;
            case TOP -> top;
            case RIGHT -> right;
            case BOTTOM -> bottom;
        };
    }

    /** Edges closer than {@code minDistance}, in left, top, right, bottom order. */
    public List<Edge> edgesBelow(double minDistance) {
        List<Edge> violated = new ArrayList<>();
        for (Edge edge : Edge.values()) {
            if (get(edge) < minDistance) {
                violated.add(edge);
            }
        }
        return violated;
    }

    static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
