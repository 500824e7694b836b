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

import java.util.Objects;

/**
 * A single fill or stroke paint entry. Only visible {@link Type#SOLID} paints take part in color
 * classification; other paint types still count as "has fill".
 */
public record Paint(Type type, Rgb color, boolean visible) {

    public enum Type {
        SOLID,
        OTHER
    }

    public Paint {
        Objects.requireNonNull(type, "type");
        if (type == Type.SOLID) {
            Objects.requireNonNull(color, "solid paint needs a color");
        }
    }

    public static Paint solid(Rgb color) {
        return new Paint(Type.SOLID, color, true);
    }

    public static Paint solid(double r, double g, double b) {
        return solid(new Rgb(r, g, b));
    }

    public static Paint hidden(Rgb color) {
        return new Paint(Type.SOLID, color, false);
    }

    /** Gradient, image or any other non-solid paint. */
    public static Paint other() {
        return new Paint(Type.OTHER, null, true);
    }

    public boolean isVisibleSolid() {
        return type == Type.SOLID && visible;
    }
}
