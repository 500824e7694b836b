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

/** The closed vocabulary of scene node kinds the validators understand. */
public enum NodeKind {
    FRAME,
    GROUP,
    BOOLEAN_OPERATION,
    VECTOR,
    ELLIPSE,
    RECTANGLE,
    STAR,
    LINE,
    POLYGON;

    /** Returns true for leaf shapes (and boolean-operation results) that carry fills or strokes. */
    public boolean isPrimitive() {
        return switch (this) {
            case FRAME, GROUP -> false;
            case BOOLEAN_OPERATION, VECTOR, ELLIPSE, RECTANGLE, STAR, LINE, POLYGON -> true;
        };
    }

    /** Returns true for kinds that hold an ordered child list. */
    public boolean hasChildren() {
        return switch (this) {
            case FRAME, GROUP, BOOLEAN_OPERATION -> true;
            default -> false;
        };
    }
}
