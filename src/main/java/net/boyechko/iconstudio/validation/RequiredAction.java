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
import net.boyechko.iconstudio.color.ColorGroup;

/**
 * One remediation step a structurally unready icon needs.
 *
 * @param group color group to union; null for outline and flatten
 * @param nodeIds primitives the step applies to
 */
public record RequiredAction(Type type, ColorGroup group, List<String> nodeIds) {

    /** Declared in the order the steps must run. */
    public enum Type {
        OUTLINE_STROKES,
        UNION,
        FLATTEN
    }

    public RequiredAction {
        nodeIds = List.copyOf(nodeIds);
    }

    public static RequiredAction outline(List<String> nodeIds) {
        return new RequiredAction(Type.OUTLINE_STROKES, null, nodeIds);
    }

    public static RequiredAction union(ColorGroup group, List<String> nodeIds) {
        return new RequiredAction(Type.UNION, group, nodeIds);
    }

    public static RequiredAction flatten(List<String> nodeIds) {
        return new RequiredAction(Type.FLATTEN, null, nodeIds);
    }

    /** Checklist line shown to the user. */
    public String instruction() {
        return switch (type) {
            case OUTLINE_STROKES -> "Outline Stroke (Opt+Cmd+O)";
            case UNION ->
                    "Boolean Groups > Union the "
                            + nodeIds.size()
                            + " "
                            + group.key()
                            + " shapes (Opt+Shift+U)";
            case FLATTEN -> "Flatten Selection (Opt+Shift+F)";
        };
    }
}
