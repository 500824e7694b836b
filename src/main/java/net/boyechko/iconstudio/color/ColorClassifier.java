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
package net.boyechko.iconstudio.color;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.Paint;
import net.boyechko.iconstudio.scene.Rgb;
import net.boyechko.iconstudio.scene.SceneNode;

/**
 * Classifies paint colors as black/dark gray or red.
 *
 * <p>Only visible solid paints are considered. A node whose fills are "mixed" matches every
 * color group, since its regions cannot be inspected individually.
 */
public class ColorClassifier {
    public static final double DEFAULT_DARK_MAX = 0.2;
    public static final double DEFAULT_RED_MIN = 0.5;
    public static final double DEFAULT_RED_OTHER_MAX = 0.3;

    private final double darkMax;
    private final double redMin;
    private final double redOtherMax;

    public ColorClassifier() {
        this(DEFAULT_DARK_MAX, DEFAULT_RED_MIN, DEFAULT_RED_OTHER_MAX);
    }

    /**
     * @param darkMax every channel must be strictly below this to count as black/dark gray
     * @param redMin the red channel must be strictly above this to count as red
     * @param redOtherMax green and blue must be strictly below this to count as red
     */
    public ColorClassifier(double darkMax, double redMin, double redOtherMax) {
        this.darkMax = darkMax;
        this.redMin = redMin;
        this.redOtherMax = redOtherMax;
    }

    public boolean isBlackOrDarkGray(Rgb c) {
        return c.r() < darkMax && c.g() < darkMax && c.b() < darkMax;
    }

    public boolean isRed(Rgb c) {
        return c.r() > redMin && c.g() < redOtherMax && c.b() < redOtherMax;
    }

    public boolean matches(Rgb c, ColorGroup group) {
        return switch (group) {
            case BLACK -> isBlackOrDarkGray(c);
            case RED -> isRed(c);
        };
    }

    /**
     * Returns true if the node, or for boolean operations any of its operands, carries a visible
     * solid fill or stroke paint of the given group.
     */
    public boolean hasColor(SceneNode node, ColorGroup group) {
        if (node.fills().isMixed()) {
            return true;
        }
        if (anyMatches(node.fills().paints(), group) || anyMatches(node.stroke().paints(), group)) {
            return true;
        }
        if (node.kind() == NodeKind.BOOLEAN_OPERATION) {
            for (SceneNode operand : node.children()) {
                if (hasColor(operand, group)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** All groups the node belongs to; empty when none of its colors is recognized. */
    public Set<ColorGroup> groupsOf(SceneNode node) {
        Set<ColorGroup> groups = EnumSet.noneOf(ColorGroup.class);
        for (ColorGroup group : ColorGroup.values()) {
            if (hasColor(node, group)) {
                groups.add(group);
            }
        }
        return groups;
    }

    private boolean anyMatches(List<Paint> paints, ColorGroup group) {
        for (Paint paint : paints) {
            if (paint.isVisibleSolid() && matches(paint.color(), group)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format(
                "ColorClassifier[dark < %.2f, red: r > %.2f, g/b < %.2f]",
                darkMax, redMin, redOtherMax);
    }
}
