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

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/** Icon families with distinct size, stroke, color and naming rules. */
public enum IconCategory {
    /** Single-color UI icons in several sizes (category A). */
    FUNCTIONAL,
    /** Two-color (black and red) illustrations at one fixed size (category B). */
    ILLUSTRATIVE;

    /** Key used for this category in {@code icon-rules.yaml}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Detects the category from an outer frame size. Only master sizes count; scaled variant sizes
     * are not detected.
     */
    public static Optional<IconCategory> detect(double frameSize, IconRules rules) {
        OptionalInt size = wholeSize(frameSize);
        if (size.isEmpty()) {
            return Optional.empty();
        }
        for (IconCategory category : values()) {
            if (rules.forCategory(category).frame_sizes.contains(size.getAsInt())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static final double SIZE_TOLERANCE = 0.01;

    /** The whole pixel size {@code size} stands for; empty if it is fractional. */
    static OptionalInt wholeSize(double size) {
        long rounded = Math.round(size);
        if (Math.abs(size - rounded) > SIZE_TOLERANCE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) rounded);
    }
}
