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

/**
 * The fills of a node: either an ordered paint list or the {@link Mixed} sentinel, which the host
 * reports when sub-regions of one shape carry different paints.
 */
public sealed interface Fills {

    record Listed(List<Paint> paints) implements Fills {
        public Listed {
            paints = List.copyOf(paints);
        }
    }

    record Mixed() implements Fills {}

    static Fills none() {
        return new Listed(List.of());
    }

    static Fills of(Paint... paints) {
        return new Listed(List.of(paints));
    }

    static Fills of(List<Paint> paints) {
        return new Listed(paints);
    }

    static Fills mixed() {
        return new Mixed();
    }

    default boolean isMixed() {
        return this instanceof Mixed;
    }

    /** Returns the listed paints, or an empty list for mixed fills. */
    default List<Paint> paints() {
        return this instanceof Listed listed ? listed.paints() : List.of();
    }

    /** True if the node has any fill at all. Mixed fills always count. */
    default boolean isPresent() {
        return isMixed() || !paints().isEmpty();
    }
}
