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
import net.boyechko.iconstudio.scene.SceneNode;

/**
 * A primitive found under a container, with the intermediate ancestors between the container
 * (excluded) and the primitive (excluded), outermost first.
 */
public record PrimitiveRef(SceneNode node, List<SceneNode> ancestors) {
    public PrimitiveRef {
        ancestors = List.copyOf(ancestors);
    }

    public SceneNode parent() {
        return ancestors.isEmpty() ? null : ancestors.get(ancestors.size() - 1);
    }
}
