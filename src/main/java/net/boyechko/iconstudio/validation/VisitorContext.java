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
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;

/**
 * Immutable context passed to visitors during scene tree traversal.
 *
 * @param node the node being visited
 * @param path slash-free display path such as {@code Icon.Group[2].Vector[3]}
 * @param ancestors nodes between the walk root (excluded) and {@code node} (excluded), outermost
 *     first
 * @param depth depth below the walk root (0 = direct child of the root)
 * @param globalIndex index in traversal order (1-based)
 */
public record VisitorContext(
        SceneNode node, String path, List<SceneNode> ancestors, int depth, int globalIndex) {

    public VisitorContext {
        ancestors = List.copyOf(ancestors);
    }

    /** Direct parent, or null when the parent is the walk root. */
    public SceneNode parent() {
        return ancestors.isEmpty() ? null : ancestors.get(ancestors.size() - 1);
    }

    public List<String> ancestorNames() {
        return ancestors.stream().map(SceneTree::label).toList();
    }

    public boolean isPrimitive() {
        return node.isPrimitive();
    }
}
