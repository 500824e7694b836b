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
package net.boyechko.iconstudio.issue;

import java.util.List;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;

/** Represents where in the scene tree an issue was found. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtNode(String nodeId, String nodeName, List<String> layerPath) implements IssueLoc {
        public AtNode {
            layerPath = layerPath != null ? List.copyOf(layerPath) : List.of();
        }
    }

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(SceneNode node) {
        if (node == null) {
            return none();
        }
        return new AtNode(node.id(), SceneTree.label(node), List.of());
    }

    static IssueLoc atNode(SceneNode node, List<String> layerPath) {
        if (node == null) {
            return none();
        }
        return new AtNode(node.id(), SceneTree.label(node), layerPath);
    }

    /** Returns the node's display name if available, null otherwise. */
    default String nodeName() {
        if (this instanceof AtNode at) {
            return at.nodeName();
        }
        return null;
    }

    /** Returns the node id if available, null otherwise. */
    default String nodeId() {
        if (this instanceof AtNode at) {
            return at.nodeId();
        }
        return null;
    }
}
