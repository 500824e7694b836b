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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/** Static helpers for navigating scene snapshots. */
public final class SceneTree {
    private SceneTree() {}

    /** Primitive with a positive stroke weight and at least one visible stroke paint. */
    public static boolean hasVisibleStroke(SceneNode node) {
        return node.stroke().isVisible();
    }

    /** Any stroke paints with positive weight, visible or not. Used for stroke-width policy. */
    public static boolean hasStroke(SceneNode node) {
        Stroke stroke = node.stroke();
        return stroke.weight() > 0 && !stroke.paints().isEmpty();
    }

    public static boolean hasFill(SceneNode node) {
        return node.fills().isPresent();
    }

    /**
     * Returns the first child frame whose name contains "container" (case-insensitive). Helper
     * frames such as guidelines or safety-area overlays are skipped.
     */
    public static Optional<SceneNode> findContentHolder(SceneNode frame) {
        for (SceneNode child : frame.children()) {
            if (child.kind() == NodeKind.FRAME
                    && child.name() != null
                    && child.name().toLowerCase(Locale.ROOT).contains("container")) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** Depth-first search for a node by id, including {@code root} itself. */
    public static Optional<SceneNode> findById(SceneNode root, String id) {
        if (root.id().equals(id)) {
            return Optional.of(root);
        }
        for (SceneNode child : root.children()) {
            Optional<SceneNode> found = findById(child, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Returns the direct parent of the node with {@code id} under {@code root}, if any. */
    public static Optional<SceneNode> parentOf(SceneNode root, String id) {
        for (SceneNode child : root.children()) {
            if (child.id().equals(id)) {
                return Optional.of(root);
            }
            Optional<SceneNode> found = parentOf(child, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** Pre-order stream of {@code root} and all its descendants. */
    public static Stream<SceneNode> descendants(SceneNode root) {
        List<SceneNode> out = new ArrayList<>();
        collect(root, out);
        return out.stream();
    }

    private static void collect(SceneNode node, List<SceneNode> out) {
        out.add(node);
        for (SceneNode child : node.children()) {
            collect(child, out);
        }
    }

    /** Readable label used in messages: name, falling back to kind and id. */
    public static String label(SceneNode node) {
        if (node.name() != null && !node.name().isBlank()) {
            return node.name();
        }
        return node.kind().name().toLowerCase(Locale.ROOT) + "#" + node.id();
    }
}
