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
import java.util.Objects;

/**
 * Read-only snapshot of a node in the host scene graph. The host owns the real nodes; a snapshot
 * is taken for each validation pass and never mutated.
 *
 * <p>{@code box} is the local layout box: {@code x}/{@code y} relative to the direct parent. It may
 * be null when the host does not expose local offsets. {@code absoluteBox} is the host's absolute
 * bounding box and {@code renderBox} its rendered bounds (which include the outer half of any
 * stroke); both are optional.
 */
public sealed interface SceneNode {

    String id();

    String name();

    NodeKind kind();

    Bounds box();

    Bounds absoluteBox();

    default Bounds renderBox() {
        return null;
    }

    default Fills fills() {
        return Fills.none();
    }

    default Stroke stroke() {
        return Stroke.NONE;
    }

    default List<SceneNode> children() {
        return List.of();
    }

    default double width() {
        return box() != null ? box().width() : absoluteBox() != null ? absoluteBox().width() : 0;
    }

    default double height() {
        return box() != null ? box().height() : absoluteBox() != null ? absoluteBox().height() : 0;
    }

    default boolean isPrimitive() {
        return kind().isPrimitive();
    }

    /** Outer icon frames and the "Container" content holder. */
    record Frame(
            String id,
            String name,
            Bounds box,
            Bounds absoluteBox,
            Fills fills,
            List<SceneNode> children)
            implements SceneNode {
        public Frame {
            Objects.requireNonNull(id, "id");
            fills = fills != null ? fills : Fills.none();
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FRAME;
        }
    }

    record Group(String id, String name, Bounds box, Bounds absoluteBox, List<SceneNode> children)
            implements SceneNode {
        public Group {
            Objects.requireNonNull(id, "id");
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GROUP;
        }
    }

    /** A boolean combination result. Rendered as one shape; its children are the operands. */
    record BooleanOp(
            String id,
            String name,
            Bounds box,
            Bounds absoluteBox,
            Bounds renderBox,
            Fills fills,
            Stroke stroke,
            List<SceneNode> children)
            implements SceneNode {
        public BooleanOp {
            Objects.requireNonNull(id, "id");
            fills = fills != null ? fills : Fills.none();
            stroke = stroke != null ? stroke : Stroke.NONE;
            children = List.copyOf(children);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN_OPERATION;
        }
    }

    /** A leaf shape: vector path, ellipse, rectangle, star, line or polygon. */
    record Shape(
            String id,
            String name,
            NodeKind kind,
            Bounds box,
            Bounds absoluteBox,
            Bounds renderBox,
            Fills fills,
            Stroke stroke)
            implements SceneNode {
        public Shape {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            if (!kind.isPrimitive() || kind == NodeKind.BOOLEAN_OPERATION) {
                throw new IllegalArgumentException("Not a leaf shape kind: " + kind);
            }
            fills = fills != null ? fills : Fills.none();
            stroke = stroke != null ? stroke : Stroke.NONE;
        }
    }
}
