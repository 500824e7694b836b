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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import net.boyechko.iconstudio.scene.Bounds;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import net.boyechko.iconstudio.validation.SceneTreeVisitor;
import net.boyechko.iconstudio.validation.SceneTreeWalker;
import net.boyechko.iconstudio.validation.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates primitives under a container and measures how far each one sits from the container's
 * edges.
 *
 * <p>Positions come from the best data the host exposes, in this order:
 *
 * <ol>
 *   <li>rendered bounds minus the container's absolute origin
 *   <li>absolute bounds minus the container's absolute origin
 *   <li>the node's local offset plus each intermediate ancestor's local offset
 * </ol>
 *
 * A node with none of these is skipped. For a stroked node {@code strokeWeight / 2} is added to
 * every distance, whichever source was used, so positions are read from the path center line.
 */
public class GeometryAnalyzer {
    private final Logger trace;

    public GeometryAnalyzer() {
        this(LoggerFactory.getLogger(GeometryAnalyzer.class));
    }

    public GeometryAnalyzer(Logger trace) {
        this.trace = Objects.requireNonNull(trace, "trace");
    }

    /**
     * Returns every primitive under {@code container} in depth-first order. Boolean operations are
     * primitives themselves; their operands are not returned.
     */
    public List<PrimitiveRef> findPrimitives(SceneNode container) {
        PrimitiveCollector collector = new PrimitiveCollector();
        new SceneTreeWalker().addVisitor(collector).walk(container);
        trace.debug("Found {} primitives under {}", collector.found.size(), container.name());
        return collector.found;
    }

    /** Returns true if any primitive exists anywhere under {@code node}. */
    public boolean containsPrimitive(SceneNode node) {
        return SceneTree.descendants(node).anyMatch(n -> n != node && n.isPrimitive());
    }

    /** Distances using local offsets only, for callers without absolute container bounds. */
    public Optional<EdgeDistances> computeEdgeDistances(
            SceneNode node, List<SceneNode> ancestors, double containerSize) {
        return measure(node, ancestors, null, containerSize).map(Measured::distances);
    }

    public Optional<EdgeDistances> computeEdgeDistances(
            SceneNode node, List<SceneNode> ancestors, SceneNode container) {
        return measure(node, ancestors, container.absoluteBox(), container.width())
                .map(Measured::distances);
    }

    /** Full position record for one primitive, or empty if its geometry is unavailable. */
    public Optional<VectorPositionInfo> positionOf(PrimitiveRef ref, SceneNode container) {
        SceneNode node = ref.node();
        Optional<Measured> measured =
                measure(node, ref.ancestors(), container.absoluteBox(), container.width());
        if (measured.isEmpty()) {
            return Optional.empty();
        }
        Measured m = measured.get();

        SceneNode parent = ref.parent();
        boolean inFrame =
                parent != null
                        && parent.kind() == NodeKind.FRAME
                        && !SceneTree.label(parent).toLowerCase(Locale.ROOT).contains("container");
        List<String> layerPath = ref.ancestors().stream().map(SceneTree::label).toList();

        return Optional.of(
                new VectorPositionInfo(
                        node.id(),
                        node.name(),
                        m.box().x(),
                        m.box().y(),
                        node.box() != null ? node.box().x() : m.box().x(),
                        node.box() != null ? node.box().y() : m.box().y(),
                        m.box().width(),
                        m.box().height(),
                        m.distances(),
                        node.stroke().weight(),
                        inFrame,
                        inFrame ? SceneTree.label(parent) : null,
                        layerPath));
    }

    /** Union of the given positions' boxes, in container coordinates. */
    public Optional<Bounds> contentExtent(List<VectorPositionInfo> positions) {
        Bounds extent = null;
        for (VectorPositionInfo p : positions) {
            Bounds box = Bounds.of(p.x(), p.y(), p.width(), p.height());
            extent = extent == null ? box : extent.union(box);
        }
        return Optional.ofNullable(extent);
    }

    private record Measured(Bounds box, EdgeDistances distances) {}

    private Optional<Measured> measure(
            SceneNode node, List<SceneNode> ancestors, Bounds containerAbs, double containerSize) {
        Bounds box;
        double adjustment = 0;

        if (node.renderBox() != null && containerAbs != null) {
            box = node.renderBox().translate(-containerAbs.x(), -containerAbs.y());
        } else if (node.absoluteBox() != null && containerAbs != null) {
            box = node.absoluteBox().translate(-containerAbs.x(), -containerAbs.y());
        } else if (node.box() != null) {
            double absX = node.box().x();
            double absY = node.box().y();
            for (SceneNode ancestor : ancestors) {
                if (ancestor.box() != null) {
                    absX += ancestor.box().x();
                    absY += ancestor.box().y();
                }
            }
            box = Bounds.of(absX, absY, node.box().width(), node.box().height());
        } else {
            trace.debug("Skipping {}: no geometry available", SceneTree.label(node));
            return Optional.empty();
        }

        // Safety zones are measured from the stroke's center line
        if (node.stroke().weight() > 0) {
            adjustment = node.stroke().weight() / 2;
        }
        EdgeDistances distances =
                EdgeDistances.rounded(
                        box.x() + adjustment,
                        box.y() + adjustment,
                        containerSize - box.right() + adjustment,
                        containerSize - box.bottom() + adjustment);
        trace.debug(
                "{} at ({}, {}) size {}x{}: {}",
                SceneTree.label(node),
                box.x(),
                box.y(),
                box.width(),
                box.height(),
                distances);
        return Optional.of(new Measured(box, distances));
    }

    /** Collects primitives without descending into boolean-operation operands. */
    private static final class PrimitiveCollector implements SceneTreeVisitor {
        private final List<PrimitiveRef> found = new ArrayList<>();

        @Override
        public String name() {
            return "Primitive Collector";
        }

        @Override
        public boolean enterNode(VisitorContext ctx) {
            if (ctx.isPrimitive()) {
                found.add(new PrimitiveRef(ctx.node(), ctx.ancestors()));
                return false;
            }
            return true;
        }
    }
}
