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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import net.boyechko.iconstudio.color.ColorClassifier;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.geometry.EdgeDistances;
import net.boyechko.iconstudio.geometry.GeometryAnalyzer;
import net.boyechko.iconstudio.geometry.PrimitiveRef;
import net.boyechko.iconstudio.geometry.VectorPositionInfo;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueLoc;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.Bounds;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a master icon frame: frame size, the nested Container frame, stroke widths and the
 * safety zone around every vector.
 *
 * <p>Checks run in this order, stopping early only where later checks have nothing to inspect:
 *
 * <ol>
 *   <li>category detection (terminal if the size matches no category)
 *   <li>square frame with a valid size
 *   <li>Container present (terminal), named correctly, sized like its parent, not empty
 *       (terminal)
 *   <li>at least one vector under the Container (terminal)
 *   <li>per vector: stroke width policy and safety-zone distances, merged into one message
 *   <li>content extent and required colors, where the category defines them
 * </ol>
 */
public class MasterIconValidator {
    private final IconRules rules;
    private final ColorClassifier classifier;
    private final GeometryAnalyzer geometry;
    private final Logger trace;

    public MasterIconValidator(IconRules rules) {
        this(rules, LoggerFactory.getLogger(MasterIconValidator.class));
    }

    public MasterIconValidator(IconRules rules, Logger trace) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.trace = Objects.requireNonNull(trace, "trace");
        this.classifier = rules.colorClassifier();
        this.geometry = new GeometryAnalyzer(trace);
    }

    /** Validates with the category detected from the frame size. */
    public MasterValidation validate(SceneNode frame) {
        Objects.requireNonNull(frame, "frame");
        Optional<IconCategory> detected = IconCategory.detect(frame.width(), rules);
        if (detected.isEmpty()) {
            Issue issue =
                    Issue.error(
                            IssueType.UNKNOWN_FRAME_SIZE,
                            IssueLoc.atNode(frame),
                            String.format(
                                    "Frame size %sx%spx is not a valid master icon size"
                                            + "<br>Valid sizes: %s",
                                    px(frame.width()), px(frame.height()), masterSizeSummary()));
            return new MasterValidation(null, ValidationResult.of(issue), List.of());
        }
        return validate(frame, detected.get());
    }

    public MasterValidation validate(SceneNode frame, IconCategory category) {
        Objects.requireNonNull(frame, "frame");
        IconRules.CategoryRules catRules = rules.forCategory(category);
        trace.debug("Validating {} master icon {}", category.key(), SceneTree.label(frame));

        IssueList issues = new IssueList();
        List<VectorPositionInfo> positions = new ArrayList<>();

        validateFrameSize(frame, category, catRules, issues);
        validateContainer(frame, category, catRules, issues, positions);

        boolean positionProblems =
                issues.containsType(IssueType.SAFETY_ZONE)
                        || issues.containsType(IssueType.CONTENT_EXTENT);
        if (positionProblems && catRules.center_line_note) {
            issues.add(
                    Issue.warning(
                            IssueType.MEASUREMENT_NOTE,
                            IssueLoc.atNode(frame),
                            "<strong>Note:</strong> Stroke positions are measured from the"
                                    + " path center line"));
        }

        trace.debug("Validation of {} complete: {} issues", SceneTree.label(frame), issues.size());
        return new MasterValidation(category, ValidationResult.of(issues), positions);
    }

    private void validateFrameSize(
            SceneNode frame,
            IconCategory category,
            IconRules.CategoryRules catRules,
            IssueList issues) {
        if (frame.width() != frame.height()) {
            issues.add(
                    Issue.error(
                            IssueType.FRAME_NOT_SQUARE,
                            IssueLoc.atNode(frame),
                            String.format(
                                    "Frame must be square: %sx%spx<br>Expected: %sx%spx",
                                    px(frame.width()),
                                    px(frame.height()),
                                    px(frame.width()),
                                    px(frame.width()))));
        }

        List<Integer> validSizes = catRules.validSizes();
        OptionalInt size = IconCategory.wholeSize(frame.width());
        if (size.isEmpty() || !validSizes.contains(size.getAsInt())) {
            issues.add(
                    Issue.error(
                            IssueType.INVALID_FRAME_SIZE,
                            IssueLoc.atNode(frame),
                            String.format(
                                    "Invalid frame size: %sx%spx<br>Expected sizes for %s: %spx",
                                    px(frame.width()),
                                    px(frame.height()),
                                    category.key(),
                                    joinSizes(validSizes))));
        }
    }

    private void validateContainer(
            SceneNode frame,
            IconCategory category,
            IconRules.CategoryRules catRules,
            IssueList issues,
            List<VectorPositionInfo> positions) {
        if (frame.children().isEmpty()) {
            issues.add(
                    Issue.error(
                            IssueType.FRAME_EMPTY,
                            IssueLoc.atNode(frame),
                            "Frame is empty<br>Expected: Container frame with icon content"));
            return;
        }

        Optional<SceneNode> found = SceneTree.findContentHolder(frame);
        if (found.isEmpty()) {
            issues.add(
                    Issue.error(
                            IssueType.CONTAINER_MISSING,
                            IssueLoc.atNode(frame),
                            "No Container frame found<br>Expected: A frame named \""
                                    + catRules.content_holder_name
                                    + "\" with icon content"));
            return;
        }
        SceneNode container = found.get();

        if (!catRules.content_holder_name.equals(container.name())) {
            issues.add(
                    Issue.error(
                            IssueType.CONTAINER_MISNAMED,
                            IssueLoc.atNode(container),
                            "Container frame should be named \""
                                    + catRules.content_holder_name
                                    + "\"<br>Found: \""
                                    + container.name()
                                    + "\""));
        }

        if (container.width() != frame.width() || container.height() != frame.height()) {
            issues.add(
                    Issue.error(
                            IssueType.CONTAINER_SIZE_MISMATCH,
                            IssueLoc.atNode(container),
                            String.format(
                                    "Container size mismatch: %sx%spx"
                                            + "<br>Expected: %sx%spx (same as parent frame)",
                                    px(container.width()),
                                    px(container.height()),
                                    px(frame.width()),
                                    px(frame.height()))));
        }

        if (container.children().isEmpty()) {
            issues.add(
                    Issue.error(
                            IssueType.CONTAINER_EMPTY,
                            IssueLoc.atNode(container),
                            "Container is empty<br>Expected: Vector paths or shapes"));
            return;
        }

        List<PrimitiveRef> primitives = geometry.findPrimitives(container);
        if (primitives.isEmpty()) {
            issues.add(
                    Issue.error(
                            IssueType.NO_VECTOR_CONTENT,
                            IssueLoc.atNode(container),
                            "Container has no vector content<br>Expected: Vector paths,"
                                    + " shapes, or groups containing vectors"));
            return;
        }

        for (PrimitiveRef ref : primitives) {
            validatePrimitive(ref, container, category, catRules, issues, positions);
        }

        if (catRules.content_inset > 0) {
            validateContentExtent(frame, catRules, issues, positions);
        }
        validateRequiredColors(frame, category, catRules, primitives, issues);
    }

    private void validatePrimitive(
            PrimitiveRef ref,
            SceneNode container,
            IconCategory category,
            IconRules.CategoryRules catRules,
            IssueList issues,
            List<VectorPositionInfo> positions) {
        SceneNode vector = ref.node();
        boolean hasStroke = SceneTree.hasStroke(vector);
        boolean hasFill = SceneTree.hasFill(vector);
        if (!hasStroke && !hasFill) {
            trace.debug("Skipping {}: neither fill nor stroke", SceneTree.label(vector));
            return;
        }

        String name = SceneTree.label(vector);
        List<String> layerPath = ref.ancestors().stream().map(SceneTree::label).toList();
        IssueLoc loc = IssueLoc.atNode(vector, layerPath);
        List<String> problems = new ArrayList<>();

        if (hasStroke) {
            double weight = vector.stroke().weight();
            if (weight == catRules.required_stroke_width) {
                // Standard width
            } else if (catRules.isToleratedStrokeWidth(weight)) {
                issues.add(
                        Issue.warning(
                                IssueType.STROKE_WIDTH,
                                loc,
                                String.format(
                                        "Vector \"%s\" has stroke width %spx. Check if the"
                                                + " modified stroke width is necessary.",
                                        name, px(weight))));
            } else {
                problems.add(
                        String.format(
                                "incorrect stroke width: %spx (expected: %s)",
                                px(weight), strokePolicy(category, catRules)));
            }
        }

        Optional<VectorPositionInfo> position = geometry.positionOf(ref, container);
        boolean inSafetyArea = false;
        if (position.isPresent()) {
            VectorPositionInfo info = position.get();
            positions.add(info);

            double minDistance =
                    hasStroke ? catRules.stroke_safety_zone : catRules.fill_safety_zone;
            EdgeDistances distances = info.distances();
            for (EdgeDistances.Edge edge : distances.edgesBelow(minDistance)) {
                inSafetyArea = true;
                problems.add(
                        String.format(
                                Locale.ROOT,
                                "%s edge is in safety area (%.2fpx, min: %spx)",
                                edge.label(),
                                distances.get(edge),
                                px(minDistance)));
            }
        }

        if (!problems.isEmpty()) {
            String header =
                    inSafetyArea
                            ? "Check position of \""
                                    + name
                                    + "\" ("
                                    + (hasStroke ? "stroke" : "fill")
                                    + ")"
                            : "Check stroke of \"" + name + "\"";
            issues.add(
                    Issue.error(
                            inSafetyArea ? IssueType.SAFETY_ZONE : IssueType.STROKE_WIDTH,
                            loc,
                            header + ":<br>" + String.join("<br>", problems)));
        }
    }

    private void validateContentExtent(
            SceneNode frame,
            IconRules.CategoryRules catRules,
            IssueList issues,
            List<VectorPositionInfo> positions) {
        Optional<Bounds> extent = geometry.contentExtent(positions);
        if (extent.isEmpty()) {
            return;
        }
        double max = frame.width() - catRules.content_inset;
        Bounds box = extent.get();
        if (round2(box.width()) > max || round2(box.height()) > max) {
            issues.add(
                    Issue.error(
                            IssueType.CONTENT_EXTENT,
                            IssueLoc.atNode(frame),
                            String.format(
                                    Locale.ROOT,
                                    "Content area %.2fx%.2fpx is too large"
                                            + "<br>Expected: at most %sx%spx",
                                    box.width(),
                                    box.height(),
                                    px(max),
                                    px(max))));
        }
    }

    private void validateRequiredColors(
            SceneNode frame,
            IconCategory category,
            IconRules.CategoryRules catRules,
            List<PrimitiveRef> primitives,
            IssueList issues) {
        for (String key : catRules.required_colors) {
            ColorGroup group = ColorGroup.fromKey(key);
            boolean present =
                    primitives.stream().anyMatch(r -> classifier.hasColor(r.node(), group));
            if (!present) {
                issues.add(
                        Issue.error(
                                IssueType.MISSING_COLOR,
                                IssueLoc.atNode(frame),
                                "No "
                                        + group.key()
                                        + " paths found<br>Expected: "
                                        + catRules.required_colors.stream()
                                                .collect(Collectors.joining(" and "))
                                        + " paths for "
                                        + category.key()
                                        + " icons"));
            }
        }
    }

    private static String strokePolicy(IconCategory category, IconRules.CategoryRules catRules) {
        StringBuilder sb = new StringBuilder(px(catRules.required_stroke_width)).append("px");
        if (!catRules.tolerated_stroke_widths.isEmpty()) {
            sb.append(" (or ")
                    .append(
                            catRules.tolerated_stroke_widths.stream()
                                    .map(w -> px(w) + "px")
                                    .collect(Collectors.joining(", ")))
                    .append(" with warning)");
        }
        return sb.append(" for ").append(category.key()).append(" icons").toString();
    }

    private String masterSizeSummary() {
        List<String> parts = new ArrayList<>();
        for (IconCategory category : IconCategory.values()) {
            if (rules.categories.containsKey(category.key())) {
                parts.add(
                        joinSizes(rules.forCategory(category).frame_sizes)
                                + "px ("
                                + category.key()
                                + ")");
            }
        }
        return String.join(" or ", parts);
    }

    private static String joinSizes(List<Integer> sizes) {
        return sizes.stream().map(String::valueOf).collect(Collectors.joining("px, "));
    }

    /** Formats a pixel value without trailing zeros: 2.0 becomes "2", 1.75 stays "1.75". */
    static String px(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
