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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.boyechko.iconstudio.color.ColorClassifier;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.geometry.GeometryAnalyzer;
import net.boyechko.iconstudio.geometry.PrimitiveRef;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueLoc;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether an icon's content is ready for processing: strokes outlined, same-colored shapes
 * unioned, and everything flattened into one shape. All missing steps are combined into a single
 * checklist error.
 *
 * <p>Categories differ only in which color groups are tracked.
 */
public class StructuralReadinessValidator {
    private final IconRules rules;
    private final ColorClassifier classifier;
    private final GeometryAnalyzer geometry;
    private final Logger trace;

    public StructuralReadinessValidator(IconRules rules) {
        this(rules, LoggerFactory.getLogger(StructuralReadinessValidator.class));
    }

    public StructuralReadinessValidator(IconRules rules, Logger trace) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.trace = Objects.requireNonNull(trace, "trace");
        this.classifier = rules.colorClassifier();
        this.geometry = new GeometryAnalyzer(trace);
    }

    public ValidationResult validate(SceneNode frame, IconCategory category) {
        return assess(frame, category).result();
    }

    public ReadinessReport assess(SceneNode frame, IconCategory category) {
        Objects.requireNonNull(frame, "frame");
        IconRules.CategoryRules catRules = rules.forCategory(category);
        trace.debug("Checking readiness of {} icon {}", category.key(), SceneTree.label(frame));

        if (frame.children().isEmpty()) {
            return ReadinessReport.terminal(emptyContainer(frame), null);
        }

        SceneNode holder = SceneTree.findContentHolder(frame).orElse(frame);
        if (holder != frame && holder.children().isEmpty()) {
            return ReadinessReport.terminal(emptyContainer(frame), holder);
        }

        List<PrimitiveRef> primitives = geometry.findPrimitives(holder);
        if (primitives.isEmpty()) {
            Issue issue =
                    Issue.error(
                            IssueType.NO_VECTOR_CONTENT,
                            IssueLoc.atNode(frame),
                            "No vector content in <strong>"
                                    + SceneTree.label(frame)
                                    + "</strong><br>Please add vector shapes to this icon");
            return ReadinessReport.terminal(ValidationResult.of(issue), holder);
        }

        IssueList issues = new IssueList();
        List<String> strokedIds = new ArrayList<>();
        Map<ColorGroup, List<SceneNode>> groups = new EnumMap<>(ColorGroup.class);
        List<SceneNode> unclassified = new ArrayList<>();
        List<ColorGroup> tracked = catRules.trackedGroups();

        for (PrimitiveRef ref : primitives) {
            SceneNode node = ref.node();
            if (SceneTree.hasVisibleStroke(node)) {
                trace.debug("  {} has strokes (not outlined)", SceneTree.label(node));
                strokedIds.add(node.id());
            }

            Set<ColorGroup> colors = classifier.groupsOf(node);
            boolean classified = false;
            for (ColorGroup group : tracked) {
                if (colors.contains(group)) {
                    groups.computeIfAbsent(group, g -> new ArrayList<>()).add(node);
                    classified = true;
                }
            }
            if (!classified) {
                unclassified.add(node);
            }

            if (node.kind() == NodeKind.BOOLEAN_OPERATION) {
                issues.add(
                        Issue.warning(
                                IssueType.BOOLEAN_OPERATION,
                                IssueLoc.atNode(node),
                                "Boolean operation \""
                                        + SceneTree.label(node)
                                        + "\" in "
                                        + SceneTree.label(frame)
                                        + "<br>Consider unioning paths for cleaner output"));
            }
        }

        List<RequiredAction> actions = new ArrayList<>();
        if (!strokedIds.isEmpty()) {
            actions.add(RequiredAction.outline(strokedIds));
        }
        for (ColorGroup group : tracked) {
            List<SceneNode> members = groups.getOrDefault(group, List.of());
            if (members.size() > 1) {
                List<String> ids = members.stream().map(SceneNode::id).toList();
                actions.add(RequiredAction.union(group, ids));
            }
        }
        if (needsFlatten(groups, unclassified)) {
            actions.add(
                    RequiredAction.flatten(primitives.stream().map(r -> r.node().id()).toList()));
        }

        trace.debug(
                "  {} primitives, strokes={}, groups={}, unclassified={}, actions={}",
                primitives.size(),
                !strokedIds.isEmpty(),
                groupSizes(groups),
                unclassified.size(),
                actions.stream().map(RequiredAction::type).toList());

        if (!actions.isEmpty()) {
            issues.add(0, preparationError(frame, actions));
        }

        return new ReadinessReport(
                ValidationResult.of(issues),
                holder,
                !strokedIds.isEmpty(),
                primitives.size(),
                groups,
                unclassified,
                actions);
    }

    /**
     * Flatten is needed unless exactly one shape would remain once every tracked group is unioned.
     * A single shape that carries both black and red regions counts once.
     */
    private static boolean needsFlatten(
            Map<ColorGroup, List<SceneNode>> groups, List<SceneNode> unclassified) {
        List<SceneNode> black = groups.getOrDefault(ColorGroup.BLACK, List.of());
        List<SceneNode> red = groups.getOrDefault(ColorGroup.RED, List.of());
        if (unclassified.isEmpty()
                && black.size() == 1
                && red.size() == 1
                && black.get(0).id().equals(red.get(0).id())) {
            return false;
        }

        int afterUnion = unclassified.size();
        for (List<SceneNode> members : groups.values()) {
            if (!members.isEmpty()) {
                afterUnion++;
            }
        }
        return afterUnion != 1;
    }

    private static ValidationResult emptyContainer(SceneNode frame) {
        return ValidationResult.of(
                Issue.error(
                        IssueType.EMPTY_CONTAINER,
                        IssueLoc.atNode(frame),
                        "<strong>"
                                + SceneTree.label(frame)
                                + ": empty container</strong>"
                                + "<br>Please add vector content to this icon"));
    }

    private static Issue preparationError(SceneNode frame, List<RequiredAction> actions) {
        StringBuilder sb = new StringBuilder();
        sb.append("<strong>")
                .append(SceneTree.label(frame))
                .append(":</strong> Please prepare your icon first:");
        int step = 1;
        for (RequiredAction action : actions) {
            sb.append("<br>").append(step++).append(". ").append(action.instruction());
        }
        boolean outline =
                actions.stream().anyMatch(a -> a.type() == RequiredAction.Type.OUTLINE_STROKES);
        boolean flatten = actions.stream().anyMatch(a -> a.type() == RequiredAction.Type.FLATTEN);
        if (outline && flatten) {
            sb.append("<br>Note: Outline before flattening to preserve stroke widths");
        }
        return Issue.error(IssueType.NEEDS_PREPARATION, IssueLoc.atNode(frame), sb.toString());
    }

    private static Map<String, Integer> groupSizes(Map<ColorGroup, List<SceneNode>> groups) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        groups.forEach((group, members) -> sizes.put(group.key(), members.size()));
        return sizes;
    }
}
