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
package net.boyechko.iconstudio.repair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.iconstudio.core.IconReport;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.scene.SceneEditor;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completes a variant set: every size the category allows that is missing for a variant type is
 * created by scaling down the nearest larger variant of the same type.
 *
 * <p>Variants are named {@code Size=<n>, Variant=<type>}. A variant without a parsable name falls
 * back to its rounded width and to "(Def) Outlined" unless its name mentions "Filled".
 */
public class ScaleVariants implements RepairStep {
    private static final Logger logger = LoggerFactory.getLogger(ScaleVariants.class);
    private static final int P_SCALE = 60;

    public static final String OUTLINED = "(Def) Outlined";
    public static final String FILLED = "Filled";
    private static final List<String> VARIANT_ORDER = List.of(OUTLINED, FILLED);

    @Override
    public int priority() {
        return P_SCALE;
    }

    @Override
    public String name() {
        return "Create scaled sizes";
    }

    @Override
    public boolean isNeeded(IconReport report, RepairContext ctx) {
        return ctx.request().variantSetId() != null
                && !ctx.categoryRules().scaled_sizes.isEmpty();
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        String setId = ctx.request().variantSetId();
        if (setId == null) {
            throw new RepairException(name(), "No variant set to scale");
        }

        List<Integer> targets = new ArrayList<>(ctx.categoryRules().validSizes());
        targets.sort(Comparator.reverseOrder());

        try {
            SceneNode set = ctx.editor().snapshot(setId);
            Map<String, List<SceneNode>> byType = groupByType(set);

            int created = 0;
            for (Map.Entry<String, List<SceneNode>> entry : byType.entrySet()) {
                String type = entry.getKey();
                List<SceneNode> existing = entry.getValue();
                for (int target : targets) {
                    if (existing.stream().anyMatch(v -> sizeOf(v) == target)) {
                        continue;
                    }
                    Optional<SceneNode> source = nearestLarger(existing, target);
                    if (source.isEmpty()) {
                        logger.warn("No source variant found for {}px {}", target, type);
                        continue;
                    }
                    createScaledVariant(ctx.editor(), source.get(), target, type);
                    created++;
                }
            }
            logger.debug("Created {} scaled variants in {}", created, SceneTree.label(set));
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to scale variants: " + e.getMessage(), e);
        }
    }

    private void createScaledVariant(
            SceneEditor editor, SceneNode source, int targetSize, String variantType)
            throws SceneEditException {
        int sourceSize = sizeOf(source);
        double factor = (double) targetSize / sourceSize;
        logger.debug(
                "Creating {}px from {}px (scale: {})",
                targetSize,
                sourceSize,
                String.format("%.2f", factor));

        String cloneId = editor.cloneNode(source.id());
        editor.resize(cloneId, targetSize, targetSize);

        SceneNode clone = editor.snapshot(cloneId);
        Optional<SceneNode> holder = SceneTree.findContentHolder(clone);
        if (holder.isPresent()) {
            SceneNode container = holder.get();
            if (!container.children().isEmpty()) {
                SceneNode vector = container.children().get(0);
                editor.rescale(vector.id(), factor);
                if (vector.box() != null) {
                    editor.move(
                            vector.id(), vector.box().x() * factor, vector.box().y() * factor);
                }
            } else {
                logger.warn("Container of {} has no children to scale", SceneTree.label(clone));
            }
            editor.resize(container.id(), targetSize, targetSize);
        }

        editor.rename(cloneId, variantName(targetSize, variantType));
    }

    public static String variantName(int size, String variantType) {
        return "Size=" + size + ", Variant=" + variantType;
    }

    /** Size from the {@code Size=} property, else the rounded width. */
    static int sizeOf(SceneNode variant) {
        String size = properties(variant.name()).get("Size");
        if (size != null) {
            try {
                return Integer.parseInt(size.trim());
            } catch (NumberFormatException e) {
                logger.debug("Unparsable size '{}' in {}", size, variant.name());
            }
        }
        return (int) Math.round(variant.width());
    }

    static String typeOf(SceneNode variant) {
        String type = properties(variant.name()).get("Variant");
        if (type != null) {
            return type;
        }
        return variant.name() != null && variant.name().contains(FILLED) ? FILLED : OUTLINED;
    }

    /** Parses {@code Key=Value, Key=Value} variant names. */
    static Map<String, String> properties(String name) {
        Map<String, String> props = new HashMap<>();
        if (name == null) {
            return props;
        }
        for (String part : name.split(",")) {
            int eq = part.indexOf('=');
            if (eq > 0) {
                props.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
            }
        }
        return props;
    }

    private static Map<String, List<SceneNode>> groupByType(SceneNode set) {
        Map<String, List<SceneNode>> byType = new LinkedHashMap<>();
        for (String type : VARIANT_ORDER) {
            byType.put(type, new ArrayList<>());
        }
        for (SceneNode child : set.children()) {
            if (child.kind() == NodeKind.FRAME) {
                byType.computeIfAbsent(typeOf(child), t -> new ArrayList<>()).add(child);
            }
        }
        byType.values().removeIf(List::isEmpty);
        return byType;
    }

    private static Optional<SceneNode> nearestLarger(List<SceneNode> variants, int target) {
        return variants.stream()
                .filter(v -> sizeOf(v) > target)
                .min(Comparator.comparingInt(ScaleVariants::sizeOf));
    }
}
