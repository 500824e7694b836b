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

import java.util.List;
import java.util.Set;
import net.boyechko.iconstudio.color.ColorClassifier;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.geometry.GeometryAnalyzer;
import net.boyechko.iconstudio.geometry.PrimitiveRef;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import net.boyechko.iconstudio.validation.IconRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds each vector's fills to the color variable of its color group, e.g. black to "base" and
 * red to "pulse". A category with a single tracked color binds every vector to it.
 */
public class ApplyColorVariables implements RepairStep {
    private static final Logger logger = LoggerFactory.getLogger(ApplyColorVariables.class);
    private static final int P_COLORIZE = 50;

    @Override
    public int priority() {
        return P_COLORIZE;
    }

    @Override
    public String name() {
        return "Apply color variables";
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        IconRules.CategoryRules catRules = ctx.categoryRules();
        ColorClassifier classifier = ctx.rules().colorClassifier();
        List<ColorGroup> tracked = catRules.trackedGroups();

        try {
            SceneNode frame = ctx.frame();
            SceneNode holder = SceneTree.findContentHolder(frame).orElse(frame);
            for (PrimitiveRef ref : new GeometryAnalyzer().findPrimitives(holder)) {
                SceneNode node = ref.node();
                if (node.fills().isMixed()) {
                    // Regions of a mixed fill are bound by the host per region
                    logger.debug("Skipping {}: mixed fills", SceneTree.label(node));
                    continue;
                }
                ColorGroup group = groupFor(node, classifier, tracked);
                String variable = group != null ? catRules.colorVariable(group) : null;
                if (variable == null) {
                    logger.debug("Skipping {}: no color variable applies", SceneTree.label(node));
                    continue;
                }
                ctx.editor().bindFillVariable(node.id(), variable);
                logger.debug("Bound {} to {}", SceneTree.label(node), variable);
            }
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to apply colors: " + e.getMessage(), e);
        }
    }

    private static ColorGroup groupFor(
            SceneNode node, ColorClassifier classifier, List<ColorGroup> tracked) {
        Set<ColorGroup> groups = classifier.groupsOf(node);
        for (ColorGroup group : tracked) {
            if (groups.contains(group)) {
                return group;
            }
        }
        return tracked.size() == 1 ? tracked.get(0) : null;
    }
}
