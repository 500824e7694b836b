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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.SceneNode;

/**
 * Structural state of an icon's content: whether strokes are outlined and same-colored shapes
 * unioned and flattened.
 *
 * @param contentHolder node whose descendants were inspected; null if the frame was empty
 * @param groups primitives per tracked color group; a primitive may appear in several groups
 * @param unclassified primitives matching no tracked group
 * @param actions remediation steps in execution order
 */
public record ReadinessReport(
        ValidationResult result,
        SceneNode contentHolder,
        boolean hasStrokes,
        int primitiveCount,
        Map<ColorGroup, List<SceneNode>> groups,
        List<SceneNode> unclassified,
        List<RequiredAction> actions) {

    public ReadinessReport {
        groups = groups.isEmpty() ? Map.of() : new EnumMap<>(groups);
        unclassified = List.copyOf(unclassified);
        actions = List.copyOf(actions);
    }

    /** Report for content that could not be analyzed at all (empty, no vectors). */
    static ReadinessReport terminal(ValidationResult result, SceneNode contentHolder) {
        return new ReadinessReport(
                result, contentHolder, false, 0, Map.of(), List.of(), List.of());
    }

    public boolean isReady() {
        return result.isValid();
    }

    public boolean requires(RequiredAction.Type type) {
        return actions.stream().anyMatch(a -> a.type() == type);
    }

    public List<SceneNode> group(ColorGroup group) {
        return groups.getOrDefault(group, List.of());
    }
}
