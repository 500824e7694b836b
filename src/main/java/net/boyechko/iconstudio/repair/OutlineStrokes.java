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

import net.boyechko.iconstudio.core.IconReport;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.validation.ReadinessReport;
import net.boyechko.iconstudio.validation.RequiredAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Converts every stroked primitive into an equivalent filled path. */
public class OutlineStrokes implements RepairStep {
    private static final Logger logger = LoggerFactory.getLogger(OutlineStrokes.class);
    private static final int P_OUTLINE = 20;

    @Override
    public int priority() {
        return P_OUTLINE;
    }

    @Override
    public String name() {
        return "Outline strokes";
    }

    @Override
    public boolean isNeeded(IconReport report, RepairContext ctx) {
        return report.readiness() != null
                && report.readiness().requires(RequiredAction.Type.OUTLINE_STROKES);
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        try {
            ReadinessReport readiness = ctx.readiness();
            for (RequiredAction action : readiness.actions()) {
                if (action.type() != RequiredAction.Type.OUTLINE_STROKES) {
                    continue;
                }
                for (String id : action.nodeIds()) {
                    String outlined = ctx.editor().outlineStroke(id);
                    logger.debug("Outlined {} -> {}", id, outlined);
                }
            }
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to outline strokes: " + e.getMessage(), e);
        }
    }
}
