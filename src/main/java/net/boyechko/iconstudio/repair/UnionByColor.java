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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.iconstudio.core.IconReport;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.validation.ReadinessReport;
import net.boyechko.iconstudio.validation.RequiredAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Unions the primitives of each tracked color group into a single shape per group. */
public class UnionByColor implements RepairStep {
    private static final Logger logger = LoggerFactory.getLogger(UnionByColor.class);
    private static final int P_UNION = 30;

    @Override
    public int priority() {
        return P_UNION;
    }

    @Override
    public String name() {
        return "Union shapes";
    }

    @Override
    public boolean isNeeded(IconReport report, RepairContext ctx) {
        return report.readiness() != null
                && report.readiness().requires(RequiredAction.Type.UNION);
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        try {
            ReadinessReport readiness = ctx.readiness();
            String holderId = readiness.contentHolder().id();
            Set<String> consumed = new HashSet<>();
            for (RequiredAction action : readiness.actions()) {
                if (action.type() != RequiredAction.Type.UNION) {
                    continue;
                }
                // A shape in two color groups is consumed by the first union
                List<String> ids =
                        action.nodeIds().stream().filter(id -> !consumed.contains(id)).toList();
                if (ids.size() < 2) {
                    continue;
                }
                String union = ctx.editor().union(ids, holderId);
                consumed.addAll(ids);
                logger.debug(
                        "United {} {} shapes into {}", ids.size(), action.group().key(), union);
            }
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to union shapes: " + e.getMessage(), e);
        }
    }
}
