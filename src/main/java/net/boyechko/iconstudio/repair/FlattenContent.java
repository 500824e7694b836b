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
import net.boyechko.iconstudio.core.IconReport;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.validation.ReadinessReport;
import net.boyechko.iconstudio.validation.RequiredAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the Container's content into one vector named "Vector". Content that is already a
 * single vector is only renamed.
 */
public class FlattenContent implements RepairStep {
    private static final Logger logger = LoggerFactory.getLogger(FlattenContent.class);
    private static final int P_FLATTEN = 40;

    public static final String VECTOR_NAME = "Vector";

    @Override
    public int priority() {
        return P_FLATTEN;
    }

    @Override
    public String name() {
        return "Flatten";
    }

    @Override
    public boolean isNeeded(IconReport report, RepairContext ctx) {
        ReadinessReport readiness = report.readiness();
        if (readiness == null || readiness.contentHolder() == null) {
            return false;
        }
        return readiness.requires(RequiredAction.Type.FLATTEN)
                || !isSingleVector(readiness.contentHolder());
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        try {
            ReadinessReport readiness = ctx.readiness();
            SceneNode holder = readiness.contentHolder();
            if (holder == null) {
                throw new RepairException(name(), "Icon has no content to flatten");
            }

            if (isSingleVector(holder)) {
                SceneNode only = holder.children().get(0);
                if (!VECTOR_NAME.equals(only.name())) {
                    ctx.editor().rename(only.id(), VECTOR_NAME);
                }
                return;
            }

            List<String> childIds = holder.children().stream().map(SceneNode::id).toList();
            String flattened = ctx.editor().flatten(childIds, holder.id());
            ctx.editor().rename(flattened, VECTOR_NAME);
            logger.debug("Flattened {} nodes into {}", childIds.size(), flattened);
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to flatten: " + e.getMessage(), e);
        }
    }

    private static boolean isSingleVector(SceneNode holder) {
        return holder.children().size() == 1 && holder.children().get(0).isPrimitive();
    }
}
