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
import net.boyechko.iconstudio.validation.IconCategory;

/** Writes the formatted description to the variant set, or to the frame if there is none. */
public class EditDescription implements RepairStep {
    private static final int P_DESCRIBE = 70;

    @Override
    public int priority() {
        return P_DESCRIBE;
    }

    @Override
    public String name() {
        return "Edit description";
    }

    @Override
    public boolean isNeeded(IconReport report, RepairContext ctx) {
        return ctx.request().description() != null;
    }

    @Override
    public void apply(RepairContext ctx) throws RepairException {
        DescriptionData data = ctx.request().description();
        if (data == null) {
            throw new RepairException(name(), "No description provided");
        }
        boolean functional = data instanceof DescriptionData.Functional;
        if (functional != (ctx.category() == IconCategory.FUNCTIONAL)) {
            throw new IllegalArgumentException(
                    "Description data does not match " + ctx.category().key() + " icons");
        }

        String text = DescriptionTemplate.format(data);
        try {
            ctx.editor().setDescription(ctx.request().descriptionTargetId(), text);
        } catch (SceneEditException e) {
            throw new RepairException(name(), "Failed to set description: " + e.getMessage(), e);
        }
    }
}
