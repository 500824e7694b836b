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

import java.util.Objects;
import net.boyechko.iconstudio.core.RepairRequest;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.scene.SceneEditor;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.validation.IconCategory;
import net.boyechko.iconstudio.validation.IconRules;
import net.boyechko.iconstudio.validation.MasterIconValidator;
import net.boyechko.iconstudio.validation.MasterValidation;
import net.boyechko.iconstudio.validation.ReadinessReport;
import net.boyechko.iconstudio.validation.StructuralReadinessValidator;

/** Everything a repair step needs. Snapshots are re-read on every call. */
public final class RepairContext {
    private final SceneEditor editor;
    private final IconRules rules;
    private final IconCategory category;
    private final RepairRequest request;
    private final MasterIconValidator masterValidator;
    private final StructuralReadinessValidator readinessValidator;

    public RepairContext(
            SceneEditor editor, IconRules rules, IconCategory category, RepairRequest request) {
        this.editor = Objects.requireNonNull(editor, "editor");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.category = Objects.requireNonNull(category, "category");
        this.request = Objects.requireNonNull(request, "request");
        this.masterValidator = new MasterIconValidator(rules);
        this.readinessValidator = new StructuralReadinessValidator(rules);
    }

    public SceneEditor editor() {
        return editor;
    }

    public IconRules rules() {
        return rules;
    }

    public IconRules.CategoryRules categoryRules() {
        return rules.forCategory(category);
    }

    public IconCategory category() {
        return category;
    }

    public RepairRequest request() {
        return request;
    }

    public SceneNode frame() throws SceneEditException {
        return editor.snapshot(request.frameId());
    }

    public ReadinessReport readiness() throws SceneEditException {
        return readinessValidator.assess(frame(), category);
    }

    public MasterValidation master() throws SceneEditException {
        return masterValidator.validate(frame(), category);
    }
}
