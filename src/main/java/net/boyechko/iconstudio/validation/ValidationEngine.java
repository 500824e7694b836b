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

import java.util.Objects;
import net.boyechko.iconstudio.core.IconReport;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the master, readiness and name validators on one frame and combines their verdicts. The
 * validators are independent; all of them read the same snapshot.
 */
public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    private final MasterIconValidator masterValidator;
    private final StructuralReadinessValidator readinessValidator;
    private final NameValidator nameValidator;

    public ValidationEngine(IconRules rules) {
        this(
                new MasterIconValidator(rules),
                new StructuralReadinessValidator(rules),
                new NameValidator(rules));
    }

    public ValidationEngine(
            MasterIconValidator masterValidator,
            StructuralReadinessValidator readinessValidator,
            NameValidator nameValidator) {
        this.masterValidator = Objects.requireNonNull(masterValidator);
        this.readinessValidator = Objects.requireNonNull(readinessValidator);
        this.nameValidator = Objects.requireNonNull(nameValidator);
    }

    /**
     * Validates {@code frame}. With a null category it is detected from the frame size.
     *
     * @param iconName name to check against the naming convention; null to skip
     */
    public IconReport evaluate(SceneNode frame, IconCategory category, String iconName) {
        Objects.requireNonNull(frame, "frame");
        MasterValidation master =
                category != null
                        ? masterValidator.validate(frame, category)
                        : masterValidator.validate(frame);
        IconCategory effective = master.category();
        if (effective == null) {
            logger.debug("No category for {}; skipping readiness and name checks", frame.name());
            return new IconReport(frame.id(), frame.name(), null, master, null, null, null);
        }

        ReadinessReport readiness = readinessValidator.assess(frame, effective);

        ValidationResult name = null;
        String suggestion = null;
        if (iconName != null) {
            name = nameValidator.validate(iconName, effective);
            if (!name.isValid()) {
                suggestion = nameValidator.generateSuggestion(iconName, effective);
            }
        }

        return new IconReport(
                frame.id(), frame.name(), effective, master, readiness, name, suggestion);
    }

    public MasterIconValidator masterValidator() {
        return masterValidator;
    }

    public StructuralReadinessValidator readinessValidator() {
        return readinessValidator;
    }

    public NameValidator nameValidator() {
        return nameValidator;
    }
}
