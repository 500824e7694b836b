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

import static net.boyechko.iconstudio.SceneFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.SceneNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class StructuralReadinessValidatorTest {
    private final StructuralReadinessValidator validator =
            new StructuralReadinessValidator(IconRules.loadDefault());

    @ParameterizedTest
    @EnumSource(IconCategory.class)
    void emptyFrameIsInvalidForEveryCategory(IconCategory category) {
        ValidationResult result = validator.validate(frame("Icon", 32), category);

        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals(IssueType.EMPTY_CONTAINER, result.errors().get(0).type());
        assertTrue(result.errors().get(0).message().contains("Icon: empty container"));
    }

    @Test
    void emptyContentHolderIsInvalid() {
        ValidationResult result = validator.validate(icon("Icon", 32), IconCategory.FUNCTIONAL);

        assertEquals(IssueType.EMPTY_CONTAINER, result.errors().get(0).type());
    }

    @Test
    void groupsWithoutShapesHaveNoVectorContent() {
        SceneNode frame = icon("Icon", 32, group("Empty", 0, 0, 10, 10));

        ValidationResult result = validator.validate(frame, IconCategory.FUNCTIONAL);

        assertEquals(IssueType.NO_VECTOR_CONTENT, result.errors().get(0).type());
    }

    @Test
    void singleFilledShapeIsReady() {
        SceneNode frame = icon("Icon", 32, filled("Vector", 4, 4, 24, 24, BLACK));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertTrue(report.isReady());
        assertTrue(report.actions().isEmpty());
        assertEquals(1, report.primitiveCount());
        assertEquals("Container", report.contentHolder().name());
    }

    @Test
    void strokedShapeNeedsOutlining() {
        SceneNode frame = icon("Icon", 32, stroked("Line", 4, 4, 24, 24, 2, BLACK));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertFalse(report.isReady());
        assertTrue(report.hasStrokes());
        assertTrue(report.requires(RequiredAction.Type.OUTLINE_STROKES));
        assertFalse(report.requires(RequiredAction.Type.FLATTEN));
        assertEquals(IssueType.NEEDS_PREPARATION, report.result().errors().get(0).type());
    }

    @Test
    void sameColoredShapesNeedUnionOnly() {
        SceneNode frame =
                icon(
                        "Icon",
                        32,
                        filled("A", 4, 4, 10, 10, BLACK),
                        filled("B", 16, 16, 10, 10, BLACK));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertTrue(report.requires(RequiredAction.Type.UNION));
        assertFalse(report.requires(RequiredAction.Type.FLATTEN));
        assertEquals(2, report.group(ColorGroup.BLACK).size());
        String message = report.result().errors().get(0).message();
        assertTrue(message.contains("Please prepare your icon first"));
        assertTrue(message.contains("1. Boolean Groups > Union the 2 black shapes"));
    }

    @Test
    void unclassifiedShapeForcesFlatten() {
        SceneNode frame =
                icon(
                        "Icon",
                        32,
                        filled("Black", 4, 4, 10, 10, BLACK),
                        filled("Gray", 16, 16, 10, 10, GRAY));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertTrue(report.requires(RequiredAction.Type.FLATTEN));
        assertFalse(report.requires(RequiredAction.Type.UNION));
        assertEquals(1, report.unclassified().size());
    }

    @Test
    void outlineBeforeFlattenNoteIsAdded() {
        SceneNode frame =
                icon(
                        "Icon",
                        32,
                        stroked("Line", 4, 4, 10, 10, 2, BLACK),
                        filled("Gray", 16, 16, 10, 10, GRAY));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        List<RequiredAction.Type> types =
                report.actions().stream().map(RequiredAction::type).toList();
        assertEquals(
                List.of(RequiredAction.Type.OUTLINE_STROKES, RequiredAction.Type.FLATTEN), types);
        assertTrue(
                report.result().errors().get(0).message().contains("Outline before flattening"));
    }

    @Test
    void blackAndRedShapesAreFlattenedTogether() {
        SceneNode frame =
                icon(
                        "Icon",
                        64,
                        filled("Black", 8, 8, 20, 20, BLACK),
                        filled("Red", 30, 30, 20, 20, RED));

        ReadinessReport report = validator.assess(frame, IconCategory.ILLUSTRATIVE);

        assertTrue(report.requires(RequiredAction.Type.FLATTEN));
        assertFalse(report.requires(RequiredAction.Type.UNION));
        assertEquals(1, report.group(ColorGroup.RED).size());
    }

    @Test
    void singleTwoColorShapeIsReady() {
        SceneNode frame = icon("Icon", 64, mixed("Vector", 8, 8, 40, 40));

        ReadinessReport report = validator.assess(frame, IconCategory.ILLUSTRATIVE);

        assertTrue(report.isReady());
        assertEquals(1, report.group(ColorGroup.BLACK).size());
        assertEquals(1, report.group(ColorGroup.RED).size());
    }

    @Test
    void redIsNotTrackedForFunctionalIcons() {
        SceneNode frame = icon("Icon", 32, filled("Red", 4, 4, 24, 24, RED));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertTrue(report.isReady(), "a single shape needs no flattening");
        assertEquals(1, report.unclassified().size());
    }

    @Test
    void booleanOperationOnlyWarns() {
        SceneNode frame =
                icon(
                        "Icon",
                        32,
                        booleanOp(
                                "Union",
                                4,
                                4,
                                24,
                                24,
                                BLACK,
                                filled("A", 0, 0, 10, 10, BLACK),
                                filled("B", 10, 10, 10, 10, BLACK)));

        ValidationResult result = validator.validate(frame, IconCategory.FUNCTIONAL);

        assertTrue(result.isValid());
        assertEquals(1, result.warnings().size());
        assertEquals(IssueType.BOOLEAN_OPERATION, result.warnings().get(0).type());
    }

    @Test
    void frameWithoutContainerIsInspectedDirectly() {
        SceneNode frame = frame("Icon", 32, filled("Vector", 4, 4, 24, 24, BLACK));

        ReadinessReport report = validator.assess(frame, IconCategory.FUNCTIONAL);

        assertTrue(report.isReady());
        assertSame(frame, report.contentHolder());
    }
}
