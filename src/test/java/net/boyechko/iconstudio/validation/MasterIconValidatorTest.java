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

import net.boyechko.iconstudio.geometry.EdgeDistances;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.scene.Bounds;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.SceneNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MasterIconValidatorTest {
    private final MasterIconValidator validator = new MasterIconValidator(IconRules.loadDefault());

    private static SceneNode functionalIcon(SceneNode... content) {
        return icon("arrow", 32, content);
    }

    @Test
    void wellFormedFunctionalIconPasses() {
        MasterValidation result =
                validator.validate(functionalIcon(filled("Vector", 4, 4, 24, 24, BLACK)));

        assertEquals(IconCategory.FUNCTIONAL, result.category());
        assertTrue(result.isValid(), () -> result.result().toString());
        assertTrue(result.result().issues().isEmpty());
        assertEquals(1, result.positions().size());
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.5, 1.75})
    void toleratedStrokeWidthsOnlyWarnForFunctionalIcons(double weight) {
        SceneNode frame = functionalIcon(stroked("Line", 4, 4, 24, 24, weight, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertTrue(result.isValid());
        assertEquals(1, result.warnings().size());
        Issue warning = result.warnings().get(0);
        assertEquals(IssueType.STROKE_WIDTH, warning.type());
        assertTrue(warning.message().contains("Check if the modified stroke width is necessary"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.0, 1.25, 2.5, 3.0})
    void otherStrokeWidthsAreErrorsForFunctionalIcons(double weight) {
        SceneNode frame = functionalIcon(stroked("Line", 4, 4, 24, 24, weight, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertFalse(result.isValid());
        assertEquals(1, result.errors().size());
        assertEquals(IssueType.STROKE_WIDTH, result.errors().get(0).type());
        assertTrue(
                result.errors()
                        .get(0)
                        .message()
                        .contains("expected: 2px (or 1.75px, 1.5px with warning) for functional"));
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.5, 1.75, 2.5})
    void anyNonStandardStrokeIsAnErrorForIllustrativeIcons(double weight) {
        SceneNode frame =
                icon(
                        "bike",
                        64,
                        stroked("Black", 8, 8, 20, 20, weight, BLACK),
                        filled("Red", 30, 30, 20, 20, RED));

        ValidationResult result = validator.validate(frame).result();

        assertFalse(result.isValid());
        assertTrue(result.warnings().isEmpty());
        assertEquals(IssueType.STROKE_WIDTH, result.errors().get(0).type());
    }

    @Test
    void unknownFrameSizeIsTerminal() {
        MasterValidation result =
                validator.validate(frame("odd", 40, filled("V", 4, 4, 8, 8, BLACK)));

        assertNull(result.category());
        assertEquals(1, result.result().errors().size());
        Issue error = result.result().errors().get(0);
        assertEquals(IssueType.UNKNOWN_FRAME_SIZE, error.type());
        assertEquals(
                "Frame size 40x40px is not a valid master icon size<br>"
                        + "Valid sizes: 32px, 24px, 20px (functional) or 64px (illustrative)",
                error.message());
    }

    @Test
    void scaledSizeIsAcceptedWhenCategoryIsGiven() {
        SceneNode frame = icon("arrow", 28, filled("Vector", 4, 4, 20, 20, BLACK));

        assertTrue(validator.validate(frame, IconCategory.FUNCTIONAL).isValid());
        assertNull(validator.validate(frame).category(), "28px is not a master size");
    }

    @Test
    void nonSquareFrameIsReported() {
        SceneNode frame =
                frame(
                        "arrow",
                        32,
                        30,
                        frame("Container", 32, 30, filled("V", 4, 4, 20, 20, BLACK)));

        ValidationResult result = validator.validate(frame, IconCategory.FUNCTIONAL).result();

        assertTrue(result.errors().containsType(IssueType.FRAME_NOT_SQUARE));
    }

    @Test
    void wrongSizeForCategoryIsReported() {
        SceneNode frame = icon("arrow", 64, filled("V", 8, 8, 40, 40, BLACK));

        ValidationResult result = validator.validate(frame, IconCategory.FUNCTIONAL).result();

        assertTrue(result.errors().containsType(IssueType.INVALID_FRAME_SIZE));
    }

    @Test
    void emptyFrameIsReported() {
        ValidationResult result = validator.validate(frame("arrow", 32)).result();

        assertEquals(1, result.errors().size());
        assertEquals(IssueType.FRAME_EMPTY, result.errors().get(0).type());
    }

    @Test
    void missingContainerIsTerminal() {
        SceneNode frame = frame("arrow", 32, filled("Vector", 4, 4, 24, 24, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(1, result.errors().size());
        assertEquals(IssueType.CONTAINER_MISSING, result.errors().get(0).type());
    }

    @Test
    void misnamedAndMisSizedContainerAreBothReported() {
        SceneNode frame =
                frame(
                        "arrow",
                        32,
                        frame("icon container", 30, filled("V", 4, 4, 20, 20, BLACK)));

        ValidationResult result = validator.validate(frame).result();

        assertTrue(result.errors().containsType(IssueType.CONTAINER_MISNAMED));
        assertTrue(result.errors().containsType(IssueType.CONTAINER_SIZE_MISMATCH));
    }

    @Test
    void emptyContainerIsTerminal() {
        ValidationResult result = validator.validate(icon("arrow", 32)).result();

        assertEquals(1, result.errors().size());
        assertEquals(IssueType.CONTAINER_EMPTY, result.errors().get(0).type());
    }

    @Test
    void containerWithoutVectorsIsTerminal() {
        SceneNode frame = icon("arrow", 32, group("Empty", 0, 0, 10, 10));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(IssueType.NO_VECTOR_CONTENT, result.errors().get(0).type());
    }

    @Test
    void shapeAtOriginViolatesFillSafetyZoneOnTwoEdges() {
        SceneNode frame = functionalIcon(filled("Dot", 0, 0, 10, 10, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(1, result.errors().size());
        Issue error = result.errors().get(0);
        assertEquals(IssueType.SAFETY_ZONE, error.type());
        assertEquals(
                "Check position of \"Dot\" (fill):<br>"
                        + "left edge is in safety area (0.00px, min: 2px)<br>"
                        + "top edge is in safety area (0.00px, min: 2px)",
                error.message());
        assertEquals("Dot", error.where().nodeName());
    }

    @Test
    void strokedShapesNeedTheWiderSafetyZone() {
        SceneNode frame = functionalIcon(stroked("Ring", 1, 4, 20, 20, 2, BLACK));

        Issue error = validator.validate(frame).result().errors().get(0);

        assertTrue(error.message().startsWith("Check position of \"Ring\" (stroke)"));
        assertTrue(error.message().contains("left edge is in safety area (2.00px, min: 3px)"));
    }

    @Test
    void strokeAndPositionProblemsAreMergedPerNode() {
        SceneNode frame = functionalIcon(stroked("Line", 1, 10, 10, 10, 1, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(1, result.errors().size());
        String message = result.errors().get(0).message();
        assertTrue(message.contains("incorrect stroke width: 1px"));
        assertTrue(message.contains("left edge is in safety area (1.50px, min: 3px)"));
    }

    @Test
    void strokeCenterLineClearsTheSafetyZone() {
        SceneNode frame = functionalIcon(stroked("Vector", 2, 2, 28, 28, 2, BLACK));

        MasterValidation result = validator.validate(frame);

        assertTrue(result.isValid(), () -> result.result().toString());
        assertEquals(
                new EdgeDistances(3, 3, 3, 3), result.positions().get(0).distances());
    }

    @Test
    void illustrativeContentWithinInsetPasses() {
        SceneNode frame =
                icon(
                        "bike",
                        64,
                        filled("Black", 4, 4, 28, 56, BLACK),
                        filled("Red", 32, 4, 28, 56, RED));

        MasterValidation result = validator.validate(frame);

        assertEquals(IconCategory.ILLUSTRATIVE, result.category());
        assertTrue(result.isValid(), () -> result.result().toString());
    }

    @Test
    void oversizedIllustrativeContentGetsMeasurementNote() {
        SceneNode frame =
                icon(
                        "bike",
                        64,
                        filled("Black", 2, 2, 30, 60, BLACK),
                        filled("Red", 32, 2, 30, 60, RED));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(1, result.errors().size());
        assertEquals(IssueType.CONTENT_EXTENT, result.errors().get(0).type());
        assertEquals(1, result.warnings().size());
        assertEquals(IssueType.MEASUREMENT_NOTE, result.warnings().get(0).type());
        IssueList issues = result.issues();
        assertEquals(IssueType.MEASUREMENT_NOTE, issues.get(issues.size() - 1).type());
    }

    @Test
    void illustrativeIconsNeedBothColors() {
        SceneNode frame = icon("bike", 64, filled("Black", 8, 8, 40, 40, BLACK));

        ValidationResult result = validator.validate(frame).result();

        assertEquals(1, result.errors().size());
        assertEquals(IssueType.MISSING_COLOR, result.errors().get(0).type());
        assertTrue(result.errors().get(0).message().startsWith("No red paths found"));
    }

    @Test
    void mixedFillCountsAsBothColors() {
        SceneNode frame = icon("bike", 64, mixed("Vector", 8, 8, 40, 40));

        assertTrue(validator.validate(frame).isValid());
    }

    @Test
    void fullSizeIllustrativeVectorKeepsFourPixelDistances() {
        SceneNode frame = icon("bike", 64, mixed("Vector", 4, 4, 56, 56));

        MasterValidation result = validator.validate(frame);

        assertTrue(result.isValid(), () -> result.result().toString());
        assertEquals(
                new EdgeDistances(4, 4, 4, 4), result.positions().get(0).distances());
    }

    @Test
    void fullSizeSolidVectorStillNeedsRed() {
        SceneNode frame = icon("bike", 64, filled("Vector", 4, 4, 56, 56, BLACK));

        MasterValidation result = validator.validate(frame);

        assertEquals(
                new EdgeDistances(4, 4, 4, 4), result.positions().get(0).distances());
        assertEquals(1, result.result().errors().size());
        Issue error = result.result().errors().get(0);
        assertEquals(IssueType.MISSING_COLOR, error.type());
        assertTrue(error.message().startsWith("No red paths found"));
    }

    @Test
    void fractionalFrameSizeIsNotRoundedUp() {
        SceneNode frame = icon("Icon", 31.6, filled("Vector", 4, 4, 23.6, 23.6, BLACK));

        MasterValidation detected = validator.validate(frame);
        assertNull(detected.category());
        assertEquals(IssueType.UNKNOWN_FRAME_SIZE, detected.result().errors().get(0).type());

        ValidationResult explicit = validator.validate(frame, IconCategory.FUNCTIONAL).result();
        assertFalse(explicit.isValid());
        assertEquals(IssueType.INVALID_FRAME_SIZE, explicit.errors().get(0).type());
    }

    @Test
    void shapesWithoutPaintAreIgnored() {
        SceneNode frame =
                functionalIcon(
                        filled("Vector", 4, 4, 24, 24, BLACK),
                        new SceneNode.Shape(
                                "ghost",
                                "Ghost",
                                NodeKind.RECTANGLE,
                                Bounds.of(0, 0, 32, 32),
                                null,
                                null,
                                null,
                                null));

        assertTrue(validator.validate(frame).isValid());
    }
}
