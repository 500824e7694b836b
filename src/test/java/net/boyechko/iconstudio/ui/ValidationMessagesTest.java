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
package net.boyechko.iconstudio.ui;

import static net.boyechko.iconstudio.SceneFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueLoc;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.workflow.WorkflowResult;
import org.junit.jupiter.api.Test;

class ValidationMessagesTest {

    @Test
    void resultListsErrorsAndWarningsSeparately() {
        ValidationResult result =
                ValidationResult.of(
                        List.of(
                                Issue.error(
                                        IssueType.SAFETY_ZONE,
                                        IssueLoc.atNode(filled("Dot", 0, 0, 1, 1, BLACK)),
                                        "Check position of \"Dot\" (fill)"),
                                Issue.warning(
                                        IssueType.STROKE_WIDTH,
                                        IssueLoc.none(),
                                        "Stroke <strong>1.5</strong>")));

        JsonObject json =
                JsonParser.parseString(ValidationMessages.toJson(result)).getAsJsonObject();

        assertFalse(json.get("isValid").getAsBoolean());
        JsonObject error = json.getAsJsonArray("errors").get(0).getAsJsonObject();
        assertEquals("Check position of \"Dot\" (fill)", error.get("message").getAsString());
        assertEquals("Dot", error.get("node").getAsString());
        JsonObject warning = json.getAsJsonArray("warnings").get(0).getAsJsonObject();
        assertEquals("Stroke <strong>1.5</strong>", warning.get("message").getAsString());
        assertFalse(warning.has("node"));
        assertTrue(warning.get("canProceed").getAsBoolean());
    }

    @Test
    void markupIsNotEscaped() {
        ValidationResult result =
                ValidationResult.of(
                        Issue.error(IssueType.NAME_CASING, IssueLoc.none(), "a<br>b"));

        assertTrue(ValidationMessages.toJson(result).contains("a<br>b"));
    }

    @Test
    void successfulWorkflowOmitsFailureFields() {
        String text = ValidationMessages.toJson(WorkflowResult.success(List.of("Flatten")));
        JsonObject json = JsonParser.parseString(text).getAsJsonObject();

        assertTrue(json.get("success").getAsBoolean());
        assertEquals("Flatten", json.getAsJsonArray("completedSteps").get(0).getAsString());
        assertFalse(json.has("failedStep"));
        assertFalse(json.has("error"));
    }

    @Test
    void failedWorkflowNamesTheStep() {
        String text =
                ValidationMessages.toJson(
                        WorkflowResult.failure(List.of(), "Validate icon", "Validation failed"));
        JsonObject json = JsonParser.parseString(text).getAsJsonObject();

        assertEquals("Validate icon", json.get("failedStep").getAsString());
        assertEquals("Validation failed", json.get("error").getAsString());
        assertEquals(0, json.getAsJsonArray("completedSteps").size());
    }

    @Test
    void progressCarriesStepPosition() {
        JsonObject json =
                JsonParser.parseString(ValidationMessages.progress("Flatten", 2, 5))
                        .getAsJsonObject();

        assertEquals("Flatten", json.get("step").getAsString());
        assertEquals(2, json.get("index").getAsInt());
        assertEquals(5, json.get("total").getAsInt());
    }
}
