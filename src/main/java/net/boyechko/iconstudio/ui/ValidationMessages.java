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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.List;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.ValidationResult;
import net.boyechko.iconstudio.workflow.WorkflowResult;

/**
 * JSON messages exchanged with the plugin UI. Absent optional fields are omitted from the output.
 */
public final class ValidationMessages {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private ValidationMessages() {}

    static final class ErrorEntry {
        String message;
        String node;

        ErrorEntry(Issue issue) {
            this.message = issue.message();
            this.node = issue.where().nodeName();
        }
    }

    static final class WarningEntry {
        String message;
        String node;
        boolean canProceed = true;

        WarningEntry(Issue issue) {
            this.message = issue.message();
            this.node = issue.where().nodeName();
        }
    }

    static final class ResultMessage {
        boolean isValid;
        List<ErrorEntry> errors;
        List<WarningEntry> warnings;
    }

    static final class ProgressMessage {
        String step;
        int index;
        int total;
    }

    static final class WorkflowMessage {
        boolean success;
        List<String> completedSteps;
        String failedStep;
        String error;
    }

    /** {@code {isValid, errors:[{message,node?}], warnings:[{message,node?,canProceed}]}} */
    public static String toJson(ValidationResult result) {
        ResultMessage msg = new ResultMessage();
        msg.isValid = result.isValid();
        msg.errors = result.errors().stream().map(ErrorEntry::new).toList();
        msg.warnings = result.warnings().stream().map(WarningEntry::new).toList();
        return GSON.toJson(msg);
    }

    /** {@code {step, index, total}} */
    public static String progress(String stepName, int index, int total) {
        ProgressMessage msg = new ProgressMessage();
        msg.step = stepName;
        msg.index = index;
        msg.total = total;
        return GSON.toJson(msg);
    }

    /** {@code {success, completedSteps, failedStep?, error?}} */
    public static String toJson(WorkflowResult result) {
        WorkflowMessage msg = new WorkflowMessage();
        msg.success = result.success();
        msg.completedSteps = result.completedSteps();
        msg.failedStep = result.failedStep();
        msg.error = result.error();
        return GSON.toJson(msg);
    }
}
