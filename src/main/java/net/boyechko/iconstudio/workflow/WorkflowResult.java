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
package net.boyechko.iconstudio.workflow;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a workflow run.
 *
 * @param completedSteps names of the steps that finished, in order
 * @param failedStep name of the step that failed; null on success
 * @param error failure reason; null on success
 */
public record WorkflowResult(
        boolean success, List<String> completedSteps, String failedStep, String error) {

    public WorkflowResult {
        completedSteps = List.copyOf(completedSteps);
    }

    public static WorkflowResult success(List<String> completedSteps) {
        return new WorkflowResult(true, completedSteps, null, null);
    }

    public static WorkflowResult failure(
            List<String> completedSteps, String failedStep, String error) {
        return new WorkflowResult(false, completedSteps, failedStep, error);
    }

    public Optional<String> failedStepName() {
        return Optional.ofNullable(failedStep);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
