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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs named steps strictly in insertion order, stopping at the first failure.
 *
 * <p>Each step runs to completion before the next starts; asynchronous steps are awaited. There
 * is no timeout, so a step that never completes blocks the run. Steps that completed before a
 * failure are not rolled back. Any throwable a step raises fails the run, except a {@link
 * VirtualMachineError}, which propagates.
 */
public class WorkflowOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final List<WorkflowStep> steps = new ArrayList<>();

    public WorkflowOrchestrator addStep(String name, WorkflowStep.Action action) {
        steps.add(new WorkflowStep(name, action));
        return this;
    }

    /** Adds a step whose work completes asynchronously; the run waits for the stage. */
    public WorkflowOrchestrator addAsyncStep(
            String name, Supplier<? extends CompletionStage<?>> operation) {
        steps.add(new WorkflowStep(name, () -> await(operation.get())));
        return this;
    }

    public WorkflowResult run() {
        return run(null);
    }

    /**
     * Executes all steps. {@code onProgress} is called before each step; once a step fails no
     * further steps run and no further progress is reported.
     */
    public WorkflowResult run(ProgressCallback onProgress) {
        List<String> completed = new ArrayList<>();
        List<WorkflowStep> toRun = List.copyOf(steps);
        int total = toRun.size();

        logger.debug("Starting workflow with {} steps", total);
        for (int i = 0; i < total; i++) {
            WorkflowStep step = toRun.get(i);
            if (onProgress != null) {
                onProgress.onProgress(step.name(), i + 1, total);
            }
            try {
                step.action().execute();
            } catch (Throwable t) {
                if (t instanceof VirtualMachineError vme) {
                    throw vme;
                }
                String error = describe(unwrap(t));
                logger.error("Step '{}' failed: {}", step.name(), error);
                return WorkflowResult.failure(completed, step.name(), error);
            }
            logger.debug("Step '{}' completed", step.name());
            completed.add(step.name());
        }

        logger.debug("Workflow completed: {}", completed);
        return WorkflowResult.success(completed);
    }

    public void clear() {
        steps.clear();
    }

    public int getStepCount() {
        return steps.size();
    }

    public List<String> getStepNames() {
        return steps.stream().map(WorkflowStep::name).toList();
    }

    private static void await(CompletionStage<?> stage) throws Exception {
        try {
            stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** The failure's message, or its string form when it has none. */
    static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
