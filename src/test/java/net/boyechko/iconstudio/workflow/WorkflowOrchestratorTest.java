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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class WorkflowOrchestratorTest {

    @Test
    void stopsAtFirstFailureAndReportsProgressUpToIt() {
        List<String> progress = new ArrayList<>();
        AtomicBoolean cRan = new AtomicBoolean();
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator()
                        .addStep("A", () -> {})
                        .addStep(
                                "B",
                                () -> {
                                    throw new IllegalStateException("boom");
                                })
                        .addStep("C", () -> cRan.set(true));

        WorkflowResult result =
                orchestrator.run(
                        (name, index, total) -> progress.add(name + " " + index + "/" + total));

        assertFalse(result.success());
        assertEquals(List.of("A"), result.completedSteps());
        assertEquals("B", result.failedStep());
        assertEquals("boom", result.error());
        assertEquals(List.of("A 1/3", "B 2/3"), progress);
        assertFalse(cRan.get());
    }

    @Test
    void errorsThrownByStepsAlsoFailTheRun() {
        AtomicBoolean laterRan = new AtomicBoolean();
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator()
                        .addStep(
                                "assert",
                                () -> {
                                    throw new AssertionError("boom");
                                })
                        .addStep("later", () -> laterRan.set(true));

        WorkflowResult result = orchestrator.run((name, index, total) -> {});

        assertFalse(result.success());
        assertTrue(result.completedSteps().isEmpty());
        assertEquals("assert", result.failedStep());
        assertEquals("boom", result.error());
        assertFalse(laterRan.get());
    }

    @Test
    void emptyWorkflowSucceedsWithoutProgress() {
        List<String> progress = new ArrayList<>();

        WorkflowResult result =
                new WorkflowOrchestrator().run((name, index, total) -> progress.add(name));

        assertTrue(result.success());
        assertTrue(result.completedSteps().isEmpty());
        assertTrue(result.failedStepName().isEmpty());
        assertTrue(result.errorMessage().isEmpty());
        assertTrue(progress.isEmpty());
    }

    @Test
    void allStepsRunInInsertionOrder() {
        List<String> ran = new ArrayList<>();
        WorkflowOrchestrator orchestrator = new WorkflowOrchestrator();
        for (String name : List.of("outline", "union", "flatten")) {
            orchestrator.addStep(name, () -> ran.add(name));
        }

        WorkflowResult result = orchestrator.run();

        assertTrue(result.success());
        assertEquals(List.of("outline", "union", "flatten"), ran);
        assertEquals(ran, result.completedSteps());
    }

    @Test
    void asyncStepsAreAwaited() {
        List<String> ran = new ArrayList<>();
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator()
                        .addAsyncStep(
                                "async",
                                () -> CompletableFuture.runAsync(() -> ran.add("async")))
                        .addStep("sync", () -> ran.add("sync"));

        WorkflowResult result = orchestrator.run();

        assertTrue(result.success());
        assertEquals(List.of("async", "sync"), ran);
    }

    @Test
    void asyncFailureReportsTheUnderlyingCause() {
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator()
                        .addAsyncStep(
                                "late",
                                () ->
                                        CompletableFuture.supplyAsync(
                                                () -> {
                                                    throw new IllegalArgumentException("too late");
                                                }));

        WorkflowResult result = orchestrator.run();

        assertFalse(result.success());
        assertEquals("late", result.failedStep());
        assertEquals("too late", result.error());
    }

    @Test
    void exceptionWithoutMessageUsesItsStringForm() {
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator()
                        .addStep(
                                "silent",
                                () -> {
                                    throw new IllegalStateException();
                                });

        WorkflowResult result = orchestrator.run();

        assertEquals("java.lang.IllegalStateException", result.error());
    }

    @Test
    void stepsCanBeListedAndCleared() {
        WorkflowOrchestrator orchestrator =
                new WorkflowOrchestrator().addStep("one", () -> {}).addStep("two", () -> {});

        assertEquals(2, orchestrator.getStepCount());
        assertEquals(List.of("one", "two"), orchestrator.getStepNames());

        orchestrator.clear();

        assertEquals(0, orchestrator.getStepCount());
        assertTrue(orchestrator.run().success());
    }
}
