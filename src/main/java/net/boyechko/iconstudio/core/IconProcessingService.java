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
package net.boyechko.iconstudio.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.repair.RepairContext;
import net.boyechko.iconstudio.repair.RepairStep;
import net.boyechko.iconstudio.repair.ValidationGate;
import net.boyechko.iconstudio.scene.SceneEditException;
import net.boyechko.iconstudio.scene.SceneEditor;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.validation.IconCategory;
import net.boyechko.iconstudio.validation.IconRules;
import net.boyechko.iconstudio.validation.SceneTreeWalker;
import net.boyechko.iconstudio.validation.ValidationEngine;
import net.boyechko.iconstudio.validation.VerboseOutputVisitor;
import net.boyechko.iconstudio.workflow.WorkflowOrchestrator;
import net.boyechko.iconstudio.workflow.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes icon frames and runs the repair pipeline against them.
 *
 * <p>The pipeline is gated: it refuses to run when the icon has size, stroke or safety-zone
 * errors, since those need a designer's judgement. Steps that complete before a failure are left
 * in place.
 */
public class IconProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(IconProcessingService.class);

    private static final String ANALYZE_PHASE = "Analyze icon";
    private static final String REPAIR_PHASE = "Prepare icon";

    private final SceneEditor editor;
    private final ProcessingListener listener;
    private final IconRules rules;
    private final ValidationEngine engine;
    private final boolean printSceneTree;

    public static class IconProcessingServiceBuilder {
        private SceneEditor editor;
        private ProcessingListener listener;
        private IconRules rules;
        private boolean printSceneTree;

        public IconProcessingServiceBuilder withSceneEditor(SceneEditor editor) {
            this.editor = editor;
            return this;
        }

        public IconProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public IconProcessingServiceBuilder withRules(IconRules rules) {
            this.rules = rules;
            return this;
        }

        public IconProcessingServiceBuilder withPrintSceneTree(boolean printSceneTree) {
            this.printSceneTree = printSceneTree;
            return this;
        }

        public IconProcessingService build() {
            if (editor == null) {
                throw new IllegalStateException(
                        "SceneEditor must be provided via withSceneEditor(...) before building"
                                + " IconProcessingService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before"
                                + " building IconProcessingService");
            }
            return new IconProcessingService(this);
        }
    }

    public static IconProcessingServiceBuilder builder() {
        return new IconProcessingServiceBuilder();
    }

    private IconProcessingService(IconProcessingServiceBuilder builder) {
        this.editor = builder.editor;
        this.listener = builder.listener;
        this.rules = builder.rules != null ? builder.rules : IconRules.loadDefault();
        this.engine = new ValidationEngine(rules);
        this.printSceneTree = builder.printSceneTree;
    }

    public IconReport analyze(SceneNode frame, IconCategory category) {
        return analyze(frame, category, null);
    }

    /**
     * Validates {@code frame} and reports every issue to the listener.
     *
     * @param category category to check against; null to detect it from the frame size
     * @param iconName name to check; null to skip the name check
     */
    public IconReport analyze(SceneNode frame, IconCategory category, String iconName) {
        listener.onPhaseStart(ANALYZE_PHASE);
        if (printSceneTree) {
            new SceneTreeWalker()
                    .addVisitor(new VerboseOutputVisitor(listener::onVerboseOutput))
                    .walk(frame);
        }

        IconReport report = engine.evaluate(frame, category, iconName);
        IssueList issues = report.allIssues();
        if (issues.isEmpty()) {
            listener.onSuccess("No issues found");
        } else {
            reportIssuesGrouped(issues);
            listener.onInfo("Found " + issues.size() + " issue(s)");
        }
        if (report.nameSuggestion() != null) {
            listener.onInfo("Suggested name: " + report.nameSuggestion());
        }
        return report;
    }

    /**
     * Runs the repair pipeline for the frame named in {@code request}. Only the steps the analysis
     * says are needed are scheduled; the validation gate always runs first.
     */
    public WorkflowResult remediate(RepairRequest request) {
        SceneNode frame;
        try {
            frame = editor.snapshot(request.frameId());
        } catch (SceneEditException e) {
            listener.onError("Could not read icon: " + e.getMessage());
            WorkflowResult result =
                    WorkflowResult.failure(List.of(), ANALYZE_PHASE, e.getMessage());
            listener.onSummary(result);
            return result;
        }

        IconReport report = analyze(frame, request.category());
        if (report.category() == null) {
            String error =
                    report.master().result().errors().stream()
                            .findFirst()
                            .map(Issue::message)
                            .orElse("Could not determine icon category");
            listener.onError(error);
            WorkflowResult result = WorkflowResult.failure(List.of(), ANALYZE_PHASE, error);
            listener.onSummary(result);
            return result;
        }

        RepairContext ctx = new RepairContext(editor, rules, report.category(), request);
        WorkflowOrchestrator orchestrator = new WorkflowOrchestrator();
        for (RepairStep step : ProcessingDefaults.repairSteps()) {
            if (step instanceof ValidationGate || step.isNeeded(report, ctx)) {
                orchestrator.addStep(step.name(), () -> step.apply(ctx));
            } else {
                logger.debug("Skipping step '{}': nothing to do", step.name());
            }
        }

        listener.onPhaseStart(REPAIR_PHASE);
        WorkflowResult result = orchestrator.run(listener::onProgress);
        if (result.success()) {
            listener.onSuccess("Icon prepared (" + result.completedSteps().size() + " steps)");
        } else {
            listener.onError(result.failedStep() + ": " + result.error());
        }
        listener.onSummary(result);
        return result;
    }

    public IconRules rules() {
        return rules;
    }

    // == Reporting helpers ============================================

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }
}
