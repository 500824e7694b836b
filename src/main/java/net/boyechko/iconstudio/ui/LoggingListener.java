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

import net.boyechko.iconstudio.core.ProcessingListener;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueSev;
import net.boyechko.iconstudio.workflow.WorkflowResult;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    static final String LOGGER_NAME = "net.boyechko.iconstudio.processing";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        String message = "ISSUE " + issue.type() + ": " + plain(issue.message()) + where(issue);
        if (issue.severity() == IssueSev.WARNING) {
            logger.warn("{}", message);
        } else {
            logger.error("{}", message);
        }
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onProgress(String stepName, int index, int total) {
        logger.info("STEP {}/{} {}", index, total, stepName);
    }

    @Override
    public void onSummary(WorkflowResult result) {
        if (result.success()) {
            logger.info("SUMMARY success completed={}", result.completedSteps().size());
        } else {
            logger.info(
                    "SUMMARY failed at '{}' completed={}: {}",
                    result.failedStep(),
                    result.completedSteps().size(),
                    result.error());
        }
    }

    private static String where(Issue issue) {
        String node = issue.where().nodeName();
        return node != null ? " (at " + node + ")" : "";
    }

    /** Strips the markup used by the plugin UI. */
    static String plain(String message) {
        return message.replace("<br>", " ").replaceAll("</?strong>", "");
    }
}
