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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueLoc;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.scene.NodeKind;
import net.boyechko.iconstudio.scene.SceneNode;
import org.junit.jupiter.api.Test;

/** Tests for SceneTreeWalker and visitor infrastructure. */
class SceneTreeWalkerTest {

    private static SceneNode sampleTree() {
        return icon(
                "Icon",
                32,
                group("Group", 4, 4, 20, 20, filled("Left", 0, 0, 8, 8, BLACK)),
                filled("Right", 20, 4, 8, 8, BLACK));
    }

    @Test
    void walkerVisitsEveryNodeBelowTheRoot() {
        List<String> visited = new ArrayList<>();
        SceneTreeVisitor tracking =
                new SceneTreeVisitor() {
                    @Override
                    public String name() {
                        return "Tracking Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        visited.add(ctx.node().name() + "@" + ctx.depth());
                        return true;
                    }
                };

        new SceneTreeWalker().addVisitor(tracking).walk(sampleTree());

        assertEquals(List.of("Container@0", "Group@1", "Left@2", "Right@1"), visited);
    }

    @Test
    void visitorContextProvidesPathAndAncestors() {
        List<String> paths = new ArrayList<>();
        List<List<String>> ancestors = new ArrayList<>();
        SceneTreeVisitor pathVisitor =
                new SceneTreeVisitor() {
                    @Override
                    public String name() {
                        return "Path Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        if (ctx.node().kind() == NodeKind.VECTOR) {
                            paths.add(ctx.path());
                            ancestors.add(ctx.ancestorNames());
                        }
                        return true;
                    }
                };

        new SceneTreeWalker().addVisitor(pathVisitor).walk(sampleTree());

        assertEquals("Container[1].Group[2].Left[3]", paths.get(0));
        assertEquals(List.of("Container", "Group"), ancestors.get(0));
        assertEquals(List.of("Container"), ancestors.get(1));
    }

    @Test
    void returningFalseSkipsChildren() {
        List<String> visited = new ArrayList<>();
        SceneTreeVisitor skipping =
                new SceneTreeVisitor() {
                    @Override
                    public String name() {
                        return "Skipping Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        visited.add(ctx.node().name());
                        return ctx.node().kind() != NodeKind.GROUP;
                    }
                };

        new SceneTreeWalker().addVisitor(skipping).walk(sampleTree());

        assertEquals(List.of("Container", "Group", "Right"), visited);
    }

    @Test
    void failingVisitorDoesNotStopOthers() {
        List<String> visited = new ArrayList<>();
        SceneTreeVisitor failing =
                new SceneTreeVisitor() {
                    @Override
                    public String name() {
                        return "Failing Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        throw new IllegalStateException("boom");
                    }
                };
        SceneTreeVisitor tracking =
                new SceneTreeVisitor() {
                    @Override
                    public String name() {
                        return "Tracking Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        visited.add(ctx.node().name());
                        return true;
                    }
                };

        new SceneTreeWalker().addVisitor(failing).addVisitor(tracking).walk(sampleTree());

        assertEquals(4, visited.size());
    }

    @Test
    void issuesFromAllVisitorsAreCollected() {
        SceneTreeVisitor reporting =
                new SceneTreeVisitor() {
                    private final IssueList issues = new IssueList();

                    @Override
                    public String name() {
                        return "Reporting Visitor";
                    }

                    @Override
                    public boolean enterNode(VisitorContext ctx) {
                        if (ctx.node().kind() == NodeKind.GROUP) {
                            issues.add(
                                    Issue.warning(
                                            IssueType.BOOLEAN_OPERATION,
                                            IssueLoc.atNode(ctx.node()),
                                            "found group"));
                        }
                        return true;
                    }

                    @Override
                    public IssueList getIssues() {
                        return issues;
                    }
                };

        IssueList issues = new SceneTreeWalker().addVisitor(reporting).walk(sampleTree());

        assertEquals(1, issues.size());
        assertEquals("Group", issues.get(0).where().nodeName());
    }

    @Test
    void verboseOutputListsEveryNode() {
        List<String> lines = new ArrayList<>();

        new SceneTreeWalker().addVisitor(new VerboseOutputVisitor(lines::add)).walk(sampleTree());

        assertEquals(2 + 4, lines.size(), "header, separator and one row per node");
        assertTrue(lines.get(0).startsWith("Index"));
        assertTrue(lines.get(4).contains("- Left"));
        assertTrue(lines.get(4).contains("fills=1"));
    }
}
