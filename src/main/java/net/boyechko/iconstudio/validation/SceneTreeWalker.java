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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a scene subtree once, invoking multiple visitors at each node. The root itself is not
 * visited; its children are depth 0.
 */
public class SceneTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(SceneTreeWalker.class);

    private final List<SceneTreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public SceneTreeWalker addVisitor(SceneTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(SceneNode root) {
        this.globalIndex = 0;

        for (SceneTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        List<SceneNode> ancestors = new ArrayList<>();
        for (SceneNode child : root.children()) {
            walkNode(child, "", ancestors, 0);
        }

        IssueList allIssues = new IssueList();
        for (SceneTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }

        return allIssues;
    }

    private void walkNode(SceneNode node, String parentPath, List<SceneNode> ancestors, int depth) {
        globalIndex++;

        String path = parentPath + SceneTree.label(node) + "[" + globalIndex + "]";
        VisitorContext ctx = new VisitorContext(node, path, ancestors, depth, globalIndex);

        // Call enterNode on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (SceneTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterNode(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren && !node.children().isEmpty()) {
            ancestors.add(node);
            for (SceneNode child : node.children()) {
                walkNode(child, path + ".", ancestors, depth + 1);
            }
            ancestors.remove(ancestors.size() - 1);
        }

        for (SceneTreeVisitor visitor : visitors) {
            try {
                visitor.leaveNode(ctx);
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
