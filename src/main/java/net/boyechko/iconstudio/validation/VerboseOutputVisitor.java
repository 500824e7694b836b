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

import java.util.function.Consumer;
import net.boyechko.iconstudio.scene.SceneNode;
import net.boyechko.iconstudio.scene.SceneTree;

/** Outputs a tabular listing of the scene tree during traversal. */
public class VerboseOutputVisitor implements SceneTreeVisitor {

    private static final String INDENT = "  ";
    private static final int INDEX_WIDTH = 5;
    private static final int NODE_NAME_WIDTH = 30;
    private static final int KIND_WIDTH = 18;
    private static final int SIZE_WIDTH = 14;

    private static final String ROW_FORMAT =
            String.format(
                    "%%-%ds %%-%ds %%-%ds %%-%ds %%s",
                    INDEX_WIDTH, NODE_NAME_WIDTH, KIND_WIDTH, SIZE_WIDTH);

    private final Consumer<String> output;
    private boolean headerPrinted = false;

    public VerboseOutputVisitor(Consumer<String> output) {
        this.output = output;
    }

    @Override
    public String name() {
        return "Verbose Scene Tree Traversal";
    }

    @Override
    public void beforeTraversal() {
        printHeader();
    }

    @Override
    public boolean enterNode(VisitorContext ctx) {
        if (!headerPrinted) {
            printHeader();
        }
        printNode(ctx);
        // Operands of a boolean operation are listed too
        return true;
    }

    private void printHeader() {
        if (headerPrinted) return;
        headerPrinted = true;

        output.accept(String.format(ROW_FORMAT, "Index", "Node", "Kind", "Size", "Paint"));
        output.accept(
                String.format(
                        ROW_FORMAT,
                        "-".repeat(INDEX_WIDTH),
                        "-".repeat(NODE_NAME_WIDTH),
                        "-".repeat(KIND_WIDTH),
                        "-".repeat(SIZE_WIDTH),
                        "-".repeat(20)));
    }

    private void printNode(VisitorContext ctx) {
        SceneNode node = ctx.node();
        String paddedIndex = String.format("%" + INDEX_WIDTH + "d", ctx.globalIndex());
        String nodeName = INDENT.repeat(ctx.depth()) + "- " + SceneTree.label(node);
        String size = String.format("%.2fx%.2f", node.width(), node.height());

        output.accept(
                String.format(
                        ROW_FORMAT, paddedIndex, nodeName, node.kind(), size, paintSummary(node)));
    }

    private static String paintSummary(SceneNode node) {
        StringBuilder sb = new StringBuilder();
        if (node.fills().isMixed()) {
            sb.append("fill=mixed");
        } else if (!node.fills().paints().isEmpty()) {
            sb.append("fills=").append(node.fills().paints().size());
        }
        if (node.stroke().weight() > 0) {
            if (sb.length() > 0) sb.append(' ');
            sb.append("stroke=").append(node.stroke().weight());
        }
        return sb.toString();
    }
}
