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
package net.boyechko.iconstudio.scene;

import java.util.List;

/**
 * Write contract with the host scene graph. Every call is an opaque, individually atomic mutation
 * performed by the host; validators never use this interface, only repair steps do.
 *
 * <p>Nodes are addressed by id. Operations that replace nodes (outline, union, flatten, clone)
 * return the id of the node they produced.
 */
public interface SceneEditor {

    /** Re-reads the current state of a node and its subtree. */
    SceneNode snapshot(String id) throws SceneEditException;

    /** Converts a stroked primitive into an equivalent filled path, in place. */
    String outlineStroke(String id) throws SceneEditException;

    /** Boolean-unions the given nodes into one node appended to {@code parentId}. */
    String union(List<String> ids, String parentId) throws SceneEditException;

    /** Flattens the given nodes into a single vector appended to {@code parentId}. */
    String flatten(List<String> ids, String parentId) throws SceneEditException;

    /** Duplicates a node with its subtree; the clone is placed next to the original. */
    String cloneNode(String id) throws SceneEditException;

    void resize(String id, double width, double height) throws SceneEditException;

    /** Scales the node's geometry (paths, stroke weights) by {@code factor}. */
    void rescale(String id, double factor) throws SceneEditException;

    void move(String id, double x, double y) throws SceneEditException;

    void appendChild(String parentId, String childId) throws SceneEditException;

    void remove(String id) throws SceneEditException;

    void rename(String id, String name) throws SceneEditException;

    /** Binds every fill paint of the node to the named color variable. */
    void bindFillVariable(String id, String variableName) throws SceneEditException;

    void setDescription(String id, String description) throws SceneEditException;
}
