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
package net.boyechko.iconstudio.issue;

/** Represents the type of a problem found in an icon. */
public enum IssueType {
    // Structural readiness
    EMPTY_CONTAINER(ErrorKind.STRUCTURAL, "empty containers"),
    NO_VECTOR_CONTENT(ErrorKind.STRUCTURAL, "containers without vector content"),
    NEEDS_PREPARATION(ErrorKind.STRUCTURAL, "icons that need outline, union or flatten"),
    BOOLEAN_OPERATION(ErrorKind.STRUCTURAL, "unresolved boolean operations"),

    // Frame and container geometry
    UNKNOWN_FRAME_SIZE(ErrorKind.GEOMETRY, "frames with an unrecognized size"),
    FRAME_NOT_SQUARE(ErrorKind.GEOMETRY, "frames that are not square"),
    INVALID_FRAME_SIZE(ErrorKind.GEOMETRY, "frames with an invalid size"),
    FRAME_EMPTY(ErrorKind.GEOMETRY, "empty frames"),
    CONTAINER_MISSING(ErrorKind.GEOMETRY, "frames without a Container"),
    CONTAINER_MISNAMED(ErrorKind.GEOMETRY, "misnamed Container frames"),
    CONTAINER_SIZE_MISMATCH(ErrorKind.GEOMETRY, "Container frames sized unlike their parent"),
    CONTAINER_EMPTY(ErrorKind.GEOMETRY, "empty Container frames"),

    // Vector content
    STROKE_WIDTH(ErrorKind.GEOMETRY, "vectors with a non-standard stroke width"),
    SAFETY_ZONE(ErrorKind.GEOMETRY, "vectors inside the safety area"),
    CONTENT_EXTENT(ErrorKind.GEOMETRY, "content exceeding the allowed area"),
    MISSING_COLOR(ErrorKind.GEOMETRY, "icons missing a required color"),
    MEASUREMENT_NOTE(ErrorKind.GEOMETRY, "measurement notes"),

    // Naming
    NAME_CASING(ErrorKind.NAME, "names with wrong casing"),
    NAME_LENGTH(ErrorKind.NAME, "names with invalid length"),
    NAME_CHARACTERS(ErrorKind.NAME, "names with invalid characters");

    private final ErrorKind kind;
    private final String groupLabel;

    IssueType(ErrorKind kind, String groupLabel) {
        this.kind = kind;
        this.groupLabel = groupLabel;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
