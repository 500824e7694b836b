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

import java.util.Objects;

/** Represents a single problem found while validating an icon. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLoc where;
    private final String message;

    public Issue(IssueType type, IssueSev sev, String message) {
        this(type, sev, IssueLoc.none(), message);
    }

    public Issue(IssueType type, IssueSev sev, IssueLoc where, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(sev, "severity");
        this.where = where != null ? where : IssueLoc.none();
        this.message = Objects.requireNonNull(message, "message");
    }

    public static Issue error(IssueType type, IssueLoc where, String message) {
        return new Issue(type, IssueSev.ERROR, where, message);
    }

    public static Issue warning(IssueType type, IssueLoc where, String message) {
        return new Issue(type, IssueSev.WARNING, where, message);
    }

    public IssueType type() {
        return type;
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLoc where() {
        return where;
    }

    /** Message text; may contain {@code <br>} and {@code <strong>} markup for the UI. */
    public String message() {
        return message;
    }

    public ErrorKind kind() {
        return type.kind();
    }

    public boolean isError() {
        return severity == IssueSev.ERROR;
    }

    @Override
    public String toString() {
        String node = where.nodeName();
        return severity + " " + type + (node != null ? " [" + node + "]" : "") + ": " + message;
    }
}
