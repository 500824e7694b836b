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

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import net.boyechko.iconstudio.issue.Issue;
import net.boyechko.iconstudio.issue.IssueList;
import net.boyechko.iconstudio.issue.IssueLoc;
import net.boyechko.iconstudio.issue.IssueType;
import net.boyechko.iconstudio.issue.ValidationResult;

/**
 * Checks icon names against the category's casing convention: kebab-case for functional icons,
 * snake_case for illustrative ones. Several errors may be reported for one name.
 */
public class NameValidator {
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 50;
    public static final String FALLBACK_NAME = "icon";

    private static final Pattern ALLOWED_CHARS = Pattern.compile("^[a-z0-9_-]+$");
    private static final String SNAKE_CASE_MESSAGE =
            "Name must be in snake_case format (lowercase with underscores)";
    private static final String KEBAB_CASE_MESSAGE =
            "Name must be in kebab-case format (lowercase with hyphens)";

    private final IconRules rules;

    public NameValidator(IconRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ValidationResult validate(String name, IconCategory category) {
        Objects.requireNonNull(name, "name");
        char sep = rules.forCategory(category).separator();
        IssueList issues = new IssueList();

        if (!casingPattern(sep).matcher(name).matches()) {
            issues.add(
                    Issue.error(
                            IssueType.NAME_CASING,
                            IssueLoc.none(),
                            sep == '_' ? SNAKE_CASE_MESSAGE : KEBAB_CASE_MESSAGE));
        }

        if (name.length() < MIN_LENGTH || name.length() > MAX_LENGTH) {
            issues.add(
                    Issue.error(
                            IssueType.NAME_LENGTH,
                            IssueLoc.none(),
                            "Name must be between "
                                    + MIN_LENGTH
                                    + " and "
                                    + MAX_LENGTH
                                    + " characters"));
        }

        if (!ALLOWED_CHARS.matcher(name).matches()) {
            issues.add(
                    Issue.error(
                            IssueType.NAME_CHARACTERS,
                            IssueLoc.none(),
                            "Name must not contain special characters"
                                    + " (only letters, numbers, and separators)"));
        }

        return ValidationResult.of(issues);
    }

    /**
     * Builds a corrected name: lowercased, disallowed characters replaced by the separator, runs
     * of separators collapsed and trimmed, truncated to {@value #MAX_LENGTH} characters, and
     * replaced by {@value #FALLBACK_NAME} if fewer than {@value #MIN_LENGTH} remain. Applying it
     * to its own output returns the same string.
     */
    public String generateSuggestion(String name, IconCategory category) {
        Objects.requireNonNull(name, "name");
        char sep = rules.forCategory(category).separator();
        String quoted = Pattern.quote(String.valueOf(sep));

        String suggestion = name.toLowerCase(Locale.ROOT);
        suggestion = suggestion.replaceAll("[^a-z0-9" + quoted + "]", String.valueOf(sep));
        suggestion = suggestion.replaceAll(quoted + "+", String.valueOf(sep));
        suggestion = trimSeparators(suggestion, sep);

        if (suggestion.length() > MAX_LENGTH) {
            // Cutting may expose a trailing separator
            suggestion = trimSeparators(suggestion.substring(0, MAX_LENGTH), sep);
        }
        if (suggestion.length() < MIN_LENGTH) {
            suggestion = FALLBACK_NAME;
        }
        return suggestion;
    }

    private static Pattern casingPattern(char sep) {
        String s = Pattern.quote(String.valueOf(sep));
        return Pattern.compile("^[a-z0-9]+(" + s + "[a-z0-9]+)*$");
    }

    private static String trimSeparators(String s, char sep) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == sep) {
            start++;
        }
        while (end > start && s.charAt(end - 1) == sep) {
            end--;
        }
        return s.substring(start, end);
    }
}
