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
package net.boyechko.iconstudio.repair;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.iconstudio.validation.IconCategory;

/**
 * Formats icon descriptions in the library's fixed layout and parses them back.
 *
 * <pre>
 * EN:                          EN: text
 * Default: text                DE: text
 * Contextual: text
 *                              Keywords: words
 * DE:                          #illustrativeicon #ii
 * Default: text
 * Contextual: text
 *
 * Keywords: words
 * #functionalicon #fi #coreicon
 * </pre>
 */
public final class DescriptionTemplate {
    public static final String FUNCTIONAL_TAGS = "#functionalicon #fi #coreicon";
    public static final String ILLUSTRATIVE_TAGS = "#illustrativeicon #ii";

    private DescriptionTemplate() {}

    /**
     * Formats the description. Optional fields that are blank are written empty.
     *
     * @throws IllegalArgumentException if a required field is missing
     */
    public static String format(DescriptionData data) {
        requireComplete(data);
        if (data instanceof DescriptionData.Functional f) {
            return "EN:\n"
                    + "Default: "
                    + f.enDefault()
                    + "\n"
                    + "Contextual: "
                    + orEmpty(f.enContextual())
                    + "\n"
                    + "\n"
                    + "DE:\n"
                    + "Default: "
                    + f.deDefault()
                    + "\n"
                    + "Contextual: "
                    + orEmpty(f.deContextual())
                    + "\n"
                    + "\n"
                    + "Keywords: "
                    + orEmpty(f.keywords())
                    + "\n"
                    + FUNCTIONAL_TAGS;
        }
        DescriptionData.Illustrative i = (DescriptionData.Illustrative) data;
        return "EN: "
                + i.en()
                + "\n"
                + "DE: "
                + i.de()
                + "\n"
                + "\n"
                + "Keywords: "
                + orEmpty(i.keywords())
                + "\n"
                + ILLUSTRATIVE_TAGS;
    }

    /** Parses a formatted description; empty if required fields are missing. */
    public static Optional<DescriptionData> parse(String description, IconCategory category) {
        if (description == null) {
            return Optional.empty();
        }
        return category == IconCategory.FUNCTIONAL
                ? parseFunctional(description)
                : parseIllustrative(description);
    }

    /**
     * @throws IllegalArgumentException listing every missing required field
     */
    public static void requireComplete(DescriptionData data) {
        List<String> errors = new ArrayList<>();
        if (data instanceof DescriptionData.Functional f) {
            if (isBlank(f.enDefault())) errors.add("EN Default is required");
            if (isBlank(f.deDefault())) errors.add("DE Default is required");
        } else if (data instanceof DescriptionData.Illustrative i) {
            if (isBlank(i.en())) errors.add("EN is required");
            if (isBlank(i.de())) errors.add("DE is required");
        } else {
            throw new IllegalArgumentException("No description data");
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid description data: " + String.join(", ", errors));
        }
    }

    private static Optional<DescriptionData> parseFunctional(String description) {
        String section = "";
        String enDefault = null;
        String enContextual = "";
        String deDefault = null;
        String deContextual = "";
        String keywords = "";

        for (String line : description.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.equals("EN:")) {
                section = "EN";
            } else if (trimmed.equals("DE:")) {
                section = "DE";
            } else if (trimmed.startsWith("Default:")) {
                String value = valueAfter(trimmed, "Default:");
                if (section.equals("EN")) {
                    enDefault = value;
                } else if (section.equals("DE")) {
                    deDefault = value;
                }
            } else if (trimmed.startsWith("Contextual:")) {
                String value = valueAfter(trimmed, "Contextual:");
                if (section.equals("EN")) {
                    enContextual = value;
                } else if (section.equals("DE")) {
                    deContextual = value;
                }
            } else if (trimmed.startsWith("Keywords:")) {
                keywords = valueAfter(trimmed, "Keywords:");
            }
        }

        if (isBlank(enDefault) || isBlank(deDefault)) {
            return Optional.empty();
        }
        return Optional.of(
                new DescriptionData.Functional(
                        enDefault, enContextual, deDefault, deContextual, keywords));
    }

    private static Optional<DescriptionData> parseIllustrative(String description) {
        String en = null;
        String de = null;
        String keywords = "";

        for (String line : description.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("EN:")) {
                en = valueAfter(trimmed, "EN:");
            } else if (trimmed.startsWith("DE:")) {
                de = valueAfter(trimmed, "DE:");
            } else if (trimmed.startsWith("Keywords:")) {
                keywords = valueAfter(trimmed, "Keywords:");
            }
        }

        if (isBlank(en) || isBlank(de)) {
            return Optional.empty();
        }
        return Optional.of(new DescriptionData.Illustrative(en, de, keywords));
    }

    private static String valueAfter(String line, String prefix) {
        return line.substring(prefix.length()).trim();
    }

    private static String orEmpty(String s) {
        return isBlank(s) ? "" : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
