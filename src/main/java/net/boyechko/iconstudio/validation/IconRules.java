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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.iconstudio.color.ColorClassifier;
import net.boyechko.iconstudio.color.ColorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Size, stroke, color and naming rules per icon category, loaded from YAML. */
public final class IconRules {
    private static final String DEFAULT_RULES_RESOURCE = "/icon-rules.yaml";
    private static final Logger logger = LoggerFactory.getLogger(IconRules.class);

    public Colors colors;
    public Map<String, CategoryRules> categories;

    /** Channel thresholds for color classification. */
    public static final class Colors {
        public double dark_max = ColorClassifier.DEFAULT_DARK_MAX;
        public double red_min = ColorClassifier.DEFAULT_RED_MIN;
        public double red_other_max = ColorClassifier.DEFAULT_RED_OTHER_MAX;
    }

    public static final class CategoryRules {
        /** Master sizes; used to detect the category of an outer frame. */
        public List<Integer> frame_sizes = new ArrayList<>();

        /** Sizes produced by scaling a master; valid for variants but not detected. */
        public List<Integer> scaled_sizes = new ArrayList<>();

        public double required_stroke_width = 2.0;

        /**
         * Stroke widths accepted with a warning. Empty means any width other than the required
         * one is an error.
         */
        public List<Double> tolerated_stroke_widths = new ArrayList<>();

        public double fill_safety_zone = 2.0;
        public double stroke_safety_zone = 3.0;

        /** Total inset from the frame edge that content must respect; 0 disables the check. */
        public double content_inset;

        /** Colors the finished icon must contain, e.g. black and red for two-color icons. */
        public List<String> required_colors = new ArrayList<>();

        /** Whether position errors are prefixed with a note on center-line measurement. */
        public boolean center_line_note;

        public String name_separator = "-";
        public List<String> tracked_colors = new ArrayList<>();
        public String content_holder_name = "Container";

        /** Color group key (e.g. "black") to the color variable fills are bound to. */
        public Map<String, String> color_variables = new HashMap<>();

        public List<Integer> validSizes() {
            List<Integer> sizes = new ArrayList<>(frame_sizes);
            for (Integer s : scaled_sizes) {
                if (!sizes.contains(s)) {
                    sizes.add(s);
                }
            }
            return sizes;
        }

        public boolean isToleratedStrokeWidth(double width) {
            for (Double tolerated : tolerated_stroke_widths) {
                if (tolerated != null && tolerated == width) {
                    return true;
                }
            }
            return false;
        }

        public List<ColorGroup> trackedGroups() {
            return tracked_colors.stream().map(ColorGroup::fromKey).toList();
        }

        public char separator() {
            return name_separator.charAt(0);
        }

        /** Returns the variable bound for a color group, or null if the group is not bound. */
        public String colorVariable(ColorGroup group) {
            return color_variables.get(group.key());
        }
    }

    public IconRules() {
        this.colors = new Colors();
        this.categories = new HashMap<>();
    }

    public CategoryRules forCategory(IconCategory category) {
        CategoryRules rules = categories.get(category.key());
        if (rules == null) {
            throw new IllegalArgumentException("No rules defined for category " + category.key());
        }
        return rules;
    }

    public ColorClassifier colorClassifier() {
        return new ColorClassifier(colors.dark_max, colors.red_min, colors.red_other_max);
    }

    /**
     * Load IconRules from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static IconRules fromResource(String resourcePath) {
        try (var inputStream = IconRules.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(IconRules.class, new LoaderOptions()));
            IconRules rules = yaml.load(inputStream);
            if (rules.colors == null) {
                rules.colors = new Colors();
            }
            if (rules.categories == null) {
                rules.categories = new HashMap<>();
            }

            logger.debug(
                    "Loaded IconRules with {} categories from resource {}",
                    rules.categories.size(),
                    resourcePath);

            var warnings = rules.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Rules loaded from {} have {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return rules;
        } catch (Exception e) {
            logger.error(
                    "Failed to load IconRules from resource {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load icon rules from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    /** Load default rules from standard location */
    public static IconRules loadDefault() {
        return fromResource(DEFAULT_RULES_RESOURCE);
    }

    /**
     * Checks the rules for contradictions and returns a list of warnings: categories missing from
     * the file, master sizes shared between categories, tolerated widths equal to the required
     * width, unknown color keys, and tracked colors without a color variable.
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();

        for (IconCategory category : IconCategory.values()) {
            if (!categories.containsKey(category.key())) {
                warnings.add("Missing rules for category '" + category.key() + "'");
            }
        }

        Map<Integer, String> sizeOwners = new HashMap<>();
        for (Map.Entry<String, CategoryRules> entry : categories.entrySet()) {
            String name = entry.getKey();
            CategoryRules rules = entry.getValue();

            for (Integer size : rules.frame_sizes) {
                String owner = sizeOwners.putIfAbsent(size, name);
                if (owner != null) {
                    warnings.add(
                            String.format(
                                    "Ambiguous size: %dpx is a master size of both '%s' and '%s'",
                                    size, owner, name));
                }
            }

            if (rules.isToleratedStrokeWidth(rules.required_stroke_width)) {
                warnings.add(
                        String.format(
                                "Contradiction: '%s' tolerates its own required stroke"
                                        + " width %.2f",
                                name,
                                rules.required_stroke_width));
            }

            if (rules.name_separator == null || rules.name_separator.length() != 1) {
                warnings.add(
                        String.format(
                                "Suspicious: '%s' name_separator should be a single character",
                                name));
            }

            for (String color : rules.tracked_colors) {
                try {
                    ColorGroup group = ColorGroup.fromKey(color);
                    if (rules.colorVariable(group) == null) {
                        warnings.add(
                                String.format(
                                        "Suspicious: '%s' tracks color '%s' but binds no"
                                                + " color variable for it",
                                        name,
                                        color));
                    }
                } catch (IllegalArgumentException e) {
                    warnings.add(String.format("Unknown color '%s' in '%s'", color, name));
                }
            }

            for (String color : rules.required_colors) {
                if (!rules.tracked_colors.contains(color)) {
                    warnings.add(
                            String.format(
                                    "Suspicious: '%s' requires color '%s' but does not track it",
                                    name, color));
                }
            }
        }

        return warnings;
    }
}
