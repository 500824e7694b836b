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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import net.boyechko.iconstudio.color.ColorGroup;
import net.boyechko.iconstudio.scene.Rgb;
import org.junit.jupiter.api.Test;

class IconRulesTest {

    @Test
    void defaultRulesLoadBothCategories() {
        IconRules rules = IconRules.loadDefault();

        IconRules.CategoryRules functional = rules.forCategory(IconCategory.FUNCTIONAL);
        assertEquals(List.of(32, 24, 20), functional.frame_sizes);
        assertEquals(List.of(32, 24, 20, 28, 16, 14, 12), functional.validSizes());
        assertEquals(2.0, functional.required_stroke_width);
        assertTrue(functional.isToleratedStrokeWidth(1.75));
        assertEquals('-', functional.separator());
        assertEquals("base", functional.colorVariable(ColorGroup.BLACK));

        IconRules.CategoryRules illustrative = rules.forCategory(IconCategory.ILLUSTRATIVE);
        assertEquals(List.of(64), illustrative.validSizes());
        assertEquals(8.0, illustrative.content_inset);
        assertEquals(List.of(ColorGroup.BLACK, ColorGroup.RED), illustrative.trackedGroups());
        assertEquals("pulse", illustrative.colorVariable(ColorGroup.RED));
        assertTrue(illustrative.center_line_note);
    }

    @Test
    void defaultRulesAreConsistent() {
        assertEquals(List.of(), IconRules.loadDefault().validateConsistency());
    }

    @Test
    void categoryIsDetectedFromMasterSizesOnly() {
        IconRules rules = IconRules.loadDefault();

        assertEquals(Optional.of(IconCategory.FUNCTIONAL), IconCategory.detect(24, rules));
        assertEquals(Optional.of(IconCategory.FUNCTIONAL), IconCategory.detect(31.6, rules));
        assertEquals(Optional.of(IconCategory.ILLUSTRATIVE), IconCategory.detect(64, rules));
        assertEquals(Optional.empty(), IconCategory.detect(28, rules));
        assertEquals(Optional.empty(), IconCategory.detect(40, rules));
    }

    @Test
    void contradictionsAreWarned() {
        IconRules rules = new IconRules();
        IconRules.CategoryRules a = new IconRules.CategoryRules();
        a.frame_sizes = List.of(32);
        a.tolerated_stroke_widths = List.of(2.0);
        a.tracked_colors = List.of("black", "purple");
        IconRules.CategoryRules b = new IconRules.CategoryRules();
        b.frame_sizes = List.of(32);
        b.name_separator = "__";
        rules.categories.put("functional", a);
        rules.categories.put("illustrative", b);

        List<String> warnings = rules.validateConsistency();

        assertTrue(warnings.stream().anyMatch(w -> w.startsWith("Ambiguous size: 32px")));
        assertTrue(warnings.stream().anyMatch(w -> w.startsWith("Contradiction:")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("name_separator")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("binds no color variable")));
        assertTrue(warnings.stream().anyMatch(w -> w.startsWith("Unknown color 'purple'")));
    }

    @Test
    void missingCategoryIsAProgrammingError() {
        IconRules empty = new IconRules();

        assertTrue(empty.validateConsistency().contains("Missing rules for category 'functional'"));
        assertThrows(
                IllegalArgumentException.class, () -> empty.forCategory(IconCategory.FUNCTIONAL));
    }

    @Test
    void missingResourceFailsToLoad() {
        IllegalStateException e =
                assertThrows(
                        IllegalStateException.class,
                        () -> IconRules.fromResource("/no-such-rules.yaml"));
        assertTrue(e.getMessage().contains("/no-such-rules.yaml"));
    }

    @Test
    void classifierUsesConfiguredThresholds() {
        IconRules rules = new IconRules();
        rules.colors.dark_max = 0.05;

        assertFalse(
                rules.colorClassifier()
                        .isBlackOrDarkGray(new Rgb(0.1, 0.1, 0.1)));
    }
}
