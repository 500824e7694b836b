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

/** User-supplied description fields, one shape per icon category. */
public sealed interface DescriptionData {

    /** Functional icons: default and contextual text in English and German. */
    record Functional(
            String enDefault,
            String enContextual,
            String deDefault,
            String deContextual,
            String keywords)
            implements DescriptionData {}

    /** Illustrative icons: a single text per language. */
    record Illustrative(String en, String de, String keywords) implements DescriptionData {}
}
