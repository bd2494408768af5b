/*
 * GoFix - Automated Go Source Migration
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
package net.boyechko.gofix.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RewriteSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("gofix.maxPasses");
        System.clearProperty("gofix.extension");
    }

    @Test
    void defaultsAreSane() {
        RewriteSettings settings = RewriteSettings.defaults();
        assertEquals(RewriteSettings.DEFAULT_MAX_PASSES, settings.maxPasses());
        assertEquals(".go", settings.extension());
        assertTrue(settings.workers() >= 1);
    }

    @Test
    void systemPropertyOverridesDefault() {
        System.setProperty("gofix.maxPasses", "3");
        System.setProperty("gofix.extension", ".gox");
        RewriteSettings settings = RewriteSettings.resolve();
        assertEquals(3, settings.maxPasses());
        assertEquals(".gox", settings.extension());
    }

    @Test
    void invalidPropertyFallsBackToDefault() {
        System.setProperty("gofix.maxPasses", "lots");
        assertEquals(RewriteSettings.DEFAULT_MAX_PASSES, RewriteSettings.resolve().maxPasses());
    }

    @Test
    void rejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> new RewriteSettings(0, 1, ".go"));
        assertThrows(
                IllegalArgumentException.class,
                () -> RewriteSettings.defaults().withWorkers(0));
    }
}
