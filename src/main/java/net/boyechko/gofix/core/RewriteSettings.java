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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine tuning. Each value comes from a JVM system property, else an environment variable,
 * else a default.
 *
 * @param maxPasses {@code gofix.maxPasses} / {@code GOFIX_MAX_PASSES}, default 10
 * @param workers {@code gofix.workers} / {@code GOFIX_WORKERS}, default the number of processors
 * @param extension {@code gofix.extension} / {@code GOFIX_EXTENSION}, default {@code .go}
 */
public record RewriteSettings(int maxPasses, int workers, String extension) {
    private static final Logger logger = LoggerFactory.getLogger(RewriteSettings.class);

    public static final int DEFAULT_MAX_PASSES = 10;
    public static final String DEFAULT_EXTENSION = ".go";

    public RewriteSettings {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
    }

    public static RewriteSettings defaults() {
        return new RewriteSettings(
                DEFAULT_MAX_PASSES, Runtime.getRuntime().availableProcessors(), DEFAULT_EXTENSION);
    }

    public static RewriteSettings resolve() {
        RewriteSettings d = defaults();
        return new RewriteSettings(
                resolveInt("gofix.maxPasses", "GOFIX_MAX_PASSES", d.maxPasses()),
                resolveInt("gofix.workers", "GOFIX_WORKERS", d.workers()),
                resolveString("gofix.extension", "GOFIX_EXTENSION", d.extension()));
    }

    public RewriteSettings withWorkers(int workers) {
        return new RewriteSettings(maxPasses, workers, extension);
    }

    public RewriteSettings withMaxPasses(int maxPasses) {
        return new RewriteSettings(maxPasses, workers, extension);
    }

    private static String resolveString(String property, String envVar, String fallback) {
        // 1. Explicit JVM flag, e.g. -Dgofix.workers=4
        String sysProp = System.getProperty(property);
        if (sysProp != null && !sysProp.isBlank()) return sysProp.trim();

        // 2. Environment variable, e.g. export GOFIX_WORKERS=4
        String env = System.getenv(envVar);
        if (env != null && !env.isBlank()) return env.trim();

        return fallback;
    }

    private static int resolveInt(String property, String envVar, int fallback) {
        String value = resolveString(property, envVar, null);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= 1) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.debug("Not a number for {}: {}", property, value, e);
        }
        logger.warn("Ignoring {}={}: expected a positive integer", property, value);
        return fallback;
    }
}
