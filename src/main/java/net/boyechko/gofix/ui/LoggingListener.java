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
package net.boyechko.gofix.ui;

import net.boyechko.gofix.core.RewriteListener;
import net.boyechko.gofix.core.RewriteOutcome;
import net.boyechko.gofix.core.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link RewriteListener} that routes all events through SLF4J. */
public class LoggingListener implements RewriteListener {

    private static final Logger logger = LoggerFactory.getLogger("net.boyechko.gofix.run");

    @Override
    public void onFileRewritten(RewriteOutcome outcome) {
        logger.info("FIXED {}: {}", outcome.path(), String.join(" ", outcome.appliedFixNames()));
    }

    @Override
    public void onFileFailed(RewriteOutcome outcome) {
        logger.error("FAILED {}: {}", outcome.path(), outcome.errorMessage());
    }

    @Override
    public void onFileUnchanged(RewriteOutcome outcome) {
        logger.debug("UNCHANGED {}", outcome.path());
    }

    @Override
    public void onSummary(RunSummary summary) {
        logger.info(
                "SUMMARY files={} changed={} failed={} skipped={}",
                summary.outcomes().size(),
                summary.changedCount(),
                summary.failureCount(),
                summary.skipped());
    }
}
