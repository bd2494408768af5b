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

import java.util.List;

/**
 * Outcomes of a batch run, sorted by path.
 *
 * @param skipped files never started because the run was cancelled
 */
public record RunSummary(List<RewriteOutcome> outcomes, int skipped) {

    public RunSummary {
        outcomes = List.copyOf(outcomes);
    }

    public long changedCount() {
        return outcomes.stream().filter(o -> o.changed() && !o.isFailure()).count();
    }

    public long failureCount() {
        return outcomes.stream().filter(RewriteOutcome::isFailure).count();
    }

    public boolean hasFailures() {
        return failureCount() > 0;
    }
}
