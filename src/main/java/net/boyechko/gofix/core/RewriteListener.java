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
 * Receives the results of a run. {@link RewriteRunner} calls it from one thread, in path order,
 * after the files have been processed.
 */
public interface RewriteListener {
    void onFileRewritten(RewriteOutcome outcome);

    void onFileFailed(RewriteOutcome outcome);

    default void onFileUnchanged(RewriteOutcome outcome) {}

    /** Diff mode only: the unified diff of a changed file. */
    default void onDiff(RewriteOutcome outcome, String diff) {}

    default void onSummary(RunSummary summary) {}

    /** A listener that forwards every event to each of {@code listeners} in turn. */
    static RewriteListener compose(RewriteListener... listeners) {
        List<RewriteListener> all = List.of(listeners);
        return new RewriteListener() {
            @Override
            public void onFileRewritten(RewriteOutcome outcome) {
                all.forEach(l -> l.onFileRewritten(outcome));
            }

            @Override
            public void onFileFailed(RewriteOutcome outcome) {
                all.forEach(l -> l.onFileFailed(outcome));
            }

            @Override
            public void onFileUnchanged(RewriteOutcome outcome) {
                all.forEach(l -> l.onFileUnchanged(outcome));
            }

            @Override
            public void onDiff(RewriteOutcome outcome, String diff) {
                all.forEach(l -> l.onDiff(outcome, diff));
            }

            @Override
            public void onSummary(RunSummary summary) {
                all.forEach(l -> l.onSummary(summary));
            }
        };
    }

    static RewriteListener none() {
        return new RewriteListener() {
            @Override
            public void onFileRewritten(RewriteOutcome outcome) {}

            @Override
            public void onFileFailed(RewriteOutcome outcome) {}
        };
    }
}
