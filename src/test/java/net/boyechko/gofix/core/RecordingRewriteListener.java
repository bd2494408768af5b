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

import java.util.ArrayList;
import java.util.List;

/** Remembers every callback so tests can check what a run reported. */
public class RecordingRewriteListener implements RewriteListener {
    public final List<String> events = new ArrayList<>();
    public final List<RewriteOutcome> rewritten = new ArrayList<>();
    public final List<RewriteOutcome> failed = new ArrayList<>();
    public final List<RewriteOutcome> unchanged = new ArrayList<>();
    public final List<String> diffs = new ArrayList<>();
    public RunSummary summary;

    @Override
    public void onFileRewritten(RewriteOutcome outcome) {
        events.add("rewritten " + outcome.path());
        rewritten.add(outcome);
    }

    @Override
    public void onFileFailed(RewriteOutcome outcome) {
        events.add("failed " + outcome.path());
        failed.add(outcome);
    }

    @Override
    public void onFileUnchanged(RewriteOutcome outcome) {
        events.add("unchanged " + outcome.path());
        unchanged.add(outcome);
    }

    @Override
    public void onDiff(RewriteOutcome outcome, String diff) {
        events.add("diff " + outcome.path());
        diffs.add(diff);
    }

    @Override
    public void onSummary(RunSummary summary) {
        events.add("summary");
        this.summary = summary;
    }
}
