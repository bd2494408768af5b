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
package net.boyechko.gofix.fix;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.function.Predicate;
import net.boyechko.gofix.ast.GoFile;

/**
 * A named, dated rewrite that adapts source written against an older API to a newer one.
 *
 * <p>{@link #transform(GoFile)} must return {@code true} exactly when it changed the tree, and
 * must be idempotent: once it has rewritten a pattern, running it again finds nothing to do.
 * {@link #precondition(GoFile)} is only a cheap short cut (such as "does the file import the
 * package at all") and must be free of side effects; skipping it must never change the result.
 */
public interface Fix {
    /** Run order: by date, then by name. Later fixes may rely on earlier ones having run. */
    Comparator<Fix> ORDER = Comparator.comparing(Fix::date).thenComparing(Fix::name);

    String name();

    LocalDate date();

    String description();

    default boolean precondition(GoFile file) {
        return true;
    }

    boolean transform(GoFile file);

    static Fix of(
            String name, String date, String description, Predicate<GoFile> transform) {
        return of(name, date, description, f -> true, transform);
    }

    static Fix of(
            String name,
            String date,
            String description,
            Predicate<GoFile> precondition,
            Predicate<GoFile> transform) {
        return new FunctionalFix(
                name, LocalDate.parse(date), description, precondition, transform);
    }
}
