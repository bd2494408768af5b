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
import java.util.Objects;
import java.util.function.Predicate;
import net.boyechko.gofix.ast.GoFile;

/** A {@link Fix} assembled from functions, for small fixes and tests. */
record FunctionalFix(
        String name,
        LocalDate date,
        String description,
        Predicate<GoFile> check,
        Predicate<GoFile> rewrite)
        implements Fix {

    FunctionalFix {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(rewrite, "rewrite");
        description = description == null ? "" : description;
    }

    @Override
    public boolean precondition(GoFile file) {
        return check.test(file);
    }

    @Override
    public boolean transform(GoFile file) {
        return rewrite.test(file);
    }

    @Override
    public String toString() {
        return name;
    }
}
