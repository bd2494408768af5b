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

import java.util.List;

/** One or more requested fix names are not registered. */
public class UnknownFixException extends Exception {
    private final List<String> names;

    public UnknownFixException(List<String> names) {
        super("unknown fix" + (names.size() == 1 ? "" : "es") + ": " + String.join(", ", names));
        this.names = List.copyOf(names);
    }

    /** Every unrecognized name, in the order requested. */
    public List<String> names() {
        return names;
    }
}
