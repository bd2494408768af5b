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
package net.boyechko.gofix.ast;

import java.util.List;

/** A function signature. {@code results} is {@code null} when the function returns nothing. */
public class FuncType extends Expr {
    private final FieldList params;
    private FieldList results;

    public FuncType(FieldList params, FieldList results) {
        this.params = params;
        this.results = results;
    }

    public FieldList getParams() {
        return params;
    }

    public FieldList getResults() {
        return results;
    }

    public void setResults(FieldList results) {
        this.results = results;
    }

    @Override
    public List<Object> children() {
        return fields(params, results);
    }
}
