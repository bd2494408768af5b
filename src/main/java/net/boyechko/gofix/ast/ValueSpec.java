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

import java.util.ArrayList;
import java.util.List;

/** {@code a, b T = x, y} inside a {@code var} or {@code const} declaration. */
public class ValueSpec extends Spec {
    private final List<Ident> names;
    private Expr type;
    private final List<Expr> values;

    public ValueSpec(List<Ident> names, Expr type, List<? extends Expr> values) {
        this.names = new ArrayList<>(names);
        this.type = type;
        this.values = new ArrayList<>(values);
    }

    public List<Ident> getNames() {
        return names;
    }

    public Expr getType() {
        return type;
    }

    public void setType(Expr type) {
        this.type = type;
    }

    public List<Expr> getValues() {
        return values;
    }

    @Override
    public List<Object> children() {
        return fields(names, type, values);
    }
}
