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

/** An interface type; each method is a {@link Field} whose type is a {@link FuncType}. */
public class InterfaceType extends Expr {
    private final FieldList methods;

    public InterfaceType(FieldList methods) {
        this.methods = methods;
    }

    public FieldList getMethods() {
        return methods;
    }

    @Override
    public List<Object> children() {
        return fields(methods);
    }
}
