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

/** {@code Name T}, or the alias form {@code Name = T}. */
public class TypeSpec extends Spec {
    private final Ident name;
    private final boolean alias;
    private Expr type;

    public TypeSpec(Ident name, boolean alias, Expr type) {
        this.name = name;
        this.alias = alias;
        this.type = type;
    }

    public Ident getName() {
        return name;
    }

    public boolean isAlias() {
        return alias;
    }

    public Expr getType() {
        return type;
    }

    public void setType(Expr type) {
        this.type = type;
    }

    @Override
    public List<Object> children() {
        return fields(name, type);
    }
}
