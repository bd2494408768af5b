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

/**
 * A parameter, result, struct field or interface method. Names are empty for anonymous
 * parameters and embedded fields; the tag is {@code null} unless a struct field has one.
 */
public class Field extends Node {
    private final List<Ident> names;
    private Expr type;
    private BasicLit tag;

    public Field(List<Ident> names, Expr type, BasicLit tag) {
        this.names = new ArrayList<>(names);
        this.type = type;
        this.tag = tag;
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

    public BasicLit getTag() {
        return tag;
    }

    public void setTag(BasicLit tag) {
        this.tag = tag;
    }

    @Override
    public List<Object> children() {
        return fields(names, type, tag);
    }
}
