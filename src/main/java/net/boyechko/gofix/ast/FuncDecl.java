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

/** A function or method declaration; the body is {@code null} for external functions. */
public class FuncDecl extends Decl {
    private final FieldList recv;
    private final Ident name;
    private final FuncType type;
    private final BlockStmt body;

    public FuncDecl(FieldList recv, Ident name, FuncType type, BlockStmt body) {
        this.recv = recv;
        this.name = name;
        this.type = type;
        this.body = body;
    }

    public FieldList getRecv() {
        return recv;
    }

    public Ident getName() {
        return name;
    }

    public FuncType getType() {
        return type;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public List<Object> children() {
        return fields(recv, name, type, body);
    }
}
