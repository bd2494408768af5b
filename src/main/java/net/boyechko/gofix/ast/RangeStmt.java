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

/** {@code for key, value := range x { }}; key, value and op are absent for {@code for range x}. */
public class RangeStmt extends Stmt {
    private Expr key;
    private Expr value;
    private final String op;
    private Expr x;
    private final BlockStmt body;

    public RangeStmt(Expr key, Expr value, String op, Expr x, BlockStmt body) {
        this.key = key;
        this.value = value;
        this.op = op;
        this.x = x;
        this.body = body;
    }

    public Expr getKey() {
        return key;
    }

    public void setKey(Expr key) {
        this.key = key;
    }

    public Expr getValue() {
        return value;
    }

    public void setValue(Expr value) {
        this.value = value;
    }

    public String getOp() {
        return op;
    }

    public Expr getX() {
        return x;
    }

    public void setX(Expr x) {
        this.x = x;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public List<Object> children() {
        return fields(key, value, x, body);
    }
}
