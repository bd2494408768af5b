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

public class IncDecStmt extends Stmt {
    private Expr x;
    private final String op;

    public IncDecStmt(Expr x, String op) {
        this.x = x;
        this.op = op;
    }

    public Expr getX() {
        return x;
    }

    public void setX(Expr x) {
        this.x = x;
    }

    /** {@code ++} or {@code --}. */
    public String getOp() {
        return op;
    }

    @Override
    public List<Object> children() {
        return fields(x);
    }
}
