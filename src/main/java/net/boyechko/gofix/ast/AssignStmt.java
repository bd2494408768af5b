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

/** Assignment, short variable declaration ({@code :=}) or an assignment operation like {@code +=}. */
public class AssignStmt extends Stmt {
    private final List<Expr> lhs;
    private final String op;
    private final List<Expr> rhs;

    public AssignStmt(List<? extends Expr> lhs, String op, List<? extends Expr> rhs) {
        this.lhs = new ArrayList<>(lhs);
        this.op = op;
        this.rhs = new ArrayList<>(rhs);
    }

    public List<Expr> getLhs() {
        return lhs;
    }

    public String getOp() {
        return op;
    }

    public List<Expr> getRhs() {
        return rhs;
    }

    @Override
    public List<Object> children() {
        return fields(lhs, rhs);
    }
}
