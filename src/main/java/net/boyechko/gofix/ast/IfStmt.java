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

/** {@code if init; cond { } else ...}; the else branch is an {@link IfStmt} or a block. */
public class IfStmt extends Stmt {
    private Stmt init;
    private Expr cond;
    private final BlockStmt body;
    private Stmt elseBranch;

    public IfStmt(Stmt init, Expr cond, BlockStmt body, Stmt elseBranch) {
        this.init = init;
        this.cond = cond;
        this.body = body;
        this.elseBranch = elseBranch;
    }

    public Stmt getInit() {
        return init;
    }

    public void setInit(Stmt init) {
        this.init = init;
    }

    public Expr getCond() {
        return cond;
    }

    public void setCond(Expr cond) {
        this.cond = cond;
    }

    public BlockStmt getBody() {
        return body;
    }

    public Stmt getElse() {
        return elseBranch;
    }

    public void setElse(Stmt elseBranch) {
        this.elseBranch = elseBranch;
    }

    @Override
    public List<Object> children() {
        return fields(init, cond, body, elseBranch);
    }
}
