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

/** {@code for init; cond; post { }}; any of the three clauses may be absent. */
public class ForStmt extends Stmt {
    private Stmt init;
    private Expr cond;
    private Stmt post;
    private final BlockStmt body;
    private final boolean threeClause;

    public ForStmt(Stmt init, Expr cond, Stmt post, BlockStmt body, boolean threeClause) {
        this.init = init;
        this.cond = cond;
        this.post = post;
        this.body = body;
        this.threeClause = threeClause;
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

    public Stmt getPost() {
        return post;
    }

    public void setPost(Stmt post) {
        this.post = post;
    }

    public BlockStmt getBody() {
        return body;
    }

    /** True when the header was written with semicolons, even if some clauses are empty. */
    public boolean isThreeClause() {
        return threeClause;
    }

    @Override
    public List<Object> children() {
        return fields(init, cond, post, body);
    }
}
