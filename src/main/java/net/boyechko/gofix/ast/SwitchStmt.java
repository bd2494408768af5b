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

/**
 * An expression or type switch. The tag is an {@link ExprStmt} for {@code switch x}, or the
 * {@code v := x.(type)} guard of a type switch; both init and tag may be absent. The body holds
 * only {@link CaseClause}s.
 */
public class SwitchStmt extends Stmt {
    private Stmt init;
    private Stmt tag;
    private final BlockStmt body;

    public SwitchStmt(Stmt init, Stmt tag, BlockStmt body) {
        this.init = init;
        this.tag = tag;
        this.body = body;
    }

    public Stmt getInit() {
        return init;
    }

    public void setInit(Stmt init) {
        this.init = init;
    }

    public Stmt getTag() {
        return tag;
    }

    public void setTag(Stmt tag) {
        this.tag = tag;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public List<Object> children() {
        return fields(init, tag, body);
    }
}
