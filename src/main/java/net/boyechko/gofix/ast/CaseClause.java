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

/** A {@code case} of a switch; an empty expression list means {@code default}. */
public class CaseClause extends Stmt {
    private final List<Expr> list;
    private final List<Stmt> body;

    public CaseClause(List<? extends Expr> list, List<? extends Stmt> body) {
        this.list = new ArrayList<>(list);
        this.body = new ArrayList<>(body);
    }

    public List<Expr> getList() {
        return list;
    }

    public boolean isDefault() {
        return list.isEmpty();
    }

    public List<Stmt> getBody() {
        return body;
    }

    @Override
    public List<Object> children() {
        return fields(list, body);
    }
}
