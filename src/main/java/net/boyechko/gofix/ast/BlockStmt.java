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

/** A braced statement list. Comments just before the closing brace are kept with the block. */
public class BlockStmt extends Stmt {
    private final List<Stmt> list;
    private final List<Comment> closingComments = new ArrayList<>();

    public BlockStmt(List<? extends Stmt> list) {
        this.list = new ArrayList<>(list);
    }

    public List<Stmt> getList() {
        return list;
    }

    public List<Comment> getClosingComments() {
        return closingComments;
    }

    @Override
    public List<Object> children() {
        return fields(list);
    }
}
