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

/** {@code break}, {@code continue}, {@code goto} or {@code fallthrough}, with optional label. */
public class BranchStmt extends Stmt {
    private final String keyword;
    private Ident label;

    public BranchStmt(String keyword, Ident label) {
        this.keyword = keyword;
        this.label = label;
    }

    public String getKeyword() {
        return keyword;
    }

    public Ident getLabel() {
        return label;
    }

    public void setLabel(Ident label) {
        this.label = label;
    }

    @Override
    public List<Object> children() {
        return fields(label);
    }
}
