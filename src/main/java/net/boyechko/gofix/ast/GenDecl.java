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

/**
 * An {@code import}, {@code const}, {@code type} or {@code var} declaration, either single or
 * parenthesized ({@link #isGrouped()}).
 */
public class GenDecl extends Decl {
    private final String keyword;
    private final List<Spec> specs;
    private boolean grouped;

    public GenDecl(String keyword, List<? extends Spec> specs, boolean grouped) {
        this.keyword = keyword;
        this.specs = new ArrayList<>(specs);
        this.grouped = grouped;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isImport() {
        return "import".equals(keyword);
    }

    public List<Spec> getSpecs() {
        return specs;
    }

    public boolean isGrouped() {
        return grouped;
    }

    public void setGrouped(boolean grouped) {
        this.grouped = grouped;
    }

    @Override
    public List<Object> children() {
        return fields(specs);
    }
}
