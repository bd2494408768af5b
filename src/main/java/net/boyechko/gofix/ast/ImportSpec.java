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

/** {@code [name] "path"}; the name is {@code null} unless the import is renamed, dot or blank. */
public class ImportSpec extends Spec {
    private Ident name;
    private BasicLit path;

    public ImportSpec(Ident name, BasicLit path) {
        this.name = name;
        this.path = path;
    }

    public Ident getName() {
        return name;
    }

    public void setName(Ident name) {
        this.name = name;
    }

    public BasicLit getPath() {
        return path;
    }

    public void setPath(BasicLit path) {
        this.path = path;
    }

    /** The import path without quotes. */
    public String unquotedPath() {
        String v = path.getValue();
        return v.length() >= 2 ? v.substring(1, v.length() - 1) : v;
    }

    @Override
    public List<Object> children() {
        return fields(name, path);
    }
}
