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
package net.boyechko.gofix.fixes;

import java.time.LocalDate;
import java.util.Map;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.SelectorExpr;
import net.boyechko.gofix.fix.AstUtil;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.walk.AstWalker;

/**
 * Renames exported members of one package, such as {@code sort.SortInts} to {@code sort.Ints}.
 * References go through the name the file imports the package under, so aliased imports are
 * handled; dot and blank imports have no qualified references and are skipped.
 */
public class RenamePackageMemberFix implements Fix {
    private final String name;
    private final LocalDate date;
    private final String description;
    private final String importPath;
    private final Map<String, String> renames;

    public RenamePackageMemberFix(
            String name,
            LocalDate date,
            String description,
            String importPath,
            Map<String, String> renames) {
        this.name = name;
        this.date = date;
        this.description = description;
        this.importPath = importPath;
        this.renames = Map.copyOf(renames);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LocalDate date() {
        return date;
    }

    @Override
    public String description() {
        return description;
    }

    public String importPath() {
        return importPath;
    }

    @Override
    public boolean precondition(GoFile file) {
        return AstUtil.imports(file, importPath);
    }

    @Override
    public boolean transform(GoFile file) {
        String pkg = AstUtil.importedAs(file, importPath);
        if (pkg.isEmpty()) {
            return false;
        }
        boolean fixed = false;
        for (SelectorExpr sel : AstWalker.collect(file, SelectorExpr.class)) {
            String replacement = renames.get(sel.getSel().getName());
            if (replacement != null && AstUtil.isTopName(sel.getX(), pkg)) {
                sel.getSel().setName(replacement);
                fixed = true;
            }
        }
        return fixed;
    }

    @Override
    public String toString() {
        return name;
    }
}
