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
package net.boyechko.gofix.fix;

import net.boyechko.gofix.ast.Expr;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.Ident;
import net.boyechko.gofix.ast.ImportSpec;
import net.boyechko.gofix.ast.Node;
import net.boyechko.gofix.ast.SelectorExpr;

/** Small syntactic queries shared by fixes. None of them resolve scopes or types. */
public final class AstUtil {
    private AstUtil() {}

    /** Whether the file imports {@code path} under any name. */
    public static boolean imports(GoFile file, String path) {
        return file.imports().anyMatch(spec -> spec.unquotedPath().equals(path));
    }

    /**
     * The name the file uses to refer to the package at {@code path}: its alias if renamed,
     * otherwise the last path element. Returns an empty string when the package is not imported
     * or is imported with {@code .} or {@code _}, since then no qualified reference exists.
     */
    public static String importedAs(GoFile file, String path) {
        return file.imports()
                .filter(spec -> spec.unquotedPath().equals(path))
                .findFirst()
                .map(AstUtil::localName)
                .orElse("");
    }

    private static String localName(ImportSpec spec) {
        if (spec.getName() != null) {
            String name = spec.getName().getName();
            return name.equals(".") || name.equals("_") ? "" : name;
        }
        String path = spec.unquotedPath();
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** Whether {@code x} is the bare identifier {@code name}. */
    public static boolean isTopName(Expr x, String name) {
        return x instanceof Ident id && id.getName().equals(name);
    }

    /** Whether {@code x} is the qualified reference {@code pkg.member}. */
    public static boolean isPkgDot(Expr x, String pkg, String member) {
        return x instanceof SelectorExpr sel
                && isTopName(sel.getX(), pkg)
                && sel.getSel().getName().equals(member);
    }

    /**
     * Gives {@code replacement} the position of {@code original} and moves the original's
     * comments over, so the replacement prints where the original was.
     */
    public static <T extends Node> T positioned(T replacement, Node original) {
        replacement.setPos(original.getPos());
        replacement.setEndLine(original.getEndLine());
        replacement.getLeadingComments().addAll(original.getLeadingComments());
        replacement.setTrailingComment(original.getTrailingComment());
        original.getLeadingComments().clear();
        original.setTrailingComment(null);
        return replacement;
    }
}
