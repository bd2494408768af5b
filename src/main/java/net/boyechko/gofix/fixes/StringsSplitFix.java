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
import java.util.List;
import net.boyechko.gofix.ast.BasicLit;
import net.boyechko.gofix.ast.CallExpr;
import net.boyechko.gofix.ast.Expr;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.SelectorExpr;
import net.boyechko.gofix.ast.UnaryExpr;
import net.boyechko.gofix.fix.AstUtil;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.walk.AstWalker;

/**
 * The three-argument {@code Split(s, sep, n)} and {@code SplitAfter(s, sep, n)} of packages
 * {@code strings} and {@code bytes} split in two: a count of {@code -1} is dropped, any other
 * count moves the call to {@code SplitN} or {@code SplitAfterN}.
 */
public final class StringsSplitFix implements Fix {
    private static final List<String> PACKAGES = List.of("bytes", "strings");

    @Override
    public String name() {
        return "stringssplit";
    }

    @Override
    public LocalDate date() {
        return LocalDate.of(2011, 6, 28);
    }

    @Override
    public String description() {
        return "Restore strings.Split semantics: drop an n of -1, otherwise use SplitN.";
    }

    @Override
    public boolean precondition(GoFile file) {
        return PACKAGES.stream().anyMatch(path -> AstUtil.imports(file, path));
    }

    @Override
    public boolean transform(GoFile file) {
        boolean fixed = false;
        for (String path : PACKAGES) {
            String pkg = AstUtil.importedAs(file, path);
            if (pkg.isEmpty()) {
                continue;
            }
            for (CallExpr call : AstWalker.collect(file, CallExpr.class)) {
                if (call.getArgs().size() != 3 || call.hasEllipsis()) {
                    continue;
                }
                if (!AstUtil.isPkgDot(call.getFun(), pkg, "Split")
                        && !AstUtil.isPkgDot(call.getFun(), pkg, "SplitAfter")) {
                    continue;
                }
                if (isMinusOne(call.getArgs().get(2))) {
                    call.getArgs().remove(2);
                } else {
                    SelectorExpr fun = (SelectorExpr) call.getFun();
                    fun.getSel().setName(fun.getSel().getName() + "N");
                }
                fixed = true;
            }
        }
        return fixed;
    }

    private static boolean isMinusOne(Expr e) {
        return e instanceof UnaryExpr u
                && u.getOp().equals("-")
                && u.getX() instanceof BasicLit lit
                && lit.getValue().equals("1");
    }
}
