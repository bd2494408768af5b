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

/** A function call or conversion. {@link #hasEllipsis()} marks a trailing {@code args...}. */
public class CallExpr extends Expr {
    private Expr fun;
    private final List<Expr> args;
    private boolean ellipsis;

    public CallExpr(Expr fun, List<? extends Expr> args, boolean ellipsis) {
        this.fun = fun;
        this.args = new ArrayList<>(args);
        this.ellipsis = ellipsis;
    }

    public Expr getFun() {
        return fun;
    }

    public void setFun(Expr fun) {
        this.fun = fun;
    }

    /** The live argument list; fixes may edit it in place. */
    public List<Expr> getArgs() {
        return args;
    }

    public boolean hasEllipsis() {
        return ellipsis;
    }

    public void setEllipsis(boolean ellipsis) {
        this.ellipsis = ellipsis;
    }

    @Override
    public List<Object> children() {
        return fields(fun, args);
    }
}
