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

/** {@code x[low:high]} or the three-index form {@code x[low:high:max]}; bounds may be absent. */
public class SliceExpr extends Expr {
    private Expr x;
    private Expr low;
    private Expr high;
    private Expr max;
    private final boolean slice3;

    public SliceExpr(Expr x, Expr low, Expr high, Expr max, boolean slice3) {
        this.x = x;
        this.low = low;
        this.high = high;
        this.max = max;
        this.slice3 = slice3;
    }

    public Expr getX() {
        return x;
    }

    public void setX(Expr x) {
        this.x = x;
    }

    public Expr getLow() {
        return low;
    }

    public void setLow(Expr low) {
        this.low = low;
    }

    public Expr getHigh() {
        return high;
    }

    public void setHigh(Expr high) {
        this.high = high;
    }

    public Expr getMax() {
        return max;
    }

    public void setMax(Expr max) {
        this.max = max;
    }

    public boolean isSlice3() {
        return slice3;
    }

    @Override
    public List<Object> children() {
        return fields(x, low, high, max);
    }
}
