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
package net.boyechko.gofix.core;

import net.boyechko.gofix.fix.FixRegistry;
import net.boyechko.gofix.fixes.MathFix;
import net.boyechko.gofix.fixes.NetIpv6ZoneFix;
import net.boyechko.gofix.fixes.SortSliceFix;
import net.boyechko.gofix.fixes.StringsSplitFix;

/** The fixes shipped with the tool. */
public final class FixDefaults {
    private FixDefaults() {}

    public static FixRegistry registry() {
        return FixRegistry.of(
                new SortSliceFix(), new StringsSplitFix(), new MathFix(), new NetIpv6ZoneFix());
    }
}
