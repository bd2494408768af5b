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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.gofix.GoSourceTestBase;
import net.boyechko.gofix.ast.GoFile;
import org.junit.jupiter.api.Test;

class NetIpv6ZoneFixTest extends GoSourceTestBase {
    private final NetIpv6ZoneFix fix = new NetIpv6ZoneFix();

    @Test
    void keysPositionalAddressLiterals() {
        String in =
                "package main\n"
                        + "\n"
                        + "import \"net\"\n"
                        + "\n"
                        + "func f() net.Addr {\n"
                        + "\ta := &net.IPAddr{ip1}\n"
                        + "\tsub(&net.UDPAddr{ip2, 12345})\n"
                        + "\tc := &net.TCPAddr{IP: ip3, Port: 54321}\n"
                        + "\td := &net.TCPAddr{ip4, 0}\n"
                        + "\tp := 1234\n"
                        + "\te := &net.TCPAddr{ip4, p}\n"
                        + "\treturn &net.TCPAddr{ip5}, nil\n"
                        + "}\n";
        String out =
                "package main\n"
                        + "\n"
                        + "import \"net\"\n"
                        + "\n"
                        + "func f() net.Addr {\n"
                        + "\ta := &net.IPAddr{IP: ip1}\n"
                        + "\tsub(&net.UDPAddr{IP: ip2, Port: 12345})\n"
                        + "\tc := &net.TCPAddr{IP: ip3, Port: 54321}\n"
                        + "\td := &net.TCPAddr{IP: ip4}\n"
                        + "\tp := 1234\n"
                        + "\te := &net.TCPAddr{IP: ip4, Port: p}\n"
                        + "\treturn &net.TCPAddr{IP: ip5}, nil\n"
                        + "}\n";
        assertFix(fix, in, out);
    }

    @Test
    void dropsEmptyZoneButKeepsNamedZone() {
        assertFix(
                fix,
                "package main\n\nimport \"net\"\n\nvar a = net.IPAddr{ip, \"\"}\n\n"
                        + "var b = net.IPAddr{ip, \"eth0\"}\n",
                "package main\n\nimport \"net\"\n\nvar a = net.IPAddr{IP: ip}\n\n"
                        + "var b = net.IPAddr{IP: ip, Zone: \"eth0\"}\n");
    }

    @Test
    void followsImportAlias() {
        assertFix(
                fix,
                "package main\n\nimport n \"net\"\n\nvar a = n.TCPAddr{ip, 80}\n",
                "package main\n\nimport n \"net\"\n\nvar a = n.TCPAddr{IP: ip, Port: 80}\n");
    }

    @Test
    void keepsCommentsOnMultilineLiteral() {
        assertFix(
                fix,
                "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{\n\tip, // address\n"
                        + "\t80,\n}\n",
                "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{\n\tIP: ip, // address\n"
                        + "\tPort: 80,\n}\n");
    }

    @Test
    void leavesElidedAndOversizedLiteralsAlone() {
        assertNoFix(
                fix,
                "package main\n\nimport \"net\"\n\nvar a = []net.TCPAddr{{ip, 80}}\n\n"
                        + "var b = net.TCPAddr{ip, 80, \"zone\"}\n\nvar c = net.TCPAddr{}\n");
    }

    @Test
    void ignoresFilesThatDoNotImportNet() {
        GoFile file = parse("package main\n\nvar a = net.TCPAddr{ip, 80}\n");
        assertFalse(fix.precondition(file));
        assertFalse(fix.transform(file));
    }

    @Test
    void ignoresUnknownTypesInNet() {
        assertNoFix(fix, "package main\n\nimport \"net\"\n\nvar a = net.Dialer{t, 0}\n");
    }

    @Test
    void zeroInFirstPositionIsKeyed() {
        NetIpv6ZoneFix imageFix =
                new NetIpv6ZoneFix(KeyedLiteralTable.fromResource("/keyed-literals-test.yaml"));
        assertFix(
                imageFix,
                "package main\n\nimport \"image\"\n\nvar a = image.Point{0, 0}\n\n"
                        + "var b = image.Point{0, 5}\n",
                "package main\n\nimport \"image\"\n\nvar a = image.Point{X: 0}\n\n"
                        + "var b = image.Point{X: 0, Y: 5}\n");
    }
}
