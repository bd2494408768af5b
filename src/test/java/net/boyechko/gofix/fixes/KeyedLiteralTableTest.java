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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeyedLiteralTableTest {

    @Test
    void defaultTableCoversNetAddresses() {
        KeyedLiteralTable table = KeyedLiteralTable.loadDefault();
        assertEquals(Set.of("net"), table.importPaths());
        Map<String, KeyedLiteralTable.Structure> net = table.structuresIn("net");
        assertEquals(Set.of("IPAddr", "UDPAddr", "TCPAddr"), net.keySet());
        assertEquals(Optional.of("0"), net.get("TCPAddr").zeroLiteral("Port"));
        assertEquals(Optional.of("\"\""), net.get("IPAddr").zeroLiteral("Zone"));
        assertEquals(Optional.empty(), net.get("TCPAddr").zeroLiteral("IP"));
    }

    @Test
    void loadsCustomTable() {
        KeyedLiteralTable table = KeyedLiteralTable.fromResource("/keyed-literals-test.yaml");
        KeyedLiteralTable.Structure point = table.structuresIn("image").get("Point");
        assertEquals(List.of("X", "Y"), point.getFields());
        assertTrue(table.structuresIn("net").isEmpty());
    }

    @Test
    void rejectsZeroValueForUnknownField() {
        var ex =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> KeyedLiteralTable.fromResource("/keyed-literals-invalid.yaml"));
        assertTrue(ex.getMessage().contains("unknown field Z"), ex.getMessage());
    }

    @Test
    void missingResourceIsAnError() {
        assertThrows(
                IllegalArgumentException.class,
                () -> KeyedLiteralTable.fromResource("/no-such-table.yaml"));
    }
}
