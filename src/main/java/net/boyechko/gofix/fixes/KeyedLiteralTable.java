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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Struct types whose positional literals {@link NetIpv6ZoneFix} converts to keyed form. */
public final class KeyedLiteralTable {
    private static final String DEFAULT_RESOURCE = "/keyed-literals.yaml";
    private static final Logger logger = LoggerFactory.getLogger(KeyedLiteralTable.class);

    public List<Structure> structures;

    public static final class Structure {
        public String import_path;
        public String type;
        public List<String> fields;

        /** Zero literal per field name; fields without an entry are never dropped. */
        public Map<String, String> zero;

        public String getImportPath() {
            return import_path;
        }

        public String getType() {
            return type;
        }

        public List<String> getFields() {
            return fields == null ? List.of() : fields;
        }

        public Optional<String> zeroLiteral(String field) {
            return zero == null ? Optional.empty() : Optional.ofNullable(zero.get(field));
        }
    }

    public KeyedLiteralTable() {
        this.structures = new ArrayList<>();
    }

    /**
     * Loads a table from a classpath resource.
     *
     * @param resourcePath absolute resource path, starting with "/"
     */
    public static KeyedLiteralTable fromResource(String resourcePath) {
        try (InputStream in = KeyedLiteralTable.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            Yaml yaml = new Yaml(new Constructor(KeyedLiteralTable.class, new LoaderOptions()));
            KeyedLiteralTable table = yaml.load(in);
            if (table == null) {
                table = new KeyedLiteralTable();
            }
            table.validate(resourcePath);
            logger.debug(
                    "Loaded {} keyed-literal structures from {}",
                    table.structures.size(),
                    resourcePath);
            return table;
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error(
                    "Failed to load keyed-literal table from {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load keyed-literal table from " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    public static KeyedLiteralTable loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    private void validate(String source) {
        if (structures == null) {
            structures = new ArrayList<>();
        }
        for (Structure s : structures) {
            if (s.import_path == null || s.type == null || s.getFields().isEmpty()) {
                throw new IllegalArgumentException(
                        source + ": every structure needs import_path, type and fields");
            }
            if (s.zero != null) {
                for (String field : s.zero.keySet()) {
                    if (!s.fields.contains(field)) {
                        throw new IllegalArgumentException(
                                source + ": " + s.type + " has a zero value for unknown field "
                                        + field);
                    }
                }
            }
        }
    }

    /** Import paths that have at least one structure, in table order. */
    public Set<String> importPaths() {
        Set<String> paths = new LinkedHashSet<>();
        structures.forEach(s -> paths.add(s.import_path));
        return paths;
    }

    /** Structures of one package keyed by type name. */
    public Map<String, Structure> structuresIn(String importPath) {
        Map<String, Structure> result = new HashMap<>();
        for (Structure s : structures) {
            if (s.import_path.equals(importPath)) {
                result.put(s.type, s);
            }
        }
        return result;
    }
}
