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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The catalog of known fixes. Built once at startup and read-only afterwards, so it can be
 * shared freely between worker threads.
 */
public final class FixRegistry {
    private final Map<String, Fix> byName;
    private final List<Fix> ordered;

    private FixRegistry(Map<String, Fix> byName) {
        this.byName = byName;
        List<Fix> sorted = new ArrayList<>(byName.values());
        sorted.sort(Fix.ORDER);
        this.ordered = List.copyOf(sorted);
    }

    public static FixRegistry of(Fix... fixes) {
        return of(List.of(fixes));
    }

    /** @throws DuplicateFixException if two fixes share a name */
    public static FixRegistry of(Collection<? extends Fix> fixes) {
        Builder builder = builder();
        fixes.forEach(builder::register);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Every fix in run order. */
    public List<Fix> all() {
        return ordered;
    }

    /**
     * The named fixes in run order. Duplicate names are ignored.
     *
     * @throws UnknownFixException listing every name that is not registered
     */
    public List<Fix> select(Collection<String> names) throws UnknownFixException {
        Set<String> wanted = new LinkedHashSet<>(names);
        List<String> unknown = new ArrayList<>();
        for (String name : wanted) {
            if (!byName.containsKey(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownFixException(unknown);
        }
        return ordered.stream().filter(f -> wanted.contains(f.name())).toList();
    }

    public static final class Builder {
        private final Map<String, Fix> fixes = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(Fix fix) {
            if (fixes.putIfAbsent(fix.name(), fix) != null) {
                throw new DuplicateFixException(fix.name());
            }
            return this;
        }

        public FixRegistry build() {
            return new FixRegistry(new LinkedHashMap<>(fixes));
        }
    }
}
