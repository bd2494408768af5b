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
import java.util.Map;
import java.util.Optional;
import net.boyechko.gofix.ast.BasicLit;
import net.boyechko.gofix.ast.CompositeLit;
import net.boyechko.gofix.ast.Expr;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.Ident;
import net.boyechko.gofix.ast.KeyValueExpr;
import net.boyechko.gofix.ast.SelectorExpr;
import net.boyechko.gofix.fix.AstUtil;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.walk.AstWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites positional literals of the {@code net} address structs, which gained a {@code Zone}
 * field, into keyed form:
 *
 * <pre>
 * &amp;net.TCPAddr{ip, 80}   becomes  &amp;net.TCPAddr{IP: ip, Port: 80}
 * &amp;net.TCPAddr{ip, 0}    becomes  &amp;net.TCPAddr{IP: ip}
 * </pre>
 *
 * A literal that already has a key anywhere is left alone, as is one with more elements than the
 * table knows fields for.
 */
public final class NetIpv6ZoneFix implements Fix {
    private static final Logger logger = LoggerFactory.getLogger(NetIpv6ZoneFix.class);

    private final KeyedLiteralTable table;

    public NetIpv6ZoneFix() {
        this(KeyedLiteralTable.loadDefault());
    }

    public NetIpv6ZoneFix(KeyedLiteralTable table) {
        this.table = table;
    }

    @Override
    public String name() {
        return "netipv6zone";
    }

    @Override
    public LocalDate date() {
        return LocalDate.of(2012, 11, 26);
    }

    @Override
    public String description() {
        return "Adapt element key to IPAddr, UDPAddr or TCPAddr composite literals.";
    }

    @Override
    public boolean precondition(GoFile file) {
        return table.importPaths().stream().anyMatch(path -> AstUtil.imports(file, path));
    }

    @Override
    public boolean transform(GoFile file) {
        boolean fixed = false;
        for (String path : table.importPaths()) {
            String pkg = AstUtil.importedAs(file, path);
            if (pkg.isEmpty()) {
                continue;
            }
            Map<String, KeyedLiteralTable.Structure> structures = table.structuresIn(path);
            for (CompositeLit lit : AstWalker.collect(file, CompositeLit.class)) {
                Optional<KeyedLiteralTable.Structure> target = resolve(lit, pkg, structures);
                if (target.isPresent() && rewrite(lit, target.get())) {
                    logger.debug(
                            "Keyed {}.{} literal at {}", pkg, target.get().getType(), lit.getPos());
                    fixed = true;
                }
            }
        }
        return fixed;
    }

    private static Optional<KeyedLiteralTable.Structure> resolve(
            CompositeLit lit, String pkg, Map<String, KeyedLiteralTable.Structure> structures) {
        if (lit.getType() instanceof SelectorExpr sel && AstUtil.isTopName(sel.getX(), pkg)) {
            return Optional.ofNullable(structures.get(sel.getSel().getName()));
        }
        return Optional.empty();
    }

    private static boolean rewrite(CompositeLit lit, KeyedLiteralTable.Structure structure) {
        List<Expr> elements = lit.getElements();
        List<String> fields = structure.getFields();
        if (elements.isEmpty()
                || elements.size() > fields.size()
                || elements.stream().anyMatch(e -> e instanceof KeyValueExpr)) {
            return false;
        }
        // Walk backwards so removals do not shift the indices still to be visited.
        for (int i = elements.size() - 1; i >= 0; i--) {
            Expr element = elements.get(i);
            String field = fields.get(i);
            if (i > 0 && isZero(element, structure.zeroLiteral(field))) {
                elements.remove(i);
            } else {
                KeyValueExpr keyed = new KeyValueExpr(new Ident(field), element);
                elements.set(i, AstUtil.positioned(keyed, element));
            }
        }
        return true;
    }

    private static boolean isZero(Expr element, Optional<String> zero) {
        return zero.isPresent()
                && element instanceof BasicLit lit
                && lit.getValue().equals(zero.get());
    }
}
