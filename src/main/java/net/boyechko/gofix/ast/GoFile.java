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
import java.util.stream.Stream;

/**
 * Root of a parsed source file. Leading comments (such as a package doc comment) are the
 * file's own {@link #getLeadingComments()}; comments after the last declaration are closing
 * comments.
 */
public class GoFile extends Node {
    private final Ident packageName;
    private final List<Decl> decls;
    private final List<Comment> closingComments = new ArrayList<>();

    public GoFile(Ident packageName, List<? extends Decl> decls) {
        this.packageName = packageName;
        this.decls = new ArrayList<>(decls);
    }

    public Ident getPackageName() {
        return packageName;
    }

    public List<Decl> getDecls() {
        return decls;
    }

    public List<Comment> getClosingComments() {
        return closingComments;
    }

    /** All import specs in declaration order. */
    public Stream<ImportSpec> imports() {
        return decls.stream()
                .filter(d -> d instanceof GenDecl g && g.isImport())
                .flatMap(d -> ((GenDecl) d).getSpecs().stream())
                .map(ImportSpec.class::cast);
    }

    @Override
    public List<Object> children() {
        return fields(packageName, decls);
    }
}
