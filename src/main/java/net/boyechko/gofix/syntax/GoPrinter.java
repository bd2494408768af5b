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
package net.boyechko.gofix.syntax;

import java.util.List;
import java.util.function.Consumer;
import net.boyechko.gofix.ast.ArrayType;
import net.boyechko.gofix.ast.AssignStmt;
import net.boyechko.gofix.ast.BasicLit;
import net.boyechko.gofix.ast.BinaryExpr;
import net.boyechko.gofix.ast.BlockStmt;
import net.boyechko.gofix.ast.BranchStmt;
import net.boyechko.gofix.ast.CallExpr;
import net.boyechko.gofix.ast.CaseClause;
import net.boyechko.gofix.ast.ChanType;
import net.boyechko.gofix.ast.Comment;
import net.boyechko.gofix.ast.CompositeLit;
import net.boyechko.gofix.ast.Decl;
import net.boyechko.gofix.ast.DeclStmt;
import net.boyechko.gofix.ast.DeferStmt;
import net.boyechko.gofix.ast.Ellipsis;
import net.boyechko.gofix.ast.Expr;
import net.boyechko.gofix.ast.ExprStmt;
import net.boyechko.gofix.ast.Field;
import net.boyechko.gofix.ast.FieldList;
import net.boyechko.gofix.ast.ForStmt;
import net.boyechko.gofix.ast.FuncDecl;
import net.boyechko.gofix.ast.FuncLit;
import net.boyechko.gofix.ast.FuncType;
import net.boyechko.gofix.ast.GenDecl;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.GoStmt;
import net.boyechko.gofix.ast.Ident;
import net.boyechko.gofix.ast.IfStmt;
import net.boyechko.gofix.ast.ImportSpec;
import net.boyechko.gofix.ast.IncDecStmt;
import net.boyechko.gofix.ast.IndexExpr;
import net.boyechko.gofix.ast.InterfaceType;
import net.boyechko.gofix.ast.KeyValueExpr;
import net.boyechko.gofix.ast.LabeledStmt;
import net.boyechko.gofix.ast.MapType;
import net.boyechko.gofix.ast.Node;
import net.boyechko.gofix.ast.ParenExpr;
import net.boyechko.gofix.ast.RangeStmt;
import net.boyechko.gofix.ast.ReturnStmt;
import net.boyechko.gofix.ast.SelectorExpr;
import net.boyechko.gofix.ast.SendStmt;
import net.boyechko.gofix.ast.SliceExpr;
import net.boyechko.gofix.ast.Spec;
import net.boyechko.gofix.ast.StarExpr;
import net.boyechko.gofix.ast.Stmt;
import net.boyechko.gofix.ast.StructType;
import net.boyechko.gofix.ast.SwitchStmt;
import net.boyechko.gofix.ast.TypeAssertExpr;
import net.boyechko.gofix.ast.TypeSpec;
import net.boyechko.gofix.ast.UnaryExpr;
import net.boyechko.gofix.ast.ValueSpec;

/**
 * Canonical printer for the Go subset.
 *
 * <p>Layout rules: one tab per nesting level, single spaces around binary operators and after
 * commas, at most one blank line kept between items that were separated in the source, composite
 * literals that spanned several lines keep one element per line with a trailing comma, and the
 * output ends with exactly one newline. Struct fields are not column aligned.
 */
public final class GoPrinter implements SourcePrinter {

    @Override
    public String print(GoFile file) {
        Output output = new Output();
        output.file(file);
        return output.result();
    }

    private static final class Output {
        private final StringBuilder out = new StringBuilder();
        private int indent;

        String result() {
            int end = out.length();
            while (end > 0 && out.charAt(end - 1) == '\n') {
                end--;
            }
            return out.substring(0, end) + "\n";
        }

        void file(GoFile file) {
            comments(file.getLeadingComments(), file.getPos().line());
            out.append("package ").append(file.getPackageName().getName()).append('\n');
            int prevEnd = file.getPackageName().getEndLine();
            for (Decl decl : file.getDecls()) {
                int start = startLine(decl);
                if (prevEnd == 0 || start == 0 || start - prevEnd > 1) {
                    out.append('\n');
                }
                item(decl, () -> decl(decl), "", decl.getTrailingComment());
                prevEnd = endLine(decl);
            }
            closing(file.getClosingComments(), prevEnd);
        }

        // ---- layout helpers

        private void tabs() {
            out.append("\t".repeat(Math.max(indent, 0)));
        }

        private static int startLine(Node n) {
            List<Comment> leading = n.getLeadingComments();
            return leading.isEmpty() ? n.getPos().line() : leading.get(0).line();
        }

        private static int endLine(Node n) {
            Comment trailing = n.getTrailingComment();
            return trailing == null ? n.getEndLine() : Math.max(n.getEndLine(), trailing.endLine());
        }

        private static boolean blankBetween(int prevEnd, Node next) {
            int start = startLine(next);
            return prevEnd > 0 && start > 0 && start - prevEnd > 1;
        }

        private void comments(List<Comment> comments, int followingLine) {
            Comment prev = null;
            for (Comment c : comments) {
                if (prev != null && c.line() - prev.endLine() > 1) {
                    out.append('\n');
                }
                tabs();
                out.append(c.text()).append('\n');
                prev = c;
            }
            if (prev != null && followingLine > 0 && followingLine - prev.endLine() > 1) {
                out.append('\n');
            }
        }

        private void item(Node n, Runnable body, String suffix, Comment trailing) {
            comments(n.getLeadingComments(), n.getPos().line());
            tabs();
            body.run();
            out.append(suffix);
            if (trailing != null) {
                out.append(' ').append(trailing.text());
            }
            out.append('\n');
        }

        private int items(List<? extends Node> nodes, String suffix) {
            return items(nodes, suffix, this::node);
        }

        private int items(List<? extends Node> nodes, String suffix, Consumer<Node> body) {
            int prevEnd = 0;
            for (Node n : nodes) {
                if (blankBetween(prevEnd, n)) {
                    out.append('\n');
                }
                if (n instanceof Stmt s) {
                    stmtLine(s);
                } else {
                    item(n, () -> body.accept(n), suffix, n.getTrailingComment());
                }
                prevEnd = endLine(n);
            }
            return prevEnd;
        }

        private void closing(List<Comment> comments, int prevEnd) {
            int last = prevEnd;
            for (Comment c : comments) {
                if (last > 0 && c.line() - last > 1) {
                    out.append('\n');
                }
                tabs();
                out.append(c.text()).append('\n');
                last = c.endLine();
            }
        }

        private void node(Node n) {
            if (n instanceof Spec spec) {
                spec(spec);
            } else if (n instanceof Field field) {
                structField(field);
            } else if (n instanceof Expr e) {
                expr(e);
            } else if (n instanceof Decl d) {
                decl(d);
            } else {
                throw new IllegalArgumentException("cannot print " + n);
            }
        }

        // ---- declarations

        private void decl(Decl decl) {
            if (decl instanceof GenDecl g) {
                genDecl(g);
            } else if (decl instanceof FuncDecl f) {
                out.append("func ");
                if (f.getRecv() != null) {
                    out.append('(');
                    params(f.getRecv());
                    out.append(") ");
                }
                out.append(f.getName().getName());
                signature(f.getType());
                if (f.getBody() != null) {
                    out.append(' ');
                    block(f.getBody());
                }
            } else {
                throw new IllegalArgumentException("cannot print " + decl);
            }
        }

        private void genDecl(GenDecl g) {
            out.append(g.getKeyword()).append(' ');
            if (!g.isGrouped()) {
                if (!g.getSpecs().isEmpty()) {
                    spec(g.getSpecs().get(0));
                }
                return;
            }
            if (g.getSpecs().isEmpty()) {
                out.append("()");
                return;
            }
            out.append("(\n");
            indent++;
            items(g.getSpecs(), "");
            indent--;
            tabs();
            out.append(')');
        }

        private void spec(Spec spec) {
            if (spec instanceof ImportSpec i) {
                if (i.getName() != null) {
                    out.append(i.getName().getName()).append(' ');
                }
                out.append(i.getPath().getValue());
            } else if (spec instanceof ValueSpec v) {
                identList(v.getNames());
                if (v.getType() != null) {
                    out.append(' ');
                    expr(v.getType());
                }
                if (!v.getValues().isEmpty()) {
                    out.append(" = ");
                    exprList(v.getValues());
                }
            } else if (spec instanceof TypeSpec t) {
                out.append(t.getName().getName()).append(t.isAlias() ? " = " : " ");
                expr(t.getType());
            }
        }

        // ---- statements

        private void stmtLine(Stmt s) {
            if (s instanceof LabeledStmt l) {
                comments(l.getLeadingComments(), l.getPos().line());
                indent--;
                tabs();
                indent++;
                out.append(l.getLabel().getName()).append(":\n");
                Stmt inner = l.getStmt();
                Comment trailing =
                        inner.getTrailingComment() != null
                                ? inner.getTrailingComment()
                                : l.getTrailingComment();
                item(inner, () -> stmt(inner), "", trailing);
            } else {
                item(s, () -> stmt(s), "", s.getTrailingComment());
            }
        }

        private void block(BlockStmt b) {
            if (b.getList().isEmpty()
                    && b.getClosingComments().isEmpty()
                    && (b.getEndLine() == 0 || b.getEndLine() == b.getPos().line())) {
                out.append("{}");
                return;
            }
            out.append("{\n");
            indent++;
            int prevEnd = items(b.getList(), "");
            closing(b.getClosingComments(), prevEnd);
            indent--;
            tabs();
            out.append('}');
        }

        private void stmt(Stmt s) {
            if (s instanceof ExprStmt e) {
                expr(e.getX());
            } else if (s instanceof AssignStmt a) {
                exprList(a.getLhs());
                out.append(' ').append(a.getOp()).append(' ');
                exprList(a.getRhs());
            } else if (s instanceof IncDecStmt i) {
                expr(i.getX());
                out.append(i.getOp());
            } else if (s instanceof SendStmt send) {
                expr(send.getChan());
                out.append(" <- ");
                expr(send.getValue());
            } else if (s instanceof GoStmt g) {
                out.append("go ");
                expr(g.getCall());
            } else if (s instanceof DeferStmt d) {
                out.append("defer ");
                expr(d.getCall());
            } else if (s instanceof ReturnStmt r) {
                out.append("return");
                if (!r.getResults().isEmpty()) {
                    out.append(' ');
                    exprList(r.getResults());
                }
            } else if (s instanceof BranchStmt b) {
                out.append(b.getKeyword());
                if (b.getLabel() != null) {
                    out.append(' ').append(b.getLabel().getName());
                }
            } else if (s instanceof BlockStmt b) {
                block(b);
            } else if (s instanceof IfStmt i) {
                ifStmt(i);
            } else if (s instanceof SwitchStmt sw) {
                switchStmt(sw);
            } else if (s instanceof ForStmt f) {
                forStmt(f);
            } else if (s instanceof RangeStmt r) {
                out.append("for ");
                if (r.getKey() != null) {
                    expr(r.getKey());
                    if (r.getValue() != null) {
                        out.append(", ");
                        expr(r.getValue());
                    }
                    out.append(' ').append(r.getOp()).append(' ');
                }
                out.append("range ");
                expr(r.getX());
                out.append(' ');
                block(r.getBody());
            } else if (s instanceof DeclStmt d) {
                genDecl(d.getDecl());
            } else if (s instanceof LabeledStmt l) {
                out.append(l.getLabel().getName()).append(": ");
                stmt(l.getStmt());
            } else {
                throw new IllegalArgumentException("cannot print " + s);
            }
        }

        private void ifStmt(IfStmt i) {
            out.append("if ");
            if (i.getInit() != null) {
                stmt(i.getInit());
                out.append("; ");
            }
            expr(i.getCond());
            out.append(' ');
            block(i.getBody());
            if (i.getElse() != null) {
                out.append(" else ");
                stmt(i.getElse());
            }
        }

        private void switchStmt(SwitchStmt sw) {
            out.append("switch ");
            if (sw.getInit() != null) {
                stmt(sw.getInit());
                out.append("; ");
            }
            if (sw.getTag() != null) {
                stmt(sw.getTag());
                out.append(' ');
            }
            out.append("{\n");
            int prevEnd = 0;
            for (Stmt s : sw.getBody().getList()) {
                CaseClause clause = (CaseClause) s;
                if (blankBetween(prevEnd, clause)) {
                    out.append('\n');
                }
                comments(clause.getLeadingComments(), clause.getPos().line());
                tabs();
                if (clause.isDefault()) {
                    out.append("default:");
                } else {
                    out.append("case ");
                    exprList(clause.getList());
                    out.append(':');
                }
                if (clause.getTrailingComment() != null) {
                    out.append(' ').append(clause.getTrailingComment().text());
                }
                out.append('\n');
                indent++;
                items(clause.getBody(), "");
                indent--;
                prevEnd = clause.getEndLine();
            }
            closing(sw.getBody().getClosingComments(), prevEnd);
            tabs();
            out.append('}');
        }

        private void forStmt(ForStmt f) {
            out.append("for ");
            if (f.isThreeClause()) {
                if (f.getInit() != null) {
                    stmt(f.getInit());
                }
                out.append("; ");
                if (f.getCond() != null) {
                    expr(f.getCond());
                }
                out.append("; ");
                if (f.getPost() != null) {
                    stmt(f.getPost());
                }
                trimTrailingSpace();
                out.append(' ');
            } else if (f.getCond() != null) {
                expr(f.getCond());
                out.append(' ');
            }
            block(f.getBody());
        }

        private void trimTrailingSpace() {
            while (out.length() > 0 && out.charAt(out.length() - 1) == ' ') {
                out.setLength(out.length() - 1);
            }
        }

        // ---- expressions

        private void exprList(List<? extends Expr> list) {
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                expr(list.get(i));
            }
        }

        private void identList(List<Ident> names) {
            for (int i = 0; i < names.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                out.append(names.get(i).getName());
            }
        }

        private void expr(Expr e) {
            if (e instanceof Ident id) {
                out.append(id.getName());
            } else if (e instanceof BasicLit lit) {
                out.append(lit.getValue());
            } else if (e instanceof CompositeLit lit) {
                compositeLit(lit);
            } else if (e instanceof KeyValueExpr kv) {
                expr(kv.getKey());
                out.append(": ");
                expr(kv.getValue());
            } else if (e instanceof SelectorExpr sel) {
                expr(sel.getX());
                out.append('.').append(sel.getSel().getName());
            } else if (e instanceof CallExpr call) {
                expr(call.getFun());
                out.append('(');
                exprList(call.getArgs());
                if (call.hasEllipsis()) {
                    out.append("...");
                }
                out.append(')');
            } else if (e instanceof IndexExpr ix) {
                expr(ix.getX());
                out.append('[');
                expr(ix.getIndex());
                out.append(']');
            } else if (e instanceof SliceExpr sl) {
                expr(sl.getX());
                out.append('[');
                optional(sl.getLow());
                out.append(':');
                optional(sl.getHigh());
                if (sl.isSlice3()) {
                    out.append(':');
                    optional(sl.getMax());
                }
                out.append(']');
            } else if (e instanceof StarExpr star) {
                out.append('*');
                expr(star.getX());
            } else if (e instanceof UnaryExpr u) {
                unary(u);
            } else if (e instanceof BinaryExpr b) {
                expr(b.getX());
                out.append(' ').append(b.getOp()).append(' ');
                expr(b.getY());
            } else if (e instanceof ParenExpr p) {
                out.append('(');
                expr(p.getX());
                out.append(')');
            } else if (e instanceof TypeAssertExpr ta) {
                expr(ta.getX());
                out.append(".(");
                if (ta.getType() == null) {
                    out.append("type");
                } else {
                    expr(ta.getType());
                }
                out.append(')');
            } else if (e instanceof FuncLit fn) {
                out.append("func");
                signature(fn.getType());
                out.append(' ');
                block(fn.getBody());
            } else {
                type(e);
            }
        }

        private void optional(Expr e) {
            if (e != null) {
                expr(e);
            }
        }

        private void unary(UnaryExpr u) {
            out.append(u.getOp());
            String inner =
                    u.getX() instanceof UnaryExpr x
                            ? x.getOp()
                            : u.getX() instanceof StarExpr ? "*" : "";
            // "- -x" and "& &x" must not fuse into "--" and "&&".
            String fused = u.getOp() + inner;
            if (fused.equals("--")
                    || fused.equals("++")
                    || fused.equals("&&")
                    || fused.equals("&^")) {
                out.append(' ');
            }
            expr(u.getX());
        }

        private void compositeLit(CompositeLit lit) {
            if (lit.getType() != null) {
                expr(lit.getType());
            }
            if (!lit.isMultiline()) {
                out.append('{');
                List<Expr> elements = lit.getElements();
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) {
                        out.append(", ");
                    }
                    Expr element = elements.get(i);
                    for (Comment c : element.getLeadingComments()) {
                        out.append(c.text()).append(' ');
                    }
                    expr(element);
                    if (element.getTrailingComment() != null) {
                        out.append(' ').append(element.getTrailingComment().text());
                    }
                }
                out.append('}');
                return;
            }
            out.append("{\n");
            indent++;
            items(lit.getElements(), ",");
            indent--;
            tabs();
            out.append('}');
        }

        private void type(Expr e) {
            if (e instanceof ArrayType a) {
                out.append('[');
                optional(a.getLen());
                out.append(']');
                expr(a.getElt());
            } else if (e instanceof Ellipsis el) {
                out.append("...");
                optional(el.getElt());
            } else if (e instanceof MapType m) {
                out.append("map[");
                expr(m.getKey());
                out.append(']');
                expr(m.getValue());
            } else if (e instanceof ChanType c) {
                out.append(
                        switch (c.getDir()) {
                            case BOTH -> "chan ";
                            case SEND -> "chan<- ";
                            case RECV -> "<-chan ";
                        });
                expr(c.getValue());
            } else if (e instanceof FuncType f) {
                out.append("func");
                signature(f);
            } else if (e instanceof StructType s) {
                fieldBlock("struct", s.getFields(), n -> structField((Field) n));
            } else if (e instanceof InterfaceType i) {
                fieldBlock("interface", i.getMethods(), n -> interfaceItem((Field) n));
            } else {
                throw new IllegalArgumentException("cannot print " + e);
            }
        }

        private void fieldBlock(String keyword, FieldList fields, Consumer<Node> body) {
            out.append(keyword);
            if (fields.isEmpty()) {
                out.append("{}");
                return;
            }
            out.append(" {\n");
            indent++;
            items(fields.getList(), "", body);
            indent--;
            tabs();
            out.append('}');
        }

        private void interfaceItem(Field field) {
            if (field.getType() instanceof FuncType method && field.getNames().size() == 1) {
                out.append(field.getNames().get(0).getName());
                signature(method);
            } else {
                expr(field.getType());
            }
        }

        private void structField(Field field) {
            if (!field.getNames().isEmpty()) {
                identList(field.getNames());
                out.append(' ');
            }
            expr(field.getType());
            if (field.getTag() != null) {
                out.append(' ').append(field.getTag().getValue());
            }
        }

        private void signature(FuncType type) {
            out.append('(');
            params(type.getParams());
            out.append(')');
            FieldList results = type.getResults();
            if (results == null || results.isEmpty()) {
                return;
            }
            List<Field> list = results.getList();
            if (list.size() == 1 && list.get(0).getNames().isEmpty()) {
                out.append(' ');
                expr(list.get(0).getType());
            } else {
                out.append(" (");
                params(results);
                out.append(')');
            }
        }

        private void params(FieldList params) {
            List<Field> list = params.getList();
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                Field f = list.get(i);
                if (!f.getNames().isEmpty()) {
                    identList(f.getNames());
                    out.append(' ');
                }
                expr(f.getType());
            }
        }
    }
}
