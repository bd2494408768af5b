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

import java.util.ArrayList;
import java.util.List;
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
import net.boyechko.gofix.ast.Position;
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
 * Recursive descent parser for one file. Instances are single use; {@link GoParser} creates one
 * per call.
 *
 * <p>{@code exprLev} follows the usual Go convention: it is negative inside the header of an
 * {@code if}, {@code for} or {@code switch}, where {@code T {} reads as the start of a block
 * rather than a composite literal, and is raised again inside parentheses and brackets.
 */
class Parser {
    private record PendingComment(Comment comment, boolean sameLine) {}

    private final String path;
    private final List<Token> tokens;
    private final List<PendingComment> pending = new ArrayList<>();
    private int index = -1;
    private Token tok;
    private int lastLine;
    private int exprLev;

    Parser(String path, List<Token> tokens) {
        this.path = path;
        this.tokens = tokens;
        next();
    }

    GoFile parseFile() throws ParseException {
        List<Comment> doc = takeLeading();
        Token start = tok;
        expectKeyword("package");
        Ident name = parseIdent();
        expectSemi();
        List<Decl> decls = new ArrayList<>();
        while (tok.type() != TokenType.EOF) {
            decls.add(parseDecl());
        }
        GoFile file = at(new GoFile(name, decls), start);
        file.getLeadingComments().addAll(doc);
        file.getClosingComments().addAll(takeLeading());
        return file;
    }

    // ---- token handling

    private void next() {
        if (tok != null) {
            lastLine = tok.endLine();
        }
        index++;
        while (tokens.get(index).type() == TokenType.COMMENT) {
            Token c = tokens.get(index);
            pending.add(
                    new PendingComment(
                            new Comment(c.text(), c.line(), c.endLine()),
                            tok != null && c.line() == lastLine));
            index++;
        }
        tok = tokens.get(index);
    }

    private boolean isOp(String op) {
        return tok.isOperator(op);
    }

    private boolean isKeyword(String keyword) {
        return tok.isKeyword(keyword);
    }

    private Token expect(String op) throws ParseException {
        if (!isOp(op)) {
            throw errorExpected("'" + op + "'");
        }
        Token t = tok;
        next();
        return t;
    }

    private void expectKeyword(String keyword) throws ParseException {
        if (!isKeyword(keyword)) {
            throw errorExpected("'" + keyword + "'");
        }
        next();
    }

    // A semicolon may be omitted before a closing ")" or "}".
    private void expectSemi() throws ParseException {
        if (tok.type() == TokenType.SEMICOLON) {
            next();
        } else if (!isOp(")") && !isOp("}")) {
            throw errorExpected("';'");
        }
    }

    private ParseException errorExpected(String what) {
        return error(tok, "expected " + what + ", found " + tok.describe());
    }

    private ParseException error(Token at, String message) {
        return new ParseException(path, new Position(at.line(), at.column()), message);
    }

    private <T extends Node> T at(T node, Token start) {
        node.setPos(new Position(start.line(), start.column()));
        node.setEndLine(Math.max(lastLine, start.endLine()));
        return node;
    }

    // ---- comments

    private List<Comment> takeLeading() {
        List<Comment> out = new ArrayList<>(pending.size());
        for (PendingComment p : pending) {
            out.add(p.comment());
        }
        pending.clear();
        return out;
    }

    private void attachTrailing(Node node) {
        if (!pending.isEmpty()) {
            PendingComment first = pending.get(0);
            if (first.sameLine() && first.comment().line() == node.getEndLine()) {
                node.setTrailingComment(first.comment());
                pending.remove(0);
            }
        }
    }

    // ---- declarations

    private Decl parseDecl() throws ParseException {
        List<Comment> leading = takeLeading();
        Decl decl;
        if (isKeyword("func")) {
            decl = parseFuncDecl();
        } else if (isKeyword("import")
                || isKeyword("var")
                || isKeyword("const")
                || isKeyword("type")) {
            decl = parseGenDecl();
        } else {
            throw errorExpected("declaration");
        }
        decl.getLeadingComments().addAll(leading);
        expectSemi();
        attachTrailing(decl);
        return decl;
    }

    private GenDecl parseGenDecl() throws ParseException {
        Token start = tok;
        String keyword = tok.text();
        next();
        List<Spec> specs = new ArrayList<>();
        boolean grouped = isOp("(");
        if (grouped) {
            next();
            while (!isOp(")") && tok.type() != TokenType.EOF) {
                List<Comment> leading = takeLeading();
                Spec spec = parseSpec(keyword);
                spec.getLeadingComments().addAll(leading);
                expectSemi();
                attachTrailing(spec);
                specs.add(spec);
            }
            expect(")");
        } else {
            specs.add(parseSpec(keyword));
        }
        return at(new GenDecl(keyword, specs, grouped), start);
    }

    private Spec parseSpec(String keyword) throws ParseException {
        Token start = tok;
        return switch (keyword) {
            case "import" -> {
                Ident name = null;
                if (isOp(".")) {
                    name = at(new Ident("."), tok);
                    next();
                } else if (tok.type() == TokenType.IDENT) {
                    name = parseIdent();
                }
                if (tok.type() != TokenType.STRING) {
                    throw errorExpected("import path");
                }
                BasicLit importPath = parseBasicLit();
                yield at(new ImportSpec(name, importPath), start);
            }
            case "type" -> {
                Ident name = parseIdent();
                boolean alias = isOp("=");
                if (alias) {
                    next();
                }
                Expr type = parseType();
                yield at(new TypeSpec(name, alias, type), start);
            }
            default -> {
                List<Ident> names = parseIdentList();
                Expr type = null;
                List<Expr> values = new ArrayList<>();
                if (!isOp("=") && tok.type() != TokenType.SEMICOLON && !isOp(")")) {
                    type = parseType();
                }
                if (isOp("=")) {
                    next();
                    values = parseExprList();
                }
                yield at(new ValueSpec(names, type, values), start);
            }
        };
    }

    private FuncDecl parseFuncDecl() throws ParseException {
        Token start = tok;
        expectKeyword("func");
        FieldList recv = null;
        if (isOp("(")) {
            recv = parseParameters();
        }
        Ident name = parseIdent();
        Token sigStart = tok;
        FuncType type = parseSignature(sigStart);
        BlockStmt body = null;
        if (isOp("{")) {
            exprLev++;
            body = parseBlock();
            exprLev--;
        }
        return at(new FuncDecl(recv, name, type, body), start);
    }

    // ---- types

    private Expr parseType() throws ParseException {
        Expr type = tryType();
        if (type == null) {
            throw errorExpected("type");
        }
        return type;
    }

    private Expr tryType() throws ParseException {
        Token start = tok;
        if (tok.type() == TokenType.IDENT) {
            return parseTypeName();
        }
        if (isOp("[")) {
            next();
            Expr len = null;
            if (isOp("...")) {
                len = at(new Ellipsis(null), tok);
                next();
            } else if (!isOp("]")) {
                exprLev++;
                len = parseExpr();
                exprLev--;
            }
            expect("]");
            Expr elt = parseType();
            return at(new ArrayType(len, elt), start);
        }
        if (isOp("*")) {
            next();
            return at(new StarExpr(parseType()), start);
        }
        if (isOp("(")) {
            next();
            Expr inner = parseType();
            expect(")");
            return at(new ParenExpr(inner), start);
        }
        if (isOp("<-")) {
            next();
            expectKeyword("chan");
            return at(new ChanType(ChanType.Dir.RECV, parseType()), start);
        }
        if (tok.type() != TokenType.KEYWORD) {
            return null;
        }
        return switch (tok.text()) {
            case "struct" -> parseStructType();
            case "interface" -> parseInterfaceType();
            case "func" -> {
                next();
                yield parseSignature(start);
            }
            case "map" -> {
                next();
                expect("[");
                Expr key = parseType();
                expect("]");
                yield at(new MapType(key, parseType()), start);
            }
            case "chan" -> {
                next();
                ChanType.Dir dir = ChanType.Dir.BOTH;
                if (isOp("<-")) {
                    next();
                    dir = ChanType.Dir.SEND;
                }
                yield at(new ChanType(dir, parseType()), start);
            }
            default -> null;
        };
    }

    private Expr parseTypeName() throws ParseException {
        Token start = tok;
        Ident ident = parseIdent();
        if (isOp(".")) {
            next();
            return at(new SelectorExpr(ident, parseIdent()), start);
        }
        return ident;
    }

    private FuncType parseSignature(Token start) throws ParseException {
        FieldList params = parseParameters();
        FieldList results = null;
        if (isOp("(")) {
            results = parseParameters();
        } else {
            Token resultStart = tok;
            Expr result = tryType();
            if (result != null) {
                Field field = at(new Field(List.of(), result, null), resultStart);
                results = at(new FieldList(List.of(field)), resultStart);
            }
        }
        return at(new FuncType(params, results), start);
    }

    // Parameter lists are either all named ("a, b int, c string") or all unnamed ("int, string").
    private FieldList parseParameters() throws ParseException {
        Token open = expect("(");
        exprLev++;
        List<Field> fields = new ArrayList<>();
        List<Expr> bare = new ArrayList<>();
        Token groupStart = tok;
        boolean named = false;
        while (!isOp(")") && tok.type() != TokenType.EOF) {
            if (bare.isEmpty()) {
                groupStart = tok;
            }
            Expr item = parseParameterType();
            if (!isOp(",") && !isOp(")")) {
                List<Ident> names = new ArrayList<>();
                for (Expr e : bare) {
                    names.add(asName(e));
                }
                names.add(asName(item));
                Expr type = parseParameterType();
                fields.add(at(new Field(names, type, null), groupStart));
                bare.clear();
                named = true;
            } else {
                bare.add(item);
            }
            if (!isOp(",")) {
                break;
            }
            next();
        }
        exprLev--;
        if (named && !bare.isEmpty()) {
            throw error(tok, "mixed named and unnamed parameters");
        }
        for (Expr type : bare) {
            Field field = new Field(List.of(), type, null);
            field.setPos(type.getPos());
            field.setEndLine(type.getEndLine());
            fields.add(field);
        }
        expect(")");
        return at(new FieldList(fields), open);
    }

    private Expr parseParameterType() throws ParseException {
        if (isOp("...")) {
            Token start = tok;
            next();
            return at(new Ellipsis(parseType()), start);
        }
        return parseType();
    }

    private Ident asName(Expr e) throws ParseException {
        if (e instanceof Ident ident) {
            return ident;
        }
        throw new ParseException(path, e.getPos(), "expected parameter name");
    }

    private StructType parseStructType() throws ParseException {
        Token start = tok;
        expectKeyword("struct");
        Token open = expect("{");
        List<Field> fields = new ArrayList<>();
        while (!isOp("}") && tok.type() != TokenType.EOF) {
            List<Comment> leading = takeLeading();
            Token fieldStart = tok;
            List<Ident> names = new ArrayList<>();
            Expr type;
            if (isOp("*")) {
                next();
                type = at(new StarExpr(parseTypeName()), fieldStart);
            } else {
                Ident first = parseIdent();
                if (isOp(".")) {
                    next();
                    type = at(new SelectorExpr(first, parseIdent()), fieldStart);
                } else if (tok.type() == TokenType.SEMICOLON
                        || tok.type() == TokenType.STRING
                        || isOp("}")) {
                    type = first;
                } else {
                    names.add(first);
                    while (isOp(",")) {
                        next();
                        names.add(parseIdent());
                    }
                    type = parseType();
                }
            }
            BasicLit tag = tok.type() == TokenType.STRING ? parseBasicLit() : null;
            Field field = at(new Field(names, type, tag), fieldStart);
            field.getLeadingComments().addAll(leading);
            expectSemi();
            attachTrailing(field);
            fields.add(field);
        }
        expect("}");
        return at(new StructType(at(new FieldList(fields), open)), start);
    }

    private InterfaceType parseInterfaceType() throws ParseException {
        Token start = tok;
        expectKeyword("interface");
        Token open = expect("{");
        List<Field> methods = new ArrayList<>();
        while (!isOp("}") && tok.type() != TokenType.EOF) {
            List<Comment> leading = takeLeading();
            Token itemStart = tok;
            Field item;
            if (tok.type() == TokenType.IDENT) {
                Expr name = parseTypeName();
                if (name instanceof Ident ident && isOp("(")) {
                    item = new Field(List.of(ident), parseSignature(tok), null);
                } else {
                    item = new Field(List.of(), name, null);
                }
            } else {
                item = new Field(List.of(), parseType(), null);
            }
            at(item, itemStart);
            item.getLeadingComments().addAll(leading);
            expectSemi();
            attachTrailing(item);
            methods.add(item);
        }
        expect("}");
        return at(new InterfaceType(at(new FieldList(methods), open)), start);
    }

    // ---- expressions

    private Expr parseExpr() throws ParseException {
        return parseBinaryExpr(1);
    }

    private List<Expr> parseExprList() throws ParseException {
        List<Expr> list = new ArrayList<>();
        list.add(parseExpr());
        while (isOp(",")) {
            next();
            list.add(parseExpr());
        }
        return list;
    }

    private Expr parseBinaryExpr(int minPrec) throws ParseException {
        Token start = tok;
        Expr x = parseUnaryExpr();
        while (true) {
            int prec = tok.type() == TokenType.OPERATOR ? precedence(tok.text()) : 0;
            if (prec < minPrec) {
                return x;
            }
            String op = tok.text();
            next();
            Expr y = parseBinaryExpr(prec + 1);
            x = at(new BinaryExpr(x, op, y), start);
        }
    }

    static int precedence(String op) {
        return switch (op) {
            case "||" -> 1;
            case "&&" -> 2;
            case "==", "!=", "<", "<=", ">", ">=" -> 3;
            case "+", "-", "|", "^" -> 4;
            case "*", "/", "%", "<<", ">>", "&", "&^" -> 5;
            default -> 0;
        };
    }

    private Expr parseUnaryExpr() throws ParseException {
        Token start = tok;
        if (tok.type() == TokenType.OPERATOR) {
            switch (tok.text()) {
                case "+", "-", "!", "^", "&", "<-", "~" -> {
                    String op = tok.text();
                    next();
                    if (op.equals("<-") && isKeyword("chan")) {
                        next();
                        Expr chan = at(new ChanType(ChanType.Dir.RECV, parseType()), start);
                        return parsePrimaryTail(chan, start);
                    }
                    return at(new UnaryExpr(op, parseUnaryExpr()), start);
                }
                case "*" -> {
                    next();
                    return at(new StarExpr(parseUnaryExpr()), start);
                }
                default -> {
                    // not a unary operator; fall through to operand
                }
            }
        }
        return parsePrimaryTail(parseOperand(), start);
    }

    private Expr parseOperand() throws ParseException {
        Token start = tok;
        switch (tok.type()) {
            case IDENT:
                return parseIdent();
            case INT:
            case FLOAT:
            case IMAG:
            case CHAR:
            case STRING:
                return parseBasicLit();
            default:
                break;
        }
        if (isOp("(")) {
            next();
            exprLev++;
            Expr x = parseExpr();
            exprLev--;
            expect(")");
            return at(new ParenExpr(x), start);
        }
        if (isKeyword("func")) {
            next();
            FuncType type = parseSignature(start);
            if (isOp("{")) {
                exprLev++;
                BlockStmt body = parseBlock();
                exprLev--;
                return at(new FuncLit(type, body), start);
            }
            return type;
        }
        Expr type = tryType();
        if (type != null) {
            return type;
        }
        throw errorExpected("operand");
    }

    private Expr parsePrimaryTail(Expr operand, Token start) throws ParseException {
        Expr x = operand;
        while (true) {
            if (isOp(".")) {
                next();
                if (tok.type() == TokenType.IDENT) {
                    x = at(new SelectorExpr(x, parseIdent()), start);
                } else if (isOp("(")) {
                    next();
                    Expr type = null;
                    if (isKeyword("type")) {
                        next();
                    } else {
                        type = parseType();
                    }
                    expect(")");
                    x = at(new TypeAssertExpr(x, type), start);
                } else {
                    throw errorExpected("selector or type assertion");
                }
            } else if (isOp("[")) {
                x = parseIndexOrSlice(x, start);
            } else if (isOp("(")) {
                x = parseCall(x, start);
            } else if (isOp("{") && isLiteralType(x) && (exprLev >= 0 || !isTypeName(x))) {
                x = parseLiteralValue(x, start);
            } else {
                return x;
            }
        }
    }

    private Expr parseIndexOrSlice(Expr x, Token start) throws ParseException {
        expect("[");
        exprLev++;
        Expr[] index = new Expr[3];
        int colons = 0;
        if (!isOp(":")) {
            index[0] = parseExpr();
        }
        while (isOp(":") && colons < 2) {
            colons++;
            next();
            if (!isOp(":") && !isOp("]")) {
                index[colons] = parseExpr();
            }
        }
        exprLev--;
        expect("]");
        if (colons == 0) {
            if (index[0] == null) {
                throw error(tok, "expected operand");
            }
            return at(new IndexExpr(x, index[0]), start);
        }
        return at(new SliceExpr(x, index[0], index[1], index[2], colons == 2), start);
    }

    private CallExpr parseCall(Expr fun, Token start) throws ParseException {
        expect("(");
        exprLev++;
        List<Expr> args = new ArrayList<>();
        boolean ellipsis = false;
        while (!isOp(")") && tok.type() != TokenType.EOF) {
            args.add(parseExpr());
            if (isOp("...")) {
                ellipsis = true;
                next();
            }
            if (!isOp(",")) {
                break;
            }
            next();
        }
        exprLev--;
        expect(")");
        return at(new CallExpr(fun, args, ellipsis), start);
    }

    private CompositeLit parseLiteralValue(Expr type, Token start) throws ParseException {
        Token open = expect("{");
        exprLev++;
        List<Expr> elements = new ArrayList<>();
        while (!isOp("}") && tok.type() != TokenType.EOF) {
            List<Comment> leading = takeLeading();
            Expr element = parseElement();
            element.getLeadingComments().addAll(leading);
            elements.add(element);
            if (!isOp(",")) {
                break;
            }
            next();
            attachTrailing(element);
        }
        exprLev--;
        Token close = expect("}");
        CompositeLit lit = at(new CompositeLit(type, elements), start);
        lit.setMultiline(close.line() > open.line());
        return lit;
    }

    private Expr parseElement() throws ParseException {
        Token start = tok;
        Expr x = parseElementValue();
        if (isOp(":")) {
            next();
            return at(new KeyValueExpr(x, parseElementValue()), start);
        }
        return x;
    }

    private Expr parseElementValue() throws ParseException {
        if (isOp("{")) {
            return parseLiteralValue(null, tok);
        }
        return parseExpr();
    }

    private static boolean isTypeName(Expr x) {
        return x instanceof Ident || (x instanceof SelectorExpr s && s.getX() instanceof Ident);
    }

    private static boolean isLiteralType(Expr x) {
        return isTypeName(x)
                || x instanceof ArrayType
                || x instanceof MapType
                || x instanceof StructType;
    }

    private Ident parseIdent() throws ParseException {
        if (tok.type() != TokenType.IDENT) {
            throw errorExpected("identifier");
        }
        Ident ident = at(new Ident(tok.text()), tok);
        next();
        return ident;
    }

    private List<Ident> parseIdentList() throws ParseException {
        List<Ident> names = new ArrayList<>();
        names.add(parseIdent());
        while (isOp(",")) {
            next();
            names.add(parseIdent());
        }
        return names;
    }

    private BasicLit parseBasicLit() {
        BasicLit.Kind kind =
                switch (tok.type()) {
                    case INT -> BasicLit.Kind.INT;
                    case FLOAT -> BasicLit.Kind.FLOAT;
                    case IMAG -> BasicLit.Kind.IMAG;
                    case CHAR -> BasicLit.Kind.CHAR;
                    default -> BasicLit.Kind.STRING;
                };
        Token start = tok;
        next();
        return at(new BasicLit(kind, start.text()), start);
    }

    // ---- statements

    private BlockStmt parseBlock() throws ParseException {
        Token open = expect("{");
        List<Stmt> list = parseStmtList();
        List<Comment> closing = takeLeading();
        expect("}");
        BlockStmt block = at(new BlockStmt(list), open);
        block.getClosingComments().addAll(closing);
        return block;
    }

    private List<Stmt> parseStmtList() throws ParseException {
        List<Stmt> list = new ArrayList<>();
        while (!isOp("}")
                && !isKeyword("case")
                && !isKeyword("default")
                && tok.type() != TokenType.EOF) {
            if (tok.type() == TokenType.SEMICOLON) {
                next();
                continue;
            }
            List<Comment> leading = takeLeading();
            Stmt stmt = parseStmt();
            stmt.getLeadingComments().addAll(leading);
            if (tok.type() == TokenType.SEMICOLON) {
                next();
            } else if (!isOp("}") && !isKeyword("case") && !isKeyword("default")) {
                throw errorExpected("';'");
            }
            attachTrailing(stmt);
            list.add(stmt);
        }
        return list;
    }

    private Stmt parseStmt() throws ParseException {
        Token start = tok;
        if (isOp("{")) {
            return parseBlock();
        }
        if (tok.type() != TokenType.KEYWORD) {
            return parseSimpleStmt(true);
        }
        switch (tok.text()) {
            case "var", "const", "type":
                return at(new DeclStmt(parseGenDecl()), start);
            case "go":
                next();
                return at(new GoStmt(parseExpr()), start);
            case "defer":
                next();
                return at(new DeferStmt(parseExpr()), start);
            case "return":
                next();
                List<Expr> results = new ArrayList<>();
                if (tok.type() != TokenType.SEMICOLON && !isOp("}")) {
                    results = parseExprList();
                }
                return at(new ReturnStmt(results), start);
            case "break", "continue", "goto", "fallthrough":
                String keyword = tok.text();
                next();
                Ident label = tok.type() == TokenType.IDENT ? parseIdent() : null;
                return at(new BranchStmt(keyword, label), start);
            case "if":
                return parseIfStmt();
            case "switch":
                return parseSwitchStmt();
            case "for":
                return parseForStmt();
            case "select":
                throw error(tok, "select statements are not supported");
            default:
                return parseSimpleStmt(true);
        }
    }

    /**
     * Parses an expression, assignment, send, inc/dec or labeled statement. A {@code range}
     * clause comes back as an assignment whose single right-hand value is a {@code range}
     * {@link UnaryExpr}; {@link #parseForStmt()} unwraps it.
     */
    private Stmt parseSimpleStmt(boolean labelOk) throws ParseException {
        Token start = tok;
        if (isKeyword("range")) {
            next();
            Expr x = at(new UnaryExpr("range", parseExpr()), start);
            return at(new AssignStmt(List.of(), "", List.of(x)), start);
        }
        List<Expr> lhs = parseExprList();
        if (tok.type() != TokenType.OPERATOR) {
            return at(new ExprStmt(single(lhs)), start);
        }
        String op = tok.text();
        switch (op) {
            case ":=", "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "&^=":
                next();
                if (isKeyword("range") && (op.equals(":=") || op.equals("="))) {
                    Token rangeStart = tok;
                    next();
                    Expr x = at(new UnaryExpr("range", parseExpr()), rangeStart);
                    return at(new AssignStmt(lhs, op, List.of(x)), start);
                }
                return at(new AssignStmt(lhs, op, parseExprList()), start);
            case ":":
                if (labelOk && lhs.size() == 1 && lhs.get(0) instanceof Ident label) {
                    next();
                    return at(new LabeledStmt(label, parseStmt()), start);
                }
                break;
            case "<-":
                next();
                return at(new SendStmt(single(lhs), parseExpr()), start);
            case "++", "--":
                next();
                return at(new IncDecStmt(single(lhs), op), start);
            default:
                break;
        }
        return at(new ExprStmt(single(lhs)), start);
    }

    private Expr single(List<Expr> list) throws ParseException {
        if (list.size() != 1) {
            throw error(tok, "expected 1 expression, found " + list.size());
        }
        return list.get(0);
    }

    private IfStmt parseIfStmt() throws ParseException {
        Token start = tok;
        expectKeyword("if");
        int outer = exprLev;
        exprLev = -1;
        Stmt init = null;
        Expr cond;
        Stmt s = parseSimpleStmt(false);
        if (tok.type() == TokenType.SEMICOLON) {
            next();
            init = s;
            cond = parseExpr();
        } else {
            cond = condition(s);
        }
        exprLev = outer;
        BlockStmt body = parseBlock();
        Stmt elseBranch = null;
        if (isKeyword("else")) {
            next();
            if (isKeyword("if")) {
                elseBranch = parseIfStmt();
            } else if (isOp("{")) {
                elseBranch = parseBlock();
            } else {
                throw errorExpected("if statement or block");
            }
        }
        return at(new IfStmt(init, cond, body, elseBranch), start);
    }

    private Expr condition(Stmt s) throws ParseException {
        if (s instanceof ExprStmt e) {
            return e.getX();
        }
        throw new ParseException(path, s.getPos(), "expected boolean expression");
    }

    private SwitchStmt parseSwitchStmt() throws ParseException {
        Token start = tok;
        expectKeyword("switch");
        int outer = exprLev;
        exprLev = -1;
        Stmt init = null;
        Stmt tag = null;
        if (!isOp("{")) {
            if (tok.type() != TokenType.SEMICOLON) {
                tag = parseSimpleStmt(false);
            }
            if (tok.type() == TokenType.SEMICOLON) {
                next();
                init = tag;
                tag = null;
                if (!isOp("{")) {
                    tag = parseSimpleStmt(false);
                }
            }
        }
        exprLev = outer;
        Token open = expect("{");
        List<Stmt> clauses = new ArrayList<>();
        while (isKeyword("case") || isKeyword("default")) {
            List<Comment> leading = takeLeading();
            CaseClause clause = parseCaseClause();
            clause.getLeadingComments().addAll(leading);
            clauses.add(clause);
        }
        List<Comment> closing = takeLeading();
        expect("}");
        BlockStmt body = at(new BlockStmt(clauses), open);
        body.getClosingComments().addAll(closing);
        return at(new SwitchStmt(init, tag, body), start);
    }

    private CaseClause parseCaseClause() throws ParseException {
        Token start = tok;
        List<Expr> list = new ArrayList<>();
        if (isKeyword("case")) {
            next();
            list = parseExprList();
        } else {
            expectKeyword("default");
        }
        Token colon = expect(":");
        Comment trailing = null;
        if (!pending.isEmpty()
                && pending.get(0).sameLine()
                && pending.get(0).comment().line() == colon.line()) {
            trailing = pending.remove(0).comment();
        }
        CaseClause clause = new CaseClause(list, parseStmtList());
        clause.setTrailingComment(trailing);
        return at(clause, start);
    }

    private Stmt parseForStmt() throws ParseException {
        Token start = tok;
        expectKeyword("for");
        int outer = exprLev;
        exprLev = -1;
        Stmt init = null;
        Stmt cond = null;
        Stmt post = null;
        boolean threeClause = false;
        if (!isOp("{")) {
            if (tok.type() != TokenType.SEMICOLON) {
                cond = parseSimpleStmt(false);
            }
            if (tok.type() == TokenType.SEMICOLON) {
                threeClause = true;
                next();
                init = cond;
                cond = null;
                if (tok.type() != TokenType.SEMICOLON) {
                    cond = parseSimpleStmt(false);
                }
                if (tok.type() != TokenType.SEMICOLON) {
                    throw errorExpected("';'");
                }
                next();
                if (!isOp("{")) {
                    post = parseSimpleStmt(false);
                }
            }
        }
        exprLev = outer;
        BlockStmt body = parseBlock();
        if (!threeClause
                && cond instanceof AssignStmt a
                && a.getRhs().size() == 1
                && a.getRhs().get(0) instanceof UnaryExpr u
                && u.getOp().equals("range")) {
            List<Expr> lhs = a.getLhs();
            if (lhs.size() > 2) {
                throw new ParseException(path, a.getPos(), "range permits at most two variables");
            }
            Expr key = lhs.isEmpty() ? null : lhs.get(0);
            Expr value = lhs.size() > 1 ? lhs.get(1) : null;
            String op = lhs.isEmpty() ? null : a.getOp();
            return at(new RangeStmt(key, value, op, u.getX(), body), start);
        }
        return at(
                new ForStmt(
                        init, cond == null ? null : condition(cond), post, body, threeClause),
                start);
    }
}
