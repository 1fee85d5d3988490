/*
 * CST-Lint - Lint Engine over a Lossless Concrete Syntax Tree
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
package net.boyechko.cstlint.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import net.boyechko.cstlint.syntax.LexException;
import net.boyechko.cstlint.syntax.Token;
import net.boyechko.cstlint.syntax.TokenKind;
import net.boyechko.cstlint.syntax.TokenSequence;
import net.boyechko.cstlint.syntax.Tokenizer;
import net.boyechko.cstlint.tree.Annotation;
import net.boyechko.cstlint.tree.AnnAssign;
import net.boyechko.cstlint.tree.Arg;
import net.boyechko.cstlint.tree.AsName;
import net.boyechko.cstlint.tree.Assert;
import net.boyechko.cstlint.tree.Assign;
import net.boyechko.cstlint.tree.AssignTarget;
import net.boyechko.cstlint.tree.Attribute;
import net.boyechko.cstlint.tree.AugAssign;
import net.boyechko.cstlint.tree.Await;
import net.boyechko.cstlint.tree.BinaryOperation;
import net.boyechko.cstlint.tree.BooleanOperation;
import net.boyechko.cstlint.tree.Break;
import net.boyechko.cstlint.tree.Call;
import net.boyechko.cstlint.tree.ClassDef;
import net.boyechko.cstlint.tree.CompFor;
import net.boyechko.cstlint.tree.CompIf;
import net.boyechko.cstlint.tree.Comparison;
import net.boyechko.cstlint.tree.ComparisonTarget;
import net.boyechko.cstlint.tree.ConcatenatedString;
import net.boyechko.cstlint.tree.Continue;
import net.boyechko.cstlint.tree.Decorator;
import net.boyechko.cstlint.tree.Del;
import net.boyechko.cstlint.tree.DictComp;
import net.boyechko.cstlint.tree.DictElement;
import net.boyechko.cstlint.tree.DictLiteral;
import net.boyechko.cstlint.tree.Element;
import net.boyechko.cstlint.tree.Ellipsis;
import net.boyechko.cstlint.tree.Else;
import net.boyechko.cstlint.tree.ExceptHandler;
import net.boyechko.cstlint.tree.Expr;
import net.boyechko.cstlint.tree.Expression;
import net.boyechko.cstlint.tree.Finally;
import net.boyechko.cstlint.tree.For;
import net.boyechko.cstlint.tree.FunctionDef;
import net.boyechko.cstlint.tree.GeneratorExp;
import net.boyechko.cstlint.tree.Global;
import net.boyechko.cstlint.tree.If;
import net.boyechko.cstlint.tree.IfExp;
import net.boyechko.cstlint.tree.Import;
import net.boyechko.cstlint.tree.ImportAlias;
import net.boyechko.cstlint.tree.ImportFrom;
import net.boyechko.cstlint.tree.IndentedBlock;
import net.boyechko.cstlint.tree.Lambda;
import net.boyechko.cstlint.tree.ListComp;
import net.boyechko.cstlint.tree.ListLiteral;
import net.boyechko.cstlint.tree.MaybeToken;
import net.boyechko.cstlint.tree.Module;
import net.boyechko.cstlint.tree.Name;
import net.boyechko.cstlint.tree.NameItem;
import net.boyechko.cstlint.tree.NamedExpr;
import net.boyechko.cstlint.tree.Nonlocal;
import net.boyechko.cstlint.tree.Number;
import net.boyechko.cstlint.tree.OrElse;
import net.boyechko.cstlint.tree.Param;
import net.boyechko.cstlint.tree.Parenthesized;
import net.boyechko.cstlint.tree.Pass;
import net.boyechko.cstlint.tree.Raise;
import net.boyechko.cstlint.tree.Return;
import net.boyechko.cstlint.tree.SetComp;
import net.boyechko.cstlint.tree.SetLiteral;
import net.boyechko.cstlint.tree.SimpleStatementLine;
import net.boyechko.cstlint.tree.SimpleStatementSuite;
import net.boyechko.cstlint.tree.SimpleString;
import net.boyechko.cstlint.tree.Slice;
import net.boyechko.cstlint.tree.SmallStatement;
import net.boyechko.cstlint.tree.Starred;
import net.boyechko.cstlint.tree.Statement;
import net.boyechko.cstlint.tree.Subscript;
import net.boyechko.cstlint.tree.SubscriptElement;
import net.boyechko.cstlint.tree.Suite;
import net.boyechko.cstlint.tree.Try;
import net.boyechko.cstlint.tree.Tuple;
import net.boyechko.cstlint.tree.UnaryOperation;
import net.boyechko.cstlint.tree.While;
import net.boyechko.cstlint.tree.With;
import net.boyechko.cstlint.tree.WithItem;
import net.boyechko.cstlint.tree.Yield;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser from a {@link TokenSequence} to a {@link Module}. Every token ends up
 * in exactly one node, so rendering the result reproduces the tokenized source.
 */
public final class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> KEYWORDS =
            Set.of(
                    "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
                    "del", "elif", "else", "except", "finally", "for", "from", "global", "if",
                    "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
                    "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED_ASSIGN =
            Set.of(
                    "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=",
                    "**=");

    private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> COMPOUND_KEYWORDS =
            Set.of("if", "while", "for", "try", "with", "def", "class");

    private static final Set<String> EXPRESSION_START_OPS =
            Set.of("(", "[", "{", "-", "+", "~", "...", "*");

    private final TokenSequence tokens;
    private int pos;

    private Parser(TokenSequence tokens) {
        this.tokens = tokens;
    }

    public static Module parse(TokenSequence tokens) throws SyntaxException {
        Module module = new Parser(tokens).parseModule();
        logger.debug("Parsed {} top-level statements", module.body().size());
        return module;
    }

    /** Tokenizes and parses {@code source}. */
    public static Module parseModule(String source) throws LexException, SyntaxException {
        return parse(Tokenizer.tokenize(source));
    }

    // == Statements ====================================================

    private Module parseModule() throws SyntaxException {
        List<Statement> body = new ArrayList<>();
        while (!at(TokenKind.ENDMARKER)) {
            body.add(parseStatement());
        }
        return new Module(body, take());
    }

    private Statement parseStatement() throws SyntaxException {
        if (at(TokenKind.INDENT)) {
            throw error("unexpected indent");
        }
        if (atOp("@")) {
            return parseDecorated();
        }
        if (atKeyword("async") && peek(1).kind() == TokenKind.NAME) {
            return switch (peek(1).text()) {
                case "def" -> parseFunctionDef(List.of());
                case "for" -> parseFor();
                case "with" -> parseWith();
                default -> throw error("invalid syntax");
            };
        }
        if (peek().kind() == TokenKind.NAME && COMPOUND_KEYWORDS.contains(peek().text())) {
            return switch (peek().text()) {
                case "if" -> parseIf();
                case "while" -> parseWhile();
                case "for" -> parseFor();
                case "try" -> parseTry();
                case "with" -> parseWith();
                case "def" -> parseFunctionDef(List.of());
                default -> parseClassDef(List.of());
            };
        }
        List<SmallStatement> body = parseSmallStatements();
        return new SimpleStatementLine(body, expect(TokenKind.NEWLINE, "expected end of line"));
    }

    /** Semicolon-separated small statements up to, not including, the NEWLINE. */
    private List<SmallStatement> parseSmallStatements() throws SyntaxException {
        List<SmallStatement> body = new ArrayList<>();
        while (true) {
            Function<MaybeToken, SmallStatement> statement = parseSmallStatement();
            if (atOp(";")) {
                body.add(statement.apply(MaybeToken.of(take())));
                if (at(TokenKind.NEWLINE)) {
                    return body;
                }
            } else {
                body.add(statement.apply(MaybeToken.absent()));
                return body;
            }
        }
    }

    /** Returns the statement still waiting for its separator. */
    private Function<MaybeToken, SmallStatement> parseSmallStatement() throws SyntaxException {
        if (peek().kind() == TokenKind.NAME) {
            switch (peek().text()) {
                case "pass" -> {
                    Token kw = take();
                    return semi -> new Pass(kw, semi);
                }
                case "break" -> {
                    Token kw = take();
                    return semi -> new Break(kw, semi);
                }
                case "continue" -> {
                    Token kw = take();
                    return semi -> new Continue(kw, semi);
                }
                case "return" -> {
                    Token kw = take();
                    Expression value = canStartExpression() ? parseStarExpressions() : null;
                    return semi -> new Return(kw, value, semi);
                }
                case "raise" -> {
                    return parseRaise();
                }
                case "global", "nonlocal" -> {
                    return parseGlobal();
                }
                case "del" -> {
                    Token kw = take();
                    Expression target = parseStarExpressions();
                    return semi -> new Del(kw, target, semi);
                }
                case "assert" -> {
                    Token kw = take();
                    Expression test = parseTest();
                    MaybeToken comma = maybeOp(",");
                    Expression msg = comma.isPresent() ? parseTest() : null;
                    return semi -> new Assert(kw, test, comma, msg, semi);
                }
                case "import" -> {
                    return parseImport();
                }
                case "from" -> {
                    return parseImportFrom();
                }
                default -> {
                    // expression statement
                }
            }
        }
        return parseExpressionStatement();
    }

    private Function<MaybeToken, SmallStatement> parseExpressionStatement()
            throws SyntaxException {
        Expression first = parseYieldOrStarExpressions();

        if (atOp(":")) {
            Annotation annotation = new Annotation(take(), parseTest());
            MaybeToken equal = maybeOp("=");
            Expression value = equal.isPresent() ? parseYieldOrStarExpressions() : null;
            return semi -> new AnnAssign(first, annotation, equal, value, semi);
        }
        if (peek().kind() == TokenKind.OP && AUGMENTED_ASSIGN.contains(peek().text())) {
            Token op = take();
            Expression value = parseYieldOrStarExpressions();
            return semi -> new AugAssign(first, op, value, semi);
        }
        if (atOp("=")) {
            List<AssignTarget> targets = new ArrayList<>();
            Expression current = first;
            while (atOp("=")) {
                targets.add(new AssignTarget(current, take()));
                current = parseYieldOrStarExpressions();
            }
            Expression value = current;
            return semi -> new Assign(targets, value, semi);
        }
        return semi -> new Expr(first, semi);
    }

    private Function<MaybeToken, SmallStatement> parseRaise() throws SyntaxException {
        Token kw = take();
        Expression exc = null;
        MaybeToken from = MaybeToken.absent();
        Expression cause = null;
        if (canStartExpression()) {
            exc = parseTest();
            from = maybeKeyword("from");
            if (from.isPresent()) {
                cause = parseTest();
            }
        }
        Expression e = exc;
        MaybeToken f = from;
        Expression c = cause;
        return semi -> new Raise(kw, e, f, c, semi);
    }

    private Function<MaybeToken, SmallStatement> parseGlobal() throws SyntaxException {
        Token kw = take();
        List<NameItem> names = new ArrayList<>();
        MaybeToken comma;
        do {
            Name name = parseName();
            comma = maybeOp(",");
            names.add(new NameItem(name, comma));
        } while (comma.isPresent());
        if (kw.text().equals("global")) {
            return semi -> new Global(kw, names, semi);
        }
        return semi -> new Nonlocal(kw, names, semi);
    }

    private Function<MaybeToken, SmallStatement> parseImport() throws SyntaxException {
        Token kw = take();
        List<ImportAlias> names = new ArrayList<>();
        MaybeToken comma;
        do {
            Expression dotted = parseDottedName();
            AsName asName = parseOptionalAsName();
            comma = maybeOp(",");
            names.add(new ImportAlias(dotted, asName, comma));
        } while (comma.isPresent());
        return semi -> new Import(kw, names, semi);
    }

    private Function<MaybeToken, SmallStatement> parseImportFrom() throws SyntaxException {
        Token fromKw = take();
        List<Token> relative = new ArrayList<>();
        while (atOp(".") || atOp("...")) {
            relative.add(take());
        }
        Expression module = null;
        if (!atKeyword("import")) {
            module = parseDottedName();
        } else if (relative.isEmpty()) {
            throw error("expected module name");
        }
        Token importKw = expectKeyword("import");

        MaybeToken star = maybeOp("*");
        MaybeToken lpar = MaybeToken.absent();
        MaybeToken rpar = MaybeToken.absent();
        List<ImportAlias> names = new ArrayList<>();
        if (!star.isPresent()) {
            lpar = maybeOp("(");
            MaybeToken comma;
            do {
                if (lpar.isPresent() && atOp(")")) {
                    break;
                }
                Name name = parseName();
                AsName asName = parseOptionalAsName();
                comma = maybeOp(",");
                names.add(new ImportAlias(name, asName, comma));
            } while (comma.isPresent());
            if (lpar.isPresent()) {
                rpar = MaybeToken.of(expectOp(")"));
            }
        }
        Expression m = module;
        MaybeToken l = lpar;
        MaybeToken r = rpar;
        return semi -> new ImportFrom(fromKw, relative, m, importKw, star, l, names, r, semi);
    }

    private Expression parseDottedName() throws SyntaxException {
        Expression name = parseName();
        while (atOp(".")) {
            Token dot = take();
            name = new Attribute(name, dot, parseName());
        }
        return name;
    }

    private AsName parseOptionalAsName() throws SyntaxException {
        if (!atKeyword("as")) {
            return null;
        }
        Token as = take();
        return new AsName(as, parseName());
    }

    // == Compound statements ===========================================

    private Statement parseDecorated() throws SyntaxException {
        List<Decorator> decorators = new ArrayList<>();
        while (atOp("@")) {
            Token at = take();
            Expression expression = parseNamedExpression();
            decorators.add(
                    new Decorator(at, expression, expect(TokenKind.NEWLINE, "expected newline")));
        }
        if (atKeyword("class")) {
            return parseClassDef(decorators);
        }
        if (atKeyword("def") || (atKeyword("async") && peek(1).is(TokenKind.NAME, "def"))) {
            return parseFunctionDef(decorators);
        }
        throw error("expected function or class after decorator");
    }

    private If parseIf() throws SyntaxException {
        Token kw = take();
        Expression test = parseNamedExpression();
        Token colon = expectOp(":");
        Suite body = parseSuite();
        OrElse orElse = null;
        if (atKeyword("elif")) {
            orElse = parseIf();
        } else if (atKeyword("else")) {
            orElse = parseElse();
        }
        return new If(kw, test, colon, body, orElse);
    }

    private Else parseElse() throws SyntaxException {
        Token kw = take();
        Token colon = expectOp(":");
        return new Else(kw, colon, parseSuite());
    }

    private Else parseOptionalElse() throws SyntaxException {
        return atKeyword("else") ? parseElse() : null;
    }

    private While parseWhile() throws SyntaxException {
        Token kw = take();
        Expression test = parseNamedExpression();
        Token colon = expectOp(":");
        Suite body = parseSuite();
        return new While(kw, test, colon, body, parseOptionalElse());
    }

    private For parseFor() throws SyntaxException {
        MaybeToken async = maybeKeyword("async");
        Token kw = expectKeyword("for");
        Expression target = parseTargetList();
        Token in = expectKeyword("in");
        Expression iter = parseStarExpressions();
        Token colon = expectOp(":");
        Suite body = parseSuite();
        return new For(async, kw, target, in, iter, colon, body, parseOptionalElse());
    }

    private Try parseTry() throws SyntaxException {
        Token kw = take();
        Token colon = expectOp(":");
        Suite body = parseSuite();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (atKeyword("except")) {
            Token exceptKw = take();
            Expression type = null;
            AsName name = null;
            if (!atOp(":")) {
                type = parseTest();
                name = parseOptionalAsName();
            }
            Token handlerColon = expectOp(":");
            handlers.add(new ExceptHandler(exceptKw, type, name, handlerColon, parseSuite()));
        }
        Else orElse = handlers.isEmpty() ? null : parseOptionalElse();
        Finally finalBody = null;
        if (atKeyword("finally")) {
            Token finallyKw = take();
            Token finallyColon = expectOp(":");
            finalBody = new Finally(finallyKw, finallyColon, parseSuite());
        }
        if (handlers.isEmpty() && finalBody == null) {
            throw error("expected 'except' or 'finally' block");
        }
        return new Try(kw, colon, body, handlers, orElse, finalBody);
    }

    private With parseWith() throws SyntaxException {
        MaybeToken async = maybeKeyword("async");
        Token kw = expectKeyword("with");
        List<WithItem> items = new ArrayList<>();
        MaybeToken comma;
        do {
            Expression item = parseTest();
            AsName asName = null;
            if (atKeyword("as")) {
                Token as = take();
                asName = new AsName(as, parseTarget());
            }
            comma = maybeOp(",");
            items.add(new WithItem(item, asName, comma));
        } while (comma.isPresent());
        Token colon = expectOp(":");
        return new With(async, kw, items, colon, parseSuite());
    }

    private FunctionDef parseFunctionDef(List<Decorator> decorators) throws SyntaxException {
        MaybeToken async = maybeKeyword("async");
        Token kw = expectKeyword("def");
        Name name = parseName();
        Token lpar = expectOp("(");
        List<Param> params = parseParams(")", true);
        Token rpar = expectOp(")");
        Annotation returns = null;
        if (atOp("->")) {
            Token arrow = take();
            returns = new Annotation(arrow, parseTest());
        }
        Token colon = expectOp(":");
        Suite body = parseSuite();
        return new FunctionDef(
                decorators, async, kw, name, lpar, params, rpar, returns, colon, body);
    }

    private ClassDef parseClassDef(List<Decorator> decorators) throws SyntaxException {
        Token kw = expectKeyword("class");
        Name name = parseName();
        MaybeToken lpar = maybeOp("(");
        List<Arg> bases = new ArrayList<>();
        MaybeToken rpar = MaybeToken.absent();
        if (lpar.isPresent()) {
            bases = parseArgs();
            rpar = MaybeToken.of(expectOp(")"));
        }
        Token colon = expectOp(":");
        return new ClassDef(decorators, kw, name, lpar, bases, rpar, colon, parseSuite());
    }

    private Suite parseSuite() throws SyntaxException {
        if (!at(TokenKind.NEWLINE)) {
            List<SmallStatement> body = parseSmallStatements();
            return new SimpleStatementSuite(body, expect(TokenKind.NEWLINE, "expected newline"));
        }
        Token newline = take();
        Token indent = expect(TokenKind.INDENT, "expected an indented block");
        List<Statement> body = new ArrayList<>();
        while (!at(TokenKind.DEDENT)) {
            if (at(TokenKind.ENDMARKER)) {
                throw error("unexpected end of file in indented block");
            }
            body.add(parseStatement());
        }
        return new IndentedBlock(newline, indent, body, take());
    }

    /** Parameters up to {@code closing}; lambdas pass {@code ":"} and take no annotations. */
    private List<Param> parseParams(String closing, boolean annotations) throws SyntaxException {
        List<Param> params = new ArrayList<>();
        while (!atOp(closing)) {
            MaybeToken star = MaybeToken.absent();
            if (atOp("*") || atOp("**") || atOp("/")) {
                star = MaybeToken.of(take());
            }
            Name name = null;
            if (!star.isPresent() || (!star.text().equals("/") && !atOp(",") && !atOp(closing))) {
                name = parseName();
            }
            Annotation annotation = null;
            if (annotations && name != null && atOp(":")) {
                Token colon = take();
                annotation = new Annotation(colon, parseTest());
            }
            MaybeToken equal = name != null ? maybeOp("=") : MaybeToken.absent();
            Expression defaultValue = equal.isPresent() ? parseTest() : null;
            MaybeToken comma = maybeOp(",");
            params.add(new Param(star, name, annotation, equal, defaultValue, comma));
            if (!comma.isPresent()) {
                break;
            }
        }
        return params;
    }

    // == Expressions ===================================================

    private Expression parseYieldOrStarExpressions() throws SyntaxException {
        return atKeyword("yield") ? parseYield() : parseStarExpressions();
    }

    /** Comma-separated expressions; more than one, or a trailing comma, makes a bare tuple. */
    private Expression parseStarExpressions() throws SyntaxException {
        Expression first = parseStarOrNamedExpression();
        if (!atOp(",")) {
            return first;
        }
        List<Element> elements = new ArrayList<>();
        Expression current = first;
        while (true) {
            MaybeToken comma = maybeOp(",");
            elements.add(new Element(current, comma));
            if (!comma.isPresent() || !canStartExpression()) {
                break;
            }
            current = parseStarOrNamedExpression();
        }
        return new Tuple(MaybeToken.absent(), elements, MaybeToken.absent());
    }

    private Expression parseStarOrNamedExpression() throws SyntaxException {
        if (atOp("*")) {
            Token star = take();
            return new Starred(star, parseBitOr());
        }
        return parseNamedExpression();
    }

    private Expression parseNamedExpression() throws SyntaxException {
        if (peek().kind() == TokenKind.NAME && peek(1).is(TokenKind.OP, ":=")) {
            Name target = parseName();
            Token walrus = take();
            return new NamedExpr(target, walrus, parseTest());
        }
        return parseTest();
    }

    private Expression parseTest() throws SyntaxException {
        if (atKeyword("lambda")) {
            return parseLambda();
        }
        Expression body = parseOr();
        if (atKeyword("if")) {
            Token ifKw = take();
            Expression test = parseOr();
            Token elseKw = expectKeyword("else");
            return new IfExp(body, ifKw, test, elseKw, parseTest());
        }
        return body;
    }

    private Expression parseLambda() throws SyntaxException {
        Token kw = take();
        List<Param> params = parseParams(":", false);
        Token colon = expectOp(":");
        return new Lambda(kw, params, colon, parseTest());
    }

    private Expression parseOr() throws SyntaxException {
        Expression left = parseAnd();
        while (atKeyword("or")) {
            Token op = take();
            left = new BooleanOperation(left, op, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() throws SyntaxException {
        Expression left = parseNot();
        while (atKeyword("and")) {
            Token op = take();
            left = new BooleanOperation(left, op, parseNot());
        }
        return left;
    }

    private Expression parseNot() throws SyntaxException {
        if (atKeyword("not")) {
            Token op = take();
            return new UnaryOperation(op, parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() throws SyntaxException {
        Expression left = parseBitOr();
        List<ComparisonTarget> targets = new ArrayList<>();
        while (true) {
            List<Token> op = new ArrayList<>();
            Token t = peek();
            if (t.kind() == TokenKind.OP && COMPARISON_OPS.contains(t.text())) {
                op.add(take());
            } else if (atKeyword("in")) {
                op.add(take());
            } else if (atKeyword("not") && peek(1).is(TokenKind.NAME, "in")) {
                op.add(take());
                op.add(take());
            } else if (atKeyword("is")) {
                op.add(take());
                if (atKeyword("not")) {
                    op.add(take());
                }
            } else {
                break;
            }
            targets.add(new ComparisonTarget(op, parseBitOr()));
        }
        return targets.isEmpty() ? left : new Comparison(left, targets);
    }

    private Expression parseBitOr() throws SyntaxException {
        Expression left = parseBitXor();
        while (atOp("|")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseBitXor());
        }
        return left;
    }

    private Expression parseBitXor() throws SyntaxException {
        Expression left = parseBitAnd();
        while (atOp("^")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseBitAnd());
        }
        return left;
    }

    private Expression parseBitAnd() throws SyntaxException {
        Expression left = parseShift();
        while (atOp("&")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseShift());
        }
        return left;
    }

    private Expression parseShift() throws SyntaxException {
        Expression left = parseArith();
        while (atOp("<<") || atOp(">>")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseArith());
        }
        return left;
    }

    private Expression parseArith() throws SyntaxException {
        Expression left = parseTerm();
        while (atOp("+") || atOp("-")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() throws SyntaxException {
        Expression left = parseFactor();
        while (atOp("*") || atOp("/") || atOp("//") || atOp("%") || atOp("@")) {
            Token op = take();
            left = new BinaryOperation(left, op, parseFactor());
        }
        return left;
    }

    private Expression parseFactor() throws SyntaxException {
        if (atOp("+") || atOp("-") || atOp("~")) {
            Token op = take();
            return new UnaryOperation(op, parseFactor());
        }
        return parsePower();
    }

    private Expression parsePower() throws SyntaxException {
        Expression base;
        if (atKeyword("await")) {
            Token kw = take();
            base = new Await(kw, parsePrimary());
        } else {
            base = parsePrimary();
        }
        if (atOp("**")) {
            Token op = take();
            return new BinaryOperation(base, op, parseFactor());
        }
        return base;
    }

    private Expression parsePrimary() throws SyntaxException {
        Expression expr = parseAtom();
        while (true) {
            if (atOp(".")) {
                Token dot = take();
                expr = new Attribute(expr, dot, parseName());
            } else if (atOp("(")) {
                Token lpar = take();
                List<Arg> args = parseArgs();
                expr = new Call(expr, lpar, args, expectOp(")"));
            } else if (atOp("[")) {
                Token lbracket = take();
                List<SubscriptElement> slice = parseSubscriptElements();
                expr = new Subscript(expr, lbracket, slice, expectOp("]"));
            } else {
                return expr;
            }
        }
    }

    private Expression parseAtom() throws SyntaxException {
        Token t = peek();
        switch (t.kind()) {
            case NAME -> {
                if (KEYWORDS.contains(t.text())) {
                    throw error("invalid syntax");
                }
                return new Name(take());
            }
            case NUMBER -> {
                return new Number(take());
            }
            case STRING -> {
                return parseStrings();
            }
            case OP -> {
                return switch (t.text()) {
                    case "(" -> parseParenthesized();
                    case "[" -> parseListDisplay();
                    case "{" -> parseBraceDisplay();
                    case "..." -> new Ellipsis(take());
                    default -> throw error("invalid syntax");
                };
            }
            default -> throw error("invalid syntax");
        }
    }

    private Expression parseStrings() {
        SimpleString first = new SimpleString(take());
        if (!at(TokenKind.STRING)) {
            return first;
        }
        List<SimpleString> parts = new ArrayList<>();
        parts.add(first);
        while (at(TokenKind.STRING)) {
            parts.add(new SimpleString(take()));
        }
        return new ConcatenatedString(parts);
    }

    private Expression parseParenthesized() throws SyntaxException {
        Token lpar = take();
        if (atOp(")")) {
            return new Tuple(MaybeToken.of(lpar), List.of(), MaybeToken.of(take()));
        }
        if (atKeyword("yield")) {
            Expression value = parseYield();
            return new Parenthesized(lpar, value, expectOp(")"));
        }
        Expression first = parseStarOrNamedExpression();
        if (atCompFor()) {
            List<CompFor> fors = parseCompFors();
            return new GeneratorExp(MaybeToken.of(lpar), first, fors, MaybeToken.of(expectOp(")")));
        }
        if (atOp(",")) {
            List<Element> elements = parseElements(first, ")");
            return new Tuple(MaybeToken.of(lpar), elements, MaybeToken.of(expectOp(")")));
        }
        return new Parenthesized(lpar, first, expectOp(")"));
    }

    private Expression parseListDisplay() throws SyntaxException {
        Token lbracket = take();
        if (atOp("]")) {
            return new ListLiteral(lbracket, List.of(), take());
        }
        Expression first = parseStarOrNamedExpression();
        if (atCompFor()) {
            List<CompFor> fors = parseCompFors();
            return new ListComp(lbracket, first, fors, expectOp("]"));
        }
        List<Element> elements = parseElements(first, "]");
        return new ListLiteral(lbracket, elements, expectOp("]"));
    }

    private Expression parseBraceDisplay() throws SyntaxException {
        Token lbrace = take();
        if (atOp("}")) {
            return new DictLiteral(lbrace, List.of(), take());
        }
        if (atOp("**")) {
            List<DictElement> elements = parseDictElements(null);
            return new DictLiteral(lbrace, elements, expectOp("}"));
        }
        Expression first = parseStarOrNamedExpression();
        if (atOp(":")) {
            Token colon = take();
            Expression value = parseTest();
            if (atCompFor()) {
                List<CompFor> fors = parseCompFors();
                return new DictComp(lbrace, first, colon, value, fors, expectOp("}"));
            }
            MaybeToken comma = maybeOp(",");
            DictElement head =
                    new DictElement(MaybeToken.absent(), first, MaybeToken.of(colon), value, comma);
            List<DictElement> elements =
                    comma.isPresent() ? parseDictElements(head) : List.of(head);
            return new DictLiteral(lbrace, elements, expectOp("}"));
        }
        if (atCompFor()) {
            List<CompFor> fors = parseCompFors();
            return new SetComp(lbrace, first, fors, expectOp("}"));
        }
        List<Element> elements = parseElements(first, "}");
        return new SetLiteral(lbrace, elements, expectOp("}"));
    }

    /** Elements following an already parsed {@code first}, up to {@code closing}. */
    private List<Element> parseElements(Expression first, String closing) throws SyntaxException {
        List<Element> elements = new ArrayList<>();
        Expression current = first;
        while (true) {
            MaybeToken comma = maybeOp(",");
            elements.add(new Element(current, comma));
            if (!comma.isPresent() || atOp(closing)) {
                return elements;
            }
            current = parseStarOrNamedExpression();
        }
    }

    private List<DictElement> parseDictElements(DictElement head) throws SyntaxException {
        List<DictElement> elements = new ArrayList<>();
        if (head != null) {
            elements.add(head);
        }
        while (!atOp("}")) {
            DictElement element;
            if (atOp("**")) {
                Token starStar = take();
                Expression value = parseBitOr();
                element =
                        new DictElement(
                                MaybeToken.of(starStar),
                                null,
                                MaybeToken.absent(),
                                value,
                                maybeOp(","));
            } else {
                Expression key = parseTest();
                Token colon = expectOp(":");
                Expression value = parseTest();
                element =
                        new DictElement(
                                MaybeToken.absent(),
                                key,
                                MaybeToken.of(colon),
                                value,
                                maybeOp(","));
            }
            elements.add(element);
            if (!element.comma().isPresent()) {
                break;
            }
        }
        return elements;
    }

    private boolean atCompFor() {
        return atKeyword("for") || (atKeyword("async") && peek(1).is(TokenKind.NAME, "for"));
    }

    private List<CompFor> parseCompFors() throws SyntaxException {
        List<CompFor> fors = new ArrayList<>();
        while (atCompFor()) {
            MaybeToken async = maybeKeyword("async");
            Token forKw = expectKeyword("for");
            Expression target = parseTargetList();
            Token in = expectKeyword("in");
            Expression iter = parseOr();
            List<CompIf> ifs = new ArrayList<>();
            while (atKeyword("if")) {
                Token ifKw = take();
                ifs.add(new CompIf(ifKw, parseOr()));
            }
            fors.add(new CompFor(async, forKw, target, in, iter, ifs));
        }
        return fors;
    }

    /** Assignment targets of a {@code for}: stops before {@code in}. */
    private Expression parseTargetList() throws SyntaxException {
        Expression first = parseTarget();
        if (!atOp(",")) {
            return first;
        }
        List<Element> elements = new ArrayList<>();
        Expression current = first;
        while (true) {
            MaybeToken comma = maybeOp(",");
            elements.add(new Element(current, comma));
            if (!comma.isPresent() || atKeyword("in") || !canStartExpression()) {
                break;
            }
            current = parseTarget();
        }
        return new Tuple(MaybeToken.absent(), elements, MaybeToken.absent());
    }

    private Expression parseTarget() throws SyntaxException {
        if (atOp("*")) {
            Token star = take();
            return new Starred(star, parseBitOr());
        }
        return parseBitOr();
    }

    private List<Arg> parseArgs() throws SyntaxException {
        List<Arg> args = new ArrayList<>();
        while (!atOp(")")) {
            MaybeToken star = MaybeToken.absent();
            Name keyword = null;
            MaybeToken equal = MaybeToken.absent();
            Expression value;
            if (atOp("*") || atOp("**")) {
                star = MaybeToken.of(take());
                value = parseTest();
            } else if (peek().kind() == TokenKind.NAME
                    && !KEYWORDS.contains(peek().text())
                    && peek(1).is(TokenKind.OP, "=")) {
                keyword = parseName();
                equal = MaybeToken.of(take());
                value = parseTest();
            } else {
                value = parseNamedExpression();
                if (atCompFor()) {
                    value =
                            new GeneratorExp(
                                    MaybeToken.absent(),
                                    value,
                                    parseCompFors(),
                                    MaybeToken.absent());
                }
            }
            MaybeToken comma = maybeOp(",");
            args.add(new Arg(star, keyword, equal, value, comma));
            if (!comma.isPresent()) {
                break;
            }
        }
        return args;
    }

    private List<SubscriptElement> parseSubscriptElements() throws SyntaxException {
        List<SubscriptElement> elements = new ArrayList<>();
        do {
            Expression slice = parseSliceItem();
            MaybeToken comma = maybeOp(",");
            elements.add(new SubscriptElement(slice, comma));
            if (!comma.isPresent()) {
                break;
            }
        } while (!atOp("]"));
        return elements;
    }

    private Expression parseSliceItem() throws SyntaxException {
        Expression lower = atOp(":") ? null : parseStarOrNamedExpression();
        if (!atOp(":")) {
            return lower;
        }
        Token firstColon = take();
        Expression upper = canStartExpression() ? parseTest() : null;
        MaybeToken secondColon = maybeOp(":");
        Expression step = secondColon.isPresent() && canStartExpression() ? parseTest() : null;
        return new Slice(lower, firstColon, upper, secondColon, step);
    }

    private Expression parseYield() throws SyntaxException {
        Token kw = take();
        MaybeToken from = maybeKeyword("from");
        if (from.isPresent()) {
            return new Yield(kw, from, parseTest());
        }
        Expression value = canStartExpression() ? parseStarExpressions() : null;
        return new Yield(kw, from, value);
    }

    private Name parseName() throws SyntaxException {
        Token t = peek();
        if (t.kind() != TokenKind.NAME || KEYWORDS.contains(t.text())) {
            throw error("expected a name");
        }
        return new Name(take());
    }

    // == Token helpers =================================================

    private boolean canStartExpression() {
        Token t = peek();
        return switch (t.kind()) {
            case NAME -> !KEYWORDS.contains(t.text())
                    || t.text().equals("lambda")
                    || t.text().equals("not")
                    || t.text().equals("await");
            case NUMBER, STRING -> true;
            case OP -> EXPRESSION_START_OPS.contains(t.text());
            default -> false;
        };
    }

    private Token peek() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token take() {
        Token t = peek();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return t;
    }

    private boolean at(TokenKind kind) {
        return peek().kind() == kind;
    }

    private boolean atOp(String text) {
        return peek().is(TokenKind.OP, text);
    }

    private boolean atKeyword(String text) {
        return peek().is(TokenKind.NAME, text);
    }

    private MaybeToken maybeOp(String text) {
        return atOp(text) ? MaybeToken.of(take()) : MaybeToken.absent();
    }

    private MaybeToken maybeKeyword(String text) {
        return atKeyword(text) ? MaybeToken.of(take()) : MaybeToken.absent();
    }

    private Token expect(TokenKind kind, String message) throws SyntaxException {
        if (!at(kind)) {
            throw error(message);
        }
        return take();
    }

    private Token expectOp(String text) throws SyntaxException {
        if (!atOp(text)) {
            throw error("expected '" + text + "'");
        }
        return take();
    }

    private Token expectKeyword(String text) throws SyntaxException {
        if (!atKeyword(text)) {
            throw error("expected '" + text + "'");
        }
        return take();
    }

    private SyntaxException error(String message) {
        Token t = peek();
        String found =
                switch (t.kind()) {
                    case NEWLINE -> "end of line";
                    case INDENT -> "indent";
                    case DEDENT -> "dedent";
                    case ENDMARKER -> "end of file";
                    default -> "'" + t.text() + "'";
                };
        return new SyntaxException(message + ", found " + found, tokens.positionOf(pos));
    }
}
