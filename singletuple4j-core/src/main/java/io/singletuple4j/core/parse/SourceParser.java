/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.parse;

import io.singletuple4j.core.syntax.BooleanOperator;
import io.singletuple4j.core.syntax.ComparisonOperator;
import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.SyntaxNode;
import io.singletuple4j.core.syntax.Token;
import io.singletuple4j.core.syntax.TokenKind;
import io.singletuple4j.core.tokenize.PythonTokenizer;
import io.singletuple4j.core.tokenize.TokenizeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive descent parser for Python 3 source units, producing {@link SyntaxNode} trees with
 * {@code ast}-compatible positions.
 *
 * <p>Covers statements and the expression grammar; {@code async}, {@code await}, assignment
 * expressions ({@code :=}) and {@code match} statements are rejected with a {@link ParseException}.
 * The parser stops at the first error.
 */
public final class SourceParser {

    private static final Set<String> AUGMENTED_ASSIGNMENTS =
            Set.of("+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    // binary operator levels, loosest first; '**' is handled in parsePower
    private static final List<Set<String>> OPERATOR_PRECEDENCE = List.of(
            Set.of("|"), Set.of("^"), Set.of("&"), Set.of("<<", ">>"), Set.of("+", "-"), Set.of("*", "/", "//", "%", "@"));

    private final List<Token> tokens;
    private int pos;
    private Position lastEnd = Position.of(1, 0);

    private SourceParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static SyntaxNode.Module parse(String source) throws ParseException {
        Objects.requireNonNull(source, "source");
        return parse(source.lines().toList());
    }

    /**
     * Parses one source unit.
     *
     * @param lines the unit's lines, with or without line terminators
     * @throws ParseException on the first tokenization or syntax error
     */
    public static SyntaxNode.Module parse(List<String> lines) throws ParseException {
        Objects.requireNonNull(lines, "lines");
        List<Token> all;
        try {
            all = PythonTokenizer.tokenize(lines);
        } catch (TokenizeException e) {
            throw new ParseException(e);
        }
        List<Token> significant = new ArrayList<>(all.size());
        for (Token t : all) {
            if (t.kind() != TokenKind.COMMENT && t.kind() != TokenKind.NL) significant.add(t);
        }
        return new SourceParser(significant).parseFileInput();
    }

    // ---------------- token plumbing ----------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token nextToken() {
        Token t = tokens.get(pos);
        if (t.kind() != TokenKind.END_MARKER) pos++;
        switch (t.kind()) {
            case NEWLINE, INDENT, DEDENT, END_MARKER -> { }
            default -> lastEnd = t.end();
        }
        return t;
    }

    private boolean atKind(TokenKind kind) {
        return peek().kind() == kind;
    }

    private boolean atOp(String op) {
        return peek().isOp(op);
    }

    private boolean atKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean acceptOp(String op) {
        if (!atOp(op)) return false;
        nextToken();
        return true;
    }

    private boolean acceptKeyword(String keyword) {
        if (!atKeyword(keyword)) return false;
        nextToken();
        return true;
    }

    private Token expectOp(String op) throws ParseException {
        if (!atOp(op)) throw syntaxError("expected '" + op + "'");
        return nextToken();
    }

    private Token expectKeyword(String keyword) throws ParseException {
        if (!atKeyword(keyword)) throw syntaxError("expected '" + keyword + "'");
        return nextToken();
    }

    private Token expect(TokenKind kind) throws ParseException {
        if (!atKind(kind)) throw syntaxError("expected " + kind);
        return nextToken();
    }

    private String parseIdent() throws ParseException {
        return expect(TokenKind.NAME).text();
    }

    private ParseException syntaxError(String message) {
        Token t = peek();
        String found = switch (t.kind()) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case END_MARKER -> "end of input";
            default -> "'" + t.text() + "'";
        };
        return new ParseException(message + ", got " + found, t.start());
    }

    // ---------------- statements ----------------

    private SyntaxNode.Module parseFileInput() throws ParseException {
        List<SyntaxNode> body = new ArrayList<>();
        while (!atKind(TokenKind.END_MARKER)) {
            if (atKind(TokenKind.NEWLINE)) {
                nextToken();
                continue;
            }
            parseStatement(body);
        }
        return new SyntaxNode.Module(body, Position.of(1, 0), peek().start());
    }

    private void parseStatement(List<SyntaxNode> list) throws ParseException {
        Token t = peek();
        if (t.kind() == TokenKind.INDENT) throw syntaxError("unexpected indent");
        if (t.kind() == TokenKind.KEYWORD) {
            switch (t.text()) {
                case "if" -> {
                    list.add(parseIfStatement());
                    return;
                }
                case "while" -> {
                    list.add(parseWhileStatement());
                    return;
                }
                case "for" -> {
                    list.add(parseForStatement());
                    return;
                }
                case "def" -> {
                    list.add(parseDefStatement(List.of()));
                    return;
                }
                case "class" -> {
                    list.add(parseClassStatement(List.of()));
                    return;
                }
                case "with" -> {
                    list.add(parseWithStatement());
                    return;
                }
                case "try" -> {
                    list.add(parseTryStatement());
                    return;
                }
                case "async", "await" -> throw syntaxError("unsupported syntax");
                default -> { }
            }
        }
        if (t.isOp("@")) {
            list.add(parseDecorated());
            return;
        }
        parseSimpleStatement(list);
    }

    private void parseSimpleStatement(List<SyntaxNode> list) throws ParseException {
        list.add(parseSmallStatement());
        while (acceptOp(";")) {
            if (atKind(TokenKind.NEWLINE)) break;
            list.add(parseSmallStatement());
        }
        expect(TokenKind.NEWLINE);
    }

    private SyntaxNode parseSmallStatement() throws ParseException {
        Token first = peek();
        Position start = first.start();
        if (first.kind() == TokenKind.KEYWORD) {
            switch (first.text()) {
                case "pass", "break", "continue" -> {
                    nextToken();
                    return new SyntaxNode.KeywordStatement(first.text(), List.of(), start, lastEnd);
                }
                case "global", "nonlocal" -> {
                    nextToken();
                    List<String> names = new ArrayList<>();
                    names.add(parseIdent());
                    while (acceptOp(",")) names.add(parseIdent());
                    return new SyntaxNode.KeywordStatement(first.text(), names, start, lastEnd);
                }
                case "return" -> {
                    nextToken();
                    SyntaxNode value = canStartExpression(peek()) ? parseTestListStarExpr() : null;
                    return new SyntaxNode.Return(value, start, lastEnd);
                }
                case "raise" -> {
                    nextToken();
                    SyntaxNode exception = null;
                    SyntaxNode cause = null;
                    if (canStartExpression(peek())) {
                        exception = parseTest();
                        if (acceptKeyword("from")) cause = parseTest();
                    }
                    return new SyntaxNode.Raise(exception, cause, start, lastEnd);
                }
                case "del" -> {
                    nextToken();
                    List<SyntaxNode> targets = new ArrayList<>();
                    targets.add(parseExpr());
                    while (acceptOp(",")) {
                        if (!canStartExpression(peek())) break;
                        targets.add(parseExpr());
                    }
                    return new SyntaxNode.Delete(targets, start, lastEnd);
                }
                case "assert" -> {
                    nextToken();
                    SyntaxNode test = parseTest();
                    SyntaxNode message = acceptOp(",") ? parseTest() : null;
                    return new SyntaxNode.Assert(test, message, start, lastEnd);
                }
                case "import" -> {
                    return parseImportStatement();
                }
                case "from" -> {
                    return parseFromImportStatement();
                }
                default -> { }
            }
        }
        return parseExpressionStatement();
    }

    private SyntaxNode parseExpressionStatement() throws ParseException {
        Position start = peek().start();
        if (atKeyword("yield")) {
            SyntaxNode yield = parseYield();
            return new SyntaxNode.ExpressionStatement(yield, start, lastEnd);
        }
        SyntaxNode first = parseTestListStarExpr();

        if (acceptOp(":")) {
            SyntaxNode annotation = parseTest();
            SyntaxNode value = acceptOp("=") ? parseYieldOrTestListStarExpr() : null;
            return new SyntaxNode.AnnotatedAssign(first, annotation, value, start, lastEnd);
        }
        if (peek().kind() == TokenKind.OP && AUGMENTED_ASSIGNMENTS.contains(peek().text())) {
            String operator = nextToken().text();
            SyntaxNode value = parseYieldOrTestList();
            return new SyntaxNode.AugmentedAssign(first, operator, value, start, lastEnd);
        }
        if (atOp("=")) {
            List<SyntaxNode> targets = new ArrayList<>();
            SyntaxNode value = first;
            while (acceptOp("=")) {
                targets.add(value);
                value = parseYieldOrTestListStarExpr();
            }
            return new SyntaxNode.Assign(targets, value, start, lastEnd);
        }
        if (atOp(":=")) throw syntaxError("unsupported syntax");
        return new SyntaxNode.ExpressionStatement(first, start, lastEnd);
    }

    private SyntaxNode parseImportStatement() throws ParseException {
        Position start = expectKeyword("import").start();
        List<String> names = new ArrayList<>();
        do {
            names.add(parseDottedAsName());
        } while (acceptOp(","));
        return new SyntaxNode.Import(null, names, start, lastEnd);
    }

    private SyntaxNode parseFromImportStatement() throws ParseException {
        Position start = expectKeyword("from").start();
        StringBuilder module = new StringBuilder();
        while (atOp(".") || atOp("...")) module.append(nextToken().text());
        if (!atKeyword("import")) module.append(parseDottedName());
        expectKeyword("import");
        List<String> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add("*");
        } else {
            boolean parenthesized = acceptOp("(");
            do {
                if (parenthesized && atOp(")")) break;
                String name = parseIdent();
                if (acceptKeyword("as")) name = name + " as " + parseIdent();
                names.add(name);
            } while (acceptOp(","));
            if (parenthesized) expectOp(")");
        }
        return new SyntaxNode.Import(module.toString(), names, start, lastEnd);
    }

    private String parseDottedAsName() throws ParseException {
        String name = parseDottedName();
        if (acceptKeyword("as")) name = name + " as " + parseIdent();
        return name;
    }

    private String parseDottedName() throws ParseException {
        StringBuilder name = new StringBuilder(parseIdent());
        while (acceptOp(".")) name.append('.').append(parseIdent());
        return name.toString();
    }

    private SyntaxNode parseIfStatement() throws ParseException {
        // 'if' or 'elif'
        Position start = nextToken().start();
        SyntaxNode test = parseTest();
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        List<SyntaxNode> orElse = List.of();
        if (atKeyword("elif")) {
            orElse = List.of(parseIfStatement());
        } else if (acceptKeyword("else")) {
            expectOp(":");
            orElse = parseSuite();
        }
        return new SyntaxNode.If(test, body, orElse, start, endOf(body, orElse));
    }

    private SyntaxNode parseWhileStatement() throws ParseException {
        Position start = expectKeyword("while").start();
        SyntaxNode test = parseTest();
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        List<SyntaxNode> orElse = parseElseClause();
        return new SyntaxNode.While(test, body, orElse, start, endOf(body, orElse));
    }

    private SyntaxNode parseForStatement() throws ParseException {
        Position start = expectKeyword("for").start();
        SyntaxNode target = parseExprList();
        expectKeyword("in");
        SyntaxNode iterable = parseTestListStarExpr();
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        List<SyntaxNode> orElse = parseElseClause();
        return new SyntaxNode.For(target, iterable, body, orElse, start, endOf(body, orElse));
    }

    private List<SyntaxNode> parseElseClause() throws ParseException {
        if (!acceptKeyword("else")) return List.of();
        expectOp(":");
        return parseSuite();
    }

    private SyntaxNode parseWithStatement() throws ParseException {
        Position start = expectKeyword("with").start();
        List<SyntaxNode> items = new ArrayList<>();
        do {
            Position itemStart = peek().start();
            SyntaxNode context = parseTest();
            SyntaxNode target = acceptKeyword("as") ? parseExpr() : null;
            items.add(new SyntaxNode.WithItem(context, target, itemStart, lastEnd));
        } while (acceptOp(","));
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        return new SyntaxNode.With(items, body, start, endOf(body, List.of()));
    }

    private SyntaxNode parseTryStatement() throws ParseException {
        Position start = expectKeyword("try").start();
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        List<SyntaxNode> handlers = new ArrayList<>();
        while (atKeyword("except")) {
            Position handlerStart = nextToken().start();
            SyntaxNode type = null;
            String name = null;
            if (!atOp(":")) {
                type = parseTest();
                if (acceptKeyword("as")) name = parseIdent();
            }
            expectOp(":");
            List<SyntaxNode> handlerBody = parseSuite();
            handlers.add(new SyntaxNode.ExceptHandler(type, name, handlerBody, handlerStart, endOf(handlerBody, List.of())));
        }
        List<SyntaxNode> orElse = handlers.isEmpty() ? List.of() : parseElseClause();
        List<SyntaxNode> finalBody = List.of();
        if (acceptKeyword("finally")) {
            expectOp(":");
            finalBody = parseSuite();
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) throw syntaxError("expected 'except' or 'finally' block");
        Position end = !finalBody.isEmpty() ? endOf(finalBody, List.of())
                : !orElse.isEmpty() ? endOf(orElse, List.of())
                : handlers.get(handlers.size() - 1).end();
        return new SyntaxNode.Try(body, handlers, orElse, finalBody, start, end);
    }

    private SyntaxNode parseDecorated() throws ParseException {
        List<SyntaxNode> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(parseTest());
            expect(TokenKind.NEWLINE);
        }
        if (atKeyword("def")) return parseDefStatement(decorators);
        if (atKeyword("class")) return parseClassStatement(decorators);
        throw syntaxError("expected 'def' or 'class' after decorator");
    }

    private SyntaxNode parseDefStatement(List<SyntaxNode> decorators) throws ParseException {
        Position start = expectKeyword("def").start();
        String name = parseIdent();
        expectOp("(");
        List<String> parameters = new ArrayList<>();
        List<SyntaxNode> defaults = new ArrayList<>();
        List<SyntaxNode> annotations = new ArrayList<>();
        while (!atOp(")")) {
            if (acceptOp("/")) {
                // positional-only marker
            } else if (acceptOp("*")) {
                if (atKind(TokenKind.NAME)) parseFunctionParameter(parameters, defaults, annotations);
            } else if (acceptOp("**")) {
                parseFunctionParameter(parameters, defaults, annotations);
            } else {
                parseFunctionParameter(parameters, defaults, annotations);
            }
            if (!acceptOp(",")) break;
        }
        expectOp(")");
        SyntaxNode returns = acceptOp("->") ? parseTest() : null;
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        return new SyntaxNode.FunctionDef(
                name, decorators, parameters, defaults, annotations, returns, body, start, endOf(body, List.of()));
    }

    private void parseFunctionParameter(List<String> parameters, List<SyntaxNode> defaults, List<SyntaxNode> annotations)
            throws ParseException {
        parameters.add(parseIdent());
        if (acceptOp(":")) annotations.add(parseTest());
        if (acceptOp("=")) defaults.add(parseTest());
    }

    private SyntaxNode parseClassStatement(List<SyntaxNode> decorators) throws ParseException {
        Position start = expectKeyword("class").start();
        String name = parseIdent();
        List<SyntaxNode> bases = List.of();
        if (atOp("(")) {
            Token open = nextToken();
            bases = parseArguments(open).all();
        }
        expectOp(":");
        List<SyntaxNode> body = parseSuite();
        return new SyntaxNode.ClassDef(name, decorators, bases, body, start, endOf(body, List.of()));
    }

    private List<SyntaxNode> parseSuite() throws ParseException {
        List<SyntaxNode> body = new ArrayList<>();
        if (!atKind(TokenKind.NEWLINE)) {
            parseSimpleStatement(body);
            return body;
        }
        nextToken();
        if (!atKind(TokenKind.INDENT)) throw syntaxError("expected an indented block");
        nextToken();
        while (!atKind(TokenKind.DEDENT) && !atKind(TokenKind.END_MARKER)) {
            parseStatement(body);
        }
        expect(TokenKind.DEDENT);
        return body;
    }

    /** End of a compound statement: the end of its last nested statement. */
    private static Position endOf(List<SyntaxNode> body, List<SyntaxNode> orElse) {
        List<SyntaxNode> last = orElse.isEmpty() ? body : orElse;
        return last.get(last.size() - 1).end();
    }

    // ---------------- expressions ----------------

    private static boolean canStartExpression(Token t) {
        return switch (t.kind()) {
            case NAME, NUMBER, STRING -> true;
            case KEYWORD -> switch (t.text()) {
                case "not", "lambda", "None", "True", "False", "yield", "await" -> true;
                default -> false;
            };
            case OP -> switch (t.text()) {
                case "(", "[", "{", "-", "+", "~", "*", "..." -> true;
                default -> false;
            };
            default -> false;
        };
    }

    private SyntaxNode parseYieldOrTestListStarExpr() throws ParseException {
        return atKeyword("yield") ? parseYield() : parseTestListStarExpr();
    }

    private SyntaxNode parseYieldOrTestList() throws ParseException {
        return atKeyword("yield") ? parseYield() : parseTestList();
    }

    private SyntaxNode parseYield() throws ParseException {
        Position start = expectKeyword("yield").start();
        if (acceptKeyword("from")) {
            SyntaxNode value = parseTest();
            return new SyntaxNode.Yield(value, true, start, lastEnd);
        }
        SyntaxNode value = canStartExpression(peek()) ? parseTestListStarExpr() : null;
        return new SyntaxNode.Yield(value, false, start, lastEnd);
    }

    /** {@code a, *b, c}; a trailing comma or a second element makes an unparenthesized tuple. */
    private SyntaxNode parseTestListStarExpr() throws ParseException {
        Position start = peek().start();
        SyntaxNode first = parseStarOrTest();
        if (!atOp(",")) return first;
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!canStartExpression(peek())) break;
            elements.add(parseStarOrTest());
        }
        return new SyntaxNode.Tuple(elements, false, start, lastEnd);
    }

    private SyntaxNode parseTestList() throws ParseException {
        return parseTestListStarExpr();
    }

    /** Targets of {@code for}: bitwise-or level expressions, so that {@code in} is not consumed. */
    private SyntaxNode parseExprList() throws ParseException {
        Position start = peek().start();
        SyntaxNode first = parseStarOrExpr();
        if (!atOp(",")) return first;
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (!canStartExpression(peek())) break;
            elements.add(parseStarOrExpr());
        }
        return new SyntaxNode.Tuple(elements, false, start, lastEnd);
    }

    private SyntaxNode parseStarOrTest() throws ParseException {
        if (atOp("*")) {
            Position start = nextToken().start();
            SyntaxNode value = parseExpr();
            return new SyntaxNode.Starred(value, start, lastEnd);
        }
        return parseTest();
    }

    private SyntaxNode parseStarOrExpr() throws ParseException {
        if (atOp("*")) {
            Position start = nextToken().start();
            SyntaxNode value = parseExpr();
            return new SyntaxNode.Starred(value, start, lastEnd);
        }
        return parseExpr();
    }

    private SyntaxNode parseTest() throws ParseException {
        if (atKeyword("lambda")) return parseLambda(true);
        Position start = peek().start();
        SyntaxNode body = parseOrTest();
        if (atOp(":=")) throw syntaxError("unsupported syntax");
        if (!acceptKeyword("if")) return body;
        SyntaxNode test = parseOrTest();
        expectKeyword("else");
        SyntaxNode orElse = parseTest();
        return new SyntaxNode.Conditional(body, test, orElse, start, lastEnd);
    }

    /** Conditions of comprehensions: no unparenthesized conditional expression. */
    private SyntaxNode parseTestNoCond() throws ParseException {
        return atKeyword("lambda") ? parseLambda(false) : parseOrTest();
    }

    private SyntaxNode parseLambda(boolean allowConditional) throws ParseException {
        Position start = expectKeyword("lambda").start();
        List<String> parameters = new ArrayList<>();
        List<SyntaxNode> defaults = new ArrayList<>();
        while (!atOp(":")) {
            if (acceptOp("/")) {
                // positional-only marker
            } else if (acceptOp("*") || acceptOp("**")) {
                if (atKind(TokenKind.NAME)) parameters.add(parseIdent());
            } else {
                parameters.add(parseIdent());
                if (acceptOp("=")) defaults.add(parseTest());
            }
            if (!acceptOp(",")) break;
        }
        expectOp(":");
        SyntaxNode body = allowConditional ? parseTest() : parseTestNoCond();
        return new SyntaxNode.Lambda(parameters, defaults, body, start, lastEnd);
    }

    private SyntaxNode parseOrTest() throws ParseException {
        Position start = peek().start();
        SyntaxNode first = parseAndTest();
        if (!atKeyword("or")) return first;
        List<SyntaxNode> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) values.add(parseAndTest());
        return new SyntaxNode.BooleanOp(BooleanOperator.OR, values, start, lastEnd);
    }

    private SyntaxNode parseAndTest() throws ParseException {
        Position start = peek().start();
        SyntaxNode first = parseNotTest();
        if (!atKeyword("and")) return first;
        List<SyntaxNode> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) values.add(parseNotTest());
        return new SyntaxNode.BooleanOp(BooleanOperator.AND, values, start, lastEnd);
    }

    private SyntaxNode parseNotTest() throws ParseException {
        if (atKeyword("not")) {
            Position start = nextToken().start();
            SyntaxNode operand = parseNotTest();
            return new SyntaxNode.UnaryOp("not", operand, start, lastEnd);
        }
        return parseComparison();
    }

    private SyntaxNode parseComparison() throws ParseException {
        Position start = peek().start();
        SyntaxNode left = parseExpr();
        List<ComparisonOperator> operators = new ArrayList<>();
        List<SyntaxNode> comparators = new ArrayList<>();
        ComparisonOperator op;
        while ((op = parseComparisonOperator()) != null) {
            operators.add(op);
            comparators.add(parseExpr());
        }
        if (operators.isEmpty()) return left;
        return new SyntaxNode.Comparison(left, operators, comparators, start, lastEnd);
    }

    private ComparisonOperator parseComparisonOperator() {
        Token t = peek();
        ComparisonOperator op = null;
        if (t.kind() == TokenKind.OP) {
            op = switch (t.text()) {
                case "==" -> ComparisonOperator.EQ;
                case "!=" -> ComparisonOperator.NOT_EQ;
                case "<" -> ComparisonOperator.LT;
                case "<=" -> ComparisonOperator.LT_E;
                case ">" -> ComparisonOperator.GT;
                case ">=" -> ComparisonOperator.GT_E;
                default -> null;
            };
            if (op != null) nextToken();
        } else if (t.isKeyword("in")) {
            nextToken();
            op = ComparisonOperator.IN;
        } else if (t.isKeyword("not") && peek(1).isKeyword("in")) {
            nextToken();
            nextToken();
            op = ComparisonOperator.NOT_IN;
        } else if (t.isKeyword("is")) {
            nextToken();
            op = acceptKeyword("not") ? ComparisonOperator.IS_NOT : ComparisonOperator.IS;
        }
        return op;
    }

    private SyntaxNode parseExpr() throws ParseException {
        return parseBinOpExpression(0);
    }

    private SyntaxNode parseBinOpExpression(int prec) throws ParseException {
        if (prec >= OPERATOR_PRECEDENCE.size()) return parseFactor();
        Position start = peek().start();
        SyntaxNode left = parseBinOpExpression(prec + 1);
        Set<String> operators = OPERATOR_PRECEDENCE.get(prec);
        while (peek().kind() == TokenKind.OP && operators.contains(peek().text())) {
            String operator = nextToken().text();
            SyntaxNode right = parseBinOpExpression(prec + 1);
            left = new SyntaxNode.BinaryOp(left, operator, right, start, lastEnd);
        }
        return left;
    }

    private SyntaxNode parseFactor() throws ParseException {
        if (atOp("+") || atOp("-") || atOp("~")) {
            Token op = nextToken();
            SyntaxNode operand = parseFactor();
            return new SyntaxNode.UnaryOp(op.text(), operand, op.start(), lastEnd);
        }
        return parsePower();
    }

    private SyntaxNode parsePower() throws ParseException {
        if (atKeyword("await")) throw syntaxError("unsupported syntax");
        Position start = peek().start();
        SyntaxNode base = parsePrimaryWithSuffix();
        if (!acceptOp("**")) return base;
        SyntaxNode exponent = parseFactor();
        return new SyntaxNode.BinaryOp(base, "**", exponent, start, lastEnd);
    }

    private SyntaxNode parsePrimaryWithSuffix() throws ParseException {
        Position start = peek().start();
        SyntaxNode e = parsePrimary();
        while (true) {
            if (atOp("(")) {
                e = parseCallSuffix(e, start);
            } else if (atOp("[")) {
                nextToken();
                SyntaxNode index = parseSubscriptList();
                expectOp("]");
                e = new SyntaxNode.Subscript(e, index, start, lastEnd);
            } else if (acceptOp(".")) {
                String attribute = parseIdent();
                e = new SyntaxNode.Attribute(e, attribute, start, lastEnd);
            } else {
                return e;
            }
        }
    }

    private SyntaxNode parseCallSuffix(SyntaxNode function, Position start) throws ParseException {
        Token open = expectOp("(");
        Arguments arguments = parseArguments(open);
        return new SyntaxNode.Call(function, arguments.positional(), arguments.keywords(), start, lastEnd);
    }

    /** Parses call arguments up to and including the closing parenthesis. */
    private Arguments parseArguments(Token open) throws ParseException {
        List<SyntaxNode> positional = new ArrayList<>();
        List<SyntaxNode> keywords = new ArrayList<>();
        List<SyntaxNode> all = new ArrayList<>();
        while (!atOp(")")) {
            Position start = peek().start();
            SyntaxNode argument;
            if (acceptOp("*")) {
                argument = new SyntaxNode.Starred(parseTest(), start, lastEnd);
                positional.add(argument);
            } else if (acceptOp("**")) {
                argument = new SyntaxNode.KeywordArgument(null, parseTest(), start, lastEnd);
                keywords.add(argument);
            } else if (atKind(TokenKind.NAME) && peek(1).isOp("=")) {
                String name = parseIdent();
                expectOp("=");
                argument = new SyntaxNode.KeywordArgument(name, parseTest(), start, lastEnd);
                keywords.add(argument);
            } else {
                SyntaxNode element = parseTest();
                if (atKeyword("for")) {
                    // only legal as the lone argument; spans the call's parentheses
                    List<SyntaxNode> generators = parseComprehensionFor();
                    if (!all.isEmpty() || !atOp(")")) {
                        throw new ParseException("generator expression must be parenthesized", element.start());
                    }
                    Token close = expectOp(")");
                    argument = new SyntaxNode.GeneratorExpression(element, generators, open.start(), close.end());
                    positional.add(argument);
                    all.add(argument);
                    return new Arguments(positional, keywords, all);
                }
                argument = element;
                positional.add(argument);
            }
            all.add(argument);
            if (!acceptOp(",")) break;
        }
        expectOp(")");
        return new Arguments(positional, keywords, all);
    }

    private record Arguments(List<SyntaxNode> positional, List<SyntaxNode> keywords, List<SyntaxNode> all) {}

    private SyntaxNode parseSubscriptList() throws ParseException {
        Position start = peek().start();
        SyntaxNode first = parseSubscript();
        if (!atOp(",")) return first;
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (atOp("]")) break;
            elements.add(parseSubscript());
        }
        return new SyntaxNode.Tuple(elements, false, start, lastEnd);
    }

    private SyntaxNode parseSubscript() throws ParseException {
        Position start = peek().start();
        SyntaxNode lower = null;
        if (!atOp(":")) {
            lower = parseStarOrTest();
            if (!atOp(":")) return lower;
        }
        expectOp(":");
        SyntaxNode upper = atOp(":") || atOp("]") || atOp(",") ? null : parseTest();
        SyntaxNode step = null;
        if (acceptOp(":") && !atOp("]") && !atOp(",")) step = parseTest();
        return new SyntaxNode.Slice(lower, upper, step, start, lastEnd);
    }

    private List<SyntaxNode> parseComprehensionFor() throws ParseException {
        List<SyntaxNode> generators = new ArrayList<>();
        while (atKeyword("for")) {
            Position start = nextToken().start();
            SyntaxNode target = parseExprList();
            expectKeyword("in");
            SyntaxNode iterable = parseOrTest();
            List<SyntaxNode> conditions = new ArrayList<>();
            while (acceptKeyword("if")) conditions.add(parseTestNoCond());
            generators.add(new SyntaxNode.Comprehension(target, iterable, conditions, start, lastEnd));
        }
        if (atKeyword("async")) throw syntaxError("unsupported syntax");
        return generators;
    }

    private SyntaxNode parsePrimary() throws ParseException {
        Token t = peek();
        switch (t.kind()) {
            case NAME -> {
                nextToken();
                return new SyntaxNode.Name(t.text(), t.start(), t.end());
            }
            case NUMBER -> {
                nextToken();
                return new SyntaxNode.Constant(t.text(), t.start(), t.end());
            }
            case STRING -> {
                return parseStringLiteral();
            }
            case KEYWORD -> {
                if (t.text().equals("None") || t.text().equals("True") || t.text().equals("False")) {
                    nextToken();
                    return new SyntaxNode.Constant(t.text(), t.start(), t.end());
                }
                throw syntaxError("invalid syntax");
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> {
                        return parseParenthesized();
                    }
                    case "[" -> {
                        return parseListMaker();
                    }
                    case "{" -> {
                        return parseDictOrSet();
                    }
                    case "..." -> {
                        nextToken();
                        return new SyntaxNode.Constant(t.text(), t.start(), t.end());
                    }
                    default -> throw syntaxError("invalid syntax");
                }
            }
            default -> throw syntaxError("invalid syntax");
        }
    }

    /** Adjacent string tokens concatenate into one literal. */
    private SyntaxNode parseStringLiteral() throws ParseException {
        Position start = peek().start();
        List<String> parts = new ArrayList<>();
        boolean formatted = false;
        while (atKind(TokenKind.STRING)) {
            String text = nextToken().text();
            formatted |= isFormatted(text);
            parts.add(text);
        }
        return formatted
                ? new SyntaxNode.FormattedString(parts, start, lastEnd)
                : new SyntaxNode.StringLiteral(parts, start, lastEnd);
    }

    private static boolean isFormatted(String literal) {
        int quote = 0;
        while (quote < literal.length() && literal.charAt(quote) != '"' && literal.charAt(quote) != '\'') quote++;
        return literal.substring(0, quote).toLowerCase(Locale.ROOT).contains("f");
    }

    /** Grouping, tuple display, parenthesized yield or generator expression. */
    private SyntaxNode parseParenthesized() throws ParseException {
        Token open = expectOp("(");
        if (atOp(")")) {
            Token close = nextToken();
            return new SyntaxNode.Tuple(List.of(), true, open.start(), close.end());
        }
        if (atKeyword("yield")) {
            SyntaxNode yield = parseYield();
            expectOp(")");
            return yield;
        }
        SyntaxNode first = parseStarOrTest();
        if (atKeyword("for")) {
            List<SyntaxNode> generators = parseComprehensionFor();
            Token close = expectOp(")");
            return new SyntaxNode.GeneratorExpression(first, generators, open.start(), close.end());
        }
        if (atOp(",")) {
            List<SyntaxNode> elements = new ArrayList<>();
            elements.add(first);
            while (acceptOp(",")) {
                if (atOp(")")) break;
                elements.add(parseStarOrTest());
            }
            Token close = expectOp(")");
            return new SyntaxNode.Tuple(elements, true, open.start(), close.end());
        }
        if (atOp(":=")) throw syntaxError("unsupported syntax");
        expectOp(")");
        return first;
    }

    private SyntaxNode parseListMaker() throws ParseException {
        Token open = expectOp("[");
        List<SyntaxNode> elements = new ArrayList<>();
        if (!atOp("]")) {
            SyntaxNode first = parseStarOrTest();
            if (atKeyword("for")) {
                List<SyntaxNode> generators = parseComprehensionFor();
                Token close = expectOp("]");
                return new SyntaxNode.ListComprehension(first, generators, open.start(), close.end());
            }
            elements.add(first);
            while (acceptOp(",")) {
                if (atOp("]")) break;
                elements.add(parseStarOrTest());
            }
        }
        Token close = expectOp("]");
        return new SyntaxNode.ListDisplay(elements, open.start(), close.end());
    }

    private SyntaxNode parseDictOrSet() throws ParseException {
        Token open = expectOp("{");
        if (atOp("}")) {
            Token close = nextToken();
            return new SyntaxNode.DictDisplay(List.of(), List.of(), open.start(), close.end());
        }
        if (atOp("**")) return parseDictEntries(open, null);

        SyntaxNode first = parseStarOrTest();
        if (acceptOp(":")) {
            SyntaxNode value = parseTest();
            if (atKeyword("for")) {
                List<SyntaxNode> generators = parseComprehensionFor();
                Token close = expectOp("}");
                return new SyntaxNode.DictComprehension(first, value, generators, open.start(), close.end());
            }
            List<SyntaxNode> keys = new ArrayList<>();
            List<SyntaxNode> values = new ArrayList<>();
            keys.add(first);
            values.add(value);
            return parseDictEntries(open, new DictEntries(keys, values));
        }
        if (atKeyword("for")) {
            List<SyntaxNode> generators = parseComprehensionFor();
            Token close = expectOp("}");
            return new SyntaxNode.SetComprehension(first, generators, open.start(), close.end());
        }
        List<SyntaxNode> elements = new ArrayList<>();
        elements.add(first);
        while (acceptOp(",")) {
            if (atOp("}")) break;
            elements.add(parseStarOrTest());
        }
        Token close = expectOp("}");
        return new SyntaxNode.SetDisplay(elements, open.start(), close.end());
    }

    private record DictEntries(List<SyntaxNode> keys, List<SyntaxNode> values) {}

    /** Remaining {@code key: value} and {@code **mapping} entries of a dict display. */
    private SyntaxNode parseDictEntries(Token open, DictEntries parsed) throws ParseException {
        DictEntries entries = parsed != null ? parsed : new DictEntries(new ArrayList<>(), new ArrayList<>());
        boolean needEntry = parsed == null;
        while (needEntry || acceptOp(",")) {
            needEntry = false;
            if (atOp("}")) break;
            if (acceptOp("**")) {
                entries.keys().add(null);
                entries.values().add(parseExpr());
            } else {
                entries.keys().add(parseTest());
                expectOp(":");
                entries.values().add(parseTest());
            }
        }
        Token close = expectOp("}");
        return new SyntaxNode.DictDisplay(entries.keys(), entries.values(), open.start(), close.end());
    }
}
