/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import io.singletuple4j.core.api.model.Rule;
import io.singletuple4j.core.api.model.Violation;
import io.singletuple4j.core.syntax.NodeKind;
import io.singletuple4j.core.syntax.SyntaxNode;
import io.singletuple4j.core.syntax.Token;
import io.singletuple4j.core.syntax.TokenKind;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a matched pair is a one-element tuple missing its comma or just grouping.
 *
 * <p>Only tokens strictly inside the pair and at bracket depth zero are considered. A pair is not
 * reported when it holds a comma, when it joins several adjacent string literals (outside call
 * arguments), or when it groups an operator expression (unless the candidate itself is a binary
 * operation or a lambda).
 */
public final class ViolationClassifier {

    static final Set<String> KEYWORD_OPERATORS = Set.of("and", "or", "not", "in", "is", "if", "else", "for", "lambda");

    static final Set<String> SYMBOLIC_OPERATORS = Set.of(
            "+", "-", "*", "/", "//", "%", "**", "@", "&", "|", "^", "~", "<<", ">>", "<", ">", "<=", ">=", "==",
            "!=", "->");

    private final TokenIndex index;
    private final Rule rule;

    public ViolationClassifier(TokenIndex index, Rule rule) {
        this.index = Objects.requireNonNull(index, "index");
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public Optional<Violation> classify(CandidateSite site, MatchedSpan span) {
        if (isOwnGeneratorPair(site, span)) {
            // f((x for x in y)): the call's parentheses would do
            return Optional.of(violationAt(span));
        }
        boolean checkStrings = site.context() != SiteContext.CALL_ARGUMENT;
        NodeKind kind = site.node().kind();
        boolean checkOperators = kind != NodeKind.BINARY_OP && kind != NodeKind.LAMBDA;

        int depth = 0;
        int strings = 0;
        for (int i = span.open() + 1; i < span.close(); i++) {
            Token t = index.get(i);
            if (t.isOpeningBracket()) {
                depth++;
                continue;
            }
            if (t.isClosingBracket()) {
                depth--;
                continue;
            }
            if (depth != 0) continue;

            if (t.isOp(",")) return Optional.empty();
            if (t.kind() == TokenKind.STRING) strings++;
            if (checkOperators && isOperator(t)) return Optional.empty();
        }
        if (checkStrings && strings > 1) return Optional.empty();

        return Optional.of(violationAt(span));
    }

    private boolean isOwnGeneratorPair(CandidateSite site, MatchedSpan span) {
        SyntaxNode node = site.node();
        return node.kind() == NodeKind.GENERATOR_EXPRESSION
                && span.outerOpen().isPresent()
                && index.get(span.open()).start().equals(node.start());
    }

    private Violation violationAt(MatchedSpan span) {
        Token open = index.get(span.open());
        return new Violation(open.start().line(), open.start().column(), rule.code(), rule.message());
    }

    private static boolean isOperator(Token t) {
        return switch (t.kind()) {
            case KEYWORD -> KEYWORD_OPERATORS.contains(t.text());
            case OP -> SYMBOLIC_OPERATORS.contains(t.text());
            default -> false;
        };
    }
}
