/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import io.singletuple4j.core.api.model.Mode;
import io.singletuple4j.core.syntax.NodeKind;
import io.singletuple4j.core.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Walks a tree depth-first and yields the expressions whose wrapping parentheses should be inspected.
 * Each parent decides for its direct children, so no node needs to know its parent.
 */
public final class CandidateCollector {
    private final Mode mode;

    public CandidateCollector(Mode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public List<CandidateSite> collect(SyntaxNode root) {
        Objects.requireNonNull(root, "root");
        List<CandidateSite> out = new ArrayList<>();
        visit(root, out);
        return out;
    }

    private void visit(SyntaxNode node, List<CandidateSite> out) {
        if (node instanceof SyntaxNode.Assign a) {
            offer(a.value(), SiteContext.ASSIGNMENT_VALUE, out);
        } else if (node instanceof SyntaxNode.AnnotatedAssign a) {
            if (a.value() != null) offer(a.value(), SiteContext.ASSIGNMENT_VALUE, out);
        } else if (node instanceof SyntaxNode.Comparison c) {
            // host-built trees may carry an operator-less comparison
            if (!c.operators().isEmpty() && c.operators().get(0).isMembership()) {
                offer(c.left(), SiteContext.MEMBERSHIP_LEFT, out);
            }
            for (int i = 0; i < c.operators().size(); i++) {
                if (c.operators().get(i).isMembership()) {
                    offer(c.comparators().get(i), SiteContext.MEMBERSHIP_RIGHT, out);
                }
            }
        } else if (node instanceof SyntaxNode.Call call) {
            for (SyntaxNode arg : call.args()) {
                if (!sharesCallParentheses(call, arg) && qualifies(arg, SiteContext.CALL_ARGUMENT)) {
                    out.add(CandidateSite.argument(arg, call));
                }
            }
        }
        for (SyntaxNode child : node.children()) {
            visit(child, out);
        }
    }

    /** {@code f(x for x in y)}: the generator's parentheses are the call's own. */
    private static boolean sharesCallParentheses(SyntaxNode.Call call, SyntaxNode arg) {
        return arg.kind() == NodeKind.GENERATOR_EXPRESSION
                && call.args().size() == 1
                && call.keywords().isEmpty()
                && (arg.end() == null || arg.end().equals(call.end()));
    }

    private void offer(SyntaxNode node, SiteContext context, List<CandidateSite> out) {
        if (qualifies(node, context)) out.add(new CandidateSite(node, context));
    }

    boolean qualifies(SyntaxNode node, SiteContext context) {
        if (mode == Mode.STRINGS_ONLY) {
            return node.kind() == NodeKind.STRING_LITERAL || node.kind() == NodeKind.FORMATTED_STRING;
        }
        return switch (context) {
            case ASSIGNMENT_VALUE -> isAssignmentCandidate(node);
            case MEMBERSHIP_LEFT, MEMBERSHIP_RIGHT -> isMembershipCandidate(node.kind());
            case CALL_ARGUMENT -> isCallArgumentCandidate(node.kind());
        };
    }

    private static boolean isAssignmentCandidate(SyntaxNode node) {
        return switch (node.kind()) {
            case STRING_LITERAL, FORMATTED_STRING, CONSTANT, NAME, ATTRIBUTE, SUBSCRIPT, CALL, LAMBDA,
                    GENERATOR_EXPRESSION -> true;
            // catches the redundant nesting in ((1,))
            case TUPLE -> node instanceof SyntaxNode.Tuple t && t.parenthesized();
            case SLICE, KEYWORD_ARGUMENT, STARRED, BINARY_OP, UNARY_OP, BOOLEAN_OP, COMPARISON, CONDITIONAL,
                    COMPREHENSION, LIST_COMPREHENSION, SET_COMPREHENSION, DICT_COMPREHENSION, LIST, SET, DICT,
                    YIELD -> false;
            case MODULE, ASSIGN, ANNOTATED_ASSIGN, AUGMENTED_ASSIGN, EXPRESSION_STATEMENT, IF, WHILE, FOR, WITH,
                    WITH_ITEM, TRY, EXCEPT_HANDLER, FUNCTION_DEF, CLASS_DEF, RETURN, ASSERT, RAISE, DELETE, IMPORT,
                    KEYWORD_STATEMENT -> false;
        };
    }

    private static boolean isMembershipCandidate(NodeKind kind) {
        return switch (kind) {
            case CONDITIONAL, BOOLEAN_OP -> false;
            case STRING_LITERAL, FORMATTED_STRING, CONSTANT, NAME, ATTRIBUTE, SUBSCRIPT, SLICE, CALL,
                    KEYWORD_ARGUMENT, STARRED, BINARY_OP, UNARY_OP, COMPARISON, LAMBDA, GENERATOR_EXPRESSION,
                    COMPREHENSION, LIST_COMPREHENSION, SET_COMPREHENSION, DICT_COMPREHENSION, TUPLE, LIST, SET,
                    DICT, YIELD -> true;
            case MODULE, ASSIGN, ANNOTATED_ASSIGN, AUGMENTED_ASSIGN, EXPRESSION_STATEMENT, IF, WHILE, FOR, WITH,
                    WITH_ITEM, TRY, EXCEPT_HANDLER, FUNCTION_DEF, CLASS_DEF, RETURN, ASSERT, RAISE, DELETE, IMPORT,
                    KEYWORD_STATEMENT -> false;
        };
    }

    private static boolean isCallArgumentCandidate(NodeKind kind) {
        return switch (kind) {
            // grouped arithmetic inside a call is ordinary grouping
            case CONDITIONAL, BINARY_OP -> false;
            case STRING_LITERAL, FORMATTED_STRING, CONSTANT, NAME, ATTRIBUTE, SUBSCRIPT, SLICE, CALL,
                    KEYWORD_ARGUMENT, STARRED, UNARY_OP, BOOLEAN_OP, COMPARISON, LAMBDA, GENERATOR_EXPRESSION,
                    COMPREHENSION, LIST_COMPREHENSION, SET_COMPREHENSION, DICT_COMPREHENSION, TUPLE, LIST, SET,
                    DICT, YIELD -> true;
            case MODULE, ASSIGN, ANNOTATED_ASSIGN, AUGMENTED_ASSIGN, EXPRESSION_STATEMENT, IF, WHILE, FOR, WITH,
                    WITH_ITEM, TRY, EXCEPT_HANDLER, FUNCTION_DEF, CLASS_DEF, RETURN, ASSERT, RAISE, DELETE, IMPORT,
                    KEYWORD_STATEMENT -> false;
        };
    }
}
