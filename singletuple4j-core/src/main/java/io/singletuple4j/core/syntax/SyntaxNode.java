/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A node of a parsed Python source unit.
 *
 * <p>Every node reports its {@link NodeKind}, its source span and its direct children. Spans follow the
 * conventions of Python's {@code ast} module: {@code start} is the first character of the node, {@code end}
 * is exclusive, grouping parentheses are not part of the wrapped expression, while parenthesized tuples and
 * generator expressions include their own parentheses. Nodes never point back to their parent.
 *
 * <p>Positions may be {@code null} on trees produced by hosts that lack location data; such nodes are never
 * reported.
 */
public sealed interface SyntaxNode {

    NodeKind kind();

    Position start();

    Position end();

    /** Direct children in source order; never {@code null}. */
    List<SyntaxNode> children();

    // ---------------- statements ----------------

    record Module(List<SyntaxNode> body, Position start, Position end) implements SyntaxNode {
        public Module {
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MODULE;
        }

        @Override
        public List<SyntaxNode> children() {
            return body;
        }
    }

    /** {@code a = b = value}. */
    record Assign(List<SyntaxNode> targets, SyntaxNode value, Position start, Position end) implements SyntaxNode {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGN;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(targets, value);
        }
    }

    /** {@code target: annotation [= value]}; {@code value} is nullable. */
    record AnnotatedAssign(SyntaxNode target, SyntaxNode annotation, SyntaxNode value, Position start, Position end)
            implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.ANNOTATED_ASSIGN;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(target, annotation, value);
        }
    }

    record AugmentedAssign(SyntaxNode target, String operator, SyntaxNode value, Position start, Position end)
            implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.AUGMENTED_ASSIGN;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(target, value);
        }
    }

    record ExpressionStatement(SyntaxNode value, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.EXPRESSION_STATEMENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    /** {@code elif} chains are nested {@code If} nodes in {@code orElse}. */
    record If(SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orElse, Position start, Position end)
            implements SyntaxNode {
        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(test, body, orElse);
        }
    }

    record While(SyntaxNode test, List<SyntaxNode> body, List<SyntaxNode> orElse, Position start, Position end)
            implements SyntaxNode {
        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WHILE;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(test, body, orElse);
        }
    }

    record For(
            SyntaxNode target,
            SyntaxNode iterable,
            List<SyntaxNode> body,
            List<SyntaxNode> orElse,
            Position start,
            Position end)
            implements SyntaxNode {
        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOR;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(target, iterable, body, orElse);
        }
    }

    record With(List<SyntaxNode> items, List<SyntaxNode> body, Position start, Position end) implements SyntaxNode {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WITH;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(items, body);
        }
    }

    /** {@code context [as target]}; {@code target} is nullable. */
    record WithItem(SyntaxNode context, SyntaxNode target, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.WITH_ITEM;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(context, target);
        }
    }

    record Try(
            List<SyntaxNode> body,
            List<SyntaxNode> handlers,
            List<SyntaxNode> orElse,
            List<SyntaxNode> finalBody,
            Position start,
            Position end)
            implements SyntaxNode {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TRY;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(body, handlers, orElse, finalBody);
        }
    }

    /** {@code except [type [as name]]:}; {@code type} and {@code name} are nullable. */
    record ExceptHandler(SyntaxNode type, String name, List<SyntaxNode> body, Position start, Position end)
            implements SyntaxNode {
        public ExceptHandler {
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXCEPT_HANDLER;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(type, body);
        }
    }

    /**
     * {@code def}. Only parameter names are kept; defaults and annotations are children because they are
     * evaluated expressions. {@code returns} is nullable.
     */
    record FunctionDef(
            String name,
            List<SyntaxNode> decorators,
            List<String> parameters,
            List<SyntaxNode> defaults,
            List<SyntaxNode> annotations,
            SyntaxNode returns,
            List<SyntaxNode> body,
            Position start,
            Position end)
            implements SyntaxNode {
        public FunctionDef {
            decorators = List.copyOf(decorators);
            parameters = List.copyOf(parameters);
            defaults = List.copyOf(defaults);
            annotations = List.copyOf(annotations);
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_DEF;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(decorators, defaults, annotations, returns, body);
        }
    }

    /** {@code class}; {@code bases} holds positional bases and keyword arguments in source order. */
    record ClassDef(
            String name,
            List<SyntaxNode> decorators,
            List<SyntaxNode> bases,
            List<SyntaxNode> body,
            Position start,
            Position end)
            implements SyntaxNode {
        public ClassDef {
            decorators = List.copyOf(decorators);
            bases = List.copyOf(bases);
            body = List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CLASS_DEF;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(decorators, bases, body);
        }
    }

    record Return(SyntaxNode value, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.RETURN;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    record Assert(SyntaxNode test, SyntaxNode message, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.ASSERT;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(test, message);
        }
    }

    record Raise(SyntaxNode exception, SyntaxNode cause, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.RAISE;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(exception, cause);
        }
    }

    record Delete(List<SyntaxNode> targets, Position start, Position end) implements SyntaxNode {
        public Delete {
            targets = List.copyOf(targets);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DELETE;
        }

        @Override
        public List<SyntaxNode> children() {
            return targets;
        }
    }

    /** {@code import a.b as c} and {@code from m import x}; names are kept as written. */
    record Import(String module, List<String> names, Position start, Position end) implements SyntaxNode {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    /** {@code pass}, {@code break}, {@code continue}, {@code global ...}, {@code nonlocal ...}. */
    record KeywordStatement(String keyword, List<String> names, Position start, Position end) implements SyntaxNode {
        public KeywordStatement {
            names = List.copyOf(names);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.KEYWORD_STATEMENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    // ---------------- expressions ----------------

    /** One or more adjacent plain string tokens; {@code parts} keeps their source text. */
    record StringLiteral(List<String> parts, Position start, Position end) implements SyntaxNode {
        public StringLiteral {
            parts = List.copyOf(parts);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING_LITERAL;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    /** Adjacent string tokens of which at least one is an f-string. */
    record FormattedString(List<String> parts, Position start, Position end) implements SyntaxNode {
        public FormattedString {
            parts = List.copyOf(parts);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FORMATTED_STRING;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    /** Numbers, {@code None}, {@code True}, {@code False} and {@code ...}. */
    record Constant(String text, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.CONSTANT;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    record Name(String id, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.NAME;
        }

        @Override
        public List<SyntaxNode> children() {
            return List.of();
        }
    }

    record Attribute(SyntaxNode value, String attribute, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.ATTRIBUTE;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    record Subscript(SyntaxNode value, SyntaxNode index, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.SUBSCRIPT;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value, index);
        }
    }

    /** {@code lower:upper:step}; every part is nullable. */
    record Slice(SyntaxNode lower, SyntaxNode upper, SyntaxNode step, Position start, Position end)
            implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.SLICE;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(lower, upper, step);
        }
    }

    /** {@code args} are the positional arguments (including {@code *x}); {@code keywords} the rest. */
    record Call(SyntaxNode function, List<SyntaxNode> args, List<SyntaxNode> keywords, Position start, Position end)
            implements SyntaxNode {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(function, args, keywords);
        }
    }

    /** {@code name=value}, or {@code **value} when {@code name} is {@code null}. */
    record KeywordArgument(String name, SyntaxNode value, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.KEYWORD_ARGUMENT;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    record Starred(SyntaxNode value, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.STARRED;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    record BinaryOp(SyntaxNode left, String operator, SyntaxNode right, Position start, Position end)
            implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_OP;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(left, right);
        }
    }

    /** {@code not x}, {@code -x}, {@code +x}, {@code ~x}. */
    record UnaryOp(String operator, SyntaxNode operand, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_OP;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(operand);
        }
    }

    record BooleanOp(BooleanOperator operator, List<SyntaxNode> values, Position start, Position end)
            implements SyntaxNode {
        public BooleanOp {
            values = List.copyOf(values);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN_OP;
        }

        @Override
        public List<SyntaxNode> children() {
            return values;
        }
    }

    /** {@code left op1 c1 op2 c2 ...}; {@code operators} and {@code comparators} have the same size. */
    record Comparison(
            SyntaxNode left,
            List<ComparisonOperator> operators,
            List<SyntaxNode> comparators,
            Position start,
            Position end)
            implements SyntaxNode {
        public Comparison {
            operators = List.copyOf(operators);
            comparators = List.copyOf(comparators);
            if (operators.size() != comparators.size()) {
                throw new IllegalArgumentException("operators and comparators differ in size");
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPARISON;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(left, comparators);
        }
    }

    /** {@code body if test else orElse}. */
    record Conditional(SyntaxNode body, SyntaxNode test, SyntaxNode orElse, Position start, Position end)
            implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.CONDITIONAL;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(body, test, orElse);
        }
    }

    record Lambda(List<String> parameters, List<SyntaxNode> defaults, SyntaxNode body, Position start, Position end)
            implements SyntaxNode {
        public Lambda {
            parameters = List.copyOf(parameters);
            defaults = List.copyOf(defaults);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LAMBDA;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(defaults, body);
        }
    }

    record GeneratorExpression(SyntaxNode element, List<SyntaxNode> generators, Position start, Position end)
            implements SyntaxNode {
        public GeneratorExpression {
            generators = List.copyOf(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GENERATOR_EXPRESSION;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(element, generators);
        }
    }

    /** {@code for target in iterable if cond ...}. */
    record Comprehension(SyntaxNode target, SyntaxNode iterable, List<SyntaxNode> conditions, Position start, Position end)
            implements SyntaxNode {
        public Comprehension {
            conditions = List.copyOf(conditions);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPREHENSION;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(target, iterable, conditions);
        }
    }

    record ListComprehension(SyntaxNode element, List<SyntaxNode> generators, Position start, Position end)
            implements SyntaxNode {
        public ListComprehension {
            generators = List.copyOf(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST_COMPREHENSION;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(element, generators);
        }
    }

    record SetComprehension(SyntaxNode element, List<SyntaxNode> generators, Position start, Position end)
            implements SyntaxNode {
        public SetComprehension {
            generators = List.copyOf(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET_COMPREHENSION;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(element, generators);
        }
    }

    record DictComprehension(
            SyntaxNode key, SyntaxNode value, List<SyntaxNode> generators, Position start, Position end)
            implements SyntaxNode {
        public DictComprehension {
            generators = List.copyOf(generators);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DICT_COMPREHENSION;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(key, value, generators);
        }
    }

    /** A tuple display; when {@code parenthesized} the span includes the parentheses. */
    record Tuple(List<SyntaxNode> elements, boolean parenthesized, Position start, Position end)
            implements SyntaxNode {
        public Tuple {
            elements = List.copyOf(elements);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TUPLE;
        }

        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    record ListDisplay(List<SyntaxNode> elements, Position start, Position end) implements SyntaxNode {
        public ListDisplay {
            elements = List.copyOf(elements);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LIST;
        }

        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    record SetDisplay(List<SyntaxNode> elements, Position start, Position end) implements SyntaxNode {
        public SetDisplay {
            elements = List.copyOf(elements);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET;
        }

        @Override
        public List<SyntaxNode> children() {
            return elements;
        }
    }

    /** A dict display; a {@code null} key marks a {@code **mapping} entry. */
    record DictDisplay(List<SyntaxNode> keys, List<SyntaxNode> values, Position start, Position end)
            implements SyntaxNode {
        public DictDisplay {
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DICT;
        }

        @Override
        public List<SyntaxNode> children() {
            List<SyntaxNode> out = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                if (keys.get(i) != null) out.add(keys.get(i));
                out.add(values.get(i));
            }
            return List.copyOf(out);
        }
    }

    /** {@code yield [value]} or {@code yield from value}; {@code value} is nullable. */
    record Yield(SyntaxNode value, boolean from, Position start, Position end) implements SyntaxNode {
        @Override
        public NodeKind kind() {
            return NodeKind.YIELD;
        }

        @Override
        public List<SyntaxNode> children() {
            return childrenOf(value);
        }
    }

    /** Flattens nodes and node collections into one list, dropping {@code null}s. */
    private static List<SyntaxNode> childrenOf(Object... parts) {
        List<SyntaxNode> out = new ArrayList<>();
        for (Object p : parts) {
            if (p instanceof SyntaxNode n) {
                out.add(n);
            } else if (p instanceof Collection<?> c) {
                for (Object o : c) {
                    if (o instanceof SyntaxNode n) out.add(n);
                }
            }
        }
        return List.copyOf(out);
    }
}
