/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

/** Closed set of syntax node kinds. Switches over it are written without a default branch. */
public enum NodeKind {
    // statements
    MODULE,
    ASSIGN,
    ANNOTATED_ASSIGN,
    AUGMENTED_ASSIGN,
    EXPRESSION_STATEMENT,
    IF,
    WHILE,
    FOR,
    WITH,
    WITH_ITEM,
    TRY,
    EXCEPT_HANDLER,
    FUNCTION_DEF,
    CLASS_DEF,
    RETURN,
    ASSERT,
    RAISE,
    DELETE,
    IMPORT,
    KEYWORD_STATEMENT, // pass, break, continue, global, nonlocal

    // expressions
    STRING_LITERAL,
    FORMATTED_STRING,
    CONSTANT, // numbers, None, True, False, Ellipsis
    NAME,
    ATTRIBUTE,
    SUBSCRIPT,
    SLICE,
    CALL,
    KEYWORD_ARGUMENT,
    STARRED,
    BINARY_OP,
    UNARY_OP,
    BOOLEAN_OP,
    COMPARISON,
    CONDITIONAL,
    LAMBDA,
    GENERATOR_EXPRESSION,
    COMPREHENSION, // one "for ... in ... if ..." clause
    LIST_COMPREHENSION,
    SET_COMPREHENSION,
    DICT_COMPREHENSION,
    TUPLE,
    LIST,
    SET,
    DICT,
    YIELD
}
