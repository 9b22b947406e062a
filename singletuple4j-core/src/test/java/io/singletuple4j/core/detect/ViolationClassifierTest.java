/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import static org.junit.jupiter.api.Assertions.*;

import io.singletuple4j.core.api.model.Rule;
import io.singletuple4j.core.api.model.Violation;
import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.SyntaxNode;
import io.singletuple4j.core.tokenize.PythonTokenizer;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ViolationClassifierTest {

    private static final SyntaxNode NAME = new SyntaxNode.Name("a", null, null);
    private static final SyntaxNode BINARY = new SyntaxNode.BinaryOp(NAME, "+", NAME, null, null);
    private static final SyntaxNode LAMBDA = new SyntaxNode.Lambda(List.of(), List.of(), NAME, null, null);

    /** Classifies the pair spanning token {@code open} to {@code close}. */
    private static Optional<Violation> classify(
            String source, int open, int close, SyntaxNode node, SiteContext context) throws Exception {
        TokenIndex index = new TokenIndex(PythonTokenizer.tokenize(source));
        ViolationClassifier classifier = new ViolationClassifier(index, Rule.stc001());
        return classifier.classify(new CandidateSite(node, context), new MatchedSpan(open, close, OptionalInt.empty()));
    }

    @Test
    void testViolationAtOpeningParenthesis() throws Exception {
        Optional<Violation> v = classify("x = (\"a\")", 2, 4, NAME, SiteContext.ASSIGNMENT_VALUE);
        assertTrue(v.isPresent());
        assertEquals(1, v.get().line());
        assertEquals(4, v.get().column());
        assertEquals("STC001", v.get().ruleId());
        assertEquals(Rule.STC001_MESSAGE, v.get().message());
    }

    @Test
    void testTopLevelCommaIsTuple() throws Exception {
        // x = ( a , b )
        assertTrue(classify("x = (a, b)", 2, 6, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
        assertTrue(classify("x = (a,)", 2, 5, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
    }

    @Test
    void testNestedCommaDoesNotCount() throws Exception {
        // x = ( f ( a , b ) )
        assertTrue(classify("x = (f(a, b))", 2, 9, NAME, SiteContext.ASSIGNMENT_VALUE).isPresent());
    }

    @Test
    void testImplicitStringJoin() throws Exception {
        // x = ( "a" "b" )
        assertTrue(classify("x = (\"a\" \"b\")", 2, 5, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
        assertTrue(classify("x = (\"a\" \"b\")", 2, 5, NAME, SiteContext.MEMBERSHIP_RIGHT).isEmpty());
        assertTrue(classify("x = (\"a\" \"b\")", 2, 5, NAME, SiteContext.CALL_ARGUMENT).isPresent());
    }

    @Test
    void testOperatorMeansGrouping() throws Exception {
        // x = ( a + b )
        assertTrue(classify("x = (a + b)", 2, 6, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
        assertTrue(classify("x = (a + b)", 2, 6, BINARY, SiteContext.MEMBERSHIP_RIGHT).isPresent());
    }

    @Test
    void testKeywordOperators() throws Exception {
        // x = ( not a )
        assertTrue(classify("x = (not a)", 2, 5, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
        // x = ( a is b )
        assertTrue(classify("x = (a is b)", 2, 6, NAME, SiteContext.CALL_ARGUMENT).isEmpty());
    }

    @Test
    void testLambdaBodyOperatorsIgnored() throws Exception {
        // x = ( lambda : a or b )
        assertTrue(classify("x = (lambda: a or b)", 2, 8, LAMBDA, SiteContext.ASSIGNMENT_VALUE).isPresent());
        assertTrue(classify("x = (lambda: a or b)", 2, 8, NAME, SiteContext.ASSIGNMENT_VALUE).isEmpty());
    }

    @Test
    void testNestedOperatorDoesNotCount() throws Exception {
        // x = ( f ( a + b ) )
        assertTrue(classify("x = (f(a + b))", 2, 9, NAME, SiteContext.ASSIGNMENT_VALUE).isPresent());
        // x = ( d [ a - 1 ] )
        assertTrue(classify("x = (d[a - 1])", 2, 9, NAME, SiteContext.ASSIGNMENT_VALUE).isPresent());
    }

    @Test
    void testCustomRule() throws Exception {
        Rule rule = new Rule("X100", "X100 custom", "custom", "0.1");
        TokenIndex index = new TokenIndex(PythonTokenizer.tokenize("y = (b)"));
        Optional<Violation> v = new ViolationClassifier(index, rule)
                .classify(new CandidateSite(NAME, SiteContext.ASSIGNMENT_VALUE), new MatchedSpan(2, 4, OptionalInt.empty()));
        assertEquals(Optional.of(new Violation(1, 4, "X100", "X100 custom")), v);
    }

    @Test
    void testLoneGeneratorOwnParentheses() throws Exception {
        // f ( ( x for x in y ) )
        // 0 1 2 3  4  5  6 7 8 9
        SyntaxNode generator =
                new SyntaxNode.GeneratorExpression(NAME, List.of(), Position.of(1, 2), Position.of(1, 16));
        TokenIndex index = new TokenIndex(PythonTokenizer.tokenize("f((x for x in y))"));
        ViolationClassifier classifier = new ViolationClassifier(index, Rule.stc001());
        CandidateSite site = new CandidateSite(generator, SiteContext.CALL_ARGUMENT);

        Optional<Violation> v = classifier.classify(site, new MatchedSpan(2, 8, OptionalInt.of(1)));
        assertTrue(v.isPresent());
        assertEquals(2, v.get().column());
        // the same pair outside a call is the generator's required syntax
        assertTrue(classifier.classify(site, new MatchedSpan(2, 8, OptionalInt.empty())).isEmpty());
    }
}
