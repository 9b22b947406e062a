/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import static org.junit.jupiter.api.Assertions.*;

import io.singletuple4j.core.api.model.Mode;
import io.singletuple4j.core.parse.SourceParser;
import io.singletuple4j.core.syntax.NodeKind;
import io.singletuple4j.core.syntax.SyntaxNode;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class CandidateCollectorTest {

    private static List<CandidateSite> collect(String source, Mode mode) throws Exception {
        return new CandidateCollector(mode).collect(SourceParser.parse(source));
    }

    private static List<CandidateSite> collect(String source) throws Exception {
        return collect(source, Mode.BROAD);
    }

    private static List<SiteContext> contexts(List<CandidateSite> sites) {
        return sites.stream().map(CandidateSite::context).collect(Collectors.toList());
    }

    @Test
    void testAssignmentValue() throws Exception {
        List<CandidateSite> sites = collect("x = a");
        assertEquals(1, sites.size());
        assertEquals(SiteContext.ASSIGNMENT_VALUE, sites.get(0).context());
        assertEquals(NodeKind.NAME, sites.get(0).node().kind());
    }

    @Test
    void testAssignmentExclusions() throws Exception {
        assertTrue(collect("x = a + b").isEmpty());
        assertTrue(collect("x = a if b else c").isEmpty());
        assertTrue(collect("x = not a").isEmpty());
        assertTrue(collect("x = [a]").isEmpty());
        assertTrue(collect("x = 1, 2").isEmpty());
        assertEquals(1, collect("x = (1, 2)").size());
        assertTrue(collect("x += (a)").isEmpty());
    }

    @Test
    void testMembershipOperands() throws Exception {
        List<CandidateSite> sites = collect("if a in b not in c: pass");
        assertEquals(
                List.of(SiteContext.MEMBERSHIP_LEFT, SiteContext.MEMBERSHIP_RIGHT, SiteContext.MEMBERSHIP_RIGHT),
                contexts(sites));
        assertTrue(sites.get(0).context().isMembership());
    }

    @Test
    void testMembershipOnlyForMembershipOperators() throws Exception {
        List<CandidateSite> sites = collect("a == b in c");
        assertEquals(1, sites.size());
        assertEquals(SiteContext.MEMBERSHIP_RIGHT, sites.get(0).context());
        assertEquals("c", ((SyntaxNode.Name) sites.get(0).node()).id());
        assertTrue(collect("a == b").isEmpty());
    }

    @Test
    void testMembershipExclusions() throws Exception {
        assertTrue(collect("x in (a or b)").stream().allMatch(s -> s.context() == SiteContext.MEMBERSHIP_LEFT));
        assertEquals(1, collect("x in (a or b)").size());
        assertEquals(1, collect("x in (a if b else c)").size());
        assertEquals(2, collect("x in (a + b)").size());
    }

    @Test
    void testCallArguments() throws Exception {
        List<CandidateSite> sites = collect("f(a, (b), *c, k=d)");
        assertEquals(3, sites.size());
        assertTrue(sites.stream().allMatch(s -> s.context() == SiteContext.CALL_ARGUMENT));
        assertEquals(NodeKind.STARRED, sites.get(2).node().kind());
        assertTrue(sites.stream().allMatch(s -> s.call() != null && s.call().args().size() == 3));
        assertFalse(sites.get(0).loneArgument());
        assertTrue(collect("f((a))").get(0).loneArgument());
        assertNull(collect("x = a").get(0).call());
    }

    @Test
    void testComparisonWithoutOperators() {
        SyntaxNode left = new SyntaxNode.Name("x", null, null);
        SyntaxNode comparison = new SyntaxNode.Comparison(left, List.of(), List.of(), null, null);
        assertTrue(new CandidateCollector(Mode.BROAD).collect(comparison).isEmpty());
    }

    @Test
    void testCallArgumentExclusions() throws Exception {
        assertTrue(collect("f(x for x in y)").isEmpty());
        assertTrue(collect("f((a + b))").isEmpty());
        assertTrue(collect("f(a if b else c)").isEmpty());

        List<CandidateSite> sites = collect("f((x for x in y))");
        assertEquals(1, sites.size());
        assertEquals(NodeKind.GENERATOR_EXPRESSION, sites.get(0).node().kind());
    }

    @Test
    void testParentBeforeChildren() throws Exception {
        List<CandidateSite> sites = collect("x = f(a)");
        assertEquals(List.of(SiteContext.ASSIGNMENT_VALUE, SiteContext.CALL_ARGUMENT), contexts(sites));
    }

    @Test
    void testStringsOnly() throws Exception {
        List<CandidateSite> sites = collect("x = a\ny = \"s\"\nf(b, f\"t\")\nb in ('c')", Mode.STRINGS_ONLY);
        assertEquals(3, sites.size());
        assertEquals(NodeKind.STRING_LITERAL, sites.get(0).node().kind());
        assertEquals(NodeKind.FORMATTED_STRING, sites.get(1).node().kind());
        assertEquals(SiteContext.MEMBERSHIP_RIGHT, sites.get(2).context());
    }

    @Test
    void testStatementsAreVisited() throws Exception {
        String source = "class A:\n    def f(self):\n        for i in y:\n            if i:\n                z = i\n";
        assertEquals(1, collect(source).size());
    }
}
