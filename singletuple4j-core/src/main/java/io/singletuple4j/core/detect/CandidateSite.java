/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import io.singletuple4j.core.syntax.SyntaxNode;

/**
 * A node that may be wrapped in a redundant parenthesis pair, with the context it was found in.
 * {@code call} is the enclosing call for {@link SiteContext#CALL_ARGUMENT} sites and {@code null}
 * otherwise.
 */
public record CandidateSite(SyntaxNode node, SiteContext context, SyntaxNode.Call call) {

    public CandidateSite(SyntaxNode node, SiteContext context) {
        this(node, context, null);
    }

    static CandidateSite argument(SyntaxNode node, SyntaxNode.Call call) {
        return new CandidateSite(node, SiteContext.CALL_ARGUMENT, call);
    }

    /** Whether the node is the call's only argument, so the call's parentheses are its own. */
    public boolean loneArgument() {
        return call != null && call.args().size() == 1 && call.keywords().isEmpty();
    }
}
