/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import io.singletuple4j.core.syntax.Token;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/** Finds the parenthesis pair that immediately wraps a token range. */
public final class ParenMatcher {
    private final TokenIndex index;

    public ParenMatcher(TokenIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * @param startIdx first token of the candidate
     * @param endIdx last token of the candidate
     */
    public Optional<MatchedSpan> match(int startIdx, int endIdx) {
        OptionalInt open = openingBefore(startIdx);
        if (open.isEmpty()) return Optional.empty();
        OptionalInt close = closingFor(open.getAsInt());
        if (close.isEmpty() || close.getAsInt() <= endIdx) return Optional.empty();
        return Optional.of(new MatchedSpan(open.getAsInt(), close.getAsInt(), OptionalInt.empty()));
    }

    /**
     * Matches a call argument against the call's own argument list. The wrapping pair must be a
     * distinct pair nested inside the call's parentheses, wherever the argument sits among the
     * others. A lone argument that starts and ends with its own parentheses (a generator
     * expression or a tuple display) is matched on those.
     *
     * @param callClose index of the call's closing parenthesis
     * @param loneArgument whether the candidate is the call's only argument
     */
    public Optional<MatchedSpan> matchArgument(int startIdx, int endIdx, int callClose, boolean loneArgument) {
        if (callClose < 0 || callClose >= index.size() || !index.get(callClose).isOp(")")) return Optional.empty();
        OptionalInt callOpen = openingFor(callClose);
        if (callOpen.isEmpty()) return Optional.empty();
        OptionalInt open = openingBefore(startIdx);
        if (open.isEmpty() || open.getAsInt() < callOpen.getAsInt()) return Optional.empty();

        if (open.getAsInt() == callOpen.getAsInt()) {
            if (!loneArgument || !index.get(startIdx).isOp("(")) return Optional.empty();
            OptionalInt own = closingFor(startIdx);
            if (own.isEmpty() || own.getAsInt() != endIdx) return Optional.empty();
            return Optional.of(new MatchedSpan(startIdx, endIdx, callOpen));
        }

        OptionalInt close = closingFor(open.getAsInt());
        if (close.isEmpty() || close.getAsInt() <= endIdx || close.getAsInt() >= callClose) {
            return Optional.empty();
        }
        return Optional.of(new MatchedSpan(open.getAsInt(), close.getAsInt(), callOpen));
    }

    /** The nearest non-trivia token before {@code idx}, if it is an opening parenthesis. */
    private OptionalInt openingBefore(int idx) {
        int i = idx - 1;
        while (i >= 0 && index.get(i).kind().isTrivia()) i--;
        return i >= 0 && index.get(i).isOp("(") ? OptionalInt.of(i) : OptionalInt.empty();
    }

    private OptionalInt closingFor(int open) {
        int depth = 0;
        for (int i = open; i < index.size(); i++) {
            Token t = index.get(i);
            if (t.isOp("(")) {
                depth++;
            } else if (t.isOp(")")) {
                depth--;
                if (depth == 0) return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    private OptionalInt openingFor(int close) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            Token t = index.get(i);
            if (t.isOp(")")) {
                depth++;
            } else if (t.isOp("(")) {
                depth--;
                if (depth == 0) return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
