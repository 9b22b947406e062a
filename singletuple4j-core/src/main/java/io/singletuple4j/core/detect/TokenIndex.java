/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.Token;
import java.util.List;
import java.util.OptionalInt;

/**
 * Position lookup over a token stream. Start positions are packed into one sorted {@code long[]}
 * built once; both lookups are binary searches.
 *
 * <p>Zero-width markers ({@code DEDENT}, {@code END_MARKER}) may share a start with the token after
 * them; {@link #findExact} resolves such ties to the last token at that start.
 */
public final class TokenIndex {
    private final List<Token> tokens;
    private final long[] starts;

    public TokenIndex(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.starts = new long[this.tokens.size()];
        for (int i = 0; i < starts.length; i++) {
            starts[i] = key(this.tokens.get(i).start());
        }
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /** Index of the token starting exactly at {@code position}. */
    public OptionalInt findExact(Position position) {
        long k = key(position);
        int i = upperBound(k) - 1;
        return i >= 0 && starts[i] == k ? OptionalInt.of(i) : OptionalInt.empty();
    }

    /** Index of the first token whose start is at or after {@code position}. */
    public OptionalInt findAtOrAfter(Position position) {
        int i = lowerBound(key(position));
        return i < starts.length ? OptionalInt.of(i) : OptionalInt.empty();
    }

    private int lowerBound(long k) {
        int lo = 0, hi = starts.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] < k) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private int upperBound(long k) {
        int lo = 0, hi = starts.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (starts[mid] <= k) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private static long key(Position p) {
        return ((long) p.line() << 32) | (p.column() & 0xffffffffL);
    }
}
