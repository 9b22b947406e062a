/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

/** A point in a source unit: 1-based line, 0-based column. */
public record Position(int line, int column) implements Comparable<Position> {

    public static Position of(int line, int column) {
        return new Position(line, column);
    }

    @Override
    public int compareTo(Position other) {
        int c = Integer.compare(line, other.line);
        return c != 0 ? c : Integer.compare(column, other.column);
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
