/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.api;

import io.singletuple4j.core.api.model.Diagnostic;
import io.singletuple4j.core.api.model.Mode;
import io.singletuple4j.core.api.model.Rule;
import io.singletuple4j.core.api.model.Violation;
import io.singletuple4j.core.detect.CandidateCollector;
import io.singletuple4j.core.detect.CandidateSite;
import io.singletuple4j.core.detect.MatchedSpan;
import io.singletuple4j.core.detect.ParenMatcher;
import io.singletuple4j.core.detect.SiteContext;
import io.singletuple4j.core.detect.TokenIndex;
import io.singletuple4j.core.detect.ViolationClassifier;
import io.singletuple4j.core.report.NoopReporter;
import io.singletuple4j.core.report.Reporter;
import io.singletuple4j.core.report.ViolationReporter;
import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.SyntaxNode;
import io.singletuple4j.core.tokenize.PythonTokenizer;
import io.singletuple4j.core.tokenize.TokenizeException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds parenthesized single expressions that were probably meant as one-element tuples.
 *
 * <p>Input is a parsed source unit plus its raw lines; the lines are re-tokenized to see the
 * parentheses the tree does not keep. A unit that cannot be tokenized yields no diagnostics.
 * Instances are immutable and may be shared between threads (the reporter must be thread-safe).
 */
@Slf4j
public final class SingleTupleChecker {
    @Getter
    private final Rule rule;

    @Getter
    private final Mode mode;

    private final Reporter reporter;
    private final CandidateCollector collector;
    private final ViolationReporter violations;

    public SingleTupleChecker() {
        this(Mode.BROAD, new NoopReporter());
    }

    public SingleTupleChecker(Mode mode, Reporter reporter) {
        this(Rule.stc001(), mode, reporter);
    }

    public SingleTupleChecker(Rule rule, Mode mode, Reporter reporter) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.collector = new CandidateCollector(mode);
        this.violations = new ViolationReporter(rule);
    }

    /**
     * Lazily checks one unit. Nothing is computed until the stream is consumed; the stream can be
     * consumed once. The reporter is not notified.
     */
    public Stream<Diagnostic> run(SyntaxNode tree, List<String> lines) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(lines, "lines");
        return Stream.of(tree).flatMap(root -> {
            Optional<TokenIndex> index = index(lines);
            if (index.isEmpty()) return Stream.empty();
            Unit unit = new Unit(index.get());
            return collector.collect(root).stream()
                    .map(unit::inspect)
                    .flatMap(Optional::stream)
                    .map(violations::toDiagnostic);
        });
    }

    /** Checks one unit and hands the complete result to the reporter. */
    public List<Diagnostic> check(SyntaxNode tree, List<String> lines) {
        List<Diagnostic> diagnostics = run(tree, lines).toList();
        if (log.isDebugEnabled()) {
            log.debug("{} found {} diagnostic(s) in {} line(s)", rule.code(), diagnostics.size(), lines.size());
        }
        reporter.report(diagnostics);
        return diagnostics;
    }

    private static Optional<TokenIndex> index(List<String> lines) {
        try {
            return Optional.of(new TokenIndex(PythonTokenizer.tokenize(lines)));
        } catch (TokenizeException e) {
            log.debug("Skipping unit that cannot be tokenized: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Per-unit collaborators bound to one token index. */
    private final class Unit {
        private final TokenIndex index;
        private final ParenMatcher matcher;
        private final ViolationClassifier classifier;

        Unit(TokenIndex index) {
            this.index = index;
            this.matcher = new ParenMatcher(index);
            this.classifier = new ViolationClassifier(index, rule);
        }

        Optional<Violation> inspect(CandidateSite site) {
            SyntaxNode node = site.node();
            if (node.start() == null || node.end() == null) {
                log.debug("Skipping {} candidate without position", node.kind());
                return Optional.empty();
            }
            OptionalInt startIdx = index.findExact(node.start());
            if (startIdx.isEmpty()) return Optional.empty();
            int endIdx = lastTokenBefore(node.end());
            Optional<MatchedSpan> span;
            if (site.context() == SiteContext.CALL_ARGUMENT) {
                SyntaxNode.Call call = site.call();
                if (call == null || call.end() == null) {
                    log.debug("Skipping {} argument without an enclosing call position", node.kind());
                    return Optional.empty();
                }
                span = matcher.matchArgument(
                        startIdx.getAsInt(), endIdx, lastTokenBefore(call.end()), site.loneArgument());
            } else {
                span = matcher.match(startIdx.getAsInt(), endIdx);
            }
            return span.flatMap(s -> classifier.classify(site, s));
        }

        /** Index of the last token starting before {@code end}. */
        private int lastTokenBefore(Position end) {
            return index.findAtOrAfter(end).orElse(index.size()) - 1;
        }
    }
}
