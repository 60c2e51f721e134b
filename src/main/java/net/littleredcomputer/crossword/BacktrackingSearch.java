package net.littleredcomputer.crossword;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Depth-first backtracking over assignments, choosing variables by minimum remaining
 * values (then degree) and trying values least-constraining first. Each extension of an
 * assignment is a fresh immutable copy, so abandoning a branch needs no undo.
 */
public class BacktrackingSearch {
    private static final Logger log = LogManager.getFormatterLogger(BacktrackingSearch.class);
    private static final Joiner commaJoiner = Joiner.on(',');
    private final Crossword crossword;
    private final Domains domains;
    private final ConsistencyChecker checker;
    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public BacktrackingSearch(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
        this.checker = new ConsistencyChecker(crossword);
    }

    public BacktrackingSearch setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * @return number of assignments examined so far
     */
    public long stepCount() { return stepCount; }

    private void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %s", stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * Minimum remaining values, ties broken by degree (most neighbors), then by the
     * canonical variable order.
     * @return the unassigned variable to branch on, or empty if all are assigned
     */
    public Optional<Variable> selectUnassignedVariable(Map<Variable, String> assignment) {
        return crossword.variables().stream()
                .filter(v -> !assignment.containsKey(v))
                .min(Comparator.<Variable>comparingInt(domains::size)
                        .thenComparing(v -> crossword.neighbors(v).size(), Comparator.reverseOrder())
                        .thenComparing(Comparator.naturalOrder()));
    }

    /**
     * Least-constraining value: each word of v's domain is ranked by the number of words it
     * would rule out in the domains of v's unassigned neighbors. Equal ranks are ordered
     * alphabetically.
     */
    public List<String> orderDomainValues(Variable v, Map<Variable, String> assignment) {
        Map<String, Integer> eliminated = domains.get(v).stream()
                .collect(Collectors.toMap(w -> w, w -> conflicts(v, w, assignment)));
        return domains.get(v).stream()
                .sorted(Comparator.<String>comparingInt(eliminated::get).thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.toList());
    }

    private int conflicts(Variable v, String word, Map<Variable, String> assignment) {
        int count = 0;
        for (Variable n : crossword.neighbors(v)) {
            if (assignment.containsKey(n)) continue;
            Overlap o = crossword.overlap(v, n).get();
            for (String w : domains.get(n)) {
                if (!o.agrees(word, w)) ++count;
            }
        }
        return count;
    }

    /**
     * Extend the assignment until it is complete.
     * @param assignment a consistent partial assignment
     * @return a complete consistent assignment extending the argument, or empty if there is none
     */
    public Optional<Map<Variable, String>> backtrack(Map<Variable, String> assignment) {
        start();
        return search(ImmutableMap.copyOf(assignment));
    }

    private Optional<Map<Variable, String>> search(ImmutableMap<Variable, String> assignment) {
        ++stepCount;
        maybeReportProgress(() -> "depth " + assignment.size() + " " + commaJoiner.join(assignment.values()));
        if (checker.complete(assignment)) return Optional.of(assignment);
        Optional<Variable> next = selectUnassignedVariable(assignment);
        if (!next.isPresent()) return Optional.empty();
        Variable v = next.get();
        for (String word : orderDomainValues(v, assignment)) {
            ImmutableMap<Variable, String> extended = ImmutableMap.<Variable, String>builder()
                    .putAll(assignment)
                    .put(v, word)
                    .build();
            if (checker.consistent(extended)) {
                Optional<Map<Variable, String>> result = search(extended);
                if (result.isPresent()) return result;
            }
        }
        return Optional.empty();
    }
}
