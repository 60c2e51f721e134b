package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Solves a crossword: node consistency, then AC-3, then backtracking search.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);
    private final Domains domains;
    private final ArcConsistency arcConsistency;
    private final BacktrackingSearch search;

    public CrosswordSolver(Crossword crossword) {
        this.domains = Domains.initialize(crossword);
        this.arcConsistency = new ArcConsistency(crossword, domains);
        this.search = new BacktrackingSearch(crossword, domains);
    }

    public CrosswordSolver setLogInterval(Duration logInterval) {
        search.setLogInterval(logInterval);
        return this;
    }

    public Domains domains() { return domains; }

    ArcConsistency arcConsistency() { return arcConsistency; }

    BacktrackingSearch search() { return search; }

    /**
     * @return an assignment of a distinct word to every variable satisfying all overlaps,
     * or empty if the puzzle has no solution.
     */
    public Optional<Map<Variable, String>> solve() {
        Stopwatch sw = Stopwatch.createStarted();
        domains.enforceNodeConsistency();
        if (!arcConsistency.ac3()) {
            log.info("no solution: arc consistency emptied a domain (%s)", sw);
            return Optional.empty();
        }
        log.debug("after propagation:\n%s", domains);
        Optional<Map<Variable, String>> result = search.backtrack(ImmutableMap.of());
        log.info("%s after %d search steps (%s)", result.isPresent() ? "solved" : "no solution", search.stepCount(), sw);
        return result;
    }
}
