package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mackworth's AC-3: prunes domains until every value of every variable has a supporting
 * value in each neighbor's domain, or some domain empties.
 */
public class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger(ArcConsistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private long revisions;
    private long removals;

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * Make x arc-consistent with y: remove from x's domain each word that no word of y's
     * domain agrees with at their overlap.
     * @return true if x's domain was revised
     */
    @CheckReturnValue
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final Overlap overlap = o.get();
        final Set<String> ys = domains.get(y);
        ++revisions;
        int before = domains.size(x);
        boolean revised = domains.removeIf(x, w -> ys.stream().noneMatch(w2 -> overlap.agrees(w, w2)));
        removals += before - domains.size(x);
        return revised;
    }

    /**
     * @return every arc (x, y) where y is a neighbor of x
     */
    public List<Arc> allArcs() {
        List<Arc> arcs = new ArrayList<>();
        for (Variable x : crossword.variables()) {
            for (Variable y : crossword.neighbors(x)) arcs.add(new Arc(x, y));
        }
        return arcs;
    }

    @CheckReturnValue
    public boolean ac3() {
        return ac3(allArcs());
    }

    /**
     * Enforce arc consistency starting from the given arcs.
     * @param arcs initial worklist
     * @return false if some domain became empty, in which case the puzzle has no solution
     */
    @CheckReturnValue
    public boolean ac3(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        while (!queue.isEmpty()) {
            Arc a = queue.removeFirst();
            Variable x = a.x();
            if (revise(x, a.y())) {
                if (domains.isEmpty(x)) {
                    log.debug("domain of %s emptied after %d revisions", x, revisions);
                    return false;
                }
                for (Variable z : crossword.neighbors(x)) {
                    if (!z.equals(a.y())) queue.addLast(new Arc(z, x));
                }
            }
        }
        log.debug("arc consistent after %d revisions removing %d words", revisions, removals);
        return true;
    }

    long revisions() { return revisions; }
}
