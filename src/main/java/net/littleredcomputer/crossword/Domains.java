package net.littleredcomputer.crossword;

import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The candidate words remaining for each variable. Domains only ever shrink.
 */
public class Domains {
    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();

    private Domains() {}

    /**
     * @param crossword puzzle whose variables receive domains
     * @return domains in which every variable may take any word of the vocabulary
     */
    public static Domains initialize(Crossword crossword) {
        Domains d = new Domains();
        for (Variable v : crossword.variables()) {
            d.domains.put(v, new LinkedHashSet<>(crossword.words()));
        }
        return d;
    }

    /**
     * Removes from each domain the words whose length differs from the variable's.
     */
    public void enforceNodeConsistency() {
        domains.forEach((v, words) -> words.removeIf(w -> w.length() != v.length()));
    }

    public Set<String> get(Variable v) {
        return Collections.unmodifiableSet(domain(v));
    }

    public int size(Variable v) { return domain(v).size(); }

    public boolean isEmpty(Variable v) { return domain(v).isEmpty(); }

    /**
     * @return true if any words were removed from v's domain
     */
    boolean removeIf(Variable v, Predicate<String> p) {
        return domain(v).removeIf(p);
    }

    private Set<String> domain(Variable v) {
        Set<String> d = domains.get(v);
        Preconditions.checkArgument(d != null, "unknown variable %s", v);
        return d;
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        domains.forEach((v, words) -> s.append(v).append(" -> ").append(words.size()).append('\n'));
        return s.toString();
    }
}
