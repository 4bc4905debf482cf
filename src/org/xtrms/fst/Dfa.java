/*
 * @LICENSE@
 */

package org.xtrms.fst;

import static org.xtrms.fst.Misc.LS;
import static org.xtrms.fst.Misc.watchdog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deterministic Finite Automaton: a single initial state and a partial
 * transition function over single chars. Immutable.
 */
public final class Dfa {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    private final Set<Integer> states;
    private final int initial;
    private final Set<Integer> finals;
    private final Map<Integer, SortedMap<Character, Integer>> delta;

    /**
     * @param arcs
     *            single symbol arcs; at most one per (state, symbol).
     * @throws IllegalArgumentException
     *             if an arc label is not exactly one char long, two arcs
     *             leave one state on the same symbol, or a state is not in
     *             <code>states</code>.
     */
    public Dfa(
            Collection<Integer> states,
            int initial,
            Collection<Integer> finals,
            Collection<Automaton.Arc> arcs) {

        this(states, initial, finals, index(arcs));
    }

    Dfa(
            Collection<Integer> states,
            int initial,
            Collection<Integer> finals,
            Map<Integer, ? extends Map<Character, Integer>> transitions) {

        this.states = Misc.frozen(states);
        this.initial = initial;
        this.finals = Misc.frozen(finals);
        Map<Integer, SortedMap<Character, Integer>> d =
                new LinkedHashMap<Integer, SortedMap<Character, Integer>>();
        for (Map.Entry<Integer, ? extends Map<Character, Integer>> e : transitions.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            if (!this.states.contains(e.getKey())) {
                throw new IllegalArgumentException("unknown state: " + e.getKey());
            }
            for (int to : e.getValue().values()) {
                if (!this.states.contains(to)) {
                    throw new IllegalArgumentException("unknown state: " + to);
                }
            }
            d.put(e.getKey(), Collections.unmodifiableSortedMap(
                new TreeMap<Character, Integer>(e.getValue())));
        }
        this.delta = Collections.unmodifiableMap(d);

        if (!this.states.contains(initial)) {
            throw new IllegalArgumentException("initial state not in states: " + initial);
        }
        if (!this.states.containsAll(this.finals)) {
            throw new IllegalArgumentException("final states not in states: " + this.finals);
        }
    }

    private static Map<Integer, Map<Character, Integer>> index(Collection<Automaton.Arc> arcs) {
        Map<Integer, Map<Character, Integer>> ret = new LinkedHashMap<Integer, Map<Character, Integer>>();
        for (Automaton.Arc arc : arcs) {
            if (arc.label.length() != 1) {
                throw new IllegalArgumentException("not a single symbol arc: " + arc);
            }
            Map<Character, Integer> row = ret.get(arc.from);
            if (row == null) ret.put(arc.from, row = new TreeMap<Character, Integer>());
            Integer prev = row.put(arc.label.charAt(0), arc.to);
            if (prev != null && prev != arc.to) {
                throw new IllegalArgumentException("nondeterministic arc: " + arc);
            }
        }
        return ret;
    }

    /**
     * @return the DFA with a single non-final state and no transitions.
     */
    static Dfa empty() {
        return new Dfa(
            Collections.singleton(0),
            0,
            Collections.<Integer>emptySet(),
            Collections.<Integer, Map<Character, Integer>>emptyMap());
    }

    public Set<Integer> states() {
        return states;
    }

    public int initial() {
        return initial;
    }

    public Set<Integer> finals() {
        return finals;
    }

    public boolean isFinal(int state) {
        return finals.contains(state);
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the successor of <code>state</code> on <code>symbol</code>,
     *         or <code>null</code> if there is none.
     */
    public Integer next(int state, char symbol) {
        Map<Character, Integer> row = delta.get(state);
        return row == null ? null : row.get(symbol);
    }

    /**
     * @return the outgoing transitions of <code>state</code> by symbol.
     */
    public SortedMap<Character, Integer> transitions(int state) {
        SortedMap<Character, Integer> row = delta.get(state);
        return row == null ? Collections.unmodifiableSortedMap(new TreeMap<Character, Integer>()) : row;
    }

    public int transitionCount() {
        int n = 0;
        for (Map<Character, Integer> row : delta.values()) n += row.size();
        return n;
    }

    /**
     * @return every symbol labeling some transition.
     */
    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (Map<Character, Integer> row : delta.values()) ret.addAll(row.keySet());
        return ret;
    }

    public List<Automaton.Arc> arcs() {
        List<Automaton.Arc> ret = new ArrayList<Automaton.Arc>();
        for (Map.Entry<Integer, SortedMap<Character, Integer>> e : delta.entrySet()) {
            for (Map.Entry<Character, Integer> t : e.getValue().entrySet()) {
                ret.add(new Automaton.Arc(e.getKey(), String.valueOf(t.getKey()), t.getValue()));
            }
        }
        return ret;
    }

    public boolean recognize(CharSequence word) {
        int current = initial;
        for (int i = 0; i < word.length(); ++i) {
            Integer next = next(current, word.charAt(i));
            if (next == null) return false;
            current = next;
        }
        return isFinal(current);
    }

    /**
     * Runs <code>word</code> from its last symbol to its first. The returned
     * path starts with the initial state and has one more entry per
     * consumed symbol; it is shorter than <code>word.length() + 1</code> if
     * the run got stuck.
     */
    public List<Integer> pathRightToLeft(CharSequence word) {
        List<Integer> path = new ArrayList<Integer>(word.length() + 1);
        int current = initial;
        path.add(current);
        for (int i = word.length() - 1; i >= 0; --i) {
            Integer next = next(current, word.charAt(i));
            if (next == null) break;
            path.add(current = next);
        }
        return path;
    }

    /**
     * Keeps the states on some path from the initial state to a final
     * state. The initial state becomes 0, the others follow in ascending
     * order. If the initial state is useless the result is {@link #empty()}.
     */
    public Dfa trim() {
        Set<Relations.Pair> rel = new LinkedHashSet<Relations.Pair>();
        for (Map.Entry<Integer, SortedMap<Character, Integer>> e : delta.entrySet()) {
            for (int to : e.getValue().values()) rel.add(new Relations.Pair(e.getKey(), to));
        }
        List<Integer> useful = Relations.useful(rel, Collections.singleton(initial), finals);
        if (!useful.contains(initial)) return empty();

        Map<Integer, Integer> index = new LinkedHashMap<Integer, Integer>();
        index.put(initial, 0);
        for (int s : useful) if (s != initial) index.put(s, index.size());

        Map<Integer, Map<Character, Integer>> d = new LinkedHashMap<Integer, Map<Character, Integer>>();
        for (Map.Entry<Integer, SortedMap<Character, Integer>> e : delta.entrySet()) {
            Integer from = index.get(e.getKey());
            if (from == null) continue;
            Map<Character, Integer> row = new TreeMap<Character, Integer>();
            for (Map.Entry<Character, Integer> t : e.getValue().entrySet()) {
                Integer to = index.get(t.getValue());
                if (to != null) row.put(t.getKey(), to);
            }
            d.put(from, row);
        }
        List<Integer> f = new ArrayList<Integer>();
        for (int s : finals) if (index.containsKey(s)) f.add(index.get(s));
        return new Dfa(index.values(), 0, f, d);
    }

    /**
     * Moore minimization: refines final/non-final until stable, takes the
     * quotient and trims it.
     */
    public Dfa minimal() {
        Map<Integer, Integer> seed = Relations.kernel(states, new Relations.Classifier<Boolean>() {
            public Boolean classify(int state) {
                return isFinal(state);
            }
        });
        Map<Integer, Integer> eq = Relations.refine(states, seed, alphabet(),
            new Relations.Successor<Character>() {
                public Integer next(int state, Character label) {
                    return Dfa.this.next(state, label);
                }
            });

        Map<Integer, Map<Character, Integer>> d = new LinkedHashMap<Integer, Map<Character, Integer>>();
        for (Map.Entry<Integer, SortedMap<Character, Integer>> e : delta.entrySet()) {
            int from = eq.get(e.getKey());
            Map<Character, Integer> row = d.get(from);
            if (row == null) d.put(from, row = new TreeMap<Character, Integer>());
            for (Map.Entry<Character, Integer> t : e.getValue().entrySet()) {
                row.put(t.getKey(), eq.get(t.getValue()));
            }
        }
        Set<Integer> f = new LinkedHashSet<Integer>();
        for (int s : finals) f.add(eq.get(s));
        Dfa ret = new Dfa(new LinkedHashSet<Integer>(eq.values()), eq.get(initial), f, d).trim();
        if (logger.isLoggable(level)) {
            logger.log(level, "minimized " + size() + " states into " + ret.size());
        }
        return ret;
    }

    /*
     * pair states discovered by product(), in order of discovery
     */
    private static final class Product {
        final List<Relations.Pair> pairs = new ArrayList<Relations.Pair>();
        final Map<Integer, Map<Character, Integer>> delta =
                new LinkedHashMap<Integer, Map<Character, Integer>>();
    }

    /**
     * Lazy product: only pairs reachable from <code>(initial,
     * other)</code> are built. The second component moves by
     * <code>other</code>, which may answer a sink state.
     */
    private Product product(int otherInitial, Collection<Character> symbols,
            Relations.Successor<Character> other) {

        Product p = new Product();
        Map<Relations.Pair, Integer> index = new LinkedHashMap<Relations.Pair, Integer>();
        Relations.Pair start = new Relations.Pair(initial, otherInitial);
        index.put(start, 0);
        p.pairs.add(start);

        for (int n = 0; n < p.pairs.size(); ++n) {
            watchdog(p.pairs.size(), "product");
            Relations.Pair pair = p.pairs.get(n);
            Map<Character, Integer> row = new TreeMap<Character, Integer>();
            for (char c : symbols) {
                Integer to1 = next(pair.from, c);
                if (to1 == null) continue;
                Integer to2 = other.next(pair.to, c);
                if (to2 == null) continue;
                Relations.Pair q = new Relations.Pair(to1, to2);
                Integer to = index.get(q);
                if (to == null) {
                    index.put(q, to = p.pairs.size());
                    p.pairs.add(q);
                }
                row.put(c, to);
            }
            p.delta.put(n, row);
        }
        return p;
    }

    /**
     * @return the trimmed product of the minimized operands, final where
     *         both components are.
     */
    public Dfa intersect(Dfa other) {
        Dfa a = minimal();
        final Dfa b = other.minimal();
        Set<Character> symbols = new TreeSet<Character>(a.alphabet());
        symbols.retainAll(b.alphabet());
        Product p = a.product(b.initial, symbols, new Relations.Successor<Character>() {
            public Integer next(int state, Character label) {
                return b.next(state, label);
            }
        });
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < p.pairs.size(); ++n) {
            Relations.Pair pair = p.pairs.get(n);
            if (a.isFinal(pair.from) && b.isFinal(pair.to)) f.add(n);
        }
        return new Dfa(Misc.range(0, p.pairs.size()), 0, f, p.delta).trim();
    }

    /**
     * The second operand is totalized over the combined alphabet with a
     * non-final sink <code>-1</code>; a pair is final when its first
     * component is final and its second is not.
     */
    public Dfa difference(Dfa other) {
        Dfa a = minimal();
        final Dfa b = other.minimal();
        Set<Character> symbols = new TreeSet<Character>(a.alphabet());
        symbols.addAll(b.alphabet());
        Product p = a.product(b.initial, symbols, new Relations.Successor<Character>() {
            public Integer next(int state, Character label) {
                if (state == -1) return -1;
                Integer to = b.next(state, label);
                return to == null ? -1 : to;
            }
        });
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < p.pairs.size(); ++n) {
            Relations.Pair pair = p.pairs.get(n);
            if (a.isFinal(pair.from) && (pair.to == -1 || !b.isFinal(pair.to))) f.add(n);
        }
        return new Dfa(Misc.range(0, p.pairs.size()), 0, f, p.delta).trim();
    }

    public Automaton toAutomaton() {
        return new Automaton(states, Collections.singleton(initial), finals, arcs());
    }

    public Transducer identity() {
        return toAutomaton().identity();
    }

    /**
     * @return Graphviz source; for debugging only.
     */
    public String toDot(String name) {
        Dot dot = new Dot(name, Collections.singleton(initial), finals);
        for (int s : states) dot.state(s);
        for (Automaton.Arc arc : arcs()) dot.arc(arc.from, arc.to, arc.label);
        return dot.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states: ").append(states).append(LS)
          .append("initial: ").append(initial).append(LS)
          .append("final: ").append(finals).append(LS)
          .append("transitions: ").append(arcs()).append(LS);
        return sb.toString();
    }
}
