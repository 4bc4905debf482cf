/*
 * @LICENSE@
 */

package org.xtrms.fst;

import static org.xtrms.fst.Misc.LS;
import static org.xtrms.fst.Misc.watchdog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An immutable nondeterministic finite automaton. Arc labels are strings: the
 * empty string is an epsilon move, a string of length one is an ordinary
 * symbol, and a longer string is a word consumed atomically until the
 * automaton is {@linkplain #expand() expanded}.
 * <p>
 * States are <code>int</code>s with no meaning outside the owning automaton.
 * The binary operations renumber the second operand past the states of the
 * first before merging.
 */
public final class Automaton {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    /**
     * A labeled transition.
     */
    public static final class Arc {

        final int from;
        final String label;
        final int to;

        public Arc(int from, String label, int to) {
            if (label == null) throw new NullPointerException("label");
            this.from = from;
            this.label = label;
            this.to = to;
        }

        public int from() {
            return from;
        }

        public String label() {
            return label;
        }

        public int to() {
            return to;
        }

        boolean isEpsilon() {
            return label.isEmpty();
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + from;
            result = prime * result + label.hashCode();
            result = prime * result + to;
            return result;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            final Arc arc = (Arc) o;
            return from == arc.from && to == arc.to && label.equals(arc.label);
        }

        /*
         * Arc is immutable, so the string can be cached.
         */
        @Override
        public String toString() {
            if (s != null) return s;
            return s = "(" + from + ", \"" + Misc.esc(label) + "\", " + to + ")";
        }
        private String s;
    }

    private final Set<Integer> states;
    private final Set<Integer> initial;
    private final Set<Integer> finals;
    private final Set<Arc> arcs;

    /*
     * lazily computed
     */
    private Map<Integer, Set<Integer>> epsilonClosure;
    private Map<Integer, Map<String, Set<Integer>>> arcIndex;

    /**
     * @throws IllegalArgumentException
     *             if an initial, final or arc end state is not in
     *             <code>states</code>.
     */
    public Automaton(
            Collection<Integer> states,
            Collection<Integer> initial,
            Collection<Integer> finals,
            Collection<Arc> arcs) {

        this.states = Misc.frozen(states);
        this.initial = Misc.frozen(initial);
        this.finals = Misc.frozen(finals);
        this.arcs = Collections.unmodifiableSet(new LinkedHashSet<Arc>(arcs));

        if (!this.states.containsAll(this.initial)) {
            throw new IllegalArgumentException(
                "initial states not in states: " + this.initial);
        }
        if (!this.states.containsAll(this.finals)) {
            throw new IllegalArgumentException(
                "final states not in states: " + this.finals);
        }
        for (Arc arc : this.arcs) {
            if (!this.states.contains(arc.from) || !this.states.contains(arc.to)) {
                throw new IllegalArgumentException("dangling arc: " + arc);
            }
        }
    }

    /*
     * factories
     */

    /**
     * @return an automaton recognizing only the empty word.
     */
    public static Automaton fromEpsilon() {
        return fromWord("");
    }

    /**
     * @return a linear chain of <code>word.length() + 1</code> states
     *         recognizing exactly <code>word</code>.
     */
    public static Automaton fromWord(String word) {
        List<Arc> arcs = new ArrayList<Arc>();
        for (int i = 0; i < word.length(); ++i) {
            arcs.add(new Arc(i, String.valueOf(word.charAt(i)), i + 1));
        }
        return new Automaton(
            Misc.range(0, word.length() + 1),
            Collections.singleton(0),
            Collections.singleton(word.length()),
            arcs);
    }

    public static Automaton fromSymbol(char symbol) {
        return fromWord(String.valueOf(symbol));
    }

    /**
     * @return a two state automaton recognizing each symbol of
     *         <code>symbols</code> as a one symbol word.
     */
    public static Automaton fromSymbolSet(Collection<Character> symbols) {
        List<Arc> arcs = new ArrayList<Arc>();
        for (char c : new LinkedHashSet<Character>(symbols)) {
            arcs.add(new Arc(0, String.valueOf(c), 1));
        }
        return new Automaton(
            Arrays.asList(0, 1),
            Collections.singleton(0),
            Collections.singleton(1),
            arcs);
    }

    /**
     * @return the automaton recognizing every word over <code>alphabet</code>.
     */
    public static Automaton all(Collection<Character> alphabet) {
        return fromSymbolSet(alphabet).star();
    }

    /*
     * accessors
     */

    public Set<Integer> states() {
        return states;
    }

    public Set<Integer> initial() {
        return initial;
    }

    public Set<Integer> finals() {
        return finals;
    }

    public Set<Arc> arcs() {
        return arcs;
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the first state number not used by this automaton.
     */
    int nextState() {
        int max = -1;
        for (int s : states) if (s > max) max = s;
        return max + 1;
    }

    /**
     * @return the states reachable from <code>state</code> by epsilon moves,
     *         including <code>state</code> itself.
     */
    public Set<Integer> epsilonClosure(int state) {
        if (epsilonClosure == null) {
            Set<Relations.Pair> eps = new LinkedHashSet<Relations.Pair>();
            for (Arc arc : arcs) {
                if (arc.isEpsilon()) eps.add(new Relations.Pair(arc.from, arc.to));
            }
            epsilonClosure = Relations.closureOf(states, eps);
        }
        Set<Integer> ret = epsilonClosure.get(state);
        return ret == null
                ? Collections.<Integer>emptySet()
                : Collections.unmodifiableSet(ret);
    }

    private Set<Integer> targets(int state, String label) {
        if (arcIndex == null) {
            Map<Integer, Map<String, Set<Integer>>> index =
                    new LinkedHashMap<Integer, Map<String, Set<Integer>>>();
            for (Arc arc : arcs) {
                Map<String, Set<Integer>> byLabel = index.get(arc.from);
                if (byLabel == null) {
                    index.put(arc.from, byLabel = new LinkedHashMap<String, Set<Integer>>());
                }
                Set<Integer> tos = byLabel.get(arc.label);
                if (tos == null) byLabel.put(arc.label, tos = new LinkedHashSet<Integer>());
                tos.add(arc.to);
            }
            arcIndex = index;
        }
        Map<String, Set<Integer>> byLabel = arcIndex.get(state);
        Set<Integer> ret = byLabel == null ? null : byLabel.get(label);
        return ret == null ? Collections.<Integer>emptySet() : ret;
    }

    private boolean hasWordLabels() {
        for (Arc arc : arcs) if (arc.label.length() > 1) return true;
        return false;
    }

    /**
     * @return true iff some path from an initial to a final state spells
     *         <code>word</code>.
     */
    public boolean recognize(CharSequence word) {
        if (hasWordLabels()) return expand().recognize(word);

        Set<Integer> current = closure(initial);
        for (int i = 0; i < word.length() && !current.isEmpty(); ++i) {
            String symbol = String.valueOf(word.charAt(i));
            Set<Integer> next = new LinkedHashSet<Integer>();
            for (int s : current) next.addAll(targets(s, symbol));
            current = closure(next);
        }
        return Misc.intersects(current, finals);
    }

    private Set<Integer> closure(Collection<Integer> set) {
        Set<Integer> ret = new LinkedHashSet<Integer>();
        for (int s : set) ret.addAll(epsilonClosure(s));
        return ret;
    }

    /*
     * regular operations
     */

    /**
     * Clones the automaton, adding <code>k</code> to every state.
     */
    Automaton remap(int k) {
        List<Integer> s = new ArrayList<Integer>(), i = new ArrayList<Integer>(),
                f = new ArrayList<Integer>();
        for (int x : states) s.add(x + k);
        for (int x : initial) i.add(x + k);
        for (int x : finals) f.add(x + k);
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) a.add(new Arc(arc.from + k, arc.label, arc.to + k));
        return new Automaton(s, i, f, a);
    }

    public Automaton concat(Automaton... others) {
        Automaton ret = this;
        for (Automaton other : others) ret = ret.concat(other);
        return ret;
    }

    /**
     * Final states of this automaton get epsilon arcs to the initial states
     * of <code>other</code>.
     */
    public Automaton concat(Automaton other) {
        Automaton second = other.remap(nextState());

        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.addAll(second.states);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        if (Misc.intersects(initial, finals)) i.addAll(second.initial);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        a.addAll(second.arcs);
        for (int f : finals) {
            for (int init : second.initial) a.add(new Arc(f, "", init));
        }
        return new Automaton(s, i, second.finals, a);
    }

    public Automaton union(Automaton... others) {
        Automaton ret = this;
        for (Automaton other : others) ret = ret.union(other);
        return ret;
    }

    public Automaton union(Automaton other) {
        Automaton second = other.remap(nextState());

        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.addAll(second.states);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        i.addAll(second.initial);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        f.addAll(second.finals);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        a.addAll(second.arcs);
        return new Automaton(s, i, f, a);
    }

    /**
     * Kleene star: a new initial and final state with epsilon arcs to the old
     * initial states and from the old final states.
     */
    public Automaton star() {
        return loop(true);
    }

    /**
     * Like {@link #star()} but the new state is not final.
     */
    public Automaton plus() {
        return loop(false);
    }

    private Automaton loop(boolean nullable) {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        if (nullable) f.add(n);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        for (int i : initial) a.add(new Arc(n, "", i));
        for (int x : finals) a.add(new Arc(x, "", n));
        return new Automaton(s, Collections.singleton(n), f, a);
    }

    /**
     * Adds a state which is both initial and final.
     */
    public Automaton option() {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        i.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        f.add(n);
        return new Automaton(s, i, f, arcs);
    }

    /**
     * Removes the epsilon arcs. The language of the automaton is preserved;
     * the languages of the individual states are not.
     */
    public Automaton epsilonFree() {
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            if (arc.isEpsilon()) continue;
            for (int to : epsilonClosure(arc.to)) a.add(new Arc(arc.from, arc.label, to));
        }
        return new Automaton(states, closure(initial), finals, a);
    }

    /**
     * Removes the states not on a path from an initial to a final state and
     * renumbers the rest densely from 0.
     */
    public Automaton trim() {
        Set<Relations.Pair> rel = new LinkedHashSet<Relations.Pair>();
        for (Arc arc : arcs) rel.add(new Relations.Pair(arc.from, arc.to));
        List<Integer> useful = Relations.useful(rel, initial, finals);

        Map<Integer, Integer> index = new LinkedHashMap<Integer, Integer>();
        for (int s : useful) index.put(s, index.size());

        List<Integer> i = new ArrayList<Integer>(), f = new ArrayList<Integer>();
        for (int s : initial) if (index.containsKey(s)) i.add(index.get(s));
        for (int s : finals) if (index.containsKey(s)) f.add(index.get(s));
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) {
            if (index.containsKey(arc.from) && index.containsKey(arc.to)) {
                a.add(new Arc(index.get(arc.from), arc.label, index.get(arc.to)));
            }
        }
        return new Automaton(index.values(), i, f, a);
    }

    /**
     * Replaces each arc labeled by a word of length <i>n</i> &gt; 1 with a
     * chain of <i>n</i> single symbol arcs through new states.
     */
    public Automaton expand() {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            int len = arc.label.length();
            if (len <= 1) {
                a.add(arc);
                continue;
            }
            int from = arc.from;
            for (int i = 0; i < len; ++i) {
                int to = i == len - 1 ? arc.to : n++;
                s.add(to);
                a.add(new Arc(from, String.valueOf(arc.label.charAt(i)), to));
                from = to;
            }
        }
        return new Automaton(s, initial, finals, a);
    }

    /**
     * Subset construction. The automaton is made epsilon free and expanded
     * first; each discovered set of states becomes one state of the result,
     * numbered in order of discovery. Symbols without successors are left
     * out of the (partial) transition function.
     *
     * @throws ConstructionException
     *             if more than <code>org.xtrms.fst.maxStates</code> subsets
     *             are discovered.
     */
    public Dfa determinize() {
        return determinize(Misc.MAX_STATE_COUNT);
    }

    /*
     * subset construction giving up after maxStates subsets
     */
    Dfa determinize(int maxStates) {
        Automaton nfa = epsilonFree().expand();

        final Map<Integer, List<Arc>> arcsFrom = new LinkedHashMap<Integer, List<Arc>>();
        for (Arc arc : nfa.arcs) {
            List<Arc> l = arcsFrom.get(arc.from);
            if (l == null) arcsFrom.put(arc.from, l = new ArrayList<Arc>());
            l.add(arc);
        }

        List<Set<Integer>> subsets = new ArrayList<Set<Integer>>();
        Map<Set<Integer>, Integer> index = new LinkedHashMap<Set<Integer>, Integer>();
        Map<Integer, Map<Character, Integer>> delta =
                new LinkedHashMap<Integer, Map<Character, Integer>>();

        Set<Integer> init = new LinkedHashSet<Integer>(nfa.initial);
        subsets.add(init);
        index.put(init, 0);

        for (int n = 0; n < subsets.size(); ++n) {
            watchdog(subsets.size(), maxStates, "subset construction");

            SortedMap<Character, Set<Integer>> bySymbol = new TreeMap<Character, Set<Integer>>();
            for (int s : subsets.get(n)) {
                List<Arc> out = arcsFrom.get(s);
                if (out == null) continue;
                for (Arc arc : out) {
                    char c = arc.label.charAt(0);
                    Set<Integer> target = bySymbol.get(c);
                    if (target == null) bySymbol.put(c, target = new LinkedHashSet<Integer>());
                    target.add(arc.to);
                }
            }
            Map<Character, Integer> row = new TreeMap<Character, Integer>();
            for (Map.Entry<Character, Set<Integer>> e : bySymbol.entrySet()) {
                Integer to = index.get(e.getValue());
                if (to == null) {
                    index.put(e.getValue(), to = subsets.size());
                    subsets.add(e.getValue());
                }
                row.put(e.getKey(), to);
            }
            delta.put(n, row);
        }

        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < subsets.size(); ++n) {
            if (Misc.intersects(subsets.get(n), nfa.finals)) f.add(n);
        }
        Dfa dfa = new Dfa(Misc.range(0, subsets.size()), 0, f, delta);
        if (logger.isLoggable(level)) {
            logger.log(level, "determinized " + size() + " states into "
                + dfa.size() + " states");
        }
        return dfa;
    }

    /**
     * Both operands are determinized; the result is the trimmed product.
     */
    public Automaton intersect(Automaton other) {
        return determinize().intersect(other.determinize()).toAutomaton();
    }

    /**
     * @return an automaton recognizing the words recognized by this
     *         automaton and not by <code>other</code>.
     */
    public Automaton difference(Automaton other) {
        return determinize().difference(other.determinize()).toAutomaton();
    }

    /*
     * transducer bridges
     */

    /**
     * @return the identity relation on the language of this automaton.
     */
    public Transducer identity() {
        List<Transducer.Arc> a = new ArrayList<Transducer.Arc>();
        for (Arc arc : arcs) a.add(new Transducer.Arc(arc.from, arc.label, arc.label, arc.to));
        return new Transducer(states, initial, finals, a);
    }

    /**
     * The cross product relation: every word of this automaton paired with
     * every word of <code>lower</code>. Each side may move while the other
     * stays put; the result is epsilon free and trimmed.
     */
    public Transducer cross(Automaton lower) {
        Map<Integer, List<Arc>> upperFrom = withStays(this);
        Map<Integer, List<Arc>> lowerFrom = withStays(lower);

        List<Relations.Pair> pairs = new ArrayList<Relations.Pair>();
        Map<Relations.Pair, Integer> index = new LinkedHashMap<Relations.Pair, Integer>();
        for (int i1 : initial) {
            for (int i2 : lower.initial) {
                Relations.Pair p = new Relations.Pair(i1, i2);
                index.put(p, pairs.size());
                pairs.add(p);
            }
        }
        Set<Transducer.Arc> a = new LinkedHashSet<Transducer.Arc>();
        for (int n = 0; n < pairs.size(); ++n) {
            watchdog(pairs.size(), "cross product");
            Relations.Pair p = pairs.get(n);
            for (Arc a1 : upperFrom.get(p.from)) {
                for (Arc a2 : lowerFrom.get(p.to)) {
                    Relations.Pair q = new Relations.Pair(a1.to, a2.to);
                    Integer to = index.get(q);
                    if (to == null) {
                        index.put(q, to = pairs.size());
                        pairs.add(q);
                    }
                    a.add(new Transducer.Arc(n, a1.label, a2.label, to));
                }
            }
        }
        List<Integer> i = new ArrayList<Integer>(), f = new ArrayList<Integer>();
        for (int n = 0; n < pairs.size(); ++n) {
            Relations.Pair p = pairs.get(n);
            if (initial.contains(p.from) && lower.initial.contains(p.to)) i.add(n);
            if (finals.contains(p.from) && lower.finals.contains(p.to)) f.add(n);
        }
        return new Transducer(Misc.range(0, pairs.size()), i, f, a)
            .epsilonFree()
            .trim();
    }

    /*
     * arcs grouped by source state, plus an epsilon self loop on every state
     */
    private static Map<Integer, List<Arc>> withStays(Automaton a) {
        Map<Integer, List<Arc>> ret = new LinkedHashMap<Integer, List<Arc>>();
        for (int s : a.states) {
            List<Arc> l = new ArrayList<Arc>();
            l.add(new Arc(s, "", s));
            ret.put(s, l);
        }
        for (Arc arc : a.arcs) ret.get(arc.from).add(arc);
        return ret;
    }

    /**
     * @return Graphviz source; for debugging only.
     */
    public String toDot(String name) {
        Dot dot = new Dot(name, initial, finals);
        for (int s : states) dot.state(s);
        for (Arc arc : arcs) dot.arc(arc.from, arc.to, arc.isEpsilon() ? "\u03b5" : arc.label);
        return dot.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states: ").append(states).append(LS)
          .append("initial: ").append(initial).append(LS)
          .append("final: ").append(finals).append(LS)
          .append("arcs: ").append(arcs).append(LS);
        return sb.toString();
    }
}
