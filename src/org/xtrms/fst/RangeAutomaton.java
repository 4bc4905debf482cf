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
import java.util.TreeSet;

/**
 * A nondeterministic automaton whose arcs are labeled with char
 * {@link Range}s instead of single symbols, so that large character classes
 * (or "any char") cost one arc. A <code>null</code> label is an epsilon move.
 * <p>
 * Supports the language operations that only need the input side;
 * transducer bridges are not available.
 */
public final class RangeAutomaton {

    /**
     * A transition on any char of <code>label</code>, or an epsilon move if
     * <code>label</code> is <code>null</code>.
     */
    public static final class Arc {

        final int from;
        final Range label;
        final int to;

        public Arc(int from, Range label, int to) {
            this.from = from;
            this.label = label;
            this.to = to;
        }

        public int from() {
            return from;
        }

        public Range label() {
            return label;
        }

        public int to() {
            return to;
        }

        @Override
        public int hashCode() {
            return (31 * from + (label == null ? 0 : label.hashCode())) * 31 + to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            Arc a = (Arc) o;
            return from == a.from && to == a.to
                && (label == null ? a.label == null : label.equals(a.label));
        }

        @Override
        public String toString() {
            return "(" + from + ", " + (label == null ? "\u03b5" : label) + ", " + to + ")";
        }
    }

    /**
     * Deterministic form: the ranges leaving a state are pairwise disjoint.
     */
    public static final class Deterministic {

        private final Set<Integer> states;
        private final int initial;
        private final Set<Integer> finals;
        private final Map<Integer, List<Arc>> delta;

        Deterministic(Collection<Integer> states, int initial, Collection<Integer> finals,
                Map<Integer, List<Arc>> delta) {
            this.states = Misc.frozen(states);
            this.initial = initial;
            this.finals = Misc.frozen(finals);
            this.delta = delta;
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

        public Integer next(int state, char c) {
            List<Arc> out = delta.get(state);
            if (out == null) return null;
            for (Arc arc : out) if (arc.label.includes(c)) return arc.to;
            return null;
        }

        public boolean recognize(CharSequence word) {
            int current = initial;
            for (int i = 0; i < word.length(); ++i) {
                Integer next = next(current, word.charAt(i));
                if (next == null) return false;
                current = next;
            }
            return finals.contains(current);
        }

        /**
         * Totalizes with a sink state <code>-1</code> and swaps final and
         * non-final states.
         */
        public Deterministic complement() {
            Set<Integer> s = new LinkedHashSet<Integer>(states);
            s.add(-1);
            Map<Integer, List<Arc>> d = new LinkedHashMap<Integer, List<Arc>>();
            for (int state : s) {
                List<Arc> out = new ArrayList<Arc>();
                List<Range> covered = new ArrayList<Range>();
                if (delta.containsKey(state)) {
                    for (Arc arc : delta.get(state)) {
                        out.add(arc);
                        covered.add(arc.label);
                    }
                }
                for (Range r : Range.complement(covered)) out.add(new Arc(state, r, -1));
                d.put(state, out);
            }
            Set<Integer> f = new LinkedHashSet<Integer>(s);
            f.removeAll(finals);
            return new Deterministic(s, initial, f, d);
        }

        public RangeAutomaton toRangeAutomaton() {
            List<Arc> a = new ArrayList<Arc>();
            for (List<Arc> out : delta.values()) a.addAll(out);
            return new RangeAutomaton(states, Collections.singleton(initial), finals, a);
        }
    }

    private final Set<Integer> states;
    private final Set<Integer> initial;
    private final Set<Integer> finals;
    private final Set<Arc> arcs;

    private Map<Integer, Set<Integer>> epsilonClosure;

    public RangeAutomaton(
            Collection<Integer> states,
            Collection<Integer> initial,
            Collection<Integer> finals,
            Collection<Arc> arcs) {

        this.states = Misc.frozen(states);
        this.initial = Misc.frozen(initial);
        this.finals = Misc.frozen(finals);
        this.arcs = Collections.unmodifiableSet(new LinkedHashSet<Arc>(arcs));
        if (!this.states.containsAll(this.initial) || !this.states.containsAll(this.finals)) {
            throw new IllegalArgumentException("initial or final states not in states");
        }
        for (Arc arc : this.arcs) {
            if (!this.states.contains(arc.from) || !this.states.contains(arc.to)) {
                throw new IllegalArgumentException("dangling arc: " + arc);
            }
        }
    }

    public static RangeAutomaton fromEpsilon() {
        return fromWord("");
    }

    public static RangeAutomaton fromWord(String word) {
        List<Arc> a = new ArrayList<Arc>();
        for (int i = 0; i < word.length(); ++i) a.add(new Arc(i, new Range(word.charAt(i)), i + 1));
        return new RangeAutomaton(Misc.range(0, word.length() + 1),
            Collections.singleton(0), Collections.singleton(word.length()), a);
    }

    public static RangeAutomaton fromSymbol(char c) {
        return fromRange(new Range(c));
    }

    public static RangeAutomaton fromRange(Range range) {
        return new RangeAutomaton(Arrays.asList(0, 1), Collections.singleton(0),
            Collections.singleton(1), Collections.singleton(new Arc(0, range, 1)));
    }

    /**
     * @return a one symbol automaton accepting any char.
     */
    public static RangeAutomaton any() {
        return fromRange(Range.ALL);
    }

    /**
     * @return a one symbol automaton accepting any char not in
     *         <code>symbols</code>.
     */
    public static RangeAutomaton anyExcept(Collection<Character> symbols) {
        List<Range> excluded = new ArrayList<Range>();
        for (char c : symbols) excluded.add(new Range(c));
        List<Arc> a = new ArrayList<Arc>();
        for (Range r : Range.complement(excluded)) a.add(new Arc(0, r, 1));
        return new RangeAutomaton(Arrays.asList(0, 1), Collections.singleton(0),
            Collections.singleton(1), a);
    }

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

    private int nextState() {
        int max = -1;
        for (int s : states) if (s > max) max = s;
        return max + 1;
    }

    public Set<Integer> epsilonClosure(int state) {
        if (epsilonClosure == null) {
            Set<Relations.Pair> eps = new LinkedHashSet<Relations.Pair>();
            for (Arc arc : arcs) if (arc.label == null) eps.add(new Relations.Pair(arc.from, arc.to));
            epsilonClosure = Relations.closureOf(states, eps);
        }
        Set<Integer> ret = epsilonClosure.get(state);
        return ret == null
                ? Collections.<Integer>emptySet()
                : Collections.unmodifiableSet(ret);
    }

    private Set<Integer> closure(Collection<Integer> set) {
        Set<Integer> ret = new LinkedHashSet<Integer>();
        for (int s : set) ret.addAll(epsilonClosure(s));
        return ret;
    }

    public boolean recognize(CharSequence word) {
        Set<Integer> current = closure(initial);
        for (int i = 0; i < word.length() && !current.isEmpty(); ++i) {
            char c = word.charAt(i);
            Set<Integer> next = new LinkedHashSet<Integer>();
            for (Arc arc : arcs) {
                if (arc.label != null && current.contains(arc.from) && arc.label.includes(c)) {
                    next.add(arc.to);
                }
            }
            current = closure(next);
        }
        return Misc.intersects(current, finals);
    }

    RangeAutomaton remap(int k) {
        List<Integer> s = new ArrayList<Integer>(), i = new ArrayList<Integer>(),
                f = new ArrayList<Integer>();
        for (int x : states) s.add(x + k);
        for (int x : initial) i.add(x + k);
        for (int x : finals) f.add(x + k);
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) a.add(new Arc(arc.from + k, arc.label, arc.to + k));
        return new RangeAutomaton(s, i, f, a);
    }

    public RangeAutomaton concat(RangeAutomaton... others) {
        RangeAutomaton ret = this;
        for (RangeAutomaton other : others) {
            RangeAutomaton second = other.remap(ret.nextState());
            Set<Integer> s = new LinkedHashSet<Integer>(ret.states);
            s.addAll(second.states);
            Set<Integer> i = new LinkedHashSet<Integer>(ret.initial);
            if (Misc.intersects(ret.initial, ret.finals)) i.addAll(second.initial);
            Set<Arc> a = new LinkedHashSet<Arc>(ret.arcs);
            a.addAll(second.arcs);
            for (int f : ret.finals) {
                for (int init : second.initial) a.add(new Arc(f, null, init));
            }
            ret = new RangeAutomaton(s, i, second.finals, a);
        }
        return ret;
    }

    public RangeAutomaton union(RangeAutomaton... others) {
        RangeAutomaton ret = this;
        for (RangeAutomaton other : others) {
            RangeAutomaton second = other.remap(ret.nextState());
            Set<Integer> s = new LinkedHashSet<Integer>(ret.states);
            s.addAll(second.states);
            Set<Integer> i = new LinkedHashSet<Integer>(ret.initial);
            i.addAll(second.initial);
            Set<Integer> f = new LinkedHashSet<Integer>(ret.finals);
            f.addAll(second.finals);
            Set<Arc> a = new LinkedHashSet<Arc>(ret.arcs);
            a.addAll(second.arcs);
            ret = new RangeAutomaton(s, i, f, a);
        }
        return ret;
    }

    public RangeAutomaton star() {
        return loop(true);
    }

    public RangeAutomaton plus() {
        return loop(false);
    }

    private RangeAutomaton loop(boolean nullable) {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        if (nullable) f.add(n);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        for (int i : initial) a.add(new Arc(n, null, i));
        for (int x : finals) a.add(new Arc(x, null, n));
        return new RangeAutomaton(s, Collections.singleton(n), f, a);
    }

    public RangeAutomaton option() {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        i.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        f.add(n);
        return new RangeAutomaton(s, i, f, arcs);
    }

    public RangeAutomaton epsilonFree() {
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            if (arc.label == null) continue;
            for (int to : epsilonClosure(arc.to)) a.add(new Arc(arc.from, arc.label, to));
        }
        return new RangeAutomaton(states, closure(initial), finals, a);
    }

    public RangeAutomaton trim() {
        Set<Relations.Pair> rel = new LinkedHashSet<Relations.Pair>();
        for (Arc arc : arcs) rel.add(new Relations.Pair(arc.from, arc.to));
        Map<Integer, Integer> index = new LinkedHashMap<Integer, Integer>();
        for (int s : Relations.useful(rel, initial, finals)) index.put(s, index.size());

        List<Integer> i = new ArrayList<Integer>(), f = new ArrayList<Integer>();
        for (int s : initial) if (index.containsKey(s)) i.add(index.get(s));
        for (int s : finals) if (index.containsKey(s)) f.add(index.get(s));
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) {
            if (index.containsKey(arc.from) && index.containsKey(arc.to)) {
                a.add(new Arc(index.get(arc.from), arc.label, index.get(arc.to)));
            }
        }
        return new RangeAutomaton(index.values(), i, f, a);
    }

    /**
     * Product of the epsilon free operands; arcs pair up where their ranges
     * overlap.
     */
    public RangeAutomaton intersect(RangeAutomaton other) {
        RangeAutomaton a1 = epsilonFree(), a2 = other.epsilonFree();
        Map<Integer, List<Arc>> from1 = a1.arcsByState(), from2 = a2.arcsByState();

        List<Relations.Pair> pairs = new ArrayList<Relations.Pair>();
        Map<Relations.Pair, Integer> index = new LinkedHashMap<Relations.Pair, Integer>();
        for (int i1 : a1.initial) {
            for (int i2 : a2.initial) {
                Relations.Pair p = new Relations.Pair(i1, i2);
                index.put(p, pairs.size());
                pairs.add(p);
            }
        }
        int initialCount = pairs.size();
        List<Arc> a = new ArrayList<Arc>();
        for (int n = 0; n < pairs.size(); ++n) {
            watchdog(pairs.size(), "range product");
            Relations.Pair p = pairs.get(n);
            if (!from1.containsKey(p.from) || !from2.containsKey(p.to)) continue;
            for (Arc t1 : from1.get(p.from)) {
                for (Arc t2 : from2.get(p.to)) {
                    Range r = t1.label.intersect(t2.label);
                    if (r == null) continue;
                    Relations.Pair q = new Relations.Pair(t1.to, t2.to);
                    Integer to = index.get(q);
                    if (to == null) {
                        index.put(q, to = pairs.size());
                        pairs.add(q);
                    }
                    a.add(new Arc(n, r, to));
                }
            }
        }
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < pairs.size(); ++n) {
            Relations.Pair p = pairs.get(n);
            if (a1.finals.contains(p.from) && a2.finals.contains(p.to)) f.add(n);
        }
        return new RangeAutomaton(Misc.range(0, pairs.size()), Misc.range(0, initialCount), f, a)
            .trim();
    }

    private Map<Integer, List<Arc>> arcsByState() {
        Map<Integer, List<Arc>> ret = new LinkedHashMap<Integer, List<Arc>>();
        for (Arc arc : arcs) {
            List<Arc> l = ret.get(arc.from);
            if (l == null) ret.put(arc.from, l = new ArrayList<Arc>());
            l.add(arc);
        }
        return ret;
    }

    /**
     * Subset construction over the elementary intervals delimited by the
     * range bounds: every range starts a new interval at its minimum and
     * ends one after its maximum.
     */
    public Deterministic determinize() {
        RangeAutomaton fsa = epsilonFree();
        TreeSet<Character> startPoints = new TreeSet<Character>();
        startPoints.add(Character.MIN_VALUE);
        for (Arc arc : fsa.arcs) {
            startPoints.add(arc.label.min);
            if (arc.label.max < Character.MAX_VALUE) startPoints.add((char) (arc.label.max + 1));
        }
        List<Character> points = new ArrayList<Character>(startPoints);
        Map<Integer, List<Arc>> byState = fsa.arcsByState();

        List<Set<Integer>> subsets = new ArrayList<Set<Integer>>();
        Map<Set<Integer>, Integer> index = new LinkedHashMap<Set<Integer>, Integer>();
        Set<Integer> init = new LinkedHashSet<Integer>(fsa.initial);
        subsets.add(init);
        index.put(init, 0);
        Map<Integer, List<Arc>> delta = new LinkedHashMap<Integer, List<Arc>>();

        for (int n = 0; n < subsets.size(); ++n) {
            watchdog(subsets.size(), "range subset construction");
            List<Arc> out = new ArrayList<Arc>();
            for (int i = 0; i < points.size(); ++i) {
                char c = points.get(i);
                Set<Integer> target = new LinkedHashSet<Integer>();
                for (int s : subsets.get(n)) {
                    List<Arc> l = byState.get(s);
                    if (l == null) continue;
                    for (Arc arc : l) if (arc.label.includes(c)) target.add(arc.to);
                }
                if (target.isEmpty()) continue;
                Integer to = index.get(target);
                if (to == null) {
                    index.put(target, to = subsets.size());
                    subsets.add(target);
                }
                char max = i + 1 < points.size()
                        ? (char) (points.get(i + 1) - 1)
                        : Character.MAX_VALUE;
                out.add(new Arc(n, new Range(c, max), to));
            }
            delta.put(n, out);
        }
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < subsets.size(); ++n) {
            if (Misc.intersects(subsets.get(n), fsa.finals)) f.add(n);
        }
        return new Deterministic(Misc.range(0, subsets.size()), 0, f, delta);
    }

    /**
     * @return the automaton of all words over the full char set not
     *         recognized by this automaton.
     */
    public RangeAutomaton complement() {
        return determinize().complement().toRangeAutomaton();
    }

    /**
     * Not available: a range arc has no single output symbol.
     *
     * @throws UnsupportedConstructException
     *             always.
     */
    public Transducer identity() {
        throw new UnsupportedConstructException(
            "identity transducer of a range automaton; expand ranges into symbols first");
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
