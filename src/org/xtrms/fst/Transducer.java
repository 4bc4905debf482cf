/*
 * @LICENSE@
 */

package org.xtrms.fst;

import static org.xtrms.fst.Misc.LS;
import static org.xtrms.fst.Misc.watchdog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
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
 * An immutable finite state transducer. Each arc reads an input word and
 * writes an output word; either may be empty or longer than one symbol.
 * Arcs with both labels empty are epsilon moves.
 */
public final class Transducer {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    /**
     * A transition reading <code>in</code> and writing <code>out</code>.
     */
    public static final class Arc {

        final int from;
        final String in;
        final String out;
        final int to;

        public Arc(int from, String in, String out, int to) {
            if (in == null) throw new NullPointerException("in");
            if (out == null) throw new NullPointerException("out");
            this.from = from;
            this.in = in;
            this.out = out;
            this.to = to;
        }

        public int from() {
            return from;
        }

        public String in() {
            return in;
        }

        public String out() {
            return out;
        }

        public int to() {
            return to;
        }

        boolean isEpsilon() {
            return in.isEmpty() && out.isEmpty();
        }

        Label label() {
            return new Label(in, out);
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + from;
            result = prime * result + in.hashCode();
            result = prime * result + out.hashCode();
            result = prime * result + to;
            return result;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            final Arc arc = (Arc) o;
            return from == arc.from && to == arc.to
                && in.equals(arc.in) && out.equals(arc.out);
        }

        @Override
        public String toString() {
            if (s != null) return s;
            return s = "(" + from + ", \"" + Misc.esc(in) + "\":\""
                + Misc.esc(out) + "\", " + to + ")";
        }
        private String s;
    }

    /*
     * (in, out) treated as one letter by pseudoDeterminize/pseudoMinimal
     */
    static final class Label implements Comparable<Label> {

        final String in;
        final String out;

        Label(String in, String out) {
            this.in = in;
            this.out = out;
        }

        public int compareTo(Label o) {
            int c = in.compareTo(o.in);
            return c != 0 ? c : out.compareTo(o.out);
        }

        @Override
        public int hashCode() {
            return 31 * in.hashCode() + out.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Label)) return false;
            Label l = (Label) o;
            return in.equals(l.in) && out.equals(l.out);
        }

        @Override
        public String toString() {
            return in + ":" + out;
        }
    }

    /**
     * A real-time transducer plus the outputs of the empty input, which a
     * real-time transducer cannot express by itself.
     */
    public static final class RealTime {

        private final Transducer transducer;
        private final Set<String> epsilonOutputs;

        RealTime(Transducer transducer, Set<String> epsilonOutputs) {
            this.transducer = transducer;
            this.epsilonOutputs = Collections.unmodifiableSet(epsilonOutputs);
        }

        public Transducer transducer() {
            return transducer;
        }

        public Set<String> epsilonOutputs() {
            return epsilonOutputs;
        }
    }

    private final Set<Integer> states;
    private final Set<Integer> initial;
    private final Set<Integer> finals;
    private final Set<Arc> arcs;

    private Map<Integer, List<Arc>> arcsFrom;

    /**
     * @throws IllegalArgumentException
     *             if an initial, final or arc end state is not in
     *             <code>states</code>.
     */
    public Transducer(
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

    /**
     * @return a two state transducer mapping <code>in</code> to
     *         <code>out</code> with a single arc.
     */
    public static Transducer fromWordPair(String in, String out) {
        return new Transducer(
            Arrays.asList(0, 1),
            Collections.singleton(0),
            Collections.singleton(1),
            Collections.singleton(new Arc(0, in, out, 1)));
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

    public int size() {
        return states.size();
    }

    int nextState() {
        int max = -1;
        for (int s : states) if (s > max) max = s;
        return max + 1;
    }

    private List<Arc> arcsFrom(int state) {
        if (arcsFrom == null) {
            Map<Integer, List<Arc>> index = new LinkedHashMap<Integer, List<Arc>>();
            for (Arc arc : arcs) {
                List<Arc> l = index.get(arc.from);
                if (l == null) index.put(arc.from, l = new ArrayList<Arc>());
                l.add(arc);
            }
            arcsFrom = index;
        }
        List<Arc> ret = arcsFrom.get(state);
        return ret == null ? Collections.<Arc>emptyList() : ret;
    }

    /**
     * @return true iff every arc reads exactly one symbol.
     */
    public boolean isRealTime() {
        for (Arc arc : arcs) if (arc.in.length() != 1) return false;
        return true;
    }

    /*
     * regular operations, mirroring Automaton
     */

    Transducer remap(int k) {
        List<Integer> s = new ArrayList<Integer>(), i = new ArrayList<Integer>(),
                f = new ArrayList<Integer>();
        for (int x : states) s.add(x + k);
        for (int x : initial) i.add(x + k);
        for (int x : finals) f.add(x + k);
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) a.add(new Arc(arc.from + k, arc.in, arc.out, arc.to + k));
        return new Transducer(s, i, f, a);
    }

    public Transducer union(Transducer... others) {
        Transducer ret = this;
        for (Transducer other : others) ret = ret.union(other);
        return ret;
    }

    public Transducer union(Transducer other) {
        Transducer second = other.remap(nextState());

        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.addAll(second.states);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        i.addAll(second.initial);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        f.addAll(second.finals);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        a.addAll(second.arcs);
        return new Transducer(s, i, f, a);
    }

    public Transducer concat(Transducer... others) {
        Transducer ret = this;
        for (Transducer other : others) ret = ret.concat(other);
        return ret;
    }

    public Transducer concat(Transducer other) {
        Transducer second = other.remap(nextState());

        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.addAll(second.states);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        a.addAll(second.arcs);
        for (int f : finals) {
            for (int init : second.initial) a.add(new Arc(f, "", "", init));
        }
        return new Transducer(s, initial, second.finals, a);
    }

    public Transducer star() {
        return loop(true);
    }

    public Transducer plus() {
        return loop(false);
    }

    private Transducer loop(boolean nullable) {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        if (nullable) f.add(n);
        Set<Arc> a = new LinkedHashSet<Arc>(arcs);
        for (int i : initial) a.add(new Arc(n, "", "", i));
        for (int x : finals) a.add(new Arc(x, "", "", n));
        return new Transducer(s, Collections.singleton(n), f, a);
    }

    public Transducer option() {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        s.add(n);
        Set<Integer> i = new LinkedHashSet<Integer>(initial);
        i.add(n);
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        f.add(n);
        return new Transducer(s, i, f, arcs);
    }

    /*
     * projections
     */

    /**
     * @return the automaton of the input side.
     */
    public Automaton domain() {
        List<Automaton.Arc> a = new ArrayList<Automaton.Arc>();
        for (Arc arc : arcs) a.add(new Automaton.Arc(arc.from, arc.in, arc.to));
        return new Automaton(states, initial, finals, a);
    }

    /**
     * @return the automaton of the output side.
     */
    public Automaton range() {
        List<Automaton.Arc> a = new ArrayList<Automaton.Arc>();
        for (Arc arc : arcs) a.add(new Automaton.Arc(arc.from, arc.out, arc.to));
        return new Automaton(states, initial, finals, a);
    }

    public Transducer inverse() {
        List<Arc> a = new ArrayList<Arc>();
        for (Arc arc : arcs) a.add(new Arc(arc.from, arc.out, arc.in, arc.to));
        return new Transducer(states, initial, finals, a);
    }

    /*
     * normal forms
     */

    private Map<Integer, Set<Integer>> epsilonClosure() {
        Set<Relations.Pair> eps = new LinkedHashSet<Relations.Pair>();
        for (Arc arc : arcs) {
            if (arc.isEpsilon()) eps.add(new Relations.Pair(arc.from, arc.to));
        }
        return Relations.closureOf(states, eps);
    }

    /**
     * Removes the arcs whose labels are both empty.
     */
    public Transducer epsilonFree() {
        Map<Integer, Set<Integer>> closure = epsilonClosure();
        Set<Integer> i = new LinkedHashSet<Integer>();
        for (int s : initial) i.addAll(closure.get(s));
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            if (arc.isEpsilon()) continue;
            for (int to : closure.get(arc.to)) a.add(new Arc(arc.from, arc.in, arc.out, to));
        }
        return new Transducer(states, i, finals, a);
    }

    /**
     * Removes useless states and renumbers the rest densely from 0.
     */
    public Transducer trim() {
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
                a.add(new Arc(index.get(arc.from), arc.in, arc.out, index.get(arc.to)));
            }
        }
        return new Transducer(index.values(), i, f, a);
    }

    /**
     * Splits every arc into a chain of arcs reading and writing at most one
     * symbol each. The shorter label is padded with empty symbols at the
     * end.
     */
    public Transducer expand() {
        int n = nextState();
        Set<Integer> s = new LinkedHashSet<Integer>(states);
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            int len = Math.max(arc.in.length(), arc.out.length());
            if (len <= 1) {
                a.add(arc);
                continue;
            }
            int from = arc.from;
            for (int i = 0; i < len; ++i) {
                int to = i == len - 1 ? arc.to : n++;
                s.add(to);
                a.add(new Arc(from, symbol(arc.in, i), symbol(arc.out, i), to));
                from = to;
            }
        }
        return new Transducer(s, initial, finals, a);
    }

    private static String symbol(String word, int i) {
        return i < word.length() ? String.valueOf(word.charAt(i)) : "";
    }

    /**
     * Subset construction treating each (in, out) pair as a letter. The
     * relation is preserved; the result need not be functional.
     */
    public Transducer pseudoDeterminize() {
        Transducer fst = epsilonFree();

        List<Set<Integer>> subsets = new ArrayList<Set<Integer>>();
        Map<Set<Integer>, Integer> index = new LinkedHashMap<Set<Integer>, Integer>();
        Set<Integer> init = new LinkedHashSet<Integer>(fst.initial);
        subsets.add(init);
        index.put(init, 0);
        List<Arc> a = new ArrayList<Arc>();

        for (int n = 0; n < subsets.size(); ++n) {
            watchdog(subsets.size(), "pseudo-determinization");
            SortedMap<Label, Set<Integer>> byLabel = new TreeMap<Label, Set<Integer>>();
            for (int s : subsets.get(n)) {
                for (Arc arc : fst.arcsFrom(s)) {
                    Set<Integer> target = byLabel.get(arc.label());
                    if (target == null) byLabel.put(arc.label(), target = new LinkedHashSet<Integer>());
                    target.add(arc.to);
                }
            }
            for (Map.Entry<Label, Set<Integer>> e : byLabel.entrySet()) {
                Integer to = index.get(e.getValue());
                if (to == null) {
                    index.put(e.getValue(), to = subsets.size());
                    subsets.add(e.getValue());
                }
                a.add(new Arc(n, e.getKey().in, e.getKey().out, to));
            }
        }
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < subsets.size(); ++n) {
            if (Misc.intersects(subsets.get(n), fst.finals)) f.add(n);
        }
        return new Transducer(Misc.range(0, subsets.size()), Collections.singleton(0), f, a);
    }

    /**
     * {@link #pseudoDeterminize()} followed by refinement of the final
     * kernel over the (in, out) letters, quotient and trim.
     */
    public Transducer pseudoMinimal() {
        final Transducer det = pseudoDeterminize();

        final Map<Integer, Map<Label, Integer>> delta = new LinkedHashMap<Integer, Map<Label, Integer>>();
        Set<Label> labels = new LinkedHashSet<Label>();
        for (Arc arc : det.arcs) {
            Map<Label, Integer> row = delta.get(arc.from);
            if (row == null) delta.put(arc.from, row = new LinkedHashMap<Label, Integer>());
            row.put(arc.label(), arc.to);
            labels.add(arc.label());
        }
        Map<Integer, Integer> seed = Relations.kernel(det.states, new Relations.Classifier<Boolean>() {
            public Boolean classify(int state) {
                return det.finals.contains(state);
            }
        });
        Map<Integer, Integer> eq = Relations.refine(det.states, seed, labels,
            new Relations.Successor<Label>() {
                public Integer next(int state, Label label) {
                    Map<Label, Integer> row = delta.get(state);
                    return row == null ? null : row.get(label);
                }
            });

        Set<Integer> i = new LinkedHashSet<Integer>(), f = new LinkedHashSet<Integer>();
        for (int s : det.initial) i.add(eq.get(s));
        for (int s : det.finals) f.add(eq.get(s));
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : det.arcs) a.add(new Arc(eq.get(arc.from), arc.in, arc.out, eq.get(arc.to)));
        return new Transducer(new LinkedHashSet<Integer>(eq.values()), i, f, a).trim();
    }

    /*
     * composition
     */

    public Transducer compose(Transducer... others) {
        Transducer ret = this;
        for (Transducer other : others) ret = ret.compose(other);
        return ret;
    }

    /**
     * Relational composition: <code>x</code> maps to <code>z</code> iff this
     * transducer maps <code>x</code> to some <code>y</code> that
     * <code>other</code> maps to <code>z</code>. Both operands are expanded
     * and pseudo-minimized; empty self loops on every state let either side
     * wait while the other moves.
     */
    public Transducer compose(Transducer other) {
        Transducer first = expand().pseudoMinimal();
        Transducer second = other.expand().pseudoMinimal();
        Map<Integer, List<Arc>> firstFrom = withStays(first);
        Map<Integer, List<Arc>> secondFrom = withStays(second);

        List<Relations.Pair> pairs = new ArrayList<Relations.Pair>();
        Map<Relations.Pair, Integer> index = new LinkedHashMap<Relations.Pair, Integer>();
        for (int i1 : first.initial) {
            for (int i2 : second.initial) {
                Relations.Pair p = new Relations.Pair(i1, i2);
                index.put(p, pairs.size());
                pairs.add(p);
            }
        }
        int initialCount = pairs.size();
        Set<Arc> a = new LinkedHashSet<Arc>();
        for (int n = 0; n < pairs.size(); ++n) {
            watchdog(pairs.size(), "composition");
            Relations.Pair p = pairs.get(n);
            for (Arc a1 : firstFrom.get(p.from)) {
                for (Arc a2 : secondFrom.get(p.to)) {
                    if (!a1.out.equals(a2.in)) continue;
                    Relations.Pair q = new Relations.Pair(a1.to, a2.to);
                    Integer to = index.get(q);
                    if (to == null) {
                        index.put(q, to = pairs.size());
                        pairs.add(q);
                    }
                    a.add(new Arc(n, a1.in, a2.out, to));
                }
            }
        }
        List<Integer> f = new ArrayList<Integer>();
        for (int n = 0; n < pairs.size(); ++n) {
            Relations.Pair p = pairs.get(n);
            if (first.finals.contains(p.from) && second.finals.contains(p.to)) f.add(n);
        }
        Transducer ret = new Transducer(Misc.range(0, pairs.size()),
            Misc.range(0, initialCount), f, a).epsilonFree().trim();
        if (logger.isLoggable(level)) {
            logger.log(level, "composed " + first.size() + " x " + second.size()
                + " states into " + ret.size());
        }
        return ret;
    }

    private static Map<Integer, List<Arc>> withStays(Transducer t) {
        Map<Integer, List<Arc>> ret = new LinkedHashMap<Integer, List<Arc>>();
        for (int s : t.states) {
            List<Arc> l = new ArrayList<Arc>();
            l.add(new Arc(s, "", "", s));
            ret.put(s, l);
        }
        for (Arc arc : t.arcs) ret.get(arc.from).add(arc);
        return ret;
    }

    /*
     * real-time form
     */

    /**
     * Trims, removes epsilons, expands, and finally removes the arcs with
     * empty input by folding their output into the neighboring arcs.
     *
     * @throws InfiniteAmbiguityException
     *             if a cycle of empty-input arcs writes output, i.e. some
     *             input has infinitely many outputs.
     */
    public RealTime toRealTime() {
        return trim().epsilonFree().expand().removeUpperEpsilon();
    }

    /*
     * (from, to, output) along a path of empty-input arcs
     */
    private static final class Walk {
        final int from;
        final int to;
        final String out;

        Walk(int from, int to, String out) {
            this.from = from;
            this.to = to;
            this.out = out;
        }

        @Override
        public int hashCode() {
            return (31 * from + to) * 31 + out.hashCode();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Walk)) return false;
            Walk w = (Walk) o;
            return from == w.from && to == w.to && out.equals(w.out);
        }
    }

    private RealTime removeUpperEpsilon() {
        Map<Integer, List<Arc>> upper = new LinkedHashMap<Integer, List<Arc>>();
        List<Walk> closure = new ArrayList<Walk>();
        Set<Walk> seen = new HashSet<Walk>();
        for (Arc arc : arcs) {
            if (!arc.in.isEmpty()) continue;
            List<Arc> l = upper.get(arc.from);
            if (l == null) upper.put(arc.from, l = new ArrayList<Arc>());
            l.add(arc);
            Walk w = new Walk(arc.from, arc.to, arc.out);
            if (seen.add(w)) closure.add(w);
        }
        for (int n = 0; n < closure.size(); ++n) {
            watchdog(closure.size(), "epsilon closure");
            Walk w = closure.get(n);
            if (w.from == w.to && !w.out.isEmpty()) {
                logger.log(Level.SEVERE, "empty input cycle at state " + w.from
                    + " writes \"" + Misc.esc(w.out) + "\"");
                throw new InfiniteAmbiguityException(w.from, w.out);
            }
            List<Arc> next = upper.get(w.to);
            if (next == null) continue;
            for (Arc arc : next) {
                Walk v = new Walk(w.from, arc.to, w.out + arc.out);
                if (seen.add(v)) closure.add(v);
            }
        }
        for (int s : states) {
            Walk w = new Walk(s, s, "");
            if (seen.add(w)) closure.add(w);
        }

        Set<String> epsilonOutputs = new LinkedHashSet<String>();
        Set<Integer> f = new LinkedHashSet<Integer>(finals);
        Map<Integer, List<Walk>> walksFrom = new LinkedHashMap<Integer, List<Walk>>();
        Map<Integer, List<Walk>> walksTo = new LinkedHashMap<Integer, List<Walk>>();
        for (Walk w : closure) {
            if (initial.contains(w.from) && finals.contains(w.to)) {
                epsilonOutputs.add(w.out);
                f.add(w.from);
            }
            List<Walk> l = walksFrom.get(w.from);
            if (l == null) walksFrom.put(w.from, l = new ArrayList<Walk>());
            l.add(w);
            l = walksTo.get(w.to);
            if (l == null) walksTo.put(w.to, l = new ArrayList<Walk>());
            l.add(w);
        }

        Set<Arc> a = new LinkedHashSet<Arc>();
        for (Arc arc : arcs) {
            if (arc.in.isEmpty()) continue;
            for (Walk inc : walksTo.get(arc.from)) {
                for (Walk outg : walksFrom.get(arc.to)) {
                    a.add(new Arc(inc.from, arc.in, inc.out + arc.out + outg.out, outg.to));
                }
            }
        }
        return new RealTime(new Transducer(states, initial, f, a), epsilonOutputs);
    }

    /*
     * application
     */

    /**
     * Applies the transducer to <code>word</code>, one char per input
     * symbol. Word labels are expanded first.
     *
     * @return every distinct output, possibly none.
     * @throws InfiniteAmbiguityException
     *             if the search meets a cycle of empty-input arcs that
     *             writes output.
     */
    public Set<String> process(CharSequence word) {
        for (Arc arc : arcs) {
            if (arc.in.length() > 1) return expand().process(word);
        }
        List<String> tokens = new ArrayList<String>(word.length());
        for (int i = 0; i < word.length(); ++i) tokens.add(String.valueOf(word.charAt(i)));
        return process(tokens);
    }

    /*
     * the states met on the current run of empty-input arcs, innermost first
     */
    private static final class Trail {
        final int state;
        final int outLength;
        final Trail prev;

        Trail(int state, int outLength, Trail prev) {
            this.state = state;
            this.outLength = outLength;
            this.prev = prev;
        }
    }

    private static final class Frame {
        final int state;
        final int index;
        final String out;
        final Trail trail;

        Frame(int state, int index, String out, Trail trail) {
            this.state = state;
            this.index = index;
            this.out = out;
            this.trail = trail;
        }
    }

    /**
     * Applies the transducer to a sequence of input labels; an arc matches
     * a token when its input label equals it.
     */
    public Set<String> process(List<String> tokens) {
        Set<String> ret = new LinkedHashSet<String>();
        Set<List<Object>> visited = new HashSet<List<Object>>();
        Deque<Frame> stack = new ArrayDeque<Frame>();
        for (int s : initial) stack.push(new Frame(s, 0, "", new Trail(s, 0, null)));

        while (!stack.isEmpty()) {
            Frame fr = stack.pop();
            if (!visited.add(Arrays.<Object>asList(fr.state, fr.index, fr.out))) continue;

            if (fr.index == tokens.size() && finals.contains(fr.state)) ret.add(fr.out);

            for (Arc arc : arcsFrom(fr.state)) {
                if (arc.in.isEmpty()) {
                    String out = fr.out + arc.out;
                    Trail t = fr.trail;
                    while (t != null && t.state != arc.to) t = t.prev;
                    if (t != null) {
                        if (out.length() > t.outLength) {
                            throw new InfiniteAmbiguityException(arc.to, out.substring(t.outLength));
                        }
                        continue;
                    }
                    stack.push(new Frame(arc.to, fr.index, out,
                        new Trail(arc.to, out.length(), fr.trail)));
                } else if (fr.index < tokens.size() && arc.in.equals(tokens.get(fr.index))) {
                    String out = fr.out + arc.out;
                    stack.push(new Frame(arc.to, fr.index + 1, out,
                        new Trail(arc.to, out.length(), null)));
                }
            }
        }
        return ret;
    }

    /**
     * Builds the bimachine of this transducer, which must be functional.
     *
     * @param alphabet
     *            the input symbols the bimachine's left automaton is
     *            defined on.
     */
    public Bimachine toBimachine(Collection<Character> alphabet) {
        return new BimachineBuilder(this, alphabet).build();
    }

    /**
     * @return Graphviz source; for debugging only.
     */
    public String toDot(String name) {
        Dot dot = new Dot(name, initial, finals);
        for (int s : states) dot.state(s);
        for (Arc arc : arcs) dot.arc(arc.from, arc.to, arc.in + ":" + arc.out);
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
