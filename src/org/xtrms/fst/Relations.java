/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binary relations over states and equivalence relations ("kernels") used
 * for epsilon closures, trimming and partition refinement.
 * <p>
 * An equivalence relation is represented as a map from state to class index.
 * Class indices are dense and assigned in order of first appearance.
 */
final class Relations {

    private Relations() {
    } // never instantiated

    /**
     * An ordered pair of states.
     */
    static final class Pair {

        final int from;
        final int to;

        Pair(int from, int to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public int hashCode() {
            return 31 * from + to;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Pair)) return false;
            Pair p = (Pair) o;
            return from == p.from && to == p.to;
        }

        @Override
        public String toString() {
            return "(" + from + "," + to + ")";
        }
    }

    /**
     * Maps a state to the value it is classified by. Values must implement
     * equals() and hashCode().
     */
    interface Classifier<K> {
        K classify(int state);
    }

    /**
     * Transition function consulted during refinement; <code>null</code>
     * means "no transition".
     */
    interface Successor<L> {
        Integer next(int state, L label);
    }

    /**
     * Transitive closure of <code>rel</code>, computed by appending newly
     * composed pairs to a worklist until no new pair appears.
     */
    static Set<Pair> transitiveClosure(Set<Pair> rel) {
        Map<Integer, List<Integer>> byFrom = new LinkedHashMap<Integer, List<Integer>>();
        for (Pair p : rel) {
            List<Integer> tos = byFrom.get(p.from);
            if (tos == null) byFrom.put(p.from, tos = new ArrayList<Integer>());
            tos.add(p.to);
        }
        List<Pair> closure = new ArrayList<Pair>(rel);
        Set<Pair> seen = new LinkedHashSet<Pair>(rel);
        for (int n = 0; n < closure.size(); ++n) {
            Pair p = closure.get(n);
            List<Integer> tos = byFrom.get(p.to);
            if (tos == null) continue;
            for (int to : tos) {
                Pair q = new Pair(p.from, to);
                if (seen.add(q)) closure.add(q);
            }
        }
        return seen;
    }

    /**
     * Reflexive transitive closure of <code>rel</code> over
     * <code>states</code>, grouped by source state.
     */
    static Map<Integer, Set<Integer>> closureOf(Collection<Integer> states, Set<Pair> rel) {
        Map<Integer, Set<Integer>> ret = new LinkedHashMap<Integer, Set<Integer>>();
        for (int s : states) {
            Set<Integer> self = new LinkedHashSet<Integer>();
            self.add(s);
            ret.put(s, self);
        }
        for (Pair p : transitiveClosure(rel)) {
            Set<Integer> tos = ret.get(p.from);
            if (tos == null) ret.put(p.from, tos = new LinkedHashSet<Integer>());
            tos.add(p.to);
        }
        return ret;
    }

    /**
     * States reachable from <code>from</code> and co-reachable to
     * <code>to</code> along <code>rel</code>, in ascending order.
     */
    static List<Integer> useful(Set<Pair> rel, Collection<Integer> from, Collection<Integer> to) {
        Set<Pair> closure = transitiveClosure(rel);
        Set<Integer> reachable = new HashSet<Integer>(from);
        Set<Integer> coreachable = new HashSet<Integer>(to);
        for (Pair p : closure) {
            if (from.contains(p.from)) reachable.add(p.to);
            if (to.contains(p.to)) coreachable.add(p.from);
        }
        reachable.retainAll(coreachable);
        Integer[] sorted = reachable.toArray(new Integer[reachable.size()]);
        Arrays.sort(sorted);
        return Arrays.asList(sorted);
    }

    /**
     * The kernel of <code>classifier</code>: states with equal classifier
     * values share a class index.
     */
    static <K> Map<Integer, Integer> kernel(Collection<Integer> states, Classifier<K> classifier) {
        Map<K, Integer> index = new LinkedHashMap<K, Integer>();
        Map<Integer, Integer> ret = new LinkedHashMap<Integer, Integer>();
        for (int s : states) {
            K k = classifier.classify(s);
            Integer i = index.get(k);
            if (i == null) index.put(k, i = index.size());
            ret.put(s, i);
        }
        return ret;
    }

    /**
     * The common refinement of two equivalence relations.
     */
    static Map<Integer, Integer> intersect(
            Collection<Integer> states,
            final Map<Integer, Integer> r1,
            final Map<Integer, Integer> r2) {

        return kernel(states, new Classifier<Pair>() {
            public Pair classify(int state) {
                return new Pair(r1.get(state), r2.get(state));
            }
        });
    }

    static int classCount(Map<Integer, Integer> rel) {
        return new HashSet<Integer>(rel.values()).size();
    }

    /**
     * Moore style partition refinement. Starting from <code>seed</code>, a
     * class is split whenever two of its states reach different classes (or
     * one reaches none) on some label. Stops when the number of classes
     * stops growing.
     */
    static <L> Map<Integer, Integer> refine(
            final Collection<Integer> states,
            Map<Integer, Integer> seed,
            Collection<L> labels,
            final Successor<L> delta) {

        Map<Integer, Integer> eq = seed;
        int prev = 0;
        while (!labels.isEmpty() && prev < classCount(eq)) {
            final Map<Integer, Integer> current = eq;
            Map<Integer, Integer> next = null;
            for (final L label : labels) {
                Map<Integer, Integer> k = kernel(states, new Classifier<Integer>() {
                    public Integer classify(int state) {
                        Integer to = delta.next(state, label);
                        return to == null ? -1 : current.get(to);
                    }
                });
                next = next == null ? k : intersect(states, next, k);
            }
            prev = classCount(eq);
            eq = intersect(states, eq, next);
        }
        return eq;
    }
}
