/*
 * @LICENSE@
 */

package org.xtrms.fst;

import static org.xtrms.fst.Misc.watchdog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the bimachine of a functional transducer.
 * <p>
 * The right automaton is the subset construction of the reversed real-time
 * transducer, started from its final states: a right state is the set of
 * transducer states from which the rest of the input can be accepted.
 * <p>
 * A left state is a subset of transducer states reachable on the input read
 * so far together with a <i>selector</i>, which maps each right state to one
 * transducer state of the subset lying on an accepting path through it.
 * Following the selector arc by arc fixes one successful path per input, so
 * the output of each step only depends on the (left, symbol, right) triple.
 */
final class BimachineBuilder {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    private final Transducer fst;
    private final Set<Character> alphabet;

    /*
     * (symbol, from) -> arcs of the real-time transducer
     */
    private final Map<List<Object>, List<Transducer.Arc>> arcsOn =
            new LinkedHashMap<List<Object>, List<Transducer.Arc>>();

    private final List<Set<Integer>> rightSubsets = new ArrayList<Set<Integer>>();
    private final Map<Integer, Map<Character, Integer>> rightDelta =
            new LinkedHashMap<Integer, Map<Character, Integer>>();

    /*
     * toR -> symbol -> fromR, the right transitions read backwards
     */
    private final Map<Integer, Map<Character, List<Integer>>> rightInto =
            new LinkedHashMap<Integer, Map<Character, List<Integer>>>();

    BimachineBuilder(Transducer fst, Collection<Character> alphabet) {
        this.fst = fst.toRealTime().transducer();
        this.alphabet = new TreeSet<Character>(alphabet);
    }

    Bimachine build() {
        for (Transducer.Arc arc : fst.arcs()) {
            List<Object> key = key(arc.in.charAt(0), arc.from);
            List<Transducer.Arc> l = arcsOn.get(key);
            if (l == null) arcsOn.put(key, l = new ArrayList<Transducer.Arc>());
            l.add(arc);
        }
        buildRight();

        List<Set<Integer>> leftSubsets = new ArrayList<Set<Integer>>();
        List<Map<Integer, Integer>> selectors = new ArrayList<Map<Integer, Integer>>();
        Map<List<Object>, Integer> leftIndex = new LinkedHashMap<List<Object>, Integer>();
        Map<Integer, Map<Character, Integer>> leftDelta =
                new LinkedHashMap<Integer, Map<Character, Integer>>();
        Map<Bimachine.Key, String> output = new LinkedHashMap<Bimachine.Key, String>();

        Map<Integer, Integer> initSelector = new TreeMap<Integer, Integer>();
        for (int r = 0; r < rightSubsets.size(); ++r) {
            for (int s : fst.initial()) {
                if (rightSubsets.get(r).contains(s)) {
                    initSelector.put(r, s);
                    break;
                }
            }
        }
        Set<Integer> init = new LinkedHashSet<Integer>(fst.initial());
        leftSubsets.add(init);
        selectors.add(initSelector);
        leftIndex.put(Arrays.<Object>asList(init, initSelector), 0);

        for (int k = 0; k < leftSubsets.size(); ++k) {
            watchdog(leftSubsets.size(), "bimachine left automaton");
            Map<Integer, Integer> selector = selectors.get(k);
            Map<Character, Integer> row = new TreeMap<Character, Integer>();

            for (char symbol : alphabet) {
                Set<Integer> target = new LinkedHashSet<Integer>();
                for (int s : leftSubsets.get(k)) {
                    for (Transducer.Arc arc : arcs(symbol, s)) target.add(arc.to);
                }
                if (target.isEmpty()) continue;

                Map<Integer, Integer> targetSelector = new TreeMap<Integer, Integer>();
                for (Map.Entry<Integer, Integer> e : selector.entrySet()) {
                    Map<Character, List<Integer>> into = rightInto.get(e.getKey());
                    List<Integer> froms = into == null ? null : into.get(symbol);
                    if (froms == null) continue;
                    for (int fromR : froms) {
                        Transducer.Arc chosen = null;
                        for (Transducer.Arc arc : arcs(symbol, e.getValue())) {
                            if (!rightSubsets.get(fromR).contains(arc.to)) continue;
                            if (chosen == null) {
                                chosen = arc;
                            } else if (chosen.to == arc.to && !chosen.out.equals(arc.out)) {
                                throw notFunctional(arc, chosen);
                            }
                        }
                        if (chosen == null) continue;
                        targetSelector.put(fromR, chosen.to);

                        Bimachine.Key key = new Bimachine.Key(k, symbol, fromR);
                        String prev = output.put(key, chosen.out);
                        if (prev != null && !prev.equals(chosen.out)) {
                            throw notFunctional(chosen, prev);
                        }
                    }
                }
                if (targetSelector.isEmpty()) continue;

                List<Object> id = Arrays.<Object>asList(target, targetSelector);
                Integer to = leftIndex.get(id);
                if (to == null) {
                    leftIndex.put(id, to = leftSubsets.size());
                    leftSubsets.add(target);
                    selectors.add(targetSelector);
                }
                row.put(symbol, to);
            }
            leftDelta.put(k, row);
        }

        Dfa left = new Dfa(Misc.range(0, leftSubsets.size()), 0,
            new TreeSet<Integer>(), leftDelta);
        Dfa right = new Dfa(Misc.range(0, rightSubsets.size()), 0,
            new TreeSet<Integer>(), rightDelta);
        if (logger.isLoggable(level)) {
            logger.log(level, "bimachine: " + left.size() + " left states, "
                + right.size() + " right states, " + output.size() + " outputs");
        }
        return new Bimachine(left, right, output);
    }

    private void buildRight() {
        Map<Integer, List<Transducer.Arc>> arcsInto = new LinkedHashMap<Integer, List<Transducer.Arc>>();
        for (Transducer.Arc arc : fst.arcs()) {
            List<Transducer.Arc> l = arcsInto.get(arc.to);
            if (l == null) arcsInto.put(arc.to, l = new ArrayList<Transducer.Arc>());
            l.add(arc);
        }

        Map<Set<Integer>, Integer> index = new LinkedHashMap<Set<Integer>, Integer>();
        Set<Integer> init = new LinkedHashSet<Integer>(fst.finals());
        rightSubsets.add(init);
        index.put(init, 0);

        for (int n = 0; n < rightSubsets.size(); ++n) {
            watchdog(rightSubsets.size(), "bimachine right automaton");
            SortedMap<Character, Set<Integer>> bySymbol = new TreeMap<Character, Set<Integer>>();
            for (int s : rightSubsets.get(n)) {
                List<Transducer.Arc> l = arcsInto.get(s);
                if (l == null) continue;
                for (Transducer.Arc arc : l) {
                    char c = arc.in.charAt(0);
                    Set<Integer> from = bySymbol.get(c);
                    if (from == null) bySymbol.put(c, from = new LinkedHashSet<Integer>());
                    from.add(arc.from);
                }
            }
            Map<Character, Integer> row = new TreeMap<Character, Integer>();
            for (Map.Entry<Character, Set<Integer>> e : bySymbol.entrySet()) {
                Integer to = index.get(e.getValue());
                if (to == null) {
                    index.put(e.getValue(), to = rightSubsets.size());
                    rightSubsets.add(e.getValue());
                }
                row.put(e.getKey(), to);

                Map<Character, List<Integer>> into = rightInto.get(to);
                if (into == null) rightInto.put(to, into = new TreeMap<Character, List<Integer>>());
                List<Integer> froms = into.get(e.getKey());
                if (froms == null) into.put(e.getKey(), froms = new ArrayList<Integer>());
                froms.add(n);
            }
            rightDelta.put(n, row);
        }
    }

    private static List<Object> key(char symbol, int from) {
        return Arrays.<Object>asList(symbol, from);
    }

    private List<Transducer.Arc> arcs(char symbol, int from) {
        List<Transducer.Arc> ret = arcsOn.get(key(symbol, from));
        return ret == null ? new ArrayList<Transducer.Arc>() : ret;
    }

    private static IllegalArgumentException notFunctional(Transducer.Arc arc, Object other) {
        return new IllegalArgumentException("transducer is not functional: "
            + arc + " conflicts with " + other);
    }
}
