/*
 * @LICENSE@
 */

package org.xtrms.fst;

import static org.xtrms.fst.Misc.LS;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
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
 * A classical bimachine: a left automaton read forwards, a right automaton
 * read backwards, and an output function on (left state, symbol, right
 * state) triples. The right automaton first runs over the whole input from
 * its end; the left automaton then walks the input from its start, writing
 * for each symbol the output of its own state, the symbol, and the right
 * state reached on the rest of the input after that symbol.
 * <p>
 * Runs in time linear in the input and is deterministic: one output per
 * accepted input. Built by {@link Transducer#toBimachine(java.util.Collection)}.
 */
public final class Bimachine {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    /**
     * Argument of the output function.
     */
    public static final class Key {

        final int left;
        final char symbol;
        final int right;

        public Key(int left, char symbol, int right) {
            this.left = left;
            this.symbol = symbol;
            this.right = right;
        }

        public int left() {
            return left;
        }

        public char symbol() {
            return symbol;
        }

        public int right() {
            return right;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + left;
            result = prime * result + symbol;
            result = prime * result + right;
            return result;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return left == k.left && symbol == k.symbol && right == k.right;
        }

        @Override
        public String toString() {
            return "(" + left + ", '" + Misc.esc(String.valueOf(symbol)) + "', " + right + ")";
        }
    }

    /**
     * Outcome of {@link Bimachine#process(CharSequence)}: either the output,
     * or the position where the input was rejected.
     */
    public static final class Result {

        private final String output;
        private final int position;

        private Result(String output, int position) {
            this.output = output;
            this.position = position;
        }

        static Result accepted(String output) {
            return new Result(output, -1);
        }

        static Result rejected(int position) {
            return new Result(null, position);
        }

        public boolean isAccepted() {
            return output != null;
        }

        /**
         * @throws IllegalStateException
         *             if the input was rejected.
         */
        public String output() {
            if (output == null) {
                throw new IllegalStateException("input rejected at " + position);
            }
            return output;
        }

        /**
         * @return index of the offending symbol (the input length if the
         *         input ended too early), or -1 if accepted.
         */
        public int position() {
            return position;
        }

        @Override
        public String toString() {
            return output != null
                    ? "accepted: \"" + Misc.esc(output) + '"'
                    : "rejected at " + position;
        }
    }

    private final Dfa left;
    private final Dfa right;
    private final Map<Key, String> output;

    public Bimachine(Dfa left, Dfa right, Map<Key, String> output) {
        this.left = left;
        this.right = right;
        this.output = Collections.unmodifiableMap(new LinkedHashMap<Key, String>(output));
    }

    public Dfa left() {
        return left;
    }

    public Dfa right() {
        return right;
    }

    public Map<Key, String> output() {
        return output;
    }

    /**
     * @return the output for <code>input</code>, or the rejection position.
     *         The empty input is always accepted with the empty output.
     */
    public Result process(CharSequence input) {
        StringBuilder sb = new StringBuilder();
        int pos;
        try {
            pos = run(input, sb);
        } catch (IOException e) {
            throw new IllegalStateException(e); // StringBuilder never throws
        }
        return pos < 0 ? Result.accepted(sb.toString()) : Result.rejected(pos);
    }

    /**
     * Like {@link #process(CharSequence)} but throws on rejection.
     *
     * @throws UnrecognizedInputException
     *             if the input is rejected.
     */
    public String rewrite(CharSequence input) {
        Result r = process(input);
        if (!r.isAccepted()) throw new UnrecognizedInputException(input, r.position());
        return r.output();
    }

    /**
     * Streams the output into <code>sink</code> symbol by symbol, in input
     * order. On rejection the sink holds the output of the accepted prefix.
     *
     * @return true iff the input was accepted.
     */
    public boolean process(CharSequence input, Appendable sink) throws IOException {
        return run(input, sink) < 0;
    }

    /*
     * -1 if accepted, otherwise the rejected position
     */
    private int run(CharSequence input, Appendable sink) throws IOException {
        int n = input.length();
        List<Integer> rPath = right.pathRightToLeft(input);
        if (rPath.size() != n + 1) return n - rPath.size();

        int state = left.initial();
        for (int i = 0; i < n; ++i) {
            char c = input.charAt(i);
            String out = output.get(new Key(state, c, rPath.get(n - 1 - i)));
            if (out == null) return i;
            sink.append(out);

            Integer next = left.next(state, c);
            if (next == null) {
                logger.log(Level.SEVERE, "no left transition from " + state + " on '"
                    + Misc.esc(String.valueOf(c)) + "' at " + i + " despite an output");
                throw new MalformedBimachineException("missing left transition "
                    + new Key(state, c, rPath.get(n - 1 - i)));
            }
            state = next;
        }
        return -1;
    }

    /**
     * Merges left states with equal output profiles and equal futures, and
     * likewise right states, then rebuilds the output function on the
     * classes.
     */
    public Bimachine pseudoMinimal() {
        Map<Integer, Set<List<Object>>> leftProfiles = new LinkedHashMap<Integer, Set<List<Object>>>();
        Map<Integer, Set<List<Object>>> rightProfiles = new LinkedHashMap<Integer, Set<List<Object>>>();
        for (Map.Entry<Key, String> e : output.entrySet()) {
            Key k = e.getKey();
            profile(leftProfiles, k.left).add(Arrays.<Object>asList(k.symbol, k.right, e.getValue()));
            profile(rightProfiles, k.right).add(Arrays.<Object>asList(k.symbol, k.left, e.getValue()));
        }

        Map<Integer, Integer> leftEq = equivalence(left, leftProfiles, left.alphabet());
        Map<Integer, Integer> rightEq = equivalence(right, rightProfiles, right.alphabet());

        Map<Key, String> o = new LinkedHashMap<Key, String>();
        for (Map.Entry<Key, String> e : output.entrySet()) {
            Key k = e.getKey();
            o.put(new Key(leftEq.get(k.left), k.symbol, rightEq.get(k.right)), e.getValue());
        }
        Bimachine ret = new Bimachine(quotient(left, leftEq), quotient(right, rightEq), o);
        if (logger.isLoggable(level)) {
            logger.log(level, "bimachine minimized to " + ret.left.size() + " left, "
                + ret.right.size() + " right states");
        }
        return ret;
    }

    private static Set<List<Object>> profile(Map<Integer, Set<List<Object>>> profiles, int state) {
        Set<List<Object>> p = profiles.get(state);
        if (p == null) profiles.put(state, p = new HashSet<List<Object>>());
        return p;
    }

    private static Map<Integer, Integer> equivalence(
            final Dfa dfa,
            final Map<Integer, Set<List<Object>>> profiles,
            Set<Character> alphabet) {

        Map<Integer, Integer> seed = Relations.kernel(dfa.states(),
            new Relations.Classifier<Set<List<Object>>>() {
                public Set<List<Object>> classify(int state) {
                    Set<List<Object>> p = profiles.get(state);
                    return p == null ? Collections.<List<Object>>emptySet() : p;
                }
            });
        return Relations.refine(dfa.states(), seed, alphabet,
            new Relations.Successor<Character>() {
                public Integer next(int state, Character label) {
                    return dfa.next(state, label);
                }
            });
    }

    private static Dfa quotient(Dfa dfa, Map<Integer, Integer> eq) {
        Map<Integer, Map<Character, Integer>> d = new LinkedHashMap<Integer, Map<Character, Integer>>();
        for (int s : dfa.states()) {
            SortedMap<Character, Integer> row = dfa.transitions(s);
            if (row.isEmpty()) continue;
            Map<Character, Integer> r = d.get(eq.get(s));
            if (r == null) d.put(eq.get(s), r = new TreeMap<Character, Integer>());
            for (Map.Entry<Character, Integer> t : row.entrySet()) {
                r.put(t.getKey(), eq.get(t.getValue()));
            }
        }
        return new Dfa(new LinkedHashSet<Integer>(eq.values()), eq.get(dfa.initial()),
            new ArrayList<Integer>(), d);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("left:").append(LS).append(left)
          .append("right:").append(LS).append(right)
          .append("output: ").append(output).append(LS);
        return sb.toString();
    }
}
