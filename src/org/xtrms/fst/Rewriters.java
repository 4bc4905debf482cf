/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles rewrite rules, given as transducers, into transducers rewriting
 * whole texts: optional rewriting, obligatory rewriting and obligatory
 * leftmost-longest match rewriting in the manner of Karttunen's "Directed
 * Replacement" (1996).
 * <p>
 * The leftmost-longest compiler works on the alphabet extended by three
 * marker symbols, which must not occur in the text alphabet.
 */
public final class Rewriters {

    private static final Logger logger = Logger.getLogger("org.xtrms.fst");
    private static final Level level = Level.FINER;

    private Rewriters() {
    } // never instantiated

    /**
     * The auxiliary symbols of the leftmost-longest compiler.
     */
    public static final class Markers {

        /**
         * U+0000, U+0002, U+0003.
         */
        public static final Markers DEFAULT = new Markers('\u0000', '\u0002', '\u0003');

        final char cb;
        final char lb;
        final char rb;

        /**
         * @param cb
         *            marks the beginning of a candidate match.
         * @param lb
         *            left bracket of a selected match.
         * @param rb
         *            right bracket of a selected match.
         */
        public Markers(char cb, char lb, char rb) {
            if (cb == lb || cb == rb || lb == rb) {
                throw new InvalidPatternException("markers must be distinct");
            }
            this.cb = cb;
            this.lb = lb;
            this.rb = rb;
        }

        Set<Character> asSet() {
            return new LinkedHashSet<Character>(Arrays.asList(cb, lb, rb));
        }
    }

    /**
     * Rewrites any number of non-overlapping occurrences of the rule's
     * domain, leaving everything else unchanged. The input itself is among
     * the outputs.
     */
    public static Transducer toOptionalRewriter(Transducer rule, Collection<Character> alphabet) {
        Transducer idAll = Automaton.all(alphabet).identity();
        return idAll.concat(rule.concat(idAll).star()).expand();
    }

    /**
     * Rewrites every occurrence of the rule's domain; text between
     * occurrences must not contain one. Overlapping occurrences give
     * several outputs.
     */
    public static Transducer toRewriter(Transducer rule, Collection<Character> alphabet) {
        Automaton all = Automaton.all(alphabet);
        Transducer notInDomain = all
            .difference(all.concat(rule.domain(), all))
            .identity()
            .option();
        return notInDomain.concat(rule.concat(notInDomain).star());
    }

    public static Transducer toLmlRewriter(Transducer rule, Collection<Character> alphabet) {
        return toLmlRewriter(rule, alphabet, Markers.DEFAULT);
    }

    /**
     * Obligatory leftmost-longest match rewriting: scanning from the left,
     * each match starts as early as possible and is the longest one starting
     * there. The result is functional whenever the rule is.
     *
     * @throws InvalidPatternException
     *             if a marker symbol belongs to <code>alphabet</code>.
     */
    public static Transducer toLmlRewriter(
            Transducer rule,
            Collection<Character> alphabet,
            Markers markers) {

        for (char m : markers.asSet()) {
            if (alphabet.contains(m)) {
                throw new InvalidPatternException("alphabet contains the marker symbol '"
                    + Misc.esc(String.valueOf(m)) + "'");
            }
        }
        return new Lml(rule, alphabet, markers).compile();
    }

    /*
     * the leftmost-longest construction; one instance per compilation
     */
    private static final class Lml {

        final Transducer rule;
        final Automaton domain;
        final Set<Character> alphabet;
        final Set<Character> allSymbols;
        final Automaton alphabetStar;
        final Automaton allStar;
        final Markers m;

        Lml(Transducer rule, Collection<Character> alphabet, Markers markers) {
            this.rule = rule;
            this.domain = rule.domain();
            this.alphabet = new LinkedHashSet<Character>(alphabet);
            this.allSymbols = new LinkedHashSet<Character>(alphabet);
            this.allSymbols.addAll(markers.asSet());
            this.alphabetStar = Automaton.all(this.alphabet).determinize().minimal().toAutomaton();
            this.allStar = Automaton.all(allSymbols).determinize().minimal().toAutomaton();
            this.m = markers;
        }

        Transducer compile() {
            Transducer initialMatch = intro(allSymbols, only(m.cb))
                .compose(liffR(Automaton.fromSymbol(m.cb),
                    xIgnore(domain, allSymbols, only(m.cb))).identity());

            Transducer leftToRight = alphabetStar.identity()
                .concat(
                    Transducer.fromWordPair(String.valueOf(m.cb), String.valueOf(m.lb)),
                    ignoreX(domain, allSymbols, only(m.cb)).identity(),
                    Transducer.fromWordPair("", String.valueOf(m.rb)))
                .star()
                .concat(alphabetStar.identity())
                .compose(toRewriter(Transducer.fromWordPair(String.valueOf(m.cb), ""), allSymbols));

            Set<Character> brackets = new LinkedHashSet<Character>(Arrays.asList(m.lb, m.rb));
            Automaton notLongest = contains(Automaton.fromSymbol(m.lb)
                .concat(ignoreX(domain, allSymbols, brackets)
                    .intersect(contains(Automaton.fromSymbol(m.rb)))));
            Transducer longestMatch = not(notLongest).identity();

            Transducer replacement = toRewriter(
                Transducer.fromWordPair(String.valueOf(m.lb), "")
                    .concat(rule, Transducer.fromWordPair(String.valueOf(m.rb), "")),
                allSymbols);

            Transducer ret = initialMatch.compose(leftToRight, longestMatch, replacement);
            if (logger.isLoggable(level)) {
                logger.log(level, "leftmost-longest rewriter: " + ret.size() + " states, "
                    + ret.arcs().size() + " arcs");
            }
            return ret;
        }

        /*
         * logic over the language of all words with markers
         */

        Automaton not(Automaton lang) {
            return allStar.difference(lang);
        }

        Automaton contains(Automaton lang) {
            return allStar.concat(lang, allStar);
        }

        /*
         * every prefix in p is followed by a suffix in s
         */
        Automaton ifPThenS(Automaton p, Automaton s) {
            return not(p.concat(not(s)));
        }

        /*
         * every suffix in s is preceded by a prefix in p
         */
        Automaton ifSThenP(Automaton p, Automaton s) {
            return not(not(p).concat(s));
        }

        Automaton pIffS(Automaton p, Automaton s) {
            return ifPThenS(p, s).intersect(ifSThenP(p, s));
        }

        /*
         * a position is preceded by a suffix in l iff followed by a prefix in r
         */
        Automaton liffR(Automaton l, Automaton r) {
            return pIffS(allStar.concat(l), r.concat(allStar));
        }
    }

    private static Set<Character> only(char c) {
        return Collections.singleton(c);
    }

    private static Set<Character> minus(Set<Character> alphabet, Set<Character> symbols) {
        Set<Character> ret = new LinkedHashSet<Character>(alphabet);
        ret.removeAll(symbols);
        return ret;
    }

    /**
     * Freely inserts symbols of <code>symbols</code> into words over the
     * rest of <code>alphabet</code>.
     */
    static Transducer intro(Set<Character> alphabet, Set<Character> symbols) {
        return Automaton.fromSymbolSet(minus(alphabet, symbols)).identity()
            .union(Automaton.fromEpsilon().cross(Automaton.fromSymbolSet(symbols)))
            .star();
    }

    /*
     * as intro, but no inserted symbol at the end
     */
    static Transducer introX(Set<Character> alphabet, Set<Character> symbols) {
        return intro(alphabet, symbols)
            .concat(Automaton.fromSymbolSet(minus(alphabet, symbols)).identity())
            .option();
    }

    /*
     * as intro, but no inserted symbol at the beginning
     */
    static Transducer xIntro(Set<Character> alphabet, Set<Character> symbols) {
        return Automaton.fromSymbolSet(minus(alphabet, symbols)).identity()
            .concat(intro(alphabet, symbols))
            .option();
    }

    /**
     * The words of <code>lang</code> with symbols of <code>symbols</code>
     * freely interspersed.
     */
    static Automaton ignore(Automaton lang, Set<Character> alphabet, Set<Character> symbols) {
        return lang.identity().compose(intro(alphabet, symbols)).range();
    }

    static Automaton ignoreX(Automaton lang, Set<Character> alphabet, Set<Character> symbols) {
        return lang.identity().compose(introX(alphabet, symbols)).range();
    }

    static Automaton xIgnore(Automaton lang, Set<Character> alphabet, Set<Character> symbols) {
        return lang.identity().compose(xIntro(alphabet, symbols)).range();
    }
}
