/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.Arrays;
import java.util.Collections;

public class AutomatonTestCase extends AbstractFstTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AutomatonTestCase.class);
    }

    public AutomatonTestCase(String name) {
        super(name);
    }

    private static final String[] SAMPLES = {
        "", "a", "b", "ab", "ba", "aa", "bb", "abb", "aab", "bab", "abab", "babb", "aaaa"
    };

    private static void assertSameLanguage(Automaton expected, Automaton actual) {
        for (String w : SAMPLES) {
            assertEquals("on \"" + w + "\"", expected.recognize(w), actual.recognize(w));
        }
    }

    public void testFromEpsilon() {
        Automaton fsa = Automaton.fromEpsilon();
        assertEquals(1, fsa.size());
        assertTrue(fsa.recognize(""));
        assertFalse(fsa.recognize("a"));
    }

    public void testFromWord() {
        Automaton fsa = Automaton.fromWord("abc");
        assertEquals(4, fsa.size());
        assertTrue(fsa.recognize("abc"));
        assertFalse(fsa.recognize(""));
        assertFalse(fsa.recognize("ab"));
        assertFalse(fsa.recognize("abca"));
    }

    public void testFromSymbolSet() {
        Automaton fsa = Automaton.fromSymbolSet(chars("abc"));
        assertEquals(2, fsa.size());
        assertTrue(fsa.recognize("a"));
        assertTrue(fsa.recognize("b"));
        assertTrue(fsa.recognize("c"));
        assertFalse(fsa.recognize("d"));
        assertFalse(fsa.recognize("ab"));
        assertFalse(fsa.recognize(""));
    }

    public void testAll() {
        Automaton fsa = Automaton.all(chars("ab"));
        assertTrue(fsa.recognize(""));
        assertTrue(fsa.recognize("abba"));
        assertFalse(fsa.recognize("abc"));
    }

    public void testDanglingArcRejected() {
        try {
            new Automaton(states(0), states(0), states(0),
                Collections.singleton(new Automaton.Arc(0, "a", 1)));
            fail("accepted an arc to an unknown state");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testConcat() {
        Automaton fsa = Automaton.fromWord("abc").concat(Automaton.fromWord("de"));
        assertEquals(7, fsa.size());
        assertEquals(1, fsa.initial().size());
        assertEquals(1, fsa.finals().size());
        assertTrue(fsa.recognize("abcde"));
        assertFalse(fsa.recognize("abc"));
        assertFalse(fsa.recognize("de"));
        assertFalse(fsa.recognize(""));
    }

    public void testConcatMultiple() {
        Automaton fsa = Automaton.fromWord("ab").concat(
            Automaton.fromWord("cde"), Automaton.fromWord("f").star());
        assertTrue(fsa.recognize("abcde"));
        assertTrue(fsa.recognize("abcdef"));
        assertTrue(fsa.recognize("abcdefffffff"));
        assertFalse(fsa.recognize("abcdff"));
    }

    public void testConcatNullableFirst() {
        Automaton fsa = Automaton.fromWord("a").option().concat(Automaton.fromWord("b"));
        assertTrue(fsa.recognize("b"));
        assertTrue(fsa.recognize("ab"));
        assertFalse(fsa.recognize("a"));
    }

    public void testUnion() {
        Automaton fsa = Automaton.fromWord("abc").union(Automaton.fromWord("de"));
        assertEquals(7, fsa.size());
        assertEquals(2, fsa.initial().size());
        assertEquals(2, fsa.finals().size());
        assertTrue(fsa.recognize("abc"));
        assertTrue(fsa.recognize("de"));
        assertFalse(fsa.recognize("abcde"));
        assertFalse(fsa.recognize(""));
    }

    public void testUnionEpsilon() {
        Automaton fsa = Automaton.fromWord("abc").union(Automaton.fromEpsilon());
        assertEquals(5, fsa.size());
        assertTrue(fsa.recognize(""));
        assertTrue(fsa.recognize("abc"));
        assertFalse(fsa.recognize("a"));
    }

    public void testStar() {
        Automaton fsa = Automaton.fromWord("a").star();
        assertEquals(3, fsa.size());
        assertEquals(1, fsa.initial().size());
        assertEquals(2, fsa.finals().size());
        for (String w : Arrays.asList("", "a", "aa", "aaaaaaaa")) assertTrue(w, fsa.recognize(w));
        assertFalse(fsa.recognize("ab"));
    }

    public void testStarOfUnion() {
        Automaton fsa = Automaton.fromWord("ab").union(Automaton.fromWord("c")).star();
        assertTrue(fsa.recognize(""));
        assertTrue(fsa.recognize("abcab"));
        assertTrue(fsa.recognize("ccc"));
        assertFalse(fsa.recognize("abca"));
    }

    public void testPlus() {
        Automaton fsa = Automaton.fromWord("ab").plus();
        assertFalse(fsa.recognize(""));
        assertTrue(fsa.recognize("ab"));
        assertTrue(fsa.recognize("ababab"));
        assertFalse(fsa.recognize("aba"));
    }

    public void testOption() {
        Automaton fsa = Automaton.fromWord("abc").option();
        assertTrue(fsa.recognize(""));
        assertTrue(fsa.recognize("abc"));
        assertFalse(fsa.recognize("ab"));
    }

    public void testEpsilonFree() {
        Automaton fsa = Automaton.fromWord("a").star().concat(Automaton.fromWord("b").option());
        Automaton free = fsa.epsilonFree();
        for (Automaton.Arc arc : free.arcs()) assertFalse(arc.toString(), arc.label().isEmpty());
        assertSameLanguage(fsa, free);
    }

    public void testTrim() {
        Automaton fsa = new Automaton(states(0, 1, 2, 3, 4), states(0), states(2),
            Arrays.asList(
                new Automaton.Arc(0, "a", 1),
                new Automaton.Arc(1, "b", 2),
                new Automaton.Arc(0, "c", 3),
                new Automaton.Arc(4, "d", 2)));
        Automaton trimmed = fsa.trim();
        assertEquals(3, trimmed.size());
        assertEquals(2, trimmed.arcs().size());
        assertTrue(trimmed.recognize("ab"));
        assertFalse(trimmed.recognize("c"));
    }

    public void testTrimIdempotent() {
        Automaton fsa = Automaton.fromWord("ab").union(Automaton.fromWord("c").star()).trim();
        Automaton again = fsa.trim();
        assertEquals(fsa.states(), again.states());
        assertEquals(fsa.arcs(), again.arcs());
        assertEquals(fsa.initial(), again.initial());
        assertEquals(fsa.finals(), again.finals());
    }

    public void testTrimEmptyLanguage() {
        Automaton fsa = new Automaton(states(0, 1), states(0), states(1),
            Collections.<Automaton.Arc>emptyList());
        assertEquals(0, fsa.trim().size());
    }

    public void testWordLabels() {
        Automaton fsa = new Automaton(states(0, 1), states(0), states(1),
            Collections.singleton(new Automaton.Arc(0, "abc", 1)));
        assertTrue(fsa.recognize("abc"));
        assertFalse(fsa.recognize("ab"));

        Automaton expanded = fsa.expand();
        assertEquals(4, expanded.size());
        for (Automaton.Arc arc : expanded.arcs()) assertEquals(1, arc.label().length());
        assertTrue(expanded.recognize("abc"));
    }

    public void testDeterminize() {
        Automaton fsa = Automaton.fromWord("ab").union(
            Automaton.fromWord("ac"), Automaton.fromWord("a").star());
        Dfa dfa = fsa.determinize();
        assertSameLanguage(fsa, dfa.toAutomaton());
        assertTrue(dfa.recognize("ac"));
        assertTrue(dfa.recognize("aaa"));
        assertFalse(dfa.recognize("abc"));
    }

    public void testDeterminizeIsDeterministic() {
        Automaton fsa = Automaton.all(chars("ab")).concat(Automaton.fromWord("abb"));
        Dfa dfa = fsa.determinize();
        for (int s : dfa.states()) {
            for (char c : dfa.transitions(s).keySet()) {
                int n = 0;
                for (Automaton.Arc arc : dfa.arcs()) {
                    if (arc.from() == s && arc.label().charAt(0) == c) ++n;
                }
                assertEquals(1, n);
            }
        }
        assertSameLanguage(fsa, dfa.toAutomaton());
    }

    public void testIntersect() {
        Automaton all = Automaton.all(chars("ab"));
        Automaton hasA = all.concat(Automaton.fromSymbol('a'), all);
        Automaton hasB = all.concat(Automaton.fromSymbol('b'), all);
        Automaton both = hasA.intersect(hasB);
        assertTrue(both.recognize("ab"));
        assertTrue(both.recognize("bba"));
        assertFalse(both.recognize("aa"));
        assertFalse(both.recognize(""));
    }

    public void testDifference() {
        Automaton all = Automaton.all(chars("ab"));
        Automaton noAa = all.difference(all.concat(Automaton.fromWord("aa"), all));
        assertTrue(noAa.recognize(""));
        assertTrue(noAa.recognize("aba"));
        assertTrue(noAa.recognize("bbb"));
        assertFalse(noAa.recognize("aab"));
        assertFalse(noAa.recognize("baa"));
    }

    public void testDifferenceWithForeignSymbols() {
        Automaton ab = Automaton.fromWord("ab").union(Automaton.fromWord("cd"));
        Automaton diff = ab.difference(Automaton.fromWord("cd"));
        assertTrue(diff.recognize("ab"));
        assertFalse(diff.recognize("cd"));
    }

    public void testIdentity() {
        Transducer id = Automaton.fromWord("ab").star().identity();
        assertEquals(words("abab"), id.process("abab"));
        assertTrue(id.process("aba").isEmpty());
    }

    public void testCross() {
        Transducer t = Automaton.fromWord("ab").cross(Automaton.fromWord("x"));
        assertEquals(words("x"), t.process("ab"));
        assertTrue(t.process("a").isEmpty());

        Transducer erase = Automaton.fromSymbol('a').plus().cross(Automaton.fromEpsilon());
        assertEquals(words(""), erase.process("aaa"));
    }

    public void testToDot() {
        String dot = Automaton.fromWord("ab").option().toDot("ab?");
        logDot(dot);
        assertTrue(dot.startsWith("digraph"));
        assertTrue(dot.contains("doublecircle"));
    }
}
