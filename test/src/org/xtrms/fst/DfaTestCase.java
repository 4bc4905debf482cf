/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class DfaTestCase extends AbstractFstTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(DfaTestCase.class);
    }

    public DfaTestCase(String name) {
        super(name);
    }

    private Dfa ba;

    protected void setUp() throws Exception {
        super.setUp();
        // recognizes "ba"
        ba = new Dfa(states(0, 1, 2), 0, states(2), Arrays.asList(
            new Automaton.Arc(0, "b", 1),
            new Automaton.Arc(1, "a", 2)));
    }

    public void testRecognize() {
        assertTrue(ba.recognize("ba"));
        assertFalse(ba.recognize("b"));
        assertFalse(ba.recognize("bab"));
        assertFalse(ba.recognize(""));
        assertEquals(Integer.valueOf(1), ba.next(0, 'b'));
        assertNull(ba.next(0, 'a'));
    }

    public void testNondeterministicArcsRejected() {
        try {
            new Dfa(states(0, 1, 2), 0, states(2), Arrays.asList(
                new Automaton.Arc(0, "a", 1),
                new Automaton.Arc(0, "a", 2)));
            fail("accepted two arcs on one symbol");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testWordArcRejected() {
        try {
            new Dfa(states(0, 1), 0, states(1),
                Collections.singleton(new Automaton.Arc(0, "ab", 1)));
            fail("accepted a word label");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testPathRightToLeft() {
        // the word is read from its end: "ab" feeds 'b' then 'a'
        assertEquals(Arrays.asList(0, 1, 2), ba.pathRightToLeft("ab"));
        assertEquals(Arrays.asList(0), ba.pathRightToLeft(""));
        List<Integer> stuck = ba.pathRightToLeft("bb");
        assertEquals(Arrays.asList(0, 1), stuck);
    }

    public void testTrim() {
        Dfa dfa = new Dfa(states(0, 1, 2, 3), 0, states(2), Arrays.asList(
            new Automaton.Arc(0, "a", 1),
            new Automaton.Arc(1, "b", 2),
            new Automaton.Arc(0, "c", 3)));
        Dfa trimmed = dfa.trim();
        assertEquals(3, trimmed.size());
        assertEquals(0, trimmed.initial());
        assertEquals(2, trimmed.transitionCount());
        assertTrue(trimmed.recognize("ab"));
        assertFalse(trimmed.recognize("c"));
    }

    public void testTrimUselessInitial() {
        Dfa dfa = new Dfa(states(0, 1), 0, Collections.<Integer>emptySet(),
            Collections.singleton(new Automaton.Arc(0, "a", 1)));
        Dfa trimmed = dfa.trim();
        assertEquals(1, trimmed.size());
        assertTrue(trimmed.finals().isEmpty());
        assertEquals(0, trimmed.transitionCount());
    }

    public void testMinimal() {
        Automaton all = Automaton.all(chars("ab"));
        Dfa dfa = all.concat(Automaton.fromWord("abb")).determinize();
        Dfa min = dfa.minimal();
        assertEquals(4, min.size());
        for (String w : Arrays.asList("abb", "aabb", "babb", "ab", "abba", "")) {
            assertEquals(w, dfa.recognize(w), min.recognize(w));
        }
        assertEquals(min.size(), min.minimal().size());
    }

    public void testMinimalMergesEquivalentBranches() {
        Dfa dfa = new Dfa(states(0, 1, 2, 3), 0, states(3), Arrays.asList(
            new Automaton.Arc(0, "a", 1),
            new Automaton.Arc(0, "b", 2),
            new Automaton.Arc(1, "c", 3),
            new Automaton.Arc(2, "c", 3)));
        Dfa min = dfa.minimal();
        assertEquals(3, min.size());
        assertTrue(min.recognize("ac"));
        assertTrue(min.recognize("bc"));
    }

    public void testIntersect() {
        Dfa evenA = new Dfa(states(0, 1), 0, states(0), Arrays.asList(
            new Automaton.Arc(0, "a", 1),
            new Automaton.Arc(1, "a", 0),
            new Automaton.Arc(0, "b", 0),
            new Automaton.Arc(1, "b", 1)));
        Dfa endsB = Automaton.all(chars("ab")).concat(Automaton.fromSymbol('b')).determinize();
        Dfa both = evenA.intersect(endsB);
        assertTrue(both.recognize("aab"));
        assertTrue(both.recognize("b"));
        assertFalse(both.recognize("ab"));
        assertFalse(both.recognize("aa"));
    }

    public void testDifference() {
        Dfa all = Automaton.all(chars("ab")).determinize();
        Dfa diff = all.difference(ba);
        assertFalse(diff.recognize("ba"));
        assertTrue(diff.recognize("b"));
        assertTrue(diff.recognize(""));
        assertTrue(diff.recognize("bab"));
    }

    public void testDifferenceOfEqualLanguagesIsEmpty() {
        Dfa diff = ba.difference(ba);
        assertTrue(diff.finals().isEmpty());
        assertEquals(1, diff.size());
    }

    public void testAlphabet() {
        assertEquals(chars("ab"), ba.alphabet());
    }

    public void testToDot() {
        String dot = ba.toDot("ba");
        logDot(dot);
        assertTrue(dot.contains("s0 -> s1"));
    }
}
