/*
 * @LICENSE@
 */

package org.xtrms.fst.test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import org.xtrms.fst.AbstractFstTestCase;
import org.xtrms.fst.Automaton;
import org.xtrms.fst.Bimachine;
import org.xtrms.fst.Dfa;
import org.xtrms.fst.MalformedBimachineException;
import org.xtrms.fst.Transducer;
import org.xtrms.fst.UnrecognizedInputException;

public class BimachineTestCase extends AbstractFstTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(BimachineTestCase.class);
    }

    public BimachineTestCase(String name) {
        super(name);
    }

    private Bimachine ab;

    protected void setUp() throws Exception {
        super.setUp();
        Transducer fst = new Transducer(states(0, 1, 2), states(0), states(2), Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(1, "b", "y", 2)));
        ab = fst.toBimachine(chars("ab")).pseudoMinimal();
    }

    public void testConstruction() {
        assertEquals(3, ab.left().size());
        assertEquals(3, ab.right().size());
        assertEquals(2, ab.left().transitionCount());
        assertEquals(2, ab.right().transitionCount());
        assertEquals(2, ab.output().size());
        logDot(ab.left().toDot("left"));
        logDot(ab.right().toDot("right"));
    }

    public void testProcess() {
        assertEquals("xy", ab.process("ab").output());

        Bimachine.Result r = ab.process("a");
        assertFalse(r.isAccepted());
        assertEquals(0, r.position());

        r = ab.process("abb");
        assertFalse(r.isAccepted());
        assertEquals(1, r.position());
        try {
            r.output();
            fail("output of a rejected input");
        } catch (IllegalStateException e) {
            logger.fine(r.toString());
        }
    }

    public void testEmptyInput() {
        assertEquals("", ab.rewrite(""));
    }

    public void testRewrite() {
        assertEquals("xy", ab.rewrite("ab"));
        try {
            ab.rewrite("abb");
            fail("rejected input rewritten");
        } catch (UnrecognizedInputException e) {
            assertEquals(1, e.position());
        }
        try {
            ab.rewrite("ac");
            fail("foreign symbol rewritten");
        } catch (UnrecognizedInputException e) {
            logger.fine(e.getMessage());
        }
    }

    public void testStreaming() throws IOException {
        StringBuilder sb = new StringBuilder();
        assertTrue(ab.process("ab", sb));
        assertEquals("xy", sb.toString());

        sb.setLength(0);
        assertFalse(ab.process("aab", sb));
    }

    public void testShortAndLongAlternatives() {
        // { (a, x), (ab, yyyy) }
        Transducer fst = new Transducer(states(0, 1, 2, 3), states(0), states(1, 3), Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(0, "a", "yyyy", 2),
            new Transducer.Arc(2, "b", "", 3)));
        Bimachine bm = fst.toBimachine(chars("ab")).pseudoMinimal();

        assertEquals("x", bm.rewrite("a"));
        assertEquals("yyyy", bm.rewrite("ab"));
        assertFalse(bm.process("aa").isAccepted());
        assertFalse(bm.process("abb").isAccepted());
    }

    public void testDecisionAtTheEnd() {
        // (a:a)* | (a:)* b:b
        Transducer fst = Transducer.fromWordPair("a", "a").star().union(
            Transducer.fromWordPair("a", "").star().concat(Transducer.fromWordPair("b", "b")));
        Bimachine bm = fst.toBimachine(chars("ab")).pseudoMinimal();

        assertEquals("b", bm.rewrite("aab"));
        assertEquals("aa", bm.rewrite("aa"));
        assertEquals("b", bm.rewrite("aaaaaab"));
        assertEquals("b", bm.rewrite("b"));
        assertFalse(bm.process("aba").isAccepted());
    }

    public void testAgreesWithTransducer() {
        Transducer fst = Transducer.fromWordPair("ab", "X")
            .union(Automaton.fromSymbolSet(chars("abc")).identity())
            .star();
        Bimachine bm = fst.toBimachine(chars("abc"));
        // the relation is not functional; only inputs with one output agree
        for (String w : Arrays.asList("", "c", "cc", "a", "ba", "ca")) {
            assertEquals(w, fst.process(w), Collections.singleton(bm.rewrite(w)));
        }
    }

    public void testNotFunctional() {
        Transducer fst = new Transducer(states(0, 1), states(0), states(1), Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(0, "a", "y", 1)));
        try {
            fst.toBimachine(chars("a"));
            fail("non-functional transducer accepted");
        } catch (IllegalArgumentException e) {
            logger.fine(e.getMessage());
        }
    }

    public void testMalformed() {
        Dfa left = new Dfa(states(0), 0, states(), Collections.<Automaton.Arc>emptyList());
        Dfa right = new Dfa(states(0, 1), 0, states(),
            Collections.singleton(new Automaton.Arc(0, "a", 1)));
        Map<Bimachine.Key, String> output = Collections.singletonMap(new Bimachine.Key(0, 'a', 0), "x");
        Bimachine bm = new Bimachine(left, right, output);
        try {
            bm.process("a");
            fail("missing left transition not detected");
        } catch (MalformedBimachineException e) {
            logger.fine(e.getMessage());
        }
    }
}
