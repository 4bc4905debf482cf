/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class TransducerTestCase extends AbstractFstTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(TransducerTestCase.class);
    }

    public TransducerTestCase(String name) {
        super(name);
    }

    private List<Transducer.Arc> arcs;

    protected void setUp() throws Exception {
        super.setUp();
        arcs = new ArrayList<Transducer.Arc>(Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(0, "a", "y", 2),
            new Transducer.Arc(1, "b", "y", 3),
            new Transducer.Arc(2, "c", "z", 2)));
    }

    private Transducer sample() {
        return new Transducer(states(0, 1, 2, 3), states(0), states(2, 3), arcs);
    }

    public void testProcess() {
        Transducer fst = sample();
        assertEquals(words("xy"), fst.process("ab"));
        assertEquals(words("y"), fst.process("a"));
        assertEquals(words("yzzzz"), fst.process("acccc"));
        assertTrue(fst.process("b").isEmpty());
        assertTrue(fst.process("").isEmpty());
    }

    public void testProcessWithEmptyInputArc() {
        arcs.add(new Transducer.Arc(2, "", "E", 1));
        Transducer fst = sample();
        assertEquals(words("xy", "yEy"), fst.process("ab"));
        assertEquals(words("yzzzEy"), fst.process("acccb"));
    }

    public void testProcessTokens() {
        Transducer fst = new Transducer(states(0, 1), states(0), states(1),
            Arrays.asList(new Transducer.Arc(0, "if", "IF", 1)));
        assertEquals(words("IF"), fst.process(Arrays.asList("if")));
        assertEquals(words("IF"), fst.process("if"));
        assertTrue(fst.process(Arrays.asList("i", "f")).isEmpty());
    }

    public void testInfiniteAmbiguity() {
        Transducer fst = new Transducer(states(0, 1, 2), states(0), states(2), Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(1, "", "y", 2),
            new Transducer.Arc(2, "", "y", 1)));
        try {
            fst.toRealTime();
            fail("empty input cycle with output not detected");
        } catch (InfiniteAmbiguityException e) {
            // expected
        }
        try {
            fst.process("a");
            fail("empty input cycle with output not detected");
        } catch (InfiniteAmbiguityException e) {
            // expected
        }
    }

    public void testSilentEmptyCycleIsFine() {
        Transducer fst = new Transducer(states(0, 1, 2), states(0), states(2), Arrays.asList(
            new Transducer.Arc(0, "a", "x", 1),
            new Transducer.Arc(1, "", "", 2),
            new Transducer.Arc(2, "", "", 1)));
        assertEquals(words("x"), fst.process("a"));
        assertEquals(words("x"), fst.toRealTime().transducer().process("a"));
    }

    public void testFromWordPair() {
        Transducer fst = Transducer.fromWordPair("abc", "x");
        assertEquals(2, fst.size());
        assertEquals(words("x"), fst.process("abc"));
        assertTrue(fst.process("ab").isEmpty());
    }

    public void testUnion() {
        Transducer fst = Transducer.fromWordPair("a", "b").union(Transducer.fromWordPair("c", "d"));
        assertEquals(4, fst.size());
        assertEquals(2, fst.initial().size());
        assertEquals(words("b"), fst.process("a"));
        assertEquals(words("d"), fst.process("c"));
    }

    public void testConcat() {
        Transducer fst = Transducer.fromWordPair("a", "x").concat(
            Transducer.fromWordPair("b", "y"), Transducer.fromWordPair("", "z"));
        assertEquals(words("xyz"), fst.process("ab"));
        assertTrue(fst.process("a").isEmpty());
    }

    public void testStar() {
        Transducer fst = Transducer.fromWordPair("a", "x").union(Transducer.fromWordPair("b", "yy")).star();
        assertEquals(5, fst.size());
        assertEquals(1, fst.initial().size());
        assertEquals(3, fst.finals().size());
        assertEquals(6, fst.arcs().size());
        assertEquals(words(""), fst.process(""));
        assertEquals(words("xyyx"), fst.process("aba"));
    }

    public void testPlusAndOption() {
        Transducer plus = Transducer.fromWordPair("a", "x").plus();
        assertTrue(plus.process("").isEmpty());
        assertEquals(words("xxx"), plus.process("aaa"));

        Transducer option = Transducer.fromWordPair("a", "x").option();
        assertEquals(words(""), option.process(""));
        assertEquals(words("x"), option.process("a"));
        assertTrue(option.process("aa").isEmpty());
    }

    public void testProjections() {
        Transducer fst = sample();
        assertTrue(fst.domain().recognize("acc"));
        assertFalse(fst.domain().recognize("xz"));
        assertTrue(fst.range().recognize("yzz"));
        assertEquals(words("ab"), fst.inverse().process("xy"));
    }

    public void testExpand() {
        Transducer fst = Transducer.fromWordPair("abc", "xy").expand();
        assertEquals(4, fst.size());
        for (Transducer.Arc arc : fst.arcs()) {
            assertTrue(arc.in().length() <= 1 && arc.out().length() <= 1);
        }
        assertEquals(words("xy"), fst.process("abc"));
    }

    public void testEpsilonFree() {
        Transducer fst = Transducer.fromWordPair("a", "x").star().epsilonFree();
        for (Transducer.Arc arc : fst.arcs()) {
            assertFalse(arc.in().isEmpty() && arc.out().isEmpty());
        }
        assertEquals(words("xx"), fst.process("aa"));
    }

    public void testTrim() {
        arcs.add(new Transducer.Arc(3, "d", "w", 4));
        Transducer fst = new Transducer(states(0, 1, 2, 3, 4, 5), states(0), states(2, 3), arcs);
        Transducer trimmed = fst.trim();
        assertEquals(4, trimmed.size());
        assertEquals(4, trimmed.arcs().size());
    }

    public void testPseudoMinimal() {
        Transducer fst = Transducer.fromWordPair("a", "x").union(Transducer.fromWordPair("a", "x"));
        Transducer min = fst.pseudoMinimal();
        assertEquals(2, min.size());
        assertEquals(1, min.arcs().size());
        assertEquals(1, min.pseudoDeterminize().initial().size());
        assertEquals(words("x"), min.process("a"));
    }

    public void testCompose() {
        Transducer fst = Transducer.fromWordPair("a", "b").compose(Transducer.fromWordPair("b", "c"));
        assertEquals(words("c"), fst.process("a"));

        Transducer none = Transducer.fromWordPair("a", "b").compose(Transducer.fromWordPair("c", "d"));
        assertTrue(none.process("a").isEmpty());
    }

    public void testComposeWordsAndEmptyLabels() {
        Transducer first = Transducer.fromWordPair("ab", "xyz");
        Transducer second = Transducer.fromWordPair("x", "").concat(Transducer.fromWordPair("yz", "Q"));
        assertEquals(words("Q"), first.compose(second).process("ab"));
    }

    public void testComposeStars() {
        Transducer t1 = Transducer.fromWordPair("a", "b").star();
        Transducer t2 = Transducer.fromWordPair("b", "c").star();
        Transducer fst = t1.compose(t2);
        assertEquals(words("ccc"), fst.process("aaa"));
        assertEquals(words(""), fst.process(""));
    }

    public void testComposeAssociative() {
        Transducer t1 = Transducer.fromWordPair("a", "b").union(Transducer.fromWordPair("a", "c")).star();
        Transducer t2 = Transducer.fromWordPair("b", "d").union(Transducer.fromWordPair("c", "dd")).star();
        Transducer t3 = Transducer.fromWordPair("d", "e").star();
        Transducer left = t1.compose(t2).compose(t3);
        Transducer right = t1.compose(t2.compose(t3));
        for (String w : Arrays.asList("", "a", "aa", "aaa", "b")) {
            assertEquals(w, left.process(w), right.process(w));
        }
        assertEquals(words("ee", "eee", "eeee"), left.process("aa"));
    }

    public void testToRealTime() {
        Transducer fst = Transducer.fromWordPair("", "x").concat(Transducer.fromWordPair("a", "y"));
        Transducer.RealTime rt = fst.toRealTime();
        assertTrue(rt.transducer().isRealTime());
        assertFalse(fst.isRealTime());
        assertTrue(rt.epsilonOutputs().isEmpty());
        assertEquals(words("xy"), rt.transducer().process("a"));
    }

    public void testToRealTimeEpsilonOutputs() {
        Transducer.RealTime rt = Transducer.fromWordPair("", "x").toRealTime();
        assertEquals(words("x"), rt.epsilonOutputs());
        assertTrue(rt.transducer().process("").contains(""));
    }

    public void testToRealTimeTrailingOutput() {
        Transducer fst = Transducer.fromWordPair("a", "y").concat(Transducer.fromWordPair("", "z"));
        Transducer.RealTime rt = fst.toRealTime();
        assertTrue(rt.transducer().isRealTime());
        assertEquals(words("yz"), rt.transducer().process("a"));
    }

    public void testToDot() {
        String dot = sample().toDot("sample");
        logDot(dot);
        assertTrue(dot.contains("a:x"));
    }
}
