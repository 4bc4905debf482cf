/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-fst</b> - finite state automata, transducers and bimachines
 * for text rewriting.</h3>
 * <p>
 * <h4>Overview.</h4>
 * <p>
 * {@link org.xtrms.fst.Automaton}s and {@link org.xtrms.fst.Transducer}s are
 * immutable values combined by the regular operations (concatenation, union,
 * star) and by the relational ones (intersection, difference, composition,
 * projection). A {@link org.xtrms.fst.Dfa} is the deterministic, minimizable
 * form of an automaton.
 * <p>
 * {@link org.xtrms.fst.Rewriters} turns a rule - a transducer mapping the
 * strings to replace onto their replacements - into a transducer rewriting
 * whole texts. The obligatory leftmost-longest match rewriter follows L.
 * Karttunen, "Directed Replacement" (1996).
 * <p>
 * A functional transducer compiles into a {@link org.xtrms.fst.Bimachine},
 * which rewrites its input deterministically in linear time: a right
 * automaton scans the input from the end, a left automaton from the start,
 * and each symbol's output is looked up from the pair of states around it.
 * Combined with a {@link org.xtrms.fst.TokenSlicer} this makes a lexer.
 * <p>
 * <h4>Limits.</h4>
 * <p>
 * Every construction that discovers states through a worklist (subset
 * construction, products, composition, bimachines) stops with a
 * {@link org.xtrms.fst.ConstructionException} once it exceeds the number of
 * states given by the system property <code>org.xtrms.fst.maxStates</code>
 * (default 1,000,000).
 * <p>
 * Construction milestones are logged to the <code>java.util.logging</code>
 * logger <code>"org.xtrms.fst"</code> at <code>FINER</code>.
 */
package org.xtrms.fst;
