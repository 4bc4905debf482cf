/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown when a cycle of transitions consuming no input produces non empty
 * output, so that a single input has infinitely many outputs. This is a
 * structural property of the transducer, not of a particular input.
 */
public class InfiniteAmbiguityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int state;

    public InfiniteAmbiguityException(int state, String output) {
        super("infinitely ambiguous transducer: empty input cycle at state "
            + state + " produces \"" + Misc.esc(output) + '"');
        this.state = state;
    }

    /**
     * @return the state on the offending cycle.
     */
    public int state() {
        return state;
    }
}
