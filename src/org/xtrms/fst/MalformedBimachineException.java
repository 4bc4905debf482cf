/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown when a {@link Bimachine} contradicts its own invariants, i.e. its
 * output table and its left automaton disagree. Never caused by the input.
 */
public class MalformedBimachineException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public MalformedBimachineException(String msg) {
        super(msg);
    }
}
