/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown by {@link Range} when the lower bound exceeds the upper bound.
 */
public class InvalidRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(char min, char max) {
        super("invalid char range: '" + Misc.esc(String.valueOf(min))
            + "'-'" + Misc.esc(String.valueOf(max)) + "'");
    }
}
