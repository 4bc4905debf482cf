/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown when a rewrite rule cannot be compiled as given, e.g. when the
 * alphabet contains one of the reserved marker symbols.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPatternException(String msg) {
        super(msg);
    }
}
