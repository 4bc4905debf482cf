/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown by operations deliberately left unimplemented for a representation.
 */
public class UnsupportedConstructException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    public UnsupportedConstructException(String msg) {
        super(msg);
    }
}
