/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * A runtime exception thrown when a construction exhausts its resources,
 * e.g. a subset construction or a product discovering more states than
 * allowed by the <code>org.xtrms.fst.maxStates</code> system property.
 */
public class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
