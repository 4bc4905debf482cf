/*
 * @LICENSE@
 */

package org.xtrms.fst;

/**
 * Thrown by {@link Bimachine#rewrite(CharSequence)} when the input is not in
 * the domain of the bimachine. The bimachine stays usable.
 */
public class UnrecognizedInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public UnrecognizedInputException(CharSequence input, int position) {
        super("unrecognized input at " + position + ": "
            + (position < input.length()
                ? "'" + Misc.esc(String.valueOf(input.charAt(position))) + "'"
                : "<end>"));
        this.position = position;
    }

    /**
     * @return index of the offending symbol.
     */
    public int position() {
        return position;
    }
}
