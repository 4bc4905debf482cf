/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.io.Flushable;

/**
 * An {@link Appendable} sink for {@link Bimachine#process(CharSequence,
 * Appendable)} that cuts the streamed output into tokens. A token is the
 * text between a start sentinel and the next end sentinel; each completed
 * token is handed to the {@link Listener}. Text outside tokens is dropped.
 */
public final class TokenSlicer implements Appendable, Flushable {

    public interface Listener {
        void token(String text);
    }

    private final char start;
    private final char end;
    private final Listener listener;
    private final StringBuilder sb = new StringBuilder();
    private boolean inToken = false;

    public TokenSlicer(char start, char end, Listener listener) {
        if (start == end) throw new IllegalArgumentException("start and end sentinels must differ");
        this.start = start;
        this.end = end;
        this.listener = listener;
    }

    public TokenSlicer append(char c) {
        if (c == start) {
            if (inToken) throw unbalanced(c);
            inToken = true;
        } else if (c == end) {
            if (!inToken) throw unbalanced(c);
            inToken = false;
            listener.token(sb.toString());
            Misc.clear(sb);
        } else if (inToken) {
            sb.append(c);
        }
        return this;
    }

    public TokenSlicer append(CharSequence csq) {
        return append(csq, 0, csq.length());
    }

    public TokenSlicer append(CharSequence csq, int from, int to) {
        for (int i = from; i < to; ++i) append(csq.charAt(i));
        return this;
    }

    /**
     * @return true iff a start sentinel is waiting for its end sentinel.
     */
    public boolean isInToken() {
        return inToken;
    }

    /**
     * Checks that no token is left open.
     *
     * @throws IllegalStateException
     *             if the last token was never closed.
     */
    public void flush() {
        if (inToken) {
            throw new IllegalStateException("unterminated token: \"" + Misc.esc(sb) + '"');
        }
    }

    private IllegalStateException unbalanced(char c) {
        return new IllegalStateException("unbalanced token sentinel '"
            + Misc.esc(String.valueOf(c)) + "'");
    }
}
