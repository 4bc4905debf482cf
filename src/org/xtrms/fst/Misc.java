/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects and methods shared by the automata classes.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /**
     * Upper bound on the number of states discovered by any single worklist
     * construction (subset construction, products, composition, bimachine).
     */
    static final int MAX_STATE_COUNT =
            Integer.getInteger("org.xtrms.fst.maxStates", 1000 * 1000);

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static void watchdog(int count, String what) {
        watchdog(count, MAX_STATE_COUNT, what);
    }

    static void watchdog(int count, int limit, String what) {
        if (count > limit) {
            throw new ConstructionException(
                what + " state count exceeded: " + limit);
        }
    }

    static Set<Integer> frozen(Collection<Integer> c) {
        return Collections.unmodifiableSet(new LinkedHashSet<Integer>(c));
    }

    static List<Integer> range(int from, int count) {
        List<Integer> ret = new ArrayList<Integer>(count);
        for (int i = 0; i < count; ++i) ret.add(from + i);
        return ret;
    }

    static <T> boolean intersects(Collection<T> lhs, Collection<T> rhs) {
        for (T t : lhs) if (rhs.contains(t)) return true;
        return false;
    }

    /**
     * Java lang escaper - escapes " and \, non-printable-ASCII and beyond ->
     * \\u codes. Used for labels in toString() and dot output.
     */
    static String esc(CharSequence cs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cs.length(); ++i) {
            char c = cs.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\').append(c);
            } else if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
