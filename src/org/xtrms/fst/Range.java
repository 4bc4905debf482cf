/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * An immutable, non-empty, inclusive interval of chars, used as the arc
 * label of a {@link RangeAutomaton}. There is no representation for the
 * empty range; operations that could produce one return <code>null</code>.
 */
public final class Range implements Comparable<Range> {

    public static final Range ALL = new Range(Character.MIN_VALUE, Character.MAX_VALUE);

    final char min;
    final char max;

    public Range(char c) {
        this(c, c);
    }

    /**
     * @throws InvalidRangeException
     *             if <code>min &gt; max</code>.
     */
    public Range(char min, char max) {
        if (min > max) throw new InvalidRangeException(min, max);
        this.min = min;
        this.max = max;
    }

    public char min() {
        return min;
    }

    public char max() {
        return max;
    }

    public boolean includes(char c) {
        return min <= c && c <= max;
    }

    /**
     * @return the common part, or <code>null</code> if the ranges are
     *         disjoint.
     */
    public Range intersect(Range other) {
        char lo = min > other.min ? min : other.min;
        char hi = max < other.max ? max : other.max;
        return lo <= hi ? new Range(lo, hi) : null;
    }

    /**
     * @return the sorted, disjoint ranges covering every char not covered by
     *         <code>ranges</code>.
     */
    static List<Range> complement(Collection<Range> ranges) {
        List<Range> ret = new ArrayList<Range>();
        int next = Character.MIN_VALUE;
        for (Range r : new TreeSet<Range>(ranges)) {
            if (r.min > next) ret.add(new Range((char) next, (char) (r.min - 1)));
            if (r.max + 1 > next) next = r.max + 1;
        }
        if (next <= Character.MAX_VALUE) ret.add(new Range((char) next, Character.MAX_VALUE));
        return ret;
    }

    public int compareTo(Range r) {
        if (min != r.min) return min < r.min ? -1 : 1;
        if (max != r.max) return max < r.max ? -1 : 1;
        return 0;
    }

    @Override
    public int hashCode() {
        return 31 * min + max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range)) return false;
        Range r = (Range) o;
        return min == r.min && max == r.max;
    }

    @Override
    public String toString() {
        String lo = "'" + Misc.esc(String.valueOf(min)) + "'";
        return min == max ? lo : lo + "-'" + Misc.esc(String.valueOf(max)) + "'";
    }
}
