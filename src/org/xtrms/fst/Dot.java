/*
 * @LICENSE@
 */

package org.xtrms.fst;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulates a Graphviz digraph. Lossy and one-way: meant for eyeballing
 * automata while debugging.
 */
final class Dot {

    private final String name;
    private final Collection<Integer> initial;
    private final Collection<Integer> finals;
    private final Set<Integer> states = new LinkedHashSet<Integer>();
    private final StringBuilder edges = new StringBuilder();

    Dot(String name, Collection<Integer> initial, Collection<Integer> finals) {
        this.name = name;
        this.initial = initial;
        this.finals = finals;
    }

    Dot state(int s) {
        states.add(s);
        return this;
    }

    Dot arc(int from, int to, String label) {
        edges.append("  ").append(id(from)).append(" -> ").append(id(to))
             .append(" [label = \"").append(Misc.esc(label)).append("\"];")
             .append(Misc.LS);
        return this;
    }

    private static String id(int s) {
        return s < 0 ? "sink" : "s" + s;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(Misc.esc(name)).append("\" {").append(Misc.LS);
        sb.append("  rankdir = LR;").append(Misc.LS);
        for (int s : states) {
            String shape = finals.contains(s) ? "doublecircle" : "circle";
            sb.append("  ").append(id(s)).append(" [shape = ").append(shape)
              .append(", label = \"").append(s).append("\"];").append(Misc.LS);
            if (initial.contains(s)) {
                sb.append("  start").append(s).append(" [shape = none, label = \"\"];")
                  .append(Misc.LS)
                  .append("  start").append(s).append(" -> ").append(id(s)).append(";")
                  .append(Misc.LS);
            }
        }
        sb.append(edges);
        sb.append("}").append(Misc.LS);
        return sb.toString();
    }
}
