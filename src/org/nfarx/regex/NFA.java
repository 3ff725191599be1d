/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata - plus anchors.
 */
package org.nfarx.regex;

import static org.nfarx.regex.Misc.LS;
import static org.nfarx.regex.Misc.Esc.JAVA;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.nfarx.regex.Misc.BreadthFirstVisitor;
import org.nfarx.regex.Misc.Edge;
import org.nfarx.regex.Misc.Vertex;

/**
 * The compiled automaton of a {@link Regex}: a start {@link State} and every
 * state reachable from it. The graph may be cyclic (<code>a*</code> loops
 * back into its own fragment). It is built once by the {@link GraphBuilder},
 * and is never changed afterwards, which is what makes a compiled Regex safe
 * to share between threads.
 */
final class NFA {

    /**
     * A transition to a next state. An epsilon arc consumes nothing and always
     * carries {@link CharCondition#TRUE}; a consuming arc moves on one input
     * char which passes its condition.
     */
    static final class Arc implements Edge<State> {

        final State ns;     // next state
        final boolean consumes;
        final CharCondition cc;

        private Arc(State ns, boolean consumes, CharCondition cc) {
            this.ns = ns;
            this.consumes = consumes;
            this.cc = cc;
        }
        static Arc epsilon(State ns) {
            return new Arc(ns, false, CharCondition.TRUE);
        }
        static Arc consuming(State ns, CharCondition cc) {
            return new Arc(ns, true, cc);
        }
        public State vertex() {
            return ns;
        }
        boolean accepts(char c) {
            return consumes && cc.test(c);
        }
        @Override
        public String toString() {
            return (consumes ? JAVA.esc(String.valueOf(cc)) : "e") + "->" + ns.id;
        }
    }

    /**
     * A state; identity is object identity. The flags are set while the
     * graph is built: <code>mustBeStart</code> on the node of a '^',
     * <code>mustBeEnd</code> on the node of a '$', and <code>accept</code>
     * on the exit node of the whole pattern only.
     */
    static final class State implements Vertex<Arc> {

        private final List<Arc> arcs = new ArrayList<Arc>(2);
        boolean mustBeStart = false;
        boolean mustBeEnd = false;
        boolean accept = false;
        int id = -1;        // for ease of debug only

        State() {
        }

        void add(Arc arc) {
            arcs.add(arc);
        }

        List<Arc> arcs() {
            return arcs;
        }

        int size() {return arcs.size();}

        public Iterable<Arc> edges() {
            return arcs;
        }

        /**
         * @return <code>true</code> if this state may be active at a position
         *         with the given absolute boundary conditions.
         */
        boolean admits(boolean atStart, boolean atEnd) {
            return (atStart || !mustBeStart) && (atEnd || !mustBeEnd);
        }

        /*
         * arcs print as ids only; nested printing would not terminate on loops.
         */
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(id).append(':');
            if (mustBeStart) sb.append('^');
            if (mustBeEnd) sb.append('$');
            if (accept) sb.append('E');
            sb.append(arcs);
            return sb.toString();
        }
    }

    final State start;
    final State accept;
    private final List<State> states;

    /**
     * Freezes the graph reachable from <code>start</code>, numbering the
     * states in breadth first order.
     */
    NFA(State start, State accept) {
        assert accept.accept;
        this.start = start;
        this.accept = accept;
        final List<State> numbered = new ArrayList<State>();
        new BreadthFirstVisitor<State, Arc>() {
            @Override
            protected void visit(State s) {
                s.id = numbered.size();
                numbered.add(s);
            }
        }.start(start);
        this.states = Collections.unmodifiableList(numbered);
        assert accept.id >= 0 : "accept state is not reachable";
    }

    /**
     * @return the states, in breadth first order from {@link #start}.
     */
    List<State> states() {
        return states;
    }

    /**
     * @return the number of states in this NFA.
     */
    int size() {
        return states.size();
    }

    int acceptCount() {
        int n = 0;
        for (State s : states) if (s.accept) ++n;
        return n;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states=").append(size()).append(LS);
        for (State s : states) {
            sb.append("  ").append(s).append(LS);
        }
        return sb.toString();
    }
}
