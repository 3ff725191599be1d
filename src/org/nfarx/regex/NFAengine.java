/*
 * @LICENSE@
 */

package org.nfarx.regex;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.nfarx.regex.NFA.Arc;
import org.nfarx.regex.NFA.State;

/**
 * Simulates an {@link NFA} against input text. The engine holds no state
 * between calls: every query allocates its own state sets, so one engine may
 * serve any number of threads.
 * <p>
 * Anchors are always evaluated against the whole input: a position is a
 * start iff it is <code>0</code>, and an end iff it is
 * <code>input.length()</code>, whatever window the query was given.
 */
final class NFAengine {

    private static final Logger logger = Logger.getLogger("org.nfarx.regex");
    private static final Level level = Level.FINEST;

    private final NFA nfa;

    NFAengine(NFA nfa) {
        this.nfa = nfa;
    }

    /*
     * ===================================================================
     * closures
     * ===================================================================
     */

    /**
     * Collects into <code>out</code> every state reachable from
     * <code>s</code> over epsilon arcs alone, <code>s</code> included. A
     * state which the boundary conditions don't admit is neither collected
     * nor passed through.
     */
    static void closure(State s, boolean atStart, boolean atEnd, Set<State> out) {
        if (!s.admits(atStart, atEnd) || !out.add(s)) return;
        final Deque<State> todo = new ArrayDeque<State>();
        todo.push(s);
        while (!todo.isEmpty()) {
            for (Arc arc : todo.pop().arcs()) {
                if (arc.consumes || !arc.ns.admits(atStart, atEnd)) continue;
                if (out.add(arc.ns)) todo.push(arc.ns);
            }
        }
    }

    static Set<State> closure(State s, boolean atStart, boolean atEnd) {
        Set<State> out = new LinkedHashSet<State>();
        closure(s, atStart, atEnd, out);
        return out;
    }

    /**
     * The start-tracking variant of {@link #closure(State, boolean, boolean)}:
     * every state in the closure of <code>s</code> gets <code>starts</code>
     * added to its start set in <code>target</code>.
     */
    static void mergeClosure(Map<State, SortedSet<Integer>> target, State s,
            boolean atStart, boolean atEnd, Set<Integer> starts) {
        for (State c : closure(s, atStart, atEnd)) {
            SortedSet<Integer> set = target.get(c);
            if (set == null) {
                target.put(c, set = new TreeSet<Integer>());
            }
            set.addAll(starts);
        }
    }

    /*
     * ===================================================================
     * stepping
     * ===================================================================
     */

    private static Set<State> step(Set<State> current, CharSequence input, int pos) {
        final char c = input.charAt(pos);
        final boolean atEnd = pos + 1 == input.length();
        final Set<State> next = new LinkedHashSet<State>();
        for (State s : current) {
            for (Arc arc : s.arcs()) {
                if (arc.accepts(c)) closure(arc.ns, false, atEnd, next);
            }
        }
        return next;
    }

    private static Map<State, SortedSet<Integer>> step(
            Map<State, SortedSet<Integer>> current, CharSequence input, int pos) {
        final char c = input.charAt(pos);
        final boolean atEnd = pos + 1 == input.length();
        final Map<State, SortedSet<Integer>> next = 
            new LinkedHashMap<State, SortedSet<Integer>>();
        for (Map.Entry<State, SortedSet<Integer>> e : current.entrySet()) {
            for (Arc arc : e.getKey().arcs()) {
                if (arc.accepts(c)) mergeClosure(next, arc.ns, false, atEnd, e.getValue());
            }
        }
        return next;
    }

    private void seed(Map<State, SortedSet<Integer>> active, CharSequence input, int pos) {
        mergeClosure(active, nfa.start, pos == 0, pos == input.length(), 
                Collections.singleton(pos));
    }

    /*
     * ===================================================================
     * queries. Windows are validated by the caller.
     * ===================================================================
     */

    /**
     * @return <code>true</code> iff the whole window
     *         <code>[start, end)</code> is consumed on a path to the accept
     *         state.
     */
    boolean matches(CharSequence input, int start, int end) {
        Set<State> active = closure(nfa.start, start == 0, start == input.length());
        for (int pos = start; pos < end && !active.isEmpty(); ++pos) {
            active = step(active, input, pos);
        }
        return active.contains(nfa.accept);
    }

    /**
     * Reports at most one match per start position, with the longest end
     * found for it. Matches are reported in ascending start order.
     * <p>
     * Every start in the start set of the accept state has its end updated,
     * so each start keeps the longest end any of its paths reaches. A start
     * whose longest match lies within a match already reported is skipped.
     * With <code>a+</code> over <code>"aaabaa"</code> this gives (0,3) and
     * (4,6).
     * 
     * @return <code>true</code> iff the callback asked to stop.
     */
    boolean forEachMatch(CharSequence input, int start, int end, MatchCallback callback) {
        final SortedMap<Integer, Integer> longest = new TreeMap<Integer, Integer>();
        Map<State, SortedSet<Integer>> active = new LinkedHashMap<State, SortedSet<Integer>>();
        for (int pos = start; pos < end; ++pos) {
            seed(active, input, pos);
            active = step(active, input, pos);
            final SortedSet<Integer> starts = active.get(nfa.accept);
            if (starts != null) {
                for (Integer s : starts) longest.put(s, pos + 1);
            }
        }
        int reportedEnd = -1;
        for (Map.Entry<Integer, Integer> m : longest.entrySet()) {
            if (m.getValue() <= reportedEnd) continue;    // covered
            reportedEnd = m.getValue();
            if (callback.call(m.getKey(), m.getValue())) {
                logger.log(level, "stopped at match ({0},{1})", 
                        new Object[] {m.getKey(), m.getValue()});
                return true;
            }
        }
        return false;
    }

    /**
     * Leftmost, locally longest, non-overlapping matches: from each cursor
     * position a fresh simulation looks for the longest non-empty match
     * starting exactly there. A match moves the cursor to its end, a miss
     * moves it by one.
     * 
     * @return <code>true</code> iff the callback asked to stop.
     */
    boolean forEachNonOverlappingMatch(CharSequence input, int start, int end,
            MatchCallback callback) {
        int pos = start;
        while (pos < end) {
            final int longestEnd = longestFrom(input, pos, end);
            if (longestEnd < 0) {
                ++pos;
                continue;
            }
            if (callback.call(pos, longestEnd)) {
                logger.log(level, "stopped at match ({0},{1})", 
                        new Object[] {pos, longestEnd});
                return true;
            }
            pos = longestEnd;
        }
        return false;
    }

    /*
     * end of the longest non-empty match which starts at from, or -1.
     */
    private int longestFrom(CharSequence input, int from, int end) {
        int longestEnd = -1;
        Map<State, SortedSet<Integer>> active = new LinkedHashMap<State, SortedSet<Integer>>();
        seed(active, input, from);
        for (int pos = from; pos < end && !active.isEmpty(); ++pos) {
            active = step(active, input, pos);
            final SortedSet<Integer> starts = active.get(nfa.accept);
            if (starts != null && starts.contains(from)) {
                longestEnd = pos + 1;
            }
        }
        return longestEnd;
    }
}
