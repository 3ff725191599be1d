/*
 * @LICENSE@
 */

package org.nfarx.regex;

import static org.nfarx.regex.Misc.Esc.QUOTE;

import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.nfarx.regex.Misc.FlagMgr;

/**
 * A compiled regular expression. Instances are immutable and thread safe: the
 * automaton is built once by {@link #compile(String, int)}, and every query
 * works on its own state.
 * <p>
 * The syntax is a small subset of that of {@link java.util.regex.Pattern}:
 * literals, <code>.</code>, char classes (<code>[a-z]</code>,
 * <code>[^0-9]</code>, with no escapes inside the brackets), the shorthand
 * classes <code>\d \w \s</code> and their complements, grouping,
 * alternation, the greedy quantifiers <code>* + ?</code> and
 * <code>{m} {m,} {m,n}</code>, and the anchors <code>^ $</code>.
 * <p>
 * <strong>Anchors</strong> refer to the boundaries of the whole input, never
 * to the window of a query: <code>compile("^a").matches("ba", 1, 2)</code> is
 * <code>false</code>.
 * <p>
 * <strong>Capturing groups</strong>, back references, reluctant quantifiers
 * and lookaround are <em>not</em> supported; parenthesis only group.
 * <p>
 * <strong>Match enumeration</strong> reports non-empty matches only, through
 * a {@link MatchCallback}. {@link #forEachMatch(CharSequence, MatchCallback)}
 * gives at most one (longest) match per start position, and those matches
 * may overlap; {@link #forEachNonOverlappingMatch(CharSequence, MatchCallback)}
 * gives leftmost longest matches which never overlap.
 */
public final class Regex {

    private static final Logger logger = Logger.getLogger("org.nfarx.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Literals and char classes match regardless of (simple) case. The
     * <code>.</code> wildcard is unaffected.
     */
    public static final int CASE_INSENSITIVE = flagMgr.next("CASE_INSENSITIVE");

    /**
     * Every char of the pattern stands for itself; there are no
     * metacharacters.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    static {
        flagMgr.freezeAndCount();
    }

    private final String regex;
    private final int flags;
    final NFA nfa;
    private final NFAengine engine;

    private Regex(String regex, int flags) {
        flagMgr.check(flags);
        this.regex = regex;
        this.flags = flags;
        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + regex);
            logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        }
        // the empty pattern matches the empty input only
        this.nfa = regex.length() == 0 
            ? GraphBuilder.build("^$", Tokenizer.tokenize("^$")) 
            : GraphBuilder.build(regex, Tokenizer.tokenize(regex, flags));
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "nfa for " + regex + ": " + nfa);
        }
        this.engine = new NFAengine(nfa);
    }

    /**
     * @throws PatternSyntaxException
     *             if the pattern is malformed.
     * @throws IllegalStateException
     *             if an anchor stands where nothing can be sequenced with it,
     *             as in <code>a$b</code>, <code>a^</code>, <code>$$</code> or
     *             <code>^^</code>, or for the empty group <code>()</code>.
     */
    public static Regex compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * @param regex
     *            the regular expression to be compiled.
     * @param flags
     *            a bit mask of {@link #CASE_INSENSITIVE} and {@link #LITERAL}
     * @return the compiled regex.
     * @throws PatternSyntaxException
     *             if the pattern is malformed.
     * @throws IllegalArgumentException
     *             if <code>flags</code> has undefined bits set.
     * @throws IllegalStateException
     *             if an anchor stands where nothing can be sequenced with it,
     *             as in <code>a$b</code>, <code>a^</code>, <code>$$</code> or
     *             <code>^^</code>, or for the empty group <code>()</code>.
     */
    public static Regex compile(String regex, int flags) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        return new Regex(regex, flags);
    }

    public static boolean matches(String regex, CharSequence input) {
        return compile(regex).matches(input);
    }

    /**
     * Backslash escapes every metachar of <code>s</code>, so that
     * <code>compile(quote(s))</code> matches exactly <code>s</code>.
     */
    public static String quote(String s) {
        return QUOTE.esc(s);
    }

    public String pattern() {
        return regex;
    }

    public int flags() {
        return flags;
    }

    /*
     * ===================================================================
     * queries
     * ===================================================================
     */

    public boolean matches(CharSequence input) {
        return matches(input, 0, input.length());
    }

    /**
     * @return <code>true</code> iff this regex matches exactly the window
     *         <code>[start, end)</code> of <code>input</code>.
     * @throws IndexOutOfBoundsException
     *             if the window is not within <code>input</code>.
     */
    public boolean matches(CharSequence input, int start, int end) {
        checkWindow(input, start, end);
        return engine.matches(input, start, end);
    }

    public boolean contains(CharSequence input) {
        return contains(input, 0, input.length());
    }

    /**
     * @return <code>true</code> iff a non-empty match lies within the window
     *         <code>[start, end)</code> of <code>input</code>.
     * @throws IndexOutOfBoundsException
     *             if the window is not within <code>input</code>.
     */
    public boolean contains(CharSequence input, int start, int end) {
        return forEachNonOverlappingMatch(input, start, end, new MatchCallback() {
            public boolean call(int s, int e) {
                return true;
            }
        });
    }

    public boolean forEachMatch(CharSequence input, MatchCallback callback) {
        return forEachMatch(input, 0, input.length(), callback);
    }

    /**
     * Calls back once for every start position in the window which begins a
     * match, with the longest end found for it, in ascending start order.
     * Matches may overlap, but a match which lies within one already
     * reported is skipped.
     * 
     * @return <code>true</code> iff the callback stopped the enumeration.
     * @throws IndexOutOfBoundsException
     *             if the window is not within <code>input</code>.
     */
    public boolean forEachMatch(CharSequence input, int start, int end, MatchCallback callback) {
        checkWindow(input, start, end);
        return engine.forEachMatch(input, start, end, callback);
    }

    public boolean forEachNonOverlappingMatch(CharSequence input, MatchCallback callback) {
        return forEachNonOverlappingMatch(input, 0, input.length(), callback);
    }

    /**
     * Calls back for the leftmost longest match in the window, then for the
     * leftmost longest match after it, and so on.
     * 
     * @return <code>true</code> iff the callback stopped the enumeration.
     * @throws IndexOutOfBoundsException
     *             if the window is not within <code>input</code>.
     */
    public boolean forEachNonOverlappingMatch(CharSequence input, int start, int end,
            MatchCallback callback) {
        checkWindow(input, start, end);
        return engine.forEachNonOverlappingMatch(input, start, end, callback);
    }

    public int countMatches(CharSequence input) {
        final Counter counter = new Counter();
        forEachMatch(input, counter);
        return counter.n;
    }

    public int countNonOverlappingMatches(CharSequence input) {
        final Counter counter = new Counter();
        forEachNonOverlappingMatch(input, counter);
        return counter.n;
    }

    private static final class Counter implements MatchCallback {
        int n = 0;
        public boolean call(int start, int end) {
            ++n;
            return false;
        }
    }

    private static void checkWindow(CharSequence input, int start, int end) {
        if (start < 0 || start > end || end > input.length()) {
            throw new IndexOutOfBoundsException(
                "window [" + start + ", " + end + ") of input length " + input.length());
        }
    }

    @Override
    public int hashCode() {
        return 31 * regex.hashCode() + flags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Regex)) return false;
        Regex that = (Regex) o;
        return flags == that.flags && regex.equals(that.regex);
    }

    @Override
    public String toString() {
        return regex;
    }
}
