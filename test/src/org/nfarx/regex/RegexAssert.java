/*@LICENSE@
 */

package org.nfarx.regex;

import static junit.framework.Assert.*;

/**
 * Static assertions over compiled {@link Regex}es. Expected matches are given
 * as spec strings of <code>(start,end)</code> pairs, e.g.
 * <code>"(0,3)(4,6)"</code>; the empty spec means no match.
 */
public final class RegexAssert {
    
    private RegexAssert() {}   // not instantiable.

    private static final java.util.regex.Pattern specPattern = 
        java.util.regex.Pattern.compile(
            "\\A(?:\\s*\\(\\d+,\\s*\\d+\\))*\\s*\\z");
 
    private static final java.util.regex.Pattern pairPattern = 
        java.util.regex.Pattern.compile(
            "\\((\\d+),\\s*(\\d+)\\)");   // g[1], g[2]

    /*
     * collects callbacks as a spec string
     */
    private static final class Recorder implements MatchCallback {
        final StringBuilder sb = new StringBuilder();
        final int stopAfter;
        int calls = 0;
        Recorder(int stopAfter) {
            this.stopAfter = stopAfter;
        }
        public boolean call(int start, int end) {
            sb.append(specFrom(start, end));
            return ++calls == stopAfter;
        }
    }

    static String specFrom(int s, int e) {
        return "(" + s + ',' + e + ')';
    }

    /*
     * normalizes whitespace out of a spec, and checks it's well formed
     */
    static String normalize(String spec) {
        assertTrue("bad spec: " + spec, specPattern.matcher(spec).matches());
        StringBuilder sb = new StringBuilder();
        java.util.regex.Matcher m = pairPattern.matcher(spec);
        while (m.find()) {
            sb.append(specFrom(
                Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        }
        return sb.toString();
    }

    /*
     * spec of the matches of a java.util.regex find() loop, with empty matches left out
     */
    static String javaSpec(String regex, CharSequence input) {
        StringBuilder sb = new StringBuilder();
        java.util.regex.Matcher jm = java.util.regex.Pattern.compile(regex).matcher(input);
        while (jm.find()) {
            if (jm.end() > jm.start()) sb.append(specFrom(jm.start(), jm.end()));
        }
        return sb.toString();
    }

    public static void assertMatches(String regex, CharSequence... inputs) {
        assertMatches(Regex.compile(regex), inputs);
    }

    public static void assertMatches(Regex rx, CharSequence... inputs) {
        for (CharSequence input : inputs) {
            assertTrue("\"" + rx + "\" should match \"" + input + "\"", rx.matches(input));
        }
    }

    public static void assertNotMatches(String regex, CharSequence... inputs) {
        assertNotMatches(Regex.compile(regex), inputs);
    }

    public static void assertNotMatches(Regex rx, CharSequence... inputs) {
        for (CharSequence input : inputs) {
            assertFalse("\"" + rx + "\" should not match \"" + input + "\"", rx.matches(input));
        }
    }

    /**
     * Checks {@link Regex#forEachMatch(CharSequence, MatchCallback)}.
     */
    public static void assertAllMatches(String regex, CharSequence input, String spec) {
        Recorder r = new Recorder(-1);
        assertFalse(Regex.compile(regex).forEachMatch(input, r));
        assertEquals("rx: \"" + regex + "\", input: \"" + input + "\"",
            normalize(spec), r.sb.toString());
    }

    /**
     * Checks
     * {@link Regex#forEachNonOverlappingMatch(CharSequence, MatchCallback)}.
     */
    public static void assertNonOverlapping(String regex, CharSequence input, String spec) {
        Recorder r = new Recorder(-1);
        assertFalse(Regex.compile(regex).forEachNonOverlappingMatch(input, r));
        assertEquals("rx: \"" + regex + "\", input: \"" + input + "\"",
            normalize(spec), r.sb.toString());
    }

    /**
     * Checks that the enumerations stop after the n'th callback, and that
     * exactly n callbacks were made.
     */
    public static void assertStopsAfter(String regex, CharSequence input, int n) {
        Regex rx = Regex.compile(regex);
        Recorder r = new Recorder(n);
        assertTrue("forEachMatch did not stop", rx.forEachMatch(input, r));
        assertEquals(n, r.calls);
        r = new Recorder(n);
        assertTrue("forEachNonOverlappingMatch did not stop", 
            rx.forEachNonOverlappingMatch(input, r));
        assertEquals(n, r.calls);
    }

    /**
     * Compares with the standard library: whole match, for a regex in the
     * syntax both packages read the same way.
     */
    public static void assertJavaMatches(String regex, String... inputs) {
        Regex rx = Regex.compile(regex);
        for (String input : inputs) {
            assertEquals("rx: \"" + regex + "\", input: \"" + input + "\"",
                java.util.regex.Pattern.matches(regex, input), rx.matches(input));
        }
    }

    /**
     * Compares non-overlapping matches with a standard library find() loop.
     * Only meaningful where leftmost first and leftmost longest agree.
     */
    public static void assertJavaFind(String regex, String... inputs) {
        for (String input : inputs) {
            Recorder r = new Recorder(-1);
            Regex.compile(regex).forEachNonOverlappingMatch(input, r);
            assertEquals("rx: \"" + regex + "\", input: \"" + input + "\"",
                javaSpec(regex, input), r.sb.toString());
        }
    }
}
