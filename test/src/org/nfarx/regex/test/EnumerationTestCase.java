/* @LICENSE@  
 */

package org.nfarx.regex.test;

import static org.nfarx.regex.RegexAssert.*;

import org.nfarx.regex.AbstractRxTestCase;
import org.nfarx.regex.MatchCallback;
import org.nfarx.regex.Regex;

public class EnumerationTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(EnumerationTestCase.class);
    }

    public EnumerationTestCase(String name) {
        super(name);
    }

    /*
     * records matches as "(s,e)" pairs
     */
    private static final class Spec implements MatchCallback {
        final StringBuilder sb = new StringBuilder();
        public boolean call(int start, int end) {
            sb.append('(').append(start).append(',').append(end).append(')');
            return false;
        }
        @Override
        public String toString() {
            return sb.toString();
        }
    }

    public void testPlus() {
        assertAllMatches("a+", "aaabaa", "(0,3)(4,6)");
        assertNonOverlapping("a+", "aaabaa", "(0,3)(4,6)");
        Regex rx = Regex.compile("a+");
        assertEquals(2, rx.countMatches("aaabaa"));
        assertEquals(2, rx.countNonOverlappingMatches("aaabaa"));
    }

    public void testEarlyStop() {
        assertStopsAfter("a+", "aaabaa", 1);
        assertStopsAfter("a+", "aaabaa", 2);
        assertStopsAfter("[0-9]+", "1 22 333 4444", 3);
    }

    public void testOverlapping() {
        assertAllMatches("ab|bc", "abc", "(0,2)(1,3)");
        assertNonOverlapping("ab|bc", "abc", "(0,2)");
        assertAllMatches("aba", "ababa", "(0,3)(2,5)");
        assertNonOverlapping("aba", "ababa", "(0,3)");
        assertEquals(2, Regex.compile("aba").countMatches("ababa"));
        assertEquals(1, Regex.compile("aba").countNonOverlappingMatches("ababa"));
    }

    public void testConvergingPaths() {
        // start 1 reaches the accept state alone at 2, then again with start 0 at 4
        assertAllMatches("a(bc)?|xabc", "xabc", "(0,4)");
        assertNonOverlapping("a(bc)?|xabc", "xabc", "(0,4)");
        Spec s = new Spec();
        assertFalse(Regex.compile("a(bc)?|xabc").forEachMatch("xabc", 1, 4, s));
        assertEquals("(1,4)", s.toString());
        
        assertAllMatches("aa|a", "aa", "(0,2)");
        assertAllMatches("aa|a", "aaa", "(0,2)(1,3)");
        assertAllMatches("xab|ab(cd)?", "xabcd", "(0,3)(1,5)");
        assertEquals(1, Regex.compile("a(bc)?|xabc").countMatches("xabc"));
    }

    public void testLongestPerStart() {
        assertAllMatches("a|ab", "ab", "(0,2)");
        assertNonOverlapping("a|ab", "ab", "(0,2)");
        assertAllMatches("[0-9]+", "ab12cd345", "(2,4)(6,9)");
        assertNonOverlapping("[0-9]+", "ab12cd345", "(2,4)(6,9)");
        assertNonOverlapping("(ab)+", "abababxab", "(0,6)(7,9)");
    }

    public void testNonEmptyOnly() {
        assertAllMatches("a*", "bbb", "");
        assertNonOverlapping("a*", "bbb", "");
        assertAllMatches("a*", "baab", "(1,3)");
        assertNonOverlapping("a*", "baab", "(1,3)");
        assertEquals(0, Regex.compile("").countMatches("abc"));
        assertEquals(0, Regex.compile("x?").countNonOverlappingMatches(""));
    }

    public void testWindow() {
        Regex rx = Regex.compile("a+");
        Spec all = new Spec();
        assertFalse(rx.forEachMatch("aaabaa", 1, 5, all));
        assertEquals("(1,3)(4,5)", all.toString());
        Spec nov = new Spec();
        assertFalse(rx.forEachNonOverlappingMatch("aaabaa", 1, 5, nov));
        assertEquals("(1,3)(4,5)", nov.toString());
        
        Spec none = new Spec();
        assertFalse(rx.forEachMatch("aaabaa", 3, 4, none));
        assertFalse(rx.forEachNonOverlappingMatch("aaabaa", 2, 2, none));
        assertEquals("", none.toString());
    }

    public void testAgainstJava() {
        assertJavaFind("[a-z]+", "abc def  g", "", "123");
        assertJavaFind("\\d+", "a1b22c333");
        assertJavaFind("ab|cd", "xabcdab");
        assertJavaFind("a+", "aaabaa");
        assertJavaFind("(ab)*c", "cabcababcx");
    }

    public void testDeterministicOrder() {
        Spec s0 = new Spec();
        Spec s1 = new Spec();
        Regex.compile("a.|b.").forEachMatch("abbaab", s0);
        Regex.compile("a.|b.").forEachMatch("abbaab", s1);
        assertEquals(s0.toString(), s1.toString());
        logger.log(level, "a.|b. on abbaab: " + s0);
    }
}
