/* @LICENSE@  
 */

package org.nfarx.regex.test;

import static org.nfarx.regex.RegexAssert.*;

import org.nfarx.regex.AbstractRxTestCase;
import org.nfarx.regex.Regex;

/**
 * Anchors always refer to the boundaries of the whole input, whatever the
 * window of the query.
 */
public class AnchorsTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AnchorsTestCase.class);
    }

    public AnchorsTestCase(String name) {
        super(name);
    }

    public void testEmptyInput() {
        assertMatches("^$", "");
        assertNotMatches("^$", "a", " ");
        assertMatches("^", "");
        assertMatches("$", "");
    }

    public void testWholeInput() {
        assertMatches("^abc$", "abc");
        assertNotMatches("^abc$", "abcd", "ab");
        assertMatches("^a*$", "", "aaa");
    }

    public void testStartIgnoresWindow() {
        Regex rx = Regex.compile("^a");
        assertFalse(rx.matches("ba", 1, 2));
        assertTrue(rx.matches("ab", 0, 1));
        assertFalse(rx.contains("ba", 1, 2));
        assertTrue(Regex.compile("a").matches("ba", 1, 2));
    }

    public void testEndIgnoresWindow() {
        Regex rx = Regex.compile("a$");
        assertTrue(rx.matches("ba", 1, 2));
        assertFalse(rx.matches("ab", 0, 1));
        assertTrue(Regex.compile("$").matches("abc", 3, 3));
        assertFalse(Regex.compile("$").matches("abc", 0, 0));
        assertFalse(Regex.compile("^$").matches("abc", 3, 3));
    }

    public void testEnumeration() {
        assertAllMatches("^a", "aaa", "(0,1)");
        assertNonOverlapping("^a", "aaa", "(0,1)");
        assertAllMatches("a$", "aaa", "(2,3)");
        assertNonOverlapping("a$", "aaa", "(2,3)");
        assertAllMatches("^a|b", "aab", "(0,1)(2,3)");
        assertNonOverlapping("^a|b", "aab", "(0,1)(2,3)");
        assertAllMatches("^a+$", "aaba", "");
    }

    public void testAnchorsInGroups() {
        assertMatches("(^a|b)c", "ac", "bc");
        assertNotMatches("x(^a|b)c", "xac");
        assertMatches("x(^a|b)c", "xbc");
        assertMatches("(a$|b)", "a", "b");
        assertNotMatches("(a$|b)c", "ac");
    }

    public void testAnchorsSurviveRepetition() {
        // every copy of the group keeps its '^'
        assertMatches("(^a|b){2}", "ab", "bb");
        assertNotMatches("(^a|b){2}", "aa", "ba");
        assertMatches("(b|c$){1,2}", "b", "bc", "c");
        assertNotMatches("(b|c$){1,2}", "cb");
        assertMatches("(^a|b)+", "abbb", "a");
        assertNotMatches("(^a|b)+", "aba");
    }
}
