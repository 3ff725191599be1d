/*
 * @LICENSE@
 */

package org.nfarx.regex;

/**
 * A predicate over a single <code>char</code>; the test carried by every
 * consuming {@linkplain NFA.Arc arc} of a compiled {@link Regex}.
 * Implementations must be stateless so that compiled patterns can be shared
 * between threads.
 */
public interface CharCondition {

    /**
     * @param c
     *            the input character
     * @return <code>true</code> if <code>c</code> passes this condition.
     */
    boolean test(char c);

    /**
     * Accepts every character; used for '.' and for all epsilon arcs.
     */
    CharCondition TRUE = new CharCondition() {
        public boolean test(char c) {
            return true;
        }
        @Override
        public String toString() {
            return ".";
        }
    };
}
