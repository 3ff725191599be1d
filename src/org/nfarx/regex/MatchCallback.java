/*
 * @LICENSE@
 */

package org.nfarx.regex;

/**
 * Receives the matches found by the enumerating queries of {@link Regex}.
 */
public interface MatchCallback {

    /**
     * @param start
     *            index of the first char of the match
     * @param end
     *            index after the last char of the match
     * @return <code>true</code> to stop the enumeration.
     */
    boolean call(int start, int end);
}
