/*
 * @LICENSE@
 */

/**
 * <h3><b>nfarx</b> - A small Thompson NFA based regex package.</h3>
 * <p>
 * A pattern is compiled in three steps: the {@link org.nfarx.regex.Tokenizer}
 * turns it into tokens with explicit concatenation, the
 * {@link org.nfarx.regex.GraphBuilder} reorders them into postfix by operator
 * precedence and assembles the automaton from fragments, and the resulting
 * {@link org.nfarx.regex.NFA} is frozen inside a {@link org.nfarx.regex.Regex}.
 * Queries simulate the automaton directly, tracking every active state at
 * once, so there is no backtracking and no pattern can make a query take more
 * than time linear in the input times the automaton size.
 * <p>
 * Bounded repetition (<code>a{2,5}</code>) copies the repeated fragment, so
 * large bounds give large automata. That is the one cost paid at compile time.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>, for the construction and
 * the simulation.</li>
 * <li>The <a
 * href="http://en.wikipedia.org/wiki/Shunting-yard_algorithm">shunting-yard</a>
 * algorithm, for the postfix conversion.</li>
 * </ul>
 */
package org.nfarx.regex;
