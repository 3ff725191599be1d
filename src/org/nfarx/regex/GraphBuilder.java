/*
 * @LICENSE@
 */

package org.nfarx.regex;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.nfarx.regex.Misc.BreadthFirstVisitor;
import org.nfarx.regex.NFA.Arc;
import org.nfarx.regex.NFA.State;
import org.nfarx.regex.Token.Kind;

/**
 * Builds the {@link NFA} for a token list in two steps: operator precedence
 * (shunting-yard) reordering of the tokens into postfix, then Thompson's
 * construction over the postfix tokens with a stack of {@link Fragment}s.
 * <p>
 * Precedence is <code>| &lt; concat &lt; * + ? {m,n}</code>, all left
 * associative. Quantifiers which need the same sub-expression more than once
 * (<code>+</code> and <code>{m,n}</code>) get {@linkplain #copy(Fragment)
 * copies} of its fragment, never shared states.
 */
final class GraphBuilder {

    private static final Logger logger = Logger.getLogger("org.nfarx.regex");
    private static final Level level = Level.FINEST;

    /**
     * An open sub-graph for one sub-expression. Nothing leaves
     * <code>exit</code> yet; later combinators hang their arcs there.
     */
    static final class Fragment {
        final State entry;
        final State exit;

        Fragment(State entry, State exit) {
            this.entry = entry;
            this.exit = exit;
        }

        /*
         * zero width fragment on a single state
         */
        static Fragment empty() {
            State s = new State();
            return new Fragment(s, s);
        }

        @Override
        public String toString() {
            return "{" + entry + " .. " + exit + "}";
        }
    }

    private final String regex;

    private GraphBuilder(String regex) {
        this.regex = regex;
    }

    /**
     * @param regex
     *            the pattern the tokens came from, for error reporting only
     * @param tokens
     *            the output of the {@link Tokenizer}
     * @return the frozen automaton.
     * @throws PatternSyntaxException
     *             for mismatched parenthesis, or an operator without operands.
     */
    static NFA build(String regex, List<Token> tokens) {
        return new GraphBuilder(regex).assemble(toPostfix(regex, tokens));
    }

    static List<Token> toPostfix(String regex, List<Token> tokens) {
        final List<Token> output = new ArrayList<Token>(tokens.size());
        final LinkedList<Token> stack = new LinkedList<Token>();

        for (Token t : tokens) {
            switch (t.kind) {
            case LITERAL: case START_ANCHOR: case END_ANCHOR:
                output.add(t);
                break;
            case OPEN:
                stack.push(t);
                break;
            case CLOSE:
                while (!stack.isEmpty() && stack.peek().kind != Kind.OPEN) {
                    output.add(stack.pop());
                }
                if (stack.isEmpty()) {
                    throw new PatternSyntaxException("Mismatched parentheses", regex, -1);
                }
                stack.pop();
                break;
            default:
                while (!stack.isEmpty() 
                        && stack.peek().kind != Kind.OPEN
                        && stack.peek().precedence() >= t.precedence()) {
                    output.add(stack.pop());
                }
                stack.push(t);
            }
        }

        while (!stack.isEmpty()) {
            final Token op = stack.pop();
            if (op.kind == Kind.OPEN || op.kind == Kind.CLOSE) {
                throw new PatternSyntaxException("Mismatched parentheses", regex, -1);
            }
            output.add(op);
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "postfix: " + output);
        }
        return output;
    }

    private NFA assemble(List<Token> postfix) {
        final LinkedList<Fragment> stack = new LinkedList<Fragment>();

        for (Token token : postfix) {
            Fragment a, b;
            switch (token.kind) {
            case LITERAL:
                final State from = new State();
                final State to = new State();
                from.add(Arc.consuming(to, token.condition));
                stack.push(new Fragment(from, to));
                break;
            case CONCAT:
                b = pop(stack, token);
                a = pop(stack, token);
                stack.push(cat(a, b));
                break;
            case ALT:
                b = pop(stack, token);
                a = pop(stack, token);
                stack.push(alt(a, b));
                break;
            case STAR:
                stack.push(star(pop(stack, token)));
                break;
            case PLUS:
                a = pop(stack, token);
                stack.push(cat(a, star(copy(a))));
                break;
            case QUESTION:
                stack.push(question(pop(stack, token)));
                break;
            case REPEAT:
                stack.push(repeat(pop(stack, token), token.min, token.max));
                break;
            case START_ANCHOR:
                a = Fragment.empty();
                a.entry.mustBeStart = true;
                stack.push(a);
                break;
            case END_ANCHOR:
                a = Fragment.empty();
                a.entry.mustBeEnd = true;
                stack.push(a);
                break;
            default:
                throw new IllegalStateException("unexpected token in postfix: " + token);
            }
        }

        if (stack.size() != 1) {
            throw new IllegalStateException(
                "malformed postfix for '" + regex + "': " + stack.size() + " fragments left");
        }
        final Fragment f = stack.pop();
        f.exit.accept = true;
        return new NFA(f.entry, f.exit);
    }

    private Fragment pop(LinkedList<Fragment> stack, Token op) {
        if (stack.isEmpty()) {
            throw new PatternSyntaxException("Missing operand for '" + op + "'", regex, -1);
        }
        return stack.pop();
    }

    /*
     * Fragment combinators. All of them hang new arcs on the exit states of
     * their arguments, so each argument fragment is used up by the call.
     */

    static Fragment cat(Fragment a, Fragment b) {
        a.exit.add(Arc.epsilon(b.entry));
        return new Fragment(a.entry, b.exit);
    }

    static Fragment alt(Fragment a, Fragment b) {
        final State entry = new State();
        final State exit = new State();
        entry.add(Arc.epsilon(a.entry));
        entry.add(Arc.epsilon(b.entry));
        a.exit.add(Arc.epsilon(exit));
        b.exit.add(Arc.epsilon(exit));
        return new Fragment(entry, exit);
    }

    static Fragment star(Fragment e) {
        final State entry = new State();
        final State exit = new State();
        entry.add(Arc.epsilon(e.entry));
        entry.add(Arc.epsilon(exit));
        e.exit.add(Arc.epsilon(e.entry));
        e.exit.add(Arc.epsilon(exit));
        return new Fragment(entry, exit);
    }

    static Fragment question(Fragment e) {
        final State entry = new State();
        final State exit = new State();
        entry.add(Arc.epsilon(e.entry));
        entry.add(Arc.epsilon(exit));
        e.exit.add(Arc.epsilon(exit));
        return new Fragment(entry, exit);
    }

    /**
     * <code>e{min,max}</code>: <code>min</code> copies in sequence, then
     * either <code>max - min</code> optional copies in sequence, or a starred
     * copy if <code>max</code> is unbounded. <code>e</code> itself is left
     * unused; only copies end up in the graph.
     */
    static Fragment repeat(Fragment e, int min, int max) {
        Fragment acc = exactly(e, min);
        if (max == Token.UNBOUNDED) {
            return cat(acc, star(copy(e)));
        }
        for (int i = min; i < max; ++i) {
            acc = cat(acc, question(copy(e)));
        }
        return acc;
    }

    private static Fragment exactly(Fragment e, int times) {
        if (times == 0) {
            return Fragment.empty();
        }
        Fragment acc = copy(e);
        for (int i = 1; i < times; ++i) {
            acc = cat(acc, copy(e));
        }
        return acc;
    }

    /**
     * Copies every state reachable from <code>f.entry</code>, with its anchor
     * flags, and re-creates every arc between the copies. The copy shares no
     * state with <code>f</code>. Arcs leading out of the reachable set are
     * dropped; a self-contained fragment has none.
     */
    static Fragment copy(Fragment f) {
        final Map<State, State> map = new IdentityHashMap<State, State>();
        new BreadthFirstVisitor<State, Arc>() {
            @Override
            protected void visit(State old) {
                State s = new State();
                s.mustBeStart = old.mustBeStart;
                s.mustBeEnd = old.mustBeEnd;
                map.put(old, s);
            }
        }.start(f.entry);
        for (Map.Entry<State, State> e : map.entrySet()) {
            final State copy = e.getValue();
            for (Arc arc : e.getKey().arcs()) {
                final State ns = map.get(arc.ns);
                if (ns == null) continue;
                copy.add(arc.consumes ? Arc.consuming(ns, arc.cc) : Arc.epsilon(ns));
            }
        }
        final State exit = map.get(f.exit);
        assert exit != null : "fragment exit not reachable from its entry";
        return new Fragment(map.get(f.entry), exit);
    }
}
