/*
 * @LICENSE@
 */

package org.nfarx.regex;

/**
 * An immutable token produced by the {@link Tokenizer} and consumed once by
 * the {@link GraphBuilder}. Only {@link Kind#LITERAL} tokens carry a
 * condition; only {@link Kind#REPEAT} tokens carry bounds.
 */
final class Token {

    enum Kind {
        LITERAL,
        /**
         * Synthetic, inserted between tokens which must be sequenced.
         */
        CONCAT,
        ALT, STAR, PLUS, QUESTION,
        /**
         * Bounded repetition: <code>{m}</code>, <code>{m,}</code>,
         * <code>{m,n}</code>
         */
        REPEAT,
        OPEN, CLOSE,
        START_ANCHOR, END_ANCHOR;
    }

    /**
     * Marker for an unbounded {@link #max}.
     */
    static final int UNBOUNDED = -1;

    final Kind kind;
    final CharCondition condition;
    final int min;
    final int max;

    private Token(Kind kind, CharCondition condition, int min, int max) {
        this.kind = kind;
        this.condition = condition;
        this.min = min;
        this.max = max;
    }

    static Token of(Kind kind) {
        assert kind != Kind.LITERAL && kind != Kind.REPEAT : kind;
        return new Token(kind, null, 0, 0);
    }

    static Token literal(CharCondition condition) {
        assert condition != null;
        return new Token(Kind.LITERAL, condition, 0, 0);
    }

    static Token repeat(int min, int max) {
        assert min >= 0 && (max == UNBOUNDED || max >= min);
        return new Token(Kind.REPEAT, null, min, max);
    }

    boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    /**
     * @return the precedence of an operator token, or 0 for everything else.
     */
    int precedence() {
        switch (kind) {
        case ALT:
            return 1;
        case CONCAT:
            return 2;
        case STAR: case PLUS: case QUESTION: case REPEAT:
            return 3;
        default:
            return 0;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
        case LITERAL:
            return String.valueOf(condition);
        case REPEAT:
            return "{" + min + (min == max ? "" : "," + (isUnbounded() ? "" : max)) + "}";
        case CONCAT:
            return "~";
        case ALT:
            return "|";
        case STAR:
            return "*";
        case PLUS:
            return "+";
        case QUESTION:
            return "?";
        case OPEN:
            return "(";
        case CLOSE:
            return ")";
        case START_ANCHOR:
            return "^";
        case END_ANCHOR:
            return "$";
        default:
            throw new AssertionError(kind);
        }
    }
}
