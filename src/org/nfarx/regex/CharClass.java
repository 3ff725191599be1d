/*
 * @LICENSE@
 */

package org.nfarx.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.nfarx.regex.Misc.Esc.RXCC;

/**
 * An immutable value class representing the bracketed character classes of a
 * pattern (<code>[abc]</code>, <code>[^a-z_]</code>, ...). A char is a member
 * if it is one of the single chars or lies in one of the ranges; a negated
 * class inverts that test.
 * <p>
 * The {@link Builder} is used by the {@link Tokenizer} to build up a class one
 * member at a time. A range whose last char sorts before its first char is
 * kept, and simply contains nothing.
 * <p>
 * The predefined shorthand classes (<code>\d</code>, <code>\w</code>,
 * <code>\s</code> and their complements) are plain {@link CharCondition}s
 * held here as constants.
 */
final class CharClass implements CharCondition {

    static final class Interval {

        /**
         * <code>begin</code> is inclusive.
         */
        final int begin;
        /**
         * <code>end</code> is exclusive.
         */
        final int end;

        private Interval(char first, char last) {
            this.begin = first;
            this.end = last + 1;
        }

        boolean contains(char c) {
            return begin <= c && c < end;
        }

        @Override
        public int hashCode() {
            return 31 * begin + end;
        }
        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Interval))
                return false;
            final Interval ci = (Interval) o;
            return begin == ci.begin && end == ci.end;
        }
        @Override
        public String toString() {
            return RXCC.esc(begin) + '-' + RXCC.esc(end - 1);
        }
    }

    static final CharCondition DIGIT = new CharCondition() {
        public boolean test(char c) {
            return '0' <= c && c <= '9';
        }
        @Override
        public String toString() {
            return "\\d";
        }
    };

    static final CharCondition WORD = new CharCondition() {
        public boolean test(char c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }
        @Override
        public String toString() {
            return "\\w";
        }
    };

    static final CharCondition SPACE = new CharCondition() {
        public boolean test(char c) {
            return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f';
        }
        @Override
        public String toString() {
            return "\\s";
        }
    };

    static final CharCondition NDIGIT = complement(DIGIT, "\\D");
    static final CharCondition NWORD = complement(WORD, "\\W");
    static final CharCondition NSPACE = complement(SPACE, "\\S");

    private static CharCondition complement(final CharCondition cc, final String name) {
        return new CharCondition() {
            public boolean test(char c) {
                return !cc.test(c);
            }
            @Override
            public String toString() {
                return name;
            }
        };
    }

    /**
     * Single char literal condition.
     */
    static CharCondition literal(final char ch) {
        return new CharCondition() {
            public boolean test(char c) {
                return c == ch;
            }
            @Override
            public String toString() {
                return RXCC.esc(ch);
            }
        };
    }

    /**
     * Wraps a condition so that a char passes if it, its upper case or its
     * lower case form passes. {@link CharCondition#TRUE} is returned as is.
     */
    static CharCondition foldCase(final CharCondition cc) {
        if (cc == CharCondition.TRUE) return cc;
        return new CharCondition() {
            public boolean test(char c) {
                return cc.test(c)
                    || cc.test(Character.toLowerCase(c))
                    || cc.test(Character.toUpperCase(c));
            }
            @Override
            public String toString() {
                return "(?i)" + cc;
            }
        };
    }

    private final boolean negated;
    private final SortedSet<Character> chars;
    private final List<Interval> ranges;

    private CharClass(boolean negated, SortedSet<Character> chars, List<Interval> ranges) {
        this.negated = negated;
        this.chars = Collections.unmodifiableSortedSet(chars);
        this.ranges = Collections.unmodifiableList(ranges);
    }

    boolean contains(char c) {
        boolean in = chars.contains(c);
        for (int i = 0; !in && i < ranges.size(); ++i) {
            in = ranges.get(i).contains(c);
        }
        return in != negated;
    }

    public boolean test(char c) {
        return contains(c);
    }

    boolean isNegated() {
        return negated;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = negated ? 1231 : 1237;
        result = prime * result + chars.hashCode();
        result = prime * result + ranges.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CharClass))
            return false;
        final CharClass cc = (CharClass) o;
        return negated == cc.negated
            && chars.equals(cc.chars)
            && ranges.equals(cc.ranges);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[');
        if (negated) sb.append('^');
        for (char c : chars) RXCC.esc(sb, c);
        for (Interval ci : ranges) sb.append(ci);
        sb.append(']');
        return sb.toString();
    }

    static final class Builder {

        private boolean negated = false;
        private final SortedSet<Character> chars = new TreeSet<Character>();
        private final List<Interval> ranges = new ArrayList<Interval>();

        /**
         * Creates an empty <code>Builder</code> instance
         */
        Builder() {
        }

        Builder add(char c) {
            chars.add(c);
            return this;
        }

        /**
         * @param first
         *            first char of the range, inclusive
         * @param last
         *            last char of the range, inclusive
         * @return <code>this</code>.
         */
        Builder add(char first, char last) {
            ranges.add(new Interval(first, last));
            return this;
        }

        Builder complement() {
            negated = !negated;
            return this;
        }

        boolean isEmpty() {
            return chars.isEmpty() && ranges.isEmpty();
        }

        CharClass build() {
            return new CharClass(
                negated,
                new TreeSet<Character>(chars),
                new ArrayList<Interval>(ranges));
        }
    }
}
