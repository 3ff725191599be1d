/*
 * @LICENSE@
 */

package org.nfarx.regex;

import static org.nfarx.regex.Misc.isSet;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.nfarx.regex.Token.Kind;

/**
 * Turns a pattern string into a flat list of {@link Token}s in a single left
 * to right pass, then makes sequencing explicit by inserting
 * {@link Kind#CONCAT} tokens. Supported syntax:
 * <ul>
 * <li><code>( ) | * + ?</code> - grouping, alternation and quantifiers</li>
 * <li><code>.</code> - any char</li>
 * <li><code>^ $</code> - start and end of the whole input</li>
 * <li><code>[abc] [^a-z]</code> - char classes; no escapes inside</li>
 * <li><code>\d \D \w \W \s \S</code> - shorthand classes; any other escaped
 * char stands for itself</li>
 * <li><code>{m} {m,} {m,n}</code> - bounded repetition</li>
 * </ul>
 */
final class Tokenizer {

    private static final Logger logger = Logger.getLogger("org.nfarx.regex");
    private static final Level level = Level.FINEST;

    /*
     * A CONCAT goes between A and B iff A is a "left" kind and B a "right" kind.
     */
    private static final EnumSet<Kind> CONCAT_LEFT = EnumSet.of(
        Kind.LITERAL, Kind.STAR, Kind.PLUS, Kind.QUESTION, Kind.CLOSE,
        Kind.START_ANCHOR, Kind.REPEAT);
    private static final EnumSet<Kind> CONCAT_RIGHT = EnumSet.of(
        Kind.LITERAL, Kind.OPEN, Kind.END_ANCHOR);

    /*
     * printable ASCII literals are shared
     */
    private static final CharCondition[] ASCII_CACHE = new CharCondition[127 - 32];
    static {
        for (int i = 0; i < ASCII_CACHE.length; ++i) {
            ASCII_CACHE[i] = CharClass.literal((char) (i + 32));
        }
    }

    private final String regex;
    private final boolean foldcase;
    private int position = 0;

    private Tokenizer(String regex, int flags) {
        this.regex = regex;
        this.foldcase = isSet(flags, Regex.CASE_INSENSITIVE);
    }

    static List<Token> tokenize(String regex) {
        return tokenize(regex, 0);
    }

    static List<Token> tokenize(String regex, int flags) {
        final Tokenizer tokenizer = new Tokenizer(regex, flags);
        final List<Token> base = isSet(flags, Regex.LITERAL)
            ? tokenizer.scanLiteral()
            : tokenizer.scan();
        final List<Token> tokens = addConcats(base);
        if (logger.isLoggable(level)) {
            logger.log(level, "tokens: " + tokens);
        }
        return tokens;
    }

    private List<Token> scanLiteral() {
        List<Token> tokens = new ArrayList<Token>(regex.length());
        for (position = 0; position < regex.length(); ++position) {
            tokens.add(literal(charCondition(regex.charAt(position))));
        }
        return tokens;
    }

    private List<Token> scan() {
        List<Token> tokens = new ArrayList<Token>(regex.length());
        for (position = 0; position < regex.length(); ++position) {
            final char c = regex.charAt(position);
            switch (c) {
            case '(':
                tokens.add(Token.of(Kind.OPEN));
                break;
            case ')':
                tokens.add(Token.of(Kind.CLOSE));
                break;
            case '|':
                tokens.add(Token.of(Kind.ALT));
                break;
            case '*':
                tokens.add(Token.of(Kind.STAR));
                break;
            case '+':
                tokens.add(Token.of(Kind.PLUS));
                break;
            case '?':
                tokens.add(Token.of(Kind.QUESTION));
                break;
            case '.':
                tokens.add(Token.literal(CharCondition.TRUE));
                break;
            case '^':
                tokens.add(Token.of(Kind.START_ANCHOR));
                break;
            case '$':
                tokens.add(Token.of(Kind.END_ANCHOR));
                break;
            case '[':
                tokens.add(literal(scanCharClass()));
                break;
            case '\\':
                tokens.add(literal(scanEscape()));
                break;
            case '{':
                tokens.add(scanRepeat());
                break;
            default:
                tokens.add(literal(charCondition(c)));
            }
        }
        return tokens;
    }

    private Token literal(CharCondition cc) {
        return Token.literal(foldcase ? CharClass.foldCase(cc) : cc);
    }

    private static CharCondition charCondition(char c) {
        final int i = c - 32;
        return 0 <= i && i < ASCII_CACHE.length ? ASCII_CACHE[i] : CharClass.literal(c);
    }

    /*
     * position is on the '['; leaves it on the ']'
     */
    private CharClass scanCharClass() {
        final int end = regex.indexOf(']', position + 1);
        if (end < 0) {
            syntaxError("Unterminated character class");
        }
        final String content = regex.substring(position + 1, end);
        position = end;
        return parseCharClass(content);
    }

    /**
     * Parses the inside of a char class. <code>x-y</code> is a range only if a
     * char follows the '-', so a trailing '-' (as in <code>[a-]</code>) is a
     * plain member, as is a leading one.
     */
    static CharClass parseCharClass(String content) {
        final CharClass.Builder ccb = new CharClass.Builder();
        int i = 0;
        if (content.startsWith("^")) {
            ccb.complement();
            i = 1;
        }
        while (i < content.length()) {
            if (i + 2 < content.length() && content.charAt(i + 1) == '-') {
                ccb.add(content.charAt(i), content.charAt(i + 2));
                i += 3;
            } else {
                ccb.add(content.charAt(i));
                ++i;
            }
        }
        return ccb.build();
    }

    /*
     * position is on the '\'; leaves it on the escaped char
     */
    private CharCondition scanEscape() {
        if (position + 1 >= regex.length()) {
            syntaxError("Dangling escape");
        }
        final char c = regex.charAt(++position);
        switch (c) {
        case 'd':
            return CharClass.DIGIT;
        case 'D':
            return CharClass.NDIGIT;
        case 'w':
            return CharClass.WORD;
        case 'W':
            return CharClass.NWORD;
        case 's':
            return CharClass.SPACE;
        case 'S':
            return CharClass.NSPACE;
        default:
            return charCondition(c);
        }
    }

    /*
     * position is on the '{'; leaves it on the '}'
     */
    private Token scanRepeat() {
        final int end = regex.indexOf('}', position + 1);
        if (end < 0) {
            syntaxError("Unterminated repetition");
        }
        final String body = regex.substring(position + 1, end);
        final String[] parts = body.split(",", -1);
        final int min;
        final int max;
        switch (parts.length) {
        case 1:
            min = max = bound(parts[0], body);
            break;
        case 2:
            min = parts[0].isEmpty() ? 0 : bound(parts[0], body);
            max = parts[1].isEmpty() ? Token.UNBOUNDED : bound(parts[1], body);
            break;
        default:
            syntaxError("Bad repetition syntax: {" + body + "}");
            return null; // not reached
        }
        if (min < 0) {
            syntaxError("Repetition minimum must be >= 0: {" + body + "}");
        }
        if (max != Token.UNBOUNDED && max < min) {
            syntaxError("Repetition maximum must be >= minimum: {" + body + "}");
        }
        position = end;
        return Token.repeat(min, max);
    }

    private int bound(String s, String body) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            syntaxError("Bad repetition bound '" + s + "': {" + body + "}");
            return 0; // not reached
        }
    }

    private static List<Token> addConcats(List<Token> tokens) {
        final List<Token> ret = new ArrayList<Token>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); ++i) {
            final Token t = tokens.get(i);
            ret.add(t);
            if (i + 1 < tokens.size()
                    && CONCAT_LEFT.contains(t.kind)
                    && CONCAT_RIGHT.contains(tokens.get(i + 1).kind)) {
                ret.add(Token.of(Kind.CONCAT));
            }
        }
        return ret;
    }

    private void syntaxError(String msg) {
        throw new PatternSyntaxException(msg, regex, position);
    }
}
