package koi.lang;

import static java.util.Map.entry;
import static koi.lang.Token.Kind.*;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Last stage: splits each {@code LINE} into keywords, operators, names and
 * integer literals, left to right. Every other token passes through.
 */
final class WordSplitter extends Pass {

    private static final ImmutableMap<String, Token.Kind> keywords = ImmutableMap.ofEntries(
        entry("if", IF),
        entry("else", ELSE),
        entry("while", WHILE),
        entry("return", RETURN));

    private static final ImmutableMap<String, Token.Kind> operators = ImmutableMap.ofEntries(
        entry("==", EQUAL),
        entry("!=", NOT_EQUAL),
        entry("<=", LESS_EQUAL),
        entry(">=", GREATER_EQUAL),
        entry("->", ARROW));

    private static final ImmutableMap<Character, Token.Kind> punctuation = ImmutableMap.ofEntries(
        entry('=', ASSIGN),
        entry('+', PLUS),
        entry('-', MINUS),
        entry('*', STAR),
        entry('/', SLASH),
        entry('<', LESS),
        entry('>', GREATER),
        entry(',', COMMA),
        entry(':', COLON),
        entry('(', PAREN_LEFT),
        entry(')', PAREN_RIGHT));

    private static final String BOUNDARY = "(?![\\p{L}\\p{Nd}_])";

    private static final Pattern identifier = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

    private static record IntegerForm(Pattern pattern, int radix) {
        IntegerForm(String digits, int radix) {
            this(Pattern.compile(digits + BOUNDARY), radix);
        }
    }

    // prefixed forms first, so the leading 0 is not taken for a decimal
    private static final ImmutableList<IntegerForm> integers = ImmutableList.of(
        new IntegerForm("0[xX]([0-9a-fA-F]+)", 16),
        new IntegerForm("0[oO]([0-7]+)", 8),
        new IntegerForm("0[bB]([01]+)", 2),
        new IntegerForm("(0|[1-9][0-9]*)", 10));

    WordSplitter(Iterator<Token> upstream) {
        super(upstream);
    }

    @Override
    protected void process(Token token) {
        if (!token.is(LINE)) {
            emit(token);
            return;
        }

        var text = token.text();
        var current = skipWhitespace(text, 0);
        while (current < text.length()) {
            var width = scanWord(text, current, token.position().shift(current));
            current = skipWhitespace(text, current + width);
        }
    }

    /** Emits the word starting at {@code start} and returns its width. */
    private int scanWord(String text, int start, Position position) {
        for (var keyword : keywords.entrySet()) {
            var word = keyword.getKey();
            if (text.startsWith(word, start) && !isIdentifierPart(text, start + word.length())) {
                emit(Token.of(keyword.getValue(), position));
                return word.length();
            }
        }

        for (var operator : operators.entrySet()) {
            if (text.startsWith(operator.getKey(), start)) {
                emit(Token.of(operator.getValue(), position));
                return operator.getKey().length();
            }
        }

        var single = punctuation.get(text.charAt(start));
        if (single != null) {
            emit(Token.of(single, position));
            return 1;
        }

        var name = identifier.matcher(text).region(start, text.length());
        if (name.lookingAt()) {
            emit(new Token(NAME, position, name.group()));
            return name.end() - start;
        }

        for (var form : integers) {
            var literal = form.pattern().matcher(text).region(start, text.length());
            if (literal.lookingAt()) {
                emit(new Token(INT, position, new BigInteger(literal.group(1), form.radix())));
                return literal.end() - start;
            }
        }

        throw new LexException(position);
    }

    private static boolean isIdentifierPart(String text, int index) {
        if (index >= text.length()) {
            return false;
        }
        var c = text.codePointAt(index);
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int skipWhitespace(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}
