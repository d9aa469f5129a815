package koi.lang;

import java.util.Iterator;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Composes the pipeline stages. Every method returns a fresh lazy iterator;
 * nothing is read until the first token is pulled.
 *
 * <pre>
 * lines        :: LineSplitter
 * strings      :: lines + StringExtractor
 * comments     :: strings + CommentFilter
 * indentation  :: comments + IndentationTracker
 * tokenize     :: indentation + WordSplitter
 * </pre>
 */
@RequiredArgsConstructor
public final class Lexer {

    @Getter
    private final @NonNull LexerConfig config;

    public Lexer() {
        this(LexerConfig.DEFAULT);
    }

    public Iterator<Token> lines(@NonNull String source) {
        return new LineSplitter(source);
    }

    public Iterator<Token> strings(String source) {
        return new StringExtractor(lines(source), config);
    }

    public Iterator<Token> comments(String source) {
        return new CommentFilter(strings(source), config);
    }

    public Iterator<Token> indentation(String source) {
        return new IndentationTracker(comments(source));
    }

    public Iterator<Token> tokenize(String source) {
        return new WordSplitter(indentation(source));
    }

    public TokenStream stream(String source) {
        return new TokenStream(tokenize(source));
    }

    //// single stages over an arbitrary upstream ////

    public Iterator<Token> extractStrings(Iterator<Token> upstream) {
        return new StringExtractor(upstream, config);
    }

    public Iterator<Token> filterComments(Iterator<Token> upstream) {
        return new CommentFilter(upstream, config);
    }

    public Iterator<Token> trackIndentation(Iterator<Token> upstream) {
        return new IndentationTracker(upstream);
    }

    public Iterator<Token> splitWords(Iterator<Token> upstream) {
        return new WordSplitter(upstream);
    }
}
