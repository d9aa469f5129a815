package koi.lang;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import com.google.common.collect.AbstractIterator;

import lombok.NonNull;

/**
 * A lazy pipeline stage. Each upstream token is handed to {@link #process}
 * only once every token emitted for the previous one has been pulled, so a
 * stage never runs ahead of its consumer.
 */
abstract class Pass extends AbstractIterator<Token> {

    private final Iterator<Token> upstream;
    private final Deque<Token> pending = new ArrayDeque<>();
    private boolean finished = false;

    Pass(@NonNull Iterator<Token> upstream) {
        this.upstream = upstream;
    }

    /**
     * Handles one upstream token, emitting zero or more tokens.
     */
    protected abstract void process(Token token);

    protected final void emit(Token token) {
        pending.add(token);
    }

    /**
     * Ends the stream once the tokens emitted so far have been pulled.
     */
    protected final void finish() {
        finished = true;
    }

    @Override
    protected final Token computeNext() {
        while (pending.isEmpty()) {
            if (finished || !upstream.hasNext()) {
                return endOfData();
            }
            process(upstream.next());
        }
        return pending.poll();
    }
}
