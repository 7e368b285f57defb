package org.sml;

import java.util.concurrent.CancellationException;
import java.util.concurrent.SynchronousQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a {@link Lexer} on its own thread. Tokens are handed over one at a
 * time: the scanner blocks after each token until the consumer takes it.
 * Closing the stream stops the scanner thread.
 */
public class ConcurrentLexer implements TokenStream {
    private static final Logger log = LogManager.getLogger("lexer");

    private final SynchronousQueue<Token> items = new SynchronousQueue<>();
    private final Thread thread;
    private Token last;

    public ConcurrentLexer(String name, String input) {
        var lexer = new Lexer(name, input);
        var queue = this.items;
        this.thread = new Thread(() -> run(lexer, queue), "lexer-" + name);
        this.thread.setDaemon(true);
        this.thread.start();
    }

    private static void run(Lexer lexer, SynchronousQueue<Token> items) {
        try {
            Token token;
            do {
                token = lexer.nextToken();
                items.put(token);
            } while (!token.isTerminal());
            log.debug("scanner for " + lexer.name + " finished");
        } catch (InterruptedException e) {
            log.debug("scanner for " + lexer.name + " stopped at " + lexer.pos);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public Token nextToken() {
        if (last != null && last.isTerminal()) {
            return last;
        }
        try {
            last = items.take();
            return last;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for the scanner");
        }
    }

    // Whether the scanner thread is still running
    boolean isRunning() {
        return thread.isAlive();
    }

    void join(long millis) throws InterruptedException {
        thread.join(millis);
    }

    @Override
    public void close() {
        thread.interrupt();
    }
}
