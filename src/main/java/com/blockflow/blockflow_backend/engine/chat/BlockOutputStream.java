package com.blockflow.blockflow_backend.engine.chat;

import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Streamed output of one block. The executor's event thread pushes, a drain task reads; the
 * stream ends when {@link #close()} is called.
 */
final class BlockOutputStream {

    private record Piece(String text) {}

    private static final Piece END = new Piece(null);

    private final String blockId;
    private final BlockingQueue<Piece> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Instant completedAt;

    BlockOutputStream(String blockId) {
        this.blockId = blockId;
    }

    String blockId() {
        return blockId;
    }

    void push(String text) {
        if (!closed.get()) {
            queue.add(new Piece(text));
        }
    }

    void close() {
        if (closed.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    /** Hands every pushed piece to {@code writer} in order, returning once the stream is closed. */
    void drainTo(Consumer<String> writer) throws InterruptedException {
        while (true) {
            Piece next = queue.take();
            if (next == END) break;
            writer.accept(next.text());
        }
        completedAt = Instant.now();
    }

    /** When the last piece was drained; null while the stream is open. */
    Instant completedAt() {
        return completedAt;
    }
}
