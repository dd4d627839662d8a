package org.quill.compiler.frontend.parser.ast;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out node ids. Ids are strictly increasing and never reused for the lifetime of the
 * allocator. The allocator is safe to share between threads that build trees concurrently.
 */
public final class NodeIdAllocator {

    private final AtomicLong next;

    public NodeIdAllocator() {
        this(1);
    }

    /**
     * @param firstId The id handed out by the first call to {@link #nextId()}.
     */
    public NodeIdAllocator(long firstId) {
        this.next = new AtomicLong(firstId);
    }

    /**
     * @return A fresh id.
     */
    public long nextId() {
        return next.getAndIncrement();
    }

    /**
     * @return The id the next call to {@link #nextId()} will return.
     */
    public long peek() {
        return next.get();
    }
}
