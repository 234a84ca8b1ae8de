package org.sysmlite.kerml.m3;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out element identifiers. One allocator is shared by all documents of
 * a workspace; identifiers are monotonic and never reused.
 */
public final class IdAllocator {

    private final AtomicLong next;

    public IdAllocator() {
        this(1);
    }

    public IdAllocator(long first) {
        this.next = new AtomicLong(first);
    }

    public long next() {
        return next.getAndIncrement();
    }

    /**
     * @return the id the next call to {@link #next()} will return
     */
    public long peek() {
        return next.get();
    }
}
