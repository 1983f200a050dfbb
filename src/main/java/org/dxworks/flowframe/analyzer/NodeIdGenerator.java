package org.dxworks.flowframe.analyzer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monotonic node identities of the form {@code static-N}, starting at 1 after a reset.
 */
public class NodeIdGenerator {

    private static final NodeIdGenerator SHARED = new NodeIdGenerator();

    private final AtomicInteger counter = new AtomicInteger();

    public static NodeIdGenerator shared() {
        return SHARED;
    }

    public String next() {
        return "static-" + counter.incrementAndGet();
    }

    public void reset() {
        counter.set(0);
    }
}
