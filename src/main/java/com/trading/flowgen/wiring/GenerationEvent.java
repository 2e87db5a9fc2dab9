package com.trading.flowgen.wiring;

import com.trading.flowgen.GenerationOutcome;
import com.trading.flowgen.codegen.GenerationRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot carrying one generation request to the consumer
 * thread.
 * <p>
 * Instances are pre-allocated by the ring buffer and reused; the consumer
 * clears the slot once the request has been answered so the request and its
 * future are not retained.
 */
public final class GenerationEvent {
    private GenerationRequest request;
    private CompletableFuture<GenerationOutcome> result;
    private long submittedNanos;

    void set(GenerationRequest request, CompletableFuture<GenerationOutcome> result) {
        this.request = request;
        this.result = result;
        this.submittedNanos = System.nanoTime();
    }

    public GenerationRequest request() {
        return request;
    }

    public CompletableFuture<GenerationOutcome> result() {
        return result;
    }

    public long submittedNanos() {
        return submittedNanos;
    }

    public void clear() {
        request = null;
        result = null;
        submittedNanos = 0;
    }
}
