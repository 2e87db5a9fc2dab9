package com.trading.flowgen.wiring;

import com.trading.flowgen.GenerationOutcome;
import com.trading.flowgen.StrategyBuilder;
import com.trading.flowgen.codegen.GenerationRequest;
import com.trading.flowgen.io.FlowGenConfig;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.EventTranslatorTwoArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serializes generation requests through an LMAX Disruptor ring buffer.
 *
 * <p>
 * Any number of threads may {@link #submit} concurrently (multi-producer).
 * A single consumer thread runs {@link StrategyBuilder#build} for one request
 * at a time, so the history lookup and the save that follows it never
 * interleave: two identical requests for the same instance yield one saved
 * record, and the second outcome is marked {@code reused}.
 *
 * <p>
 * Failures inside the pipeline complete the caller's future exceptionally;
 * the consumer thread keeps running.
 */
public final class GenerationPublisher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GenerationPublisher.class);

    private static final EventTranslatorTwoArg<GenerationEvent, GenerationRequest, CompletableFuture<GenerationOutcome>> TRANSLATOR =
            (event, sequence, request, future) -> event.set(request, future);

    private final Disruptor<GenerationEvent> disruptor;
    private final RingBuffer<GenerationEvent> ringBuffer;
    private volatile boolean closed;

    public GenerationPublisher(StrategyBuilder builder, FlowGenConfig config) {
        this(builder, config.getRingBufferSize());
    }

    /**
     * @param bufferSize ring buffer capacity; must be a power of two
     */
    public GenerationPublisher(StrategyBuilder builder, int bufferSize) {
        Objects.requireNonNull(builder, "builder");
        if (bufferSize <= 0 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of two: " + bufferSize);

        this.disruptor = new Disruptor<>(
                GenerationEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new Handler(builder));
        this.ringBuffer = disruptor.start();
        log.info("Generation publisher started (buffer size {})", bufferSize);
    }

    /** Queues a request; blocks only while the ring buffer is full. */
    public CompletableFuture<GenerationOutcome> submit(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        if (closed)
            throw new IllegalStateException("Generation publisher is closed");
        CompletableFuture<GenerationOutcome> future = new CompletableFuture<>();
        ringBuffer.publishEvent(TRANSLATOR, request, future);
        return future;
    }

    /** Stops accepting requests and waits for queued ones to finish. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            disruptor.shutdown(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.error("Generation publisher did not drain within 30s; halting", e);
            disruptor.halt();
        }
        log.info("Generation publisher stopped");
    }

    private static final class Handler implements EventHandler<GenerationEvent> {
        private final StrategyBuilder builder;

        Handler(StrategyBuilder builder) {
            this.builder = builder;
        }

        @Override
        public void onEvent(GenerationEvent event, long sequence, boolean endOfBatch) {
            CompletableFuture<GenerationOutcome> future = event.result();
            try {
                GenerationOutcome outcome = builder.build(event.request());
                if (log.isDebugEnabled())
                    log.debug("Request {} for instance {} done in {} us", sequence, event.request().instanceId(),
                            (System.nanoTime() - event.submittedNanos()) / 1_000);
                future.complete(outcome);
            } catch (Throwable t) {
                // Keep the consumer thread alive; the caller sees the failure.
                log.error("Generation failed for instance {}: {}", event.request().instanceId(), t.getMessage(), t);
                future.completeExceptionally(t);
            } finally {
                event.clear();
            }
        }
    }
}
