package com.example.orchestrator.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * The single thread that applies every state mutation. Messages are applied strictly in the
 * order they were posted; an action that throws is logged and the loop keeps running.
 */
public final class ControlLoop implements Executor, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlLoop.class);
    private static final RpcEnvelope POISON = new RpcEnvelope("poison", () -> {
    });

    private final BlockingQueue<RpcEnvelope> queue = new LinkedBlockingQueue<>();
    private final Thread consumer;
    private final Object lock = new Object();
    private boolean closed;

    public ControlLoop() {
        this("orchestrator-control");
    }

    public ControlLoop(String threadName) {
        consumer = new Thread(this::consume, threadName);
        consumer.setDaemon(true);
        consumer.start();
    }

    /**
     * Queues a one-way message.
     *
     * @throws RejectedExecutionException once the loop is closed
     */
    public void post(String method, Runnable action) {
        synchronized (lock) {
            if (closed) {
                throw new RejectedExecutionException("Control loop is closed, dropping " + method);
            }
            queue.add(new RpcEnvelope(method, action));
        }
    }

    /**
     * Queues a request and returns a future completed with its answer, or exceptionally with
     * whatever the supplier threw.
     */
    public <T> CompletableFuture<T> call(String method, Supplier<T> supplier) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            post(method, () -> {
                try {
                    future.complete(supplier.get());
                } catch (RuntimeException ex) {
                    future.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            future.completeExceptionally(ex);
        }
        return future;
    }

    /**
     * Completes once every message posted before this call has been applied.
     */
    public CompletableFuture<Void> flush() {
        return call("flush", () -> null);
    }

    @Override
    public void execute(Runnable command) {
        post("task", command);
    }

    public boolean inLoop() {
        return Thread.currentThread() == consumer;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Applies the messages already queued, then stops the loop. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            queue.add(POISON);
        }
        if (inLoop()) {
            return;
        }
        try {
            consumer.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the control loop to stop");
        }
    }

    private void consume() {
        try {
            while (true) {
                RpcEnvelope envelope = queue.take();
                if (envelope == POISON) {
                    return;
                }
                apply(envelope);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Control loop stopped unexpectedly", ex);
        }
    }

    private void apply(RpcEnvelope envelope) {
        try {
            envelope.action().run();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to apply {}", envelope.method(), ex);
        }
    }
}
