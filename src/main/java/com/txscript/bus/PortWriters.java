package com.txscript.bus;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import com.txscript.debug.Debug;

/**
 * Serializes writes per port: each port has its own single-thread executor, so frames on
 * one port go out in order while distinct ports are written concurrently.
 */
public final class PortWriters implements AutoCloseable {

    /** Creates the executor that owns writes for one port. */
    @FunctionalInterface
    public interface ExecutorFactory {
        Executor create(int port);
    }

    /** One daemon thread per port, named after it. */
    public static final ExecutorFactory SINGLE_THREAD_PER_PORT = port -> Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "txscript-port-" + port);
        t.setDaemon(true);
        return t;
    });

    private static final String TAG = "txscript.bus";

    private final CanBus bus;
    private final ExecutorFactory factory;
    private final Map<Integer, Executor> writers = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public PortWriters(CanBus bus, ExecutorFactory factory) {
        this.bus = bus;
        this.factory = factory;
    }

    /**
     * Queue one write. The future completes with the bus result, or exceptionally if the
     * bus threw or the writers are closed.
     */
    public CompletableFuture<Boolean> write(int port, long id, byte[] data, boolean extended) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("port writers closed"));
        }
        byte[] payload = data.clone();
        Executor executor = writers.computeIfAbsent(port, factory::create);
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return bus.sendFrame(port, id, payload, extended);
                } catch (IOException e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Stop accepting writes but let queued ones finish. */
    public void shutdown() {
        stop(false);
    }

    /** Stop accepting writes and interrupt queued ones. */
    @Override
    public void close() {
        stop(true);
    }

    private void stop(boolean now) {
        closed = true;
        for (Map.Entry<Integer, Executor> e : writers.entrySet()) {
            if (e.getValue() instanceof ExecutorService) {
                ExecutorService service = (ExecutorService) e.getValue();
                if (now) service.shutdownNow();
                else service.shutdown();
            }
        }
        if (!writers.isEmpty()) {
            Debug.get().d(TAG, (now ? "closed" : "shut down") + " writers for ports " + writers.keySet());
        }
        writers.clear();
    }
}
