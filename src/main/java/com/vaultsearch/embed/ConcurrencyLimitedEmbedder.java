package com.vaultsearch.embed;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards a slow, stateful embedding backend. The backend is loaded once and
 * shared; at most {@code maxConcurrency} calls reach it at a time, queued
 * callers are admitted in arrival order, and each call is cut off after
 * {@code timeout}. A timed-out call keeps its slot until the backend returns,
 * so backends must honour interruption or bound their own calls. Failures are
 * reported to the caller, never retried here.
 */
public class ConcurrencyLimitedEmbedder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimitedEmbedder.class);
    private static final String WARMUP_TEXT = "warmup";

    private final EmbeddingBackendLoader loader;
    private final Semaphore admission;
    private final int maxConcurrency;
    private final Duration timeout;
    private final ExecutorService workers;
    private final AtomicReference<CompletableFuture<EmbeddingService>> backend = new AtomicReference<>();

    public ConcurrencyLimitedEmbedder(EmbeddingBackendLoader loader, int maxConcurrency, Duration timeout) {
        this.loader = loader;
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.admission = new Semaphore(this.maxConcurrency, true);
        this.timeout = timeout;
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    public float[] embed(String text) {
        try {
            admission.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailedException("Interrupted while waiting for an embedding slot", e);
        }
        // the slot is released by whoever runs the backend call, once it returns
        AtomicBoolean claimed = new AtomicBoolean();
        Future<float[]> call;
        try {
            EmbeddingService service = awaitBackend();
            call = workers.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return service.embed(text);
                } finally {
                    admission.release();
                }
            });
        } catch (RuntimeException e) {
            admission.release();
            throw e;
        }
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(call, claimed);
            log.warn("Embedding call exceeded {} ms and was cancelled", timeout.toMillis());
            throw new EmbedTimeoutException(timeout);
        } catch (ExecutionException e) {
            throw asFailure("Embedding backend call failed", e.getCause());
        } catch (InterruptedException e) {
            abandon(call, claimed);
            Thread.currentThread().interrupt();
            throw new EmbeddingFailedException("Interrupted while embedding", e);
        }
    }

    /**
     * Starts backend initialisation and a throw-away embedding in the
     * background. Any failure is logged and dropped.
     */
    public CompletableFuture<Void> warmUp() {
        return CompletableFuture.runAsync(() -> {
            try {
                embed(WARMUP_TEXT);
                log.info("Embedding backend warmed up: {}", label());
            } catch (RuntimeException e) {
                log.debug("Embedding warm-up failed; backend will initialise on first query", e);
            }
        }, workers);
    }

    public String label() {
        CompletableFuture<EmbeddingService> current = backend.get();
        if (current != null && current.isDone() && !current.isCompletedExceptionally()) {
            return current.join().version();
        }
        return "uninitialised";
    }

    public boolean isInitialised() {
        CompletableFuture<EmbeddingService> current = backend.get();
        return current != null && current.isDone() && !current.isCompletedExceptionally();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int availableSlots() {
        return admission.availablePermits();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private EmbeddingService awaitBackend() {
        try {
            return backendFuture().get();
        } catch (ExecutionException e) {
            throw asFailure("Embedding backend failed to initialise", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailedException("Interrupted while initialising embedding backend", e);
        }
    }

    private CompletableFuture<EmbeddingService> backendFuture() {
        while (true) {
            CompletableFuture<EmbeddingService> existing = backend.get();
            if (existing != null) {
                return existing;
            }
            CompletableFuture<EmbeddingService> created = new CompletableFuture<>();
            if (backend.compareAndSet(null, created)) {
                log.info("Initialising embedding backend");
                workers.execute(() -> initialise(created));
                return created;
            }
        }
    }

    private void initialise(CompletableFuture<EmbeddingService> target) {
        try {
            EmbeddingService service = loader.load();
            if (service == null) {
                throw new IllegalStateException("Embedding backend loader returned null");
            }
            target.complete(service);
        } catch (Exception e) {
            // a failed load is forgotten so the next call can try again
            backend.compareAndSet(target, null);
            target.completeExceptionally(e);
        }
    }

    private void abandon(Future<float[]> call, AtomicBoolean claimed) {
        call.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            admission.release();
        }
    }

    private static RuntimeException asFailure(String message, Throwable cause) {
        if (cause instanceof EmbeddingFailedException) {
            return (EmbeddingFailedException) cause;
        }
        return new EmbeddingFailedException(message + ": " + cause.getMessage(), cause);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "embedder-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
