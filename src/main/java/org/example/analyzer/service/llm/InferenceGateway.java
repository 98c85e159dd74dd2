package org.example.analyzer.service.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single shared handle to the inference engine.
 *
 * At most one provider call is in flight at any time. Callers queue on a fair permit,
 * so calls from different chapters are served first-come-first-served. Each call runs
 * on a worker thread and is awaited with a timeout; a caller that waits too long gets
 * {@link InferenceTimeoutException}, but the permit stays with the worker until the
 * provider call has actually returned.
 */
public class InferenceGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceGateway.class);

    private final LlmProvider provider;
    private final Duration timeout;
    private final Semaphore enginePermit = new Semaphore(1, true);
    private final ExecutorService callExecutor;

    public InferenceGateway(LlmProvider provider, Duration timeout) {
        this.provider = provider;
        this.timeout = timeout;
        AtomicInteger threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "inference-call-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Inference gateway ready: provider={}, timeout={}s",
                provider.getProviderName(), timeout.toSeconds());
    }

    /**
     * Run one inference call while holding the engine permit.
     *
     * @throws TokenOverflowException when the provider reports a context overflow
     * @throws InferenceTimeoutException when the call exceeds the timeout
     * @throws LlmProviderException on any other provider failure
     */
    public String generate(String systemPrompt, String userPrompt, LlmOptions options) {
        try {
            enginePermit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for inference", e);
        }

        // Whoever claims the call first owns the permit: the worker when it starts,
        // or the caller when it gives up before the worker ever ran.
        AtomicBoolean claimed = new AtomicBoolean();
        Future<String> call;
        try {
            call = callExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return provider.generate(systemPrompt, userPrompt, options);
                } finally {
                    enginePermit.release();
                }
            });
        } catch (RejectedExecutionException e) {
            enginePermit.release();
            throw new EngineUnavailableException("Inference gateway is shut down", e);
        }

        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(call, claimed);
            log.warn("Inference call timed out after {}s", timeout.toSeconds());
            throw new InferenceTimeoutException("Inference call exceeded " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            abandon(call, claimed);
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for inference", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LlmProviderException providerException) {
                throw providerException;
            }
            throw new LlmProviderException("Inference call failed", cause);
        }
    }

    private void abandon(Future<String> call, AtomicBoolean claimed) {
        if (claimed.compareAndSet(false, true)) {
            enginePermit.release();
        }
        call.cancel(true);
    }

    public boolean isAvailable() {
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            log.debug("Availability check failed: {}", e.getMessage());
            return false;
        }
    }

    public String getProviderName() {
        return provider.getProviderName();
    }

    /**
     * Number of callers currently waiting for the engine.
     */
    public int getQueueLength() {
        return enginePermit.getQueueLength();
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
