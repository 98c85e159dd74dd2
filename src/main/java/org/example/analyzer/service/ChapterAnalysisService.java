package org.example.analyzer.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.analyzer.model.AnalysisProgress;
import org.example.analyzer.model.AnalysisRunState;
import org.example.analyzer.model.AnalysisStatusResponse;
import org.example.analyzer.model.ChapterAnalysisResult;
import org.example.analyzer.service.analysis.AnalysisStore;
import org.example.analyzer.service.analysis.ChapterAnalysisPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background queue of chapter analyses. Requests are taken by a small pool of workers;
 * each worker runs one chapter at a time through the pipeline, and all workers share
 * the single inference engine.
 *
 * Only queued, running, failed and cancelled chapters are tracked in memory, and a
 * finished job drops its chapter text. Completed chapters are reported from the store.
 */
@Service
public class ChapterAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ChapterAnalysisService.class);

    private final ChapterAnalysisPipeline pipeline;
    private final AnalysisStore store;
    private final Clock clock;
    private final BlockingQueue<AnalysisJob> requestQueue = new LinkedBlockingQueue<>();
    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final int workers;
    private ExecutorService executor;
    private volatile boolean running = true;

    public ChapterAnalysisService(ChapterAnalysisPipeline pipeline,
                                  AnalysisStore store,
                                  Clock clock,
                                  @Value("${analysis.queue.workers:1}") int workers) {
        this.pipeline = pipeline;
        this.store = store;
        this.clock = clock;
        this.workers = Math.max(1, workers);
    }

    @PostConstruct
    public void init() {
        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "chapter-analysis-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workers; i++) {
            executor.submit(this::processQueue);
        }
        log.info("Chapter analysis service started with {} queue worker(s)", workers);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        jobs.values().forEach(job -> job.cancelled = true);
        if (executor != null) {
            executor.shutdownNow();
        }
        log.info("Chapter analysis service shutting down");
    }

    /**
     * Queue a chapter for analysis. A chapter that is already queued or running is not
     * queued twice; the caller gets the pending future instead.
     */
    public CompletableFuture<ChapterAnalysisResult> requestAnalysis(String chapterId, String text) {
        AnalysisJob[] created = new AnalysisJob[1];
        AnalysisJob job = jobs.compute(chapterId, (id, existing) -> {
            if (existing != null && existing.state.isActive()) {
                return existing;
            }
            created[0] = new AnalysisJob(id, text == null ? "" : text, now());
            return created[0];
        });
        if (job == created[0]) {
            requestQueue.offer(job);
            log.debug("Queued analysis for chapter {}", chapterId);
        }
        return job.future;
    }

    /**
     * Request cancellation. A queued chapter is dropped at once; a running one stops
     * after its current unit, keeping its checkpoint for a later resume.
     *
     * @return false when the chapter has no active analysis
     */
    public boolean cancel(String chapterId) {
        AnalysisJob job = jobs.get(chapterId);
        if (job == null || !job.state.isActive()) {
            return false;
        }
        job.cancelled = true;
        if (requestQueue.remove(job)) {
            job.finish(AnalysisRunState.CANCELLED, null, now());
            job.future.completeExceptionally(new CancellationException("Analysis of chapter " + chapterId + " cancelled"));
            log.info("Removed queued analysis for chapter {}", chapterId);
        }
        return true;
    }

    public Optional<AnalysisStatusResponse> getStatus(String chapterId) {
        AnalysisJob job = jobs.get(chapterId);
        if (job != null) {
            return Optional.of(job.toStatus());
        }
        return store.findResult(chapterId)
                .map(result -> new AnalysisStatusResponse(chapterId, AnalysisRunState.COMPLETED, null, 0, 0,
                        result.degraded(), null, result.completedAt()));
    }

    public Optional<ChapterAnalysisResult> getResult(String chapterId) {
        return store.findResult(chapterId);
    }

    public int getQueueDepth() {
        return requestQueue.size();
    }

    public int getWorkers() {
        return workers;
    }

    private void processQueue() {
        while (running) {
            try {
                AnalysisJob job = requestQueue.take();
                process(job);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error processing chapter analysis queue", e);
            }
        }
    }

    private void process(AnalysisJob job) {
        job.state = AnalysisRunState.RUNNING;
        job.updatedAt = now();
        long startedAtMs = System.currentTimeMillis();
        try {
            ChapterAnalysisResult result = pipeline.analyze(job.chapterId, job.text,
                    () -> job.cancelled || !running, job::onProgress);
            job.degraded = result.degraded();
            job.finish(AnalysisRunState.COMPLETED, null, now());
            // The stored result answers status queries from here on
            jobs.remove(job.chapterId, job);
            job.future.complete(result);
            log.info("Analyzed chapter {} in {} ms", job.chapterId, System.currentTimeMillis() - startedAtMs);
        } catch (CancellationException e) {
            job.finish(AnalysisRunState.CANCELLED, null, now());
            job.future.completeExceptionally(e);
        } catch (Exception e) {
            log.error("Failed to analyze chapter {}", job.chapterId, e);
            job.finish(AnalysisRunState.FAILED, e.getMessage(), now());
            job.future.completeExceptionally(e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private final class AnalysisJob {
        private final String chapterId;
        private volatile String text;
        private final CompletableFuture<ChapterAnalysisResult> future = new CompletableFuture<>();
        private volatile AnalysisRunState state = AnalysisRunState.QUEUED;
        private volatile boolean cancelled;
        private volatile AnalysisProgress progress;
        private volatile boolean degraded;
        private volatile String error;
        private volatile LocalDateTime updatedAt;

        private AnalysisJob(String chapterId, String text, LocalDateTime createdAt) {
            this.chapterId = chapterId;
            this.text = text;
            this.updatedAt = createdAt;
        }

        private void onProgress(AnalysisProgress progress) {
            this.progress = progress;
            this.updatedAt = now();
        }

        private void finish(AnalysisRunState finalState, String error, LocalDateTime at) {
            this.state = finalState;
            this.error = error;
            this.text = null;
            this.updatedAt = at;
        }

        private AnalysisStatusResponse toStatus() {
            AnalysisProgress current = progress;
            return new AnalysisStatusResponse(
                    chapterId,
                    state,
                    current != null ? current.passName() : null,
                    current != null ? current.segmentIndex() : 0,
                    current != null ? current.totalSegments() : 0,
                    degraded,
                    error,
                    updatedAt);
        }
    }
}
