package io.malicki.transferpipeline.processing;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process FIFO queue drained by a single worker thread.
 * <p>
 * Jobs run one at a time in enqueue order; a failing job is logged and the
 * next one starts regardless. Nothing is persisted: jobs still queued when the
 * process dies are lost, which {@link ProcessingRecovery} compensates for on
 * the next start.
 */
@Component
@Slf4j
public class TransferWorkQueue {

    private final ExecutorService worker;
    private final AtomicInteger pendingJobs = new AtomicInteger(0);

    public TransferWorkQueue() {
        this(Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "transfer-worker");
            thread.setDaemon(true);
            return thread;
        }));
    }

    TransferWorkQueue(ExecutorService worker) {
        this.worker = worker;
    }

    public void enqueue(String jobName, TransferJob job) {
        int depth = pendingJobs.incrementAndGet();
        log.debug("📥 [QUEUE] Enqueued {} | Pending: {}", jobName, depth);

        try {
            worker.execute(() -> runJob(jobName, job));
        } catch (RejectedExecutionException e) {
            pendingJobs.decrementAndGet();
            log.error("❌ [QUEUE] Worker is shut down, dropped job {}", jobName);
        }
    }

    private void runJob(String jobName, TransferJob job) {
        long started = System.currentTimeMillis();
        try {
            job.run();
            log.debug("✅ [QUEUE] Finished {} in {}ms", jobName, System.currentTimeMillis() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ [QUEUE] Job {} interrupted", jobName);
        } catch (Exception e) {
            log.error("❌ [QUEUE] Job {} failed: {}", jobName, e.getMessage(), e);
        } finally {
            pendingJobs.decrementAndGet();
        }
    }

    public int getPendingJobs() {
        return pendingJobs.get();
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("⚠️ [QUEUE] Shutting down with {} unfinished jobs", pendingJobs.get());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
