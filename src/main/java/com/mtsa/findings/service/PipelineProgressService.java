package com.mtsa.findings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class PipelineProgressService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineProgressService.class);

    private static class Progress {
        final AtomicInteger expected;
        final AtomicInteger processed = new AtomicInteger(0);
        final AtomicInteger failed = new AtomicInteger(0);

        Progress(int expected) {
            this.expected = new AtomicInteger(expected);
        }
    }

    private final ConcurrentHashMap<UUID, Progress> progressMap = new ConcurrentHashMap<>();

    public void startTracking(UUID runId, int expected) {
        if (runId == null) {
            return;
        }
        progressMap.put(runId, new Progress(expected));
        logger.info("Precomputation run {} started ({} jobs due).", runId, expected);
    }

    public void increment(UUID runId, String label, boolean success) {
        if (runId == null) {
            return;
        }
        Progress progress = progressMap.get(runId);
        if (progress == null) {
            return;
        }
        int processed = progress.processed.incrementAndGet();
        if (!success) {
            progress.failed.incrementAndGet();
        }
        int expected = progress.expected.get();
        if (processed % 25 == 0 || processed == expected) {
            logger.info("Precomputation run {}: processed {}/{} ({} failed attempts){}",
                    runId,
                    processed,
                    expected,
                    progress.failed.get(),
                    label != null ? " - " + label : "");
        }
    }

    /**
     * Grows the expected total when retries add attempts mid-run.
     */
    public void expectMore(UUID runId, int additional) {
        Progress progress = runId == null ? null : progressMap.get(runId);
        if (progress != null && additional > 0) {
            progress.expected.addAndGet(additional);
        }
    }

    public void complete(UUID runId) {
        if (runId == null) {
            return;
        }
        Progress progress = progressMap.remove(runId);
        if (progress != null) {
            logger.info("Precomputation run {} finished (processed {}, {} failed attempts).",
                    runId,
                    progress.processed.get(),
                    progress.failed.get());
        }
    }
}
