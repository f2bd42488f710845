package com.agentbox.backend.service;

import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import com.agentbox.backend.repository.MintJobRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the mint job table. Jobs are claimed with a conditional update that takes a
 * lease; a job whose lease ran out (process died mid-run) is claimed again on the next pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class MintJobWorker {
    static final int BATCH_SIZE = 20;

    MintJobRepository mintJobRepository;
    MintAndFinalizeService mintAndFinalizeService;

    @Qualifier("taskExecutor")
    Executor taskExecutor;

    AtomicBoolean draining = new AtomicBoolean(false);

    @NonFinal
    @Value("${worker.enabled:true}")
    boolean enabled;

    @NonFinal
    @Value("${worker.lease-seconds:600}")
    long leaseSeconds;

    @NonFinal
    @Value("${worker.max-attempts:5}")
    int maxAttempts;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onJobQueued(MintJobQueuedEvent event) {
        log.debug("Mint job {} queued for instance {}", event.getJobId(), event.getInstanceId());
        kick();
    }

    public void kick() {
        if (!enabled) return;
        try {
            taskExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Worker busy, queued jobs wait for the next poll");
        }
    }

    @Scheduled(fixedDelayString = "${worker.poll-interval-ms:30000}", initialDelayString = "${worker.poll-interval-ms:30000}")
    public void poll() {
        if (enabled) drain();
    }

    /** Processes every claimable job; returns how many were run. A concurrent call returns 0. */
    public int drain() {
        if (!draining.compareAndSet(false, true)) return 0;
        int processed = 0;
        try {
            List<Long> ids;
            do {
                ids = mintJobRepository.findClaimableIds(Instant.now(), MintJobStatus.PENDING, MintJobStatus.RUNNING,
                        PageRequest.of(0, BATCH_SIZE));
                for (Long jobId : ids) {
                    if (runOne(jobId)) processed++;
                }
            } while (ids.size() == BATCH_SIZE);
        } finally {
            draining.set(false);
        }
        return processed;
    }

    private boolean runOne(Long jobId) {
        Instant now = Instant.now();
        int claimed = mintJobRepository.claim(jobId, now, now.plus(leaseSeconds, ChronoUnit.SECONDS),
                MintJobStatus.PENDING, MintJobStatus.RUNNING);
        if (claimed == 0) return false;

        MintJob job = mintJobRepository.findById(jobId).orElse(null);
        if (job == null) return false;

        try {
            if (job.getAttempts() > maxAttempts) {
                mintAndFinalizeService.abandon(job, "gave up after " + maxAttempts + " attempts");
            } else {
                mintAndFinalizeService.process(job);
            }
        } catch (Exception e) {
            // lease stays, the job is picked up again once it expires
            log.error("Mint job {} for instance {} failed on attempt {}", jobId, job.getInstanceId(), job.getAttempts(), e);
        }
        return true;
    }
}
