package com.agentbox.backend.service;

import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import com.agentbox.backend.repository.MintJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MintJobWorkerTest {
    @Mock MintJobRepository mintJobRepository;
    @Mock MintAndFinalizeService mintAndFinalizeService;

    Executor executor = Runnable::run;
    MintJobWorker worker;

    @BeforeEach
    void setUp() {
        worker = new MintJobWorker(mintJobRepository, mintAndFinalizeService, executor);
        ReflectionTestUtils.setField(worker, "enabled", true);
        ReflectionTestUtils.setField(worker, "leaseSeconds", 600L);
        ReflectionTestUtils.setField(worker, "maxAttempts", 3);
    }

    private MintJob job(long id, int attempts) {
        MintJob job = MintJob.builder().id(id).instanceId(100L + id).status(MintJobStatus.RUNNING).attempts(attempts).build();
        when(mintJobRepository.findById(id)).thenReturn(Optional.of(job));
        return job;
    }

    private void claimable(Long... ids) {
        when(mintJobRepository.findClaimableIds(any(Instant.class), eq(MintJobStatus.PENDING), eq(MintJobStatus.RUNNING), any(Pageable.class)))
                .thenReturn(List.of(ids))
                .thenReturn(List.of());
    }

    private void claimSucceeds(long id) {
        when(mintJobRepository.claim(eq(id), any(Instant.class), any(Instant.class), eq(MintJobStatus.PENDING), eq(MintJobStatus.RUNNING)))
                .thenReturn(1);
    }

    @Test
    void drainProcessesClaimedJobs() {
        MintJob first = job(1L, 1);
        MintJob second = job(2L, 1);
        claimable(1L, 2L);
        claimSucceeds(1L);
        claimSucceeds(2L);

        assertThat(worker.drain()).isEqualTo(2);

        verify(mintAndFinalizeService).process(first);
        verify(mintAndFinalizeService).process(second);
    }

    @Test
    void jobClaimedElsewhereIsSkipped() {
        job(1L, 1);
        claimable(1L);

        assertThat(worker.drain()).isZero();
        verify(mintAndFinalizeService, never()).process(any());
    }

    @Test
    void failingJobDoesNotStopTheBatch() {
        MintJob broken = job(1L, 1);
        MintJob healthy = job(2L, 1);
        claimable(1L, 2L);
        claimSucceeds(1L);
        claimSucceeds(2L);
        doThrow(new IllegalStateException("rpc down")).when(mintAndFinalizeService).process(broken);

        assertThat(worker.drain()).isEqualTo(2);
        verify(mintAndFinalizeService).process(healthy);
    }

    @Test
    void jobPastAttemptLimitIsAbandoned() {
        MintJob exhausted = job(1L, 4);
        claimable(1L);
        claimSucceeds(1L);

        worker.drain();

        verify(mintAndFinalizeService).abandon(eq(exhausted), anyString());
        verify(mintAndFinalizeService, never()).process(any());
    }

    @Test
    void disabledWorkerIgnoresKicksAndPolls() {
        ReflectionTestUtils.setField(worker, "enabled", false);
        Executor spy = mock(Executor.class);
        MintJobWorker idle = new MintJobWorker(mintJobRepository, mintAndFinalizeService, spy);

        idle.onJobQueued(new MintJobQueuedEvent(1L, 1L));
        idle.poll();
        worker.poll();

        verify(spy, never()).execute(any());
        verify(mintJobRepository, never()).findClaimableIds(any(), any(), any(), any());
    }

    @Test
    void queuedEventKicksADrain() {
        claimable();

        worker.onJobQueued(new MintJobQueuedEvent(5L, 9L));

        verify(mintJobRepository).findClaimableIds(any(Instant.class), eq(MintJobStatus.PENDING), eq(MintJobStatus.RUNNING), any(Pageable.class));
    }
}
