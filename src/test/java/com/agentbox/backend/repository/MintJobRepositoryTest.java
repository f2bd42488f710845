package com.agentbox.backend.repository;

import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class MintJobRepositoryTest {
    @Autowired MintJobRepository mintJobRepository;

    private MintJob job(MintJobStatus status, Instant leaseUntil) {
        return mintJobRepository.saveAndFlush(MintJob.builder()
                .instanceId(1L).status(status).leaseUntil(leaseUntil).createdAt(Instant.now())
                .build());
    }

    @Test
    void pendingJobIsClaimedOnce() {
        Long id = job(MintJobStatus.PENDING, null).getId();
        Instant now = Instant.now();
        Instant lease = now.plus(10, ChronoUnit.MINUTES);

        assertThat(mintJobRepository.claim(id, now, lease, MintJobStatus.PENDING, MintJobStatus.RUNNING)).isEqualTo(1);
        assertThat(mintJobRepository.claim(id, now, lease, MintJobStatus.PENDING, MintJobStatus.RUNNING)).isZero();

        MintJob claimed = mintJobRepository.findById(id).orElseThrow();
        assertThat(claimed.getStatus()).isEqualTo(MintJobStatus.RUNNING);
        assertThat(claimed.getAttempts()).isEqualTo(1);
    }

    @Test
    void expiredLeaseMakesJobClaimableAgain() {
        Instant now = Instant.now();
        Long abandoned = job(MintJobStatus.RUNNING, now.minus(1, ChronoUnit.MINUTES)).getId();
        Long live = job(MintJobStatus.RUNNING, now.plus(5, ChronoUnit.MINUTES)).getId();
        Long done = job(MintJobStatus.DONE, null).getId();
        Long pending = job(MintJobStatus.PENDING, null).getId();

        assertThat(mintJobRepository.findClaimableIds(now, MintJobStatus.PENDING, MintJobStatus.RUNNING, PageRequest.of(0, 10)))
                .containsExactly(abandoned, pending)
                .doesNotContain(live, done);
        assertThat(mintJobRepository.claim(live, now, now.plus(10, ChronoUnit.MINUTES),
                MintJobStatus.PENDING, MintJobStatus.RUNNING)).isZero();
        assertThat(mintJobRepository.claim(abandoned, now, now.plus(10, ChronoUnit.MINUTES),
                MintJobStatus.PENDING, MintJobStatus.RUNNING)).isEqualTo(1);
    }
}
