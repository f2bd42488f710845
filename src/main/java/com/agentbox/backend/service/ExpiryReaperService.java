package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.repository.InstanceRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ExpiryReaperService {
    InstanceRepository instanceRepository;
    InstanceTeardownService instanceTeardownService;
    EventRecorder eventRecorder;

    AtomicLong reaped = new AtomicLong();

    @NonFinal
    @Value("${expiry.enabled:true}")
    boolean enabled;

    @Scheduled(fixedDelayString = "${expiry.sweep-interval-ms:3600000}", initialDelayString = "${expiry.sweep-interval-ms:3600000}")
    public void scheduledSweep() {
        if (!enabled) return;
        try {
            sweep();
        } catch (Exception e) {
            log.error("Expiry sweep failed", e);
        }
    }

    /** Tears down every instance whose expiry has passed; returns how many were deleted. */
    public int sweep() {
        List<Instance> expired = instanceRepository.findAllByExpiresAtLessThanEqualAndStatusNot(Instant.now(), InstanceStatus.DELETED);
        if (expired.isEmpty()) return 0;

        log.info("Expiry sweep found {} instance(s)", expired.size());
        int deleted = 0;
        for (Instance instance : expired) {
            try {
                eventRecorder.recordSystem(EventType.INSTANCE_EXPIRED, Constants.ACTOR.REAPER, instance.getId(),
                        Map.of("expiresAt", instance.getExpiresAt().toString()));
                if (instanceTeardownService.teardown(instance, Constants.ACTOR.SYSTEM, Constants.ACTOR.REAPER)) {
                    deleted++;
                    reaped.incrementAndGet();
                }
            } catch (Exception e) {
                log.error("Reaping instance {} failed", instance.getId(), e);
            }
        }
        return deleted;
    }

    public long reapedTotal() {
        return reaped.get();
    }
}
