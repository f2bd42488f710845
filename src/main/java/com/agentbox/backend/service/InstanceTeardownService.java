package com.agentbox.backend.service;

import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.utils.HostnameResolver;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Moves an instance through deleting to deleted. External teardown is best-effort: the row
 * is authoritative, so a provider failure is logged and the row is still marked deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class InstanceTeardownService {
    InstanceRepository instanceRepository;
    VmGateway vmGateway;
    DnsGateway dnsGateway;
    EventRecorder eventRecorder;
    HostnameResolver hostnameResolver;

    /**
     * @return false when another caller already finished the deletion
     */
    public boolean teardown(Instance instance, String actorType, String actorId) {
        Long id = instance.getId();
        if (instanceRepository.markDeleting(id, InstanceStatus.DELETING, InstanceStatus.DELETED) == 0) {
            log.debug("Instance {} already deleted", id);
            return false;
        }
        eventRecorder.record(EventType.INSTANCE_DELETION_STARTED, actorType, actorId, id, Map.of());

        if (vmGateway.isConfigured()) {
            try {
                vmGateway.deleteServer(id);
            } catch (Exception e) {
                log.error("Server {} not deleted, remove it by hand: {}", id, e.getMessage());
            }
        }

        if (dnsGateway.isConfigured()) {
            String hostname = hostnameResolver.hostnameOf(instance.getName());
            try {
                dnsGateway.deleteRecord(hostname);
            } catch (Exception e) {
                log.warn("DNS record {} for instance {} not deleted: {}", hostname, id, e.getMessage());
            }
        }

        if (instanceRepository.markDeleted(id, Instant.now(), InstanceStatus.DELETING, InstanceStatus.DELETED) == 0) {
            log.debug("Instance {} was marked deleted concurrently", id);
            return false;
        }
        eventRecorder.record(EventType.INSTANCE_DELETED, actorType, actorId, id, Map.of());
        log.info("Instance {} ({}) deleted by {}", id, instance.getName(), actorId);
        return true;
    }
}
