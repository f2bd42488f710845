package com.agentbox.backend.service;

import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.exception.ProviderApiException;
import com.agentbox.backend.repository.InstanceRepository;
import com.agentbox.backend.utils.HostnameResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExpiryReaperServiceTest {
    @Mock InstanceRepository instanceRepository;
    @Mock VmGateway vmGateway;
    @Mock DnsGateway dnsGateway;
    @Mock EventRecorder eventRecorder;

    ExpiryReaperService reaper;

    @BeforeEach
    void setUp() {
        InstanceTeardownService teardown = new InstanceTeardownService(instanceRepository, vmGateway, dnsGateway,
                eventRecorder, new HostnameResolver("agentbox.test"));
        reaper = new ExpiryReaperService(instanceRepository, teardown, eventRecorder);

        when(vmGateway.isConfigured()).thenReturn(true);
        when(dnsGateway.isConfigured()).thenReturn(true);
        when(instanceRepository.markDeleting(anyLong(), eq(InstanceStatus.DELETING), eq(InstanceStatus.DELETED))).thenReturn(1);
        when(instanceRepository.markDeleted(anyLong(), any(Instant.class), eq(InstanceStatus.DELETING), eq(InstanceStatus.DELETED)))
                .thenReturn(1);
    }

    private static Instance expired(long id, String name) {
        return Instance.builder().id(id).name(name).status(InstanceStatus.RUNNING)
                .createdAt(Instant.now().minusSeconds(900_000)).expiresAt(Instant.now().minusSeconds(60))
                .build();
    }

    @Test
    void sweepDeletesEveryExpiredInstance() {
        when(instanceRepository.findAllByExpiresAtLessThanEqualAndStatusNot(any(Instant.class), eq(InstanceStatus.DELETED)))
                .thenReturn(List.of(expired(1L, "one"), expired(2L, "two")));

        assertThat(reaper.sweep()).isEqualTo(2);

        verify(vmGateway).deleteServer(1L);
        verify(vmGateway).deleteServer(2L);
        verify(dnsGateway).deleteRecord("one.agentbox.test");
        verify(eventRecorder).record(eq(EventType.INSTANCE_DELETED), eq("system"), eq("reaper"), eq(1L), anyMap());
        assertThat(reaper.reapedTotal()).isEqualTo(2);
    }

    @Test
    void providerFailuresDoNotKeepTheRowAlive() {
        when(instanceRepository.findAllByExpiresAtLessThanEqualAndStatusNot(any(Instant.class), eq(InstanceStatus.DELETED)))
                .thenReturn(List.of(expired(3L, "three")));
        doThrow(new ProviderApiException("HETZNER", 500, "down")).when(vmGateway).deleteServer(3L);
        doThrow(new ProviderApiException("CLOUDFLARE", 500, "down")).when(dnsGateway).deleteRecord("three.agentbox.test");

        assertThat(reaper.sweep()).isEqualTo(1);

        verify(instanceRepository).markDeleted(eq(3L), any(Instant.class), eq(InstanceStatus.DELETING), eq(InstanceStatus.DELETED));
    }

    @Test
    void instanceAlreadyBeingDeletedElsewhereIsSkipped() {
        when(instanceRepository.findAllByExpiresAtLessThanEqualAndStatusNot(any(Instant.class), eq(InstanceStatus.DELETED)))
                .thenReturn(List.of(expired(4L, "four")));
        when(instanceRepository.markDeleting(eq(4L), any(), any())).thenReturn(0);

        assertThat(reaper.sweep()).isZero();
        verify(vmGateway, never()).deleteServer(anyLong());
    }

    @Test
    void nothingExpiredIsANoOp() {
        when(instanceRepository.findAllByExpiresAtLessThanEqualAndStatusNot(any(Instant.class), eq(InstanceStatus.DELETED)))
                .thenReturn(List.of());

        assertThat(reaper.sweep()).isZero();
        verify(instanceRepository, never()).markDeleting(anyLong(), any(), any());
    }
}
