package com.agentbox.backend.service;

import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.dto.response.SyncResponse;
import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.exception.ProviderApiException;
import com.agentbox.backend.repository.InstanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationServiceTest {
    private static final String WALLET = "NewOwner11111111111111111111111111111";
    private static final CallerIdentity CALLER = CallerIdentity.wallet(WALLET, false);

    @Mock InstanceRepository instanceRepository;
    @Mock LedgerGateway ledgerGateway;
    @Mock EventRecorder eventRecorder;

    ReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new ReconciliationService(instanceRepository, ledgerGateway, eventRecorder);
        when(ledgerGateway.isConfigured()).thenReturn(true);
    }

    private static LedgerGateway.IdentityDescriptor descriptorFor(String serverId) {
        LedgerGateway.IdentityDescriptor.IdentityDescriptorBuilder builder = LedgerGateway.IdentityDescriptor.builder().name("x");
        if (serverId != null) builder.metadata("agentbox:serverId", serverId);
        return builder.build();
    }

    @Test
    void embeddedServerIdRecoversLostLink() {
        when(ledgerGateway.ownedTokensOf(WALLET)).thenReturn(List.of("MintA"));
        when(instanceRepository.findAllByNftMintInAndStatusNot(List.of("MintA"), InstanceStatus.DELETED)).thenReturn(List.of());
        when(ledgerGateway.loadIdentity("MintA")).thenReturn(Optional.of(descriptorFor("42")));
        when(instanceRepository.recoverIdentity(42L, "MintA", WALLET, InstanceStatus.DELETED)).thenReturn(1);

        SyncResponse result = service.sync(CALLER);

        assertThat(result.getRecovered()).isEqualTo(1);
        assertThat(result.getClaimed()).isZero();
        verify(eventRecorder).record(EventType.INSTANCE_RECOVERED, CALLER, 42L, Map.of("mint", "MintA"));
    }

    @Test
    void tokenHeldByNewWalletClaimsTheInstance() {
        Instance instance = Instance.builder().id(5L).nftMint("MintB").ownerWallet("OldOwner").build();
        when(ledgerGateway.ownedTokensOf(WALLET)).thenReturn(List.of("MintB"));
        when(instanceRepository.findAllByNftMintInAndStatusNot(List.of("MintB"), InstanceStatus.DELETED)).thenReturn(List.of(instance));
        when(instanceRepository.updateOwner(5L, WALLET)).thenReturn(1);

        SyncResponse result = service.sync(CALLER);

        assertThat(result.getClaimed()).isEqualTo(1);
        verify(eventRecorder).record(EventType.INSTANCE_CLAIMED, CALLER, 5L, Map.of("previousOwner", "OldOwner"));
        verify(ledgerGateway, never()).loadIdentity(anyString());
    }

    @Test
    void alreadyOwnedInstanceIsLeftAlone() {
        Instance instance = Instance.builder().id(5L).nftMint("MintB").ownerWallet(WALLET).build();
        when(ledgerGateway.ownedTokensOf(WALLET)).thenReturn(List.of("MintB"));
        when(instanceRepository.findAllByNftMintInAndStatusNot(any(), eq(InstanceStatus.DELETED))).thenReturn(List.of(instance));

        SyncResponse result = service.sync(CALLER);

        assertThat(result.getClaimed()).isZero();
        verify(instanceRepository, never()).updateOwner(anyLong(), anyString());
    }

    @Test
    void unreadableOrUnmarkedTokensAreSkipped() {
        when(ledgerGateway.ownedTokensOf(WALLET)).thenReturn(List.of("Gone", "Plain", "Junk"));
        when(instanceRepository.findAllByNftMintInAndStatusNot(any(), eq(InstanceStatus.DELETED))).thenReturn(List.of());
        when(ledgerGateway.loadIdentity("Gone")).thenThrow(new ProviderApiException("LEDGER_SIGNER", 500, "x"));
        when(ledgerGateway.loadIdentity("Plain")).thenReturn(Optional.of(descriptorFor(null)));
        when(ledgerGateway.loadIdentity("Junk")).thenReturn(Optional.of(descriptorFor("42; drop")));

        SyncResponse result = service.sync(CALLER);

        assertThat(result.getRecovered()).isZero();
        verify(instanceRepository, never()).recoverIdentity(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void operatorHasNothingToSync() {
        SyncResponse result = service.sync(CallerIdentity.operator());

        assertThat(result.getClaimed()).isZero();
        assertThat(result.getRecovered()).isZero();
        verifyNoInteractions(ledgerGateway);
    }
}
