package com.agentbox.backend.repository;

import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class InstanceRepositoryTest {
    private static final long ID = 77L;
    private static final String TOKEN = "cb-token";

    @Autowired InstanceRepository instanceRepository;

    @BeforeEach
    void setUp() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        instanceRepository.saveAndFlush(Instance.builder()
                .id(ID).name("agent-repo").ownerWallet("owner").status(InstanceStatus.PROVISIONING)
                .provisioningStep(ProvisioningStep.VM_CREATED).ip("192.0.2.1").callbackToken(TOKEN)
                .createdAt(now).expiresAt(now.plus(7, ChronoUnit.DAYS))
                .build());
    }

    private Instance reload() {
        return instanceRepository.findById(ID).orElseThrow();
    }

    @Test
    void stepUpdateRequiresMatchingToken() {
        ProvisioningStep step = ProvisioningStep.CONFIGURING;

        assertThat(instanceRepository.updateProvisioningStep(ID, "nope", step, step.notAfter(), InstanceStatus.PROVISIONING)).isZero();
        assertThat(instanceRepository.updateProvisioningStep(ID, TOKEN, step, step.notAfter(), InstanceStatus.PROVISIONING)).isEqualTo(1);
        assertThat(reload().getProvisioningStep()).isEqualTo(ProvisioningStep.CONFIGURING);
    }

    @Test
    void staleStepIsAcceptedButDoesNotRegress() {
        ProvisioningStep ready = ProvisioningStep.OPENCLAW_READY;
        ProvisioningStep configuring = ProvisioningStep.CONFIGURING;

        instanceRepository.updateProvisioningStep(ID, TOKEN, ready, ready.notAfter(), InstanceStatus.PROVISIONING);
        int stale = instanceRepository.updateProvisioningStep(ID, TOKEN, configuring, configuring.notAfter(), InstanceStatus.PROVISIONING);

        assertThat(stale).isEqualTo(1);
        assertThat(reload().getProvisioningStep()).isEqualTo(ProvisioningStep.OPENCLAW_READY);
    }

    @Test
    void completeProvisioningConsumesTokenExactlyOnce() {
        assertThat(instanceRepository.completeProvisioning(ID, TOKEN, "vm-wallet", "gw",
                InstanceStatus.PROVISIONING, InstanceStatus.MINTING)).isEqualTo(1);
        assertThat(instanceRepository.completeProvisioning(ID, TOKEN, "other-wallet", "gw2",
                InstanceStatus.PROVISIONING, InstanceStatus.MINTING)).isZero();

        Instance instance = reload();
        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.MINTING);
        assertThat(instance.getCallbackToken()).isNull();
        assertThat(instance.getProvisioningStep()).isNull();
        assertThat(instance.getVmWallet()).isEqualTo("vm-wallet");
        assertThat(instance.getGatewayToken()).isEqualTo("gw");
    }

    @Test
    void mintRetryGateAdmitsOneCaller() {
        instanceRepository.completeProvisioning(ID, TOKEN, "vm-wallet", null, InstanceStatus.PROVISIONING, InstanceStatus.MINTING);
        instanceRepository.transitionStatus(ID, InstanceStatus.MINTING, InstanceStatus.RUNNING);

        assertThat(instanceRepository.beginMintRetry(ID, InstanceStatus.MINTING, InstanceStatus.MINT_RETRYABLE)).isEqualTo(1);
        assertThat(instanceRepository.beginMintRetry(ID, InstanceStatus.MINTING, InstanceStatus.MINT_RETRYABLE)).isZero();
    }

    @Test
    void mintRetryGateRejectsMintedInstance() {
        instanceRepository.completeProvisioning(ID, TOKEN, "vm-wallet", null, InstanceStatus.PROVISIONING, InstanceStatus.MINTING);
        instanceRepository.transitionStatus(ID, InstanceStatus.MINTING, InstanceStatus.RUNNING);
        instanceRepository.attachMint(ID, "Mint1");

        assertThat(instanceRepository.beginMintRetry(ID, InstanceStatus.MINTING, InstanceStatus.MINT_RETRYABLE)).isZero();
        assertThat(instanceRepository.attachMint(ID, "Mint2")).isZero();
        assertThat(reload().getNftMint()).isEqualTo("Mint1");
    }

    @Test
    void deletionClearsTokenAndHidesRow() {
        assertThat(instanceRepository.markDeleting(ID, InstanceStatus.DELETING, InstanceStatus.DELETED)).isEqualTo(1);
        assertThat(reload().getCallbackToken()).isNull();
        assertThat(instanceRepository.markDeleted(ID, Instant.now(), InstanceStatus.DELETING, InstanceStatus.DELETED)).isEqualTo(1);

        assertThat(instanceRepository.findByIdAndStatusNot(ID, InstanceStatus.DELETED)).isEmpty();
        assertThat(instanceRepository.existsByNameAndStatusNot("agent-repo", InstanceStatus.DELETED)).isFalse();
        assertThat(instanceRepository.markDeleting(ID, InstanceStatus.DELETING, InstanceStatus.DELETED)).isZero();
    }

    @Test
    void recoveryOverwritesMintAndOwner() {
        assertThat(instanceRepository.recoverIdentity(ID, "MintR", "new-owner", InstanceStatus.DELETED)).isEqualTo(1);
        assertThat(instanceRepository.recoverIdentity(ID, "MintR", "new-owner", InstanceStatus.DELETED)).isZero();

        Instance instance = reload();
        assertThat(instance.getNftMint()).isEqualTo("MintR");
        assertThat(instance.getOwnerWallet()).isEqualTo("new-owner");
    }
}
