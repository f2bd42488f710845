package com.agentbox.backend.repository;

import com.agentbox.backend.entity.Instance;
import com.agentbox.backend.entity.enumeration.InstanceStatus;
import com.agentbox.backend.entity.enumeration.ProvisioningStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle transitions are single conditional updates. Callers must treat a zero
 * row count as "precondition did not hold" and never fall back to read-then-write.
 */
@Repository
public interface InstanceRepository extends JpaRepository<Instance, Long> {

    Optional<Instance> findByIdAndStatusNot(Long id, InstanceStatus status);

    Optional<Instance> findByIdAndStatusAndCallbackToken(Long id, InstanceStatus status, String callbackToken);

    boolean existsByNameAndStatusNot(String name, InstanceStatus status);

    boolean existsByNameAndStatusNotAndIdNot(String name, InstanceStatus status, Long id);

    List<Instance> findAllByOwnerWalletAndStatusNotOrderByCreatedAtDesc(String ownerWallet, InstanceStatus status);

    List<Instance> findAllByStatusNotOrderByCreatedAtDesc(InstanceStatus status);

    List<Instance> findAllByNftMintInAndStatusNot(Collection<String> mints, InstanceStatus status);

    List<Instance> findAllByExpiresAtLessThanEqualAndStatusNot(Instant cutoff, InstanceStatus status);

    @Query("""
    select i from Instance i
    where i.status <> :deleted
      and i.expiresAt <= :cutoff
      and ( :ownerWallet is null or i.ownerWallet = :ownerWallet )
    order by i.expiresAt asc
    """)
    List<Instance> findExpiring(@Param("cutoff") Instant cutoff,
                                @Param("ownerWallet") String ownerWallet,
                                @Param("deleted") InstanceStatus deleted);

    // ===== callback protocol =====

    /** Matches whenever the token does; the step itself only moves forward. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i
       set i.provisioningStep = case
             when ( i.provisioningStep is null or i.provisioningStep in :notAfter ) then :step
             else i.provisioningStep
           end
    where i.id = :id
      and i.status = :provisioning
      and i.callbackToken = :token
    """)
    int updateProvisioningStep(@Param("id") Long id,
                               @Param("token") String token,
                               @Param("step") ProvisioningStep step,
                               @Param("notAfter") Collection<ProvisioningStep> notAfter,
                               @Param("provisioning") InstanceStatus provisioning);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i
       set i.status = :minting,
           i.vmWallet = :vmWallet,
           i.gatewayToken = coalesce(:gatewayToken, i.gatewayToken),
           i.provisioningStep = null,
           i.callbackToken = null
    where i.id = :id
      and i.status = :provisioning
      and i.callbackToken = :token
    """)
    int completeProvisioning(@Param("id") Long id,
                             @Param("token") String token,
                             @Param("vmWallet") String vmWallet,
                             @Param("gatewayToken") String gatewayToken,
                             @Param("provisioning") InstanceStatus provisioning,
                             @Param("minting") InstanceStatus minting);

    // ===== status transitions =====

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.status = :to where i.id = :id and i.status = :from")
    int transitionStatus(@Param("id") Long id,
                         @Param("from") InstanceStatus from,
                         @Param("to") InstanceStatus to);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i set i.status = :minting
    where i.id = :id
      and i.status <> :minting
      and i.status in :retryable
      and i.nftMint is null
      and i.vmWallet is not null
    """)
    int beginMintRetry(@Param("id") Long id,
                       @Param("minting") InstanceStatus minting,
                       @Param("retryable") Collection<InstanceStatus> retryable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i set i.status = :minting
    where i.id = :id
      and i.status <> :minting
      and i.status in :retryable
      and i.nftMint = :mint
    """)
    int beginTransferRetry(@Param("id") Long id,
                           @Param("mint") String mint,
                           @Param("minting") InstanceStatus minting,
                           @Param("retryable") Collection<InstanceStatus> retryable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i
       set i.status = :deleting, i.callbackToken = null, i.provisioningStep = null
    where i.id = :id and i.status <> :deleted
    """)
    int markDeleting(@Param("id") Long id,
                     @Param("deleting") InstanceStatus deleting,
                     @Param("deleted") InstanceStatus deleted);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i set i.status = :deleted, i.deletedAt = :now
    where i.id = :id and i.status = :deleting
    """)
    int markDeleted(@Param("id") Long id,
                    @Param("now") Instant now,
                    @Param("deleting") InstanceStatus deleting,
                    @Param("deleted") InstanceStatus deleted);

    // ===== identity =====

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.nftMint = :mint where i.id = :id and i.nftMint is null")
    int attachMint(@Param("id") Long id, @Param("mint") String mint);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.ownerWallet = :owner where i.id = :id and i.ownerWallet <> :owner")
    int updateOwner(@Param("id") Long id, @Param("owner") String owner);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i set i.nftMint = :mint, i.ownerWallet = :owner
    where i.id = :id
      and i.status <> :deleted
      and ( i.nftMint is null or i.nftMint <> :mint or i.ownerWallet <> :owner )
    """)
    int recoverIdentity(@Param("id") Long id,
                        @Param("mint") String mint,
                        @Param("owner") String owner,
                        @Param("deleted") InstanceStatus deleted);

    // ===== owner edits =====

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.name = :name where i.id = :id and i.status <> :deleted")
    int rename(@Param("id") Long id,
               @Param("name") String name,
               @Param("deleted") InstanceStatus deleted);

    /** Conditional on the expiry read by the caller, so two extends cannot both apply to the same base. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Instance i set i.expiresAt = :next where i.id = :id and i.expiresAt = :current")
    int extendExpiry(@Param("id") Long id,
                     @Param("current") Instant current,
                     @Param("next") Instant next);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update Instance i set i.telegramBotToken = :token, i.telegramBotUsername = :username
    where i.id = :id and i.status = :running
    """)
    int updateChannel(@Param("id") Long id,
                      @Param("token") String encryptedToken,
                      @Param("username") String username,
                      @Param("running") InstanceStatus running);
}
