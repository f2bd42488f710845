package com.agentbox.backend.repository;

import com.agentbox.backend.entity.MintJob;
import com.agentbox.backend.entity.enumeration.MintJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MintJobRepository extends JpaRepository<MintJob, Long> {

    Optional<MintJob> findFirstByInstanceIdOrderByIdDesc(Long instanceId);

    Optional<MintJob> findFirstByInstanceIdAndMintAddressOrderByIdDesc(Long instanceId, String mintAddress);

    @Query("""
    select j.id from MintJob j
    where j.status = :pending
       or ( j.status = :running and j.leaseUntil < :now )
    order by j.id asc
    """)
    List<Long> findClaimableIds(@Param("now") Instant now,
                                @Param("pending") MintJobStatus pending,
                                @Param("running") MintJobStatus running,
                                Pageable pageable);

    /** Takes the lease; zero rows means another worker got there first. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
    update MintJob j
       set j.status = :running, j.leaseUntil = :leaseUntil, j.attempts = j.attempts + 1
    where j.id = :id
      and ( j.status = :pending or ( j.status = :running and j.leaseUntil < :now ) )
    """)
    int claim(@Param("id") Long id,
              @Param("now") Instant now,
              @Param("leaseUntil") Instant leaseUntil,
              @Param("pending") MintJobStatus pending,
              @Param("running") MintJobStatus running);
}
