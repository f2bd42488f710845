package com.agentbox.backend.entity;

import com.agentbox.backend.entity.enumeration.MintJobStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outbox row for the funding/minting workflow. Written in the same transaction as the
 * state transition that requests it; step flags make a resumed job skip finished work.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "mint_jobs", indexes = {
        @Index(name = "mint_jobs_status_idx", columnList = "status"),
        @Index(name = "mint_jobs_instance_idx", columnList = "instance_id")
})
public class MintJob extends AbstractAuditingEntity<Long> implements Serializable {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "instance_id", nullable = false)
    Long instanceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    MintJobStatus status;

    @Builder.Default
    boolean nativeFunded = false;

    @Builder.Default
    boolean stableFunded = false;

    @Column(length = 64)
    String mintAddress;

    @Builder.Default
    boolean transferred = false;

    @Builder.Default
    int attempts = 0;

    Instant leaseUntil;

    @Column(length = 1000)
    String lastError;

    Instant createdAt;
}
