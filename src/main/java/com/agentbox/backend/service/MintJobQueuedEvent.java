package com.agentbox.backend.service;

import lombok.Value;

/**
 * Published inside the transaction that inserts a mint job; listeners act after commit.
 */
@Value
public class MintJobQueuedEvent {
    Long instanceId;
    Long jobId;
}
