package com.agentbox.backend.entity.enumeration;

public enum MintJobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
