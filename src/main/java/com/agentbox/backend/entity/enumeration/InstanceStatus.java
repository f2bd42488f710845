package com.agentbox.backend.entity.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum InstanceStatus {
    PROVISIONING("provisioning"),
    MINTING("minting"),
    RUNNING("running"),
    STOPPED("stopped"),
    ERROR("error"),
    DELETING("deleting"),
    DELETED("deleted");

    /** States from which a manual mint retry may start. */
    public static final Set<InstanceStatus> MINT_RETRYABLE = EnumSet.of(RUNNING, STOPPED, ERROR);

    private final String value;

    InstanceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
