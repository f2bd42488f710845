package com.agentbox.backend.entity.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Progress reported by a booting VM, in the order the bootstrap script emits them.
 */
public enum ProvisioningStep {
    VM_CREATED("vm_created"),
    CONFIGURING("configuring"),
    WALLET_CREATED("wallet_created"),
    OPENCLAW_READY("openclaw_ready"),
    SERVICES_STARTING("services_starting");

    private final String value;

    ProvisioningStep(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<ProvisioningStep> fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }

    /** Steps a row may currently hold for this step to be accepted (never moves backwards). */
    public List<ProvisioningStep> notAfter() {
        return Arrays.asList(values()).subList(0, ordinal() + 1);
    }
}
