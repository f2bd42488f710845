package com.agentbox.backend.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Cloud server provider. Calls throw {@link com.agentbox.backend.exception.ProviderApiException}
 * on provider errors.
 */
public interface VmGateway {

    boolean isConfigured();

    /** Candidate locations in preference order. */
    List<String> locations();

    /** Creates and starts a server in one location. A capacity error means "try the next location". */
    CreatedServer createServer(String name, String userData, String location);

    /** Provider status ("running", "off", ...), empty if the server does not exist. */
    Optional<String> getServerStatus(long serverId);

    /** Delete-if-exists. */
    void deleteServer(long serverId);

    void rebootServer(long serverId);

    @Value
    @Builder
    class CreatedServer {
        long id;
        String ip;
        String rootPassword;
        String location;
        String snapshotId;
    }
}
