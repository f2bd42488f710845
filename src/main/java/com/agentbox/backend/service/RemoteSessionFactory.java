package com.agentbox.backend.service;

public interface RemoteSessionFactory {

    boolean isConfigured();

    /** Opens a connection; fails with {@link com.agentbox.backend.exception.RemoteSessionException} when the host is unreachable. */
    RemoteSession open(String host);
}
