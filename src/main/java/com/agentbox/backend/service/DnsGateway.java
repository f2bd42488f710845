package com.agentbox.backend.service;

public interface DnsGateway {

    boolean isConfigured();

    void createRecord(String hostname, String ip);

    /** Removes every A record for the hostname; no-op when none exists. */
    void deleteRecord(String hostname);
}
