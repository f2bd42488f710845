package com.agentbox.backend.utils;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class HostnameResolver {
    private final String baseDomain;

    public HostnameResolver(@Value("${agentbox.base-domain:agentbox.fyi}") String baseDomain) {
        this.baseDomain = baseDomain;
    }

    public String hostnameOf(String instanceName) {
        return instanceName + "." + baseDomain;
    }
}
