package com.agentbox.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class SshRemoteSessionFactory implements RemoteSessionFactory {
    ObjectMapper objectMapper;

    @NonFinal
    @Value("${ssh.private-key-path:}")
    String privateKeyPath;

    @NonFinal
    @Value("${ssh.user:root}")
    String user;

    @NonFinal
    @Value("${ssh.connect-timeout-seconds:10}")
    int connectTimeoutSeconds;

    @Override
    public boolean isConfigured() {
        return privateKeyPath != null && !privateKeyPath.isBlank();
    }

    @Override
    public RemoteSession open(String host) {
        return SshRemoteSession.connect(user, host, privateKeyPath, connectTimeoutSeconds, objectMapper);
    }
}
