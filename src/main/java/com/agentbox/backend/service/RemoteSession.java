package com.agentbox.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Shell access to one running instance. {@link #close()} is idempotent and releases the
 * underlying connection even while a command is still running.
 */
public interface RemoteSession extends AutoCloseable {

    ExecResult exec(String command);

    JsonNode readJson(String remotePath);

    /** Writes to a temp file, then moves it over {@code remotePath}; chowns when {@code owner} is set. */
    void writeJson(String remotePath, Object data, String owner);

    void restartService(String service);

    @Override
    void close();

    @Value
    class ExecResult {
        int code;
        String stdout;
        String stderr;

        public boolean succeeded() {
            return code == 0;
        }
    }
}
