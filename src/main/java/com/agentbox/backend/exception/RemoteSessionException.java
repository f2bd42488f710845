package com.agentbox.backend.exception;

public class RemoteSessionException extends RuntimeException {

    public RemoteSessionException(String message) {
        super(message);
    }

    public RemoteSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
