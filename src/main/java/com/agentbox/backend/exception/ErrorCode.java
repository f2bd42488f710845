package com.agentbox.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

@Getter
public enum ErrorCode {
    UNCATEGORIZED_EXCEPTION(9999, "Uncategorized error", HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_KEY(1001, "Invalid request", HttpStatus.BAD_REQUEST),
    MALFORMED_REQUEST(1002, "Malformed request body", HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(1006, "Unauthenticated", HttpStatus.UNAUTHORIZED),
    UNAUTHORIZED(1007, "You do not have permission", HttpStatus.FORBIDDEN),

    // instances
    INSTANCE_NOT_FOUND(1101, "Instance not found", HttpStatus.NOT_FOUND),
    INVALID_INSTANCE_NAME(1102, "Name must be 3-63 lowercase letters, digits or hyphens", HttpStatus.BAD_REQUEST),
    INSTANCE_NAME_TAKEN(1103, "Instance name already in use", HttpStatus.CONFLICT),
    NAME_ALLOCATION_FAILED(1104, "Could not allocate a unique instance name", HttpStatus.CONFLICT),
    EXTENSION_LIMIT_EXCEEDED(1105, "Instance lifetime cannot exceed 90 days", HttpStatus.BAD_REQUEST),
    INVALID_STATE(1106, "Operation not allowed in the current instance state", HttpStatus.CONFLICT),
    INVALID_EXPIRING_WINDOW(1107, "days must be between 1 and 90", HttpStatus.BAD_REQUEST),

    // callback protocol
    UNKNOWN_PROVISIONING_STEP(1201, "Unknown provisioning step", HttpStatus.BAD_REQUEST),
    INVALID_SERVER_ID(1202, "serverId must be numeric", HttpStatus.BAD_REQUEST),

    // identity
    NFT_ALREADY_MINTED(1301, "Instance already has an identity token", HttpStatus.BAD_REQUEST),
    VM_WALLET_MISSING(1302, "Instance has no VM wallet yet", HttpStatus.BAD_REQUEST),
    MINT_IN_PROGRESS(1303, "Minting already in progress", HttpStatus.CONFLICT),
    NFT_NOT_MINTED(1304, "Instance has no identity token", HttpStatus.BAD_REQUEST),

    // sign-in
    INVALID_WALLET_ADDRESS(1401, "Invalid wallet address", HttpStatus.BAD_REQUEST),
    TIMESTAMP_EXPIRED(1402, "Sign-in timestamp outside the accepted window", HttpStatus.BAD_REQUEST),
    INVALID_SIGNATURE(1403, "Invalid signature", HttpStatus.UNAUTHORIZED),

    // channel / remote session
    INVALID_CHANNEL_TOKEN(1501, "Messaging channel token rejected by provider", HttpStatus.BAD_REQUEST),
    INVALID_WITHDRAWAL(1502, "Invalid withdrawal request", HttpStatus.BAD_REQUEST),
    SESSION_TIMEOUT(1503, "Remote session timed out", HttpStatus.BAD_GATEWAY),
    SESSION_FAILED(1504, "Remote command failed", HttpStatus.BAD_GATEWAY),

    // upstream
    UPSTREAM_FAILED(1601, "Upstream provider error", HttpStatus.BAD_GATEWAY),
    UPSTREAM_NOT_CONFIGURED(1602, "Upstream provider not configured", HttpStatus.SERVICE_UNAVAILABLE),
    ;

    ErrorCode(int code, String message, HttpStatusCode statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    private final int code;
    private final String message;
    private final HttpStatusCode statusCode;
}
