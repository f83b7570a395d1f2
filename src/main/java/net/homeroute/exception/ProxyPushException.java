package net.homeroute.exception;

import jakarta.annotation.Nullable;

/**
 * Pushing a compiled configuration to the proxy's control plane failed.
 * The control client never retries; whether to push again is up to the caller.
 */
public class ProxyPushException extends RuntimeException {

    @Nullable
    private final Integer statusCode;

    public ProxyPushException(String message, @Nullable Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public ProxyPushException(String message, @Nullable Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }
}
