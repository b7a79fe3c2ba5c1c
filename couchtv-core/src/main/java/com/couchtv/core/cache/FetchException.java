package com.couchtv.core.cache;

/**
 * Thrown by a {@link Fetcher} when a value could not be produced.
 * The message is shown to the user as the cache's last error.
 */
public class FetchException extends Exception {

    public enum ErrorType {
        NETWORK,         // Connection refused, reset, DNS
        TIMEOUT,         // Client timeout elapsed
        BLOCKED,         // Proxy or firewall answered instead of the API
        API,             // Upstream returned an error status or error payload
        PARSE,           // Response could not be read
        NOT_CONFIGURED,  // Missing key, credentials or database
        UNKNOWN          // Anything else
    }

    private final ErrorType type;

    public FetchException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public FetchException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Whether retrying later could plausibly succeed without user action.
     */
    public boolean isTransient() {
        return type == ErrorType.NETWORK || type == ErrorType.TIMEOUT;
    }
}
