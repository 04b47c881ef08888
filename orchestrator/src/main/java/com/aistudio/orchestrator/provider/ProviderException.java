package com.aistudio.orchestrator.provider;

/**
 * Thrown when an external generation provider returns an error or is unreachable.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final int    statusCode;   // 0 when no HTTP response was received

    public ProviderException(String provider, int statusCode, String message) {
        super("%s error %d: %s".formatted(provider, statusCode, message));
        this.provider   = provider;
        this.statusCode = statusCode;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider   = provider;
        this.statusCode = 0;
    }

    public String provider() { return provider; }
    public int statusCode()  { return statusCode; }
}
