package io.parley.core.provider;

/** A provider call failed. The conversation that was being sent is left untouched. */
public class ProviderException extends RuntimeException {
    private final String provider;
    private final int statusCode;

    public ProviderException(String provider, String message) {
        this(provider, message, -1, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        this(provider, message, -1, cause);
    }

    public ProviderException(String provider, String message, int statusCode, Throwable cause) {
        super("Provider " + provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String provider() {
        return provider;
    }

    /** HTTP status of the failed call, or -1 when the call never produced a response. */
    public int statusCode() {
        return statusCode;
    }
}
