package io.harvest.financial;

/**
 * A single upstream request failed. Treated as transient by the fetcher.
 */
public class ProviderException extends Exception {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
