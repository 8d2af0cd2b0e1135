package io.tiergate.core.entitlement;

import java.io.IOException;

/**
 * The store timed out or is temporarily unavailable. The whole operation may be retried.
 */
public class TransientStoreException extends IOException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
