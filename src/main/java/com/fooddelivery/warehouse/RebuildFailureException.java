package com.fooddelivery.warehouse;

/**
 * A warehouse rebuild did not complete. The previously published snapshot is still current.
 */
public class RebuildFailureException extends RuntimeException {

    public RebuildFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
