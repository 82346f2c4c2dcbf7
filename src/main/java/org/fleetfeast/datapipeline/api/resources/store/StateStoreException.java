package org.fleetfeast.datapipeline.api.resources.store;

/**
 * Raised when a state-store operation fails. Callers treat it as transient.
 */
public class StateStoreException extends Exception {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
