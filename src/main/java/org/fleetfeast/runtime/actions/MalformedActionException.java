package org.fleetfeast.runtime.actions;

/**
 * An action payload that cannot be decoded: invalid JSON, unknown type, or missing fields.
 */
public class MalformedActionException extends Exception {

    public MalformedActionException(String message) {
        super(message);
    }

    public MalformedActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
