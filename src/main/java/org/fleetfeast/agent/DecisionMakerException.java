package org.fleetfeast.agent;

/**
 * The decision maker could not produce an answer: unreachable service, error response or
 * malformed tool call. The agent bridge treats it as a hold for the cycle.
 */
public class DecisionMakerException extends Exception {

    public DecisionMakerException(String message) {
        super(message);
    }

    public DecisionMakerException(String message, Throwable cause) {
        super(message, cause);
    }
}
