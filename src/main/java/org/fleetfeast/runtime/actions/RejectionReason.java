package org.fleetfeast.runtime.actions;

public enum RejectionReason {
    UNKNOWN_TRUCK("unknown truck"),
    UNKNOWN_ZONE("unknown zone"),
    INVALID_STATE_FOR_DISPATCH("invalid state for dispatch"),
    INVALID_STATE_FOR_RESTOCK("invalid state for restock"),
    NO_PARKING_CAPACITY("no parking capacity");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
