package org.fleetfeast.runtime.model;

public enum TruckStatus {
    IDLE,
    MOVING,
    SERVING,
    RESTOCKING
}
