package org.fleetfeast.runtime.snapshot;

/**
 * A snapshot together with its JSON form, serialized once by the simulation loop and
 * shared by every subscriber.
 */
public record PublishedSnapshot(WorldSnapshot snapshot, String json) {
}
