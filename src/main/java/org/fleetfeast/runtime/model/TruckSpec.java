package org.fleetfeast.runtime.model;

/**
 * Static parameters of a truck, read once from configuration.
 */
public record TruckSpec(
        String id,
        String startZone,
        String restockZone,
        int initialInventory,
        int maxInventory,
        double speedMultiplier,
        double unitPrice,
        double restockFixedFee,
        double restockPerUnitCost) {
}
