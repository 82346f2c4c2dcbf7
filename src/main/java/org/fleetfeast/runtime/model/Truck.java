package org.fleetfeast.runtime.model;

/**
 * Mutable state of one truck. Owned by the simulation thread; every other thread sees
 * trucks only through snapshots.
 */
public final class Truck {

    public static final long NO_TICK = -1L;

    private final TruckSpec spec;

    private TruckStatus status = TruckStatus.IDLE;
    private String currentZone;
    private String destinationZone;
    private int inventory;
    private double totalRevenue;
    private long departureTick = NO_TICK;
    private long arrivalTick = NO_TICK;
    private boolean restockBound;
    private long restockCompleteTick = NO_TICK;
    private long unitsSold;

    public Truck(TruckSpec spec) {
        this.spec = spec;
        this.currentZone = spec.startZone();
        this.inventory = spec.initialInventory();
    }

    /**
     * Copy of the mutable part of a truck, used to undo an action within a batch.
     */
    public record Checkpoint(TruckStatus status, String currentZone, String destinationZone, int inventory,
                             double totalRevenue, long departureTick, long arrivalTick, boolean restockBound,
                             long restockCompleteTick, long unitsSold) {
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(status, currentZone, destinationZone, inventory, totalRevenue,
                departureTick, arrivalTick, restockBound, restockCompleteTick, unitsSold);
    }

    public void restore(Checkpoint checkpoint) {
        this.status = checkpoint.status();
        this.currentZone = checkpoint.currentZone();
        this.destinationZone = checkpoint.destinationZone();
        this.inventory = checkpoint.inventory();
        this.totalRevenue = checkpoint.totalRevenue();
        this.departureTick = checkpoint.departureTick();
        this.arrivalTick = checkpoint.arrivalTick();
        this.restockBound = checkpoint.restockBound();
        this.restockCompleteTick = checkpoint.restockCompleteTick();
        this.unitsSold = checkpoint.unitsSold();
    }

    /**
     * Starts a trip, or redirects the current one. A redirected truck keeps its original
     * departure zone and tick.
     */
    public void startMoving(String destination, long departure, long arrival, boolean towardRestock) {
        if (departureTick == NO_TICK) {
            this.departureTick = departure;
        }
        this.status = TruckStatus.MOVING;
        this.destinationZone = destination;
        this.arrivalTick = arrival;
        this.restockBound = towardRestock;
        this.restockCompleteTick = NO_TICK;
    }

    /**
     * Completes transit: the destination becomes the current zone.
     */
    public void arrive() {
        this.currentZone = destinationZone;
        this.destinationZone = null;
        this.departureTick = NO_TICK;
        this.arrivalTick = NO_TICK;
    }

    public void startServing() {
        this.status = TruckStatus.SERVING;
        this.restockBound = false;
    }

    public void becomeIdle() {
        this.status = TruckStatus.IDLE;
        this.destinationZone = null;
        this.departureTick = NO_TICK;
        this.arrivalTick = NO_TICK;
        this.restockBound = false;
        this.restockCompleteTick = NO_TICK;
    }

    public void startRestocking(long completeTick) {
        this.status = TruckStatus.RESTOCKING;
        this.destinationZone = null;
        this.departureTick = NO_TICK;
        this.arrivalTick = NO_TICK;
        this.restockBound = false;
        this.restockCompleteTick = completeTick;
    }

    public void sell(int units) {
        if (units < 0 || units > inventory) {
            throw new IllegalArgumentException("Cannot sell " + units + " units from truck " + getId() + " holding " + inventory);
        }
        this.inventory -= units;
        this.unitsSold += units;
        this.totalRevenue += units * spec.unitPrice();
    }

    /**
     * Refills to capacity and charges the restock cost.
     *
     * @return the cost charged, {@code 0} if the truck was already full
     */
    public double refill() {
        int unitsAdded = spec.maxInventory() - inventory;
        double cost = unitsAdded > 0 ? spec.restockFixedFee() + spec.restockPerUnitCost() * unitsAdded : 0.0;
        this.inventory = spec.maxInventory();
        this.totalRevenue -= cost;
        return cost;
    }

    public String getId() {
        return spec.id();
    }

    public TruckSpec getSpec() {
        return spec;
    }

    public TruckStatus getStatus() {
        return status;
    }

    public String getCurrentZone() {
        return currentZone;
    }

    public String getDestinationZone() {
        return destinationZone;
    }

    public int getInventory() {
        return inventory;
    }

    public int getMaxInventory() {
        return spec.maxInventory();
    }

    public double getTotalRevenue() {
        return totalRevenue;
    }

    /**
     * @return the tick the current trip left {@link #getCurrentZone()}, {@link #NO_TICK} when not moving
     */
    public long getDepartureTick() {
        return departureTick;
    }

    public long getArrivalTick() {
        return arrivalTick;
    }

    public boolean isRestockBound() {
        return restockBound;
    }

    public long getRestockCompleteTick() {
        return restockCompleteTick;
    }

    public long getUnitsSold() {
        return unitsSold;
    }

    @Override
    public String toString() {
        return "Truck[" + getId() + " " + status + " at " + currentZone
                + (destinationZone != null ? " -> " + destinationZone : "")
                + ", inventory=" + inventory + "/" + spec.maxInventory() + "]";
    }
}
