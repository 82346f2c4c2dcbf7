package org.fleetfeast.runtime.actions;

/**
 * Result of applying one {@link PendingAction}.
 *
 * @param action   the action
 * @param accepted whether the action took effect (or was acknowledged)
 * @param reason   why it was rejected, {@code null} when accepted
 * @param detail   human-readable explanation
 */
public record ActionOutcome(PendingAction action, boolean accepted, RejectionReason reason, String detail) {

    public static ActionOutcome accepted(PendingAction action, String detail) {
        return new ActionOutcome(action, true, null, detail);
    }

    public static ActionOutcome rejected(PendingAction action, RejectionReason reason, String detail) {
        return new ActionOutcome(action, false, reason, detail);
    }

    /**
     * @return {@code accepted} or {@code rejected: <reason>}, as written to the decision log
     */
    public String describe() {
        return accepted ? "accepted" : "rejected: " + reason.getDescription() + " (" + detail + ")";
    }
}
