package org.fleetfeast.datapipeline.api.resources;

import java.time.Instant;

/**
 * A transient error that did not stop the component reporting it.
 *
 * @param timestamp when the error was recorded
 * @param code      short category, e.g. {@code STORE_WRITE_FAILED}
 * @param message   human-readable summary
 * @param details   additional context
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
