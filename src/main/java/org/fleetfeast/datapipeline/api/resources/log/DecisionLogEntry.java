package org.fleetfeast.datapipeline.api.resources.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One agent decision or its processing outcome.
 *
 * @param timestampMs wall-clock time the entry was written
 * @param tick        simulation tick the entry refers to
 * @param source      who wrote the entry ({@code agent} or {@code simulation})
 * @param type        action type, e.g. {@code dispatch}
 * @param description human-readable summary including the agent's reasoning
 * @param outcome     {@code queued}, {@code accepted}, {@code rejected: ...} or {@code hold}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionLogEntry(
        @JsonProperty("timestamp") long timestampMs,
        @JsonProperty("tick") long tick,
        @JsonProperty("source") String source,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description,
        @JsonProperty("outcome") String outcome) {
}
