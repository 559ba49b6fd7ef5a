package gpufleet.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gpufleet.orchestrator.model.StateHistoryEntry;

import java.time.Instant;

/**
 * One state history row.
 * GET /api/v1/instances/{id}/history
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryEntryResponse(
        @JsonProperty("from_status") String fromStatus,
        @JsonProperty("to_status") String toStatus,
        @JsonProperty("reason") String reason,
        @JsonProperty("metadata") String metadata,
        @JsonProperty("created_at") Instant createdAt) {

    public static HistoryEntryResponse from(StateHistoryEntry entry) {
        return new HistoryEntryResponse(
                entry.fromStatus() != null ? entry.fromStatus().dbValue() : null,
                entry.toStatus().dbValue(),
                entry.reason(),
                entry.metadata(),
                entry.createdAt());
    }
}
