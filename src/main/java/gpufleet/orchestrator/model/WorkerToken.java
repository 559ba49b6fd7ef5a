package gpufleet.orchestrator.model;

import java.time.Instant;

/**
 * Stored worker credential. Only the hash and a short prefix are kept.
 */
public record WorkerToken(
        String instanceId,
        String tokenHash,
        String tokenPrefix,
        Instant createdAt,
        Instant lastSeenAt,
        Instant revokedAt) {

    public boolean isRevoked() {
        return revokedAt != null;
    }
}
