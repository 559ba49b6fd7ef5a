package gpufleet.orchestrator.service;

import gpufleet.cloud.mock.MockCloudProvider;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.WorkerToken;
import gpufleet.orchestrator.repository.InstanceRepository;
import gpufleet.orchestrator.repository.WorkerTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker-facing operations: heartbeat ingestion, registration and token bootstrap.
 *
 * Heartbeats only touch worker_* columns; lifecycle status is owned by the state machine.
 */
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private static final int TOKEN_PREFIX_LENGTH = 12;

    /**
     * Result of a registration. Token fields are set only on the call that issued the token.
     */
    public record Registration(String instanceId, String token, String tokenPrefix) {
        public boolean tokenIssued() {
            return token != null;
        }
    }

    private final InstanceRepository instances;
    private final WorkerTokenRepository tokens;
    private final OrchestratorConfig config;
    private final Clock clock;

    public WorkerService(InstanceRepository instances, WorkerTokenRepository tokens, OrchestratorConfig config) {
        this.instances = instances;
        this.tokens = tokens;
        this.config = config;
        this.clock = config.clock();
    }

    /**
     * Process a heartbeat. Terminated and archived instances ignore it.
     *
     * @return false if the instance is unknown or no longer accepts heartbeats
     */
    public boolean reportHeartbeat(String instanceId, String status, String modelId, Integer queueDepth,
            Double gpuUtilization, String metadata) {
        String normalized = status != null ? status.trim().toLowerCase(Locale.ROOT) : null;
        boolean updated = instances.updateWorkerHeartbeat(instanceId, normalized, modelId, queueDepth,
                gpuUtilization, metadata, clock.instant());
        if (updated) {
            log.debug("Heartbeat from {} (status={}, model={}, queue={}, gpu={})",
                    instanceId, normalized, modelId, queueDepth, gpuUtilization);
        } else {
            log.debug("Ignored heartbeat for {}", instanceId);
        }
        return updated;
    }

    /**
     * Heartbeat with credential check.
     *
     * @throws WorkerAuthException if auth is enabled and the token does not match
     */
    public boolean reportHeartbeat(String instanceId, String bearerToken, String status, String modelId,
            Integer queueDepth, Double gpuUtilization, String metadata) {
        requireAuthorized(instanceId, bearerToken);
        return reportHeartbeat(instanceId, status, modelId, queueDepth, gpuUtilization, metadata);
    }

    /**
     * Record worker ports and bootstrap its token on first contact.
     *
     * An unauthenticated worker may bootstrap once, and only from the instance's own address (any
     * address for mock instances).
     *
     * @return registration result, empty if the instance is unknown or terminal
     * @throws IllegalStateException if the ip/port pair is taken by another active instance, or the
     *                               token was already issued
     * @throws WorkerAuthException   if auth is enabled and bootstrap is not allowed
     */
    public Optional<Registration> registerWorker(String instanceId, String modelId, int vllmPort, int healthPort,
            String metadata, String bearerToken, String clientIp) {
        Optional<Instance> found = instances.findById(instanceId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Instance instance = found.get();

        boolean authorized = isAuthorized(instanceId, bearerToken);
        if (config.workerAuthRequired() && !authorized && !bootstrapAllowed(instance, clientIp)) {
            throw new WorkerAuthException("unauthorized");
        }

        if (!instances.registerWorker(instanceId, modelId, vllmPort, healthPort, metadata, clock.instant())) {
            return Optional.empty();
        }

        log.info("Worker registered for {} (model={}, vllm={}, health={})", instanceId, modelId, vllmPort, healthPort);

        if (authorized && bearerToken != null) {
            return Optional.of(new Registration(instanceId, null, null));
        }

        String token = newToken();
        String prefix = token.substring(0, TOKEN_PREFIX_LENGTH);
        boolean issued = tokens.insertIfAbsent(
                new WorkerToken(instanceId, sha256Hex(token), prefix, clock.instant(), null, null));
        if (!issued) {
            if (config.workerAuthRequired()) {
                throw new IllegalStateException("token_already_exists");
            }
            return Optional.of(new Registration(instanceId, null, null));
        }

        log.info("Issued worker token {}... for {}", prefix, instanceId);
        return Optional.of(new Registration(instanceId, token, prefix));
    }

    /**
     * Check a worker credential. Always true when auth is disabled. The shared token, if
     * configured, is accepted for every instance.
     */
    public boolean isAuthorized(String instanceId, String bearerToken) {
        if (!config.workerAuthRequired()) {
            return true;
        }
        if (bearerToken == null || bearerToken.isBlank()) {
            return false;
        }
        if (config.hasWorkerAuthToken() && config.workerAuthToken().equals(bearerToken.trim())) {
            return true;
        }

        Optional<WorkerToken> stored = tokens.findByInstance(instanceId);
        if (stored.isEmpty() || stored.get().isRevoked()) {
            return false;
        }
        boolean matches = MessageDigest.isEqual(
                stored.get().tokenHash().getBytes(StandardCharsets.US_ASCII),
                sha256Hex(bearerToken.trim()).getBytes(StandardCharsets.US_ASCII));
        if (matches) {
            tokens.touch(instanceId, clock.instant());
        }
        return matches;
    }

    private void requireAuthorized(String instanceId, String bearerToken) {
        if (!isAuthorized(instanceId, bearerToken)) {
            log.warn("Rejected worker call for {}", instanceId);
            throw new WorkerAuthException("unauthorized");
        }
    }

    private boolean bootstrapAllowed(Instance instance, String clientIp) {
        if (tokens.findByInstance(instance.id()).isPresent()) {
            return false;
        }
        if (MockCloudProvider.NAME.equals(instance.provider())) {
            return true;
        }
        return instance.hasIp() && clientIp != null && instance.ipAddress().equals(clientIp.trim());
    }

    static String newToken() {
        return "wk_" + UUID.randomUUID() + "_" + UUID.randomUUID();
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
