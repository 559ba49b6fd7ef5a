package gpufleet.orchestrator.service;

import gpufleet.cloud.provider.ProviderException;
import gpufleet.orchestrator.bus.Command;
import gpufleet.orchestrator.bus.CommandBus;
import gpufleet.orchestrator.bus.CommandCodec;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Instance;
import gpufleet.orchestrator.model.InstanceStatus;
import gpufleet.orchestrator.model.TransitionResult;
import gpufleet.orchestrator.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Consumes the orchestrator command channel.
 *
 * One receive thread decodes messages and hands each command to a worker pool, so a slow provider
 * call never blocks receiving. Delivery is best-effort; the reconciliation jobs cover lost
 * commands.
 */
public class CommandDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final CommandBus bus;
    private final InstanceRepository instances;
    private final InstanceService instanceService;
    private final ProvisioningService provisioningService;
    private final TerminationService terminationService;
    private final CatalogService catalogService;
    private final IntSupplier reconciler;
    private final OrchestratorConfig config;

    private final AtomicLong handled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private ExecutorService workers;
    private Thread receiver;
    private volatile boolean running = false;

    public CommandDispatcher(CommandBus bus, InstanceRepository instances, InstanceService instanceService,
            ProvisioningService provisioningService, TerminationService terminationService,
            CatalogService catalogService, IntSupplier reconciler, OrchestratorConfig config) {
        this.bus = bus;
        this.instances = instances;
        this.instanceService = instanceService;
        this.provisioningService = provisioningService;
        this.terminationService = terminationService;
        this.catalogService = catalogService;
        this.reconciler = reconciler;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Dispatcher already running");
            return;
        }
        running = true;

        AtomicInteger threadCount = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.dispatcherThreads(), r -> {
            Thread t = new Thread(r, "gpufleet-dispatch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        CommandBus.Subscription subscription = bus.subscribe(config.commandChannel());
        receiver = new Thread(() -> receiveLoop(subscription), "gpufleet-dispatch-receiver");
        receiver.setDaemon(true);
        receiver.start();

        log.info("Dispatcher listening on {} with {} workers", config.commandChannel(), config.dispatcherThreads());
    }

    private void receiveLoop(CommandBus.Subscription subscription) {
        try (subscription) {
            while (running) {
                String payload = subscription.poll(POLL_TIMEOUT);
                if (payload == null) {
                    continue;
                }
                Optional<Command> command = CommandCodec.decode(payload);
                if (command.isEmpty()) {
                    continue;
                }
                try {
                    workers.execute(() -> dispatch(command.get()));
                } catch (RejectedExecutionException e) {
                    log.warn("Dispatcher shutting down, dropping {}", command.get().type());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Dispatcher receive loop stopped");
    }

    /**
     * Handle one command on the calling thread. Never throws.
     */
    public void dispatch(Command command) {
        log.info("Handling {} (instance={}, correlation={})", command.type(), command.instanceId(),
                command.correlationId());
        try {
            switch (command.type()) {
                case PROVISION -> provisioningService.provision(command.instanceId(), command.provider(),
                        command.zone(), command.instanceType(), command.modelId());
                case TERMINATE -> terminate(command.instanceId());
                case REINSTALL -> instanceService.reinstall(command.instanceId());
                case SYNC_CATALOG -> catalogService.sync(command.provider());
                case RECONCILE -> reconciler.getAsInt();
            }
            handled.incrementAndGet();
        } catch (ProviderException e) {
            failed.incrementAndGet();
            log.error("{} failed: [{}] {}", command.type(), e.code(), e.getMessage());
        } catch (Exception e) {
            failed.incrementAndGet();
            log.error("{} failed for instance {}", command.type(), command.instanceId(), e);
        }
    }

    /**
     * Move to terminating, then run the teardown right away if this replica can claim the row.
     */
    private void terminate(String instanceId) {
        TransitionResult result = instanceService.requestTermination(instanceId, "terminate_requested");
        if (!result.isSuccess()) {
            log.warn("TERMINATE for {} ignored: {}", instanceId, result);
            return;
        }

        Optional<Instance> claimed = instances.claimById(instanceId, InstanceStatus.TERMINATING,
                config.clock().instant(), config.terminatorLease());
        if (claimed.isPresent()) {
            try {
                TerminationService.Outcome outcome = terminationService.terminate(claimed.get());
                log.info("TERMINATE fast path for {}: {}", instanceId, outcome);
            } finally {
                instances.releaseClaim(claimed.get());
            }
        } else {
            log.debug("Instance {} claimed elsewhere, terminator job will finish it", instanceId);
        }
    }

    public long handledCount() {
        return handled.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        try {
            receiver.join(POLL_TIMEOUT.toMillis() * 2);
            workers.shutdown();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Dispatcher workers forcefully stopped");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatcher stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
