package gpufleet.cloud.yandex;

import com.google.protobuf.InvalidProtocolBufferException;
import gpufleet.cloud.config.YandexCloudConfig;
import gpufleet.cloud.provider.AttachedVolume;
import gpufleet.cloud.provider.CloudProvider;
import gpufleet.cloud.provider.DeleteOutcome;
import gpufleet.cloud.provider.InstanceSpec;
import gpufleet.cloud.provider.InstanceTypeOffer;
import gpufleet.cloud.provider.ProviderException;
import gpufleet.cloud.util.CloudInitBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import yandex.cloud.api.compute.v1.DiskOuterClass;
import yandex.cloud.api.compute.v1.DiskServiceOuterClass;
import yandex.cloud.api.compute.v1.ImageServiceOuterClass;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;
import yandex.cloud.sdk.utils.OperationUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Yandex Cloud Compute adapter.
 * Instance types map to [TYPE.*] presets from the INI config.
 */
public class YandexCloudProvider implements CloudProvider {

    private static final Logger log = LoggerFactory.getLogger(YandexCloudProvider.class);

    public static final String NAME = "yandex";
    private static final long GB = 1024L * 1024 * 1024;
    private static final Duration OPERATION_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration STATUS_POLL_INTERVAL = Duration.ofSeconds(5);

    private final YandexAuth auth;
    private final YandexCloudConfig config;

    public YandexCloudProvider(YandexAuth auth, YandexCloudConfig config) {
        this.auth = auth;
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String createInstance(InstanceSpec spec) throws ProviderException {
        YandexCloudConfig.InstancePreset preset = requirePreset(spec.zone(), spec.instanceType());
        if (spec.imageId() == null || spec.imageId().isBlank()) {
            throw ProviderException.permanent("IMAGE_REQUIRED", "No boot image for " + spec.instanceType());
        }

        String userData = CloudInitBuilder.buildUserData(
                config.sshUser(), config.sshPublicKey(), spec.workerEnv(), config.workerImage());

        var request = buildCreateInstanceRequest(spec, preset, userData);

        try {
            OperationOuterClass.Operation op = auth.getInstanceService().create(request);
            String instanceId = op.getMetadata()
                    .unpack(InstanceServiceOuterClass.CreateInstanceMetadata.class)
                    .getInstanceId();
            log.info("Create sent: name={} id={}", request.getName(), instanceId);

            // the caller persists the id before anything waits on the operation
            return instanceId;
        } catch (StatusRuntimeException e) {
            throw classify("create instance", e);
        } catch (InvalidProtocolBufferException e) {
            throw new ProviderException(ProviderException.Kind.TRANSIENT, "BAD_OPERATION_METADATA",
                    "Cannot read create operation metadata", e);
        }
    }

    @Override
    public void startInstance(String zone, String providerInstanceId) throws ProviderException {
        try {
            InstanceOuterClass.Instance instance = getInstance(providerInstanceId);
            InstanceOuterClass.Instance.Status status = instance.getStatus();
            if (status == InstanceOuterClass.Instance.Status.ERROR) {
                throw ProviderException.permanent("INSTANCE_ERROR",
                        "Instance " + providerInstanceId + " is in ERROR state");
            }
            if (status == InstanceOuterClass.Instance.Status.PROVISIONING
                    || status == InstanceOuterClass.Instance.Status.STARTING) {
                awaitRunning(providerInstanceId);
                return;
            }
            if (status == InstanceOuterClass.Instance.Status.RUNNING) {
                return;
            }
            var op = auth.getInstanceService().start(InstanceServiceOuterClass.StartInstanceRequest.newBuilder()
                    .setInstanceId(providerInstanceId)
                    .build());
            awaitOperation(op, "start " + providerInstanceId);
        } catch (StatusRuntimeException e) {
            throw classify("start instance", e);
        }
    }

    @Override
    public Optional<String> getIp(String zone, String providerInstanceId) throws ProviderException {
        try {
            InstanceOuterClass.Instance instance = getInstance(providerInstanceId);
            if (instance.getNetworkInterfacesCount() == 0) {
                return Optional.empty();
            }
            var addr = instance.getNetworkInterfaces(0).getPrimaryV4Address();
            String ip = addr.hasOneToOneNat() ? addr.getOneToOneNat().getAddress() : addr.getAddress();
            return ip == null || ip.isBlank() ? Optional.empty() : Optional.of(ip);
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw classify("get instance ip", e);
        }
    }

    @Override
    public DeleteOutcome deleteInstance(String zone, String providerInstanceId) throws ProviderException {
        try {
            var op = auth.getInstanceService().delete(InstanceServiceOuterClass.DeleteInstanceRequest.newBuilder()
                    .setInstanceId(providerInstanceId)
                    .build());
            awaitOperation(op, "delete " + providerInstanceId);
            return DeleteOutcome.DELETED;
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return DeleteOutcome.ALREADY_GONE;
            }
            throw classify("delete instance", e);
        }
    }

    @Override
    public boolean instanceExists(String zone, String providerInstanceId) throws ProviderException {
        try {
            getInstance(providerInstanceId);
            return true;
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return false;
            }
            throw classify("check instance", e);
        }
    }

    @Override
    public List<AttachedVolume> listAttachedVolumes(String zone, String providerInstanceId) throws ProviderException {
        try {
            InstanceOuterClass.Instance instance = getInstance(providerInstanceId);
            List<AttachedVolume> volumes = new ArrayList<>();
            if (instance.hasBootDisk()) {
                volumes.add(describe(instance.getBootDisk(), true));
            }
            for (InstanceOuterClass.AttachedDisk disk : instance.getSecondaryDisksList()) {
                volumes.add(describe(disk, false));
            }
            return volumes;
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return List.of();
            }
            throw classify("list attached disks", e);
        }
    }

    @Override
    public DeleteOutcome deleteVolume(String zone, String providerVolumeId) throws ProviderException {
        try {
            var op = auth.getDiskService().delete(DiskServiceOuterClass.DeleteDiskRequest.newBuilder()
                    .setDiskId(providerVolumeId)
                    .build());
            awaitOperation(op, "delete disk " + providerVolumeId);
            return DeleteOutcome.DELETED;
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return DeleteOutcome.ALREADY_GONE;
            }
            throw classify("delete disk", e);
        }
    }

    @Override
    public Optional<String> resolveBootImage(String zone, String instanceType) throws ProviderException {
        YandexCloudConfig.InstancePreset preset = config.preset(instanceType);
        String family = preset != null && preset.imageFamily() != null ? preset.imageFamily() : config.imageFamily();
        if (family == null || family.isBlank()) {
            return Optional.empty();
        }
        try {
            var image = auth.getImageService().getLatestByFamily(
                    ImageServiceOuterClass.GetImageLatestByFamilyRequest.newBuilder()
                            .setFolderId(config.imageFolderId())
                            .setFamily(family)
                            .build());
            return Optional.of(image.getId());
        } catch (StatusRuntimeException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw classify("resolve image family " + family, e);
        }
    }

    @Override
    public List<InstanceTypeOffer> fetchCatalog(String zone) {
        return config.presets.values().stream()
                .filter(p -> p.availableIn(zone))
                .map(p -> new InstanceTypeOffer(p.code(), p.code(), p.cpu(), p.ramGb(), p.gpus(),
                        p.vramPerGpuGb(), p.costPerHour()))
                .toList();
    }

    // ---------- helpers ----------

    private InstanceOuterClass.Instance getInstance(String id) {
        return auth.getInstanceService().get(InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                .setInstanceId(id)
                .build());
    }

    private AttachedVolume describe(InstanceOuterClass.AttachedDisk attached, boolean boot) {
        long size = 0;
        String type = boot ? "boot" : "data";
        try {
            DiskOuterClass.Disk disk = auth.getDiskService().get(DiskServiceOuterClass.GetDiskRequest.newBuilder()
                    .setDiskId(attached.getDiskId())
                    .build());
            size = disk.getSize();
            type = disk.getTypeId();
        } catch (StatusRuntimeException e) {
            log.warn("Cannot describe disk {}: {}", attached.getDiskId(), e.getStatus());
        }
        return new AttachedVolume(attached.getDiskId(), type, size, boot, boot || attached.getAutoDelete());
    }

    private YandexCloudConfig.InstancePreset requirePreset(String zone, String code) throws ProviderException {
        YandexCloudConfig.InstancePreset preset = config.preset(code);
        if (preset == null || !preset.availableIn(zone)) {
            throw ProviderException.permanent("INVALID_INSTANCE_TYPE",
                    "Instance type '" + code + "' is not offered in " + zone);
        }
        return preset;
    }

    /**
     * Polls until the instance is RUNNING. {@link #createInstance} returns before the create operation is done.
     */
    private void awaitRunning(String providerInstanceId) throws ProviderException {
        long deadline = System.nanoTime() + OPERATION_TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            InstanceOuterClass.Instance.Status status = getInstance(providerInstanceId).getStatus();
            if (status == InstanceOuterClass.Instance.Status.RUNNING) {
                return;
            }
            if (status == InstanceOuterClass.Instance.Status.ERROR) {
                throw ProviderException.permanent("INSTANCE_ERROR",
                        "Instance " + providerInstanceId + " is in ERROR state");
            }
            try {
                Thread.sleep(STATUS_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(ProviderException.Kind.TRANSIENT, "INTERRUPTED",
                        "wait for " + providerInstanceId + " interrupted", e);
            }
        }
        throw ProviderException.transientFailure("START_TIMEOUT",
                "Instance " + providerInstanceId + " not running after " + OPERATION_TIMEOUT);
    }

    private void awaitOperation(OperationOuterClass.Operation op, String what) throws ProviderException {
        try {
            OperationOuterClass.Operation done = OperationUtils.wait(auth.getOperationService(), op, OPERATION_TIMEOUT);
            if (done.hasError()) {
                throw ProviderException.permanent("OPERATION_FAILED",
                        what + " failed: " + done.getError().getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.TRANSIENT, "INTERRUPTED",
                    what + " interrupted", e);
        }
    }

    private InstanceServiceOuterClass.CreateInstanceRequest buildCreateInstanceRequest(
            InstanceSpec spec, YandexCloudConfig.InstancePreset preset, String userData) {
        var resources = InstanceServiceOuterClass.ResourcesSpec.newBuilder()
                .setCores(preset.cpu())
                .setMemory(preset.ramGb() * GB)
                .setGpus(preset.gpus())
                .build();

        var disk = InstanceServiceOuterClass.AttachedDiskSpec.DiskSpec.newBuilder()
                .setImageId(spec.imageId())
                .setSize(config.diskGb() * GB)
                .build();

        var boot = InstanceServiceOuterClass.AttachedDiskSpec.newBuilder()
                .setAutoDelete(true)
                .setDiskSpec(disk)
                .build();

        var nic = InstanceServiceOuterClass.NetworkInterfaceSpec.newBuilder()
                .setSubnetId(config.subnetId());
        if (config.securityGroupId() != null && !config.securityGroupId().isBlank()) {
            nic.addSecurityGroupIds(config.securityGroupId());
        }

        var addr = InstanceServiceOuterClass.PrimaryAddressSpec.newBuilder();
        if (config.publicIp()) {
            addr.setOneToOneNatSpec(
                    InstanceServiceOuterClass.OneToOneNatSpec.newBuilder()
                            .setIpVersion(InstanceOuterClass.IpVersion.IPV4)
                            .build());
        }
        nic.setPrimaryV4AddressSpec(addr.build());

        return InstanceServiceOuterClass.CreateInstanceRequest.newBuilder()
                .setFolderId(config.folderId())
                .setName(toInstanceName(spec.name()))
                .setZoneId(spec.zone())
                .setPlatformId(preset.platformId())
                .setResourcesSpec(resources)
                .setBootDiskSpec(boot)
                .addNetworkInterfaceSpecs(nic)
                .putMetadata("user-data", userData)
                .putLabels("managed-by", "gpufleet")
                .setSchedulingPolicy(
                        InstanceOuterClass.SchedulingPolicy.newBuilder()
                                .setPreemptible(config.preemptible())
                                .build())
                .build();
    }

    /**
     * Yandex names: lowercase letters, digits and hyphens, starting with a letter, at most 63 chars.
     */
    static String toInstanceName(String name) {
        String cleaned = ("gpufleet-" + name).toLowerCase().replaceAll("[^a-z0-9-]", "-");
        return cleaned.length() > 63 ? cleaned.substring(0, 63) : cleaned;
    }

    private static boolean isNotFound(StatusRuntimeException e) {
        return e.getStatus().getCode() == Status.Code.NOT_FOUND;
    }

    private static ProviderException classify(String what, StatusRuntimeException e) {
        Status.Code code = e.getStatus().getCode();
        ProviderException.Kind kind = switch (code) {
            case NOT_FOUND -> ProviderException.Kind.NOT_FOUND;
            case UNAVAILABLE, DEADLINE_EXCEEDED, ABORTED, INTERNAL, UNKNOWN, CANCELLED ->
                    ProviderException.Kind.TRANSIENT;
            default -> ProviderException.Kind.PERMANENT;
        };
        return new ProviderException(kind, "YC_" + code.name(), what + ": " + e.getStatus().getDescription(), e);
    }
}
