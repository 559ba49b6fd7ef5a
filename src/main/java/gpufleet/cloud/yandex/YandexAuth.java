package gpufleet.cloud.yandex;

import gpufleet.cloud.config.YandexCloudConfig;
import yandex.cloud.api.compute.v1.DiskServiceGrpc;
import yandex.cloud.api.compute.v1.ImageServiceGrpc;
import yandex.cloud.api.compute.v1.InstanceServiceGrpc;
import yandex.cloud.api.operation.OperationServiceGrpc;
import yandex.cloud.sdk.ServiceFactory;
import yandex.cloud.sdk.auth.Auth;

import java.time.Duration;

/**
 * Holds the gRPC stubs for the compute services the provider uses.
 */
public class YandexAuth {
    private final ServiceFactory factory;
    private final OperationServiceGrpc.OperationServiceBlockingStub operationService;
    private final InstanceServiceGrpc.InstanceServiceBlockingStub instanceService;
    private final ImageServiceGrpc.ImageServiceBlockingStub imageService;
    private final DiskServiceGrpc.DiskServiceBlockingStub diskService;

    public YandexAuth(YandexCloudConfig config) {
        this.factory = buildFactory(config.oauthToken());

        this.operationService = factory.create(
                OperationServiceGrpc.OperationServiceBlockingStub.class,
                OperationServiceGrpc::newBlockingStub
        );
        this.instanceService = factory.create(
                InstanceServiceGrpc.InstanceServiceBlockingStub.class,
                InstanceServiceGrpc::newBlockingStub
        );
        this.imageService = factory.create(
                ImageServiceGrpc.ImageServiceBlockingStub.class,
                ImageServiceGrpc::newBlockingStub
        );
        this.diskService = factory.create(
                DiskServiceGrpc.DiskServiceBlockingStub.class,
                DiskServiceGrpc::newBlockingStub
        );
    }

    private static ServiceFactory buildFactory(String oauthToken) {
        var credentials = (oauthToken == null || oauthToken.isBlank())
                ? Auth.oauthTokenBuilder().fromEnv("OAUTH_TOKEN")
                : Auth.oauthTokenBuilder().oauth(oauthToken);
        return ServiceFactory.builder()
                .credentialProvider(credentials)
                .requestTimeout(Duration.ofMinutes(1))
                .build();
    }

    public OperationServiceGrpc.OperationServiceBlockingStub getOperationService() { return operationService; }
    public InstanceServiceGrpc.InstanceServiceBlockingStub getInstanceService() { return instanceService; }
    public ImageServiceGrpc.ImageServiceBlockingStub getImageService() { return imageService; }
    public DiskServiceGrpc.DiskServiceBlockingStub getDiskService() { return diskService; }
}
