package gpufleet.cloud.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Yandex Cloud account, network and instance-type presets loaded from INI.
 */
public class YandexCloudConfig {

    // AUTH
    public String oauthToken;     // null -> taken from OAUTH_TOKEN env
    public String folderId;

    // NETWORK
    public String subnetId;
    public String securityGroupId;
    public boolean publicIp = true;

    // VM defaults
    public String imageFolderId = "standard-images";
    public String imageFamily;
    public int diskGb = 100;
    public boolean preemptible = false;

    // SSH
    public String sshUser;
    public String sshPublicKey;

    // WORKER
    public String workerImage;

    /** Instance types keyed by code, from [TYPE.&lt;code&gt;] sections. */
    public final Map<String, InstancePreset> presets = new LinkedHashMap<>();

    public String oauthToken()      { return oauthToken; }
    public String folderId()        { return folderId; }
    public String subnetId()        { return subnetId; }
    public String securityGroupId() { return securityGroupId; }
    public boolean publicIp()       { return publicIp; }
    public String imageFolderId()   { return imageFolderId; }
    public String imageFamily()     { return imageFamily; }
    public int diskGb()             { return diskGb; }
    public boolean preemptible()    { return preemptible; }
    public String sshUser()         { return sshUser; }
    public String sshPublicKey()    { return sshPublicKey; }
    public String workerImage()     { return workerImage; }

    public InstancePreset preset(String code) {
        return presets.get(code);
    }

    /**
     * One orderable GPU shape.
     */
    public record InstancePreset(
            String code,
            String platformId,
            int cpu,
            int ramGb,
            int gpus,
            int vramPerGpuGb,
            double costPerHour,
            String imageFamily,
            List<String> zones) {

        public boolean availableIn(String zone) {
            return zones.isEmpty() || zones.contains(zone);
        }
    }

    @Override public String toString() {
        return "YandexCloudConfig{" +
                "folderId='" + folderId + '\'' +
                ", subnetId='" + subnetId + '\'' +
                ", presets=" + presets.keySet() +
                '}';
    }
}
