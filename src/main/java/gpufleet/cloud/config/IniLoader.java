package gpufleet.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Loads Yandex Cloud settings from an INI file.
 * Sections: [AUTH], [NETWORK], [VM], [SSH], [WORKER] (opt.) and one [TYPE.&lt;code&gt;] per instance type.
 */
public class IniLoader {

    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);
    private static final String TYPE_PREFIX = "TYPE.";

    public static Optional<YandexCloudConfig> load(File file) {
        try {
            return load(new Ini(file));
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load cloud config from {}", file, ex);
            return Optional.empty();
        }
    }

    public static Optional<YandexCloudConfig> load(InputStream in) {
        try {
            return load(new Ini(in));
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load cloud config from stream", ex);
            return Optional.empty();
        }
    }

    private static Optional<YandexCloudConfig> load(Ini ini) throws IOException {
        Profile.Section auth = ini.get("AUTH");
        Profile.Section net  = ini.get("NETWORK");
        Profile.Section vm   = ini.get("VM");
        Profile.Section ssh  = ini.get("SSH");
        Profile.Section worker = ini.get("WORKER"); // optional

        if (auth == null || net == null || vm == null || ssh == null) {
            log.warn("Cloud config is missing one of [AUTH], [NETWORK], [VM], [SSH]");
            return Optional.empty();
        }

        String keyPath = opt(ssh, "public_key_path");
        String keyText = opt(ssh, "public_key");
        if ((keyText == null || keyText.isBlank()) && keyPath != null && !keyPath.isBlank()) {
            keyText = Files.readString(new File(keyPath).toPath()).trim();
        }

        YandexCloudConfig cfg = new YandexCloudConfig();

        // AUTH
        cfg.oauthToken = opt(auth, "oauth_token");
        cfg.folderId   = auth.fetch("folder_id");

        // NETWORK
        cfg.subnetId        = net.fetch("subnet_id");
        cfg.securityGroupId = opt(net, "security_group_id");
        cfg.publicIp        = Boolean.parseBoolean(opt(net, "public_ip", "true"));

        // VM
        cfg.imageFolderId = opt(vm, "image_folder_id", "standard-images");
        cfg.imageFamily   = opt(vm, "image_family");
        cfg.diskGb        = Integer.parseInt(opt(vm, "disk_gb", "100"));
        cfg.preemptible   = Boolean.parseBoolean(opt(vm, "preemptible", "false"));

        // SSH
        cfg.sshUser      = ssh.fetch("user");
        cfg.sshPublicKey = keyText;

        // WORKER
        if (worker != null) {
            cfg.workerImage = opt(worker, "image");
        }

        // TYPE.<code>
        for (String sectionName : ini.keySet()) {
            if (!sectionName.startsWith(TYPE_PREFIX)) {
                continue;
            }
            Profile.Section s = ini.get(sectionName);
            String code = sectionName.substring(TYPE_PREFIX.length());
            cfg.presets.put(code, new YandexCloudConfig.InstancePreset(
                    code,
                    s.fetch("platform_id"),
                    Integer.parseInt(s.fetch("cpu")),
                    Integer.parseInt(s.fetch("ram_gb")),
                    Integer.parseInt(opt(s, "gpus", "1")),
                    Integer.parseInt(opt(s, "vram_gb", "0")),
                    Double.parseDouble(opt(s, "cost_per_hour", "0")),
                    opt(s, "image_family"),
                    splitList(opt(s, "zones"))));
        }

        log.info("Loaded cloud config: {}", cfg);
        return Optional.of(cfg);
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        return s == null ? null : s.get(key);
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
