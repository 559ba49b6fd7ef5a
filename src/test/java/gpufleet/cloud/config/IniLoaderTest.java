package gpufleet.cloud.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IniLoaderTest {

    private static Optional<YandexCloudConfig> load(String ini) {
        return IniLoader.load(new ByteArrayInputStream(ini.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void loadsSectionsAndPresets() {
        Optional<YandexCloudConfig> loaded = load("""
                [AUTH]
                oauth_token = y0_test
                folder_id = b1gfolder

                [NETWORK]
                subnet_id = e9bsubnet
                public_ip = true

                [VM]
                image_family = ubuntu-2204-lts-gpu
                disk_gb = 200
                preemptible = true

                [SSH]
                user = ubuntu
                public_key = ssh-ed25519 AAAA test@host

                [WORKER]
                image = registry.example/worker:1.4

                [TYPE.gpu-a100-1]
                platform_id = gpu-standard-v3
                cpu = 28
                ram_gb = 119
                gpus = 1
                vram_gb = 80
                cost_per_hour = 3.2
                zones = ru-central1-a, ru-central1-b
                """);

        YandexCloudConfig cfg = loaded.orElseThrow();
        assertEquals("b1gfolder", cfg.folderId());
        assertEquals("y0_test", cfg.oauthToken());
        assertEquals("e9bsubnet", cfg.subnetId());
        assertEquals(200, cfg.diskGb());
        assertTrue(cfg.preemptible());
        assertEquals("ubuntu", cfg.sshUser());
        assertEquals("registry.example/worker:1.4", cfg.workerImage());

        YandexCloudConfig.InstancePreset preset = cfg.preset("gpu-a100-1");
        assertEquals("gpu-standard-v3", preset.platformId());
        assertEquals(28, preset.cpu());
        assertEquals(80, preset.vramPerGpuGb());
        assertEquals(List.of("ru-central1-a", "ru-central1-b"), preset.zones());
        assertTrue(preset.availableIn("ru-central1-b"));
        assertFalse(preset.availableIn("ru-central1-d"));
    }

    @Test
    void missingSectionYieldsEmpty() {
        assertTrue(load("""
                [AUTH]
                folder_id = b1gfolder
                """).isEmpty());
    }

    @Test
    void malformedPresetYieldsEmpty() {
        assertTrue(load("""
                [AUTH]
                folder_id = b1gfolder
                [NETWORK]
                subnet_id = e9bsubnet
                [VM]
                [SSH]
                user = ubuntu
                [TYPE.broken]
                platform_id = gpu-standard-v3
                cpu = many
                ram_gb = 119
                """).isEmpty());
    }
}
