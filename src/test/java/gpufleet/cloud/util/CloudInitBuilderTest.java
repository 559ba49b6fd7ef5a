package gpufleet.cloud.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CloudInitBuilderTest {

    @Test
    void writesSortedWorkerEnvAndRunCommand() {
        String userData = CloudInitBuilder.buildUserData("ubuntu", "ssh-ed25519 AAAA test",
                Map.of("GPUFLEET_VLLM_PORT", "8000", "GPUFLEET_INSTANCE_ID", "i-1"),
                "registry.example/worker:1.4");

        assertTrue(userData.startsWith("#cloud-config\n"));
        assertTrue(userData.contains("  - name: ubuntu\n"));
        assertTrue(userData.contains("      - ssh-ed25519 AAAA test\n"));
        assertTrue(userData.indexOf("GPUFLEET_INSTANCE_ID=i-1") < userData.indexOf("GPUFLEET_VLLM_PORT=8000"));
        assertTrue(userData.contains("--env-file " + CloudInitBuilder.WORKER_ENV_FILE
                + " registry.example/worker:1.4"));
    }

    @Test
    void skipsUserAndRunCommandWhenNotConfigured() {
        String userData = CloudInitBuilder.buildUserData(null, null, Map.of("A", "1"), null);

        assertFalse(userData.contains("users:"));
        assertFalse(userData.contains("runcmd:"));
        assertTrue(userData.contains("      A=1\n"));
    }
}
