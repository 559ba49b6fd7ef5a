package gpufleet.cloud.util;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the cloud-init user data that installs and starts the worker agent.
 */
public final class CloudInitBuilder {

    public static final String WORKER_ENV_FILE = "/etc/default/gpufleet-worker";

    private CloudInitBuilder() {}

    public static String buildUserData(String user, String sshPublicKey, Map<String, String> workerEnv,
            String workerImage) {
        StringBuilder sb = new StringBuilder();
        sb.append("#cloud-config\n");
        sb.append("ssh_pwauth: no\n");

        if (user != null && !user.isBlank() && sshPublicKey != null && !sshPublicKey.isBlank()) {
            sb.append("users:\n");
            sb.append("  - name: ").append(user).append("\n");
            sb.append("    sudo: ALL=(ALL) NOPASSWD:ALL\n");
            sb.append("    groups: sudo\n");
            sb.append("    shell: /bin/bash\n");
            sb.append("    ssh_authorized_keys:\n");
            sb.append("      - ").append(sshPublicKey).append("\n");
        }

        // sorted for stable output
        Map<String, String> env = new TreeMap<>(workerEnv);
        sb.append("write_files:\n");
        sb.append("  - path: ").append(WORKER_ENV_FILE).append("\n");
        sb.append("    permissions: '0600'\n");
        sb.append("    content: |\n");
        for (Map.Entry<String, String> e : env.entrySet()) {
            sb.append("      ").append(e.getKey()).append('=').append(e.getValue()).append("\n");
        }

        if (workerImage != null && !workerImage.isBlank()) {
            sb.append("runcmd:\n");
            sb.append("  - 'docker run -d --restart=always --gpus all --network host --env-file ")
                    .append(WORKER_ENV_FILE).append(" ").append(workerImage).append("'\n");
        }
        return sb.toString();
    }
}
