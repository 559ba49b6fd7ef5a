package gpufleet.orchestrator.model;

/**
 * Status of a tracked provider volume.
 */
public enum VolumeStatus {
    ATTACHED,
    DELETING,
    /** Terminal */
    DELETED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static VolumeStatus fromDb(String value) {
        return valueOf(value.toUpperCase());
    }
}
