package gpufleet.cloud.provider;

/**
 * Result of an idempotent teardown call.
 */
public enum DeleteOutcome {
    /** Delete accepted by the provider */
    DELETED,
    /** Resource was already gone - idempotent success */
    ALREADY_GONE
}
