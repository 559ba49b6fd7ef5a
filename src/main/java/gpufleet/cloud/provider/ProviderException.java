package gpufleet.cloud.provider;

/**
 * Failure reported by a cloud provider call.
 * The kind decides whether the orchestrator retries or fails the instance.
 */
public class ProviderException extends Exception {

    public enum Kind {
        /** Network hiccup, throttling, provider 5xx - safe to retry */
        TRANSIENT,
        /** Quota exceeded, invalid zone/type, bad credentials - retrying won't help */
        PERMANENT,
        /** Resource does not exist */
        NOT_FOUND
    }

    private final Kind kind;
    private final String code;

    public ProviderException(Kind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public ProviderException(Kind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static ProviderException transientFailure(String code, String message) {
        return new ProviderException(Kind.TRANSIENT, code, message);
    }

    public static ProviderException permanent(String code, String message) {
        return new ProviderException(Kind.PERMANENT, code, message);
    }

    public Kind kind() {
        return kind;
    }

    /** Short machine-readable code, stored as the instance error_code. */
    public String code() {
        return code;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
