package oscar.provisioning.exception;

/**
 * Failure of a service creation step, typed by {@link ErrorKind}.
 * Carries the offending provider kind and id when the failure concerns a storage binding.
 */
public class ProvisioningException extends RuntimeException {

    private final ErrorKind kind;
    private final String providerKind;
    private final String providerId;

    public ProvisioningException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    public ProvisioningException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public ProvisioningException(ErrorKind kind, String message, String providerKind, String providerId,
                                 Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerKind = providerKind;
        this.providerId = providerId;
    }

    public static ProvisioningException unsupportedInputProvider(String providerKind) {
        return new ProvisioningException(ErrorKind.UNSUPPORTED_INPUT_PROVIDER,
            String.format("unrecognized input provider \"%s\" (valid inputs are MinIO and WebDAV)", providerKind),
            providerKind, null, null);
    }

    public static ProvisioningException providerNotDefined(String providerKind, String providerId) {
        return new ProvisioningException(ErrorKind.PROVIDER_NOT_DEFINED,
            String.format("the StorageProvider \"%s.%s\" is not defined", providerKind, providerId),
            providerKind, providerId, null);
    }

    public static ProvisioningException untrustedProvider(String providerId, String endpoint) {
        return new ProvisioningException(ErrorKind.UNTRUSTED_PROVIDER,
            String.format("the provided MinIO server \"%s\" is not the one configured in the platform", endpoint),
            "minio", providerId, null);
    }

    public static ProvisioningException storageBackend(String providerKind, String providerId, String message,
                                                       Throwable cause) {
        return new ProvisioningException(ErrorKind.STORAGE_BACKEND, message, providerKind, providerId, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getProviderKind() {
        return providerKind;
    }

    public String getProviderId() {
        return providerId;
    }
}
