package oscar.provisioning.service.storage;

/**
 * Provisioning capabilities of one resolved provider instance. Selected once per binding,
 * so the provisioning steps never branch on provider kind names.
 */
public interface StorageBackend extends AutoCloseable {

    ProviderKind kind();

    String providerId();

    /**
     * Creates the bucket (or container) and folder named by {@code path}; already existing
     * ones are treated as success.
     */
    void createBucketOrContainer(StoragePath path);

    /**
     * Subscribes the webhook identified by {@code arn} to object creation events under {@code path}.
     *
     * @throws UnsupportedOperationException if the backend cannot deliver triggers
     */
    default void enableNotification(StoragePath path, String arn) {
        throw new UnsupportedOperationException(kind().getWireName() + " providers do not support notifications");
    }

    /**
     * Removes every subscription of {@code arn} from the bucket of {@code path}.
     */
    default void disableNotification(StoragePath path, String arn) {
        throw new UnsupportedOperationException(kind().getWireName() + " providers do not support notifications");
    }

    /**
     * Releases the connections held by this backend.
     */
    @Override
    default void close() {
    }
}
