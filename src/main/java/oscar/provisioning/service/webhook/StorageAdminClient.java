package oscar.provisioning.service.webhook;

import oscar.provisioning.exception.StorageAdminException;

/**
 * Administrative operations on the platform's object store.
 */
public interface StorageAdminClient {

    /**
     * Registers (or replaces) the webhook notification target named {@code serviceName},
     * authenticating deliveries with {@code token}.
     */
    void registerWebhook(String serviceName, String token) throws StorageAdminException;

    /**
     * Restarts the object store so that newly registered targets become active.
     */
    void restartServer() throws StorageAdminException;
}
