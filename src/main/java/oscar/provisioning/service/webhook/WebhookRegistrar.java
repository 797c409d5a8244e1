package oscar.provisioning.service.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.exception.ErrorKind;
import oscar.provisioning.exception.ProvisioningException;
import oscar.provisioning.exception.StorageAdminException;
import org.springframework.stereotype.Service;

/**
 * Registers a service's delivery endpoint as a MinIO webhook target and reloads MinIO so the
 * target becomes active. Without it no trigger can reach the service, so every failure is fatal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistrar {

    private final MinioAdminClientFactory adminClientFactory;

    public void register(String serviceName, String accessToken, MinioProvider defaultProvider) {
        StorageAdminClient adminClient;
        try {
            adminClient = adminClientFactory.create(defaultProvider);
        } catch (IllegalArgumentException e) {
            throw new ProvisioningException(ErrorKind.WEBHOOK_REGISTRATION,
                "the provided MinIO configuration is not valid: " + e.getMessage(), e);
        }

        try {
            adminClient.registerWebhook(serviceName, accessToken);
        } catch (StorageAdminException e) {
            throw new ProvisioningException(ErrorKind.WEBHOOK_REGISTRATION,
                "error registering the service's webhook: " + e.getMessage(), e);
        }

        try {
            adminClient.restartServer();
        } catch (StorageAdminException e) {
            throw new ProvisioningException(ErrorKind.WEBHOOK_REGISTRATION,
                "error restarting the MinIO server: " + e.getMessage(), e);
        }
    }
}
