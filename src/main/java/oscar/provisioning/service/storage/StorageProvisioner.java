package oscar.provisioning.service.storage;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.dto.service.StorageIOConfig;
import oscar.provisioning.dto.service.StorageProviders;
import oscar.provisioning.exception.ErrorKind;
import oscar.provisioning.exception.ProvisioningException;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.stereotype.Service;

/**
 * Creates the buckets, folders and event subscriptions implied by a service's input and output
 * bindings. Inputs are fully processed before outputs; on any failure the notifications enabled
 * so far are disabled again before the original error propagates. Buckets and folders are left
 * in place since they may predate the service.
 */
@Service
@Slf4j
public class StorageProvisioner {

    private final StorageBackendFactory backendFactory;
    private final OscarProperties properties;

    public StorageProvisioner(StorageBackendFactory backendFactory, OscarProperties properties) {
        this.backendFactory = backendFactory;
        this.properties = properties;
    }

    /**
     * Validates every input binding and the paths of the output bindings without touching any
     * backend, so that a bad trigger definition is rejected before anything is created.
     */
    public void validateInputs(ServiceDefinition service) {
        for (StorageIOConfig input : nullSafe(service.getInput())) {
            resolveInput(service, input);
        }
        for (StorageIOConfig output : nullSafe(service.getOutput())) {
            parsePath(output);
        }
    }

    public void provision(ServiceDefinition service) {
        String arn = service.minioWebhookArn();
        List<EnabledNotification> enabled = new ArrayList<>();
        List<StorageBackend> opened = new ArrayList<>();
        try {
            for (StorageIOConfig input : nullSafe(service.getInput())) {
                checkNotCancelled();
                ResolvedBinding binding = resolveInput(service, input);
                if (binding.kind() == ProviderKind.WEBDAV) {
                    continue;
                }
                StorageBackend backend = backendFactory.create(binding.kind(), binding.reference().id(),
                    service.getStorageProviders());
                opened.add(backend);
                backend.createBucketOrContainer(binding.path());
                backend.enableNotification(binding.path(), arn);
                enabled.add(new EnabledNotification(backend, binding.path()));
                log.info("Enabled {} notifications on {}", binding.reference(),
                    LogSanitizer.sanitize(binding.path().fullPath()));
            }

            for (StorageIOConfig output : nullSafe(service.getOutput())) {
                checkNotCancelled();
                ResolvedBinding binding = resolveOutput(service, output);
                StorageBackend backend = backendFactory.create(binding.kind(), binding.reference().id(),
                    service.getStorageProviders());
                opened.add(backend);
                backend.createBucketOrContainer(binding.path());
            }
        } catch (ProvisioningException e) {
            disableNotifications(enabled, arn);
            throw e;
        } catch (RuntimeException e) {
            disableNotifications(enabled, arn);
            throw ProvisioningException.storageBackend(null, null,
                "error provisioning storage for service " + service.getName() + ": " + e.getMessage(), e);
        } finally {
            opened.forEach(StorageProvisioner::closeQuietly);
        }
    }

    private static void closeQuietly(StorageBackend backend) {
        try {
            backend.close();
        } catch (RuntimeException e) {
            log.warn("Unable to release {}.{} client: {}", backend.kind().getWireName(), backend.providerId(),
                e.getMessage());
        }
    }

    /**
     * Best effort: failures are logged, never propagated, so the caller keeps the original error.
     */
    void disableNotifications(List<EnabledNotification> enabled, String arn) {
        for (EnabledNotification notification : enabled) {
            try {
                notification.backend().disableNotification(notification.path(), arn);
                log.info("Disabled notifications on {}", LogSanitizer.sanitize(notification.path().bucket()));
            } catch (RuntimeException e) {
                log.warn("Unable to disable notifications on bucket {}: {}",
                    LogSanitizer.sanitize(notification.path().bucket()), e.getMessage());
            }
        }
    }

    private ResolvedBinding resolveInput(ServiceDefinition service, StorageIOConfig input) {
        ProviderReference reference = ProviderReference.parse(input.getProvider());
        ProviderKind kind = reference.kind()
            .filter(ProviderKind::isInputCapable)
            .orElseThrow(() -> ProvisioningException.unsupportedInputProvider(reference.kindName()));
        requireDefined(service, kind, reference);

        if (kind == ProviderKind.MINIO && !reference.isDefault()) {
            MinioProvider declared = service.getStorageProviders().getMinio().get(reference.id());
            if (!declared.hasSameIdentityAs(properties.getMinio().toProvider())) {
                throw ProvisioningException.untrustedProvider(reference.id(), declared.getEndpoint());
            }
        }
        return new ResolvedBinding(reference, kind, parsePath(input));
    }

    private ResolvedBinding resolveOutput(ServiceDefinition service, StorageIOConfig output) {
        ProviderReference reference = ProviderReference.parse(output.getProvider());
        ProviderKind kind = reference.kind()
            .orElseThrow(() -> ProvisioningException.providerNotDefined(reference.kindName(), reference.id()));
        requireDefined(service, kind, reference);
        return new ResolvedBinding(reference, kind, parsePath(output));
    }

    private static StoragePath parsePath(StorageIOConfig binding) {
        StoragePath path = StoragePath.parse(binding.getPath());
        if (path.bucket().isEmpty()) {
            throw new ProvisioningException(ErrorKind.INVALID_SPECIFICATION,
                String.format("the path \"%s\" of provider %s does not name a bucket",
                    binding.getPath(), binding.getProvider()));
        }
        return path;
    }

    private static void requireDefined(ServiceDefinition service, ProviderKind kind, ProviderReference reference) {
        StorageProviders providers = service.getStorageProviders();
        if (providers == null || kind.instances(providers).get(reference.id()) == null) {
            throw ProvisioningException.providerNotDefined(kind.getWireName(), reference.id());
        }
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProvisioningException(ErrorKind.CANCELLED, "service creation was cancelled");
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    record ResolvedBinding(ProviderReference reference, ProviderKind kind, StoragePath path) {
    }

    record EnabledNotification(StorageBackend backend, StoragePath path) {
    }
}
