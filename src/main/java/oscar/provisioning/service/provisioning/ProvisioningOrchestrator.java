package oscar.provisioning.service.provisioning;

import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.dto.service.StorageProviders;
import oscar.provisioning.exception.ErrorKind;
import oscar.provisioning.exception.IdentityResolutionException;
import oscar.provisioning.exception.ProvisioningException;
import oscar.provisioning.exception.ServiceAlreadyExistsException;
import oscar.provisioning.exception.WorkloadBackendException;
import oscar.provisioning.service.auth.AuthorizationGate;
import oscar.provisioning.service.backend.ServerlessBackend;
import oscar.provisioning.service.queue.QueueRegistrationException;
import oscar.provisioning.service.queue.SchedulingQueueRegistrar;
import oscar.provisioning.service.storage.StorageProvisioner;
import oscar.provisioning.service.webhook.WebhookRegistrar;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.stereotype.Service;

/**
 * Drives a service creation request through its steps on the calling thread.
 *
 * <p>Once the workload exists, any later failure deletes it again before the error is reported.
 * A registered webhook is left in place since it is harmless without a subscribed bucket.
 */
@Service
@Slf4j
public class ProvisioningOrchestrator {

    private final AuthorizationGate authorizationGate;
    private final ServiceNormalizer normalizer;
    private final ServerlessBackend backend;
    private final WebhookRegistrar webhookRegistrar;
    private final StorageProvisioner storageProvisioner;
    private final SchedulingQueueRegistrar queueRegistrar;
    private final OscarProperties properties;

    public ProvisioningOrchestrator(AuthorizationGate authorizationGate,
                                    ServiceNormalizer normalizer,
                                    ServerlessBackend backend,
                                    WebhookRegistrar webhookRegistrar,
                                    StorageProvisioner storageProvisioner,
                                    SchedulingQueueRegistrar queueRegistrar,
                                    OscarProperties properties) {
        this.authorizationGate = authorizationGate;
        this.normalizer = normalizer;
        this.backend = backend;
        this.webhookRegistrar = webhookRegistrar;
        this.storageProvisioner = storageProvisioner;
        this.queueRegistrar = queueRegistrar;
        this.properties = properties;
    }

    /**
     * Creates the service.
     *
     * @param service  definition received from the caller; normalized in place
     * @param rawToken bearer token of the caller, or {@code null} when not authenticated through OIDC
     * @return the final state, always {@link ProvisioningState#COMPLETE}
     * @throws ProvisioningException describing the first fatal failure, after compensation ran
     */
    public ProvisioningState createService(ServiceDefinition service, String rawToken) {
        String name = LogSanitizer.sanitize(service.getName());
        ProvisioningState state = ProvisioningState.RECEIVED;
        log.info("Creating service {}", name);

        try {
            checkNotCancelled();
            authorize(service, rawToken);
            state = transition(name, state, ProvisioningState.AUTHORIZED);

            normalizer.normalize(service);
            storageProvisioner.validateInputs(service);
            state = transition(name, state, ProvisioningState.NORMALIZED);

            checkNotCancelled();
            createWorkload(service);
            state = transition(name, state, ProvisioningState.WORKLOAD_CREATED);
        } catch (ProvisioningException e) {
            transition(name, state, ProvisioningState.FAILED);
            throw e;
        }

        try {
            checkNotCancelled();
            webhookRegistrar.register(service.getName(), service.getToken(),
                service.getStorageProviders().getMinio().get(StorageProviders.DEFAULT_PROVIDER));
            state = transition(name, state, ProvisioningState.WEBHOOK_REGISTERED);

            checkNotCancelled();
            storageProvisioner.provision(service);
            state = transition(name, state, ProvisioningState.STORAGE_PROVISIONED);
        } catch (ProvisioningException e) {
            abort(service.getName(), state);
            throw e;
        } catch (RuntimeException e) {
            abort(service.getName(), state);
            throw new ProvisioningException(ErrorKind.STORAGE_BACKEND,
                "unexpected error creating the service: " + e.getMessage(), e);
        }

        if (properties.getYunikorn().isEnabled()) {
            try {
                queueRegistrar.registerQueue(service);
            } catch (QueueRegistrationException | RuntimeException e) {
                log.warn("Unable to register the scheduling queue of service {}: {}", name, e.getMessage());
            }
        }
        return transition(name, state, ProvisioningState.COMPLETE);
    }

    private void authorize(ServiceDefinition service, String rawToken) {
        String vo = service.getVo();
        if (vo == null || vo.isEmpty()) {
            return;
        }
        if (rawToken == null || rawToken.isBlank()) {
            throw notEnrolled(vo);
        }

        boolean hasVO;
        try {
            hasVO = authorizationGate.userHasVO(rawToken, vo);
        } catch (IdentityResolutionException e) {
            throw new ProvisioningException(ErrorKind.IDENTITY_RESOLUTION, e.getMessage(), e);
        }
        if (!hasVO) {
            throw notEnrolled(vo);
        }
    }

    private void createWorkload(ServiceDefinition service) {
        try {
            backend.createWorkload(service);
        } catch (ServiceAlreadyExistsException e) {
            throw new ProvisioningException(ErrorKind.SERVICE_ALREADY_EXISTS, e.getMessage(), e);
        } catch (WorkloadBackendException e) {
            throw new ProvisioningException(ErrorKind.WORKLOAD_BACKEND,
                "Error creating the service: " + e.getMessage(), e);
        }
    }

    /**
     * Deletes the workload; a failure here is logged so the caller still sees the original error.
     */
    private void abort(String serviceName, ProvisioningState reached) {
        String name = LogSanitizer.sanitize(serviceName);
        transition(name, reached, ProvisioningState.ABORTING);
        try {
            backend.deleteWorkload(serviceName);
        } catch (WorkloadBackendException | RuntimeException e) {
            log.warn("Unable to delete the workload of service {} during rollback: {}", name, e.getMessage());
        }
        transition(name, ProvisioningState.ABORTING, ProvisioningState.FAILED);
    }

    private static ProvisioningState transition(String name, ProvisioningState from, ProvisioningState to) {
        log.info("Service {}: {} -> {}", name, from, to);
        return to;
    }

    private static ProvisioningException notEnrolled(String vo) {
        return new ProvisioningException(ErrorKind.VO_NOT_ENROLLED,
            "This user isn't enrolled on the vo: " + LogSanitizer.sanitize(vo));
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProvisioningException(ErrorKind.CANCELLED, "service creation was cancelled");
        }
    }
}
