package oscar.provisioning.service.provisioning;

/**
 * Steps of a single service creation request.
 */
public enum ProvisioningState {
    RECEIVED,
    AUTHORIZED,
    NORMALIZED,
    WORKLOAD_CREATED,
    WEBHOOK_REGISTERED,
    STORAGE_PROVISIONED,
    COMPLETE,
    /** Reachable from any state after {@link #WORKLOAD_CREATED}; undoes what was created. */
    ABORTING,
    FAILED
}
