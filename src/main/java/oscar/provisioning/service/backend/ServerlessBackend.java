package oscar.provisioning.service.backend;

import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.exception.WorkloadBackendException;

/**
 * Backend that materializes a service definition as runnable workload objects.
 */
public interface ServerlessBackend {

    /**
     * @throws oscar.provisioning.exception.ServiceAlreadyExistsException if a service with the same
     *         name is already present
     */
    void createWorkload(ServiceDefinition service) throws WorkloadBackendException;

    /** Deleting a service that does not exist is not an error. */
    void deleteWorkload(String name) throws WorkloadBackendException;
}
