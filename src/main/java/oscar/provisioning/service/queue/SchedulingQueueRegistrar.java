package oscar.provisioning.service.queue;

import oscar.provisioning.dto.service.ServiceDefinition;

/**
 * Registers a dedicated scheduling queue for a service, bounded by the service's resources.
 */
public interface SchedulingQueueRegistrar {

    /**
     * @throws QueueRegistrationException if the scheduler configuration cannot be read or updated
     */
    void registerQueue(ServiceDefinition service) throws QueueRegistrationException;
}
