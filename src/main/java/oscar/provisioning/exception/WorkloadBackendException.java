package oscar.provisioning.exception;

/**
 * Exception thrown when the workload backend fails to create or delete a service
 */
public class WorkloadBackendException extends Exception {

    public WorkloadBackendException(String message) {
        super(message);
    }

    public WorkloadBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
