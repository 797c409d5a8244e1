package oscar.provisioning.exception;

public class ServiceAlreadyExistsException extends WorkloadBackendException {

    public ServiceAlreadyExistsException(Throwable cause) {
        super("A service with the provided name already exists", cause);
    }
}
