package oscar.provisioning.exception;

/**
 * Exception thrown when a call to the object store administrative API fails
 */
public class StorageAdminException extends Exception {

    private final String operation;

    public StorageAdminException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StorageAdminException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
