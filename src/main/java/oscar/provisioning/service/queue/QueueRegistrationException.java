package oscar.provisioning.service.queue;

public class QueueRegistrationException extends Exception {

    public QueueRegistrationException(String message) {
        super(message);
    }

    public QueueRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
