package oscar.provisioning.exception;

/**
 * Base exception for CDMI container storage errors
 */
public class CdmiException extends Exception {

    public CdmiException(String message) {
        super(message);
    }

    public CdmiException(String message, Throwable cause) {
        super(message, cause);
    }
}
