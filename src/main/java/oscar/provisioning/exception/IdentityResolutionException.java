package oscar.provisioning.exception;

/**
 * Raised when the identity provider cannot resolve a bearer token into a subject and groups.
 */
public class IdentityResolutionException extends Exception {

    public IdentityResolutionException(String message) {
        super(message);
    }

    public IdentityResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
