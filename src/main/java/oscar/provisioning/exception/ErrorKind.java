package oscar.provisioning.exception;

import org.springframework.http.HttpStatus;

/**
 * Closed set of provisioning failure kinds. Handlers match on the kind, never on message text.
 */
public enum ErrorKind {
    INVALID_SPECIFICATION(HttpStatus.BAD_REQUEST, true),
    UNSUPPORTED_INPUT_PROVIDER(HttpStatus.BAD_REQUEST, true),
    PROVIDER_NOT_DEFINED(HttpStatus.BAD_REQUEST, true),
    UNTRUSTED_PROVIDER(HttpStatus.BAD_REQUEST, true),
    VO_NOT_ENROLLED(HttpStatus.BAD_REQUEST, true),
    IDENTITY_RESOLUTION(HttpStatus.INTERNAL_SERVER_ERROR, false),
    SERVICE_ALREADY_EXISTS(HttpStatus.CONFLICT, true),
    WORKLOAD_BACKEND(HttpStatus.INTERNAL_SERVER_ERROR, false),
    WEBHOOK_REGISTRATION(HttpStatus.INTERNAL_SERVER_ERROR, false),
    STORAGE_BACKEND(HttpStatus.INTERNAL_SERVER_ERROR, false),
    CANCELLED(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean clientError;

    ErrorKind(HttpStatus status, boolean clientError) {
        this.status = status;
        this.clientError = clientError;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isClientError() {
        return clientError;
    }
}
