package oscar.provisioning.exception;

public class CdmiBadRequestException extends CdmiException {

    public CdmiBadRequestException(String message) {
        super(message);
    }
}
