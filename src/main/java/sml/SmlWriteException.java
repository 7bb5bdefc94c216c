package sml;

public class SmlWriteException extends SmlException {

    public SmlWriteException(SmlErrorType errorType, String message) {
        super(errorType, message);
    }
}
