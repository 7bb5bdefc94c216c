package sml;

public class SmlConfigurationException extends SmlException {

    public SmlConfigurationException(SmlErrorType errorType, String message) {
        super(errorType, message);
    }
}
