package sml;

import lombok.Getter;

/**
 * Base of every error raised while reading or writing SML.
 */
@Getter
public class SmlException extends RuntimeException {

    private final SmlErrorType errorType;

    public SmlException(SmlErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }
}
