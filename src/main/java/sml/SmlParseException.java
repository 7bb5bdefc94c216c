package sml;

import lombok.Getter;

/**
 * Structural or resource error found while building the element tree.
 * {@code line} is 1-based.
 */
@Getter
public class SmlParseException extends SmlException {

    private final int line;

    public SmlParseException(SmlErrorType errorType, int line, String message) {
        super(errorType, message);
        this.line = line;
    }
}
