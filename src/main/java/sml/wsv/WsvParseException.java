package sml.wsv;

import lombok.Getter;
import sml.SmlErrorType;
import sml.SmlParseException;

/**
 * Tokenization error. Both {@code line} and {@code column} are 1-based,
 * the column counting code points.
 */
@Getter
public class WsvParseException extends SmlParseException {

    private final int column;

    public WsvParseException(SmlErrorType errorType, int line, int column, String message) {
        super(errorType, line, message);
        this.column = column;
    }
}
