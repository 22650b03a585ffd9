package ai.dictsite.converter.engine;

/**
 * Runtime exception raised when a document cannot be rewritten.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
