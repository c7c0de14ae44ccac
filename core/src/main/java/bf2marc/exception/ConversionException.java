package bf2marc.exception;

/**
 * A failure scoped to a single description. Never allowed to abort the batch, the pipeline
 * catches it at the description boundary.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String msg) {
        super(msg);
    }

    public ConversionException(String msg, Throwable t) {
        super(msg, t);
    }
}
