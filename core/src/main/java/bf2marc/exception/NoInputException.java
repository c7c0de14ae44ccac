package bf2marc.exception;

/**
 * Thrown when no source was named and nothing arrived on standard input in time.
 */
public class NoInputException extends InputException {

    public NoInputException(String msg) {
        super(msg);
    }
}
