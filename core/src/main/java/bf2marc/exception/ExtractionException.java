package bf2marc.exception;

public class ExtractionException extends Bf2MarcException {

    public ExtractionException(String msg, Throwable t) {
        super(msg, t);
    }
}
