package bf2marc.exception;

public class StripingException extends ConversionException {

    public StripingException(String msg) {
        super(msg);
    }

    public StripingException(String msg, Throwable t) {
        super(msg, t);
    }
}
