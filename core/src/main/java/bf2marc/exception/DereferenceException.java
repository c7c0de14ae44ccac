package bf2marc.exception;

public class DereferenceException extends Exception {

    public DereferenceException(String msg) {
        super(msg);
    }

    public DereferenceException(String msg, Throwable t) {
        super(msg, t);
    }
}
