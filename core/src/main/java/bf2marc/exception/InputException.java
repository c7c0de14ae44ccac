package bf2marc.exception;

public class InputException extends Bf2MarcException {

    public InputException(String msg) {
        super(msg);
    }

    public InputException(String msg, Throwable t) {
        super(msg, t);
    }
}
