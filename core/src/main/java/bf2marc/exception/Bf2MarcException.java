package bf2marc.exception;

/**
 * Base class of the fatal, configuration-class errors. Anything thrown as a Bf2MarcException
 * aborts the whole run.
 */
public class Bf2MarcException extends Exception {

    public Bf2MarcException(String msg) {
        super(msg);
    }

    public Bf2MarcException(Throwable t) {
        super(t);
    }

    public Bf2MarcException(String msg, Throwable t) {
        super(msg, t);
    }
}
