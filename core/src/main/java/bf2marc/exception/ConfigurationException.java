package bf2marc.exception;

public class ConfigurationException extends Bf2MarcException {

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable t) {
        super(msg, t);
    }
}
