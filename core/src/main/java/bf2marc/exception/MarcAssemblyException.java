package bf2marc.exception;

public class MarcAssemblyException extends ConversionException {

    public MarcAssemblyException(String msg) {
        super(msg);
    }

    public MarcAssemblyException(String msg, Throwable t) {
        super(msg, t);
    }
}
