package bf2marc;

import org.marc4j.marc.Record;
import org.w3c.dom.Document;

/**
 * What became of one description. Failures are values here, not exceptions, so that nothing thrown
 * while converting one description can reach the others.
 */
public class ConversionResult {

    public enum Status {
        /** A MARC record was produced. */
        CONVERTED,
        /** The mapping rules legitimately produced no record. Not an error. */
        NO_RECORD,
        /** Something went wrong for this description; see the reason. */
        FAILED
    }

    private final String label;
    private final Status status;
    private final Document marcXml;
    private final Record record;
    private final String reason;

    private ConversionResult(String label, Status status, Document marcXml, Record record, String reason) {
        this.label = label;
        this.status = status;
        this.marcXml = marcXml;
        this.record = record;
        this.reason = reason;
    }

    public static ConversionResult converted(String label, Document marcXml) {
        return new ConversionResult(label, Status.CONVERTED, marcXml, null, null);
    }

    public static ConversionResult noRecord(String label) {
        return new ConversionResult(label, Status.NO_RECORD, null, null, null);
    }

    public static ConversionResult failed(String label, String reason) {
        return new ConversionResult(label, Status.FAILED, null, null, reason);
    }

    /**
     * The same result with the record built from its MARCXML.
     */
    public ConversionResult withRecord(Record record) {
        return new ConversionResult(label, status, marcXml, record, reason);
    }

    public String getLabel() {
        return label;
    }

    public Status getStatus() {
        return status;
    }

    public Document getMarcXml() {
        return marcXml;
    }

    public Record getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return label + ": " + status + (reason != null ? " (" + reason + ")" : "");
    }
}
