package bf2marc.converter.marc;

import bf2marc.ConversionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.marc4j.MarcException;
import org.marc4j.MarcStreamWriter;
import org.marc4j.MarcXmlWriter;
import org.marc4j.marc.Record;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a run: the results for every description, in extraction order, and the records
 * that were built from them.
 */
public class MarcCollection
{
    private final static Logger log = LogManager.getLogger(MarcCollection.class);

    private final List<ConversionResult> m_results;
    private final List<String> m_warnings;

    public MarcCollection(List<ConversionResult> results, List<String> warnings)
    {
        m_results = Collections.unmodifiableList(new ArrayList<>(results));
        m_warnings = new ArrayList<>(warnings);
    }

    public List<ConversionResult> getResults()
    {
        return m_results;
    }

    public List<Record> getRecords()
    {
        List<Record> records = new ArrayList<>();
        for (ConversionResult result : m_results)
        {
            if (result.getRecord() != null)
                records.add(result.getRecord());
        }
        return records;
    }

    public synchronized List<String> getWarnings()
    {
        return new ArrayList<>(m_warnings);
    }

    public int count(ConversionResult.Status status)
    {
        int n = 0;
        for (ConversionResult result : m_results)
        {
            if (result.getStatus() == status)
                ++n;
        }
        return n;
    }

    /**
     * True when descriptions were attempted, at least one failed and none became a record.
     * A run where every description legitimately produced no record is not a failure.
     */
    public boolean isTotalFailure()
    {
        return count(ConversionResult.Status.CONVERTED) == 0 && count(ConversionResult.Status.FAILED) > 0;
    }

    /**
     * Writes every record to out. Nothing reaches out until the whole collection is serialized.
     *
     * @return the number of records written
     */
    public int serialize(OutputStream out, OutputFormat format) throws IOException
    {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int written = format == OutputFormat.MARCXML ? writeXml(buffer) : writeIso2709(buffer);
        buffer.writeTo(out);
        out.flush();
        return written;
    }

    private int writeXml(ByteArrayOutputStream buffer) throws IOException
    {
        // Each record is tried on its own first, a failure halfway through would leave the shared writer broken
        List<Record> writable = new ArrayList<>();
        for (Record record : getRecords())
        {
            try
            {
                MarcXmlWriter trial = new MarcXmlWriter(new ByteArrayOutputStream(), "UTF-8");
                trial.write(record);
                trial.close();
            } catch (RuntimeException e)
            {
                warn("Left out record " + controlNumber(record) + " from MARCXML output: " + e);
                continue;
            }
            writable.add(record);
        }

        try
        {
            MarcXmlWriter writer = new MarcXmlWriter(buffer, "UTF-8", true);
            for (Record record : writable)
            {
                writer.write(record);
            }
            writer.close();
        } catch (MarcException e)
        {
            throw new IOException("Could not write MARCXML: " + e.getMessage(), e);
        }
        return writable.size();
    }

    private int writeIso2709(ByteArrayOutputStream buffer) throws IOException
    {
        int written = 0;
        for (Record record : getRecords())
        {
            // One writer per record, so that a record too long for the format can be left out on its own
            ByteArrayOutputStream single = new ByteArrayOutputStream();
            try
            {
                MarcStreamWriter writer = new MarcStreamWriter(single, "UTF-8");
                writer.write(record);
                writer.close();
            } catch (RuntimeException e)
            {
                warn("Left out record " + controlNumber(record) + " from ISO 2709 output: " + e);
                continue;
            }
            single.writeTo(buffer);
            ++written;
        }
        return written;
    }

    private synchronized void warn(String warning)
    {
        log.warn(warning);
        m_warnings.add(warning);
    }

    private static String controlNumber(Record record)
    {
        String id = record.getControlNumber();
        return id != null ? id : "(no 001)";
    }
}
