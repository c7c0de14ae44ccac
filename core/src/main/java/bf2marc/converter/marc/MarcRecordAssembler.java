package bf2marc.converter.marc;

import bf2marc.ConversionResult;
import bf2marc.exception.MarcAssemblyException;
import bf2marc.meta.Bibframe;
import bf2marc.util.ComposeUtil;
import bf2marc.util.Xml;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.marc4j.MarcXmlReader;
import org.marc4j.marc.Record;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns the MARCXML coming out of the stylesheet into marc4j records.
 * <p>
 * Values are normalized to NFC first, then the document is checked for the structure a MARC 21
 * record must have. Anything that does not pass is dropped with a warning.
 */
public class MarcRecordAssembler
{
    private final static Logger log = LogManager.getLogger(MarcRecordAssembler.class);

    private static final Pattern CONTROL_TAG = Pattern.compile("00[1-9]");
    private static final Pattern DATA_TAG = Pattern.compile("[0-9A-Za-z]{3}");

    public MarcCollection assemble(List<ConversionResult> results)
    {
        List<ConversionResult> assembled = new ArrayList<>(results.size());
        List<String> warnings = new ArrayList<>();
        for (ConversionResult result : results)
        {
            if (result.getStatus() != ConversionResult.Status.CONVERTED)
            {
                assembled.add(result);
                continue;
            }
            try
            {
                assembled.add(result.withRecord(buildRecord(result.getMarcXml(), result.getLabel())));
            } catch (MarcAssemblyException e)
            {
                String warning = "Dropped record for " + result.getLabel() + ": " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
                assembled.add(ConversionResult.failed(result.getLabel(), e.getMessage()));
            }
        }
        return new MarcCollection(assembled, warnings);
    }

    /**
     * @param marcXml a document with a single MARC 21 slim record element as its root. Normalized in place.
     * @param label what to call the record in messages
     */
    public Record buildRecord(Document marcXml, String label)
    {
        ComposeUtil.compose(marcXml, false);
        validate(marcXml.getDocumentElement());

        byte[] bytes;
        try
        {
            bytes = Xml.docToBytes(marcXml, false);
        } catch (TransformerException e)
        {
            throw new MarcAssemblyException("Could not serialize record for " + label, e);
        }

        try
        {
            MarcXmlReader reader = new MarcXmlReader(new ByteArrayInputStream(bytes));
            if (!reader.hasNext())
                throw new MarcAssemblyException("No record found for " + label);
            Record record = reader.next();
            // The output is always UTF-8
            record.getLeader().setCharCodingScheme('a');
            return record;
        } catch (MarcAssemblyException e)
        {
            throw e;
        } catch (RuntimeException e)
        {
            throw new MarcAssemblyException("Could not read record for " + label + ": " + e.getMessage(), e);
        }
    }

    private static void validate(Element record)
    {
        if (record == null || !Bibframe.MARCXML_NS.equals(record.getNamespaceURI())
                || !"record".equals(record.getLocalName()))
            throw new MarcAssemblyException("Root element is not a MARC record");

        List<Element> leaders = children(record, "leader");
        if (leaders.size() != 1)
            throw new MarcAssemblyException("Expected one leader, found " + leaders.size());
        String leader = leaders.get(0).getTextContent();
        if (leader.length() != 24)
            throw new MarcAssemblyException("Leader must be 24 characters: '" + leader + "'");

        for (Element field : children(record, "controlfield"))
        {
            String tag = field.getAttribute("tag");
            if (!CONTROL_TAG.matcher(tag).matches())
                throw new MarcAssemblyException("Bad control field tag: '" + tag + "'");
        }

        for (Element field : children(record, "datafield"))
        {
            String tag = field.getAttribute("tag");
            if (!DATA_TAG.matcher(tag).matches() || tag.startsWith("00"))
                throw new MarcAssemblyException("Bad data field tag: '" + tag + "'");
            if (field.getAttribute("ind1").length() != 1 || field.getAttribute("ind2").length() != 1)
                throw new MarcAssemblyException("Field " + tag + " needs one-character indicators");

            List<Element> subfields = children(field, "subfield");
            if (subfields.isEmpty())
                throw new MarcAssemblyException("Field " + tag + " has no subfields");
            for (Element subfield : subfields)
            {
                if (subfield.getAttribute("code").length() != 1)
                    throw new MarcAssemblyException("Field " + tag + " has a bad subfield code: '"
                            + subfield.getAttribute("code") + "'");
            }
        }
    }

    private static List<Element> children(Element parent, String localName)
    {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++)
        {
            if (nodes.item(i) instanceof Element)
            {
                Element e = (Element) nodes.item(i);
                if (Bibframe.MARCXML_NS.equals(e.getNamespaceURI()) && localName.equals(e.getLocalName()))
                    result.add(e);
            }
        }
        return result;
    }
}
