package bf2marc.converter.marc;

import bf2marc.ConversionProfile;
import bf2marc.exception.ConfigurationException;
import bf2marc.exception.ConversionException;
import bf2marc.meta.Bibframe;
import bf2marc.util.Xml;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.transform.ErrorListener;
import javax.xml.transform.Source;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMResult;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamSource;
import java.io.File;
import java.net.URL;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs the BIBFRAME to MARC mapping rules, an XSLT stylesheet, over a striped document.
 * <p>
 * The stylesheet is compiled once; the compiled Templates are shared by all descriptions and threads.
 */
public class MarcXsltTransformer
{
    private final static Logger log = LogManager.getLogger(MarcXsltTransformer.class);

    public static final String DEFAULT_STYLESHEET = "bf2marc/bibframe2marc.xsl";

    private final Templates m_templates;
    private final Map<String, String> m_parameters;

    public MarcXsltTransformer(Source stylesheet, Map<String, String> parameters) throws ConfigurationException
    {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setErrorListener(new LoggingErrorListener());
        try
        {
            m_templates = factory.newTemplates(stylesheet);
        } catch (TransformerConfigurationException e)
        {
            throw new ConfigurationException("Could not compile stylesheet " + stylesheet.getSystemId() + ": "
                    + e.getMessageAndLocation(), e);
        }
        m_parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    public static MarcXsltTransformer fromProfile(ConversionProfile profile) throws ConfigurationException
    {
        String location = profile.getProperty(ConversionProfile.STYLESHEET, "").trim();
        Source source;
        if (location.isEmpty())
        {
            URL bundled = MarcXsltTransformer.class.getClassLoader().getResource(DEFAULT_STYLESHEET);
            if (bundled == null)
                throw new ConfigurationException("Bundled stylesheet " + DEFAULT_STYLESHEET + " is missing");
            source = new StreamSource(bundled.toExternalForm());
        }
        else
        {
            File file = new File(location);
            if (!file.canRead())
                throw new ConfigurationException("Cannot read stylesheet " + location);
            source = new StreamSource(file);
        }
        return new MarcXsltTransformer(source, profile.getStylesheetParameters());
    }

    /**
     * @return the MARCXML record, or empty if the rules produced no record for this description
     * @throws ConversionException if the stylesheet fails on this document
     */
    public Optional<Document> transform(Document stripedDocument)
    {
        Document output = Xml.newDocument();
        try
        {
            Transformer transformer = m_templates.newTransformer();
            transformer.setErrorListener(new LoggingErrorListener());
            m_parameters.forEach(transformer::setParameter);
            transformer.transform(new DOMSource(stripedDocument), new DOMResult(output));
        } catch (TransformerException e)
        {
            throw new ConversionException("Stylesheet failed: " + e.getMessageAndLocation(), e);
        } catch (RuntimeException e)
        {
            // XSLTC reports a terminating xsl:message this way
            throw new ConversionException("Stylesheet failed: " + e.getMessage(), e);
        }

        NodeList records = output.getElementsByTagNameNS(Bibframe.MARCXML_NS, "record");
        if (records.getLength() == 0)
            return Optional.empty();
        if (records.getLength() > 1)
            log.warn("Stylesheet produced " + records.getLength() + " records for one description, keeping the first");

        Document record = Xml.newDocument();
        Node imported = record.importNode((Element) records.item(0), true);
        record.appendChild(imported);
        return Optional.of(record);
    }

    /**
     * Keeps xsl:message output and recoverable errors out of stderr, which may be carrying the records.
     */
    private static class LoggingErrorListener implements ErrorListener
    {
        @Override
        public void warning(TransformerException exception)
        {
            log.info("Stylesheet: " + exception.getMessageAndLocation());
        }

        @Override
        public void error(TransformerException exception)
        {
            log.warn("Stylesheet error: " + exception.getMessageAndLocation());
        }

        @Override
        public void fatalError(TransformerException exception) throws TransformerException
        {
            throw exception;
        }
    }
}
