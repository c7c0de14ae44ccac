package bf2marc.util;

import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * The madness, just to build and print some xml.
 * DocumentBuilders and Transformers are not thread safe, so a new one is made for every call.
 */
public class Xml
{
    private static final DocumentBuilderFactory docBuildFactory = DocumentBuilderFactory.newInstance();
    private static final TransformerFactory transformerFactory = TransformerFactory.newInstance();
    static
    {
        docBuildFactory.setNamespaceAware(true);
        try
        {
            docBuildFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e)
        {
            throw new RuntimeException(e);
        }
    }

    public static DocumentBuilder newDocumentBuilder()
    {
        try
        {
            synchronized (docBuildFactory)
            {
                return docBuildFactory.newDocumentBuilder();
            }
        } catch (ParserConfigurationException e)
        {
            throw new RuntimeException(e);
        }
    }

    public static Document newDocument()
    {
        return newDocumentBuilder().newDocument();
    }

    public static Document parse(String xml) throws SAXException, IOException
    {
        return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }

    public static byte[] docToBytes(Document xmlDoc, boolean indent) throws TransformerException
    {
        Transformer transformer;
        synchronized (transformerFactory)
        {
            transformer = transformerFactory.newTransformer();
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        if (indent)
        {
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        transformer.transform(new DOMSource(xmlDoc), new StreamResult(out));
        return out.toByteArray();
    }

    public static String docToString(Document xmlDoc) throws TransformerException
    {
        return new String(docToBytes(xmlDoc, true), StandardCharsets.UTF_8);
    }
}
