package bf2marc.converter.marc;

import bf2marc.ConversionProfile;
import bf2marc.Description;
import bf2marc.TestData;
import bf2marc.component.GraphStore;
import bf2marc.converter.StripedXmlConverter;
import bf2marc.exception.ConfigurationException;
import bf2marc.exception.ConversionException;
import bf2marc.extract.DescriptionExtractor;
import bf2marc.meta.Bibframe;
import bf2marc.util.Xml;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.transform.stream.StreamSource;
import java.io.StringReader;
import java.util.Collections;
import java.util.Optional;
import java.util.Properties;

public class MarcXsltTransformerTest
{
    private GraphStore store;
    private DescriptionExtractor extractor;

    @Before
    public void setUp() throws Exception
    {
        store = TestData.storeFromResource("bf2marc/descriptions.ttl");
        extractor = DescriptionExtractor.fromProfile(new ConversionProfile());
    }

    private Document striped(String work) throws Exception
    {
        for (Description d : extractor.extract(store.getModel()))
        {
            if (d.getWork().getURI().equals(TestData.EX + work))
                return new StripedXmlConverter().stripe(d, d.getModel());
        }
        throw new AssertionError(work + " not extracted");
    }

    static String field(Document record, String tag, String code)
    {
        NodeList fields = record.getElementsByTagNameNS(Bibframe.MARCXML_NS, "*");
        for (int i = 0; i < fields.getLength(); i++)
        {
            Element field = (Element) fields.item(i);
            if (!tag.equals(field.getAttribute("tag")))
                continue;
            if (code == null)
                return field.getTextContent();
            NodeList subfields = field.getElementsByTagNameNS(Bibframe.MARCXML_NS, "subfield");
            for (int j = 0; j < subfields.getLength(); j++)
            {
                Element subfield = (Element) subfields.item(j);
                if (code.equals(subfield.getAttribute("code")))
                    return subfield.getTextContent();
            }
        }
        return null;
    }

    @Test
    public void testBundledStylesheet() throws Exception
    {
        MarcXsltTransformer transformer = MarcXsltTransformer.fromProfile(new ConversionProfile());
        Optional<Document> result = transformer.transform(striped("work1"));

        Assert.assertTrue(result.isPresent());
        Document record = result.get();
        Assert.assertEquals("record", record.getDocumentElement().getLocalName());
        Assert.assertEquals(Bibframe.MARCXML_NS, record.getDocumentElement().getNamespaceURI());
        Assert.assertEquals("rec-1", field(record, "001", null));
        Assert.assertNull(field(record, "003", null));
        Assert.assertEquals("9789100000001", field(record, "020", "a"));
        Assert.assertEquals("Strindberg, August", field(record, "100", "a"));
        Assert.assertEquals("Röda rummet", field(record, "245", "a"));
        Assert.assertEquals("Stockholm", field(record, "264", "a"));
        Assert.assertEquals("1879", field(record, "264", "c"));
        Assert.assertEquals("KB", field(record, "852", "a"));
        // The subject is only a reference until dereferenced
        Assert.assertNull(field(record, "650", "a"));
    }

    @Test
    public void testStylesheetParameters() throws Exception
    {
        Properties properties = new Properties();
        properties.setProperty("stylesheet.param.pControlNumberIdentifier", "SE-LIBR");
        MarcXsltTransformer transformer = MarcXsltTransformer.fromProfile(new ConversionProfile(properties));

        Document record = transformer.transform(striped("work2")).get();
        Assert.assertEquals("rec-2", field(record, "001", null));
        Assert.assertEquals("SE-LIBR", field(record, "003", null));
    }

    @Test
    public void testNoTitleGivesNoRecord() throws Exception
    {
        GraphStore untitled = TestData.storeFromTurtle(
                "ex:w a bf:Work ; bf:hasInstance ex:i .\n" +
                "ex:i a bf:Instance ; bf:date \"1900\" .\n");
        Description d = extractor.extract(untitled.getModel()).get(0);
        Document striped = new StripedXmlConverter().stripe(d, d.getModel());

        Assert.assertFalse(MarcXsltTransformer.fromProfile(new ConversionProfile()).transform(striped).isPresent());
    }

    @Test
    public void testOtherOutputGivesNoRecord() throws Exception
    {
        MarcXsltTransformer transformer = new MarcXsltTransformer(new StreamSource(
                getClass().getClassLoader().getResource("bf2marc/untitled.xsl").toExternalForm()),
                Collections.emptyMap());
        Assert.assertFalse(transformer.transform(striped("work1")).isPresent());
    }

    @Test(expected = ConversionException.class)
    public void testTerminatingMessage() throws Exception
    {
        Document malformed = Xml.parse("<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\"/>");
        MarcXsltTransformer.fromProfile(new ConversionProfile()).transform(malformed);
    }

    @Test(expected = ConfigurationException.class)
    public void testUncompilableStylesheet() throws Exception
    {
        new MarcXsltTransformer(new StreamSource(new StringReader("this is not a stylesheet")), Collections.emptyMap());
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingStylesheetFile() throws Exception
    {
        Properties properties = new Properties();
        properties.setProperty(ConversionProfile.STYLESHEET, "/no/such/stylesheet.xsl");
        MarcXsltTransformer.fromProfile(new ConversionProfile(properties));
    }
}
