package bf2marc.util;

import org.junit.Assert;
import org.junit.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

public class ComposeUtilTest
{
    @Test
    public void testComposeString()
    {
        String decomposed = ComposeUtil.decompose("Ångström", false);
        Assert.assertEquals(10, decomposed.length());
        Assert.assertEquals("Ångström", ComposeUtil.compose(decomposed, false));
        Assert.assertNull(ComposeUtil.compose((String) null, false));
    }

    @Test
    public void testCompatibilityForms()
    {
        // The fi ligature only goes away under compatibility normalization
        Assert.assertEquals("ﬁ", ComposeUtil.compose("ﬁ", false));
        Assert.assertEquals("fi", ComposeUtil.compose("ﬁ", true));
        Assert.assertEquals("fi", ComposeUtil.decompose("ﬁ", true));
    }

    @Test
    public void testComposeDocument() throws Exception
    {
        String decomposed = ComposeUtil.decompose("Röda", false);
        Document doc = Xml.parse("<a title=\"" + decomposed + "\"><b>" + decomposed + "</b><![CDATA[" + decomposed + "]]></a>");

        ComposeUtil.compose(doc, false);

        Element a = doc.getDocumentElement();
        Assert.assertEquals("Röda", a.getAttribute("title"));
        Assert.assertEquals("RödaRöda", a.getTextContent());
    }
}
