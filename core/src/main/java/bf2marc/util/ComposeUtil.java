package bf2marc.util;

import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.text.Normalizer;

/**
 * Unicode normalization of MARC data before it is turned into records. Composed form (NFC) is the
 * canonical form, so that the same input always gives the same bytes out.
 */
public class ComposeUtil {

    /**
     * Normalizes every text node and attribute value below (and including) node, in place.
     */
    public static void compose(Node node, boolean compat) {
        switch (node.getNodeType()) {
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                node.setNodeValue(compose(node.getNodeValue(), compat));
                return;
            case Node.ELEMENT_NODE:
                NamedNodeMap attributes = node.getAttributes();
                for (int i = 0; i < attributes.getLength(); i++) {
                    Attr attr = (Attr) attributes.item(i);
                    attr.setValue(compose(attr.getValue(), compat));
                }
                break;
            default:
                break;
        }

        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            compose(children.item(i), compat);
        }
    }

    public static String compose(String str, boolean compat) {
        if (str == null)
            return null;
        return compat
                ? Normalizer.normalize(str, Normalizer.Form.NFKC)
                : Normalizer.normalize(str, Normalizer.Form.NFC);
    }

    public static String decompose(String str, boolean compat) {
        return compat
                ? Normalizer.normalize(str, Normalizer.Form.NFKD)
                : Normalizer.normalize(str, Normalizer.Form.NFD);
    }
}
