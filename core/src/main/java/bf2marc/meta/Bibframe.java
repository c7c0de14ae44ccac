package bf2marc.meta;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.ResourceFactory;

/**
 * The BIBFRAME terms the pipeline itself depends on. Everything else is left to the stylesheet.
 */
public class Bibframe {
    public static final String NS = "http://id.loc.gov/ontologies/bibframe/";
    public static final String BFLC_NS = "http://id.loc.gov/ontologies/bflc/";
    public static final String MADSRDF_NS = "http://www.loc.gov/mads/rdf/v1#";
    public static final String MARCXML_NS = "http://www.loc.gov/MARC21/slim";

    public static final Property hasInstance = ResourceFactory.createProperty(NS, "hasInstance");
    public static final Property instanceOf = ResourceFactory.createProperty(NS, "instanceOf");
    public static final Property hasItem = ResourceFactory.createProperty(NS, "hasItem");
    public static final Property itemOf = ResourceFactory.createProperty(NS, "itemOf");

    private Bibframe() {
    }
}
