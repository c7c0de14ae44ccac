package bf2marc.converter;

import bf2marc.Description;
import bf2marc.exception.StripingException;
import bf2marc.meta.Bibframe;
import bf2marc.util.Xml;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.jena.rdf.model.impl.Util;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens the triples of a description into "striped" XML: resource elements and property elements
 * alternate all the way down, the shape XSLT mapping rules are written against. The output is RDF/XML.
 * <p>
 * Every resource is expanded where it is referenced, so the result is a tree. A resource met again while
 * it is still being expanded further up is written as a reference (rdf:resource or rdf:nodeID) instead.
 * Predicates are written in IRI order and objects in a content based order, so the same triples always
 * give the same document.
 */
public class StripedXmlConverter {
    static final String RDF_NS = RDF.getURI();

    private static final Map<String, String> WELL_KNOWN_PREFIXES = new LinkedHashMap<>();
    static {
        WELL_KNOWN_PREFIXES.put(RDFS.getURI(), "rdfs");
        WELL_KNOWN_PREFIXES.put(Bibframe.NS, "bf");
        WELL_KNOWN_PREFIXES.put(Bibframe.BFLC_NS, "bflc");
        WELL_KNOWN_PREFIXES.put(Bibframe.MADSRDF_NS, "madsrdf");
        WELL_KNOWN_PREFIXES.put("http://www.w3.org/2002/07/owl#", "owl");
        WELL_KNOWN_PREFIXES.put("http://www.w3.org/2004/02/skos/core#", "skos");
    }

    /**
     * @param graph the triples to stripe from; the description's own model or a dereference augmented copy of it
     */
    public Document stripe(Description description, Model graph) {
        Document doc = Xml.newDocument();
        Context ctx = new Context(doc, graph);

        Element root = ctx.createElement(RDF_NS + "RDF");
        doc.appendChild(root);

        Set<Resource> expanding = new HashSet<>();
        for (Resource r : description.getRoots()) {
            root.appendChild(resourceElement(ctx, r.inModel(graph), expanding));
        }

        for (Map.Entry<String, String> ns : ctx.namespaces.entrySet()) {
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + ns.getValue(), ns.getKey());
        }
        return doc;
    }

    private Element resourceElement(Context ctx, Resource resource, Set<Resource> expanding) {
        List<String> types = new ArrayList<>();
        List<Statement> statements = new ArrayList<>();
        StmtIterator it = resource.listProperties();
        try {
            while (it.hasNext()) {
                Statement statement = it.next();
                if (statement.getPredicate().equals(RDF.type) && statement.getObject().isURIResource())
                    types.add(statement.getObject().asResource().getURI());
                else
                    statements.add(statement);
            }
        } finally {
            it.close();
        }
        Collections.sort(types);
        statements.sort(Comparator
                .comparing((Statement s) -> s.getPredicate().getURI())
                .thenComparing(s -> ctx.sortKey(s.getObject())));

        // Typed node element if the first type fits in a QName, otherwise every type goes into rdf:type.
        Element element = null;
        int firstTypeProperty = 0;
        if (!types.isEmpty()) {
            element = ctx.createElementOrNull(types.get(0));
            if (element != null)
                firstTypeProperty = 1;
        }
        if (element == null)
            element = ctx.createElement(RDF_NS + "Description");

        if (resource.isURIResource())
            element.setAttributeNS(RDF_NS, "rdf:about", resource.getURI());
        else
            element.setAttributeNS(RDF_NS, "rdf:nodeID", ctx.nodeId(resource));

        expanding.add(resource);
        try {
            for (String type : types.subList(firstTypeProperty, types.size())) {
                Element typeProperty = ctx.createElement(RDF.type.getURI());
                typeProperty.setAttributeNS(RDF_NS, "rdf:resource", type);
                element.appendChild(typeProperty);
            }
            for (Statement statement : statements) {
                element.appendChild(propertyElement(ctx, statement, expanding));
            }
        } finally {
            expanding.remove(resource);
        }
        return element;
    }

    private Element propertyElement(Context ctx, Statement statement, Set<Resource> expanding) {
        Element property = ctx.createElement(statement.getPredicate().getURI());
        RDFNode object = statement.getObject();

        if (object.isLiteral()) {
            Literal literal = object.asLiteral();
            property.setTextContent(literal.getLexicalForm());
            String lang = literal.getLanguage();
            String datatype = literal.getDatatypeURI();
            if (lang != null && !lang.isEmpty())
                property.setAttributeNS(XMLConstants.XML_NS_URI, "xml:lang", lang);
            else if (datatype != null && !datatype.equals(XSDDatatype.XSDstring.getURI())
                    && !datatype.equals(RDF.langString.getURI()))
                property.setAttributeNS(RDF_NS, "rdf:datatype", datatype);
            return property;
        }

        Resource target = object.asResource();
        if (expanding.contains(target) || !hasProperties(target)) {
            if (target.isURIResource())
                property.setAttributeNS(RDF_NS, "rdf:resource", target.getURI());
            else
                property.setAttributeNS(RDF_NS, "rdf:nodeID", ctx.nodeId(target));
        } else {
            property.appendChild(resourceElement(ctx, target, expanding));
        }
        return property;
    }

    private static boolean hasProperties(Resource resource) {
        StmtIterator it = resource.listProperties();
        try {
            return it.hasNext();
        } finally {
            it.close();
        }
    }

    /**
     * Per-document state: namespace prefixes in first-use order, blank node ids in first-use order
     * and memoized sort keys.
     */
    private static class Context {
        final Document doc;
        final Model graph;
        final Map<String, String> namespaces = new LinkedHashMap<>();
        final Map<Resource, String> nodeIds = new HashMap<>();
        final Map<Resource, String> blankSignatures = new HashMap<>();
        int generatedPrefixes = 0;

        Context(Document doc, Model graph) {
            this.doc = doc;
            this.graph = graph;
            namespaces.put(RDF_NS, "rdf");
        }

        Element createElement(String iri) {
            Element element = createElementOrNull(iri);
            if (element == null)
                throw new StripingException("Cannot write <" + iri + "> as an XML element name");
            return element;
        }

        Element createElementOrNull(String iri) {
            int split = Util.splitNamespaceXML(iri);
            if (split <= 0 || split >= iri.length())
                return null;
            String ns = iri.substring(0, split);
            String local = iri.substring(split);
            return doc.createElementNS(ns, prefixFor(ns) + ":" + local);
        }

        String prefixFor(String ns) {
            String prefix = namespaces.get(ns);
            if (prefix != null)
                return prefix;

            prefix = graph.getNsURIPrefix(ns);
            if (!isUsable(prefix))
                prefix = WELL_KNOWN_PREFIXES.get(ns);
            while (!isUsable(prefix))
                prefix = "ns" + generatedPrefixes++;

            namespaces.put(ns, prefix);
            return prefix;
        }

        private boolean isUsable(String prefix) {
            return prefix != null && !prefix.isEmpty()
                    && !prefix.toLowerCase().startsWith("xml")
                    && !namespaces.containsValue(prefix);
        }

        String nodeId(Resource blank) {
            return nodeIds.computeIfAbsent(blank, b -> "b" + nodeIds.size());
        }

        String sortKey(RDFNode node) {
            if (node.isAnon())
                return blankSignatures.computeIfAbsent(node.asResource(), b -> sortKey(b, new HashSet<>()));
            return sortKey(node, null);
        }

        private String sortKey(RDFNode node, Set<Resource> expanding) {
            if (node.isLiteral()) {
                Literal literal = node.asLiteral();
                return "0" + literal.getLexicalForm() + '\u0000' + literal.getLanguage() + '\u0000' + literal.getDatatypeURI();
            }
            if (node.isURIResource())
                return "1" + node.asResource().getURI();
            if (!expanding.add(node.asResource()))
                return "2";
            String signature = blankSignature(node.asResource(), expanding);
            expanding.remove(node.asResource());
            return signature;
        }

        /**
         * Blank node labels differ between parses, so blank nodes are ordered by everything below them
         * instead. A blank node met again on its own path counts as a bare marker.
         */
        private String blankSignature(Resource blank, Set<Resource> expanding) {
            List<String> parts = new ArrayList<>();
            StmtIterator it = blank.listProperties();
            try {
                while (it.hasNext()) {
                    Statement statement = it.next();
                    parts.add(statement.getPredicate().getURI() + ' ' + sortKey(statement.getObject(), expanding));
                }
            } finally {
                it.close();
            }
            Collections.sort(parts);
            return "2" + String.join("\u0001", parts) + "\u0002";
        }
    }
}
