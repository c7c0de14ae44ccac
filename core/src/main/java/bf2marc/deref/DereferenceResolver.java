package bf2marc.deref;

import bf2marc.ConversionMetrics;
import bf2marc.Description;
import bf2marc.exception.DereferenceException;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.jena.vocabulary.RDF;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.TreeSet;

/**
 * Pulls in the triples of external resources a description points at.
 * <p>
 * A triple qualifies when its subject is typed with a configured class and its object is an IRI
 * starting with one of that class's prefixes. The fetched triples go into a copy of the
 * description's model; neither the description nor the graph store it came from is touched.
 */
public class DereferenceResolver {
    private final static Logger log = LogManager.getLogger(DereferenceResolver.class);

    private final Dereferencer m_dereferencer;
    private final ConversionMetrics m_metrics;

    public DereferenceResolver(Dereferencer dereferencer) {
        this(dereferencer, new ConversionMetrics());
    }

    public DereferenceResolver(Dereferencer dereferencer, ConversionMetrics metrics) {
        m_dereferencer = dereferencer;
        m_metrics = metrics;
    }

    /**
     * @return the description's own model if there is nothing to do, otherwise a new model
     * holding the description's triples and everything that could be fetched.
     */
    public Model resolve(Description description, DereferenceConfig config) {
        if (config == null || config.isEmpty())
            return description.getModel();

        Set<String> targets = findTargets(description.getModel(), config);
        if (targets.isEmpty())
            return description.getModel();

        Model augmented = ModelFactory.createDefaultModel();
        augmented.setNsPrefixes(description.getModel().getNsPrefixMap());
        augmented.add(description.getModel());

        for (String iri : targets) {
            try {
                Model fetched = m_dereferencer.fetch(iri);
                augmented.add(fetched);
                m_metrics.countDereference(true);
                log.debug("Dereferenced " + iri + " (" + fetched.size() + " triples) for " + description.getLabel());
            } catch (DereferenceException e) {
                m_metrics.countDereference(false);
                log.warn("Could not dereference " + iri + " for " + description.getLabel() + ": " + e.getMessage());
            }
        }
        return augmented;
    }

    /**
     * The distinct object IRIs to fetch, sorted so that lookups happen in a stable order.
     */
    Set<String> findTargets(Model model, DereferenceConfig config) {
        Set<String> targets = new TreeSet<>();
        for (String classIri : config.getClasses()) {
            Resource cls = model.createResource(classIri);
            for (Resource subject : model.listSubjectsWithProperty(RDF.type, cls).toList()) {
                StmtIterator it = subject.listProperties();
                try {
                    while (it.hasNext()) {
                        Statement statement = it.next();
                        RDFNode object = statement.getObject();
                        if (object.isURIResource() && config.matches(classIri, object.asResource().getURI()))
                            targets.add(object.asResource().getURI());
                    }
                } finally {
                    it.close();
                }
            }
        }
        return targets;
    }
}
