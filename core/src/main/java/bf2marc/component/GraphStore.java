package bf2marc.component;

import bf2marc.exception.InputException;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.system.StreamRDFBase;
import org.apache.jena.shared.PrefixMapping;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.sparql.graph.GraphFactory;
import org.apache.jena.sparql.graph.GraphReadOnly;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;

/**
 * The triples of one run. Filled from any number of sources, then sealed; after that it is only ever read,
 * which is what lets descriptions be converted independently of each other.
 */
public class GraphStore {
    private final static Logger log = LogManager.getLogger(GraphStore.class);

    private final Model m_model = ModelFactory.createDefaultModel();
    private final Model m_readOnlyView = ModelFactory.createModelForGraph(new GraphReadOnly(m_model.getGraph()));
    private volatile boolean m_sealed = false;

    public void load(RdfSource source, RdfFormat format) throws InputException {
        if (source.isUrl())
            loadUrl(source.getLocation(), format);
        else
            loadFile(source, format);
    }

    public void load(InputStream in, RdfFormat format) throws InputException {
        checkNotSealed();
        Graph scratch = GraphFactory.createDefaultGraph();
        try {
            RDFParser.create().source(in).forceLang(format.getLang()).parse(new MergingSink(scratch));
        } catch (RuntimeException e) {
            throw new InputException("Could not parse input as " + format.getName() + ": " + e.getMessage(), e);
        }
        merge(scratch, "stream");
    }

    /**
     * Reads standard input (or whatever stream stands in for it), giving up with a NoInputException
     * if nothing arrives within waitMillis.
     */
    public void loadStdin(InputStream stdin, RdfFormat format, long waitMillis) throws InputException {
        load(StdinProbe.awaitInput(stdin, waitMillis), format);
    }

    private void loadFile(RdfSource source, RdfFormat format) throws InputException {
        checkNotSealed();
        if (!Files.isReadable(source.getPath()))
            throw new InputException("Cannot read input file " + source);

        Graph scratch = GraphFactory.createDefaultGraph();
        try (InputStream in = Files.newInputStream(source.getPath())) {
            RDFParser.create()
                    .source(in)
                    .base(source.getPath().toAbsolutePath().toUri().toString())
                    .forceLang(format.getLang())
                    .parse(new MergingSink(scratch));
        } catch (IOException | RuntimeException e) {
            throw new InputException("Could not parse " + source + " as " + format.getName() + ": " + e.getMessage(), e);
        }
        merge(scratch, source.toString());
    }

    /**
     * URLs are first fetched with content negotiation. If that fails, one more attempt is made with the
     * declared format forced. A failed second attempt is fatal.
     */
    private void loadUrl(String url, RdfFormat declared) throws InputException {
        checkNotSealed();
        Graph scratch = GraphFactory.createDefaultGraph();
        try {
            RDFParser.create().source(url).parse(new MergingSink(scratch));
        } catch (RuntimeException negotiationFailure) {
            log.warn("Content negotiated read of " + url + " failed (" + negotiationFailure.getMessage()
                    + "), retrying as " + declared.getName());
            scratch = GraphFactory.createDefaultGraph();
            try {
                RDFParser.create().source(url).forceLang(declared.getLang()).parse(new MergingSink(scratch));
            } catch (RuntimeException e) {
                throw new InputException("Could not read " + url + " as " + declared.getName() + ": " + e.getMessage(), e);
            }
        }
        merge(scratch, url);
    }

    private synchronized void merge(Graph scratch, String sourceName) {
        PrefixMapping prefixes = m_model.getGraph().getPrefixMapping();
        scratch.getPrefixMapping().getNsPrefixMap().forEach((prefix, uri) -> {
            if (prefixes.getNsPrefixURI(prefix) == null && prefixes.getNsURIPrefix(uri) == null)
                prefixes.setNsPrefix(prefix, uri);
        });
        long before = m_model.size();
        scratch.find(Node.ANY, Node.ANY, Node.ANY).forEachRemaining(m_model.getGraph()::add);
        log.info("Loaded " + (m_model.size() - before) + " new triples from " + sourceName);
    }

    private void checkNotSealed() {
        if (m_sealed)
            throw new IllegalStateException("The graph store is sealed, no more sources can be loaded");
    }

    /**
     * Ends the loading phase. The store is read-only from here on.
     */
    public void seal() {
        m_sealed = true;
    }

    public boolean isSealed() {
        return m_sealed;
    }

    /**
     * A read-only view of the loaded triples.
     */
    public Model getModel() {
        return m_readOnlyView;
    }

    public long size() {
        return m_model.size();
    }

    /**
     * Collects triples and quads alike. Named graphs carry no meaning for the conversion and are merged.
     */
    private static class MergingSink extends StreamRDFBase {
        private final Graph graph;

        MergingSink(Graph graph) {
            this.graph = graph;
        }

        @Override
        public void triple(Triple triple) {
            graph.add(triple);
        }

        @Override
        public void quad(Quad quad) {
            graph.add(quad.asTriple());
        }

        @Override
        public void prefix(String prefix, String iri) {
            if (!prefix.isEmpty())
                graph.getPrefixMapping().setNsPrefix(prefix, iri);
        }
    }
}
