package bf2marc.extract;

import bf2marc.ConversionProfile;
import bf2marc.Description;
import bf2marc.exception.ConfigurationException;
import bf2marc.exception.ExtractionException;
import bf2marc.meta.Bibframe;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the Work/Instance pairs of a graph with a SPARQL SELECT query and cuts out the triples
 * belonging to each pair.
 * <p>
 * The query must project ?work and ?instance. Each distinct pair becomes one Description, in the
 * order the query engine first reports it.
 */
public class DescriptionExtractor {
    private final static Logger log = LogManager.getLogger(DescriptionExtractor.class);

    public static final String WORK_VAR = "work";
    public static final String INSTANCE_VAR = "instance";

    private final Query m_query;
    private final int m_depth;

    public DescriptionExtractor(String queryText, int depth) throws ExtractionException {
        try {
            m_query = QueryFactory.create(queryText);
        } catch (RuntimeException e) {
            throw new ExtractionException("Malformed description query: " + e.getMessage(), e);
        }
        if (!m_query.isSelectType() || !m_query.getResultVars().contains(WORK_VAR)
                || !m_query.getResultVars().contains(INSTANCE_VAR)) {
            throw new ExtractionException("The description query must be a SELECT projecting ?" + WORK_VAR
                    + " and ?" + INSTANCE_VAR, null);
        }
        m_depth = depth;
    }

    public static DescriptionExtractor fromProfile(ConversionProfile profile)
            throws ConfigurationException, ExtractionException {
        String location = profile.getProperty(ConversionProfile.EXTRACT_QUERY);
        return new DescriptionExtractor(loadQueryText(location), profile.getDescriptionDepth());
    }

    /**
     * A file path wins over a classpath resource of the same name.
     */
    static String loadQueryText(String location) throws ConfigurationException {
        if (location == null || location.trim().isEmpty())
            throw new ConfigurationException("No description query configured (" + ConversionProfile.EXTRACT_QUERY + ")");

        Path path = Paths.get(location);
        try {
            if (Files.isRegularFile(path))
                return Files.readString(path, StandardCharsets.UTF_8);

            try (InputStream in = DescriptionExtractor.class.getClassLoader().getResourceAsStream(location)) {
                if (in == null)
                    throw new ConfigurationException("Description query not found: " + location);
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read description query " + location, e);
        }
    }

    public List<Description> extract(Model graph) throws ExtractionException {
        Set<Pair<Resource, Resource>> pairs = new LinkedHashSet<>();

        try (QueryExecution qexec = QueryExecutionFactory.create(m_query, graph)) {
            ResultSet results = qexec.execSelect();
            while (results.hasNext()) {
                QuerySolution solution = results.next();
                RDFNode work = solution.get(WORK_VAR);
                RDFNode instance = solution.get(INSTANCE_VAR);
                if (work == null || instance == null || !work.isResource() || !instance.isResource()) {
                    log.debug("Skipping incomplete binding work=" + work + " instance=" + instance);
                    continue;
                }
                pairs.add(Pair.of(work.asResource(), instance.asResource()));
            }
        } catch (RuntimeException e) {
            throw new ExtractionException("Description query failed: " + e.getMessage(), e);
        }

        List<Description> descriptions = new ArrayList<>(pairs.size());
        for (Pair<Resource, Resource> pair : pairs) {
            descriptions.add(describe(graph, pair.getLeft(), pair.getRight()));
        }

        if (descriptions.isEmpty())
            log.info("No descriptions found in the input graph");
        else
            log.info("Found " + descriptions.size() + " descriptions");
        return descriptions;
    }

    /**
     * Copies the triples reachable from the Work, the Instance and the Instance's Items into a model
     * of their own. Blank nodes are followed without limit, named resources up to the configured
     * number of hops from a root.
     */
    Description describe(Model graph, Resource work, Resource instance) {
        List<Resource> items = findItems(graph, instance);

        Model model = ModelFactory.createDefaultModel();
        model.setNsPrefixes(graph.getNsPrefixMap());

        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(work, 0));
        queue.add(new Hop(instance, 0));
        for (Resource item : items)
            queue.add(new Hop(item, 0));

        // Blank node hops cost nothing and go to the front, so every resource is expanded at its
        // shortest distance from a root
        Set<Resource> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            if (!visited.add(hop.resource))
                continue;

            StmtIterator it = graph.listStatements(hop.resource, null, (RDFNode) null);
            try {
                while (it.hasNext()) {
                    Statement statement = it.next();
                    model.add(statement);

                    RDFNode object = statement.getObject();
                    if (object.isAnon())
                        queue.addFirst(new Hop(object.asResource(), hop.distance));
                    else if (object.isURIResource() && hop.distance < m_depth)
                        queue.addLast(new Hop(object.asResource(), hop.distance + 1));
                }
            } finally {
                it.close();
            }
        }

        return new Description(work.inModel(model), instance.inModel(model), inModel(items, model), model);
    }

    private static List<Resource> findItems(Model graph, Resource instance) {
        Set<Resource> items = new LinkedHashSet<>();
        instance.inModel(graph).listProperties(Bibframe.hasItem).forEachRemaining(s -> {
            if (s.getObject().isResource())
                items.add(s.getObject().asResource());
        });
        items.addAll(graph.listSubjectsWithProperty(Bibframe.itemOf, instance).toList());
        return new ArrayList<>(items);
    }

    private static List<Resource> inModel(List<Resource> resources, Model model) {
        List<Resource> result = new ArrayList<>(resources.size());
        for (Resource resource : resources)
            result.add(resource.inModel(model));
        return result;
    }

    private static class Hop {
        final Resource resource;
        final int distance;

        Hop(Resource resource, int distance) {
            this.resource = resource;
            this.distance = distance;
        }
    }
}
