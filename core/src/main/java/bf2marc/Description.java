package bf2marc;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.Resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One catalogable unit: a Work, an Instance of it, the Instance's Items and the bounded
 * set of triples reachable from them. The model is private to the description and is
 * never written to after extraction.
 */
public class Description {
    private final Resource work;
    private final Resource instance;
    private final List<Resource> items;
    private final Model model;

    public Description(Resource work, Resource instance, List<Resource> items, Model model) {
        this.work = Objects.requireNonNull(work, "work");
        this.instance = Objects.requireNonNull(instance, "instance");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.model = Objects.requireNonNull(model, "model");
    }

    public Resource getWork() {
        return work;
    }

    public Resource getInstance() {
        return instance;
    }

    public List<Resource> getItems() {
        return items;
    }

    /**
     * Work first, then Instance, then Items. This is also the order they are striped in.
     */
    public List<Resource> getRoots() {
        List<Resource> roots = new ArrayList<>(items.size() + 2);
        roots.add(work);
        roots.add(instance);
        roots.addAll(items);
        return roots;
    }

    public Model getModel() {
        return model;
    }

    /**
     * Identifies the description in log messages.
     */
    public String getLabel() {
        return "work " + nodeLabel(work) + " / instance " + nodeLabel(instance);
    }

    static String nodeLabel(Resource resource) {
        return resource.isURIResource() ? "<" + resource.getURI() + ">" : "_:" + resource.getId().getLabelString();
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
