package bf2marc.deref;

import bf2marc.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Which referenced IRIs get fetched: class IRI to an ordered set of IRI prefixes.
 * Immutable, and handed explicitly to the resolver.
 */
public final class DereferenceConfig {
    private final static Logger log = LogManager.getLogger(DereferenceConfig.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String DEREFERENCE_KEY = "dereference";

    private static final DereferenceConfig EMPTY = new DereferenceConfig(Collections.emptyMap());

    private final Map<String, Set<String>> prefixesByClass;

    private DereferenceConfig(Map<String, Set<String>> prefixesByClass) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        prefixesByClass.forEach((cls, prefixes) ->
                copy.put(cls, Collections.unmodifiableSet(new LinkedHashSet<>(prefixes))));
        this.prefixesByClass = Collections.unmodifiableMap(copy);
    }

    public static DereferenceConfig empty() {
        return EMPTY;
    }

    public static DereferenceConfig of(Map<String, ? extends Iterable<String>> prefixesByClass) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        prefixesByClass.forEach((cls, prefixes) -> {
            Set<String> set = new LinkedHashSet<>();
            prefixes.forEach(set::add);
            map.put(cls, set);
        });
        return new DereferenceConfig(map);
    }

    public static DereferenceConfig fromFile(Path path) throws ConfigurationException {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read dereference configuration " + path, e);
        }
        return fromJson(json, path.toString());
    }

    /**
     * Parses {"dereference": {"classIri": ["prefix", ...], ...}}. Other top level keys are ignored.
     */
    public static DereferenceConfig fromJson(String json, String sourceName) throws ConfigurationException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed JSON in " + sourceName + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject())
            throw new ConfigurationException("Expected a JSON object in " + sourceName);

        Iterator<String> keys = root.fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            if (!key.equals(DEREFERENCE_KEY))
                log.debug("Ignoring unknown configuration key \"" + key + "\" in " + sourceName);
        }

        JsonNode dereference = root.get(DEREFERENCE_KEY);
        if (dereference == null || dereference.isNull())
            return EMPTY;
        if (!dereference.isObject())
            throw new ConfigurationException("\"" + DEREFERENCE_KEY + "\" must be an object in " + sourceName);

        Map<String, List<String>> prefixesByClass = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> classes = dereference.fields();
        while (classes.hasNext()) {
            Map.Entry<String, JsonNode> entry = classes.next();
            JsonNode prefixes = entry.getValue();
            if (!prefixes.isArray())
                throw new ConfigurationException("Prefixes for " + entry.getKey() + " must be an array in " + sourceName);

            List<String> list = new ArrayList<>();
            for (JsonNode prefix : prefixes) {
                if (!prefix.isTextual())
                    throw new ConfigurationException("Prefix for " + entry.getKey() + " is not a string in " + sourceName);
                list.add(prefix.asText());
            }
            prefixesByClass.put(entry.getKey(), list);
        }
        return of(prefixesByClass);
    }

    public boolean isEmpty() {
        return prefixesByClass.isEmpty();
    }

    public Set<String> getClasses() {
        return prefixesByClass.keySet();
    }

    public Set<String> getPrefixes(String classIri) {
        return prefixesByClass.getOrDefault(classIri, Collections.emptySet());
    }

    /**
     * True if iri starts with one of the prefixes configured for classIri.
     */
    public boolean matches(String classIri, String iri) {
        for (String prefix : getPrefixes(classIri)) {
            if (iri.startsWith(prefix))
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return prefixesByClass.toString();
    }
}
