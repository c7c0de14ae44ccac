package bf2marc.component;

import bf2marc.exception.ConfigurationException;
import org.apache.jena.riot.Lang;

import java.util.Locale;

/**
 * The RDF serializations accepted as input.
 */
public enum RdfFormat {
    RDFXML("rdfxml", Lang.RDFXML),
    NTRIPLES("ntriples", Lang.NTRIPLES),
    TURTLE("turtle", Lang.TURTLE),
    RDFJSON("rdfjson", Lang.RDFJSON),
    NQUADS("nquads", Lang.NQUADS),
    JSONLD("jsonld", Lang.JSONLD);

    private final String name;
    private final Lang lang;

    RdfFormat(String name, Lang lang) {
        this.name = name;
        this.lang = lang;
    }

    public String getName() {
        return name;
    }

    public Lang getLang() {
        return lang;
    }

    public static RdfFormat forName(String name) throws ConfigurationException {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (RdfFormat format : values()) {
                if (format.name.equals(wanted)) {
                    return format;
                }
            }
        }
        throw new ConfigurationException("Unknown input format: " + name);
    }
}
