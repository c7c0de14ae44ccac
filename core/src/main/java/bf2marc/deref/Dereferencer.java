package bf2marc.deref;

import bf2marc.exception.DereferenceException;
import org.apache.jena.rdf.model.Model;

/**
 * Looks up the triples describing an external resource.
 */
public interface Dereferencer {
    Model fetch(String iri) throws DereferenceException;
}
