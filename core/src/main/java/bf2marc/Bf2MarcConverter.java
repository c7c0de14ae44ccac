package bf2marc;

import bf2marc.component.GraphStore;
import bf2marc.converter.StripedXmlConverter;
import bf2marc.converter.marc.MarcCollection;
import bf2marc.converter.marc.MarcRecordAssembler;
import bf2marc.converter.marc.MarcXsltTransformer;
import bf2marc.deref.DereferenceConfig;
import bf2marc.deref.DereferenceResolver;
import bf2marc.deref.Dereferencer;
import bf2marc.exception.ConfigurationException;
import bf2marc.exception.ConversionException;
import bf2marc.exception.ExtractionException;
import bf2marc.extract.DescriptionExtractor;
import bf2marc.util.BlockingThreadPool;
import org.apache.jena.rdf.model.Model;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The whole conversion: descriptions are extracted from the sealed graph store, then each one is
 * dereferenced, striped, transformed and finally assembled into a record.
 * <p>
 * Whatever goes wrong with one description ends up in its ConversionResult. Only problems with the
 * run as a whole (the description query, being interrupted) are thrown.
 */
public class Bf2MarcConverter {
    private final static Logger log = LogManager.getLogger(Bf2MarcConverter.class);

    private final DescriptionExtractor extractor;
    private final DereferenceResolver resolver;
    private final DereferenceConfig dereferenceConfig;
    private final StripedXmlConverter striper = new StripedXmlConverter();
    private final MarcXsltTransformer transformer;
    private final MarcRecordAssembler assembler = new MarcRecordAssembler();
    private final ConversionMetrics metrics;
    private final int threads;

    public Bf2MarcConverter(DescriptionExtractor extractor, DereferenceResolver resolver,
                            DereferenceConfig dereferenceConfig, MarcXsltTransformer transformer,
                            ConversionMetrics metrics, int threads) {
        this.extractor = extractor;
        this.resolver = resolver;
        this.dereferenceConfig = dereferenceConfig != null ? dereferenceConfig : DereferenceConfig.empty();
        this.transformer = transformer;
        this.metrics = metrics;
        this.threads = Math.max(1, threads);
    }

    /**
     * @param parallel run descriptions on parallel.threads worker threads instead of one at a time
     */
    public static Bf2MarcConverter fromProfile(ConversionProfile profile, DereferenceConfig dereferenceConfig,
                                               Dereferencer dereferencer, boolean parallel)
            throws ConfigurationException, ExtractionException {
        ConversionMetrics metrics = new ConversionMetrics();
        return new Bf2MarcConverter(
                DescriptionExtractor.fromProfile(profile),
                new DereferenceResolver(dereferencer, metrics),
                dereferenceConfig,
                MarcXsltTransformer.fromProfile(profile),
                metrics,
                parallel ? profile.getParallelThreads() : 1);
    }

    public MarcCollection convert(GraphStore store) throws ExtractionException, InterruptedException {
        if (!store.isSealed())
            store.seal();

        List<Description> descriptions = extractor.extract(store.getModel());
        List<ConversionResult> results = threads > 1 && descriptions.size() > 1
                ? convertParallel(descriptions)
                : convertSequential(descriptions);

        MarcCollection collection = assembler.assemble(results);
        for (ConversionResult result : collection.getResults())
            metrics.countDescription(result.getStatus());

        log.info("Converted " + metrics.getDescriptions(ConversionResult.Status.CONVERTED)
                + ", no record for " + metrics.getDescriptions(ConversionResult.Status.NO_RECORD)
                + ", failed " + metrics.getDescriptions(ConversionResult.Status.FAILED)
                + " of " + descriptions.size() + " descriptions");
        return collection;
    }

    /**
     * Runs one description through dereferencing, striping and the stylesheet. Never throws.
     */
    public ConversionResult convert(Description description) {
        String label = description.getLabel();
        try {
            Model graph = resolver.resolve(description, dereferenceConfig);
            Document striped = striper.stripe(description, graph);
            Optional<Document> marcXml = transformer.transform(striped);
            if (marcXml.isEmpty()) {
                log.info("No record for " + label);
                return ConversionResult.noRecord(label);
            }
            return ConversionResult.converted(label, marcXml.get());
        } catch (ConversionException e) {
            log.warn("Failed to convert " + label + ": " + e.getMessage());
            return ConversionResult.failed(label, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error converting " + label, e);
            return ConversionResult.failed(label, String.valueOf(e));
        }
    }

    public ConversionMetrics getMetrics() {
        return metrics;
    }

    private List<ConversionResult> convertSequential(List<Description> descriptions) {
        List<ConversionResult> results = new ArrayList<>(descriptions.size());
        for (Description description : descriptions)
            results.add(convert(description));
        return results;
    }

    private List<ConversionResult> convertParallel(List<Description> descriptions) throws InterruptedException {
        BlockingThreadPool<ConversionResult> pool = new BlockingThreadPool<>("bf2marc-convert", threads);
        try {
            for (Description description : descriptions)
                pool.submit(() -> convert(description));
            return pool.awaitAll();
        } catch (InterruptedException e) {
            pool.cancelAll();
            throw e;
        } finally {
            pool.shutdown();
        }
    }
}
