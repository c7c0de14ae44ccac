package bf2marc.deref;

import bf2marc.exception.DereferenceException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFLanguages;
import org.apache.jena.riot.RDFParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches RDF over HTTP. A lookup that has not finished within the timeout is aborted, however
 * slowly the server keeps sending.
 */
public class HttpDereferencer implements Dereferencer, Closeable {
    private final Logger logger = LogManager.getLogger(this.getClass());

    static final String ACCEPT = "application/rdf+xml, text/turtle;q=0.9, application/n-triples;q=0.8, "
            + "application/ld+json;q=0.7, application/rdf+json;q=0.6, */*;q=0.1";

    private final CloseableHttpClient client;
    private final ScheduledExecutorService deadlines;
    private final int timeoutMillis;

    public HttpDereferencer(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        client = HttpClients.custom()
                .setDefaultRequestConfig(config)
                .setUserAgent("bf2marc")
                .build();
        deadlines = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("bf2marc-deref-deadline")
                .setDaemon(true)
                .build());
    }

    @Override
    public Model fetch(String iri) throws DereferenceException {
        HttpGet get;
        try {
            get = new HttpGet(iri);
        } catch (IllegalArgumentException e) {
            throw new DereferenceException("Not a fetchable IRI: " + iri, e);
        }
        get.setHeader("Accept", ACCEPT);

        AtomicBoolean expired = new AtomicBoolean(false);
        ScheduledFuture<?> deadline = deadlines.schedule(() -> {
            expired.set(true);
            get.abort();
        }, timeoutMillis, TimeUnit.MILLISECONDS);

        try {
            return execute(get, iri);
        } catch (SocketTimeoutException | ConnectTimeoutException e) {
            throw timedOut(iri, e);
        } catch (IOException e) {
            if (expired.get())
                throw timedOut(iri, e);
            throw new DereferenceException("GET " + iri + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (expired.get())
                throw timedOut(iri, e);
            throw new DereferenceException("Could not parse the response for " + iri + ": " + e.getMessage(), e);
        } finally {
            deadline.cancel(false);
        }
    }

    private Model execute(HttpGet get, String iri) throws IOException, DereferenceException {
        try (CloseableHttpResponse response = client.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            if (status < 200 || status > 299)
                throw new DereferenceException("GET " + iri + " returned status " + status);

            HttpEntity entity = response.getEntity();
            if (entity == null)
                throw new DereferenceException("GET " + iri + " returned no body");

            Lang lang = chooseLang(entity.getContentType(), iri);
            logger.debug("Parsing " + iri + " as " + lang.getName());

            Model model = ModelFactory.createDefaultModel();
            try (InputStream in = entity.getContent()) {
                RDFParser.create().source(in).base(iri).forceLang(lang).parse(model.getGraph());
            }
            return model;
        }
    }

    private DereferenceException timedOut(String iri, Exception cause) {
        return new DereferenceException("GET " + iri + " timed out after " + timeoutMillis + " ms", cause);
    }

    /**
     * Response media type first, then the IRI's extension, then RDF/XML.
     */
    static Lang chooseLang(Header contentType, String iri) {
        if (contentType != null && contentType.getValue() != null) {
            String mediaType = contentType.getValue().split(";")[0].trim();
            Lang lang = RDFLanguages.contentTypeToLang(mediaType);
            if (lang != null)
                return lang;
        }
        Lang byName = RDFLanguages.filenameToLang(iri);
        return byName != null ? byName : Lang.RDFXML;
    }

    @Override
    public void close() throws IOException {
        deadlines.shutdownNow();
        client.close();
    }
}
