package bf2marc.export.marc;

import bf2marc.Bf2MarcConverter;
import bf2marc.ConversionProfile;
import bf2marc.component.GraphStore;
import bf2marc.component.RdfSource;
import bf2marc.converter.marc.MarcCollection;
import bf2marc.deref.DereferenceConfig;
import bf2marc.deref.HttpDereferencer;
import bf2marc.exception.Bf2MarcException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;

public class Main
{
    private final static Logger log = LogManager.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_NOTHING_CONVERTED = 2;

    public static void main(String[] args)
    {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr)
    {
        Parameters parameters;
        try
        {
            parameters = new Parameters(args);
        } catch (Bf2MarcException e)
        {
            stderr.println("error: " + e.getMessage());
            Parameters.printUsage(stderr);
            return EXIT_FATAL;
        }

        if (parameters.getHelp())
        {
            Parameters.printUsage(stderr);
            return EXIT_OK;
        }

        if (parameters.getVerbose())
            Configurator.setLevel("bf2marc", Level.INFO);

        try
        {
            ConversionProfile profile = parameters.getProfile() != null
                    ? new ConversionProfile(parameters.getProfile())
                    : new ConversionProfile();
            if (parameters.getStylesheet() != null)
                profile.setProperty(ConversionProfile.STYLESHEET, parameters.getStylesheet());

            DereferenceConfig config = parameters.getConfig() != null
                    ? DereferenceConfig.fromFile(parameters.getConfig())
                    : DereferenceConfig.empty();

            GraphStore store = new GraphStore();
            if (parameters.getSources().isEmpty())
            {
                store.loadStdin(stdin, parameters.getFormat(), profile.getStdinWait());
            }
            else
            {
                for (RdfSource source : parameters.getSources())
                {
                    log.info("Reading " + source);
                    store.load(source, parameters.getFormat());
                }
            }
            store.seal();
            log.info("Graph store holds " + store.size() + " triples");

            MarcCollection collection;
            try (HttpDereferencer dereferencer = new HttpDereferencer(profile.getDereferenceTimeout()))
            {
                Bf2MarcConverter converter = Bf2MarcConverter.fromProfile(profile, config, dereferencer,
                        parameters.getRunParallel());
                collection = converter.convert(store);
            }

            write(collection, parameters, stdout);
            return collection.isTotalFailure() ? EXIT_NOTHING_CONVERTED : EXIT_OK;
        } catch (Bf2MarcException e)
        {
            log.error(e.getMessage(), e.getCause());
            return EXIT_FATAL;
        } catch (IOException e)
        {
            log.error("Could not write output: " + e.getMessage(), e);
            return EXIT_FATAL;
        } catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.error("Interrupted before the conversion was done");
            return EXIT_FATAL;
        }
    }

    private static void write(MarcCollection collection, Parameters parameters, OutputStream stdout)
            throws IOException
    {
        if (parameters.getOutput() == null)
        {
            collection.serialize(stdout, parameters.getOutputFormat());
            return;
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        collection.serialize(buffer, parameters.getOutputFormat());
        Files.write(parameters.getOutput(), buffer.toByteArray());
        log.info("Wrote " + collection.getRecords().size() + " records to " + parameters.getOutput());
    }
}
