package bf2marc.export.marc;

import bf2marc.component.RdfFormat;
import bf2marc.component.RdfSource;
import bf2marc.converter.marc.OutputFormat;
import bf2marc.exception.ConfigurationException;

import java.io.File;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

class Parameters
{
    private RdfFormat format = RdfFormat.RDFXML;
    private OutputFormat outputFormat = OutputFormat.MARCXML;
    private Path output;
    private Path config;
    private File profile;
    private String stylesheet;
    private boolean parallel = false;
    private boolean verbose = false;
    private boolean help = false;
    private List<RdfSource> sources = new ArrayList<>();

    RdfFormat getFormat() { return format; }
    OutputFormat getOutputFormat() { return outputFormat; }
    Path getOutput() { return output; }
    Path getConfig() { return config; }
    File getProfile() { return profile; }
    String getStylesheet() { return stylesheet; }
    boolean getRunParallel() { return parallel; }
    boolean getVerbose() { return verbose; }
    boolean getHelp() { return help; }
    List<RdfSource> getSources() { return sources; }

    Parameters(String[] args)
            throws ConfigurationException
    {
        for (String arg : args)
        {
            if (!arg.startsWith("--"))
            {
                sources.add(RdfSource.of(arg));
                continue;
            }

            int separatorIndex = arg.indexOf('=');
            if (separatorIndex > 2)
            {
                String param = arg.substring(0, separatorIndex);
                String value = arg.substring(separatorIndex + 1);
                interpretBinaryParameter(param, value);
            }
            else
            {
                interpretUnaryParameter(arg);
            }
        }
    }

    static void printUsage(PrintStream out)
    {
        out.println("Usage: java -jar bf2marc.jar [PARAMETERS] [SOURCE...]");
        out.println("");
        out.println("Converts BIBFRAME descriptions to MARC 21 records.");
        out.println("");
        out.println("Every SOURCE is a file path or a URL (http, https, ftp or file). All sources are read into");
        out.println("one graph before any conversion starts. Without sources the input is read from stdin, which");
        out.println("must start delivering data within stdin.wait milliseconds.");
        out.println("");
        out.println("Parameters:");
        out.println("");
        out.println("--format     The serialization of the input: rdfxml (default), ntriples, turtle, rdfjson,");
        out.println("             nquads or jsonld. For URLs the server's content type is tried first.");
        out.println("");
        out.println("--outformat  marcxml (default) or iso2709.");
        out.println("");
        out.println("--output     File to write the records to. Defaults to stdout.");
        out.println("");
        out.println("--config     A JSON file telling which external resources to fetch, as in");
        out.println("             {\"dereference\": {\"<class IRI>\": [\"<IRI prefix>\", ...]}}");
        out.println("");
        out.println("--profile    A properties file overriding the bundled bf2marc.properties.");
        out.println("");
        out.println("--stylesheet The XSLT stylesheet with the mapping rules. Overrides the profile.");
        out.println("");
        out.println("--parallel   Convert descriptions on parallel.threads threads. Output order is unchanged.");
        out.println("");
        out.println("--verbose    Log progress and a summary to stderr.");
        out.println("");
        out.println("--help       Print this text.");
        out.println("");
        out.println("Exit status is 0 on success, 1 on bad configuration or input, and 2 if no description could");
        out.println("be converted and at least one failed.");
    }

    private void interpretBinaryParameter(String parameter, String value)
            throws ConfigurationException
    {
        if (value.isEmpty())
            throw new ConfigurationException("No value given for " + parameter);

        switch (parameter)
        {
            case "--format":
                format = RdfFormat.forName(value);
                break;

            case "--outformat":
                outputFormat = OutputFormat.forName(value);
                break;

            case "--output":
                output = Paths.get(value);
                break;

            case "--config":
                config = Paths.get(value);
                break;

            case "--profile":
                profile = new File(value);
                break;

            case "--stylesheet":
                stylesheet = value;
                break;

            default:
                throw new ConfigurationException("Unknown parameter: " + parameter);
        }
    }

    private void interpretUnaryParameter(String parameter)
            throws ConfigurationException
    {
        switch (parameter)
        {
            case "--parallel":
                parallel = true;
                break;
            case "--verbose":
                verbose = true;
                break;
            case "--help":
                help = true;
                break;
            default:
                throw new ConfigurationException("Unknown parameter: " + parameter);
        }
    }
}
