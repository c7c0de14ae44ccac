package bf2marc;

import bf2marc.exception.ConfigurationException;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Run settings, read from the bundled bf2marc.properties and optionally overridden by a profile file.
 */
public class ConversionProfile {

    public static final String DEFAULTS_RESOURCE = "bf2marc.properties";

    public static final String DEREFERENCE_TIMEOUT = "dereference.timeout";
    public static final String STDIN_WAIT = "stdin.wait";
    public static final String DESCRIPTION_DEPTH = "description.depth";
    public static final String EXTRACT_QUERY = "extract.query";
    public static final String STYLESHEET = "stylesheet";
    public static final String STYLESHEET_PARAM_PREFIX = "stylesheet.param.";
    public static final String PARALLEL_THREADS = "parallel.threads";

    Properties properties = new Properties();

    public ConversionProfile() throws ConfigurationException {
        try (InputStream in = ConversionProfile.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read " + DEFAULTS_RESOURCE, e);
        }
    }

    public ConversionProfile(Properties overrides) throws ConfigurationException {
        this();
        properties.putAll(overrides);
    }

    public ConversionProfile(File file) throws ConfigurationException {
        this();
        Properties overrides = new Properties();
        try (InputStream in = new FileInputStream(file)) {
            overrides.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read profile " + file, e);
        }
        properties.putAll(overrides);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    public int getInt(String key, int defaultValue) throws ConfigurationException {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            int i = Integer.parseInt(value.trim());
            if (i < 0) {
                throw new ConfigurationException("Negative value for " + key + ": " + value);
            }
            return i;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not a number for " + key + ": " + value, e);
        }
    }

    public int getDereferenceTimeout() throws ConfigurationException {
        return getInt(DEREFERENCE_TIMEOUT, 5000);
    }

    public int getStdinWait() throws ConfigurationException {
        return getInt(STDIN_WAIT, 2000);
    }

    public int getDescriptionDepth() throws ConfigurationException {
        return getInt(DESCRIPTION_DEPTH, 3);
    }

    public int getParallelThreads() throws ConfigurationException {
        int threads = getInt(PARALLEL_THREADS, 0);
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * All stylesheet.param.* entries, keyed by parameter name.
     */
    public Map<String, String> getStylesheetParameters() {
        Map<String, String> params = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(STYLESHEET_PARAM_PREFIX) && key.length() > STYLESHEET_PARAM_PREFIX.length()) {
                params.put(key.substring(STYLESHEET_PARAM_PREFIX.length()), properties.getProperty(key));
            }
        }
        return params;
    }
}
