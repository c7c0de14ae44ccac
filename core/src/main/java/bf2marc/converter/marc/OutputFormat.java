package bf2marc.converter.marc;

import bf2marc.exception.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum OutputFormat {
    MARCXML("marcxml"),
    ISO2709("iso2709");

    private final String name;

    OutputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static OutputFormat forName(String name) throws ConfigurationException {
        for (OutputFormat format : values()) {
            if (format.name.equalsIgnoreCase(name.trim()))
                return format;
        }
        throw new ConfigurationException("Unknown output format: " + name + ", expected one of "
                + Arrays.stream(values()).map(OutputFormat::getName).collect(Collectors.joining(", ")));
    }
}
