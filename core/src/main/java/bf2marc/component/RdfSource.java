package bf2marc.component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * A named input: a local file or a URL.
 */
public class RdfSource {
    private static final Pattern URL_PATTERN = Pattern.compile("^(?i)(https?|ftp|file):.*");

    private final String location;
    private final boolean url;

    private RdfSource(String location, boolean url) {
        this.location = location;
        this.url = url;
    }

    public static RdfSource of(String location) {
        return new RdfSource(location, URL_PATTERN.matcher(location).matches());
    }

    public boolean isUrl() {
        return url;
    }

    public String getLocation() {
        return location;
    }

    public Path getPath() {
        return Paths.get(location);
    }

    @Override
    public String toString() {
        return location;
    }
}
