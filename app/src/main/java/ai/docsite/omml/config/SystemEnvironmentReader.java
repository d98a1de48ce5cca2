package ai.docsite.omml.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads environment variables from the host system. A variable that is not set falls back to the JVM
 * system property of the same name in lower case with dots, so {@code OMML_MODE} may also be given as
 * {@code -Domml.mode=display}.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key))
                .or(() -> Optional.ofNullable(System.getProperty(propertyName(key))));
    }

    static String propertyName(String key) {
        return key.toLowerCase(Locale.ROOT).replace('_', '.');
    }
}
