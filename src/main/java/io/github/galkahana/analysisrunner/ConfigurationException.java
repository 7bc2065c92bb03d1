package io.github.galkahana.analysisrunner;

/**
 * Invalid executor or analysis options. Raised at construction time, never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
