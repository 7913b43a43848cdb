package mycompany.heightchange.config;

import java.util.Collections;
import java.util.List;

/**
 * A configuration file could not be read or failed validation.
 */
public class ConfigException extends Exception {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = Collections.singletonList(message);
    }

    public ConfigException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = Collections.unmodifiableList(problems);
    }

    public List<String> getProblems() { return problems; }
}
