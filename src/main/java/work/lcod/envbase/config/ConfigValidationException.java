package work.lcod.envbase.config;

import work.lcod.envbase.shared.EnvBaseException;

/**
 * Raised on the first schema violation found in a configuration tree.
 */
public final class ConfigValidationException extends EnvBaseException {
    private final String path;
    private final String reason;

    public ConfigValidationException(String path, String reason) {
        super("config_invalid", reason + ": " + path);
        this.path = path;
        this.reason = reason;
    }

    /** Dotted location of the offending section or key. */
    public String path() {
        return path;
    }

    public String reason() {
        return reason;
    }
}
