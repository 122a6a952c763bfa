package work.lcod.envbase.config;

import work.lcod.envbase.shared.EnvBaseException;

public final class ConfigLoadException extends EnvBaseException {
    public ConfigLoadException(String message) {
        super("config_load_failed", message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super("config_load_failed", message, cause);
    }
}
