package work.lcod.envbase.shared;

/**
 * A config or stack event handler was registered without the capability it is expected to provide.
 */
public final class HandlerRegistrationException extends EnvBaseException {
    public HandlerRegistrationException(String message) {
        super("handler_rejected", message);
    }

    public HandlerRegistrationException(String message, Throwable cause) {
        super("handler_rejected", message, cause);
    }
}
