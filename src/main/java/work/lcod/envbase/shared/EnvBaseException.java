package work.lcod.envbase.shared;

/**
 * Root of the envbase failures. Carries a short machine code next to the human message.
 */
public class EnvBaseException extends RuntimeException {
    private final String code;

    public EnvBaseException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EnvBaseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
