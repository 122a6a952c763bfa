package work.lcod.envbase.template;

import work.lcod.envbase.shared.EnvBaseException;

public final class BindingResolutionException extends EnvBaseException {
    public BindingResolutionException(String message) {
        super("binding_unresolved", message);
    }
}
