package work.lcod.envbase.api;

import java.lang.reflect.InvocationTargetException;
import work.lcod.envbase.shared.HandlerRegistrationException;

/**
 * Instantiates handler classes named on the command line through their public no-argument constructor.
 * Whether the instance is an acceptable handler is decided at registration.
 */
public final class HandlerLoader {
    private HandlerLoader() {}

    public static Object instantiate(String className) {
        try {
            Class<?> type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
            return type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException ex) {
            throw new HandlerRegistrationException("Handler class " + className + " not found", ex);
        } catch (NoSuchMethodException ex) {
            throw new HandlerRegistrationException("Handler class " + className + " needs a public no-argument constructor", ex);
        } catch (InvocationTargetException ex) {
            throw new HandlerRegistrationException("Handler class " + className + " failed to initialize: "
                + ex.getCause(), ex.getCause());
        } catch (ReflectiveOperationException ex) {
            throw new HandlerRegistrationException("Cannot instantiate handler class " + className, ex);
        }
    }
}
