package work.lcod.envbase.monitor;

/**
 * Link of the monitor's handler chain. Events may be delivered more than once, so implementations must be
 * idempotent.
 */
@FunctionalInterface
public interface StackEventHandler {
    /**
     * @return {@code true} once this handler's concern is satisfied; it then receives no further events
     */
    boolean handle(StackEvent event);
}
