package kr.crownrpg.relay.api.lifecycle;

/**
 * Standard lifecycle contract to start and stop resources.
 * <p>
 * {@link #stop()} must be idempotent; bootstrap code calls it during partial-start rollback as well.
 */
public interface ManagedLifecycle extends AutoCloseable {

    void start();

    void stop();

    @Override
    default void close() {
        stop();
    }
}
