package kr.crownrpg.relay.api.event;

import java.io.Closeable;

/**
 * Subscription handle. {@link #close()} detaches the listener; closing twice is harmless.
 */
public interface EventSubscription extends Closeable {

    /**
     * @return the subscribed type, or {@code "*"} for an all-types subscription
     */
    String eventType();

    @Override
    void close();
}
