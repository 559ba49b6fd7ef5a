package gpufleet.orchestrator.bus;

import java.time.Duration;

/**
 * Best-effort publish/subscribe on named channels. Delivery is not persisted: a message published
 * while nobody listens, or into a full subscriber queue, is lost.
 */
public interface CommandBus extends AutoCloseable {

    /**
     * @return number of subscribers the message was queued for
     */
    int publish(String channel, String payload);

    Subscription subscribe(String channel);

    @Override
    void close();

    interface Subscription extends AutoCloseable {

        /**
         * Wait up to {@code timeout} for the next message.
         *
         * @return the payload, or null on timeout
         */
        String poll(Duration timeout) throws InterruptedException;

        @Override
        void close();
    }
}
