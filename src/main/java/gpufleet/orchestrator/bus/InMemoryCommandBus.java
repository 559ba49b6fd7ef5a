package gpufleet.orchestrator.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link CommandBus}. Each subscriber owns a bounded queue; when it is full new messages
 * are dropped for that subscriber.
 */
public class InMemoryCommandBus implements CommandBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCommandBus.class);

    private final Map<String, List<QueueSubscription>> channels = new ConcurrentHashMap<>();
    private final int queueCapacity;
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean closed = false;

    public InMemoryCommandBus(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive, but was: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    @Override
    public int publish(String channel, String payload) {
        if (closed) {
            log.warn("Bus closed, dropping message on {}", channel);
            dropped.incrementAndGet();
            return 0;
        }

        List<QueueSubscription> subscribers = channels.get(channel);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("No subscribers on {}, message dropped", channel);
            dropped.incrementAndGet();
            return 0;
        }

        int delivered = 0;
        for (QueueSubscription sub : subscribers) {
            if (sub.queue.offer(payload)) {
                delivered++;
            } else {
                dropped.incrementAndGet();
                log.warn("Subscriber queue full on {}, message dropped", channel);
            }
        }
        return delivered;
    }

    @Override
    public Subscription subscribe(String channel) {
        QueueSubscription sub = new QueueSubscription(channel, new ArrayBlockingQueue<>(queueCapacity));
        channels.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(sub);
        log.debug("New subscriber on {}", channel);
        return sub;
    }

    /**
     * Messages lost to missing subscribers or full queues since startup.
     */
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        closed = true;
        channels.clear();
    }

    private final class QueueSubscription implements Subscription {
        private final String channel;
        private final BlockingQueue<String> queue;

        private QueueSubscription(String channel, BlockingQueue<String> queue) {
            this.channel = channel;
            this.queue = queue;
        }

        @Override
        public String poll(Duration timeout) throws InterruptedException {
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void close() {
            List<QueueSubscription> subscribers = channels.get(channel);
            if (subscribers != null) {
                subscribers.remove(this);
            }
        }
    }
}
