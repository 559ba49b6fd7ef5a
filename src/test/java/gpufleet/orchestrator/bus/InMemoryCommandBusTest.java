package gpufleet.orchestrator.bus;

import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCommandBusTest {

    private InMemoryCommandBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryCommandBus(2);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void messageWithoutSubscriberIsDropped() {
        assertEquals(0, bus.publish("commands", "a"));
        assertEquals(1, bus.droppedCount());
    }

    @Test
    void everySubscriberGetsACopy() throws InterruptedException {
        CommandBus.Subscription first = bus.subscribe("commands");
        CommandBus.Subscription second = bus.subscribe("commands");

        assertEquals(2, bus.publish("commands", "a"));

        assertEquals("a", first.poll(Duration.ofMillis(100)));
        assertEquals("a", second.poll(Duration.ofMillis(100)));
        assertNull(first.poll(Duration.ofMillis(10)));
    }

    @Test
    void channelsAreIsolated() throws InterruptedException {
        CommandBus.Subscription sub = bus.subscribe("commands");

        assertEquals(0, bus.publish("other", "a"));
        assertNull(sub.poll(Duration.ofMillis(10)));
    }

    @Test
    void fullQueueDropsNewMessages() throws InterruptedException {
        CommandBus.Subscription sub = bus.subscribe("commands");

        bus.publish("commands", "a");
        bus.publish("commands", "b");
        assertEquals(0, bus.publish("commands", "c"));

        assertEquals("a", sub.poll(Duration.ofMillis(100)));
        assertEquals("b", sub.poll(Duration.ofMillis(100)));
        assertNull(sub.poll(Duration.ofMillis(10)));
        assertEquals(1, bus.droppedCount());
    }

    @Test
    void closedSubscriptionStopsReceiving() {
        CommandBus.Subscription sub = bus.subscribe("commands");
        sub.close();

        assertEquals(0, bus.publish("commands", "a"));
    }

    @Test
    void closedBusDropsEverything() {
        bus.subscribe("commands");
        bus.close();

        assertEquals(0, bus.publish("commands", "a"));
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryCommandBus(0));
    }
}
