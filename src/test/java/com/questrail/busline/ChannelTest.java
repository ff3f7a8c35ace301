package com.questrail.busline;

import com.questrail.busline.api.PacketHandler;
import com.questrail.busline.config.BundlerOptions;
import com.questrail.busline.internal.time.Cancellable;
import com.questrail.busline.time.DeterministicScheduler;
import com.questrail.busline.time.ManualMonotonicClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelTest
 * -----------------------------------------------------------------------------
 * Queue, bundler and dispatch behavior of a single channel, driven by a
 * deterministic scheduler and a recording owner.
 */
class ChannelTest {

    private static final Duration EVERY = Duration.ofMillis(50);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingOwner owner;
    private Channel channel;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        owner = new RecordingOwner();
        channel = new Channel("scores", BundlerOptions.every(EVERY), owner);
    }

    @Test
    void sendsWithinOneIntervalFlushAsOneOrderedBatch() {
        channel.send("p1");
        channel.send("p2");

        assertTrue(owner.batches.isEmpty(), "Nothing is transmitted before the interval elapses");
        assertTrue(channel.isBundlerArmed());

        scheduler.advanceMillis(50);

        assertEquals(List.of(List.of("p1", "p2")), owner.batches);
        assertEquals(0, channel.pendingCount());
        assertFalse(channel.isBundlerArmed(), "Bundler goes idle after a flush");
    }

    @Test
    void flushDoesNotFireBeforeTheInterval() {
        channel.send("p1");
        scheduler.advanceMillis(49);

        assertTrue(owner.batches.isEmpty());
        assertEquals(1, channel.pendingCount());
    }

    @Test
    void sendAfterFlushRearmsForTheNextInterval() {
        channel.send("p1");
        scheduler.advanceMillis(50);
        channel.send("p2");
        channel.send("p3");
        scheduler.advanceMillis(50);

        assertEquals(List.of(List.of("p1"), List.of("p2", "p3")), owner.batches);
    }

    @Test
    void sendOnceKeepsOnlyTheLatestValue() {
        channel.send("stale");
        channel.sendOnce("p1");
        assertEquals(1, channel.pendingCount());

        channel.sendOnce("p2");
        assertEquals(List.of("p2"), channel.pending());

        scheduler.advanceMillis(50);

        assertEquals(List.of(List.of("p2")), owner.batches);
    }

    @Test
    void sendNowBypassesTheQueue() {
        channel.send("queued");

        channel.sendNow("urgent");

        assertEquals(List.of(List.of("urgent")), owner.batches);
        assertEquals(List.of("queued"), channel.pending(), "sendNow must not consume the pending queue");

        scheduler.advanceMillis(50);
        assertEquals(List.of(List.of("urgent"), List.of("queued")), owner.batches);
    }

    @Test
    void sendNowOnIdleChannelDoesNotArmTheBundler() {
        channel.sendNow("urgent");

        assertFalse(channel.isBundlerArmed());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void resetBundlerCancelsWithoutFlushingAndKeepsTheQueue() {
        channel.send("p1");
        channel.send("p2");

        channel.resetBundler();
        scheduler.advanceMillis(100);

        assertTrue(owner.batches.isEmpty());
        assertEquals(List.of("p1", "p2"), channel.pending());
        assertFalse(channel.isBundlerArmed());

        channel.startBundler();
        scheduler.advanceMillis(50);

        assertEquals(List.of(List.of("p1", "p2")), owner.batches);
    }

    @Test
    void expiryWhileOwnerCannotTransmitKeepsTheQueue() {
        owner.connected = false;
        channel.send("p1");
        channel.send("p2");

        scheduler.advanceMillis(50);

        assertTrue(owner.batches.isEmpty());
        assertEquals(2, channel.pendingCount());
        assertFalse(channel.isBundlerArmed());

        owner.connected = true;
        channel.startBundler();
        scheduler.advanceMillis(50);
        scheduler.advanceMillis(50);

        assertEquals(List.of(List.of("p1", "p2")), owner.batches, "Held packets are flushed exactly once");
    }

    @Test
    void reachingMaxPacketsFlushesImmediately() {
        channel = new Channel("bulk", new BundlerOptions(EVERY, 3), owner);

        channel.send(1);
        channel.send(2);
        assertTrue(owner.batches.isEmpty());

        channel.send(3);

        assertEquals(List.of(List.of(1, 2, 3)), owner.batches);
        assertFalse(channel.isBundlerArmed());

        // The cancelled timer must not produce an empty or duplicate flush.
        scheduler.advanceMillis(100);
        assertEquals(1, owner.batches.size());
    }

    @Test
    void maxPacketsDoesNotFlushWhileOwnerCannotTransmit() {
        channel = new Channel("bulk", new BundlerOptions(EVERY, 2), owner);
        owner.connected = false;

        channel.send(1);
        channel.send(2);
        channel.send(3);

        assertTrue(owner.batches.isEmpty());
        assertEquals(3, channel.pendingCount());
    }

    @Test
    void handleDataDeliversEveryPacketToEveryHandlerInOrder() {
        List<Object> first = new ArrayList<>();
        List<Object> second = new ArrayList<>();
        channel.addHandler(first::add);
        channel.addHandler(second::add);

        channel.handleData(List.of("a", "b", "c"));

        assertEquals(List.of("a", "b", "c"), first);
        assertEquals(List.of("a", "b", "c"), second);
    }

    @Test
    void failingHandlerDoesNotStopDelivery() {
        List<Object> received = new ArrayList<>();
        PacketHandler failing = packet -> {
            throw new IllegalStateException("boom on " + packet);
        };
        channel.addHandler(failing);
        channel.addHandler(received::add);

        channel.handleData(List.of("a", "b"));

        assertEquals(List.of("a", "b"), received);
        assertEquals(2, owner.handlerFailures.size());
        assertEquals("boom on a", owner.handlerFailures.get(0).getMessage());
    }

    @Test
    void handleDataWithoutHandlersIsANoOp() {
        assertDoesNotThrow(() -> channel.handleData(List.of("a")));
        assertTrue(owner.handlerFailures.isEmpty());
    }

    @Test
    void removedHandlerNoLongerReceives() {
        List<Object> received = new ArrayList<>();
        PacketHandler handler = received::add;
        channel.addHandler(handler);
        channel.removeHandler(handler);
        channel.removeHandler(null);

        channel.handleData(List.of("a"));

        assertTrue(received.isEmpty());
        assertTrue(channel.handlers().isEmpty());
    }

    @Test
    void handlerChangesDuringDispatchTakeEffectFromTheNextPacket() {
        List<String> calls = new ArrayList<>();
        PacketHandler late = packet -> calls.add("late:" + packet);
        PacketHandler steady = packet -> calls.add("steady:" + packet);
        PacketHandler once = new PacketHandler() {
            @Override
            public void handle(Object packet) {
                calls.add("once:" + packet);
                channel.removeHandler(this);
                channel.addHandler(late);
            }
        };
        channel.addHandler(once);
        channel.addHandler(steady);

        channel.handleData(List.of("a", "b"));

        // The packet being dispatched keeps its handler set; the next one sees the change.
        assertEquals(List.of("once:a", "steady:a", "steady:b", "late:b"), calls);

        calls.clear();
        channel.handleData(List.of("c"));

        assertEquals(List.of("steady:c", "late:c"), calls);
        assertEquals(2, channel.handlers().size());
    }

    @Test
    void nullPacketsAreQueuedAndDelivered() {
        channel.send(null);
        scheduler.advanceMillis(50);

        assertEquals(1, owner.batches.size());
        assertEquals(1, owner.batches.get(0).size());
        assertNull(owner.batches.get(0).get(0));
    }

    private final class RecordingOwner implements Channel.Owner {
        private boolean connected = true;
        private final List<List<Object>> batches = new ArrayList<>();
        private final List<RuntimeException> handlerFailures = new ArrayList<>();

        @Override
        public Cancellable armBundler(Duration every, Runnable flush) {
            return scheduler.scheduleAfter(every, clock, flush);
        }

        @Override
        public boolean canTransmit() {
            return connected;
        }

        @Override
        public void transmit(String channel, List<Object> packets) {
            batches.add(new ArrayList<>(packets));
        }

        @Override
        public void reportHandlerFailure(String channel, PacketHandler handler, RuntimeException failure) {
            handlerFailures.add(failure);
        }
    }
}
