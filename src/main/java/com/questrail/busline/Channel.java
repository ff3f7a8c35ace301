package com.questrail.busline;

import com.questrail.busline.api.PacketHandler;
import com.questrail.busline.config.BundlerOptions;
import com.questrail.busline.internal.time.Cancellable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Channel
 * -----------------------------------------------------------------------------
 * Named, ordered packet queue with its own bundler and subscriber fan-out.
 *
 * <h2>Bundler</h2>
 * <p>The first {@link #send(Object)} on an idle channel arms the bundler. When
 * it expires, the whole queue is handed to the owner as one batch and the
 * bundler goes idle again; the next send re-arms it. Reaching
 * {@link BundlerOptions#maxPackets()} flushes at once.</p>
 *
 * <p>An expiry while the owner cannot transmit leaves the queue untouched and
 * the bundler idle, so that {@link #startBundler()} after a reconnect delivers
 * the queued packets exactly once.</p>
 *
 * <h2>Threading model</h2>
 * <p>Queue and bundler state are guarded by a per-channel lock; no lock is
 * shared between channels. A flush snapshots and clears the queue under the
 * lock and transmits outside it. The handler set is copy-on-write, so handlers
 * may be added or removed during a dispatch without disturbing it.</p>
 */
public final class Channel
{
    private static final Logger log = LoggerFactory.getLogger(Channel.class);

    /**
     * Services a channel needs from its client.
     */
    interface Owner
    {
        Cancellable armBundler(Duration every, Runnable flush);

        boolean canTransmit();

        void transmit(String channel, List<Object> packets);

        void reportHandlerFailure(String channel, PacketHandler handler, RuntimeException failure);
    }

    private final String name;
    private final BundlerOptions options;
    private final Owner owner;

    private final Object lock = new Object();
    private final List<Object> packets = new ArrayList<>();
    private final Set<PacketHandler> handlers = new CopyOnWriteArraySet<>();

    // Null while idle.
    private Cancellable bundler;
    private long armGeneration;

    Channel(String name, BundlerOptions options, Owner owner)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String name()
    {
        return name;
    }

    public BundlerOptions options()
    {
        return options;
    }

    public void addHandler(PacketHandler handler)
    {
        handlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public void removeHandler(PacketHandler handler)
    {
        if (handler != null) {
            handlers.remove(handler);
        }
    }

    public Set<PacketHandler> handlers()
    {
        return Collections.unmodifiableSet(handlers);
    }

    /**
     * Appends {@code payload} to the tail of the queue.
     */
    public void send(Object payload)
    {
        final List<Object> batch;
        synchronized (lock) {
            packets.add(payload);
            if (packets.size() < options.maxPackets() || !owner.canTransmit()) {
                armIfIdle();
                return;
            }
            cancelBundler();
            batch = drain();
        }
        owner.transmit(name, batch);
    }

    /**
     * Replaces every queued packet with {@code payload}; only the latest value
     * survives until the next flush.
     */
    public void sendOnce(Object payload)
    {
        synchronized (lock) {
            packets.clear();
            packets.add(payload);
            armIfIdle();
        }
    }

    /**
     * Transmits {@code payload} as its own single-packet batch, bypassing the
     * queue and the bundler.
     */
    public void sendNow(Object payload)
    {
        owner.transmit(name, Collections.singletonList(payload));
    }

    /**
     * Arms the bundler if it is idle.
     */
    public void startBundler()
    {
        synchronized (lock) {
            armIfIdle();
        }
    }

    /**
     * Cancels the armed bundler without flushing. Queued packets are kept.
     */
    public void resetBundler()
    {
        synchronized (lock) {
            cancelBundler();
        }
    }

    public boolean isBundlerArmed()
    {
        synchronized (lock) {
            return bundler != null;
        }
    }

    public int pendingCount()
    {
        synchronized (lock) {
            return packets.size();
        }
    }

    public List<Object> pending()
    {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(packets));
        }
    }

    /**
     * Delivers every packet, in order, to every registered handler.
     */
    public void handleData(List<?> batch)
    {
        Objects.requireNonNull(batch, "batch");

        for (Object packet : batch) {
            for (PacketHandler handler : handlers) {
                try {
                    handler.handle(packet);
                } catch (RuntimeException e) {
                    owner.reportHandlerFailure(name, handler, e);
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Bundler internals (caller holds lock)
    // -------------------------------------------------------------------------

    private void armIfIdle()
    {
        if (bundler != null) {
            return;
        }
        final long generation = ++armGeneration;
        bundler = owner.armBundler(options.every(), () -> onBundlerExpired(generation));
    }

    private void cancelBundler()
    {
        if (bundler != null) {
            bundler.cancel();
            bundler = null;
        }
        // Invalidates an expiry that is already running but has not taken the lock.
        armGeneration++;
    }

    private List<Object> drain()
    {
        List<Object> batch = new ArrayList<>(packets);
        packets.clear();
        return batch;
    }

    private void onBundlerExpired(long generation)
    {
        final List<Object> batch;
        synchronized (lock) {
            if (generation != armGeneration || bundler == null) {
                return;
            }
            bundler = null;

            if (packets.isEmpty()) {
                return;
            }
            if (!owner.canTransmit()) {
                log.debug("Channel '{}' holding {} packets until reconnect", name, packets.size());
                return;
            }
            batch = drain();
        }
        owner.transmit(name, batch);
    }
}
