package com.questrail.busline.transport;

import com.questrail.busline.Client;
import com.questrail.busline.Server;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RecordingAdapter
 * -----------------------------------------------------------------------------
 * Test-only {@link Adapter}.
 *
 * <p>Stores outbound payloads and the sockets they were addressed to. Sockets
 * connect synchronously on creation unless {@link #connectOnCreate(boolean)}
 * is switched off. {@link #disconnect(Client)} closes the socket but, like a
 * real asynchronous transport, does not call back into the client.</p>
 */
public final class RecordingAdapter implements Adapter {

    public record Sent(TransportSocket socket, byte[] payload) {}

    public static final class FakeSocket implements TransportSocket {
        private final int number;
        private volatile boolean open = true;

        private FakeSocket(int number) {
            this.number = number;
        }

        public static FakeSocket create(int number) {
            return new FakeSocket(number);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public SocketAddress remoteAddress() {
            return InetSocketAddress.createUnresolved("fake", number);
        }

        public void close() {
            open = false;
        }

        @Override
        public String toString() {
            return "fake#" + number;
        }
    }

    private final List<Sent> sent = new ArrayList<>();
    private final List<FakeSocket> created = new ArrayList<>();
    private final List<Server> listening = new ArrayList<>();
    private boolean connectOnCreate = true;
    private int disconnects;

    public RecordingAdapter connectOnCreate(boolean connect) {
        this.connectOnCreate = connect;
        return this;
    }

    @Override
    public synchronized TransportSocket createSocket(Client client, TransportSocket existing) {
        TransportSocket socket = existing;
        if (socket == null) {
            FakeSocket fresh = new FakeSocket(created.size() + 1);
            created.add(fresh);
            socket = fresh;
        }
        if (connectOnCreate) {
            client.handleConnect(socket);
        }
        return socket;
    }

    @Override
    public synchronized void send(TransportSocket socket, byte[] payload) {
        if (socket == null || !socket.isOpen()) {
            return;
        }
        sent.add(new Sent(socket, payload));
    }

    @Override
    public synchronized void disconnect(Client client) {
        disconnects++;
        if (client.socket() instanceof FakeSocket fake) {
            fake.close();
        }
    }

    @Override
    public synchronized SocketAddress listen(Server server) {
        listening.add(server);
        return InetSocketAddress.createUnresolved("fake", 0);
    }

    @Override
    public synchronized void stop(Server server) {
        listening.remove(server);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized List<Sent> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized List<FakeSocket> created() {
        return Collections.unmodifiableList(new ArrayList<>(created));
    }

    public synchronized boolean isListening(Server server) {
        return listening.contains(server);
    }

    public synchronized int disconnects() {
        return disconnects;
    }

    public synchronized void clear() {
        sent.clear();
    }
}
