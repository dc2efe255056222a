package kr.crownrpg.relay.core.connection;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport that records what it was asked to write.
 */
public final class RecordingTransport implements ConnectionTransport {

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private final AtomicInteger terminations = new AtomicInteger();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private volatile boolean failWrites;
    private volatile boolean failTerminate;

    @Override
    public void send(String text) {
        if (!open.get()) {
            throw new TransportException("closed");
        }
        if (failWrites) {
            throw new TransportException("write failed");
        }
        sent.add(text);
    }

    @Override
    public void ping() {
        if (!open.get()) {
            throw new TransportException("closed");
        }
        pings.incrementAndGet();
    }

    @Override
    public void terminate() {
        terminations.incrementAndGet();
        open.set(false);
        if (failTerminate) {
            throw new IllegalStateException("socket already broken");
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public String remoteAddress() {
        return "127.0.0.1:50000";
    }

    public List<String> sent() {
        return sent;
    }

    public int pings() {
        return pings.get();
    }

    public int terminations() {
        return terminations.get();
    }

    public RecordingTransport failWrites() {
        this.failWrites = true;
        return this;
    }

    public RecordingTransport failTerminate() {
        this.failTerminate = true;
        return this;
    }

    public RecordingTransport closed() {
        open.set(false);
        return this;
    }
}
