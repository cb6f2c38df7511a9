package software.amazon.multihash;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.SynchronousQueue;

import static software.amazon.multihash.MultiHashException.Reason.CONSUMER_PROTOCOL_VIOLATION;

/**
 * The ordered events of one {@link StreamingDigester} run.  The producer hands
 * each event over directly, so it blocks until the consumer takes it; the
 * consumer must keep reading until the terminal event.  {@link #hasNext()}
 * turns false once the terminal event has been returned.
 * <p/>
 * Intended for a single consumer thread; it may be iterated only once.
 */
public final class EventStream implements Iterator<HashEvent>, Iterable<HashEvent> {
    private final BlockingQueue<HashEvent> handoff = new SynchronousQueue<>();
    private boolean ended;
    private boolean iterated;

    /**
     * Blocks until the consumer has taken {@code event}.
     */
    void put(HashEvent event) throws InterruptedException {
        handoff.put(event);
    }

    @Override
    public Iterator<HashEvent> iterator() {
        if (iterated) {
            throw new MultiHashException(CONSUMER_PROTOCOL_VIOLATION, "event stream can be iterated only once");
        }
        iterated = true;
        return this;
    }

    @Override
    public boolean hasNext() {
        return !ended;
    }

    /**
     * Blocks until the next event arrives.
     *
     * @throws NoSuchElementException after the terminal event
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    @Override
    public HashEvent next() {
        if (ended) {
            throw new NoSuchElementException("the run already ended");
        }
        HashEvent event;
        try {
            event = handoff.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for the next event", e);
        }
        if (event.isTerminal()) {
            ended = true;
        }
        return event;
    }

    /**
     * Consumes the remaining events and returns the terminal one.
     */
    public HashEvent awaitTerminal() {
        HashEvent event = null;
        while (hasNext()) {
            event = next();
        }
        if (event == null) {
            throw new MultiHashException(CONSUMER_PROTOCOL_VIOLATION, "terminal event was already consumed");
        }
        return event;
    }
}
