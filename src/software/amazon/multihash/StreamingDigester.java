package software.amazon.multihash;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import static software.amazon.multihash.MultiHashException.Reason.CONSUMER_PROTOCOL_VIOLATION;
import static software.amazon.multihash.MultiHashException.Reason.SOURCE_READ_ERROR;

/**
 * Reads a source in chunks on a worker thread, feeds every chunk to an
 * {@link AccumulatorSet} and reports the outcome as {@link HashEvent}s.
 * <p/>
 * Each run ends with exactly one terminal event:
 * <ul>
 *   <li>{@link HashEvent.Ok} at end of stream, with the checksums</li>
 *   <li>{@link HashEvent.Stop} when the {@link CancellationToken} is observed,
 *       with the exported states</li>
 *   <li>{@link HashEvent.Error} when reading fails or the states cannot be exported</li>
 * </ul>
 * Cancellation is polled once per chunk, so a chunk that was read is always
 * hashed and counted before a Stop is emitted.  The set is sealed on every
 * terminal outcome.
 * <p/>
 * Create instances with {@link StreamingDigesterBuilder}.  A digester runs once.
 */
public final class StreamingDigester {
    private static final Logger log = LoggerFactory.getLogger(StreamingDigester.class);

    private final InputStream source;
    private final AccumulatorSet accumulators;
    private final long offset;
    private final int bufferSize;
    private final Duration progressInterval;
    private final long total;
    private final CancellationToken token;
    private final boolean closeSource;
    private final Executor executor;
    private final AtomicBoolean started = new AtomicBoolean();

    StreamingDigester(InputStream source,
                      AccumulatorSet accumulators,
                      long offset,
                      int bufferSize,
                      Duration progressInterval,
                      long total,
                      CancellationToken token,
                      boolean closeSource,
                      Executor executor) {
        if (accumulators.isSealed()) {
            throw new MultiHashException(CONSUMER_PROTOCOL_VIOLATION,
                    "the accumulator set was sealed by an earlier run");
        }
        this.source = source;
        this.accumulators = accumulators;
        this.offset = offset;
        this.bufferSize = bufferSize;
        this.progressInterval = progressInterval;
        this.total = total;
        this.token = token;
        this.closeSource = closeSource;
        this.executor = executor;
    }

    public AccumulatorSet accumulators() {
        return accumulators;
    }

    int bufferSize() {
        return bufferSize;
    }

    /**
     * Returns the number of bytes hashed so far, including the offset of a
     * resumed session.
     */
    public long computed() {
        return offset + accumulators.bytesWritten();
    }

    /**
     * Starts the run and returns its events.  The caller must consume the
     * returned stream up to the terminal event.
     *
     * @throws MultiHashException with reason CONSUMER_PROTOCOL_VIOLATION if already started
     */
    public EventStream start() {
        if (!started.compareAndSet(false, true)) {
            throw new MultiHashException(CONSUMER_PROTOCOL_VIOLATION, "digester was already started");
        }
        EventStream events = new EventStream();
        Runnable task = () -> run(events);
        if (executor != null) {
            executor.execute(task);
        } else {
            Thread thread = new Thread(task, "multihash-digester");
            thread.setDaemon(true);
            thread.start();
        }
        return events;
    }

    /**
     * Runs to completion and returns the checksums.
     *
     * @throws MultiHashException carried by the Error event
     * @throws CancellationException if the run was stopped
     */
    public Map<String, byte[]> compute() {
        HashEvent terminal = start().awaitTerminal();
        if (terminal instanceof HashEvent.Ok) {
            return ((HashEvent.Ok) terminal).checksums();
        }
        if (terminal instanceof HashEvent.Stop) {
            HashEvent.Stop stop = (HashEvent.Stop) terminal;
            throw new CancellationException("stopped (" + stop.cause() + ") after " + stop.computed() + " bytes");
        }
        throw ((HashEvent.Error) terminal).error();
    }

    private void run(EventStream events) {
        log.debug("Computing {} from offset {}", accumulators.algorithms(), offset);
        try {
            HashEvent terminal = loop(events);
            accumulators.seal();
            log.debug("Finished after {} bytes: {}", computed(), terminal);
            events.put(terminal);
        } catch (InterruptedException e) {
            // nobody is left to receive the terminal event
            Thread.currentThread().interrupt();
            accumulators.seal();
            log.warn("Interrupted while delivering events after {} bytes", computed());
        } finally {
            if (closeSource) {
                try {
                    source.close();
                } catch (IOException e) {
                    log.warn("Unable to close source", e);
                }
            }
        }
    }

    private HashEvent loop(EventStream events) throws InterruptedException {
        byte[] buffer = new byte[bufferSize];
        long lastReport = System.nanoTime();

        try {
            while (true) {
                CancellationToken.Cause cause = token.cause();
                if (cause != null) {
                    try {
                        return new HashEvent.Stop(computed(), accumulators.exportState(), cause);
                    } catch (MultiHashException e) {
                        return new HashEvent.Error(e);
                    }
                }

                int n;
                try {
                    n = source.read(buffer, 0, buffer.length);
                } catch (IOException e) {
                    log.warn("Read failed after {} bytes", computed(), e);
                    return new HashEvent.Error(new MultiHashException(SOURCE_READ_ERROR,
                            "read failed after " + computed() + " bytes", e));
                }
                if (n < 0) {
                    return new HashEvent.Ok(computed(), accumulators.digests());
                }
                if (n == 0) {
                    // only end of stream may produce an empty read
                    return new HashEvent.Error(new MultiHashException(SOURCE_READ_ERROR,
                            "source returned no bytes without reaching end of stream"));
                }

                accumulators.write(buffer, 0, n);

                if (progressInterval != null) {
                    long now = System.nanoTime();
                    if (now - lastReport >= progressInterval.toNanos()) {
                        lastReport = now;
                        events.put(new HashEvent.Progress(total, computed()));
                    }
                }
            }
        } catch (MultiHashException e) {
            return new HashEvent.Error(e);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure after {} bytes", computed(), e);
            return new HashEvent.Error(new MultiHashException(SOURCE_READ_ERROR, e));
        }
    }
}
