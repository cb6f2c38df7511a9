package software.amazon.multihash;

import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.Executor;

import static software.amazon.multihash.MultiHashException.Reason.ALGORITHM_SET_MISMATCH;

/**
 * Build a new {@link StreamingDigester} for a source and either a set of
 * algorithms, a {@link SavedSession} or an existing {@link AccumulatorSet}.
 * <p/>
 * Instances of this class are not thread-safe.
 */
public class StreamingDigesterBuilder {
    public static final int MIN_BUFFER_SIZE = 512;
    public static final int MAX_BUFFER_SIZE = 16 * 1024 * 1024;
    public static final int DEFAULT_BUFFER_SIZE = 32 * 1024;
    public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofMillis(500);

    private InputStream source;
    private Collection<String> algorithms;
    private SavedSession session;
    private AccumulatorSet accumulators;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private Duration progressInterval;
    private long total = -1;
    private CancellationToken token;
    private boolean closeSource;
    private Executor executor;

    /**
     * The standard builder of {@link StreamingDigester}s.
     */
    public static StreamingDigesterBuilder standard() {
        return new StreamingDigesterBuilder();
    }

    // no public constructor
    private StreamingDigesterBuilder() {
    }

    /**
     * Specifies the stream to read.  When resuming, it must be positioned at
     * the saved session's {@link SavedSession#computed()} offset.
     */
    public StreamingDigesterBuilder withSource(InputStream source) {
        this.source = source;
        return this;
    }

    /**
     * Specifies the algorithms to compute.  Defaults to every supported
     * algorithm when neither algorithms nor a session are given.
     */
    public StreamingDigesterBuilder withAlgorithms(String... algorithms) {
        return withAlgorithms(algorithms == null ? null : Arrays.asList(algorithms));
    }

    public StreamingDigesterBuilder withAlgorithms(Collection<String> algorithms) {
        this.algorithms = algorithms;
        return this;
    }

    /**
     * Resumes the computation captured by {@code session}.  If algorithms are
     * also given they must match the session's algorithms.
     */
    public StreamingDigesterBuilder withSavedSession(SavedSession session) {
        this.session = session;
        return this;
    }

    /**
     * Uses an existing set, whose {@link AccumulatorSet#bytesWritten()} becomes
     * the starting count.  Exclusive with algorithms and sessions.
     */
    public StreamingDigesterBuilder withAccumulatorSet(AccumulatorSet accumulators) {
        this.accumulators = accumulators;
        return this;
    }

    /**
     * Specifies the read buffer size; values outside
     * [{@value #MIN_BUFFER_SIZE}, {@value #MAX_BUFFER_SIZE}] are clamped.
     */
    public StreamingDigesterBuilder withBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
        return this;
    }

    /**
     * Specifies the minimum gap between progress events; null or a
     * non-positive duration disables them.
     */
    public StreamingDigesterBuilder withProgressInterval(Duration progressInterval) {
        this.progressInterval = progressInterval;
        return this;
    }

    /**
     * Specifies the advisory size of the whole stream, used only for the
     * progress percentage.  Non-positive means unknown.
     */
    public StreamingDigesterBuilder withTotal(long total) {
        this.total = total;
        return this;
    }

    public StreamingDigesterBuilder withCancellationToken(CancellationToken token) {
        this.token = token;
        return this;
    }

    /**
     * Whether the run closes the source when it ends.  Defaults to false.
     */
    public StreamingDigesterBuilder withCloseSource(boolean closeSource) {
        this.closeSource = closeSource;
        return this;
    }

    /**
     * Specifies where the run loop executes.  Defaults to a new daemon thread per run.
     */
    public StreamingDigesterBuilder withExecutor(Executor executor) {
        this.executor = executor;
        return this;
    }

    static int clampBufferSize(int bufferSize) {
        return Math.max(MIN_BUFFER_SIZE, Math.min(MAX_BUFFER_SIZE, bufferSize));
    }

    /**
     * Validates the configuration and constructs a new StreamingDigester.
     * Configuration errors are thrown here, never reported as events.
     *
     * @return a new StreamingDigester object
     */
    public StreamingDigester build() {
        if (source == null) {
            throw new NullPointerException("Source must not be null");
        }

        long offset;
        AccumulatorSet set;
        if (accumulators != null) {
            if (algorithms != null || session != null) {
                throw new MultiHashException(ALGORITHM_SET_MISMATCH,
                        "an accumulator set cannot be combined with algorithms or a saved session");
            }
            set = accumulators;
            offset = 0;
        } else if (session != null) {
            set = algorithms == null
                    ? AccumulatorSet.restore(session.states())
                    : AccumulatorSet.restore(session.states(), algorithms);
            offset = session.computed();
        } else {
            set = AccumulatorSet.create(algorithms == null ? DigestRegistry.supportedAlgorithms() : algorithms);
            offset = 0;
        }

        Duration interval = progressInterval == null || progressInterval.isZero() || progressInterval.isNegative()
                ? null
                : progressInterval;

        return new StreamingDigester(
                source,
                set,
                offset,
                clampBufferSize(bufferSize),
                interval,
                total,
                token == null ? CancellationToken.create() : token,
                closeSource,
                executor);
    }
}
