package software.amazon.multihash;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation signal polled by a {@link StreamingDigester} between
 * chunks.  A token is canceled explicitly with {@link #cancel()} or implicitly
 * once its deadline passes.  Polling never blocks.
 * <p/>
 * Instances of this class are thread-safe.
 */
public final class CancellationToken {
    public enum Cause {
        CANCELED,
        DEADLINE_EXCEEDED,
    }

    private final Clock clock;
    private final Instant deadline;
    private volatile boolean canceled;

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Returns a token that is only canceled explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        if (deadline == null) {
            throw new NullPointerException("Deadline must not be null");
        }
        if (clock == null) {
            throw new NullPointerException("Clock must not be null");
        }
        return new CancellationToken(clock, deadline);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new NullPointerException("Timeout must not be null");
        }
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        canceled = true;
    }

    public boolean isCancelled() {
        return cause() != null;
    }

    /**
     * Returns why this token is canceled, or null if it is not.
     */
    public Cause cause() {
        if (canceled) {
            return Cause.CANCELED;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return Cause.DEADLINE_EXCEEDED;
        }
        return null;
    }
}
