package software.amazon.multihash;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * An event produced by a {@link StreamingDigester} run.  Consumers tell the
 * kinds apart with {@code instanceof}:
 * <ul>
 *   <li>{@link Progress}: zero or more, before the terminal event</li>
 *   <li>{@link Ok}: the stream was fully hashed</li>
 *   <li>{@link Stop}: the run was canceled; carries the resumable state</li>
 *   <li>{@link Error}: the run failed; not resumable from this point</li>
 * </ul>
 * Exactly one terminal event ends every run.
 */
public abstract class HashEvent {
    private final Instant when = Instant.now();

    // only the nested kinds
    private HashEvent() {
    }

    /**
     * Returns the time this event was created.
     */
    public Instant when() {
        return when;
    }

    /**
     * Whether this event ends the run's event sequence.
     */
    public abstract boolean isTerminal();

    /**
     * Periodic report of how much of the stream has been hashed.
     */
    public static final class Progress extends HashEvent {
        private final long total;
        private final long computed;
        private final float percent;

        Progress(long total, long computed) {
            this.total = total;
            this.computed = computed;
            this.percent = percent(total, computed);
        }

        static float percent(long total, long computed) {
            return total > 0 ? (float) ((double) computed * 100 / total) : 0;
        }

        /**
         * Returns the advisory stream size, or a non-positive value when unknown.
         */
        public long total() {
            return total;
        }

        public long computed() {
            return computed;
        }

        /**
         * Returns {@code computed * 100 / total}, or 0 when the total is unknown.
         */
        public float percent() {
            return percent;
        }

        @Override
        public boolean isTerminal() {
            return false;
        }

        @Override
        public String toString() {
            return String.format("Progress[%d / %d (%.2f%%)]", computed, total, percent);
        }
    }

    /**
     * The run observed a cancellation between two chunks.
     */
    public static final class Stop extends HashEvent {
        private final long computed;
        private final Map<String, byte[]> states;
        private final CancellationToken.Cause cause;

        Stop(long computed, Map<String, byte[]> states, CancellationToken.Cause cause) {
            this.computed = computed;
            this.states = Collections.unmodifiableMap(states);
            this.cause = cause;
        }

        /**
         * Returns the number of bytes hashed into {@link #states()}.
         */
        public long computed() {
            return computed;
        }

        public Map<String, byte[]> states() {
            return states;
        }

        public CancellationToken.Cause cause() {
            return cause;
        }

        public SavedSession toSavedSession() {
            return new SavedSession(computed, states);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Stop[" + cause + " after " + computed + " bytes, states for " + states.keySet() + "]";
        }
    }

    /**
     * The run failed.  No resumable state is attached.
     */
    public static final class Error extends HashEvent {
        private final MultiHashException error;

        Error(MultiHashException error) {
            this.error = error;
        }

        public MultiHashException error() {
            return error;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Error[" + error.getReason() + ": " + error.getMessage() + "]";
        }
    }

    /**
     * The whole stream was hashed.
     */
    public static final class Ok extends HashEvent {
        private final long computed;
        private final Map<String, byte[]> checksums;

        Ok(long computed, Map<String, byte[]> checksums) {
            this.computed = computed;
            this.checksums = Collections.unmodifiableMap(checksums);
        }

        public long computed() {
            return computed;
        }

        public Map<String, byte[]> checksums() {
            return checksums;
        }

        public Map<String, String> hexChecksums() {
            return AccumulatorSet.toHex(checksums);
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Ok[" + computed + " bytes, " + hexChecksums() + "]";
        }
    }
}
