package software.amazon.multihash;

import org.bouncycastle.util.encoders.Hex;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static software.amazon.multihash.MultiHashException.Reason.ALGORITHM_SET_MISMATCH;
import static software.amazon.multihash.MultiHashException.Reason.CONSUMER_PROTOCOL_VIOLATION;
import static software.amazon.multihash.MultiHashException.Reason.NO_ALGORITHM_SPECIFIED;
import static software.amazon.multihash.MultiHashException.Reason.NO_STATE_PROVIDED;

/**
 * Named accumulators that consume the same byte stream in lockstep.
 * <p/>
 * A set's lineage starts when it is created or restored and ends when it is
 * sealed; exporting its state seals it.  After that the set may still be
 * asked for digests or state, but no longer written to.  Continue a sealed
 * lineage by {@link #restore(Map) restoring} a new set from the exported state.
 * <p/>
 * This class is not thread-safe.
 */
public final class AccumulatorSet {
    private final Map<String, Accumulator> accumulators;
    private long bytesWritten;
    private boolean sealed;

    AccumulatorSet(Map<String, Accumulator> accumulators) {
        this.accumulators = accumulators;
    }

    /**
     * Creates a set with fresh accumulators for {@code algorithms}.
     * Identifiers are canonicalized; duplicates collapse into one accumulator.
     *
     * @throws MultiHashException with reason NO_ALGORITHM_SPECIFIED or UNSUPPORTED_ALGORITHM
     */
    public static AccumulatorSet create(Collection<String> algorithms) {
        Set<String> canonical = canonicalize(algorithms);

        Map<String, Accumulator> accumulators = new TreeMap<>();
        for (String algorithm : canonical) {
            accumulators.put(algorithm, DigestRegistry.newAccumulator(algorithm));
        }
        return new AccumulatorSet(accumulators);
    }

    /**
     * Creates a set whose algorithms are the keys of {@code states}, each
     * accumulator loaded with its exported state.
     *
     * @throws MultiHashException with reason NO_STATE_PROVIDED, UNSUPPORTED_ALGORITHM
     *         or STATE_IMPORT_FAILED
     */
    public static AccumulatorSet restore(Map<String, byte[]> states) {
        if (states == null || states.isEmpty()) {
            throw new MultiHashException(NO_STATE_PROVIDED, "no states");
        }

        Map<String, Accumulator> accumulators = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : states.entrySet()) {
            String algorithm = DigestRegistry.canonicalize(entry.getKey());
            if (accumulators.containsKey(algorithm)) {
                throw new MultiHashException(ALGORITHM_SET_MISMATCH,
                        "state given twice for " + algorithm);
            }
            Accumulator accumulator = DigestRegistry.newAccumulator(algorithm);
            accumulator.importState(entry.getValue());
            accumulators.put(algorithm, accumulator);
        }
        return new AccumulatorSet(accumulators);
    }

    /**
     * Like {@link #restore(Map)}, but also requires the keys of {@code states}
     * to be exactly {@code algorithms}.
     *
     * @throws MultiHashException with reason ALGORITHM_SET_MISMATCH if they differ
     */
    public static AccumulatorSet restore(Map<String, byte[]> states, Collection<String> algorithms) {
        if (states == null || states.isEmpty()) {
            throw new MultiHashException(NO_STATE_PROVIDED, "no states");
        }
        Set<String> requested = canonicalize(algorithms);
        Set<String> saved = canonicalize(states.keySet());
        if (!requested.equals(saved)) {
            throw new MultiHashException(ALGORITHM_SET_MISMATCH,
                    "saved states " + saved + " do not match algorithms " + requested);
        }
        return restore(states);
    }

    static Set<String> canonicalize(Collection<String> algorithms) {
        if (algorithms == null || algorithms.isEmpty()) {
            throw new MultiHashException(NO_ALGORITHM_SPECIFIED, "no hash algorithm specified");
        }
        Set<String> canonical = new TreeSet<>();
        for (String algorithm : algorithms) {
            canonical.add(DigestRegistry.canonicalize(algorithm));
        }
        return canonical;
    }

    /**
     * Returns the canonical identifiers of the algorithms in this set, sorted.
     */
    public Set<String> algorithms() {
        return Collections.unmodifiableSet(accumulators.keySet());
    }

    /**
     * Returns the number of bytes written since this set was created or restored.
     */
    public long bytesWritten() {
        return bytesWritten;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Ends this set's lineage; later writes fail.
     */
    public void seal() {
        sealed = true;
    }

    public void write(byte[] bytes) {
        write(bytes, 0, bytes.length);
    }

    /**
     * Feeds the same chunk to every accumulator.  {@link #bytesWritten()} advances
     * only once all of them consumed it.
     *
     * @throws MultiHashException with reason CONSUMER_PROTOCOL_VIOLATION if the set is sealed
     */
    public void write(byte[] bytes, int off, int len) {
        if (sealed) {
            throw new MultiHashException(CONSUMER_PROTOCOL_VIOLATION,
                    "write after the accumulator set was sealed");
        }
        for (Accumulator accumulator : accumulators.values()) {
            accumulator.update(bytes, off, len);
        }
        bytesWritten += len;
    }

    /**
     * Returns the digest of each algorithm.  Only final once the whole stream
     * has been written.
     */
    public Map<String, byte[]> digests() {
        Map<String, byte[]> digests = new TreeMap<>();
        for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
            digests.put(entry.getKey(), entry.getValue().digest());
        }
        return digests;
    }

    /**
     * Returns {@link #digests()} as lower-case hex strings.
     */
    public Map<String, String> hexDigests() {
        return toHex(digests());
    }

    /**
     * Looks for an algorithm whose digest equals the hex {@code checksum}, ignoring case.
     */
    public Optional<String> match(String checksum) {
        if (checksum == null) {
            return Optional.empty();
        }
        String wanted = checksum.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : hexDigests().entrySet()) {
            if (entry.getValue().equals(wanted)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Exports the state of every accumulator and seals this set.
     *
     * @throws MultiHashException with reason STATE_EXPORT_UNSUPPORTED
     */
    public Map<String, byte[]> exportState() {
        Map<String, byte[]> states = new TreeMap<>();
        for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
            states.put(entry.getKey(), entry.getValue().exportState());
        }
        sealed = true;
        return states;
    }

    static Map<String, String> toHex(Map<String, byte[]> digests) {
        Map<String, String> hex = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : digests.entrySet()) {
            hex.put(entry.getKey(), Hex.toHexString(entry.getValue()));
        }
        return hex;
    }
}
