package software.amazon.multihash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static software.amazon.multihash.MultiHashException.Reason.STATE_EXPORT_UNSUPPORTED;
import static software.amazon.multihash.MultiHashException.Reason.STATE_IMPORT_FAILED;

/**
 * Base class that frames the native state of a digest implementation into a
 * snapshot blob and validates blobs on import.
 * <p/>
 * Blob layout:
 * <pre>
 *   'm' 'h' | version (1 byte) | id length (1 byte) | id (ASCII) | native state
 * </pre>
 * This class is not thread-safe.
 */
abstract class AbstractAccumulator implements Accumulator {
    static final byte[] SNAPSHOT_MAGIC = {'m', 'h'};
    static final byte SNAPSHOT_VERSION = 1;

    private final String algorithm;
    private final byte[] header;

    AbstractAccumulator(String algorithm) {
        if (algorithm == null) {
            throw new NullPointerException("Algorithm must not be null");
        }
        this.algorithm = algorithm;

        byte[] id = algorithm.getBytes(StandardCharsets.US_ASCII);
        header = new byte[SNAPSHOT_MAGIC.length + 2 + id.length];
        System.arraycopy(SNAPSHOT_MAGIC, 0, header, 0, SNAPSHOT_MAGIC.length);
        header[SNAPSHOT_MAGIC.length] = SNAPSHOT_VERSION;
        header[SNAPSHOT_MAGIC.length + 1] = (byte) id.length;
        System.arraycopy(id, 0, header, SNAPSHOT_MAGIC.length + 2, id.length);
    }

    @Override
    public final String algorithm() {
        return algorithm;
    }

    @Override
    public boolean supportsSnapshot() {
        return true;
    }

    @Override
    public final byte[] exportState() {
        if (!supportsSnapshot()) {
            throw new MultiHashException(STATE_EXPORT_UNSUPPORTED,
                    algorithm + " accumulator does not support state export");
        }
        byte[] nativeState = encodeState();
        byte[] blob = Arrays.copyOf(header, header.length + nativeState.length);
        System.arraycopy(nativeState, 0, blob, header.length, nativeState.length);
        return blob;
    }

    @Override
    public final void importState(byte[] state) {
        if (!supportsSnapshot()) {
            throw new MultiHashException(STATE_EXPORT_UNSUPPORTED,
                    algorithm + " accumulator does not support state import");
        }
        if (state == null) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "no state given for " + algorithm);
        }
        if (state.length < header.length
                || !Arrays.equals(header, 0, header.length, state, 0, header.length)) {
            throw new MultiHashException(STATE_IMPORT_FAILED,
                    "state is not a version " + SNAPSHOT_VERSION + " snapshot of " + algorithm);
        }

        byte[] nativeState = Arrays.copyOfRange(state, header.length, state.length);
        try {
            decodeState(nativeState);
        } catch (MultiHashException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "invalid " + algorithm + " state", e);
        }
    }

    /**
     * Returns the native state of the underlying implementation.
     */
    abstract byte[] encodeState();

    /**
     * Replaces the running state with the decoded {@code nativeState}, or throws
     * without modifying it.  Runtime exceptions are reported as STATE_IMPORT_FAILED.
     */
    abstract void decodeState(byte[] nativeState);

    static MultiHashException malformed(String algorithm) {
        return new MultiHashException(STATE_IMPORT_FAILED, "malformed " + algorithm + " state");
    }
}
