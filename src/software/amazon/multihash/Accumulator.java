package software.amazon.multihash;

/**
 * Incremental digest state bound to a single algorithm.
 * <p/>
 * Implementations are not required to be thread-safe.
 */
public interface Accumulator {
    /**
     * Returns the canonical identifier of the algorithm, e.g. "SHA-256".
     */
    String algorithm();

    /**
     * Returns the size in bytes of the value returned by {@link #digest()}.
     */
    int digestSize();

    /**
     * Updates the accumulator with {@code len} bytes of {@code bytes} starting at {@code off}.
     */
    void update(byte[] bytes, int off, int len);

    /**
     * Returns the digest of everything consumed so far.  Unlike
     * {@link java.security.MessageDigest#digest()}, the running state is left
     * untouched, so repeated calls return the same value.
     */
    byte[] digest();

    /**
     * Whether {@link #exportState()} and {@link #importState(byte[])} are available.
     */
    boolean supportsSnapshot();

    /**
     * Serializes the running state into a self-contained blob.
     *
     * @throws MultiHashException with reason STATE_EXPORT_UNSUPPORTED if
     *         {@link #supportsSnapshot()} is false
     */
    byte[] exportState();

    /**
     * Replaces the running state with one previously produced by
     * {@link #exportState()} on an accumulator of the same algorithm.
     *
     * @throws MultiHashException with reason STATE_IMPORT_FAILED if the blob is
     *         malformed; the current state is left unchanged
     */
    void importState(byte[] state);
}
