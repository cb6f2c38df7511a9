package software.amazon.multihash;

/**
 * An implementation of this interface provides fresh Accumulator instances
 * for one algorithm.
 * <p/>
 * Implementations must be thread-safe.
 */
public interface AccumulatorProvider {
    /**
     * Returns a new Accumulator instance with empty state.
     */
    Accumulator newAccumulator();
}
