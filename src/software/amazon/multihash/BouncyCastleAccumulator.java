package software.amazon.multihash;

import org.bouncycastle.crypto.ExtendedDigest;
import org.bouncycastle.crypto.digests.EncodableDigest;

import java.util.Arrays;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Accumulator that delegates to a Bouncy Castle digest whose internal state
 * can be encoded and restored.
 * <p/>
 * This class is not thread-safe.
 *
 * @param <D> the Bouncy Castle digest type
 */
final class BouncyCastleAccumulator<D extends ExtendedDigest & EncodableDigest> extends AbstractAccumulator {
    private final Function<byte[], D> restorer;
    private D digest;

    BouncyCastleAccumulator(String algorithm, Supplier<D> factory, Function<byte[], D> restorer) {
        super(algorithm);
        this.restorer = restorer;
        this.digest = factory.get();
    }

    /**
     * Returns a provider for accumulators of {@code algorithm}.
     */
    static <D extends ExtendedDigest & EncodableDigest> AccumulatorProvider provider(
            String algorithm, Supplier<D> factory, Function<byte[], D> restorer) {
        return () -> new BouncyCastleAccumulator<>(algorithm, factory, restorer);
    }

    @Override
    public int digestSize() {
        return digest.getDigestSize();
    }

    @Override
    public void update(byte[] bytes, int off, int len) {
        digest.update(bytes, off, len);
    }

    @Override
    public byte[] digest() {
        // doFinal() resets, so finish a copy instead
        D copy = restorer.apply(digest.getEncodedState());
        byte[] out = new byte[copy.getDigestSize()];
        copy.doFinal(out, 0);
        return out;
    }

    @Override
    byte[] encodeState() {
        return digest.getEncodedState();
    }

    @Override
    void decodeState(byte[] nativeState) {
        D restored = restorer.apply(nativeState);
        // trailing or truncated bytes would otherwise be accepted silently
        if (!Arrays.equals(restored.getEncodedState(), nativeState)) {
            throw malformed(algorithm());
        }
        digest = restored;
    }
}
