package software.amazon.multihash;

import org.bouncycastle.crypto.digests.MD5Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static software.amazon.multihash.MultiHashException.Reason.UNSUPPORTED_ALGORITHM;

/**
 * The closed set of supported algorithms and the providers that construct
 * their accumulators.  Identifiers are matched case-insensitively and
 * canonicalized to upper case.
 */
public final class DigestRegistry {
    public static final String MD5 = "MD5";
    public static final String SHA_1 = "SHA-1";
    public static final String SHA_256 = "SHA-256";
    public static final String SHA_512 = "SHA-512";
    public static final String CRC_32 = "CRC-32";

    private static final Map<String, AccumulatorProvider> PROVIDERS;
    private static final List<String> SUPPORTED;

    static {
        Map<String, AccumulatorProvider> providers = new TreeMap<>();
        providers.put(MD5, BouncyCastleAccumulator.<MD5Digest>provider(MD5, MD5Digest::new, s -> new MD5Digest(s)));
        providers.put(SHA_1, BouncyCastleAccumulator.<SHA1Digest>provider(SHA_1, SHA1Digest::new, s -> new SHA1Digest(s)));
        providers.put(SHA_256, BouncyCastleAccumulator.<SHA256Digest>provider(SHA_256, SHA256Digest::new, s -> new SHA256Digest(s)));
        providers.put(SHA_512, BouncyCastleAccumulator.<SHA512Digest>provider(SHA_512, SHA512Digest::new, s -> new SHA512Digest(s)));
        providers.put(CRC_32, Crc32Accumulator::new);
        PROVIDERS = Collections.unmodifiableMap(providers);
        SUPPORTED = Collections.unmodifiableList(new ArrayList<>(providers.keySet()));
    }

    // no instances
    private DigestRegistry() {
    }

    /**
     * Returns the supported algorithm identifiers in lexical order.
     */
    public static List<String> supportedAlgorithms() {
        return SUPPORTED;
    }

    public static boolean isSupported(String algorithm) {
        return algorithm != null && PROVIDERS.containsKey(algorithm.toUpperCase(Locale.ROOT));
    }

    /**
     * Returns the canonical form of {@code algorithm}.
     *
     * @throws MultiHashException with reason UNSUPPORTED_ALGORITHM
     */
    public static String canonicalize(String algorithm) {
        if (!isSupported(algorithm)) {
            throw new MultiHashException(UNSUPPORTED_ALGORITHM, "unsupported hash algorithm: " + algorithm);
        }
        return algorithm.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns the provider for {@code algorithm}.
     *
     * @throws MultiHashException with reason UNSUPPORTED_ALGORITHM
     */
    public static AccumulatorProvider provider(String algorithm) {
        return PROVIDERS.get(canonicalize(algorithm));
    }

    /**
     * Returns a new accumulator with empty state.
     *
     * @throws MultiHashException with reason UNSUPPORTED_ALGORITHM
     */
    public static Accumulator newAccumulator(String algorithm) {
        return provider(algorithm).newAccumulator();
    }
}
