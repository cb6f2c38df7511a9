package software.amazon.multihash;

/**
 * Table-driven CRC-32 (IEEE 802.3, reflected polynomial 0xEDB88320).
 * Produces the same value as {@link java.util.zip.CRC32}, but exposes the
 * CRC register so it can be snapshotted.  The digest is the checksum in
 * big-endian order; the native state is the 4-byte big-endian register.
 * <p/>
 * This class is not thread-safe.
 */
final class Crc32Accumulator extends AbstractAccumulator {
    private static final int POLYNOMIAL = 0xEDB88320;
    private static final int[] TABLE = new int[256];

    static {
        for (int n = 0; n < 256; n++) {
            int c = n;
            for (int k = 0; k < 8; k++) {
                c = (c & 1) != 0 ? POLYNOMIAL ^ (c >>> 1) : c >>> 1;
            }
            TABLE[n] = c;
        }
    }

    private int register = 0xFFFFFFFF;

    Crc32Accumulator() {
        super(DigestRegistry.CRC_32);
    }

    @Override
    public int digestSize() {
        return 4;
    }

    @Override
    public void update(byte[] bytes, int off, int len) {
        int c = register;
        for (int i = off; i < off + len; i++) {
            c = TABLE[(c ^ bytes[i]) & 0xFF] ^ (c >>> 8);
        }
        register = c;
    }

    /**
     * Returns the checksum as an unsigned value, for comparison with {@link java.util.zip.CRC32#getValue()}.
     */
    long getValue() {
        return (~register) & 0xFFFFFFFFL;
    }

    @Override
    public byte[] digest() {
        return toBytes(~register);
    }

    @Override
    byte[] encodeState() {
        return toBytes(register);
    }

    @Override
    void decodeState(byte[] nativeState) {
        if (nativeState.length != 4) {
            throw malformed(algorithm());
        }
        register = ((nativeState[0] & 0xFF) << 24)
                 | ((nativeState[1] & 0xFF) << 16)
                 | ((nativeState[2] & 0xFF) << 8)
                 |  (nativeState[3] & 0xFF);
    }

    private static byte[] toBytes(int value) {
        return new byte[] {
                (byte) (value >>> 24),
                (byte) (value >>> 16),
                (byte) (value >>> 8),
                (byte) value};
    }
}
