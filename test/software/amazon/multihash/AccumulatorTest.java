package software.amazon.multihash;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static software.amazon.multihash.MultiHashException.Reason.STATE_IMPORT_FAILED;
import static software.amazon.multihash.TestUtil.assertEquals;

public class AccumulatorTest {
    @Test
    public void testMd5() {
        Accumulator accumulator = DigestRegistry.newAccumulator("MD5");
        accumulator.update(new byte[] {0x0f}, 0, 1);
        byte[] expected = new byte[] {
                (byte)0xd8, 0x38, 0x69, 0x1e, 0x5d, 0x4a, (byte)0xd0, 0x68, 0x79,
                (byte)0xca, 0x72, 0x14, 0x42, (byte)0xe8, (byte)0x83, (byte)0xd4};
        assertEquals(expected, accumulator.digest());

        // digest() leaves the running state alone
        assertEquals(expected, accumulator.digest());
    }

    @Test
    public void testUpdateHonorsOffsetAndLength() {
        byte[] data = TestUtil.utf8("xxabcxx");
        for (String algorithm : DigestRegistry.supportedAlgorithms()) {
            Accumulator sliced = DigestRegistry.newAccumulator(algorithm);
            sliced.update(data, 2, 3);
            Accumulator whole = DigestRegistry.newAccumulator(algorithm);
            whole.update(TestUtil.utf8("abc"), 0, 3);
            assertEquals(algorithm, whole.digest(), sliced.digest());
        }
    }

    @Test
    public void testCrc32MatchesJdk() {
        byte[] data = TestUtil.randomBytes(10_000, 7);
        CRC32 jdk = new CRC32();
        Crc32Accumulator crc = new Crc32Accumulator();
        for (int off = 0; off < data.length; off += 333) {
            int len = Math.min(333, data.length - off);
            jdk.update(data, off, len);
            crc.update(data, off, len);
            assertEquals(jdk.getValue(), crc.getValue());
        }
        long value = jdk.getValue();
        assertArrayEquals(new byte[] {
                (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value},
                crc.digest());
    }

    @Test
    public void testStateCarriesAcrossInstances() {
        byte[] data = TestUtil.randomBytes(1000, 11);
        for (String algorithm : DigestRegistry.supportedAlgorithms()) {
            Accumulator whole = DigestRegistry.newAccumulator(algorithm);
            whole.update(data, 0, data.length);

            Accumulator first = DigestRegistry.newAccumulator(algorithm);
            first.update(data, 0, 123);
            Accumulator second = DigestRegistry.newAccumulator(algorithm);
            second.importState(first.exportState());
            second.update(data, 123, data.length - 123);

            assertEquals(algorithm, whole.digest(), second.digest());
        }
    }

    @Test
    public void testSnapshotHeader() {
        byte[] state = DigestRegistry.newAccumulator("SHA-256").exportState();
        assertEquals('m', state[0]);
        assertEquals('h', state[1]);
        assertEquals(AbstractAccumulator.SNAPSHOT_VERSION, state[2]);
        assertEquals("SHA-256".length(), state[3]);
        assertEquals("SHA-256", new String(state, 4, 7, StandardCharsets.US_ASCII));
    }

    @Test
    public void testImportRejectsOtherAlgorithm() {
        byte[] md5State = DigestRegistry.newAccumulator("MD5").exportState();
        assertImportFails("SHA-1", md5State);
    }

    @Test
    public void testImportRejectsMalformedState() {
        for (String algorithm : DigestRegistry.supportedAlgorithms()) {
            Accumulator accumulator = DigestRegistry.newAccumulator(algorithm);
            accumulator.update(TestUtil.utf8("some bytes"), 0, 10);
            byte[] state = accumulator.exportState();

            assertImportFails(algorithm, null);
            assertImportFails(algorithm, new byte[0]);
            assertImportFails(algorithm, Arrays.copyOf(state, 3));
            assertImportFails(algorithm, Arrays.copyOf(state, state.length - 1));
            assertImportFails(algorithm, Arrays.copyOf(state, state.length + 4));

            byte[] badVersion = state.clone();
            badVersion[2] = 9;
            assertImportFails(algorithm, badVersion);
        }
    }

    @Test
    public void testFailedImportKeepsState() {
        Accumulator accumulator = DigestRegistry.newAccumulator("SHA-256");
        accumulator.update(TestUtil.utf8("abc"), 0, 3);
        byte[] before = accumulator.digest();
        try {
            accumulator.importState(new byte[] {'m', 'h', 1});
            fail("expected STATE_IMPORT_FAILED");
        } catch (MultiHashException e) {
            assertEquals(STATE_IMPORT_FAILED, e.getReason());
        }
        assertEquals(before, accumulator.digest());
    }

    private static void assertImportFails(String algorithm, byte[] state) {
        try {
            DigestRegistry.newAccumulator(algorithm).importState(state);
            fail("expected STATE_IMPORT_FAILED for " + algorithm);
        } catch (MultiHashException e) {
            assertEquals(STATE_IMPORT_FAILED, e.getReason());
        }
    }
}
