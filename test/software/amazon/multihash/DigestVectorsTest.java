package software.amazon.multihash;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonText;
import com.amazon.ion.IonValue;
import com.amazon.ion.system.IonSystemBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.Assert.assertEquals;

/**
 * Checks every algorithm against the known digests in multihash_tests.ion.
 */
@RunWith(Parameterized.class)
public class DigestVectorsTest {
    private final static IonSystem ION = IonSystemBuilder.standard().build();
    final static String MULTIHASH_TESTS_PATH
            = String.format("test/%s/multihash_tests.ion", DigestVectorsTest.class.getPackage().getName().replace('.', '/'));

    private final String input;
    private final Map<String, String> expected;

    public DigestVectorsTest(String name, String input, Map<String, String> expected) {
        this.input = input;
        this.expected = expected;
    }

    @Parameters(name = "{0}")
    public static Collection<Object[]> tests() throws IOException {
        Collection<Object[]> tests = new ArrayList<>();
        try (Reader reader = new FileReader(new File(MULTIHASH_TESTS_PATH))) {
            Iterator<IonValue> iter = ION.iterate(reader);
            while (iter.hasNext()) {
                IonStruct test = (IonStruct) iter.next();
                String input = ((IonText) test.get("input")).stringValue();

                Map<String, String> digests = new TreeMap<>();
                for (IonValue digest : (IonStruct) test.get("digests")) {
                    digests.put(digest.getFieldName(), ((IonText) digest).stringValue());
                }

                String name = input.length() > 20 ? input.substring(0, 20) + "..." : '"' + input + '"';
                tests.add(new Object[] {name, input, digests});
            }
        }
        return tests;
    }

    @Test
    public void testUnbroken() {
        Map<String, byte[]> checksums = StreamingDigesterBuilder.standard()
                .withSource(new ByteArrayInputStream(TestUtil.utf8(input)))
                .withAlgorithms(expected.keySet())
                .build()
                .compute();
        assertEquals(expected, TestUtil.toHex(checksums));
    }

    @Test
    public void testResumedAtEveryOffset() {
        byte[] data = TestUtil.utf8(input);
        for (int k = 0; k <= data.length; k++) {
            AccumulatorSet first = AccumulatorSet.create(expected.keySet());
            first.write(data, 0, k);
            SavedSession session = SavedSession.fromBytes(new SavedSession(k, first.exportState()).toBytes());

            Map<String, byte[]> checksums = StreamingDigesterBuilder.standard()
                    .withSource(new ByteArrayInputStream(data, k, data.length - k))
                    .withSavedSession(session)
                    .build()
                    .compute();
            assertEquals("resumed at " + k, expected, TestUtil.toHex(checksums));
        }
    }
}
