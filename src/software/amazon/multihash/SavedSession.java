package software.amazon.multihash;

import com.amazon.ion.IonException;
import com.amazon.ion.IonReader;
import com.amazon.ion.IonType;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonBinaryWriterBuilder;
import com.amazon.ion.system.IonReaderBuilder;
import com.amazon.ion.system.IonTextWriterBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import static software.amazon.multihash.MultiHashException.Reason.NO_STATE_PROVIDED;
import static software.amazon.multihash.MultiHashException.Reason.STATE_IMPORT_FAILED;

/**
 * The number of bytes computed so far together with the exported accumulator
 * states.  This is what a caller carries across a stop/resume boundary; the
 * next source must start reading at offset {@link #computed()}.
 * <p/>
 * Sessions serialize to an Ion struct:
 * <pre>
 *   { computed: 1048576, states: { 'SHA-256': {{ ... }}, MD5: {{ ... }} } }
 * </pre>
 * Instances of this class are immutable.
 */
public final class SavedSession {
    static final String COMPUTED_FIELD = "computed";
    static final String STATES_FIELD = "states";

    private final long computed;
    private final Map<String, byte[]> states;

    public SavedSession(long computed, Map<String, byte[]> states) {
        if (computed < 0) {
            throw new IllegalArgumentException("computed must not be negative: " + computed);
        }
        if (states == null || states.isEmpty()) {
            throw new MultiHashException(NO_STATE_PROVIDED, "no states");
        }
        this.computed = computed;
        Map<String, byte[]> copy = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : states.entrySet()) {
            copy.put(DigestRegistry.canonicalize(entry.getKey()), entry.getValue().clone());
        }
        this.states = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the number of bytes hashed into {@link #states()}.
     */
    public long computed() {
        return computed;
    }

    /**
     * Returns the exported state of each algorithm.  Callers must not modify the arrays.
     */
    public Map<String, byte[]> states() {
        return states;
    }

    /**
     * Returns a new accumulator set loaded with these states.
     */
    public AccumulatorSet restore() {
        return AccumulatorSet.restore(states);
    }

    /**
     * Returns this session as binary Ion.
     */
    public byte[] toBytes() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (IonWriter writer = IonBinaryWriterBuilder.standard().build(baos)) {
            writeTo(writer);
        } catch (IOException e) {
            throw new IonException(e);
        }
        return baos.toByteArray();
    }

    /**
     * Returns this session as Ion text.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        try (IonWriter writer = IonTextWriterBuilder.standard().build(sb)) {
            writeTo(writer);
        } catch (IOException e) {
            throw new IonException(e);
        }
        return sb.toString();
    }

    public void writeTo(IonWriter writer) throws IOException {
        writer.stepIn(IonType.STRUCT);
        writer.setFieldName(COMPUTED_FIELD);
        writer.writeInt(computed);
        writer.setFieldName(STATES_FIELD);
        writer.stepIn(IonType.STRUCT);
        for (Map.Entry<String, byte[]> entry : states.entrySet()) {
            writer.setFieldName(entry.getKey());
            writer.writeBlob(entry.getValue());
        }
        writer.stepOut();
        writer.stepOut();
    }

    /**
     * Reads a session written by {@link #toBytes()} or {@link #toText()}.
     *
     * @throws MultiHashException with reason STATE_IMPORT_FAILED if the data is not a session
     */
    public static SavedSession fromBytes(byte[] data) {
        if (data == null) {
            throw new MultiHashException(NO_STATE_PROVIDED, "no session data");
        }
        try (IonReader reader = IonReaderBuilder.standard().build(data)) {
            return readFrom(reader);
        } catch (IOException | IonException e) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "unable to read saved session", e);
        }
    }

    public static SavedSession fromText(String text) {
        return fromBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Reads the next value of {@code reader} as a session.
     */
    public static SavedSession readFrom(IonReader reader) {
        if (reader.next() != IonType.STRUCT || reader.isNullValue()) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "saved session must be an Ion struct");
        }

        Long computed = null;
        Map<String, byte[]> states = new TreeMap<>();
        reader.stepIn();
        IonType type;
        while ((type = reader.next()) != null) {
            String fieldName = reader.getFieldName();
            if (COMPUTED_FIELD.equals(fieldName) && type == IonType.INT && !reader.isNullValue()) {
                computed = reader.longValue();
            } else if (STATES_FIELD.equals(fieldName) && type == IonType.STRUCT && !reader.isNullValue()) {
                reader.stepIn();
                IonType stateType;
                while ((stateType = reader.next()) != null) {
                    if (stateType != IonType.BLOB || reader.isNullValue()) {
                        throw new MultiHashException(STATE_IMPORT_FAILED,
                                "state of " + reader.getFieldName() + " must be a blob");
                    }
                    states.put(reader.getFieldName(), reader.newBytes());
                }
                reader.stepOut();
            }
        }
        reader.stepOut();

        if (computed == null) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "saved session has no '" + COMPUTED_FIELD + "'");
        }
        if (computed < 0) {
            throw new MultiHashException(STATE_IMPORT_FAILED, "saved session has negative '" + COMPUTED_FIELD + "'");
        }
        return new SavedSession(computed, states);
    }
}
