package software.amazon.multihash;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An input stream together with the advisory size of the whole content and
 * the offset the stream starts at.
 */
public final class SizedSource implements Closeable {
    private final InputStream stream;
    private final long total;
    private final long offset;

    public SizedSource(InputStream stream, long total, long offset) {
        if (stream == null) {
            throw new NullPointerException("Stream must not be null");
        }
        this.stream = stream;
        this.total = total;
        this.offset = offset;
    }

    public InputStream stream() {
        return stream;
    }

    /**
     * Returns the size of the whole content, or -1 if unknown.
     */
    public long total() {
        return total;
    }

    /**
     * Returns the position in the whole content of the stream's first byte.
     */
    public long offset() {
        return offset;
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
