package software.amazon.multihash;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Opens the sources a {@link StreamingDigester} typically reads from.  The
 * variants taking an offset position the stream for resuming a
 * {@link SavedSession}: pass {@link SavedSession#computed()}.
 */
public final class ByteSources {
    // no instances
    private ByteSources() {
    }

    public static SizedSource fromString(String str) {
        return fromStrings(Collections.singletonList(str));
    }

    /**
     * Returns the UTF-8 bytes of {@code strs}, concatenated.
     */
    public static SizedSource fromStrings(List<String> strs) {
        List<InputStream> streams = new ArrayList<>();
        long total = 0;
        for (String str : strs) {
            byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
            streams.add(new ByteArrayInputStream(bytes));
            total += bytes.length;
        }
        return new SizedSource(new SequenceInputStream(Collections.enumeration(streams)), total, 0);
    }

    public static SizedSource fromFile(Path file) throws IOException {
        return fromFile(file, 0);
    }

    /**
     * Opens {@code file} positioned at {@code offset}.
     *
     * @throws IllegalArgumentException if offset is negative or beyond the end of the file
     */
    public static SizedSource fromFile(Path file, long offset) throws IOException {
        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
        try {
            long size = channel.size();
            if (offset < 0 || offset > size) {
                throw new IllegalArgumentException("offset " + offset + " is outside of " + file + " (" + size + " bytes)");
            }
            channel.position(offset);
            return new SizedSource(Channels.newInputStream(channel), size, offset);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    public static SizedSource fromUrl(URL url) throws IOException {
        return fromUrl(url, 0);
    }

    /**
     * Issues a GET for {@code url}; with a positive offset, a range request
     * for everything from {@code offset} on.
     *
     * @throws IOException if the server does not answer 200 (or 206 for a range request)
     */
    public static SizedSource fromUrl(URL url, long offset) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }

        HttpURLConnection urlCon = (HttpURLConnection) url.openConnection();
        urlCon.setRequestMethod("GET");
        if (offset > 0) {
            urlCon.setRequestProperty("Range", "bytes=" + offset + "-");
        }
        urlCon.connect();

        int expected = offset > 0 ? HttpURLConnection.HTTP_PARTIAL : HttpURLConnection.HTTP_OK;
        int status = urlCon.getResponseCode();
        if (status != expected) {
            String message = urlCon.getResponseMessage();
            urlCon.disconnect();
            throw new IOException("GET " + url + " received unexpected response code " + status
                    + " (expected " + expected + "); " + message);
        }

        long length = urlCon.getContentLengthLong();
        long total = length < 0 ? -1 : offset + length;
        return new SizedSource(urlCon.getInputStream(), total, offset);
    }
}
