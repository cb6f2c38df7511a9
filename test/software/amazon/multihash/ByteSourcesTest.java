package software.amazon.multihash;

import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ByteSourcesTest {
    private static final byte[] CONTENT = TestUtil.randomBytes(10_000, 21);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private HttpServer server;
    private URL url;

    @Before
    public void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/content", exchange -> {
            String range = exchange.getRequestHeaders().getFirst("Range");
            int from = range == null ? 0 : Integer.parseInt(range.substring("bytes=".length(), range.length() - 1));
            byte[] body = Arrays.copyOfRange(CONTENT, from, CONTENT.length);
            exchange.sendResponseHeaders(range == null ? 200 : 206, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/ignores-range", exchange -> {
            exchange.sendResponseHeaders(200, CONTENT.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(CONTENT);
            }
        });
        server.start();
        url = new URL("http://127.0.0.1:" + server.getAddress().getPort() + "/content");
    }

    @After
    public void stopServer() {
        server.stop(0);
    }

    private static byte[] readAll(SizedSource source) throws IOException {
        try (InputStream in = source.stream()) {
            return in.readAllBytes();
        }
    }

    @Test
    public void testFromStrings() throws IOException {
        SizedSource source = ByteSources.fromStrings(Arrays.asList("The tunneling gopher ", "digs downwards, ",
                "unaware of what he will find."));
        assertEquals(TestUtil.GOPHER.length(), source.total());
        assertArrayEquals(TestUtil.utf8(TestUtil.GOPHER), readAll(source));
        assertEquals(3, ByteSources.fromString("éa").total());
    }

    @Test
    public void testFromFileAtOffset() throws IOException {
        Path file = folder.newFile("content.bin").toPath();
        Files.write(file, CONTENT);

        SizedSource whole = ByteSources.fromFile(file);
        assertEquals(CONTENT.length, whole.total());
        assertArrayEquals(CONTENT, readAll(whole));

        SizedSource tail = ByteSources.fromFile(file, 4000);
        assertEquals(CONTENT.length, tail.total());
        assertEquals(4000, tail.offset());
        assertArrayEquals(Arrays.copyOfRange(CONTENT, 4000, CONTENT.length), readAll(tail));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromFileBeyondEnd() throws IOException {
        Path file = folder.newFile("short.bin").toPath();
        Files.write(file, new byte[10]);
        ByteSources.fromFile(file, 11);
    }

    @Test
    public void testFromUrl() throws IOException {
        SizedSource source = ByteSources.fromUrl(url);
        assertEquals(CONTENT.length, source.total());
        assertArrayEquals(CONTENT, readAll(source));
    }

    @Test
    public void testFromUrlWithRange() throws IOException {
        SizedSource source = ByteSources.fromUrl(url, 2500);
        assertEquals(CONTENT.length, source.total());
        assertArrayEquals(Arrays.copyOfRange(CONTENT, 2500, CONTENT.length), readAll(source));
    }

    @Test(expected = IOException.class)
    public void testRangeNotSupported() throws IOException {
        ByteSources.fromUrl(new URL(url, "/ignores-range"), 2500);
    }

    @Test
    public void testResumeOverHttp() throws IOException {
        CancellationToken token = CancellationToken.create();
        HashEvent.Stop stop;
        try (SizedSource first = ByteSources.fromUrl(url)) {
            stop = (HashEvent.Stop) StreamingDigesterBuilder.standard()
                    .withSource(new TestUtil.ChunkedInputStream(readAll(first), 1000, reads -> {
                        if (reads == 4) {
                            token.cancel();
                        }
                    }))
                    .withAlgorithms("SHA-256", "CRC-32")
                    .withCancellationToken(token)
                    .build()
                    .start()
                    .awaitTerminal();
        }
        assertEquals(4000, stop.computed());

        SizedSource rest = ByteSources.fromUrl(url, stop.computed());
        HashEvent.Ok ok = (HashEvent.Ok) StreamingDigesterBuilder.standard()
                .withSource(rest.stream())
                .withSavedSession(stop.toSavedSession())
                .withTotal(rest.total())
                .withCloseSource(true)
                .build()
                .start()
                .awaitTerminal();
        assertEquals(CONTENT.length, ok.computed());
        TestUtil.assertDigestsEqual(TestUtil.digestsOf(CONTENT, "SHA-256", "CRC-32"), ok.checksums());
    }
}
