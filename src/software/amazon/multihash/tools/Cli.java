package software.amazon.multihash.tools;

import software.amazon.multihash.ByteSources;
import software.amazon.multihash.CancellationToken;
import software.amazon.multihash.DigestRegistry;
import software.amazon.multihash.EventStream;
import software.amazon.multihash.HashEvent;
import software.amazon.multihash.MultiHashException;
import software.amazon.multihash.SavedSession;
import software.amazon.multihash.SizedSource;
import software.amazon.multihash.StreamingDigesterBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Utility that prints the digests of a file, optionally stopping after a
 * timeout and resuming later from a saved session.
 */
public class Cli {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_STOPPED = 2;
    static final int EXIT_ERROR = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        List<String> algorithms = null;
        Duration timeout = null;
        Path resume = null;
        Path save = null;
        String fileName = null;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--alg":
                        algorithms = Arrays.asList(args[++i].split(","));
                        break;
                    case "--timeout":
                        timeout = Duration.ofMillis(Long.parseLong(args[++i]));
                        break;
                    case "--resume":
                        resume = Paths.get(args[++i]);
                        break;
                    case "--save":
                        save = Paths.get(args[++i]);
                        break;
                    default:
                        if (fileName != null) {
                            return usage(out);
                        }
                        fileName = args[i];
                }
            }
        } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
            return usage(out);
        }
        if (fileName == null) {
            return usage(out);
        }

        try {
            SavedSession session = resume == null ? null : SavedSession.fromBytes(Files.readAllBytes(resume));
            long offset = session == null ? 0 : session.computed();
            CancellationToken token = timeout == null
                    ? CancellationToken.create()
                    : CancellationToken.withTimeout(timeout);

            try (SizedSource source = ByteSources.fromFile(Paths.get(fileName), offset)) {
                EventStream events = StreamingDigesterBuilder.standard()
                        .withSource(source.stream())
                        .withAlgorithms(algorithms)
                        .withSavedSession(session)
                        .withTotal(source.total())
                        .withCancellationToken(token)
                        .build()
                        .start();

                HashEvent terminal = events.awaitTerminal();
                if (terminal instanceof HashEvent.Ok) {
                    for (Map.Entry<String, String> entry : ((HashEvent.Ok) terminal).hexChecksums().entrySet()) {
                        out.println(entry.getKey() + "  " + entry.getValue());
                    }
                    return EXIT_OK;
                }
                if (terminal instanceof HashEvent.Stop) {
                    HashEvent.Stop stop = (HashEvent.Stop) terminal;
                    out.println("[stopped after " + stop.computed() + " of " + source.total() + " bytes]");
                    if (save != null) {
                        Files.write(save, stop.toSavedSession().toBytes());
                        out.println("[session saved to " + save + "]");
                    }
                    return EXIT_STOPPED;
                }
                out.println("[unable to digest: " + ((HashEvent.Error) terminal).error() + "]");
                return EXIT_ERROR;
            }
        } catch (IOException | MultiHashException | IllegalArgumentException e) {
            out.println("[unable to digest: " + e + "]");
            return EXIT_ERROR;
        }
    }

    private static int usage(PrintStream out) {
        out.println("Utility that prints the digests of a file, resumably.");
        out.println();
        out.println("Usage:");
        out.println("  multihash [--alg A,B,...] [--timeout millis] [--resume session] [--save session] [filename]");
        out.println();
        out.println("where each algorithm is one of " + DigestRegistry.supportedAlgorithms());
        out.println();
        return EXIT_USAGE;
    }
}
