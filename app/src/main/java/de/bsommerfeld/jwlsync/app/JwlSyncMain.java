package de.bsommerfeld.jwlsync.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import de.bsommerfeld.jwlsync.core.error.SyncException;
import de.bsommerfeld.jwlsync.core.event.ApplicationEventBus;
import de.bsommerfeld.jwlsync.core.event.EventBusProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * <pre>
 * jwlibrary-sync &lt;source.jwlibrary&gt; &lt;destination.jwlibrary&gt; [outputDir]
 * </pre>
 *
 * Exit codes: 0 on success, 1 if the merge failed, 2 on bad usage.
 */
public final class JwlSyncMain {

    private static final Logger LOG = LoggerFactory.getLogger(JwlSyncMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: jwlibrary-sync <source.jwlibrary> <destination.jwlibrary> [outputDir]";

    private JwlSyncMain() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, new SyncModule()));
    }

    static int run(String[] args, PrintStream out, Module module) {
        if (args.length < 2 || args.length > 3) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        Injector injector = Guice.createInjector(module);
        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        ConsoleProgressView view = new ConsoleProgressView(out);
        eventBus.register(view);

        LOG.info("JWLibrarySync - JW Library Backup Merger");
        try {
            Path output = injector.getInstance(MergeService.class).merge(
                    Paths.get(args[0]), Paths.get(args[1]), args.length == 3 ? Paths.get(args[2]) : null,
                    injector.getInstance(EventBusProgressListener.class));
            LOG.info("Done: {}", output);
            return EXIT_OK;
        } catch (SyncException e) {
            LOG.error("Merge failed", e);
            return EXIT_FAILED;
        } finally {
            eventBus.unregister(view);
        }
    }
}
