package de.bsommerfeld.jwlsync.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.jwlsync.core.event.SyncEvents;
import de.bsommerfeld.jwlsync.core.progress.MergeProgress;

import java.io.PrintStream;

/**
 * Prints merge progress to a console. Register it on the
 * {@link de.bsommerfeld.jwlsync.core.event.ApplicationEventBus}.
 */
public class ConsoleProgressView {

    private final PrintStream out;
    private int lastPercent = -1;

    public ConsoleProgressView(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onProgress(SyncEvents.ProgressEvent event) {
        MergeProgress progress = event.progress();
        // bare percentage updates are only worth a line when the value moved
        if (progress.message() == null && progress.percent() == lastPercent) {
            return;
        }
        lastPercent = progress.percent();
        out.printf("[%3d%%] %s%n", progress.percent(), progress.message() != null ? progress.message() : "");
    }

    @Subscribe
    public void onCompleted(SyncEvents.MergeCompletedEvent event) {
        if (event.output() != null) {
            out.println("Created merged backup: " + event.output());
        } else {
            out.println("Merge completed.");
        }
        if (event.warnings() > 0) {
            out.println(event.warnings() + " warning(s) were recorded, see the log for details.");
        }
    }

    @Subscribe
    public void onFailed(SyncEvents.MergeFailedEvent event) {
        out.println("Merge failed during " + event.phase().label() + ": " + event.message());
    }
}
