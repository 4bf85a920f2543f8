package de.bsommerfeld.jwlsync.core.event;

import de.bsommerfeld.jwlsync.core.progress.MergeProgress;
import de.bsommerfeld.jwlsync.core.progress.MergeProgressListener;
import jakarta.inject.Inject;

/**
 * Forwards merge progress onto the {@link ApplicationEventBus} as
 * {@link SyncEvents.ProgressEvent}s.
 */
public class EventBusProgressListener implements MergeProgressListener {

    private final ApplicationEventBus eventBus;

    @Inject
    public EventBusProgressListener(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onProgress(MergeProgress progress) {
        eventBus.post(new SyncEvents.ProgressEvent(progress));
    }
}
