package de.bsommerfeld.jwlsync.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.jwlsync.core.config.SyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice wiring for the merger. Services bind themselves through their
 * {@code @Singleton} annotation; this module supplies the values they depend
 * on.
 */
public class SyncModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SyncModule.class);

    private final SyncConfig config;
    private final Clock clock;

    public SyncModule() {
        this(SyncConfig.load(), Clock.systemDefaultZone());
    }

    public SyncModule(SyncConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        LOG.debug("Configuration: {}", config);
        bind(SyncConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);
    }
}
