package io.github.drompincen.collabsync.runtime.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.collabsync.protocol.ws.WireCodec;
import io.github.drompincen.collabsync.runtime.connection.TransportFactory;
import io.github.drompincen.collabsync.runtime.profile.ProfileStore;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class SyncEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(SyncEngineFactory.class);

    private final SyncSettings settings;
    private final TransportFactory transportFactory;
    private final SyncScheduler scheduler;
    private final ProfileStore profileStore;
    private final Clock clock;
    private final WireCodec codec;

    public SyncEngineFactory(SyncSettings settings, TransportFactory transportFactory, SyncScheduler scheduler,
                             ProfileStore profileStore, Clock clock, ObjectMapper objectMapper) {
        this.settings = settings;
        this.transportFactory = transportFactory;
        this.scheduler = scheduler;
        this.profileStore = profileStore;
        this.clock = clock;
        this.codec = new WireCodec(objectMapper);
    }

    /** A new engine with the stored profile already restored. */
    public SyncEngine create() {
        SyncEngine engine = new SyncEngine(settings, transportFactory, scheduler, profileStore, clock, codec);
        engine.restoreProfile();
        log.info("Created sync engine for profile {}", settings.profileId());
        return engine;
    }
}
