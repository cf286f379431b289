package com.avari.signaling.lifecycle;

import com.avari.signaling.config.RelayProperties;
import com.avari.signaling.match.MatchRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Periodically purges matches left without live members, every
 * {@code app.relay.reaper-interval}.
 * Disconnect handling removes empty matches immediately; this only catches
 * matches whose members vanished without a close callback.
 */
@Component
public class MatchReaper implements SchedulingConfigurer {
    private static final Logger log = LoggerFactory.getLogger(MatchReaper.class);

    private final MatchRegistry registry;
    private final RelayProperties properties;

    public MatchReaper(MatchRegistry registry, RelayProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.addFixedDelayTask(this::run, properties.reaperInterval());
    }

    public void run() {
        int purged = registry.purgeStale(properties.staleMatchTimeout());
        if (purged > 0) {
            log.info("Reaper purged {} stale matches, {} active", purged, registry.matchCount());
        } else {
            log.debug("Reaper found no stale matches ({} active)", registry.matchCount());
        }
    }
}
