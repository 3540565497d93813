package com.splitttr.workspace.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;

@ApplicationScoped
public class CollaborationProducers {

    @ConfigProperty(name = "collab.reaper.idle-threshold", defaultValue = "30m")
    Duration idleThreshold;

    @ConfigProperty(name = "collab.reaper.sweep-interval", defaultValue = "5m")
    Duration sweepInterval;

    @ConfigProperty(name = "collab.operations.buffer-limit", defaultValue = "500")
    int operationBufferLimit;

    @ConfigProperty(name = "collab.locks.ttl", defaultValue = "0s")
    Duration lockTtl;

    @Produces
    @Singleton
    CollaborationSettings settings() {
        return new CollaborationSettings(idleThreshold, sweepInterval, operationBufferLimit, lockTtl);
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
