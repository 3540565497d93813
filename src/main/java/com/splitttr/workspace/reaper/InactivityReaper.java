package com.splitttr.workspace.reaper;

import com.splitttr.workspace.config.CollaborationSettings;
import com.splitttr.workspace.room.Room;
import com.splitttr.workspace.room.RoomManager;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically closes rooms nobody has touched within the idle threshold.
 * {@link #sweep()} does one pass and can be driven directly.
 */
@ApplicationScoped
public class InactivityReaper {

    private static final Logger log = LoggerFactory.getLogger(InactivityReaper.class);

    private final RoomManager rooms;
    private final CollaborationSettings settings;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    @Inject
    public InactivityReaper(RoomManager rooms, CollaborationSettings settings, Clock clock) {
        this.rooms = rooms;
        this.settings = settings;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collab-reaper");
            t.setDaemon(true);
            return t;
        });
        long period = settings.sweepInterval().toMillis();
        task = scheduler.scheduleAtFixedRate(this::sweepSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("Inactive room sweep every {}, idle threshold {}", settings.sweepInterval(), settings.idleThreshold());
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdownNow();
        task = null;
        scheduler = null;
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Closes every room idle for longer than the threshold.
     *
     * @return number of rooms closed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(settings.idleThreshold());
        int closed = 0;
        for (Room room : rooms.rooms()) {
            if (rooms.closeIfIdle(room, cutoff)) {
                log.info("Cleaned up inactive room for project {}", room.projectId());
                closed++;
            }
        }
        return closed;
    }

    // An exception escaping a fixed-rate task cancels all later runs.
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Inactive room sweep failed", e);
        }
    }
}
