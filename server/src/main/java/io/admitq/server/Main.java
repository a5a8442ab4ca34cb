// file: server/src/main/java/io/admitq/server/Main.java
package io.admitq.server;

import io.admitq.storage.DurableQueueStore;
import io.admitq.storage.FileSnapshotter;
import io.admitq.storage.FileWal;
import io.admitq.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a standalone admission queue server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire together storage components (WAL, snapshots, DurableQueueStore).
 *  - Build ceilings, running-job tracking, admission and read components.
 *  - Start the HTTP API, the reaper and the admission safety poller.
 *  - Stop everything and close the store on JVM shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        Clock clock = Clock.systemUTC();

        // ------ Storage Layer -------
        Path data = Path.of(cfg.dataDir());
        var wal = new FileWal(data.resolve("wal"), 64L * 1024 * 1024); // rotate ~64MB
        var snaps = new FileSnapshotter(data.resolve("snap"));
        var store = new DurableQueueStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()), clock);

        // ------ Admission -------
        var ceilings = cfg.ceilingsPath() == null
                ? new CeilingRegistry()
                : CeilingRegistry.fromJsonFile(Path.of(cfg.ceilingsPath()));
        var tracker = RunningJobTracker.restoredFrom(store);
        var admission = new AdmissionController(store, ceilings, tracker, clock);

        // ------ Read paths + maintenance -------
        var positions = new PositionCalculator(store);
        var summary = new QueueSummary(store, clock);
        var reaper = new Reaper(store, clock, Duration.ofSeconds(cfg.reapIntervalSeconds()));
        var poller = new AdmissionPoller(store, admission, tracker, Duration.ofSeconds(cfg.pollIntervalSeconds()));

        var service = new QueueService(store, admission, positions, summary, reaper, tracker, clock,
                cfg.removeOnCancel());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), service, ceilings);

        web.start();
        reaper.start();
        poller.start();
        log.info(() -> String.format("admitq listening on http://localhost:%d (data=%s, entries=%d)",
                cfg.httpPort(), data.toAbsolutePath(), store.size()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("shutting down");
            poller.stop();
            reaper.stop();
            web.stop();
            store.close();
        }, "admitq-shutdown"));
    }

    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return; // explicit config wins
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
